package com.goormthonuniv.sitecheck.engine;

/**
 * PENDING → FETCHING → ANALYZING → AGGREGATING → DONE.
 * FAILED 는 FETCHING(콘텐츠 획득 실패)과 AGGREGATING(사용 가능한 분석기 0개)에서만 진입한다.
 */
public enum PipelineState {
    PENDING,
    FETCHING,
    ANALYZING,
    AGGREGATING,
    DONE,
    FAILED;

    public boolean canTransitionTo(PipelineState next) {
        return switch (this) {
            case PENDING -> next == FETCHING;
            case FETCHING -> next == ANALYZING || next == FAILED;
            case ANALYZING -> next == AGGREGATING;
            case AGGREGATING -> next == DONE || next == FAILED;
            case DONE, FAILED -> false;
        };
    }

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }
}
