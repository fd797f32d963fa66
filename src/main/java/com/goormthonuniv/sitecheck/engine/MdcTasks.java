package com.goormthonuniv.sitecheck.engine;

import org.slf4j.MDC;

import java.util.Map;
import java.util.concurrent.Callable;

/** 호출 스레드의 MDC(runId 등)를 워커 스레드로 복사한다 */
final class MdcTasks {

    private MdcTasks() {}

    static <T> Callable<T> wrap(Callable<T> task) {
        Map<String, String> parentMdc = MDC.getCopyOfContextMap();
        return () -> {
            if (parentMdc != null) {
                MDC.setContextMap(parentMdc);
            }
            try {
                return task.call();
            } finally {
                MDC.clear(); // 풀 스레드 재사용 시 누수 방지
            }
        };
    }
}
