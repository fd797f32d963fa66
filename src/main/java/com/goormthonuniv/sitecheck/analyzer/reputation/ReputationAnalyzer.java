package com.goormthonuniv.sitecheck.analyzer.reputation;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.goormthonuniv.sitecheck.analyzer.AnalyzerAdapter;
import com.goormthonuniv.sitecheck.analyzer.AnalyzerException;
import com.goormthonuniv.sitecheck.analyzer.AnalyzerResult;
import com.goormthonuniv.sitecheck.analyzer.AnalyzerSource;
import com.goormthonuniv.sitecheck.analyzer.TransientAnalyzerException;
import com.goormthonuniv.sitecheck.config.SiteCheckProperties;
import com.goormthonuniv.sitecheck.fetch.DomainMetadata;
import com.goormthonuniv.sitecheck.fetch.FetchedContent;
import com.goormthonuniv.sitecheck.search.SearchAdapter;
import com.goormthonuniv.sitecheck.search.SearchResult;
import com.goormthonuniv.sitecheck.util.TextUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * 도메인 평판: 정적 도메인 정책 + 웹 검색상의 사기/피싱 언급.
 * 검색 결과는 등록 도메인 단위로 캐시한다(성공한 조회만).
 */
@Slf4j
@Component
public class ReputationAnalyzer implements AnalyzerAdapter {

    private static final List<String> SCAM_WORDS = List.of(
            "scam", "phishing", "fraud", "fake", "malicious", "malware", "사기", "피싱");
    private static final double MAX_SEARCH_BOOST = 4.0;

    // ===== 의존성 =====
    private final List<SearchAdapter> adapters;
    private final DomainRiskPolicy policy;
    private final int searchLimit;

    // ===== 캐시 =====
    private final Cache<String, List<SearchResult>> searchCache;

    public ReputationAnalyzer(List<SearchAdapter> adapters, DomainRiskPolicy policy, SiteCheckProperties properties) {
        this.adapters = adapters;
        this.policy = policy;
        SiteCheckProperties.Reputation settings = properties.getReputation();
        this.searchLimit = settings.getSearchLimit();
        this.searchCache = Caffeine.newBuilder()
                .expireAfterWrite(settings.getCacheTtl())
                .maximumSize(settings.getCacheMaxSize())
                .build();
    }

    @Override
    public AnalyzerSource source() {
        return AnalyzerSource.REPUTATION;
    }

    @Override
    public AnalyzerResult evaluate(FetchedContent content) {
        DomainMetadata domain = content.domainMetadata();
        DomainRiskPolicy.Assessment assessment = policy.assess(domain);
        SearchEvidence evidence = assessment.trusted()
                ? SearchEvidence.notQueried()
                : searchEvidence(domain.registrableDomain());

        boolean policyHasSignal = assessment.trusted() || !assessment.signals().isEmpty();
        if (evidence.allFailedTransiently() && !policyHasSignal) {
            // 근거가 전혀 없으니 Supervisor 재시도에 맡긴다
            throw new TransientAnalyzerException("all search adapters failed: " + String.join("; ", evidence.errors()));
        }

        double boost = Math.min(MAX_SEARCH_BOOST, evidence.scamMentions() * 1.0);
        double score = TextUtils.clamp(assessment.score() + boost, 0.0, 10.0);

        double confidence = 0.5 + Math.min(0.2, 0.05 * assessment.signals().size());
        if (assessment.trusted()) confidence = 0.85;
        if (evidence.queried()) confidence += 0.2;
        confidence = TextUtils.clamp(confidence, 0.0, 0.9);

        Map<String, Object> search = new LinkedHashMap<>();
        search.put("queried", evidence.queried());
        search.put("cached", evidence.cached());
        search.put("hits", evidence.results().size());
        search.put("scam_mentions", evidence.scamMentions());
        search.put("errors", evidence.errors());
        search.put("top_results", evidence.results().stream()
                .limit(3)
                .map(r -> Map.of(
                        "title", Objects.toString(r.title(), ""),
                        "url", Objects.toString(r.url(), ""),
                        "source", Objects.toString(r.source(), "")))
                .toList());

        Map<String, Object> findings = new LinkedHashMap<>();
        findings.put("domain", domain.registrableDomain());
        findings.put("host", domain.host());
        findings.put("trusted", assessment.trusted());
        findings.put("signals", assessment.signals());
        findings.put("lookalike_of", assessment.lookalikeOf());
        findings.put("search", search);
        return new AnalyzerResult(score, confidence, findings);
    }

    private SearchEvidence searchEvidence(String registrableDomain) {
        List<SearchResult> cached = searchCache.getIfPresent(registrableDomain);
        if (cached != null) {
            return SearchEvidence.of(cached, true, List.of(), false);
        }

        List<SearchAdapter> enabled = adapters.stream().filter(SearchAdapter::isEnabled).toList();
        if (enabled.isEmpty()) {
            return SearchEvidence.notQueried();
        }

        String query = "\"" + registrableDomain + "\" phishing OR scam OR fraud";
        Map<String, SearchResult> dedup = new LinkedHashMap<>();
        List<String> errors = new ArrayList<>();
        int transientFailures = 0;
        for (SearchAdapter a : enabled) {
            try {
                for (SearchResult r : a.search(query, searchLimit)) {
                    dedup.putIfAbsent(r.url(), r);
                }
            } catch (AnalyzerException e) {
                log.warn("reputation search adapter={} failed: {}", a.name(), e.getMessage());
                errors.add(a.name() + ": " + e.getMessage());
                if (e.isTransient()) transientFailures++;
            }
        }

        boolean anySucceeded = errors.size() < enabled.size();
        List<SearchResult> results = List.copyOf(dedup.values());
        if (anySucceeded) {
            searchCache.put(registrableDomain, results);
        }
        return SearchEvidence.of(results, false, errors, !anySucceeded && transientFailures == enabled.size())
                .withQueried(anySucceeded);
    }

    record SearchEvidence(
            boolean queried,
            boolean cached,
            List<SearchResult> results,
            int scamMentions,
            List<String> errors,
            boolean allFailedTransiently
    ) {
        static SearchEvidence notQueried() {
            return new SearchEvidence(false, false, List.of(), 0, List.of(), false);
        }

        static SearchEvidence of(List<SearchResult> results, boolean cached, List<String> errors, boolean allFailedTransiently) {
            int mentions = (int) results.stream()
                    .filter(r -> !TextUtils.findKeywords(r.title() + " " + r.snippet(), SCAM_WORDS).isEmpty())
                    .count();
            return new SearchEvidence(true, cached, results, mentions, List.copyOf(errors), allFailedTransiently);
        }

        SearchEvidence withQueried(boolean q) {
            return new SearchEvidence(q, cached, results, scamMentions, errors, allFailedTransiently);
        }
    }
}
