package com.goormthonuniv.sitecheck.analyzer.reputation;

import com.goormthonuniv.sitecheck.fetch.DomainMetadata;
import org.apache.commons.text.similarity.LevenshteinDistance;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * 검색 없이 도메인 자체에서 읽히는 위험 신호를 점수화하는 정책 클래스.
 * - 신뢰 도메인: 정확 매핑(exact)과 서픽스 매핑(suffix) 모두 지원, 가장 긴 서픽스 우선
 * - 위험 신호: IP 호스트, 의심 TLD, punycode, 깊은 서브도메인, 하이픈 남용, 브랜드 토큰 도용, 유사 철자(typosquatting)
 *
 * 점수 범위: 0.0 ~ 10.0
 * - 0.5: 알려진 신뢰 도메인
 * - 2.0: 기본치(정보 없음)
 * - 신호마다 가산, 10에서 절단
 */
@Component
public class DomainRiskPolicy {

    static final double TRUSTED_SCORE = 0.5;
    static final double BASELINE_SCORE = 2.0;
    private static final int MAX_LOOKALIKE_DISTANCE = 2;

    /** 신뢰 호스트 정확 매핑 */
    private final Set<String> trustedExact = new HashSet<>();

    /** 신뢰 서픽스 : ".paypal.com" 형태로 관리 */
    private final Set<String> trustedSuffixes = new HashSet<>();

    /** 사칭 대상이 되기 쉬운 브랜드 → 공식 등록 도메인 */
    private final Map<String, String> brandDomains = new LinkedHashMap<>();

    private final Set<String> suspiciousTlds = Set.of(
            "tk", "ml", "ga", "cf", "gq", "xyz", "top", "zip", "mov", "click", "country",
            "work", "rest", "support", "fit", "loan", "icu", "buzz", "cam"
    );

    private final LevenshteinDistance levenshtein = new LevenshteinDistance(MAX_LOOKALIKE_DISTANCE + 1);

    public DomainRiskPolicy() {
        // ===== 자주 사칭되는 브랜드 =====
        putBrand("paypal", "paypal.com");
        putBrand("apple", "apple.com");
        putBrand("icloud", "icloud.com");
        putBrand("microsoft", "microsoft.com");
        putBrand("office365", "office.com");
        putBrand("outlook", "outlook.com");
        putBrand("google", "google.com");
        putBrand("amazon", "amazon.com");
        putBrand("netflix", "netflix.com");
        putBrand("facebook", "facebook.com");
        putBrand("instagram", "instagram.com");
        putBrand("linkedin", "linkedin.com");
        putBrand("dropbox", "dropbox.com");
        putBrand("docusign", "docusign.com");
        putBrand("chase", "chase.com");
        putBrand("wellsfargo", "wellsfargo.com");
        putBrand("coinbase", "coinbase.com");
        putBrand("binance", "binance.com");
        putBrand("naver", "naver.com");
        putBrand("kakao", "kakao.com");
        putBrand("tosspayments", "tosspayments.com");

        // ===== 기타 신뢰 도메인(브랜드 토큰 검사 대상 아님) =====
        putTrusted("github.com");
        putTrusted("wikipedia.org");
        putTrusted("daum.net");
        putTrusted("gov.kr");
        putTrusted("go.kr");
    }

    public record Assessment(
            double score,
            boolean trusted,
            List<String> signals,
            String lookalikeOf     // 유사 철자로 의심되는 공식 도메인, 없으면 null
    ) {
        public Assessment {
            signals = List.copyOf(signals);
        }
    }

    public Assessment assess(DomainMetadata domain) {
        String host = domain.host();
        if (isTrusted(host)) {
            return new Assessment(TRUSTED_SCORE, true, List.of("trusted domain"), null);
        }

        double score = BASELINE_SCORE;
        List<String> signals = new ArrayList<>();

        if (domain.ipLiteral()) {
            score += 3.0;
            signals.add("host is a bare IP address");
        }
        if (suspiciousTlds.contains(domain.tld())) {
            score += 2.0;
            signals.add("high-abuse TLD ." + domain.tld());
        }
        if (domain.punycode()) {
            score += 2.0;
            signals.add("punycode (possible homograph) host");
        }
        if (domain.subdomainDepth() >= 3) {
            score += 1.0;
            signals.add("deep subdomain nesting (" + domain.subdomainDepth() + ")");
        }
        long hyphens = host.chars().filter(c -> c == '-').count();
        if (hyphens >= 2) {
            score += 1.0;
            signals.add("hyphen-heavy host");
        }
        if (!domain.https()) {
            score += 1.0;
            signals.add("served without HTTPS");
        }

        String brandInHost = brandTokenIn(host);
        if (brandInHost != null) {
            score += 3.0;
            signals.add("brand name '" + brandInHost + "' used outside " + brandDomains.get(brandInHost));
        }

        String lookalike = domain.ipLiteral() ? null : lookalikeOf(domain.registrableDomain());
        if (lookalike != null) {
            score += 3.0;
            signals.add("look-alike of " + lookalike);
        }

        return new Assessment(Math.min(score, 10.0), false, signals, lookalike);
    }

    public boolean isTrusted(String host) {
        if (host == null || host.isBlank()) return false;
        String h = host.toLowerCase(Locale.ROOT);
        if (trustedExact.contains(h)) return true;
        for (String sfx : trustedSuffixes) {
            if (h.endsWith(sfx)) return true;
        }
        return false;
    }

    /** 공식 도메인이 아닌데 호스트 라벨에 브랜드 토큰이 들어있는지 */
    private String brandTokenIn(String host) {
        for (String token : host.split("[.\\-]")) {
            for (String brand : brandDomains.keySet()) {
                if (token.startsWith(brand)) return brand;
            }
        }
        return null;
    }

    /** 등록 도메인의 첫 라벨이 브랜드 도메인 첫 라벨과 편집거리 1~2 */
    private String lookalikeOf(String registrable) {
        if (registrable == null || registrable.isBlank()) return null;
        String label = registrable.split("\\.")[0];
        for (String official : brandDomains.values()) {
            String officialLabel = official.split("\\.")[0];
            if (label.equals(officialLabel)) continue;
            if (Math.abs(label.length() - officialLabel.length()) > MAX_LOOKALIKE_DISTANCE) continue;
            int d = levenshtein.apply(label, officialLabel);
            if (d > 0 && d <= MAX_LOOKALIKE_DISTANCE && officialLabel.length() > 4) {
                return official;
            }
        }
        return null;
    }

    // ------------------------ 내부 유틸 ------------------------

    private void putBrand(String token, String officialDomain) {
        brandDomains.put(token, officialDomain);
        putTrusted(officialDomain);
    }

    private void putTrusted(String domain) {
        String d = domain.toLowerCase(Locale.ROOT);
        trustedExact.add(d);
        trustedSuffixes.add("." + d);
    }
}
