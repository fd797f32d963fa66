package com.goormthonuniv.sitecheck.fetch;

import java.net.URI;
import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * URL에서 바로 얻을 수 있는 도메인 정보.
 * registrableDomain은 흔한 2단계 공용 접미사(co.kr, co.uk 등)만 고려한 근사치다.
 */
public record DomainMetadata(
        String host,
        String registrableDomain,
        String tld,
        String scheme,
        boolean https,
        boolean ipLiteral,
        boolean punycode,
        int subdomainDepth
) {
    private static final Pattern IPV4 = Pattern.compile("^\\d{1,3}(\\.\\d{1,3}){3}$");
    private static final Set<String> SECOND_LEVEL_SUFFIXES = Set.of(
            "co.kr", "or.kr", "go.kr", "ac.kr", "ne.kr",
            "co.uk", "org.uk", "ac.uk",
            "com.au", "net.au", "org.au",
            "co.jp", "ne.jp", "or.jp",
            "com.br", "com.cn", "com.tr", "co.in"
    );

    public static DomainMetadata from(URI uri) {
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        String host = uri.getHost() == null ? "" : uri.getHost().toLowerCase(Locale.ROOT);
        if (host.startsWith("[") || host.contains(":") || IPV4.matcher(host).matches()) {
            return new DomainMetadata(host, host, "", scheme, "https".equals(scheme), true, false, 0);
        }

        String[] labels = host.split("\\.");
        int registrableLabels = 2;
        if (labels.length >= 3) {
            String lastTwo = labels[labels.length - 2] + "." + labels[labels.length - 1];
            if (SECOND_LEVEL_SUFFIXES.contains(lastTwo)) registrableLabels = 3;
        }
        registrableLabels = Math.min(registrableLabels, labels.length);
        String registrable = String.join(".",
                Arrays.copyOfRange(labels, labels.length - registrableLabels, labels.length));
        String tld = labels.length > 0 ? labels[labels.length - 1] : "";

        // www. 는 서브도메인 깊이에 넣지 않음
        int depth = labels.length - registrableLabels;
        if (depth > 0 && "www".equals(labels[0])) depth--;

        boolean punycode = Arrays.stream(labels).anyMatch(l -> l.startsWith("xn--"));
        return new DomainMetadata(host, registrable, tld, scheme, "https".equals(scheme), false, punycode, depth);
    }
}
