package com.goormthonuniv.sitecheck.analyzer.content;

import com.goormthonuniv.sitecheck.fetch.FetchedContent;
import com.goormthonuniv.sitecheck.fetch.PageForm;
import com.goormthonuniv.sitecheck.util.TextUtils;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** 페이지에서 바로 읽히는 보안 신호 */
public record SecurityFlags(
        boolean hasHttps,
        boolean hasSuspiciousKeywords,
        boolean hasLoginForms,
        boolean hasPaymentForms
) {
    static final List<String> SUSPICIOUS_KEYWORDS = List.of(
            "urgent", "verify", "suspended", "limited time", "act now",
            "confirm", "update", "security alert", "locked", "expires"
    );
    private static final Set<String> PAYMENT_FIELD_TYPES = Set.of("email", "text", "password", "tel");

    public static SecurityFlags of(FetchedContent content) {
        boolean https = content.domainMetadata().https();
        boolean keywords = !TextUtils.findKeywords(content.text(), SUSPICIOUS_KEYWORDS).isEmpty();
        boolean login = content.forms().stream().anyMatch(f -> f.hasFieldType("password"));
        // 개인정보/결제류 입력 칸이 3개 이상인 폼
        boolean payment = content.forms().stream().anyMatch(SecurityFlags::looksLikePaymentForm);
        return new SecurityFlags(https, keywords, login, payment);
    }

    private static boolean looksLikePaymentForm(PageForm form) {
        return form.fields().stream().filter(f -> PAYMENT_FIELD_TYPES.contains(f.type())).count() > 2;
    }

    public Map<String, Object> toFindings() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("has_https", hasHttps);
        m.put("has_suspicious_keywords", hasSuspiciousKeywords);
        m.put("has_login_forms", hasLoginForms);
        m.put("has_payment_forms", hasPaymentForms);
        return m;
    }
}
