package com.goormthonuniv.sitecheck.fetch;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;

import static org.assertj.core.api.Assertions.assertThat;

class DomainMetadataTest {

    private static DomainMetadata of(String url) {
        return DomainMetadata.from(URI.create(url));
    }

    @Test
    @DisplayName("일반 도메인: 등록 도메인, TLD, 서브도메인 깊이")
    void plainDomain() {
        DomainMetadata d = of("https://login.secure.Example.com/path");

        assertThat(d.host()).isEqualTo("login.secure.example.com");
        assertThat(d.registrableDomain()).isEqualTo("example.com");
        assertThat(d.tld()).isEqualTo("com");
        assertThat(d.subdomainDepth()).isEqualTo(2);
        assertThat(d.https()).isTrue();
        assertThat(d.ipLiteral()).isFalse();
    }

    @Test
    @DisplayName("www 는 깊이에 넣지 않는다")
    void wwwNotCounted() {
        assertThat(of("http://www.example.com").subdomainDepth()).isZero();
        assertThat(of("http://www.example.com").https()).isFalse();
    }

    @Test
    @DisplayName("2단계 공용 접미사")
    void secondLevelSuffix() {
        DomainMetadata d = of("https://shop.naver.co.kr");

        assertThat(d.registrableDomain()).isEqualTo("naver.co.kr");
        assertThat(d.tld()).isEqualTo("kr");
        assertThat(d.subdomainDepth()).isEqualTo(1);
    }

    @Test
    @DisplayName("IP 주소와 punycode")
    void ipAndPunycode() {
        assertThat(of("http://10.0.0.1:8080/a").ipLiteral()).isTrue();
        assertThat(of("http://[::1]/a").ipLiteral()).isTrue();
        assertThat(of("https://xn--pple-43d.com").punycode()).isTrue();
    }
}
