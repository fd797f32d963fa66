package com.goormthonuniv.sitecheck.config;

import io.swagger.v3.oas.models.ExternalDocumentation;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.*;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {
    @Bean
    public OpenAPI openAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("SiteCheck Risk API")
                        .description("URL 피싱/사기 사이트 위험도 평가 API. 콘텐츠, 화면, 도메인 평판 분석을 가중 결합한다.")
                        .version("v0.1.0")
                        .contact(new Contact().name("SiteCheck")))
                .tags(List.of(
                        new Tag().name("check").description("위험도 평가 / 진단"),
                        new Tag().name("health").description("상태 확인")))
                .externalDocs(new ExternalDocumentation().description("Swagger UI").url("/swagger-ui.html"));
    }
}
