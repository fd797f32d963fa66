package com.goormthonuniv.sitecheck.search;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.*;

/** Bing Web Search v7 (webPages.value) */
@Component
public class BingSearchAdapter implements SearchAdapter {

    private final RestClient rest;
    private final String endpoint;
    private final String apiKey;

    public BingSearchAdapter(RestClient rest,
                             @Value("${sitecheck.adapters.bing.endpoint:https://api.bing.microsoft.com/v7.0/search}") String endpoint,
                             @Value("${sitecheck.adapters.bing.apiKey:}") String apiKey) {
        this.rest = rest;
        this.endpoint = endpoint;
        this.apiKey = apiKey;
    }

    @Override public String name() { return "bing"; }

    @Override
    public boolean isEnabled() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public List<SearchResult> search(String query, int limit) {
        URI uri = URI.create(endpoint + "?q=" + URLEncoder.encode(query, StandardCharsets.UTF_8)
                + "&count=" + limit);

        Map<String, Object> res;
        try {
            res = rest.get().uri(uri)
                    .header("Ocp-Apim-Subscription-Key", apiKey)
                    .retrieve()
                    .body(new ParameterizedTypeReference<Map<String, Object>>() {});
        } catch (RestClientException e) {
            throw SearchFailures.classify(name(), e);
        }
        if (res == null || !(res.get("webPages") instanceof Map<?, ?> webPages)) return List.of();

        Object raw = webPages.get("value");
        List<?> value = (raw instanceof List<?> l) ? l : Collections.emptyList();

        List<SearchResult> out = new ArrayList<>();
        for (Object o : value) {
            if (!(o instanceof Map<?, ?> v)) continue;
            String name = Objects.toString(v.get("name"), "");
            String url  = Objects.toString(v.get("url"), "");
            String desc = Objects.toString(v.get("snippet"), "");
            out.add(new SearchResult(name(), name, url, desc));
        }
        return out;
    }
}
