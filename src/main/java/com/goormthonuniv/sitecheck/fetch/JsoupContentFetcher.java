package com.goormthonuniv.sitecheck.fetch;

import com.goormthonuniv.sitecheck.config.SiteCheckProperties;
import com.goormthonuniv.sitecheck.util.TextUtils;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Connection;
import org.jsoup.Jsoup;
import org.jsoup.UnsupportedMimeTypeException;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import javax.net.ssl.SSLException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.net.UnknownHostException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;

/**
 * jsoup으로 페이지를 받아 {@link FetchedContent}로 변환한다.
 * DNS/TLS/연결/타임아웃/4xx·5xx 는 모두 {@link FetchException}으로 올려 실행을 중단시킨다.
 */
@Slf4j
@Component
public class JsoupContentFetcher implements ContentFetcher {

    private final SiteCheckProperties.Fetch settings;
    private final ScreenshotRenderer screenshotRenderer;
    private final Clock clock;

    public JsoupContentFetcher(SiteCheckProperties properties, ScreenshotRenderer screenshotRenderer, Clock clock) {
        this.settings = properties.getFetch();
        this.screenshotRenderer = screenshotRenderer;
        this.clock = clock;
    }

    @Override
    public FetchedContent fetch(String url) throws FetchException {
        URI uri = parseHttpUri(url);

        long started = System.nanoTime();
        Connection.Response response;
        Document doc;
        try {
            response = Jsoup.connect(uri.toString())
                    .userAgent(settings.getUserAgent())
                    .header("Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8")
                    .header("Accept-Language", "en-US,en;q=0.9")
                    .header("Cache-Control", "no-cache")
                    .timeout((int) settings.getTimeout().toMillis())
                    .maxBodySize(settings.getMaxBodyBytes())
                    .followRedirects(true)
                    .ignoreHttpErrors(true)
                    .execute();

            if (response.statusCode() >= 400) {
                throw new FetchException(FetchFailure.HTTP_STATUS,
                        "HTTP " + response.statusCode() + " from " + url);
            }
            doc = response.parse();
        } catch (UnknownHostException e) {
            throw new FetchException(FetchFailure.DNS, "unknown host: " + uri.getHost(), e);
        } catch (SSLException e) {
            throw new FetchException(FetchFailure.TLS, "TLS handshake failed: " + e.getMessage(), e);
        } catch (SocketTimeoutException e) {
            throw new FetchException(FetchFailure.TIMEOUT, "timed out fetching " + url, e);
        } catch (ConnectException e) {
            throw new FetchException(FetchFailure.CONNECTION, "connection failed: " + e.getMessage(), e);
        } catch (UnsupportedMimeTypeException e) {
            throw new FetchException(FetchFailure.UNSUPPORTED_CONTENT, "not an HTML page: " + e.getMimeType(), e);
        } catch (IOException e) {
            throw new FetchException(FetchFailure.CONNECTION, "fetch failed: " + e.getMessage(), e);
        }
        long responseTimeMs = (System.nanoTime() - started) / 1_000_000L;

        String finalUrl = response.url() == null ? uri.toString() : response.url().toString();
        String screenshot = screenshotRenderer.render(finalUrl).orElse(null);
        log.debug("fetched url={} status={} bytes={} in {}ms screenshot={}",
                finalUrl, response.statusCode(), doc.outerHtml().length(), responseTimeMs, screenshot != null);

        return fromDocument(url, finalUrl, doc, response.statusCode(), responseTimeMs, screenshot,
                settings.getMaxLinks(), clock.instant());
    }

    /** 네트워크 없이 파싱된 문서에서 스냅샷을 만든다 */
    static FetchedContent fromDocument(String requestedUrl, String finalUrl, Document doc, int statusCode,
                                       long responseTimeMs, String screenshotRef, int maxLinks, Instant fetchedAt) {
        String metaDescription = attrOrNull(doc.selectFirst("meta[name=description]"), "content");
        String keywords = attrOrNull(doc.selectFirst("meta[name=keywords]"), "content");
        List<String> metaKeywords = keywords == null
                ? List.of()
                : Arrays.stream(keywords.split(",")).map(String::strip).filter(s -> !s.isEmpty()).toList();

        LinkedHashSet<String> links = new LinkedHashSet<>();
        for (Element a : doc.select("a[href]")) {
            String abs = a.absUrl("href");
            if (abs.isEmpty()) continue;
            String lower = abs.toLowerCase(Locale.ROOT);
            if (!lower.startsWith("http://") && !lower.startsWith("https://")) continue;
            links.add(abs);
            if (links.size() >= maxLinks) break;
        }

        List<PageForm> forms = new ArrayList<>();
        for (Element form : doc.select("form")) {
            List<PageForm.Field> fields = new ArrayList<>();
            for (Element input : form.select("input")) {
                String type = input.attr("type");
                fields.add(new PageForm.Field(
                        type.isBlank() ? "text" : type.toLowerCase(Locale.ROOT),
                        input.attr("name"),
                        input.attr("placeholder")));
            }
            String method = form.attr("method");
            forms.add(new PageForm(form.attr("action"), method.isBlank() ? "get" : method.toLowerCase(Locale.ROOT), fields));
        }

        String text = doc.body() == null ? "" : TextUtils.collapseWhitespace(doc.body().text());
        String title = doc.title().isBlank() ? null : doc.title().strip();

        return new FetchedContent(
                requestedUrl,
                finalUrl,
                doc.outerHtml(),
                text,
                title,
                metaDescription,
                metaKeywords,
                List.copyOf(links),
                forms,
                screenshotRef,
                DomainMetadata.from(URI.create(finalUrl)),
                statusCode,
                responseTimeMs,
                fetchedAt
        );
    }

    private static URI parseHttpUri(String url) throws FetchException {
        try {
            URI uri = new URI(url == null ? "" : url.strip());
            String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
            if ((!scheme.equals("http") && !scheme.equals("https")) || uri.getHost() == null) {
                throw new FetchException(FetchFailure.INVALID_URL, "not an absolute http(s) url: " + url);
            }
            return uri;
        } catch (java.net.URISyntaxException e) {
            throw new FetchException(FetchFailure.INVALID_URL, "malformed url: " + url, e);
        }
    }

    private static String attrOrNull(Element el, String attr) {
        if (el == null) return null;
        String v = el.attr(attr).strip();
        return v.isEmpty() ? null : v;
    }
}
