package com.goormthonuniv.sitecheck.analyzer.visual;

import com.goormthonuniv.sitecheck.analyzer.AnalyzerAdapter;
import com.goormthonuniv.sitecheck.analyzer.AnalyzerResult;
import com.goormthonuniv.sitecheck.analyzer.AnalyzerSource;
import com.goormthonuniv.sitecheck.analyzer.PermanentAnalyzerException;
import com.goormthonuniv.sitecheck.fetch.FetchedContent;
import com.goormthonuniv.sitecheck.llm.LlmResponseParser;
import com.goormthonuniv.sitecheck.llm.OpenAiClient;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

import static com.goormthonuniv.sitecheck.llm.LlmResponseParser.number;
import static com.goormthonuniv.sitecheck.llm.LlmResponseParser.strings;
import static com.goormthonuniv.sitecheck.llm.LlmResponseParser.text;

/** 스크린샷을 비전 모델에 보내 브랜드 사칭/로그인 화면 모방 여부를 본다 */
@Component
@RequiredArgsConstructor
public class VisualAnalyzer implements AnalyzerAdapter {

    private final OpenAiClient openAi;
    private final LlmResponseParser parser;

    @Override
    public AnalyzerSource source() {
        return AnalyzerSource.VISUAL;
    }

    @Override
    public AnalyzerResult evaluate(FetchedContent content) {
        if (!content.hasScreenshot()) {
            throw new PermanentAnalyzerException("no screenshot available");
        }
        if (!openAi.isConfigured()) {
            throw new PermanentAnalyzerException("vision model not configured");
        }

        byte[] png;
        try {
            png = Files.readAllBytes(Path.of(content.screenshotRef()));
        } catch (IOException e) {
            throw new PermanentAnalyzerException("cannot read screenshot " + content.screenshotRef(), e);
        }

        String user = "URL: " + content.finalUrl() + "\nPage title: " + (content.title() == null ? "" : content.title());
        String reply = openAi.completeWithImage(Prompt.SYSTEM, user,
                "data:image/png;base64," + Base64.getEncoder().encodeToString(png));

        Map<String, Object> verdict = parser.parse(reply);
        Map<String, Object> findings = new LinkedHashMap<>();
        findings.put("impersonated_brand", text(verdict, "impersonated_brand"));
        findings.put("visual_indicators", strings(verdict, "visual_indicators"));
        findings.put("explanation", text(verdict, "explanation"));
        findings.put("screenshot", content.screenshotRef());
        findings.put("model_output_parsed", verdict.get("parsed"));

        return new AnalyzerResult(
                number(verdict, "risk_score", 5.0),
                number(verdict, "confidence", 0.5),
                findings);
    }

    static class Prompt {
        static final String SYSTEM = """
        You review screenshots of web pages for phishing.
        Look for imitation of well-known brand logos and layouts, fake login or payment screens,
        urgency banners, and visual quality problems typical of cloned pages.
        Compare what the page looks like with the URL it is served from.

        Reply with JSON only:
        {
          "risk_score": <float 0-10>,
          "confidence": <float 0-1>,
          "impersonated_brand": "<brand>" or null,
          "visual_indicators": ["..."],
          "explanation": "..."
        }
        """;
    }
}
