package com.delta.extractor.artifact;

import com.delta.extractor.config.ExtractorProperties;
import com.delta.extractor.error.ExtractionFailureException;
import com.delta.extractor.model.ExtractedFields;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Pulls the versioned script reference out of the source document and the typed fields
 * out of the script body. Every field is "first matching pattern, or absent".
 */
@Component
public class ArtifactFieldExtractor {
    private static final Logger log = LoggerFactory.getLogger(ArtifactFieldExtractor.class);

    private final String baseUrl;
    private final String defaultSignatureTimestamp;
    private final List<Pattern> referencePatterns;
    private final Pattern referenceScriptSrcPattern;
    private final List<Pattern> signatureTimestampPatterns;
    private final List<Pattern> decipherPatterns;
    private final List<Pattern> throttlePatterns;

    public ArtifactFieldExtractor(ExtractorProperties properties) {
        ExtractorProperties.Artifact artifact = properties.getArtifact();
        this.baseUrl = stripTrailingSlash(artifact.getBaseUrl());
        this.defaultSignatureTimestamp = artifact.getDefaultSignatureTimestamp();
        this.referencePatterns = compileAll(artifact.getReferencePatterns());
        this.referenceScriptSrcPattern = compileAll(Collections.singletonList(artifact.getReferenceScriptSrcPattern()))
            .stream()
            .findFirst()
            .orElse(null);
        this.signatureTimestampPatterns = compileAll(artifact.getSignatureTimestampPatterns());
        this.decipherPatterns = compileAll(artifact.getDecipherPatterns());
        this.throttlePatterns = compileAll(artifact.getThrottlePatterns());
    }

    /**
     * Absolute URL of the versioned script referenced by {@code document}. Tries the inline
     * config patterns first, then {@code <script src>} elements.
     */
    public Optional<String> extractReferenceUrl(String document) {
        if (document == null || document.isBlank()) {
            return Optional.empty();
        }
        Optional<String> inline = firstGroup(document, referencePatterns);
        if (inline.isPresent()) {
            return Optional.of(absolutize(inline.get().replace("\\/", "/")));
        }
        if (referenceScriptSrcPattern == null) {
            return Optional.empty();
        }
        Document html = Jsoup.parse(document, baseUrl + "/");
        for (Element script : html.select("script[src]")) {
            String src = script.attr("src");
            if (referenceScriptSrcPattern.matcher(src).find()) {
                String absolute = script.absUrl("src");
                return Optional.of(absolute.isBlank() ? absolutize(src) : absolute);
            }
        }
        return Optional.empty();
    }

    /**
     * Typed fields of a script body. A missing signature timestamp is a hard failure: the
     * configured default is only logged, never returned.
     */
    public ExtractedFields extractFields(String scriptBody) {
        if (scriptBody == null || scriptBody.isBlank()) {
            throw new ExtractionFailureException("body", "Script body is empty");
        }
        Optional<String> signatureTimestamp = firstGroup(scriptBody, signatureTimestampPatterns);
        if (signatureTimestamp.isEmpty()) {
            log.warn(
                "Signature timestamp not found in script; refusing to fall back to default {}",
                defaultSignatureTimestamp
            );
            throw new ExtractionFailureException("signatureTimestamp", "Failed to extract signature timestamp");
        }
        return new ExtractedFields(
            signatureTimestamp.get(),
            extractDecipherFunction(scriptBody),
            extractThrottleFunction(scriptBody)
        );
    }

    Optional<String> extractDecipherFunction(String scriptBody) {
        for (Pattern pattern : decipherPatterns) {
            Matcher matcher = pattern.matcher(scriptBody);
            if (!matcher.find() || matcher.groupCount() < 1) {
                continue;
            }
            String name = matcher.group(1);
            Pattern definition = Pattern.compile(
                Pattern.quote(name) + "=function\\([^)]*\\)\\{[^}]+\\}",
                Pattern.DOTALL
            );
            Matcher body = definition.matcher(scriptBody);
            if (body.find()) {
                return Optional.of(body.group());
            }
        }
        return Optional.empty();
    }

    Optional<String> extractThrottleFunction(String scriptBody) {
        return firstGroup(scriptBody, throttlePatterns);
    }

    private Optional<String> firstGroup(String text, List<Pattern> patterns) {
        for (Pattern pattern : patterns) {
            Matcher matcher = pattern.matcher(text);
            if (matcher.find()) {
                String value = matcher.groupCount() >= 1 ? matcher.group(1) : matcher.group();
                if (value != null && !value.isBlank()) {
                    return Optional.of(value);
                }
            }
        }
        return Optional.empty();
    }

    private String absolutize(String reference) {
        if (reference.startsWith("http://") || reference.startsWith("https://")) {
            return reference;
        }
        if (reference.startsWith("//")) {
            return "https:" + reference;
        }
        return baseUrl + (reference.startsWith("/") ? reference : "/" + reference);
    }

    private static List<Pattern> compileAll(List<String> expressions) {
        List<Pattern> compiled = new ArrayList<>();
        if (expressions == null) {
            return compiled;
        }
        for (String expression : expressions) {
            if (expression == null || expression.isBlank()) {
                continue;
            }
            try {
                compiled.add(Pattern.compile(expression));
            } catch (PatternSyntaxException e) {
                log.warn("Ignoring invalid extraction pattern {}: {}", expression, e.getDescription());
            }
        }
        return compiled;
    }

    private static String stripTrailingSlash(String value) {
        if (value == null) {
            return "";
        }
        String trimmed = value.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
