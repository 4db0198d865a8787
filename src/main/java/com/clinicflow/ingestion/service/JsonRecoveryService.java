package com.clinicflow.ingestion.service;

import com.clinicflow.ingestion.exception.JsonRecoveryException;
import com.clinicflow.ingestion.model.ProviderEnvelope;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls the diagnosis JSON object out of provider text, repairing truncated documents where possible.
 * Every failure surfaces as {@link JsonRecoveryException}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JsonRecoveryService {

    static final int SNIPPET_LENGTH = 240;

    private static final Pattern JSON_FENCE = Pattern.compile("```json\\s*(.*?)(?:```|\\z)",
            Pattern.DOTALL | Pattern.CASE_INSENSITIVE);
    private static final Pattern ANY_FENCE = Pattern.compile("```[\\w-]*\\s*(\\{.*?)```", Pattern.DOTALL);
    private static final Pattern DANGLING_FENCE = Pattern.compile("\\s*```\\s*$");

    private final ObjectMapper objectMapper;

    /**
     * Resolves an envelope to the diagnosis object it carries.
     */
    public ObjectNode resolve(ProviderEnvelope envelope) {
        return switch (envelope.shape()) {
            case DIAGNOSIS_OBJECT -> envelope.diagnosis();
            case EMBEDDED_TEXT -> recover(envelope.text());
        };
    }

    public ObjectNode recover(@Nullable String text) {
        if (!StringUtils.hasText(text)) {
            throw new JsonRecoveryException("Provider text is empty", "");
        }
        try {
            return doRecover(text);
        } catch (JsonRecoveryException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new JsonRecoveryException("Unexpected failure while recovering provider JSON",
                    truncate(text, SNIPPET_LENGTH), ex);
        }
    }

    private ObjectNode doRecover(String text) {
        List<String> candidates = extractCandidates(text);
        if (candidates.isEmpty()) {
            log.warn("No JSON object found in provider text. Snippet: {}", truncate(text, SNIPPET_LENGTH));
            throw new JsonRecoveryException("No JSON object found in provider text", truncate(text, SNIPPET_LENGTH));
        }
        JsonRecoveryException firstFailure = null;
        for (String candidate : candidates) {
            try {
                return recoverCandidate(candidate);
            } catch (JsonRecoveryException ex) {
                if (firstFailure == null) {
                    firstFailure = ex;
                } else {
                    firstFailure.addSuppressed(ex);
                }
            }
        }
        throw firstFailure;
    }

    private ObjectNode recoverCandidate(String candidate) {
        JsonProcessingException firstFailure;
        try {
            return parseObject(candidate);
        } catch (JsonProcessingException ex) {
            firstFailure = ex;
        }
        if (!TruncatedJsonRepairer.isUnbalanced(candidate)) {
            log.warn("Provider JSON is malformed. Snippet: {}", truncate(candidate, SNIPPET_LENGTH));
            throw new JsonRecoveryException("Provider JSON is malformed: " + firstFailure.getOriginalMessage(),
                    truncate(candidate, SNIPPET_LENGTH), firstFailure);
        }
        String repaired = TruncatedJsonRepairer.repair(candidate);
        if (repaired == null) {
            throw new JsonRecoveryException("Truncated provider JSON could not be repaired",
                    truncate(candidate, SNIPPET_LENGTH), firstFailure);
        }
        try {
            ObjectNode node = parseObject(repaired);
            log.info("Repaired truncated provider JSON ({} -> {} chars).", candidate.length(), repaired.length());
            return node;
        } catch (JsonProcessingException ex) {
            log.warn("Repaired provider JSON still does not parse. Snippet: {}", truncate(repaired, SNIPPET_LENGTH));
            throw new JsonRecoveryException("Truncated provider JSON could not be repaired",
                    truncate(candidate, SNIPPET_LENGTH), ex);
        }
    }

    /**
     * Candidates in the order they are tried: the fenced {@code json} block (running to the end of the
     * text when its closing fence was cut off), then any fenced block holding an object, then every
     * top-level brace object in the text from left to right, each taken at its widest.
     */
    List<String> extractCandidates(String text) {
        Set<String> candidates = new LinkedHashSet<>();
        Matcher jsonFence = JSON_FENCE.matcher(text);
        if (jsonFence.find()) {
            addIfPresent(candidates, braceCandidate(jsonFence.group(1)));
        }
        Matcher anyFence = ANY_FENCE.matcher(text);
        if (anyFence.find()) {
            addIfPresent(candidates, braceCandidate(anyFence.group(1)));
        }
        int from = 0;
        while (from < text.length()) {
            int start = text.indexOf('{', from);
            if (start < 0) {
                break;
            }
            int end = closingBrace(text, start);
            addIfPresent(candidates, candidateAt(text, start, end));
            from = end < 0 ? text.length() : end + 1;
        }
        return new ArrayList<>(candidates);
    }

    private static void addIfPresent(Set<String> candidates, @Nullable String candidate) {
        if (StringUtils.hasText(candidate)) {
            candidates.add(candidate);
        }
    }

    private static @Nullable String braceCandidate(String text) {
        int start = text.indexOf('{');
        if (start < 0) {
            return null;
        }
        return candidateAt(text, start, closingBrace(text, start));
    }

    private static String candidateAt(String text, int start, int end) {
        if (end >= 0) {
            return text.substring(start, end + 1);
        }
        // never closed: keep the tail as a truncated candidate
        return DANGLING_FENCE.matcher(text.substring(start)).replaceAll("").trim();
    }

    /**
     * Index of the brace closing the object opened at {@code start}, or -1 when the text ends first.
     */
    private static int closingBrace(String text, int start) {
        int depth = 0;
        boolean inString = false;
        boolean escape = false;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (escape) {
                    escape = false;
                } else if (c == '\\') {
                    escape = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    private ObjectNode parseObject(String json) throws JsonProcessingException {
        JsonNode node = objectMapper.readTree(json);
        if (node instanceof ObjectNode objectNode) {
            return objectNode;
        }
        throw new JsonRecoveryException("Provider JSON is not an object", truncate(json, SNIPPET_LENGTH));
    }

    public String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            return "\"serialization-failed-" + UUID.randomUUID() + "\"";
        }
    }

    static String truncate(String value, int maxLength) {
        String normalized = value.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= maxLength) {
            return normalized;
        }
        return normalized.substring(0, maxLength) + "...";
    }
}
