package net.bookharvest.adapters.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import net.bookharvest.domain.backfill.CandidateBook;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Parses raw model output into candidate books.
 *
 * <p>Accepts a bare JSON array or an object wrapping it under {@code books}; strips markdown fences and
 * falls back to bracket extraction. Entries without a title or author are dropped.</p>
 */
@Slf4j
class GeneratedBookParser {

    private static final int DEFAULT_CONFIDENCE = 70;

    private final ObjectMapper objectMapper;

    GeneratedBookParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @throws IllegalStateException when the text holds no JSON array
     */
    List<CandidateBook> parse(String responseText, String providerId, int fallbackYear) {
        if (!StringUtils.hasText(responseText)) {
            throw new IllegalStateException("Generation response was empty");
        }
        JsonNode payload = parsePayload(responseText);
        JsonNode array = payload.isArray() ? payload : payload.path("books");
        if (!array.isArray()) {
            throw new IllegalStateException("Generation response did not contain a JSON array");
        }

        List<CandidateBook> books = new ArrayList<>();
        for (JsonNode node : array) {
            Optional<String> title = text(node, "title");
            Optional<String> author = text(node, "author");
            if (title.isEmpty() || author.isEmpty()) {
                log.debug("Dropping generated entry without title or author from {}: {}", providerId, node);
                continue;
            }
            int year = node.path("publication_year").asInt(fallbackYear);
            books.add(new CandidateBook(
                title.get(),
                author.get(),
                year > 0 ? year : fallbackYear,
                text(node, "format").orElse("Unknown"),
                text(node, "publisher").orElse(""),
                null,
                providerId,
                text(node, "significance").orElse(""),
                node.path("confidence").asInt(DEFAULT_CONFIDENCE)));
        }
        return books;
    }

    private JsonNode parsePayload(String responseText) {
        String cleaned = responseText.replace("```json", "").replace("```", "").trim();
        try {
            return objectMapper.readTree(cleaned);
        } catch (JsonProcessingException initialParseException) {
            int open = cleaned.indexOf('[');
            int close = cleaned.lastIndexOf(']');
            if (open < 0 || close <= open) {
                throw new IllegalStateException("Generation response did not include a JSON array", initialParseException);
            }
            log.warn("Generation response required bracket extraction (initial parse failed: {})",
                initialParseException.getOriginalMessage());
            try {
                return objectMapper.readTree(cleaned.substring(open, close + 1));
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Generation response JSON parsing failed", e);
            }
        }
    }

    private static Optional<String> text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return Optional.empty();
        }
        String text = value.asText();
        return StringUtils.hasText(text) ? Optional.of(text.trim()) : Optional.empty();
    }
}
