package com.clinicflow.backend.global.pagination;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Optional;
import java.util.UUID;

import com.clinicflow.backend.global.error.ErrorCode;
import com.clinicflow.backend.global.error.ProblemException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Opaque cursor format: URL-safe base64 of {@code {"v": sortValue, "id": uuid}}.
 * Cursors carry no server state, so they stay valid across instances and restarts.
 */
@Component
public class CursorCodec {

    private static final String SORT_VALUE_FIELD = "v";
    private static final String ID_FIELD = "id";

    private final ObjectMapper objectMapper;

    public CursorCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String encode(String sortValue, UUID id) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put(SORT_VALUE_FIELD, sortValue);
        node.put(ID_FIELD, id.toString());
        try {
            byte[] json = objectMapper.writeValueAsBytes(node);
            return Base64.getUrlEncoder().withoutPadding().encodeToString(json);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to encode cursor", ex);
        }
    }

    public Optional<Cursor> decode(String cursor) {
        if (!StringUtils.hasText(cursor)) {
            return Optional.empty();
        }
        try {
            byte[] json = Base64.getUrlDecoder().decode(cursor.trim());
            JsonNode node = objectMapper.readTree(new String(json, StandardCharsets.UTF_8));
            if (node == null || !node.isObject()) {
                return Optional.empty();
            }
            JsonNode sortValue = node.get(SORT_VALUE_FIELD);
            JsonNode id = node.get(ID_FIELD);
            if (sortValue == null || !sortValue.isTextual() || id == null || !id.isTextual()) {
                return Optional.empty();
            }
            return Optional.of(new Cursor(sortValue.asText(), UUID.fromString(id.asText())));
        } catch (IllegalArgumentException | JsonProcessingException ex) {
            return Optional.empty();
        }
    }

    /**
     * Absent cursor means "first page"; a present but unreadable one is a client error.
     */
    public Optional<Cursor> decodeRequired(String cursor) {
        if (!StringUtils.hasText(cursor)) {
            return Optional.empty();
        }
        return Optional.of(decode(cursor)
                .orElseThrow(() -> new ProblemException(ErrorCode.VALIDATION_ERROR, "INVALID_CURSOR")));
    }
}
