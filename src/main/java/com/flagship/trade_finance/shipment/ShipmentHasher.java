package com.flagship.trade_finance.shipment;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.Iterator;
import java.util.List;

/**
 * Computes the BoL hash: the content-derived identity of a shipment.
 *
 * The document is reduced to a canonical JSON form (object keys sorted,
 * null and blank values and then-empty containers removed, strings trimmed,
 * compact separators) and hashed with SHA3-256. The result is hex with a
 * {@code 0x} prefix. Equal documents hash equally regardless of key order
 * or empty fields.
 */
@Component
@RequiredArgsConstructor
public class ShipmentHasher {

    private static final String ALGORITHM = "SHA3-256";

    private final ObjectMapper objectMapper;

    public String hash(JsonNode document) {
        if (document == null || !document.isObject()) {
            throw new IllegalArgumentException("Shipment document must be a JSON object");
        }
        JsonNode canonical = canonicalize(document);
        if (canonical == null) {
            throw new IllegalArgumentException("Shipment document has no content");
        }
        try {
            String json = objectMapper.writeValueAsString(canonical);
            byte[] digest = MessageDigest.getInstance(ALGORITHM).digest(json.getBytes(StandardCharsets.UTF_8));
            return "0x" + HexFormat.of().formatHex(digest);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Shipment document cannot be serialized", e);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(ALGORITHM + " not available", e);
        }
    }

    /**
     * @return the cleaned node, or null if nothing is left
     */
    JsonNode canonicalize(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isTextual()) {
            String trimmed = node.asText().trim();
            return trimmed.isEmpty() ? null : objectMapper.getNodeFactory().textNode(trimmed);
        }
        if (node.isObject()) {
            List<String> names = new ArrayList<>();
            Iterator<String> fieldNames = node.fieldNames();
            fieldNames.forEachRemaining(names::add);
            names.sort(null);

            ObjectNode cleaned = objectMapper.createObjectNode();
            for (String name : names) {
                JsonNode value = canonicalize(node.get(name));
                if (value != null) {
                    cleaned.set(name, value);
                }
            }
            return cleaned.isEmpty() ? null : cleaned;
        }
        if (node.isArray()) {
            ArrayNode cleaned = objectMapper.createArrayNode();
            for (JsonNode element : node) {
                JsonNode value = canonicalize(element);
                if (value != null) {
                    cleaned.add(value);
                }
            }
            return cleaned.isEmpty() ? null : cleaned;
        }
        return node;
    }
}
