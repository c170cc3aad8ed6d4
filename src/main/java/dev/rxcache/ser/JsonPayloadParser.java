package dev.rxcache.ser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.rxcache.error.PayloadFormatException;

public class JsonPayloadParser implements PayloadParser {
    private final ObjectMapper mapper = new ObjectMapper();

    @Override
    public JsonNode parse(String payloadText) {
        try {
            JsonNode node = mapper.readTree(payloadText);
            if (node == null || node.isMissingNode()) {
                throw new PayloadFormatException("Empty payload", null);
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new PayloadFormatException("Failed to parse payload as JSON: " + abbreviate(payloadText), e);
        }
    }

    private static String abbreviate(String text) {
        return text.length() <= 120 ? text : text.substring(0, 120) + "...";
    }
}
