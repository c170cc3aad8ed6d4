package dev.rxcache.ser;

import dev.rxcache.error.PayloadFormatException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class JsonPayloadParserTest {

    private final JsonPayloadParser parser = new JsonPayloadParser();

    @Test
    void parsesObject() {
        assertEquals("198211", parser.parse("{\"rxcui\":\"198211\"}").path("rxcui").asText());
    }

    @Test
    void rejectsEmptyAndInvalidPayloads() {
        assertThrows(PayloadFormatException.class, () -> parser.parse(""));
        assertThrows(PayloadFormatException.class, () -> parser.parse("   "));
        PayloadFormatException ex = assertThrows(PayloadFormatException.class, () -> parser.parse("{\"open\":"));
        assertNotNull(ex.getCause());
    }
}
