package dev.rxcache.ser;

import com.fasterxml.jackson.databind.JsonNode;

public interface PayloadParser {
    JsonNode parse(String payloadText);
}
