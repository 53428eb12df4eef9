package io.github.drompincen.clawtrigger.protocol.ws;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

public record WsMessage(
        WsMessageType type,
        String topic,
        JsonNode payload,
        Instant ts
) {
    public static WsMessage of(WsMessageType type, String topic, JsonNode payload) {
        return new WsMessage(type, topic, payload, Instant.now());
    }

    public static WsMessage error(String topic, JsonNode payload) {
        return of(WsMessageType.ERROR, topic, payload);
    }
}
