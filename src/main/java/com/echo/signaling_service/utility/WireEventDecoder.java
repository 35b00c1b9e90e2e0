package com.echo.signaling_service.utility;

import java.io.IOException;
import java.util.Optional;

import org.springframework.stereotype.Component;

import com.echo.signaling_service.dto.InboundEvent;
import com.echo.signaling_service.dto.JoinRequest;
import com.echo.signaling_service.dto.JoinRoomRequest;
import com.echo.signaling_service.enums.WireEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.extern.slf4j.Slf4j;

/**
 * Turns a {@code {"event": ..., "data": ...}} text frame into a typed event. Unknown
 * events and payloads of the wrong shape decode to empty and are dropped by the caller.
 */
@Slf4j
@Component
public class WireEventDecoder {

    private final ObjectMapper objectMapper;

    public WireEventDecoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Optional<InboundEvent> decode(String frame) {
        JsonNode root;
        try {
            root = objectMapper.readTree(frame);
        } catch (JsonProcessingException e) {
            log.warn("Dropping unparseable frame: {}", e.getOriginalMessage());
            return Optional.empty();
        }
        if (root == null || !root.isObject() || !root.path("event").isTextual()) {
            log.warn("Dropping frame without an event name");
            return Optional.empty();
        }

        String name = root.get("event").asText();
        WireEvent event = WireEvent.fromWire(name);
        if (event == null) {
            log.debug("Dropping unknown event '{}'", name);
            return Optional.empty();
        }

        JsonNode data = root.get("data");
        try {
            switch (event) {
                case JOIN:
                    return Optional.of(new InboundEvent(event, decodeJoin(data)));
                case JOIN_ROOM:
                    return Optional.of(new InboundEvent(event, decodeJoinRoom(data)));
                case LEAVE_ROOM:
                    return Optional.of(new InboundEvent(event, null));
                default:
                    if (data == null || !data.isObject()) {
                        log.warn("Dropping '{}': payload is not an object", name);
                        return Optional.empty();
                    }
                    return Optional.of(new InboundEvent(event, read(data, event.getPayloadType())));
            }
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Dropping malformed '{}' payload: {}", name, e.getMessage());
            return Optional.empty();
        }
    }

    // "join" accepts a bare display name or {name, userId}
    private JoinRequest decodeJoin(JsonNode data) throws IOException {
        if (data == null || data.isNull()) {
            return new JoinRequest();
        }
        if (data.isTextual()) {
            return new JoinRequest(data.asText(), null);
        }
        return read(data, JoinRequest.class);
    }

    // "joinRoom" accepts a bare room name, {room} or null for the global partition
    private JoinRoomRequest decodeJoinRoom(JsonNode data) throws IOException {
        if (data == null || data.isNull()) {
            return new JoinRoomRequest();
        }
        if (data.isTextual()) {
            return new JoinRoomRequest(data.asText());
        }
        return read(data, JoinRoomRequest.class);
    }

    private <T> T read(JsonNode data, Class<T> type) throws IOException {
        return objectMapper.readerFor(type)
                .without(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .readValue(data);
    }
}
