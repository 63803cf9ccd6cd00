package io.github.drompincen.collabsync.protocol.ws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.github.drompincen.collabsync.protocol.error.ProtocolException;

public class WireCodec {

    private final ObjectMapper mapper;

    public WireCodec() {
        this(defaultMapper());
    }

    public WireCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public static ObjectMapper defaultMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.findAndRegisterModules();
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        mapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    public String encode(WsMessage message) {
        try {
            return mapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new ProtocolException("Cannot encode " + message.messageType() + ": " + e.getOriginalMessage(), e);
        }
    }

    public WsMessage decode(String frame) {
        if (frame == null || frame.isBlank()) {
            throw new ProtocolException("Empty frame");
        }
        try {
            return mapper.readValue(frame, WsMessage.class);
        } catch (JsonProcessingException e) {
            throw new ProtocolException("Malformed frame: " + e.getOriginalMessage(), e);
        }
    }
}
