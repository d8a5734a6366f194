package com.whereq.roundhouse.queue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.roundhouse.exception.JobSerializationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * JSON encoding of the values kept in store hashes. A failure here is a bug, so it is
 * logged at error level before it propagates.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JsonCodec {

    private final ObjectMapper objectMapper;

    public String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize {}", value.getClass().getSimpleName(), e);
            throw new JobSerializationException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    public <T> T read(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            log.error("Failed to deserialize {}", type.getSimpleName(), e);
            throw new JobSerializationException("Failed to deserialize " + type.getSimpleName(), e);
        }
    }
}
