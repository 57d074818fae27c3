package com.whereq.warden.service;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.whereq.warden.exception.WardenException;
import com.whereq.warden.model.BatchResult;
import com.whereq.warden.model.ProbeResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * JSON form of results. Only fields are written, so derived views such as
 * success rates and summaries stay out of the payload.
 */
@Slf4j
@Component
public class ResultSerializer {

    private final ObjectMapper objectMapper;

    public ResultSerializer() {
        this(new ObjectMapper().findAndRegisterModules());
    }

    @Autowired
    public ResultSerializer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
            .setVisibility(PropertyAccessor.FIELD, JsonAutoDetect.Visibility.ANY)
            .setVisibility(PropertyAccessor.GETTER, JsonAutoDetect.Visibility.NONE)
            .setVisibility(PropertyAccessor.IS_GETTER, JsonAutoDetect.Visibility.NONE)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
    }

    public String toJson(ProbeResult result) {
        return write(result, "probe result");
    }

    public String toJson(BatchResult batch) {
        return write(batch, "batch result");
    }

    public String toJson(AggregatedResult aggregated) {
        return write(aggregated, "aggregated result");
    }

    /**
     * @throws WardenException for malformed JSON, an unknown status or an out of range score
     */
    public ProbeResult readProbeResult(String json) {
        return read(json, ProbeResult.class, "probe result");
    }

    public BatchResult readBatchResult(String json) {
        return read(json, BatchResult.class, "batch result");
    }

    private String write(Object value, String kind) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize {}", kind, e);
            throw new WardenException("Failed to serialize " + kind, e);
        }
    }

    private <T> T read(String json, Class<T> type, String kind) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new WardenException("Failed to deserialize " + kind + ": " + e.getOriginalMessage(), e);
        }
    }
}
