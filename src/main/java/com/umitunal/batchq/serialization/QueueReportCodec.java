package com.umitunal.batchq.serialization;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * JSON codec for {@link QueueReport} using Jackson.
 */
public class QueueReportCodec {
    private final ObjectMapper mapper;

    public QueueReportCodec() {
        this(createDefaultMapper());
    }

    public QueueReportCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public byte[] encode(QueueReport report) {
        try {
            return mapper.writeValueAsBytes(report);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to serialize report to JSON", e);
        }
    }

    public String encodeToString(QueueReport report) {
        try {
            return mapper.writeValueAsString(report);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to serialize report to JSON", e);
        }
    }

    public QueueReport decode(byte[] bytes) {
        try {
            return mapper.readValue(bytes, QueueReport.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to deserialize report from JSON", e);
        }
    }

    public QueueReport decode(String json) {
        try {
            return mapper.readValue(json, QueueReport.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to deserialize report from JSON", e);
        }
    }

    private static ObjectMapper createDefaultMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }
}
