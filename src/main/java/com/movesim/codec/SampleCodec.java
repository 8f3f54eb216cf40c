package com.movesim.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.movesim.domain.model.Sample;
import com.movesim.exception.SampleEncodingException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import org.springframework.stereotype.Component;

/**
 * JSON codec for stored samples: {@code {"dx":..,"dy":..,"ts":"2024-05-01T10:15:30.123456Z"}}.
 *
 * <p>Uses its own mapper rather than the web layer's so the stored format does not change when
 * HTTP serialization settings do. Timestamps are RFC-3339 strings; on read any UTC offset is
 * accepted. A record without a timestamp cannot be ordered and is rejected.
 */
@Component
public class SampleCodec {

    private final ObjectMapper objectMapper = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.ADJUST_DATES_TO_CONTEXT_TIME_ZONE)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    public byte[] encode(Sample sample) {
        try {
            return objectMapper.writeValueAsBytes(sample);
        } catch (JsonProcessingException e) {
            throw new SampleEncodingException("Failed to encode sample at " + sample.timestamp(), e);
        }
    }

    public Sample decode(byte[] payload) {
        if (payload == null || payload.length == 0) {
            throw new SampleEncodingException("Empty record");
        }
        Sample sample;
        try {
            sample = objectMapper.readValue(payload, Sample.class);
        } catch (IOException e) {
            throw new SampleEncodingException("Failed to decode record: " + preview(payload), e);
        }
        if (sample == null || sample.timestamp() == null) {
            throw new SampleEncodingException("Record has no timestamp: " + preview(payload));
        }
        return sample;
    }

    private static String preview(byte[] payload) {
        String text = new String(payload, StandardCharsets.UTF_8);
        return text.length() > 120 ? text.substring(0, 120) + "..." : text;
    }
}
