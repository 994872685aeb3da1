package com.judgmentbell.common.format;

import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/** ObjectMapper configuration shared by the manifest, result and report formats. */
public final class JsonSupport {

    private JsonSupport() {}

    /**
     * Java time as ISO strings, unknown properties ignored, and {@code Infinity} / {@code NaN}
     * accepted on input so infinite standard errors survive a round trip.
     */
    public static ObjectMapper newObjectMapper() {
        return JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .enable(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();
    }
}
