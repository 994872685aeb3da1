package com.judgmentbell.common.format;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.judgmentbell.common.report.ChshReport;

/** JSON round trip of {@link ChshReport} for downstream comparison. */
public class ReportCodec {

    private final ObjectMapper objectMapper;

    public ReportCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String write(ChshReport report) throws JsonProcessingException {
        return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(report);
    }

    public ChshReport read(String json) throws JsonProcessingException {
        return objectMapper.readValue(json, ChshReport.class);
    }
}
