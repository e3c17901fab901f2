package com.migrationanalyzer.core.report;

import java.io.IOException;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.migrationanalyzer.core.model.AnalysisReport;

/**
 * Serializes the report to the JSON wire contract (snake_case keys, enums as their ids).
 */
public class JsonReportWriter implements ReportWriter {

    private static final Logger log = LoggerFactory.getLogger(JsonReportWriter.class);

    private final ObjectMapper mapper;

    public JsonReportWriter() {
        this.mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public String getId() {
        return "json";
    }

    @Override
    public String render(AnalysisReport report) {
        return toJson(report);
    }

    /**
     * Serializes the report.
     *
     * @param report analysis report
     * @return pretty-printed JSON
     */
    public String toJson(AnalysisReport report) {
        try {
            return mapper.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize analysis report", e);
        }
    }

    @Override
    public void write(AnalysisReport report, Path target) throws IOException {
        ReportWriter.super.write(report, target);
        log.info("Wrote JSON report: {}", target);
    }
}
