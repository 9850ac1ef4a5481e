package com.vtb.attacktree.reports;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.vtb.attacktree.config.AnalyzerConfig;
import com.vtb.attacktree.models.AnalysisReport;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Генератор отчетов в формате JSON
 */
@Slf4j
public class JsonReportGenerator implements ReportGenerator {

    private final ObjectMapper objectMapper;

    public JsonReportGenerator() {
        this(AnalyzerConfig.load().getReport());
    }

    public JsonReportGenerator(AnalyzerConfig.Report settings) {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        if (settings == null || settings.indentEnabled()) {
            this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        }
    }

    @Override
    public void generate(AnalysisReport report, Path outputPath) throws IOException {
        log.info("Генерация JSON отчета: {}", outputPath);

        if (report == null) {
            throw new IllegalArgumentException("AnalysisReport не может быть null");
        }

        Files.writeString(outputPath, render(report));
        log.info("JSON отчет сохранен: {} ({} байт)", outputPath, Files.size(outputPath));
    }

    public String render(AnalysisReport report) throws IOException {
        return objectMapper.writeValueAsString(report);
    }

    @Override
    public String getFileExtension() {
        return "json";
    }
}
