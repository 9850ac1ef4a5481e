package com.vtb.attacktree.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Конфигурация анализатора из YAML файла analyzer-config.yaml
 */
@Slf4j
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class AnalyzerConfig {

    public static final String RESOURCE_NAME = "analyzer-config.yaml";

    private Analysis analysis;
    private Map<String, String> demoScenarios;
    private Upload upload;
    private Report report;

    private static AnalyzerConfig instance;

    /**
     * Загрузить конфигурацию из classpath (один раз на процесс)
     */
    public static synchronized AnalyzerConfig load() {
        if (instance == null) {
            instance = load(RESOURCE_NAME);
        }
        return instance;
    }

    /**
     * Загрузить конфигурацию из указанного ресурса classpath
     */
    public static AnalyzerConfig load(String resourceName) {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        try (InputStream is = AnalyzerConfig.class.getClassLoader().getResourceAsStream(resourceName)) {
            if (is == null) {
                throw new IllegalStateException(resourceName + " не найден в classpath");
            }
            AnalyzerConfig config = mapper.readValue(is, AnalyzerConfig.class);
            if (config == null) {
                config = new AnalyzerConfig();
            }
            config.ensureDefaults();
            log.debug("Конфигурация загружена из {}", resourceName);
            return config;
        } catch (IOException e) {
            throw new IllegalStateException("Ошибка загрузки конфигурации: " + e.getMessage(), e);
        }
    }

    /**
     * Конфигурация со значениями по умолчанию, без чтения файла
     */
    public static AnalyzerConfig defaults() {
        AnalyzerConfig config = new AnalyzerConfig();
        config.ensureDefaults();
        return config;
    }

    /**
     * Ресурс демо-сценария по имени ("pre", "post"); null, если сценария нет
     */
    public String demoResource(String scenario) {
        if (scenario == null) {
            return null;
        }
        return demoScenarios.get(scenario.trim().toLowerCase(Locale.ROOT));
    }

    private void ensureDefaults() {
        if (analysis == null) {
            analysis = new Analysis();
        }
        analysis.ensureDefaults();
        if (demoScenarios == null) {
            demoScenarios = new LinkedHashMap<>();
        }
        demoScenarios.putIfAbsent("pre", "demo/pre_digital.yaml");
        demoScenarios.putIfAbsent("post", "demo/post_digital.yaml");
        if (upload == null) {
            upload = new Upload();
        }
        upload.ensureDefaults();
        if (report == null) {
            report = new Report();
        }
    }

    @Data
    public static class Analysis {
        private Integer topContributors;

        private void ensureDefaults() {
            if (topContributors == null || topContributors < 1) {
                topContributors = 3;
            }
        }
    }

    @Data
    public static class Upload {
        private Long maxSizeKb;
        private List<String> allowedExtensions;

        private void ensureDefaults() {
            if (maxSizeKb == null || maxSizeKb <= 0) {
                maxSizeKb = 1024L;
            }
            if (allowedExtensions == null || allowedExtensions.isEmpty()) {
                allowedExtensions = new ArrayList<>(List.of("yaml", "yml", "json", "xml"));
            }
        }

        public long maxSizeBytes() {
            return maxSizeKb * 1024;
        }
    }

    @Data
    public static class Report {
        private Boolean indentOutput = Boolean.TRUE;

        public boolean indentEnabled() {
            return indentOutput == null || indentOutput;
        }
    }
}
