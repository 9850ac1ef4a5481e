package com.vtb.attacktree.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;

import java.util.List;
import java.util.Locale;

/**
 * Поддерживаемые кодировки спецификации дерева атак
 */
public enum SpecFormat {
    YAML("text/yaml", "yaml", "yml"),
    JSON("application/json", "json"),
    XML("application/xml", "xml");

    private final String mediaType;
    private final List<String> extensions;

    SpecFormat(String mediaType, String... extensions) {
        this.mediaType = mediaType;
        this.extensions = List.of(extensions);
    }

    public String getMediaType() {
        return mediaType;
    }

    public List<String> getExtensions() {
        return extensions;
    }

    public String getDefaultExtension() {
        return extensions.get(0);
    }

    /**
     * Формат по расширению или имени ("yml", "json", ".xml")
     */
    public static SpecFormat fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Формат спецификации не указан");
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        if (normalized.startsWith(".")) {
            normalized = normalized.substring(1);
        }
        for (SpecFormat format : values()) {
            if (format.extensions.contains(normalized)) {
                return format;
            }
        }
        throw new IllegalArgumentException("Неподдерживаемый формат спецификации: " + name);
    }

    /**
     * Формат по имени файла: spec.yml -> YAML
     */
    public static SpecFormat fromFileName(String fileName) {
        if (fileName == null) {
            throw new IllegalArgumentException("Имя файла не указано");
        }
        int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) {
            throw new IllegalArgumentException("Не удалось определить формат по имени файла: " + fileName);
        }
        return fromName(fileName.substring(dot + 1));
    }

    ObjectMapper createMapper() {
        return switch (this) {
            case YAML -> new ObjectMapper(new YAMLFactory()
                .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER));
            case JSON -> new ObjectMapper();
            case XML -> new XmlMapper();
        };
    }
}
