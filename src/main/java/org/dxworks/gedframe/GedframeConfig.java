package org.dxworks.gedframe;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class GedframeConfig {

    private static final int DEFAULT_MAX_FILE_LINES = 200000;
    private static final String CONFIG_FILE_NAME = "gedframe-config.yml";
    private static final boolean DEFAULT_EXPORT_EMPTY_FIELDS = true;
    private static final boolean DEFAULT_PRETTY_PRINT = true;
    private static final ExportFormat DEFAULT_FORMAT = ExportFormat.JSON;

    private final int maxFileLines;
    private final boolean exportEmptyFields;
    private final boolean prettyPrint;
    private final ExportFormat defaultFormat;

    private GedframeConfig(int maxFileLines, boolean exportEmptyFields, boolean prettyPrint, ExportFormat defaultFormat) {
        this.maxFileLines = maxFileLines;
        this.exportEmptyFields = exportEmptyFields;
        this.prettyPrint = prettyPrint;
        this.defaultFormat = defaultFormat;
    }

    public int getMaxFileLines() {
        return maxFileLines;
    }

    public boolean isExportEmptyFields() {
        return exportEmptyFields;
    }

    public boolean isPrettyPrint() {
        return prettyPrint;
    }

    public ExportFormat getDefaultFormat() {
        return defaultFormat;
    }

    public static GedframeConfig defaults() {
        return new GedframeConfig(DEFAULT_MAX_FILE_LINES, DEFAULT_EXPORT_EMPTY_FIELDS, DEFAULT_PRETTY_PRINT, DEFAULT_FORMAT);
    }

    public static GedframeConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static GedframeConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                int effectiveMaxFileLines = (yamlConfig.maxFileLines != null && yamlConfig.maxFileLines > 0)
                        ? yamlConfig.maxFileLines
                        : DEFAULT_MAX_FILE_LINES;
                boolean effectiveExportEmptyFields = (yamlConfig.exportEmptyFields != null)
                        ? yamlConfig.exportEmptyFields
                        : DEFAULT_EXPORT_EMPTY_FIELDS;
                boolean effectivePrettyPrint = (yamlConfig.prettyPrint != null)
                        ? yamlConfig.prettyPrint
                        : DEFAULT_PRETTY_PRINT;
                ExportFormat effectiveFormat = (yamlConfig.defaultFormat != null)
                        ? ExportFormat.find(yamlConfig.defaultFormat).orElse(DEFAULT_FORMAT)
                        : DEFAULT_FORMAT;

                return new GedframeConfig(effectiveMaxFileLines, effectiveExportEmptyFields, effectivePrettyPrint, effectiveFormat);
            }
        } catch (IOException e) {
            System.err.println("[GedframeConfig] Could not read " + configPath + ", using defaults: " + e.getMessage());
        }

        return defaults();
    }

    public static GedframeConfig with(int maxFileLines, boolean exportEmptyFields, boolean prettyPrint, ExportFormat defaultFormat) {
        int effectiveMaxFileLines = maxFileLines > 0 ? maxFileLines : DEFAULT_MAX_FILE_LINES;
        ExportFormat effectiveFormat = defaultFormat != null ? defaultFormat : DEFAULT_FORMAT;
        return new GedframeConfig(effectiveMaxFileLines, exportEmptyFields, prettyPrint, effectiveFormat);
    }

    private static class YamlConfig {
        public Integer maxFileLines;
        public Boolean exportEmptyFields;
        public Boolean prettyPrint;
        public String defaultFormat;
    }
}
