package org.dxworks.codesync;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class CodesyncConfig {

    private static final int DEFAULT_MAX_FILE_LINES = 20000;
    private static final String CONFIG_FILE_NAME = "codesync-config.yml";
    private static final String DEFAULT_TABLE_SEPARATOR_CELL = "---";
    private static final boolean DEFAULT_FAIL_FAST = false;

    private final int maxFileLines;
    private final String tableSeparatorCell;
    private final boolean failFast;

    private CodesyncConfig(int maxFileLines, String tableSeparatorCell, boolean failFast) {
        this.maxFileLines = maxFileLines;
        this.tableSeparatorCell = tableSeparatorCell;
        this.failFast = failFast;
    }

    public int getMaxFileLines() {
        return maxFileLines;
    }

    public String getTableSeparatorCell() {
        return tableSeparatorCell;
    }

    public boolean isFailFast() {
        return failFast;
    }

    public static CodesyncConfig defaults() {
        return new CodesyncConfig(DEFAULT_MAX_FILE_LINES, DEFAULT_TABLE_SEPARATOR_CELL, DEFAULT_FAIL_FAST);
    }

    /**
     * Loads {@code codesync-config.yml} from the working directory.
     */
    public static CodesyncConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    /**
     * Loads the given YAML file. A missing file yields the defaults, a file that cannot be read as YAML is an
     * error.
     */
    public static CodesyncConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        YamlConfig yamlConfig;
        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
            yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
        } catch (IOException e) {
            throw new IllegalStateException("Invalid configuration file " + configPath + ": " + e.getMessage(), e);
        }
        if (yamlConfig == null) {
            return defaults();
        }

        int effectiveMaxFileLines = (yamlConfig.maxFileLines != null && yamlConfig.maxFileLines > 0)
                ? yamlConfig.maxFileLines
                : DEFAULT_MAX_FILE_LINES;
        String effectiveSeparatorCell = (yamlConfig.tableSeparatorCell != null
                && !yamlConfig.tableSeparatorCell.isBlank())
                ? yamlConfig.tableSeparatorCell.trim()
                : DEFAULT_TABLE_SEPARATOR_CELL;
        boolean effectiveFailFast = yamlConfig.failFast != null ? yamlConfig.failFast : DEFAULT_FAIL_FAST;

        return new CodesyncConfig(effectiveMaxFileLines, effectiveSeparatorCell, effectiveFailFast);
    }

    public static CodesyncConfig with(int maxFileLines, String tableSeparatorCell, boolean failFast) {
        int effectiveMaxFileLines = maxFileLines > 0 ? maxFileLines : DEFAULT_MAX_FILE_LINES;
        String effectiveSeparatorCell = (tableSeparatorCell != null && !tableSeparatorCell.isBlank())
                ? tableSeparatorCell.trim()
                : DEFAULT_TABLE_SEPARATOR_CELL;
        return new CodesyncConfig(effectiveMaxFileLines, effectiveSeparatorCell, failFast);
    }

    private static class YamlConfig {
        public Integer maxFileLines;
        public String tableSeparatorCell;
        public Boolean failFast;
    }
}
