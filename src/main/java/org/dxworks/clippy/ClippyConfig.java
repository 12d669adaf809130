package org.dxworks.clippy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.dxworks.clippy.model.ContentLimits;
import org.dxworks.clippy.parser.EmptyBlockPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class ClippyConfig {

    private static final Logger logger = LoggerFactory.getLogger(ClippyConfig.class);

    private static final String CONFIG_FILE_NAME = "clippy-config.yml";
    private static final String DEFAULT_PLATFORM = "contenteditable-generic";
    private static final boolean DEFAULT_DROP_EMPTY_BLOCKS = false;

    private final String defaultPlatform;
    private final ContentLimits limits;
    private final boolean dropEmptyBlocks;

    private ClippyConfig(String defaultPlatform, ContentLimits limits, boolean dropEmptyBlocks) {
        this.defaultPlatform = defaultPlatform;
        this.limits = limits;
        this.dropEmptyBlocks = dropEmptyBlocks;
    }

    public String getDefaultPlatform() {
        return defaultPlatform;
    }

    public ContentLimits getLimits() {
        return limits;
    }

    public boolean isDropEmptyBlocks() {
        return dropEmptyBlocks;
    }

    public EmptyBlockPolicy getEmptyBlockPolicy() {
        return dropEmptyBlocks ? EmptyBlockPolicy.DROP : EmptyBlockPolicy.KEEP;
    }

    public static ClippyConfig defaults() {
        return new ClippyConfig(DEFAULT_PLATFORM, ContentLimits.DEFAULTS, DEFAULT_DROP_EMPTY_BLOCKS);
    }

    public static ClippyConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static ClippyConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                ContentLimits limits = ContentLimits.DEFAULTS
                        .withMaxBlocks(positiveOr(yamlConfig.maxBlocks, ContentLimits.DEFAULT_MAX_BLOCKS))
                        .withMaxNestingLevel(positiveOr(yamlConfig.maxNestingLevel, ContentLimits.DEFAULT_MAX_NESTING_LEVEL))
                        .withMaxTextLength(positiveOr(yamlConfig.maxTextLength, ContentLimits.DEFAULT_MAX_TEXT_LENGTH));
                String platform = yamlConfig.defaultPlatform != null && !yamlConfig.defaultPlatform.isBlank()
                        ? yamlConfig.defaultPlatform
                        : DEFAULT_PLATFORM;
                boolean dropEmptyBlocks = yamlConfig.dropEmptyBlocks != null
                        ? yamlConfig.dropEmptyBlocks
                        : DEFAULT_DROP_EMPTY_BLOCKS;
                return new ClippyConfig(platform, limits, dropEmptyBlocks);
            }
        } catch (IOException e) {
            logger.warn("Could not read {}, using defaults: {}", configPath, e.getMessage());
        }

        return defaults();
    }

    public static ClippyConfig with(String defaultPlatform, ContentLimits limits, boolean dropEmptyBlocks) {
        String platform = defaultPlatform != null && !defaultPlatform.isBlank() ? defaultPlatform : DEFAULT_PLATFORM;
        return new ClippyConfig(platform, limits != null ? limits : ContentLimits.DEFAULTS, dropEmptyBlocks);
    }

    private static int positiveOr(Integer value, int fallback) {
        return value != null && value > 0 ? value : fallback;
    }

    private static class YamlConfig {
        public String defaultPlatform;
        public Integer maxBlocks;
        public Integer maxNestingLevel;
        public Integer maxTextLength;
        public Boolean dropEmptyBlocks;
    }
}
