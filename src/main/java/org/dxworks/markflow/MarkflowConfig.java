package org.dxworks.markflow;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.dxworks.markflow.html.style.StyleParser;
import org.dxworks.markflow.model.ColorFormat;
import org.dxworks.markflow.model.Theme;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.OptionalInt;

/**
 * Read-only settings handed to the interpreter once, at construction.
 */
public class MarkflowConfig {
    private static final Logger logger = LoggerFactory.getLogger(MarkflowConfig.class);

    private static final String CONFIG_FILE_NAME = "markflow-config.yml";
    private static final ColorFormat DEFAULT_COLOR_FORMAT = ColorFormat.BGRA8_UNORM_SRGB;
    private static final float DEFAULT_HIDPI_SCALE = 1.0f;

    private final Theme theme;
    private final ColorFormat colorFormat;
    private final float hidpiScale;

    private MarkflowConfig(Theme theme, ColorFormat colorFormat, float hidpiScale) {
        this.theme = theme;
        this.colorFormat = colorFormat;
        this.hidpiScale = hidpiScale;
    }

    public Theme getTheme() {
        return theme;
    }

    public ColorFormat getColorFormat() {
        return colorFormat;
    }

    public float getHidpiScale() {
        return hidpiScale;
    }

    public static MarkflowConfig defaults() {
        return new MarkflowConfig(Theme.darkDefault(), DEFAULT_COLOR_FORMAT, DEFAULT_HIDPI_SCALE);
    }

    public static MarkflowConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static MarkflowConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                return fromYaml(yamlConfig);
            }
        } catch (IOException e) {
            logger.warn("Could not read {}, using default settings: {}", configPath, e.getMessage());
        }

        return defaults();
    }

    public static MarkflowConfig with(Theme theme, ColorFormat colorFormat, float hidpiScale) {
        float effectiveScale = hidpiScale > 0 ? hidpiScale : DEFAULT_HIDPI_SCALE;
        return new MarkflowConfig(
                theme != null ? theme : Theme.darkDefault(),
                colorFormat != null ? colorFormat : DEFAULT_COLOR_FORMAT,
                effectiveScale);
    }

    private static MarkflowConfig fromYaml(YamlConfig yamlConfig) {
        Theme theme = "light".equalsIgnoreCase(yamlConfig.theme) ? Theme.lightDefault() : Theme.darkDefault();

        OptionalInt textColor = StyleParser.parseHexColor(yamlConfig.textColor);
        if (textColor.isPresent()) {
            theme = theme.withTextColor(textColor.getAsInt());
        }
        OptionalInt linkColor = StyleParser.parseHexColor(yamlConfig.linkColor);
        if (linkColor.isPresent()) {
            theme = theme.withLinkColor(linkColor.getAsInt());
        }
        OptionalInt codeColor = StyleParser.parseHexColor(yamlConfig.codeColor);
        if (codeColor.isPresent()) {
            theme = theme.withCodeColor(codeColor.getAsInt());
        }

        ColorFormat colorFormat = ColorFormat.parse(yamlConfig.colorFormat).orElse(DEFAULT_COLOR_FORMAT);
        float hidpiScale = (yamlConfig.hidpiScale != null && yamlConfig.hidpiScale > 0)
                ? yamlConfig.hidpiScale
                : DEFAULT_HIDPI_SCALE;

        return new MarkflowConfig(theme, colorFormat, hidpiScale);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private static class YamlConfig {
        public String theme;
        public String textColor;
        public String linkColor;
        public String codeColor;
        public String colorFormat;
        public Float hidpiScale;
    }
}
