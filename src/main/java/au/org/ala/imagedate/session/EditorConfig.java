package au.org.ala.imagedate.session;

import au.org.ala.imagedate.dates.ImageDateWriter;
import au.org.ala.imagedate.util.ImageFileEnumerator;
import com.google.common.base.Splitter;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.*;
import java.io.IOException;
import java.io.InputStream;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Properties;

/**
 * Settings of an image date editing session. Defaults can be overridden by an {@code image-date-editor.properties}
 * file on the classpath, and those in turn by system properties with the same keys.
 */
public class EditorConfig {

    private static final Logger log = LoggerFactory.getLogger(EditorConfig.class);

    public static final String RESOURCE_NAME = "image-date-editor.properties";

    public static final String PREVIEW_MAX_WIDTH = "imagedate.preview.maxWidth";
    public static final String PREVIEW_MAX_HEIGHT = "imagedate.preview.maxHeight";
    public static final String BACKGROUND_COLOR = "imagedate.background";
    public static final String EXTENSIONS = "imagedate.extensions";
    public static final String DATE_TAG_PATTERN = "imagedate.dateTagPattern";

    private int _previewMaxWidth = 1800;
    private int _previewMaxHeight = 1300;
    private Color _backgroundColor = Color.WHITE;
    private List<String> _extensions = ImageFileEnumerator.DEFAULT_EXTENSIONS;
    private String _dateTagPattern = ImageDateWriter.DEFAULT_TAG_PATTERN;

    public EditorConfig() {
    }

    public EditorConfig(int previewMaxWidth, int previewMaxHeight, Color backgroundColor) {
        _previewMaxWidth = previewMaxWidth;
        _previewMaxHeight = previewMaxHeight;
        _backgroundColor = backgroundColor;
    }

    /**
     * Defaults, then the classpath properties file, then system properties.
     */
    public static EditorConfig load() {
        Properties properties = new Properties();
        try (InputStream is = EditorConfig.class.getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
            if (is != null) {
                properties.load(is);
            } else {
                log.debug("No {} on the classpath, using defaults", RESOURCE_NAME);
            }
        } catch (IOException e) {
            log.warn("Could not read {}, using defaults", RESOURCE_NAME, e);
        }
        for (String key : List.of(PREVIEW_MAX_WIDTH, PREVIEW_MAX_HEIGHT, BACKGROUND_COLOR, EXTENSIONS, DATE_TAG_PATTERN)) {
            String value = System.getProperty(key);
            if (value != null) {
                properties.setProperty(key, value);
            }
        }
        return fromProperties(properties);
    }

    /**
     * Values that can't be parsed are logged and leave the default in place.
     */
    public static EditorConfig fromProperties(Properties properties) {
        EditorConfig config = new EditorConfig();
        String width = properties.getProperty(PREVIEW_MAX_WIDTH);
        if (StringUtils.isNotBlank(width)) {
            config.setPreviewMaxWidth(parseDimension(PREVIEW_MAX_WIDTH, width, config.getPreviewMaxWidth()));
        }
        String height = properties.getProperty(PREVIEW_MAX_HEIGHT);
        if (StringUtils.isNotBlank(height)) {
            config.setPreviewMaxHeight(parseDimension(PREVIEW_MAX_HEIGHT, height, config.getPreviewMaxHeight()));
        }
        String background = properties.getProperty(BACKGROUND_COLOR);
        if (StringUtils.isNotBlank(background)) {
            try {
                config.setBackgroundColor(Color.decode(background.trim()));
            } catch (NumberFormatException e) {
                log.warn("Invalid {} '{}', keeping {}", BACKGROUND_COLOR, background, config.getBackgroundColor());
            }
        }
        String extensions = properties.getProperty(EXTENSIONS);
        if (StringUtils.isNotBlank(extensions)) {
            config.setExtensions(Splitter.on(',').trimResults().omitEmptyStrings().splitToList(extensions));
        }
        String pattern = properties.getProperty(DATE_TAG_PATTERN);
        if (StringUtils.isNotBlank(pattern)) {
            try {
                DateTimeFormatter.ofPattern(pattern);
                config.setDateTagPattern(pattern);
            } catch (IllegalArgumentException e) {
                log.warn("Invalid {} '{}', keeping {}: {}", DATE_TAG_PATTERN, pattern, config.getDateTagPattern(), e.getMessage());
            }
        }
        return config;
    }

    private static int parseDimension(String key, String value, int defaultValue) {
        try {
            int parsed = Integer.parseInt(value.trim());
            if (parsed > 0) {
                return parsed;
            }
        } catch (NumberFormatException e) {
            log.debug("{} is not a number: {}", key, e.getMessage());
        }
        log.warn("Invalid {} '{}', keeping {}", key, value, defaultValue);
        return defaultValue;
    }

    public int getPreviewMaxWidth() { return _previewMaxWidth; }
    public void setPreviewMaxWidth(int width) { _previewMaxWidth = width; }

    public int getPreviewMaxHeight() { return _previewMaxHeight; }
    public void setPreviewMaxHeight(int height) { _previewMaxHeight = height; }

    public Color getBackgroundColor() { return _backgroundColor; }
    public void setBackgroundColor(Color c) { _backgroundColor = c; }

    public List<String> getExtensions() { return _extensions; }
    public void setExtensions(List<String> extensions) { _extensions = extensions; }

    public String getDateTagPattern() { return _dateTagPattern; }
    public void setDateTagPattern(String pattern) { _dateTagPattern = pattern; }
}
