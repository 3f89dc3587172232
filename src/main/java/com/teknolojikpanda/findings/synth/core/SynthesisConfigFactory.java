package com.teknolojikpanda.findings.synth.core;

import com.teknolojikpanda.findings.synth.model.ConfigurationValidationException;
import com.teknolojikpanda.findings.synth.model.SynthesisConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.inject.Named;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.InvalidPathException;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.stream.Collectors;

/**
 * Translates loosely typed settings (a map, {@link Properties} or the classpath defaults file)
 * into a validated {@link SynthesisConfig}. Missing keys take the built-in defaults; values that
 * cannot be parsed are reported together with range violations.
 */
@Named
public class SynthesisConfigFactory {

    public static final String DEFAULTS_RESOURCE = "finding-synthesis.properties";

    private static final Logger log = LoggerFactory.getLogger(SynthesisConfigFactory.class);

    /**
     * @throws ConfigurationValidationException listing every invalid key
     */
    @Nonnull
    public SynthesisConfig from(@Nonnull Map<String, ?> config) {
        Map<String, String> errors = new LinkedHashMap<>();
        SynthesisConfig defaults = SynthesisConfig.defaults();
        SynthesisConfig.Builder builder = defaults.toBuilder();

        builder.confidenceThreshold(intValue(config, "confidenceThreshold", defaults.getConfidenceThreshold(), errors));
        builder.analyzerTimeoutMs(longValue(config, "analyzerTimeoutMs", defaults.getAnalyzerTimeout().toMillis(), errors));
        builder.analyzerParallelism(intValue(config, "analyzerParallelism", defaults.getAnalyzerParallelism(), errors));
        builder.trackerMaxAttempts(intValue(config, "trackerMaxAttempts", defaults.getTrackerMaxAttempts(), errors));
        builder.trackerRetryDelayMs(longValue(config, "trackerRetryDelayMs", defaults.getTrackerRetryDelayMs(), errors));
        builder.trackerMaxRetryDelayMs(longValue(config, "trackerMaxRetryDelayMs", defaults.getTrackerMaxRetryDelayMs(), errors));
        builder.trackerBreakerThreshold(intValue(config, "trackerBreakerThreshold", defaults.getTrackerBreakerThreshold(), errors));
        builder.trackerBreakerCooldownMs(longValue(config, "trackerBreakerCooldownMs",
                defaults.getTrackerBreakerCooldown().toMillis(), errors));
        if (config.containsKey("trackerLabels")) {
            builder.trackerLabels(splitToList(config.get("trackerLabels")));
        }
        String storePath = stringValue(config.get("submissionStorePath"));
        if (storePath != null) {
            try {
                builder.submissionStorePath(Paths.get(storePath));
            } catch (InvalidPathException e) {
                errors.put("submissionStorePath", "invalid path: " + e.getMessage());
            }
        }

        SynthesisConfig built;
        try {
            built = builder.build();
        } catch (ConfigurationValidationException e) {
            e.getErrors().forEach(errors::putIfAbsent);
            throw new ConfigurationValidationException(errors);
        }
        if (!errors.isEmpty()) {
            throw new ConfigurationValidationException(errors);
        }
        return built;
    }

    @Nonnull
    public SynthesisConfig from(@Nonnull Properties properties) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (String name : properties.stringPropertyNames()) {
            map.put(name, properties.getProperty(name));
        }
        return from(map);
    }

    /**
     * Classpath defaults overlaid with {@code overrides}.
     */
    @Nonnull
    public SynthesisConfig loadDefaults(@Nonnull Map<String, ?> overrides) {
        Properties properties = new Properties();
        ClassLoader loader = SynthesisConfigFactory.class.getClassLoader();
        try (InputStream in = loader.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                log.debug("No {} on the classpath, using built-in defaults", DEFAULTS_RESOURCE);
            } else {
                properties.load(in);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + DEFAULTS_RESOURCE, e);
        }
        Map<String, Object> merged = new LinkedHashMap<>();
        for (String name : properties.stringPropertyNames()) {
            merged.put(name, properties.getProperty(name));
        }
        merged.putAll(overrides);
        return from(merged);
    }

    @Nonnull
    public SynthesisConfig loadDefaults() {
        return loadDefaults(Collections.emptyMap());
    }

    @Nullable
    private String stringValue(@Nullable Object value) {
        if (value == null) {
            return null;
        }
        String text = value.toString().trim();
        return text.isEmpty() ? null : text;
    }

    private int intValue(Map<String, ?> config, String key, int defaultValue, Map<String, String> errors) {
        long value = longValue(config, key, defaultValue, errors);
        if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            errors.put(key, "out of range: " + value);
            return defaultValue;
        }
        return (int) value;
    }

    private long longValue(Map<String, ?> config, String key, long defaultValue, Map<String, String> errors) {
        Object value = config.get(key);
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        String text = stringValue(value);
        if (text == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            errors.put(key, "not a number: '" + text + "'");
            return defaultValue;
        }
    }

    private List<String> splitToList(@Nullable Object value) {
        if (value instanceof Collection) {
            return ((Collection<?>) value).stream()
                    .filter(item -> item != null && !item.toString().trim().isEmpty())
                    .map(item -> item.toString().trim())
                    .collect(Collectors.toList());
        }
        String text = stringValue(value);
        if (text == null) {
            return Collections.emptyList();
        }
        return Arrays.stream(text.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }
}
