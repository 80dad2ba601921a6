package org.nowstart.intraday.service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.intraday.data.exception.StrategyConfigurationException;
import org.nowstart.intraday.data.property.StrategyProperties;
import org.springframework.boot.context.properties.bind.AbstractBindHandler;
import org.springframework.boot.context.properties.bind.BindContext;
import org.springframework.boot.context.properties.bind.BindException;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.ConfigurationPropertyName;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;
import org.springframework.boot.env.YamlPropertySourceLoader;
import org.springframework.core.env.EnumerablePropertySource;
import org.springframework.core.env.PropertySource;
import org.springframework.core.io.FileSystemResource;

/**
 * Reads the two-file YAML layout (algorithm file + risk file) into {@link StrategyProperties}.
 *
 * <p>A missing, unreadable or malformed file, or a value that cannot be converted, is not fatal: the loader logs a
 * warning and returns the defaults. An unknown root section is a typo and is rejected. Documented sections with no
 * strategy option behind them (reporting, monitoring and the like) are accepted and skipped. Keys inside bound
 * sections that match no option are logged.
 */
@Slf4j
public class StrategyConfigLoader {

    // section names are compared with '-' and '_' removed and lower-cased
    public static final Set<String> ALGORITHM_SECTIONS = Set.of("trading", "indicators", "entry", "exit", "behavior", "environment");
    public static final Set<String> ALGORITHM_SKIPPED_SECTIONS = Set.of("performance", "advanced");
    public static final Set<String> RISK_SECTIONS = Set.of("portfolio", "positionsizing", "stoploss");
    public static final Set<String> RISK_SKIPPED_SECTIONS = Set.of(
            "takeprofit", "monitoring", "marketconditions", "emergency", "reporting", "backtesting"
    );

    private static final String RISK_PREFIX = StrategyProperties.PREFIX + ".risk.";

    private final YamlPropertySourceLoader yamlLoader = new YamlPropertySourceLoader();

    public StrategyProperties load(Path algorithmFile, Path riskFile) {
        Map<String, Object> algorithmValues;
        Map<String, Object> riskValues;
        try {
            algorithmValues = readYaml(algorithmFile);
            riskValues = readYaml(riskFile);
        } catch (IOException | RuntimeException e) {
            log.warn("event=config_load_failed algorithm_file={} risk_file={} fallback=defaults", algorithmFile, riskFile, e);
            return StrategyProperties.defaults();
        }

        rejectUnknownSections(algorithmFile, algorithmValues, ALGORITHM_SECTIONS, ALGORITHM_SKIPPED_SECTIONS);
        rejectUnknownSections(riskFile, riskValues, RISK_SECTIONS, RISK_SKIPPED_SECTIONS);

        Map<String, Object> merged = new LinkedHashMap<>();
        putSections(merged, StrategyProperties.PREFIX + ".", algorithmValues, ALGORITHM_SECTIONS);
        putSections(merged, RISK_PREFIX, riskValues, RISK_SECTIONS);
        logSkippedSections(algorithmFile, algorithmValues, ALGORITHM_SKIPPED_SECTIONS);
        logSkippedSections(riskFile, riskValues, RISK_SKIPPED_SECTIONS);

        MapConfigurationPropertySource source = new MapConfigurationPropertySource(merged);
        BoundNameRecorder recorder = new BoundNameRecorder();
        StrategyProperties properties;
        try {
            properties = new Binder(source).bindOrCreate(StrategyProperties.PREFIX, Bindable.of(StrategyProperties.class), recorder);
        } catch (BindException e) {
            log.warn(
                    "event=config_bind_failed algorithm_file={} risk_file={} property={} fallback=defaults",
                    algorithmFile,
                    riskFile,
                    e.getName(),
                    e
            );
            return StrategyProperties.defaults();
        }

        warnUnrecognizedKeys(source, recorder);
        log.info("event=config_loaded algorithm_file={} risk_file={} keys={}", algorithmFile, riskFile, merged.size());
        return properties;
    }

    private Map<String, Object> readYaml(Path file) throws IOException {
        if (file == null) {
            return Map.of();
        }
        if (!Files.isReadable(file)) {
            throw new IOException("configuration file not readable: " + file);
        }
        List<PropertySource<?>> sources = yamlLoader.load(file.toString(), new FileSystemResource(file));
        Map<String, Object> values = new LinkedHashMap<>();
        for (PropertySource<?> source : sources) {
            if (source instanceof EnumerablePropertySource<?> enumerable) {
                for (String name : enumerable.getPropertyNames()) {
                    values.put(name, enumerable.getProperty(name));
                }
            }
        }
        return values;
    }

    private void rejectUnknownSections(Path file, Map<String, Object> values, Set<String> bound, Set<String> skipped) {
        Set<String> unknown = new TreeSet<>();
        for (String key : values.keySet()) {
            String section = rootSection(key);
            String normalized = normalize(section);
            if (!bound.contains(normalized) && !skipped.contains(normalized)) {
                unknown.add(section);
            }
        }
        if (!unknown.isEmpty()) {
            List<String> sorted = new ArrayList<>(unknown);
            throw new StrategyConfigurationException(
                    "unknown_config_section",
                    "Unknown configuration section(s) " + sorted + " in " + file
            );
        }
    }

    private void putSections(Map<String, Object> merged, String prefix, Map<String, Object> values, Set<String> bound) {
        values.forEach((key, value) -> {
            if (bound.contains(normalize(rootSection(key)))) {
                merged.put(prefix + key, value);
            }
        });
    }

    private void logSkippedSections(Path file, Map<String, Object> values, Set<String> skipped) {
        Set<String> present = new TreeSet<>();
        for (String key : values.keySet()) {
            String section = rootSection(key);
            if (skipped.contains(normalize(section))) {
                present.add(section);
            }
        }
        if (!present.isEmpty()) {
            log.info("event=config_sections_skipped file={} sections={}", file, present);
        }
    }

    private void warnUnrecognizedKeys(MapConfigurationPropertySource source, BoundNameRecorder recorder) {
        Set<String> unrecognized = new TreeSet<>();
        for (ConfigurationPropertyName name : source) {
            if (!recorder.isBound(name)) {
                unrecognized.add(name.toString().substring(StrategyProperties.PREFIX.length() + 1));
            }
        }
        if (!unrecognized.isEmpty()) {
            log.warn("event=config_keys_unrecognized keys={} effect=ignored", unrecognized);
        }
    }

    private String rootSection(String key) {
        int dot = key.indexOf('.');
        String head = dot < 0 ? key : key.substring(0, dot);
        int bracket = head.indexOf('[');
        return bracket < 0 ? head : head.substring(0, bracket);
    }

    private String normalize(String section) {
        return section.replace("-", "").replace("_", "").toLowerCase(Locale.ROOT);
    }

    /**
     * Remembers every property name that produced a value, so leftover source keys can be reported.
     */
    private static final class BoundNameRecorder extends AbstractBindHandler {

        private final List<ConfigurationPropertyName> boundNames = new ArrayList<>();

        @Override
        public Object onSuccess(ConfigurationPropertyName name, Bindable<?> target, BindContext context, Object result) {
            boundNames.add(name);
            return super.onSuccess(name, target, context, result);
        }

        boolean isBound(ConfigurationPropertyName name) {
            return boundNames.stream().anyMatch(name::equals);
        }
    }
}
