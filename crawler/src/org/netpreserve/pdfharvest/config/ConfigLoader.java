package org.netpreserve.pdfharvest.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.netpreserve.pdfharvest.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Reads job files, layering them over the bundled defaults.yaml and checking the result.
 */
public class ConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final Duration MIN_TIMEOUT = Duration.ofMillis(1000);
    private static final String DEFAULT_USER_AGENT = "pdfharvest";

    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory())
            .findAndRegisterModules()
            .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    private final JsonNode defaults;

    public ConfigLoader() {
        try (InputStream stream = Objects.requireNonNull(ConfigLoader.class.getResourceAsStream("defaults.yaml"),
                "missing defaults.yaml")) {
            defaults = mapper.readTree(stream);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public JobConfig load(Path file) throws ConfigException {
        JsonNode tree;
        try {
            tree = mapper.readTree(file.toFile());
        } catch (IOException e) {
            throw new ConfigException("Unable to read " + file + ": " + e.getMessage(), e);
        }
        return fromTree(tree, file.toString());
    }

    public JobConfig parse(String yaml) throws ConfigException {
        JsonNode tree;
        try {
            tree = mapper.readTree(yaml);
        } catch (JsonProcessingException e) {
            throw new ConfigException("Malformed YAML: " + e.getOriginalMessage(), e);
        }
        return fromTree(tree, "<inline>");
    }

    public String dump(JobConfig config) throws JsonProcessingException {
        return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
    }

    private JobConfig fromTree(JsonNode tree, String source) throws ConfigException {
        if (tree == null || !tree.isObject()) {
            throw new ConfigException(source + ": expected a mapping of options");
        }
        JobConfig config;
        try {
            config = mapper.treeToValue(deepMerge(defaults, tree), JobConfig.class);
        } catch (JsonProcessingException e) {
            throw new ConfigException(source + ": " + e.getOriginalMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new ConfigException(source + ": " + e.getMessage(), e);
        }
        return validate(config, source);
    }

    static JobConfig validate(JobConfig config, String source) throws ConfigException {
        Url startUrl = config.startUrl();
        if (startUrl == null || startUrl.toString().isBlank()) {
            throw new ConfigException(source + ": start_url is required");
        }
        if (!startUrl.isHttp() || startUrl.host() == null) {
            throw new ConfigException(source + ": start_url is not an http(s) URL: " + startUrl);
        }
        if (config.outputDir() == null) throw new ConfigException(source + ": output_dir is required");
        if (config.historyPath() == null) throw new ConfigException(source + ": history_path is required");

        int concurrency = atLeast("concurrency", config.concurrency(), 1);
        int maxDepth = atLeast("max_depth", config.maxDepth(), 1);
        int noNewLimit = atLeast("no_new_limit", config.noNewLimit(), 1);

        Duration timeout = config.timeout();
        if (timeout == null || timeout.compareTo(MIN_TIMEOUT) < 0) {
            log.warn("timeout {} is below the minimum, using {}ms", timeout, MIN_TIMEOUT.toMillis());
            timeout = MIN_TIMEOUT;
        }
        double delay = config.delay();
        if (delay < 0 || Double.isNaN(delay)) {
            log.warn("delay {} is negative, using 0", delay);
            delay = 0;
        }

        List<String> prefixes = config.prefixes() == null ? List.of() : config.prefixes().stream()
                .filter(prefix -> prefix != null && !prefix.isBlank())
                .toList();
        RefreshMode refreshMode = config.refreshMode() == null ? RefreshMode.NONE : config.refreshMode();
        String userAgent = config.userAgent() == null || config.userAgent().isBlank() ?
                DEFAULT_USER_AGENT : config.userAgent();
        Duration settle = nonNegative(config.settle());
        Duration backoff = nonNegative(config.backoff());
        BrowserConfig browser = config.browser() == null ? BrowserConfig.defaults() : config.browser();

        return new JobConfig(startUrl.withoutFragment(), config.outputDir(), config.historyPath(), concurrency,
                maxDepth, timeout, delay, prefixes, refreshMode, config.obeyRobots(), noNewLimit,
                config.dealCookie(), config.verbose(), userAgent, settle, backoff, browser);
    }

    private static int atLeast(String name, int value, int minimum) {
        if (value < minimum) {
            log.warn("{} {} is below the minimum, using {}", name, value, minimum);
            return minimum;
        }
        return value;
    }

    private static Duration nonNegative(Duration duration) {
        if (duration == null || duration.isNegative()) return Duration.ZERO;
        return duration;
    }

    static JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (!base.isObject() || !override.isObject()) {
            // for simple values or arrays, always take override
            return override;
        }
        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry -> {
            String key = entry.getKey();
            JsonNode overrideValue = entry.getValue();
            if (merged.has(key)) {
                merged.set(key, deepMerge(merged.get(key), overrideValue));
            } else {
                merged.set(key, overrideValue);
            }
        });
        return merged;
    }
}
