package mycompany.heightchange.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.UnrecognizedPropertyException;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import mycompany.heightchange.change.Metric;
import mycompany.heightchange.change.MetricConfig;
import mycompany.heightchange.change.PixelThreshold;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads a YAML run configuration and validates it into a {@link CompareConfig}.
 * Unknown keys and missing required keys are rejected here, before any tile is touched.
 */
public class ConfigLoader {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConfigLoader.class);

    private final ObjectMapper mapper;

    public ConfigLoader() {
        this.mapper = new ObjectMapper(new YAMLFactory())
                .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES);
    }

    public CompareConfig load(Path file) throws ConfigException {
        if (!Files.isRegularFile(file)) {
            throw new ConfigException("Configuration file not found: " + file, null);
        }
        try (InputStream in = Files.newInputStream(file)) {
            CompareConfig config = load(in, file.toString());
            LOGGER.info("Loaded configuration {} (metrics {})", file, config.getMetrics());
            return config;
        } catch (IOException ex) {
            throw new ConfigException("Cannot read configuration " + file + ": " + ex.getMessage(), ex);
        }
    }

    /**
     * Parse and validate a configuration read from a stream.
     *
     * @param source name used in error messages
     */
    public CompareConfig load(InputStream in, String source) throws ConfigException, IOException {
        Settings settings;
        try {
            settings = mapper.readValue(in, Settings.class);
        } catch (UnrecognizedPropertyException ex) {
            throw new ConfigException("Unknown key '" + ex.getPropertyName() + "' in " + source, ex);
        } catch (JsonProcessingException ex) {
            throw new ConfigException("Malformed configuration " + source + ": " + ex.getOriginalMessage(), ex);
        }
        if (settings == null) {
            throw new ConfigException("Configuration " + source + " is empty", null);
        }
        return validate(settings);
    }

    private CompareConfig validate(Settings settings) throws ConfigException {
        List<String> problems = new ArrayList<>();

        Path referenceDir = requireDirectory("reference_dir", settings.referenceDir, problems);
        Path targetDir = requireDirectory("target_dir", settings.targetDir, problems);

        boolean copyTif = Boolean.TRUE.equals(settings.copyTif);
        boolean copyLas = Boolean.TRUE.equals(settings.copyLas);
        if (copyTif) {
            require("save_dir", settings.saveDir, "copy_tif", problems);
        }
        if (copyLas) {
            require("reference_las_dir", settings.referenceLasDir, "copy_las", problems);
            require("target_las_dir", settings.targetLasDir, "copy_las", problems);
            require("save_las_dir", settings.saveLasDir, "copy_las", problems);
        }

        int threads = settings.threads == null ? 0 : settings.threads;
        if (threads < 0) {
            problems.add("threads must be 0 (all processors) or positive, got " + threads);
        }

        if (settings.changeList != null && settings.changeList.isBlank()) {
            problems.add("change_list must not be blank");
        }

        MetricConfig metrics = toMetrics(settings.metrics, problems);

        if (!problems.isEmpty()) {
            throw new ConfigException(problems);
        }

        return CompareConfig.builder()
                .referenceDir(referenceDir)
                .targetDir(targetDir)
                .saveDir(toPath(settings.saveDir))
                .referenceLasDir(toPath(settings.referenceLasDir))
                .targetLasDir(toPath(settings.targetLasDir))
                .saveLasDir(toPath(settings.saveLasDir))
                .copyTif(copyTif)
                .copyLas(copyLas)
                .threads(threads)
                .changeList(settings.changeList == null
                        ? Paths.get(CompareConfig.DEFAULT_CHANGE_LIST) : Paths.get(settings.changeList))
                .metrics(metrics)
                .build();
    }

    private static MetricConfig toMetrics(MetricSettings settings, List<String> problems) {
        if (settings == null) {
            problems.add("metrics is required");
            return null;
        }
        MetricConfig.Builder builder = MetricConfig.builder();
        if (settings.mean != null) builder.mean(settings.mean);
        if (settings.maxima != null) builder.maxima(settings.maxima);
        if (settings.sum != null) builder.sum(settings.sum);
        PixelThreshold count = toPair(Metric.COUNT_LARGER_THAN, settings.countLargerThan, problems);
        if (count != null) builder.pixel(Metric.COUNT_LARGER_THAN, count);
        PixelThreshold percentage = toPair(Metric.PERCENTAGE_LARGER_THAN, settings.percentageLargerThan, problems);
        if (percentage != null) builder.pixel(Metric.PERCENTAGE_LARGER_THAN, percentage);

        MetricConfig metrics = builder.build();
        if (metrics.isEmpty()) {
            problems.add("metrics must configure at least one of mean, maxima, sum, "
                    + "count_larger_than, percentage_larger_than");
        }
        return metrics;
    }

    private static PixelThreshold toPair(Metric metric, List<Double> values, List<String> problems) {
        if (values == null) {
            return null;
        }
        if (values.size() != 2 || values.contains(null)) {
            problems.add(metric + " must be a [value, limit] pair, got " + values);
            return null;
        }
        return new PixelThreshold(values.get(0), values.get(1));
    }

    private static Path requireDirectory(String key, String value, List<String> problems) {
        if (value == null || value.isBlank()) {
            problems.add(key + " is required");
            return null;
        }
        Path path = Paths.get(value);
        if (!Files.isDirectory(path)) {
            problems.add(key + " is not a directory: " + value);
        }
        return path;
    }

    private static void require(String key, String value, String reason, List<String> problems) {
        if (value == null || value.isBlank()) {
            problems.add(key + " is required when " + reason + " is enabled");
        }
    }

    private static Path toPath(String value) {
        return value == null || value.isBlank() ? null : Paths.get(value);
    }

    /** Raw YAML document. */
    static class Settings {
        @JsonProperty("reference_dir")
        String referenceDir;
        @JsonProperty("target_dir")
        String targetDir;
        @JsonProperty("save_dir")
        String saveDir;
        @JsonProperty("reference_las_dir")
        String referenceLasDir;
        @JsonProperty("target_las_dir")
        String targetLasDir;
        @JsonProperty("save_las_dir")
        String saveLasDir;
        @JsonProperty("copy_tif")
        Boolean copyTif;
        @JsonProperty("copy_las")
        Boolean copyLas;
        @JsonProperty("threads")
        Integer threads;
        @JsonProperty("change_list")
        String changeList;
        @JsonProperty("metrics")
        MetricSettings metrics;
    }

    static class MetricSettings {
        @JsonProperty("mean")
        Double mean;
        @JsonProperty("maxima")
        Double maxima;
        @JsonProperty("sum")
        Double sum;
        @JsonProperty("count_larger_than")
        List<Double> countLargerThan;
        @JsonProperty("percentage_larger_than")
        List<Double> percentageLargerThan;
    }
}
