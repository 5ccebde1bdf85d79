package com.augment.config;

import com.augment.core.OperationSpec;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

/** JSON loader for run configurations. */
public final class AugmentConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(AugmentConfigLoader.class);
    private static final ObjectMapper M = new ObjectMapper();

    public static final int DEFAULT_QUEUE_CAPACITY = 128;
    public static final int DEFAULT_PROGRESS_INTERVAL = 7;
    public static final String DEFAULT_FORMAT = "png";

    private AugmentConfigLoader() {}

    public static AugmentConfig load(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return load(in);
        } catch (NoSuchFileException e) {
            throw new ConfigurationException("Cannot open config file: " + path, e);
        }
    }

    public static AugmentConfig load(InputStream in) throws IOException {
        JsonNode root;
        try {
            root = M.readTree(in);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Malformed config: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) throw new ConfigurationException("Config root must be a JSON object");

        Path outputDir = Path.of(text(req(root, "output_dir"), "output_dir"));

        Path inputDir = null;
        if (root.hasNonNull("input_dir")) inputDir = Path.of(text(root.get("input_dir"), "input_dir"));

        List<String> imagePaths = new ArrayList<>();
        JsonNode paths = root.path("image_paths");
        if (!paths.isMissingNode() && !paths.isNull()) {
            if (!paths.isArray()) throw new ConfigurationException("image_paths must be an array");
            for (JsonNode p : paths) imagePaths.add(text(p, "image_paths[]"));
        }
        if (inputDir == null && imagePaths.isEmpty()) {
            throw new ConfigurationException("Either input_dir or a non-empty image_paths is required");
        }

        int iterations = clamp("iterations", integer(root, "iterations", 1), 1);
        int threads = clamp("num_threads", integer(root, "num_threads", Runtime.getRuntime().availableProcessors()), 1);
        int capacity = integer(root, "queue_capacity", DEFAULT_QUEUE_CAPACITY);
        if (capacity < 1) {
            log.warn("queue_capacity {} is below 1, using {}", capacity, DEFAULT_QUEUE_CAPACITY);
            capacity = DEFAULT_QUEUE_CAPACITY;
        }
        int progress = clamp("progress_interval", integer(root, "progress_interval", DEFAULT_PROGRESS_INTERVAL), 1);

        boolean verbose = bool(root, "verbose");
        boolean saveHistory = bool(root, "save_history");
        String format = root.hasNonNull("output_format") ? text(root.get("output_format"), "output_format") : DEFAULT_FORMAT;
        if (format.isBlank()) throw new ConfigurationException("output_format must not be blank");

        long seed;
        if (root.hasNonNull("seed")) {
            JsonNode s = root.get("seed");
            if (!s.canConvertToLong() || !s.isIntegralNumber()) throw new ConfigurationException("seed must be an integer");
            seed = s.asLong();
        } else {
            seed = ThreadLocalRandom.current().nextLong();
            log.info("No seed configured, using {}", seed);
        }

        List<OperationSpec> pipeline = pipeline(req(root, "pipeline"));

        return new AugmentConfig(outputDir, inputDir, imagePaths, iterations, threads, capacity, verbose, seed,
            saveHistory, format, progress, pipeline);
    }

    private static List<OperationSpec> pipeline(JsonNode arr) throws ConfigurationException {
        if (!arr.isArray() || arr.isEmpty()) throw new ConfigurationException("pipeline must be a non-empty array");
        List<OperationSpec> specs = new ArrayList<>();
        int index = 0;
        for (JsonNode entry : arr) {
            String where = "pipeline[" + index++ + "]";
            if (!entry.isObject()) throw new ConfigurationException(where + " must be an object");
            String name = text(req(entry, "name"), where + ".name");

            List<Double> params = new ArrayList<>();
            JsonNode p = entry.path("params");
            if (!p.isMissingNode() && !p.isNull()) {
                if (!p.isArray()) throw new ConfigurationException(where + ".params must be an array");
                for (JsonNode v : p) {
                    if (!v.isNumber()) throw new ConfigurationException(where + ".params must hold numbers, got " + v);
                    params.add(v.asDouble());
                }
            }

            double prob = 1.0;
            if (entry.hasNonNull("prob")) {
                JsonNode pr = entry.get("prob");
                if (!pr.isNumber()) throw new ConfigurationException(where + ".prob must be a number");
                prob = pr.asDouble();
                if (!(prob >= 0.0 && prob <= 1.0)) {
                    throw new ConfigurationException(where + ".prob must be within [0, 1], got " + prob);
                }
            }
            specs.add(new OperationSpec(name, params, prob));
        }
        return specs;
    }

    private static int integer(JsonNode root, String field, int dflt) throws ConfigurationException {
        if (!root.hasNonNull(field)) return dflt;
        JsonNode n = root.get(field);
        if (!n.isIntegralNumber() || !n.canConvertToInt()) throw new ConfigurationException(field + " must be an integer");
        return n.asInt();
    }

    private static int clamp(String field, int value, int min) {
        if (value >= min) return value;
        log.warn("{} {} is below {}, clamping", field, value, min);
        return min;
    }

    private static boolean bool(JsonNode root, String field) throws ConfigurationException {
        if (!root.hasNonNull(field)) return false;
        JsonNode n = root.get(field);
        if (!n.isBoolean()) throw new ConfigurationException(field + " must be a boolean");
        return n.asBoolean();
    }

    private static String text(JsonNode n, String field) throws ConfigurationException {
        if (!n.isTextual() || n.asText().isBlank()) throw new ConfigurationException(field + " must be a non-empty string");
        return n.asText();
    }

    private static JsonNode req(JsonNode n, String field) throws ConfigurationException {
        if (!n.hasNonNull(field)) throw new ConfigurationException("Missing required field: " + field);
        return n.get(field);
    }
}
