package org.impactengine.utils;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.nodes.Tag;
import org.yaml.snakeyaml.representer.Representer;
import org.yaml.snakeyaml.resolver.Resolver;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * JSON and YAML conversion between bytes and plain {@code Map}/{@code List} trees.
 * <p>
 * YAML is read without implicit timestamp resolution: {@code 2024-01-01} stays the string
 * {@code "2024-01-01"}, which is how every date travels through the pipeline.
 * <p>
 * Thread-safe: the Jackson mapper is shared; a new SnakeYAML instance is created per call
 * because {@link Yaml} is not thread-safe.
 */
public final class DocumentCodec {

    private static final ObjectMapper JSON = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private DocumentCodec() {
        // Utility class - prevent instantiation
    }

    /**
     * Parses a JSON object.
     *
     * @throws IOException if the bytes are not a JSON object
     */
    public static Map<String, Object> parseJson(byte[] bytes) throws IOException {
        Map<String, Object> result = JSON.readValue(bytes, MAP_TYPE);
        if (result == null) {
            throw new IOException("JSON document is empty");
        }
        return result;
    }

    /**
     * Parses a YAML mapping.
     *
     * @throws IOException if the bytes are not a YAML mapping
     */
    public static Map<String, Object> parseYaml(byte[] bytes) throws IOException {
        Object document;
        try {
            document = newLoader().load(new String(bytes, StandardCharsets.UTF_8));
        } catch (YAMLException e) {
            throw new IOException("Invalid YAML: " + e.getMessage(), e);
        }
        if (!(document instanceof Map)) {
            throw new IOException("YAML document must be a mapping, got "
                + (document == null ? "an empty document" : document.getClass().getSimpleName()));
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> map = (Map<String, Object>) document;
        return map;
    }

    public static byte[] toJson(Object value) throws JsonProcessingException {
        return JSON.writeValueAsBytes(value);
    }

    public static byte[] toYaml(Map<String, ?> value) {
        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        options.setIndent(2);
        return new Yaml(options).dump(value).getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Returns a deep copy of a map tree with every nested map's keys sorted.
     * Used wherever a document must render byte-identically across runs.
     */
    public static Map<String, Object> sorted(Map<String, ?> tree) {
        Map<String, Object> result = new TreeMap<>();
        for (Map.Entry<String, ?> entry : tree.entrySet()) {
            result.put(entry.getKey(), sortedValue(entry.getValue()));
        }
        return result;
    }

    @SuppressWarnings("unchecked")
    private static Object sortedValue(Object value) {
        if (value instanceof Map) {
            return sorted((Map<String, ?>) value);
        }
        if (value instanceof List) {
            List<Object> copy = new ArrayList<>();
            for (Object element : (List<?>) value) {
                copy.add(sortedValue(element));
            }
            return copy;
        }
        return value;
    }

    public static ObjectMapper jsonMapper() {
        return JSON;
    }

    private static Yaml newLoader() {
        LoaderOptions loaderOptions = new LoaderOptions();
        DumperOptions dumperOptions = new DumperOptions();
        return new Yaml(new SafeConstructor(loaderOptions), new Representer(dumperOptions),
            dumperOptions, loaderOptions, new NoTimestampResolver());
    }

    /**
     * Standard YAML 1.1 resolver minus implicit timestamps.
     */
    private static final class NoTimestampResolver extends Resolver {
        @Override
        protected void addImplicitResolvers() {
            addImplicitResolver(Tag.BOOL, BOOL, "yYnNtTfFoO");
            addImplicitResolver(Tag.INT, INT, "-+0123456789");
            addImplicitResolver(Tag.FLOAT, FLOAT, "-+0123456789.");
            addImplicitResolver(Tag.MERGE, MERGE, "<");
            addImplicitResolver(Tag.NULL, NULL, "~nN\0");
            addImplicitResolver(Tag.NULL, EMPTY, null);
        }
    }
}
