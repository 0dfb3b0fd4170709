package com.proxynode.core.node;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import com.proxynode.core.exceptions.ConfigException;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads start requests stored as JSON or YAML documents.
 */
public final class StartRequestReader {

    private StartRequestReader() {
    }

    /**
     * @param path JSON or YAML file.
     * @return The parsed request.
     * @throws ConfigException if the file is missing, unreadable or malformed.
     */
    public static StartRequest read(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new ConfigException("Start request file not found: " + path);
        }
        try (InputStream is = Files.newInputStream(path)) {
            return StartRequest.fromMap(load(is, path.toString()));
        } catch (IOException e) {
            throw new ConfigException("Error reading start request: " + path, e);
        }
    }

    /**
     * @param document JSON or YAML text.
     * @return The parsed request.
     * @throws ConfigException if the document is malformed.
     */
    public static StartRequest parse(String document) {
        Object loaded;
        try {
            loaded = newYaml().load(document);
        } catch (YAMLException e) {
            throw new ConfigException("Invalid start request: " + e.getMessage(), e);
        }
        return StartRequest.fromMap(asMap(loaded, "document"));
    }

    private static Map<?, ?> load(InputStream is, String source) {
        try {
            return asMap(newYaml().load(is), source);
        } catch (YAMLException e) {
            throw new ConfigException("Invalid start request in " + source + ": " + e.getMessage(), e);
        }
    }

    private static Map<?, ?> asMap(Object loaded, String source) {
        if (!(loaded instanceof Map<?, ?> map)) {
            throw new ConfigException("Start request in " + source + " must be an object");
        }
        return map;
    }

    private static Yaml newYaml() {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        return new Yaml(options);
    }
}
