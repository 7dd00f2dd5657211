package com.reviewengine.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * BuiltinNames - the read-only set of Python built-in identifiers.
 *
 * Loaded once from a classpath resource with one name per line ('#' starts a
 * comment). Names in this set are never reported as undefined.
 */
@Component
public class BuiltinNames {

    private static final Logger log = LoggerFactory.getLogger(BuiltinNames.class);

    public static final String DEFAULT_RESOURCE = "python-builtins.txt";

    private final Set<String> names;

    public BuiltinNames(
        @Value("${code-review.scope.builtins-resource:" + DEFAULT_RESOURCE + "}") String resource
    ) {
        this.names = load(resource);
        log.info("[BuiltinNames] Loaded {} built-in names from {}", names.size(), resource);
    }

    public static BuiltinNames defaults() {
        return new BuiltinNames(DEFAULT_RESOURCE);
    }

    public Set<String> getNames() {
        return names;
    }

    public boolean contains(String name) {
        return names.contains(name);
    }

    private static Set<String> load(String resource) {
        ClassLoader loader = BuiltinNames.class.getClassLoader();
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Built-in names resource not found: " + resource);
            }
            Set<String> loaded = new LinkedHashSet<>();
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    int comment = line.indexOf('#');
                    String name = (comment >= 0 ? line.substring(0, comment) : line).trim();
                    if (!name.isEmpty()) {
                        loaded.add(name);
                    }
                }
            }
            return Collections.unmodifiableSet(loaded);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read built-in names from " + resource, e);
        }
    }
}
