package org.carball.bowling.scenario;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Named canned games, kept in the order they were declared.
 */
@Slf4j
public class ScenarioCatalog {

    public static final String DEFAULT_RESOURCE = "scenarios.yml";

    private final Map<String, Scenario> scenarios = new LinkedHashMap<>();

    public ScenarioCatalog(List<Scenario> scenarios) {
        for (Scenario scenario : scenarios) {
            if (scenario.getName() == null || scenario.getName().isBlank()) {
                throw new IllegalArgumentException("Scenario name must not be empty");
            }
            String key = normalize(scenario.getName());
            if (this.scenarios.putIfAbsent(key, scenario) != null) {
                throw new IllegalArgumentException("Duplicate scenario: " + scenario.getName());
            }
        }
    }

    /**
     * Loads the scenarios bundled with the application.
     */
    public static ScenarioCatalog loadDefault() {
        try {
            return loadResource(DEFAULT_RESOURCE);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load bundled scenarios", e);
        }
    }

    public static ScenarioCatalog loadResource(String resource) throws IOException {
        try (InputStream in = ScenarioCatalog.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IOException("Scenario resource not found on classpath: " + resource);
            }
            return load(in);
        }
    }

    public static ScenarioCatalog load(InputStream in) throws IOException {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        mapper.disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT);

        List<Scenario> loaded = mapper.readValue(in, new TypeReference<List<Scenario>>() {});
        log.debug("Loaded {} scenarios", loaded.size());
        return new ScenarioCatalog(loaded);
    }

    public Scenario get(String name) {
        Scenario scenario = name == null ? null : scenarios.get(normalize(name));
        if (scenario == null) {
            throw new IllegalArgumentException("Unknown scenario: " + name);
        }
        return scenario;
    }

    /**
     * Resolves a comma-separated selection, or {@code all}, into scenarios in the
     * order they were asked for.
     */
    public List<Scenario> select(String selection) {
        if (selection == null || selection.isBlank() || selection.trim().equalsIgnoreCase("all")) {
            return getAll();
        }

        List<Scenario> selected = new ArrayList<>();
        for (String name : selection.split(",")) {
            if (!name.isBlank()) {
                selected.add(get(name.trim()));
            }
        }
        return selected;
    }

    public List<Scenario> getAll() {
        return Collections.unmodifiableList(new ArrayList<>(scenarios.values()));
    }

    public List<String> getNames() {
        List<String> names = new ArrayList<>();
        scenarios.values().forEach(s -> names.add(s.getName()));
        return names;
    }

    public int size() {
        return scenarios.size();
    }

    private static String normalize(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
