package com.infomedia.abacox.cdrexception.component.configmanager;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Holds the raw setting values read from the JSON settings file, falling back to each key's default.
 * <p>
 * Both camelCase keys ({@code causeCodeAmberThreshold}) and the snake_case keys of earlier releases
 * ({@code cause_code_amber_threshold}) are accepted. Array values are joined with commas.
 */
@Service
@Log4j2
public class ConfigValueService {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private final Path settingsFile;
    private final Map<String, String> overrides = new HashMap<>();
    private boolean loaded;

    public ConfigValueService(
            @org.springframework.beans.factory.annotation.Value("${cdr-exception.settings-file:exception_settings.json}") String settingsFile) {
        this.settingsFile = Path.of(settingsFile);
    }

    /**
     * Reads the settings file. Called on first {@link #getValue(ConfigKey)}.
     *
     * @throws ConfigurationException if the file exists but cannot be read or is not a JSON object.
     */
    public void loadOverrides() {
        overrides.clear();
        if (!Files.exists(settingsFile)) {
            log.warn("Settings file {} not found, using default thresholds", settingsFile.toAbsolutePath());
            loaded = true;
            return;
        }
        JsonNode root;
        try {
            root = OBJECT_MAPPER.readTree(Files.readString(settingsFile));
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Unable to parse " + settingsFile, e);
        } catch (IOException e) {
            throw new ConfigurationException("Unable to open " + settingsFile, e);
        }
        if (root == null || !root.isObject()) {
            throw new ConfigurationException("Settings file " + settingsFile + " must contain a JSON object");
        }
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            overrides.put(field.getKey(), asText(field.getValue()));
        }
        loaded = true;
        log.info("Loaded {} setting(s) from {}", overrides.size(), settingsFile);
    }

    public Value getValue(ConfigKey configKey) {
        if (!loaded) {
            loadOverrides();
        }
        String raw = overrides.get(configKey.getKey());
        if (raw == null) {
            raw = overrides.get(configKey.getLegacyKey());
        }
        if (raw == null) {
            raw = configKey.getDefaultValue();
        }
        return new Value(configKey.getKey(), raw);
    }

    public Path getSettingsFile() {
        return settingsFile;
    }

    private static String asText(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isArray()) {
            StringJoiner joiner = new StringJoiner(",");
            node.forEach(element -> joiner.add(element.asText()));
            return joiner.toString();
        }
        return node.asText();
    }
}
