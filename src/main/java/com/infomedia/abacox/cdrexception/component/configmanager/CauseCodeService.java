package com.infomedia.abacox.cdrexception.component.configmanager;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.log4j.Log4j2;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Termination cause code descriptions, used only when presenting results.
 * Loaded from {@code cdr-exception.cause-codes-file}, or from the bundled Q.850/CUCM list when that is empty.
 */
@Service
@Log4j2
public class CauseCodeService {

    static final String BUNDLED_RESOURCE = "termination_cause_codes.json";
    private static final String UNKNOWN_DESCRIPTION = "Unknown cause code";
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private final String causeCodesFile;
    private Map<Integer, String> descriptions;

    public CauseCodeService(
            @org.springframework.beans.factory.annotation.Value("${cdr-exception.cause-codes-file:}") String causeCodesFile) {
        this.causeCodesFile = causeCodesFile;
    }

    /**
     * Loaded on first lookup.
     *
     * @throws ConfigurationException if the descriptions cannot be read, are malformed or are empty.
     */
    public void loadDescriptions() {
        Map<String, String> raw;
        try (InputStream in = openSource()) {
            raw = OBJECT_MAPPER.readValue(in, new TypeReference<Map<String, String>>() {});
        } catch (IOException e) {
            throw new ConfigurationException("Unable to load termination cause codes from " + describeSource(), e);
        }
        Map<Integer, String> parsed = new TreeMap<>();
        raw.forEach((code, description) -> {
            try {
                parsed.put(Integer.parseInt(code.trim()), description);
            } catch (NumberFormatException e) {
                throw new ConfigurationException("Cause code '" + code + "' in " + describeSource() + " is not an integer", e);
            }
        });
        if (parsed.isEmpty()) {
            throw new ConfigurationException("Unable to load termination cause codes: " + describeSource() + " is empty");
        }
        descriptions = Collections.unmodifiableMap(parsed);
        log.debug("Loaded {} cause code descriptions from {}", descriptions.size(), describeSource());
    }

    public String getDescription(Integer causeCode) {
        if (causeCode == null) {
            return "";
        }
        return getDescriptions().getOrDefault(causeCode, UNKNOWN_DESCRIPTION);
    }

    public Map<Integer, String> getDescriptions() {
        if (descriptions == null) {
            loadDescriptions();
        }
        return descriptions;
    }

    private InputStream openSource() throws IOException {
        if (causeCodesFile != null && !causeCodesFile.isBlank()) {
            return Files.newInputStream(Path.of(causeCodesFile));
        }
        ClassPathResource resource = new ClassPathResource(BUNDLED_RESOURCE);
        if (!resource.exists()) {
            throw new IOException("Classpath resource " + BUNDLED_RESOURCE + " not found");
        }
        return resource.getInputStream();
    }

    private String describeSource() {
        return causeCodesFile != null && !causeCodesFile.isBlank() ? causeCodesFile : "classpath:" + BUNDLED_RESOURCE;
    }
}
