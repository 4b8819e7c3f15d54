package com.infomedia.abacox.cdrexception.component.configmanager;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CauseCodeServiceTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldLoadBundledDescriptions() {
        CauseCodeService service = new CauseCodeService("");
        service.loadDescriptions();

        assertThat(service.getDescription(41)).isEqualTo("Temporary failure");
        assertThat(service.getDescription(16)).isEqualTo("Normal call clearing");
        assertThat(service.getDescription(393216)).startsWith("Call split");
    }

    @Test
    void shouldDescribeUnknownAndMissingCodesWithoutExplicitLoad() {
        CauseCodeService service = new CauseCodeService("");

        assertThat(service.getDescription(424242)).isEqualTo("Unknown cause code");
        assertThat(service.getDescription(null)).isEmpty();
    }

    @Test
    void shouldLoadExternalFile() throws IOException {
        Path file = tempDir.resolve("codes.json");
        Files.writeString(file, "{\"41\": \"Temp fail\", \" 58 \": \"Bearer\"}");

        CauseCodeService service = new CauseCodeService(file.toString());
        service.loadDescriptions();

        assertThat(service.getDescriptions()).containsOnlyKeys(41, 58);
        assertThat(service.getDescription(58)).isEqualTo("Bearer");
    }

    @Test
    void shouldRejectEmptyMissingOrInvalidFiles() throws IOException {
        Path empty = tempDir.resolve("empty.json");
        Files.writeString(empty, "{}");
        Path invalid = tempDir.resolve("invalid.json");
        Files.writeString(invalid, "{\"forty-one\": \"x\"}");

        assertThatThrownBy(() -> new CauseCodeService(empty.toString()).loadDescriptions())
                .isInstanceOf(ConfigurationException.class).hasMessageContaining("is empty");
        assertThatThrownBy(() -> new CauseCodeService(invalid.toString()).loadDescriptions())
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> new CauseCodeService(tempDir.resolve("missing.json").toString()).loadDescriptions())
                .isInstanceOf(ConfigurationException.class);
    }
}
