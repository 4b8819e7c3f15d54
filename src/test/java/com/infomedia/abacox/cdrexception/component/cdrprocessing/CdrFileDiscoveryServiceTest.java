package com.infomedia.abacox.cdrexception.component.cdrprocessing;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CdrFileDiscoveryServiceTest {

    @TempDir
    Path tempDir;

    private final CdrFileDiscoveryService discoveryService = new CdrFileDiscoveryService();

    @Test
    void shouldListExportFilesInLexicalOrder() throws IOException {
        Files.createFile(tempDir.resolve("cmr_StandAloneCluster_01_202311141001_2"));
        Files.createFile(tempDir.resolve("b_export.CSV"));
        Files.createFile(tempDir.resolve("cdr_StandAloneCluster_01_202311141000_1"));
        Files.createFile(tempDir.resolve("a_export.csv"));
        Files.createFile(tempDir.resolve("readme.txt"));
        Files.createDirectory(tempDir.resolve("cdr_archive"));

        List<Path> files = discoveryService.discover(tempDir);

        assertThat(files).extracting(path -> path.getFileName().toString()).containsExactly(
                "a_export.csv",
                "b_export.CSV",
                "cdr_StandAloneCluster_01_202311141000_1",
                "cmr_StandAloneCluster_01_202311141001_2");
    }

    @Test
    void shouldReturnEmptyListForEmptyDirectory() {
        assertThat(discoveryService.discover(tempDir)).isEmpty();
    }

    @Test
    void shouldFailForMissingDirectory() {
        assertThatThrownBy(() -> discoveryService.discover(tempDir.resolve("nope")))
                .isInstanceOf(CdrProcessingException.class)
                .hasMessageContaining("does not exist");
    }
}
