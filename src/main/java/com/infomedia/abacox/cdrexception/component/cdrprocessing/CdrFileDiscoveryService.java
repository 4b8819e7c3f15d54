package com.infomedia.abacox.cdrexception.component.cdrprocessing;

import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

@Service
@Log4j2
public class CdrFileDiscoveryService {

    private static final List<String> FLAT_FILE_PREFIXES = List.of("cdr_", "cmr_");

    /**
     * Lists the CDR/CMR export files of a directory in lexical file-name order, the order in which
     * they must be ingested for duplicate resolution to be reproducible.
     *
     * @throws CdrProcessingException if the directory does not exist or cannot be listed.
     */
    public List<Path> discover(Path directory) {
        if (directory == null || !Files.isDirectory(directory)) {
            throw new CdrProcessingException("Input directory does not exist: " + directory);
        }
        try (Stream<Path> entries = Files.list(directory)) {
            List<Path> files = entries
                    .filter(Files::isRegularFile)
                    .filter(this::isExportFile)
                    .sorted(Comparator.comparing(path -> path.getFileName().toString()))
                    .toList();
            log.info("Found {} export file(s) in {}", files.size(), directory);
            return files;
        } catch (IOException e) {
            throw new CdrProcessingException("Unable to list input directory: " + directory, e);
        }
    }

    boolean isExportFile(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".csv") || FLAT_FILE_PREFIXES.stream().anyMatch(name::startsWith);
    }
}
