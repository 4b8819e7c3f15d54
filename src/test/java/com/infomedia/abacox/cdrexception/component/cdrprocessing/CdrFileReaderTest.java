package com.infomedia.abacox.cdrexception.component.cdrprocessing;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;

import static com.infomedia.abacox.cdrexception.testsupport.CallFixtures.CDR_HEADER;
import static com.infomedia.abacox.cdrexception.testsupport.CallFixtures.CMR_HEADER;
import static com.infomedia.abacox.cdrexception.testsupport.CallFixtures.ORIGINATION_EPOCH;
import static com.infomedia.abacox.cdrexception.testsupport.CallFixtures.cdrRow;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CdrFileReaderTest {

    @TempDir
    Path tempDir;

    private final CiscoCmRecordParser parser = new CiscoCmRecordParser(new VqMetricsParser("MLQKav", "CCR"));

    private Path write(String name, String... lines) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, String.join("\n", lines) + "\n", StandardCharsets.UTF_8);
        return file;
    }

    private List<ParsedRecord> readAll(CdrFileReader reader) {
        List<ParsedRecord> records = new ArrayList<>();
        reader.forEachRemaining(records::add);
        return records;
    }

    @Test
    void shouldReadCdrFileLazilyAndSkipTypeDefinitionLine() throws IOException {
        // GIVEN
        Path file = write("cdr_StandAloneCluster_01_202311141000_1.csv",
                CDR_HEADER,
                "INTEGER,INTEGER,INTEGER,INTEGER,INTEGER,INTEGER,VARCHAR(50),VARCHAR(50),VARCHAR(50),INTEGER,INTEGER,VARCHAR(129),VARCHAR(129),VARCHAR(600),VARCHAR(600),INTEGER",
                cdrRow("100", ORIGINATION_EPOCH, "0", "16", "SEP1", "SEP2"),
                cdrRow("101", ORIGINATION_EPOCH, "x", "16", "SEP1", "SEP2"));

        // WHEN
        List<ParsedRecord> records;
        try (CdrFileReader reader = new CdrFileReader(file, parser)) {
            assertThat(reader.getSchema()).isEqualTo(CdrSchema.CALL_DETAIL);
            records = readAll(reader);

            // THEN
            assertThat(reader.getRowsRead()).isEqualTo(3);
            assertThat(reader.getRowsSkipped()).isEqualTo(1);
        }
        assertThat(records).hasSize(2);
        assertThat(records.get(0)).isInstanceOf(CallRecord.class);
        assertThat(records.get(0).getLineNumber()).isEqualTo(3);
        assertThat(records.get(1)).isInstanceOfSatisfying(RowParseError.class,
                error -> assertThat(error.getType()).isEqualTo(RowParseErrorType.INVALID_CAUSE_CODE));
    }

    @Test
    void shouldHandleQuotedFieldsAndByteOrderMark() throws IOException {
        String quotedHeader = "\uFEFF" + "\"" + CMR_HEADER.replace(",", "\",\"") + "\"";
        Path file = write("cmr_quoted.csv",
                quotedHeader,
                "\"2\",\"1\",\"200\",\"30\",\"SEP1\",\"MLQKav=3.9;CCR=0.001\",\"" + ORIGINATION_EPOCH + "\"");

        try (CdrFileReader reader = new CdrFileReader(file, parser)) {
            assertThat(reader.getSchema()).isEqualTo(CdrSchema.CALL_QUALITY);
            List<ParsedRecord> records = readAll(reader);

            assertThat(records).singleElement().isInstanceOfSatisfying(QualityRecord.class, record -> {
                assertThat(record.getDeviceName()).isEqualTo("SEP1");
                assertThat(record.getMetrics().avgMos()).isEqualByComparingTo("3.9");
            });
        }
    }

    @Test
    void shouldYieldNothingForUnrecognisedHeader() throws IOException {
        Path file = write("notes.csv", "name,value", "a,b");

        try (CdrFileReader reader = new CdrFileReader(file, parser)) {
            assertThat(reader.getHeader().isRecognised()).isFalse();
            assertThat(reader.hasNext()).isFalse();
            assertThatThrownBy(reader::next).isInstanceOf(NoSuchElementException.class);
        }
    }

    @Test
    void shouldYieldNothingForEmptyFile() throws IOException {
        Path file = tempDir.resolve("cdr_empty");
        Files.createFile(file);

        try (CdrFileReader reader = new CdrFileReader(file, parser)) {
            assertThat(reader.hasNext()).isFalse();
        }
    }

    @Test
    void shouldFailToOpenMissingFile() {
        assertThatThrownBy(() -> new CdrFileReader(tempDir.resolve("missing.csv"), parser))
                .isInstanceOf(IOException.class);
    }
}
