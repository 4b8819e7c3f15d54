package com.infomedia.abacox.cdrexception.component.cdrprocessing;

import com.opencsv.CSVParser;
import com.opencsv.CSVParserBuilder;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvValidationException;
import lombok.extern.log4j.Log4j2;

import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Reads one CDR or CMR export lazily, one row at a time, yielding a parsed record per data row.
 * <p>
 * The header is read when the reader is opened and decides the schema for every row of the file.
 * The sequence is finite and cannot be restarted. Read errors after opening surface as
 * {@link UncheckedIOException} from {@link #hasNext()}.
 */
@Log4j2
public class CdrFileReader implements Iterator<ParsedRecord>, Closeable {

    private final CSVReader csvReader;
    private final CiscoCmRecordParser parser;
    private final String sourceName;
    private final CdrHeader header;

    private ParsedRecord nextRecord;
    private boolean exhausted;
    private long rowsRead;
    private long rowsSkipped;

    /**
     * Opens the file and reads its header.
     *
     * @throws IOException if the file cannot be opened or its header cannot be read.
     */
    public CdrFileReader(Path file, CiscoCmRecordParser parser) throws IOException {
        this.parser = parser;
        this.sourceName = file.getFileName().toString();

        CSVParser csvParser = new CSVParserBuilder()
                .withSeparator(',')
                .withIgnoreQuotations(false)
                .withQuoteChar('"')
                .withEscapeChar(CSVParser.NULL_CHARACTER)
                .build();

        this.csvReader = new CSVReaderBuilder(Files.newBufferedReader(file, StandardCharsets.UTF_8))
                .withCSVParser(csvParser)
                .withSkipLines(0)
                .build();

        try {
            this.header = readHeader();
        } catch (IOException | RuntimeException e) {
            csvReader.close();
            throw e;
        }
        if (header.isRecognised()) {
            log.info("Loading {} file: {}", header.getSchema().getShortName(), sourceName);
        } else {
            log.warn("File {} has no CDR or CMR header, skipping it", sourceName);
            exhausted = true;
        }
    }

    private CdrHeader readHeader() throws IOException {
        try {
            String[] fields;
            while ((fields = csvReader.readNext()) != null) {
                if (!CdrUtil.isBlankRow(fields)) {
                    return CdrHeader.parse(fields);
                }
            }
            return CdrHeader.parse(new String[0]);
        } catch (CsvValidationException e) {
            throw new IOException("Failed to parse CSV header of " + sourceName, e);
        }
    }

    @Override
    public boolean hasNext() {
        if (nextRecord != null) return true;
        if (exhausted) return false;
        try {
            while (true) {
                String[] fields;
                try {
                    fields = csvReader.readNext();
                } catch (CsvValidationException e) {
                    // The row is unusable but the reader can continue with the next one
                    rowsRead++;
                    nextRecord = malformedRow(e);
                    return true;
                }
                if (fields == null) break;
                rowsRead++;
                if (parser.isSkippableRow(fields, header)) {
                    rowsSkipped++;
                    continue;
                }
                nextRecord = parser.parse(fields, header, sourceName, csvReader.getLinesRead());
                return true;
            }
        } catch (IOException e) {
            exhausted = true;
            throw new UncheckedIOException("Error reading " + sourceName + " after line " + csvReader.getLinesRead(), e);
        }
        exhausted = true;
        return false;
    }

    private RowParseError malformedRow(CsvValidationException e) {
        log.debug("Malformed CSV row in {} at line {}: {}", sourceName, csvReader.getLinesRead(), e.getMessage());
        return RowParseError.builder()
                .sourceName(sourceName)
                .lineNumber(csvReader.getLinesRead())
                .type(RowParseErrorType.MALFORMED_ROW)
                .reason(e.getMessage())
                .rawRow("")
                .build();
    }

    @Override
    public ParsedRecord next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No more records in " + sourceName);
        }
        ParsedRecord current = nextRecord;
        nextRecord = null;
        return current;
    }

    public CdrHeader getHeader() {
        return header;
    }

    public CdrSchema getSchema() {
        return header.getSchema();
    }

    public String getSourceName() {
        return sourceName;
    }

    public long getRowsRead() {
        return rowsRead;
    }

    public long getRowsSkipped() {
        return rowsSkipped;
    }

    @Override
    public void close() throws IOException {
        log.debug("Closing reader for {}, read {} rows ({} skipped)", sourceName, rowsRead, rowsSkipped);
        csvReader.close();
    }
}
