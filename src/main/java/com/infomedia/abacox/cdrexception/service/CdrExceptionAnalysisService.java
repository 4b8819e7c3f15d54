package com.infomedia.abacox.cdrexception.service;

import com.infomedia.abacox.cdrexception.component.cdrprocessing.Call;
import com.infomedia.abacox.cdrexception.component.cdrprocessing.CallIndex;
import com.infomedia.abacox.cdrexception.component.cdrprocessing.CallRecord;
import com.infomedia.abacox.cdrexception.component.cdrprocessing.CdrFileReader;
import com.infomedia.abacox.cdrexception.component.cdrprocessing.CdrProcessingException;
import com.infomedia.abacox.cdrexception.component.cdrprocessing.CdrSchema;
import com.infomedia.abacox.cdrexception.component.cdrprocessing.CiscoCmRecordParser;
import com.infomedia.abacox.cdrexception.component.cdrprocessing.CorrelationResult;
import com.infomedia.abacox.cdrexception.component.cdrprocessing.DateRangeFilter;
import com.infomedia.abacox.cdrexception.component.cdrprocessing.IngestionStats;
import com.infomedia.abacox.cdrexception.component.cdrprocessing.ParsedRecord;
import com.infomedia.abacox.cdrexception.component.cdrprocessing.QualityRecord;
import com.infomedia.abacox.cdrexception.component.cdrprocessing.RowParseError;
import com.infomedia.abacox.cdrexception.component.cdrprocessing.VqMetricsParser;
import com.infomedia.abacox.cdrexception.component.configmanager.ExceptionSettings;
import com.infomedia.abacox.cdrexception.component.exceptionanalysis.Classification;
import com.infomedia.abacox.cdrexception.component.exceptionanalysis.ExceptionAnalysisResult;
import com.infomedia.abacox.cdrexception.component.exceptionanalysis.ExceptionClassifier;
import com.infomedia.abacox.cdrexception.component.exceptionanalysis.ExceptionGroup;
import com.infomedia.abacox.cdrexception.component.exceptionanalysis.ExceptionSummary;
import com.infomedia.abacox.cdrexception.component.exceptionanalysis.SummaryAggregator;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/**
 * Runs one analysis: read every file in the given order, correlate, filter to the window, then classify and
 * summarise the calls that remain.
 */
@Service
@Log4j2
@RequiredArgsConstructor
public class CdrExceptionAnalysisService {

    private final ExceptionClassifier exceptionClassifier;
    private final SummaryAggregator summaryAggregator;

    /**
     * @param files Input files, already in ingestion order.
     * @throws CdrProcessingException if there were input files but none of them could be opened.
     */
    public ExceptionAnalysisResult analyse(List<Path> files, Instant start, Instant end, ExceptionSettings settings) {
        long startTime = System.currentTimeMillis();
        DateRangeFilter filter = new DateRangeFilter(start, end);
        CiscoCmRecordParser parser = new CiscoCmRecordParser(
                new VqMetricsParser(settings.getMosMetricKey(), settings.getCcrMetricKey()));

        CallIndex callIndex = new CallIndex();
        IngestionStats stats = new IngestionStats();
        for (Path file : files) {
            ingestFile(file, parser, callIndex, stats);
        }
        if (!files.isEmpty() && stats.getFilesRead() == 0) {
            throw new CdrProcessingException("None of the " + files.size() + " input file(s) could be read");
        }

        CorrelationResult correlation = callIndex.finalizeCorrelation();
        List<Call> inRange = filter.apply(correlation.getCalls());
        List<ExceptionGroup> exceptions = exceptionClassifier.classify(inRange, settings);
        ExceptionSummary summary = summaryAggregator.aggregate(inRange, settings);

        int red = (int) exceptions.stream().filter(g -> g.getClassification() == Classification.RED).count();
        int amber = exceptions.size() - red;

        log.info("Analysis finished in {}ms. Files read: {}, skipped: {}. Rows: {}, parse errors: {}. "
                        + "Calls: {}, in range: {}, orphan CMRs: {}, replaced CDRs: {}. Exceptions: {} red, {} amber",
                System.currentTimeMillis() - startTime,
                stats.getFilesRead(), stats.getFilesSkipped(), stats.getRowsRead(), stats.getRowParseErrors(),
                correlation.getCalls().size(), inRange.size(), correlation.getOrphanQualityRecords(),
                correlation.getReplacedCallRecords(), red, amber);
        if (inRange.isEmpty()) {
            log.warn("No calls between {} and {}", start, end);
        }

        return ExceptionAnalysisResult.builder()
                .start(start)
                .end(end)
                .exceptions(exceptions)
                .summary(summary)
                .amberCount(amber)
                .redCount(red)
                .ingestionStats(stats)
                .correlatedCalls(correlation.getCalls().size())
                .callsInRange(inRange.size())
                .orphanQualityRecords(correlation.getOrphanQualityRecords())
                .replacedCallRecords(correlation.getReplacedCallRecords())
                .build();
    }

    private void ingestFile(Path file, CiscoCmRecordParser parser, CallIndex callIndex, IngestionStats stats) {
        CdrFileReader reader;
        try {
            reader = new CdrFileReader(file, parser);
        } catch (IOException e) {
            log.error("Outcome for file [{}]: SKIPPED. Reason: {}", file.getFileName(), e.getMessage());
            stats.setFilesSkipped(stats.getFilesSkipped() + 1);
            return;
        }

        long callRecords = 0;
        long qualityRecords = 0;
        long errors = 0;
        try (reader) {
            stats.setFilesRead(stats.getFilesRead() + 1);
            if (reader.getSchema() == CdrSchema.CALL_DETAIL) {
                stats.setCallDetailFiles(stats.getCallDetailFiles() + 1);
            } else if (reader.getSchema() == CdrSchema.CALL_QUALITY) {
                stats.setCallQualityFiles(stats.getCallQualityFiles() + 1);
            }
            while (reader.hasNext()) {
                ParsedRecord record = reader.next();
                if (record instanceof RowParseError error) {
                    log.debug("Row error in {} line {}: {} ({})", error.getSourceName(), error.getLineNumber(),
                            error.getType(), error.getReason());
                    stats.recordParseError(error);
                    errors++;
                    continue;
                }
                callIndex.ingest(record);
                if (record instanceof CallRecord) {
                    callRecords++;
                } else if (record instanceof QualityRecord) {
                    qualityRecords++;
                }
            }
            log.info("Outcome for file [{}]: SUCCESS. Read: {}, CDRs: {}, CMRs: {}, Errors: {}",
                    file.getFileName(), reader.getRowsRead(), callRecords, qualityRecords, errors);
        } catch (UncheckedIOException e) {
            log.error("Outcome for file [{}]: PARTIAL. Reason: read failed, continuing with the next file.",
                    file.getFileName(), e);
        } catch (IOException e) {
            log.warn("Failed to close {}: {}", file.getFileName(), e.getMessage());
        } finally {
            stats.setRowsRead(stats.getRowsRead() + reader.getRowsRead());
            stats.setRowsSkipped(stats.getRowsSkipped() + reader.getRowsSkipped());
            stats.setCallRecords(stats.getCallRecords() + callRecords);
            stats.setQualityRecords(stats.getQualityRecords() + qualityRecords);
        }
    }
}
