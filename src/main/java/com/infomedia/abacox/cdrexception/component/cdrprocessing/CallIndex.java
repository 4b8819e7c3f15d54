package com.infomedia.abacox.cdrexception.component.cdrprocessing;

import lombok.extern.log4j.Log4j2;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Correlates CMRs with their parent CDR by call id.
 * <p>
 * One index is built per run and fed strictly in file/row order: a repeated CDR replaces the earlier one,
 * and CMRs seen before their CDR are held until it arrives. Whatever is still unmatched when
 * {@link #finalizeCorrelation()} is called is counted as an orphan and dropped.
 * <p>
 * Not thread-safe.
 */
@Log4j2
public class CallIndex {

    private final Map<CallId, Entry> entries = new LinkedHashMap<>();
    private final Map<CallId, List<QualityRecord>> pendingQuality = new LinkedHashMap<>();
    private int replacedCallRecords;
    private boolean finalized;

    public void ingest(ParsedRecord record) {
        if (finalized) {
            throw new IllegalStateException("Call index has already been finalized");
        }
        if (record instanceof CallRecord callRecord) {
            ingestCallRecord(callRecord);
        } else if (record instanceof QualityRecord qualityRecord) {
            ingestQualityRecord(qualityRecord);
        } else {
            throw new IllegalArgumentException("Only call and quality records can be indexed, got: "
                    + (record == null ? "null" : record.getClass().getSimpleName()));
        }
    }

    private void ingestCallRecord(CallRecord callRecord) {
        CallId callId = callRecord.getCallId();
        Entry entry = entries.get(callId);
        if (entry != null) {
            log.debug("Duplicate CDR {} at {} line {} replaces the one from {} line {}", callId,
                    callRecord.getSourceName(), callRecord.getLineNumber(),
                    entry.callRecord.getSourceName(), entry.callRecord.getLineNumber());
            entry.callRecord = callRecord;
            replacedCallRecords++;
            return;
        }
        entry = new Entry(callRecord);
        List<QualityRecord> waiting = pendingQuality.remove(callId);
        if (waiting != null) {
            log.trace("Attaching {} buffered CMR(s) to CDR {}", waiting.size(), callId);
            entry.qualityRecords.addAll(waiting);
        }
        entries.put(callId, entry);
    }

    private void ingestQualityRecord(QualityRecord qualityRecord) {
        Entry entry = entries.get(qualityRecord.getCallId());
        if (entry != null) {
            entry.qualityRecords.add(qualityRecord);
        } else {
            pendingQuality.computeIfAbsent(qualityRecord.getCallId(), id -> new ArrayList<>()).add(qualityRecord);
        }
    }

    /**
     * Resolves every attached CMR against its final CDR and returns the correlated calls in first-seen order.
     * May be called once.
     */
    public CorrelationResult finalizeCorrelation() {
        if (finalized) {
            throw new IllegalStateException("Call index has already been finalized");
        }
        finalized = true;

        int orphans = pendingQuality.values().stream().mapToInt(List::size).sum();
        if (orphans > 0) {
            log.debug("{} CMR(s) across {} call id(s) never matched a CDR", orphans, pendingQuality.size());
        }
        pendingQuality.clear();

        List<Call> calls = new ArrayList<>(entries.size());
        int attached = 0;
        for (Entry entry : entries.values()) {
            calls.add(entry.toCall());
            attached += entry.qualityRecords.size();
        }
        entries.clear();

        return CorrelationResult.builder()
                .calls(Collections.unmodifiableList(calls))
                .orphanQualityRecords(orphans)
                .replacedCallRecords(replacedCallRecords)
                .attachedQualityRecords(attached)
                .build();
    }

    private static final class Entry {
        private CallRecord callRecord;
        private final List<QualityRecord> qualityRecords = new ArrayList<>();

        private Entry(CallRecord callRecord) {
            this.callRecord = callRecord;
        }

        private Call toCall() {
            LegQuality source = embedded(CallLeg.SOURCE);
            LegQuality destination = embedded(CallLeg.DESTINATION);
            boolean sourceMeasured = false;
            boolean destinationMeasured = false;

            // Later CMRs for the same leg win
            for (QualityRecord qualityRecord : qualityRecords) {
                if (qualityRecord.getMetrics() == null) {
                    continue;
                }
                CallLeg leg = resolveLeg(qualityRecord);
                if (leg == CallLeg.SOURCE) {
                    source = new LegQuality(qualityRecord.getDeviceName(), qualityRecord.getMetrics());
                    sourceMeasured = true;
                } else if (leg == CallLeg.DESTINATION) {
                    destination = new LegQuality(qualityRecord.getDeviceName(), qualityRecord.getMetrics());
                    destinationMeasured = true;
                } else {
                    // Transferred calls re-use the global call id, so the measuring device can be neither endpoint.
                    // Such a CMR only fills legs that no endpoint CMR has measured.
                    if (!sourceMeasured) {
                        source = new LegQuality(deviceFor(qualityRecord, CallLeg.SOURCE), qualityRecord.getMetrics());
                    }
                    if (!destinationMeasured) {
                        destination = new LegQuality(deviceFor(qualityRecord, CallLeg.DESTINATION), qualityRecord.getMetrics());
                    }
                }
            }
            return new Call(callRecord, source, destination);
        }

        private LegQuality embedded(CallLeg leg) {
            QualityMetrics metrics = callRecord.getEmbeddedQuality(leg);
            return metrics == null ? null : new LegQuality(callRecord.getDeviceName(leg), metrics);
        }

        private CallLeg resolveLeg(QualityRecord qualityRecord) {
            String device = qualityRecord.getDeviceName();
            if (isBlank(device)) {
                return null;
            }
            if (device.equalsIgnoreCase(callRecord.getOrigDeviceName())) {
                return CallLeg.SOURCE;
            }
            if (device.equalsIgnoreCase(callRecord.getDestDeviceName())) {
                return CallLeg.DESTINATION;
            }
            return null;
        }

        // A CMR without a device name is reported under the call's own endpoint
        private String deviceFor(QualityRecord qualityRecord, CallLeg leg) {
            return isBlank(qualityRecord.getDeviceName()) ? callRecord.getDeviceName(leg) : qualityRecord.getDeviceName();
        }

        private static boolean isBlank(String value) {
            return value == null || value.isBlank();
        }
    }
}
