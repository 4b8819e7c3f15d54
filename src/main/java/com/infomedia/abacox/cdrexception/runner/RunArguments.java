package com.infomedia.abacox.cdrexception.runner;

import com.infomedia.abacox.cdrexception.component.cdrprocessing.DateTimeUtil;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/**
 * Positional command-line arguments: {@code <start> <end> <input directory> <report file>}.
 */
public record RunArguments(Instant start, Instant end, Path inputDirectory, Path reportFile) {

    public static final String USAGE = "Usage: <start \"yyyy-MM-dd HH:mm:ss\"> <end \"yyyy-MM-dd HH:mm:ss\"> "
            + "<input directory> <report file .xlsx>  (dates are UTC)";

    /**
     * @throws IllegalArgumentException if the count is wrong, a date is malformed or start is after end.
     */
    public static RunArguments parse(List<String> args) {
        if (args == null || args.size() != 4) {
            throw new IllegalArgumentException("Expected 4 arguments but got " + (args == null ? 0 : args.size()));
        }
        Instant start = DateTimeUtil.parseUtcDateTime(args.get(0));
        Instant end = DateTimeUtil.parseUtcDateTime(args.get(1));
        if (start.isAfter(end)) {
            throw new IllegalArgumentException("Start date " + args.get(0) + " is after end date " + args.get(1));
        }
        String reportFile = args.get(3).trim();
        if (reportFile.isEmpty()) {
            throw new IllegalArgumentException("Report file name is empty");
        }
        return new RunArguments(start, end, Path.of(args.get(2).trim()), Path.of(reportFile));
    }
}
