package com.citation.resolution.api;

import com.citation.resolution.core.model.ProviderName;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders a {@link ResolutionReport} as user-facing lines.
 */
public class ReportFormatter {

    public List<String> format(ResolutionReport report) {
        List<String> lines = new ArrayList<>();
        for (ResolutionReport.Accepted accepted : report.accepted()) {
            if (accepted.entryKey().equals(accepted.key())) {
                lines.add("Fetched " + accepted.key() + " from " + accepted.provider().getDisplayName());
            } else {
                lines.add("Fetched " + accepted.key() + " from " + accepted.provider().getDisplayName()
                        + " as " + accepted.entryKey());
            }
        }
        for (ResolutionReport.Stub stub : report.stubs()) {
            lines.add("Added crossref " + stub.stubKey() + " -> " + stub.targetKey());
        }
        if (!report.skippedExisting().isEmpty()) {
            lines.add(report.skippedExisting().size() + " key(s) already present, not fetched");
        }
        if (!report.duplicatesSkipped().isEmpty()) {
            lines.add(report.duplicatesSkipped().size()
                    + " key(s) skipped - they refer to the same paper as an earlier key:");
            for (ResolutionReport.DuplicateSkipped duplicate : report.duplicatesSkipped()) {
                lines.add("  " + duplicate.duplicateKey() + " -> " + duplicate.winningKey()
                        + " (source key " + duplicate.winningSourceKey() + ")");
            }
        }
        for (ResolutionReport.FailedKey failed : report.failedKeys()) {
            lines.add("Could not resolve " + failed.key() + " (" + describe(failed) + ")");
        }
        return lines;
    }

    public String render(ResolutionReport report) {
        return String.join(System.lineSeparator(), format(report));
    }

    private static String describe(ResolutionReport.FailedKey failed) {
        String reason = failed.reason() != null ? failed.reason().name() : "UNKNOWN";
        if (failed.attempted().isEmpty()) {
            return reason;
        }
        return reason + ", tried " + failed.attempted().stream()
                .map(ProviderName::getDisplayName)
                .collect(Collectors.joining(", "));
    }
}
