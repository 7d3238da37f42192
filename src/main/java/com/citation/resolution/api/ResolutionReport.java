package com.citation.resolution.api;

import com.citation.resolution.core.model.FailureReason;
import com.citation.resolution.core.model.ProviderName;
import com.citation.resolution.merge.MergeDecision;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of a resolution run. Every list is in input order.
 */
public record ResolutionReport(
        String runId,
        List<Accepted> accepted,
        List<DuplicateSkipped> duplicatesSkipped,
        List<FailedKey> failedKeys,
        List<String> skippedExisting,
        List<Stub> stubs
) {
    /**
     * @param key      key as cited
     * @param entryKey key the entry was stored under
     */
    public record Accepted(String key, String entryKey, String entry, ProviderName provider) {
    }

    public record DuplicateSkipped(String duplicateKey, String winningKey, String winningSourceKey) {
    }

    public record FailedKey(String key, FailureReason reason, List<ProviderName> attempted) {
        public FailedKey {
            attempted = attempted != null ? List.copyOf(attempted) : List.of();
        }
    }

    public record Stub(String stubKey, String targetKey) {
    }

    public ResolutionReport {
        accepted = accepted != null ? List.copyOf(accepted) : List.of();
        duplicatesSkipped = duplicatesSkipped != null ? List.copyOf(duplicatesSkipped) : List.of();
        failedKeys = failedKeys != null ? List.copyOf(failedKeys) : List.of();
        skippedExisting = skippedExisting != null ? List.copyOf(skippedExisting) : List.of();
        stubs = stubs != null ? List.copyOf(stubs) : List.of();
    }

    /**
     * Builds the report from merge decisions given in input order.
     */
    public static ResolutionReport from(String runId, List<MergeDecision> decisions) {
        List<Accepted> accepted = new ArrayList<>();
        List<DuplicateSkipped> duplicates = new ArrayList<>();
        List<FailedKey> failed = new ArrayList<>();
        List<String> existing = new ArrayList<>();
        List<Stub> stubs = new ArrayList<>();

        for (MergeDecision decision : decisions) {
            String key = decision.key().raw();
            switch (decision.disposition()) {
                case ACCEPTED -> accepted.add(new Accepted(key, decision.entryKey(), decision.entry(), decision.provider()));
                case SKIPPED_DUPLICATE -> duplicates.add(
                        new DuplicateSkipped(key, decision.winningKey(), decision.winningSourceKey()));
                case SKIPPED_EXISTING -> existing.add(key);
                case FAILED -> failed.add(new FailedKey(key, decision.failureReason(), decision.attempted()));
            }
            decision.getStub().ifPresent(stub -> stubs.add(new Stub(stub.stubKey(), stub.targetKey())));
        }
        return new ResolutionReport(runId, accepted, duplicates, failed, existing, stubs);
    }

    public static ResolutionReport empty(String runId) {
        return new ResolutionReport(runId, List.of(), List.of(), List.of(), List.of(), List.of());
    }

    /**
     * Returns true if no key failed.
     */
    public boolean isSuccess() {
        return failedKeys.isEmpty();
    }

    /**
     * 0 when every key was resolved or skipped, 1 when at least one key failed.
     */
    public int exitStatus() {
        return isSuccess() ? 0 : 1;
    }

    public int totalKeys() {
        return accepted.size() + duplicatesSkipped.size() + failedKeys.size() + skippedExisting.size();
    }

    @Override
    public String toString() {
        return "ResolutionReport{" +
                "runId=" + runId +
                ", accepted=" + accepted.size() +
                ", duplicates=" + duplicatesSkipped.size() +
                ", existing=" + skippedExisting.size() +
                ", failed=" + failedKeys.size() +
                ", stubs=" + stubs.size() +
                '}';
    }
}
