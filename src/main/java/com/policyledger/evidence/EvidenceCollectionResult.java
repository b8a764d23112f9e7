package com.policyledger.evidence;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Evidence from every source, most relevant first, with per-source, per-control
 * and per-verification-outcome counts.
 */
public record EvidenceCollectionResult(
    EvidenceQuery query,
    List<CollectedEvidence> evidence,
    Map<EvidenceSourceType, Integer> bySource,
    Map<String, Integer> byControl,
    VerificationSummary chainVerification,
    Metadata metadata
) {

    public record VerificationSummary(int verified, int failed, int skipped) {}

    public record Metadata(Instant collectedAt, long durationMs, String tenantId, Instant startTime, Instant endTime) {}

    public record Summary(int totalEvidence, double averageRelevance, double chainVerificationRate) {}

    /**
     * Average relevance, and the share of verified items among those that were
     * verified at all (1.0 when none were).
     */
    public Summary summary() {
        double average = evidence.stream().mapToDouble(CollectedEvidence::relevanceScore).average().orElse(0);
        int attempted = chainVerification.verified() + chainVerification.failed();
        double rate = attempted == 0 ? 1.0 : (double) chainVerification.verified() / attempted;
        return new Summary(evidence.size(), average, rate);
    }

    public List<CollectedEvidence> filterByRelevance(double minimum) {
        return evidence.stream().filter(e -> e.relevanceScore() >= minimum).toList();
    }

    public List<CollectedEvidence> top(int n) {
        return evidence.stream()
            .sorted(Comparator.comparingDouble(CollectedEvidence::relevanceScore).reversed())
            .limit(Math.max(0, n))
            .toList();
    }
}
