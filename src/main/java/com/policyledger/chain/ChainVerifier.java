package com.policyledger.chain;

import com.policyledger.audit.AuditLogEntry;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

import static com.policyledger.chain.IntegrityIssue.Type.ALGORITHM_MISMATCH;
import static com.policyledger.chain.IntegrityIssue.Type.CHAIN_LINK_BROKEN;
import static com.policyledger.chain.IntegrityIssue.Type.CONTENT_HASH_MISMATCH;
import static com.policyledger.chain.IntegrityIssue.Type.FIRST_ENTRY_INVALID;
import static com.policyledger.chain.IntegrityIssue.Type.SEQUENCE_DUPLICATE;
import static com.policyledger.chain.IntegrityIssue.Type.SEQUENCE_GAP;
import static com.policyledger.chain.IntegrityIssue.Type.TIMESTAMP_REGRESSION;

/**
 * Verifies hash-chain integrity of audit entries. Pure function of its input;
 * never touches storage.
 */
@Component
public class ChainVerifier {

    private final ChainHasher hasher;

    public ChainVerifier(ChainHasher hasher) {
        this.hasher = hasher;
    }

    /**
     * Strict verification of a contiguous run. When the run starts at sequence 0
     * the first entry must have a null {@code prevHash}; a run starting later is
     * anchored at its first entry.
     */
    public ChainVerificationResult verify(List<AuditLogEntry> entries) {
        return verify(entries, null, false);
    }

    /**
     * Strict verification of a contiguous run whose first entry must link to
     * {@code expectedFirstPrevHash} (null for the genesis entry).
     */
    public ChainVerificationResult verify(List<AuditLogEntry> entries, String expectedFirstPrevHash) {
        return verify(entries, expectedFirstPrevHash, true);
    }

    private ChainVerificationResult verify(List<AuditLogEntry> entries, String expectedFirstPrevHash,
                                           boolean anchored) {
        long started = System.currentTimeMillis();
        List<ChainVerificationResult.EntryCheck> details = new ArrayList<>();
        if (entries == null || entries.isEmpty()) {
            return ChainVerificationResult.passed(0, 0, details, 0);
        }

        long startSequence = entries.get(0).chain().sequence();
        AuditLogEntry previous = null;
        for (int i = 0; i < entries.size(); i++) {
            AuditLogEntry entry = entries.get(i);
            long sequence = entry.chain().sequence();
            long expectedSequence = startSequence + i;
            if (sequence != expectedSequence) {
                return ChainVerificationResult.failed(i + 1, sequence, entry.id(),
                    "Sequence mismatch: expected " + expectedSequence + ", got " + sequence,
                    0, details, elapsed(started));
            }

            boolean linkValid;
            if (previous != null) {
                linkValid = Objects.equals(entry.chain().prevHash(), previous.chain().contentHash());
            } else if (anchored) {
                linkValid = Objects.equals(entry.chain().prevHash(), expectedFirstPrevHash);
            } else {
                linkValid = sequence != 0 || entry.chain().prevHash() == null;
            }

            ChainVerificationResult.EntryCheck check = checkEntry(entry, linkValid);
            details.add(check);
            if (check.error() != null) {
                return ChainVerificationResult.failed(i + 1, sequence, entry.id(), check.error(),
                    0, details, elapsed(started));
            }
            previous = entry;
        }
        return ChainVerificationResult.passed(entries.size(), 0, details, elapsed(started));
    }

    /**
     * Lenient verification for filtered windows. Entries are ordered by sequence,
     * every content hash is recomputed, and links are checked only between entries
     * whose sequences are adjacent. A clean result proves the window is internally
     * consistent; it says nothing about entries missing between gaps.
     */
    public ChainVerificationResult verifySubsequence(List<AuditLogEntry> entries) {
        long started = System.currentTimeMillis();
        List<ChainVerificationResult.EntryCheck> details = new ArrayList<>();
        if (entries == null || entries.isEmpty()) {
            return ChainVerificationResult.passed(0, 0, details, 0);
        }

        List<AuditLogEntry> ordered = new ArrayList<>(entries);
        ordered.sort(Comparator.comparingLong(e -> e.chain().sequence()));

        int unverifiable = 0;
        AuditLogEntry previous = null;
        for (int i = 0; i < ordered.size(); i++) {
            AuditLogEntry entry = ordered.get(i);
            long sequence = entry.chain().sequence();
            boolean linkValid = true;
            if (previous != null && previous.chain().sequence() == sequence) {
                linkValid = false;
            } else if (previous != null && previous.chain().sequence() + 1 == sequence) {
                linkValid = Objects.equals(entry.chain().prevHash(), previous.chain().contentHash());
            } else if (sequence == 0) {
                linkValid = entry.chain().prevHash() == null;
            } else {
                unverifiable++;
            }

            ChainVerificationResult.EntryCheck check = checkEntry(entry, linkValid);
            details.add(check);
            if (check.error() != null) {
                return ChainVerificationResult.failed(i + 1, sequence, entry.id(), check.error(),
                    unverifiable, details, elapsed(started));
            }
            previous = entry;
        }
        return ChainVerificationResult.passed(ordered.size(), unverifiable, details, elapsed(started));
    }

    /**
     * Full inspection: collects every issue instead of stopping at the first one.
     *
     * Entries are ordered by sequence. Links are checked only between adjacent
     * sequences; a gap or duplicate is reported as such. A run that starts after 0
     * has its first link checked against {@code anchorHash}, or not at all when
     * that is null.
     */
    public VerificationReport inspect(String tenantId, List<AuditLogEntry> entries, long expectedStart,
                                      String anchorHash, VerificationOptions options) {
        long started = System.currentTimeMillis();
        VerificationOptions opts = options == null ? VerificationOptions.defaults() : options;
        if (entries == null || entries.isEmpty()) {
            return VerificationReport.empty(tenantId, elapsed(started));
        }
        List<AuditLogEntry> ordered = new ArrayList<>(entries);
        ordered.sort(Comparator.comparingLong(e -> e.chain().sequence()));

        List<IntegrityIssue> issues = new ArrayList<>();
        List<ChainVerificationResult.EntryCheck> checks = new ArrayList<>();
        AuditLogEntry previous = null;
        for (AuditLogEntry entry : ordered) {
            long sequence = entry.chain().sequence();
            String expectedPrev = null;
            boolean linkChecked = false;
            if (previous == null) {
                if (sequence != 0 && anchorHash != null && sequence == expectedStart) {
                    expectedPrev = anchorHash;
                    linkChecked = true;
                }
            } else if (previous.chain().sequence() + 1 == sequence) {
                expectedPrev = previous.chain().contentHash();
                linkChecked = true;
            }
            boolean linkValid = sequence == 0
                ? entry.chain().prevHash() == null
                : !linkChecked || Objects.equals(entry.chain().prevHash(), expectedPrev);

            ChainVerificationResult.EntryCheck check = checkEntry(entry, linkValid);
            checks.add(check);

            boolean failed = false;
            if (!check.contentHashValid()) {
                issues.add(IntegrityIssue.of(CONTENT_HASH_MISMATCH, sequence, entry.id(),
                    "Content hash mismatch at sequence " + sequence,
                    check.expectedContentHash(), check.actualContentHash(), null));
                failed = true;
            }
            if (linkChecked && !linkValid) {
                issues.add(IntegrityIssue.of(CHAIN_LINK_BROKEN, sequence, entry.id(),
                    "Chain link broken at sequence " + sequence + ": prevHash does not match previous entry",
                    expectedPrev, entry.chain().prevHash(), previous == null ? null : List.of(previous.id())));
                failed = true;
            }
            previous = entry;
            if (failed && opts.stopOnFirstError()) {
                break;
            }
        }

        AuditLogEntry first = ordered.get(0);
        if (expectedStart == 0 && first.chain().sequence() == 0 && first.chain().prevHash() != null) {
            issues.add(IntegrityIssue.of(FIRST_ENTRY_INVALID, 0, first.id(),
                "First entry in chain should have null prevHash", "null", first.chain().prevHash(), null));
        }

        List<Gap> gaps = detectGaps(ordered, expectedStart);
        for (Gap gap : gaps) {
            issues.add(IntegrityIssue.of(SEQUENCE_GAP, gap.afterSequence(), gap.afterEntryId(),
                "Gap detected: missing sequences " + gap.missingStart() + "-" + gap.missingEnd()
                    + " (" + gap.count() + " entries)",
                "sequence " + (gap.afterSequence() + 1), "sequence " + gap.nextSequence(), null));
        }

        Map<Long, List<String>> bySequence = new LinkedHashMap<>();
        for (AuditLogEntry entry : ordered) {
            bySequence.computeIfAbsent(entry.chain().sequence(), k -> new ArrayList<>()).add(entry.id());
        }
        bySequence.forEach((sequence, ids) -> {
            if (ids.size() > 1) {
                issues.add(IntegrityIssue.of(SEQUENCE_DUPLICATE, sequence, ids.get(0),
                    "Duplicate sequence " + sequence + " found in " + ids.size() + " entries", null, null, ids));
            }
        });

        if (opts.verifyTimestamps()) {
            for (int i = 1; i < ordered.size(); i++) {
                AuditLogEntry before = ordered.get(i - 1);
                AuditLogEntry entry = ordered.get(i);
                if (entry.timestamp().isBefore(before.timestamp())) {
                    issues.add(IntegrityIssue.of(TIMESTAMP_REGRESSION, entry.chain().sequence(), entry.id(),
                        "Timestamp regression: entry " + entry.chain().sequence() + " is earlier than entry "
                            + before.chain().sequence(),
                        ">= " + before.timestamp(), entry.timestamp().toString(), List.of(before.id())));
                }
            }
        }

        Set<HashAlgorithm> algorithms = ordered.stream()
            .map(e -> e.chain().algorithm())
            .filter(Objects::nonNull)
            .collect(Collectors.toCollection(LinkedHashSet::new));
        if (algorithms.size() > 1) {
            String used = algorithms.stream().map(HashAlgorithm::getValue).collect(Collectors.joining(", "));
            issues.add(IntegrityIssue.of(ALGORITHM_MISMATCH, first.chain().sequence(), first.id(),
                "Multiple hash algorithms used in chain: " + used, "single consistent algorithm", used, null));
        }

        issues.sort(Comparator.comparing(IntegrityIssue::severity).thenComparingLong(IntegrityIssue::sequence));
        ChainHealthStats stats = stats(ordered, checks.size(), gaps, List.copyOf(algorithms));
        boolean valid = issues.isEmpty();
        return new VerificationReport(tenantId, valid, Instant.now(), elapsed(started), stats, issues,
            summary(valid, issues, stats), opts.includeEntryDetails() ? checks : null);
    }

    private static List<Gap> detectGaps(List<AuditLogEntry> ordered, long expectedStart) {
        List<Gap> gaps = new ArrayList<>();
        AuditLogEntry first = ordered.get(0);
        if (first.chain().sequence() > expectedStart) {
            gaps.add(new Gap(expectedStart - 1, "start", first.chain().sequence(),
                expectedStart, first.chain().sequence() - 1));
        }
        for (int i = 1; i < ordered.size(); i++) {
            AuditLogEntry before = ordered.get(i - 1);
            long next = ordered.get(i).chain().sequence();
            if (next > before.chain().sequence() + 1) {
                gaps.add(new Gap(before.chain().sequence(), before.id(), next,
                    before.chain().sequence() + 1, next - 1));
            }
        }
        return gaps;
    }

    private static ChainHealthStats stats(List<AuditLogEntry> ordered, int verified, List<Gap> gaps,
                                          List<HashAlgorithm> algorithms) {
        long missing = gaps.stream().mapToLong(Gap::count).sum();
        long expectedTotal = ordered.size() + missing;
        int continuity = (int) Math.round(ordered.size() * 100.0 / expectedTotal);
        Instant earliest = ordered.stream().map(AuditLogEntry::timestamp).min(Comparator.naturalOrder()).orElse(null);
        Instant latest = ordered.stream().map(AuditLogEntry::timestamp).max(Comparator.naturalOrder()).orElse(null);
        return new ChainHealthStats(ordered.size(), verified,
            ordered.get(0).chain().sequence(), ordered.get(ordered.size() - 1).chain().sequence(),
            new ChainHealthStats.TimeRange(earliest, latest), gaps.size(), missing, algorithms, continuity);
    }

    private static String summary(boolean valid, List<IntegrityIssue> issues, ChainHealthStats stats) {
        if (valid) {
            return "Chain integrity verified: " + stats.entriesVerified() + " entries, "
                + stats.continuityPercent() + "% continuity";
        }
        long critical = issues.stream().filter(i -> i.severity() == IntegrityIssue.Severity.CRITICAL).count();
        long high = issues.stream().filter(i -> i.severity() == IntegrityIssue.Severity.HIGH).count();
        long other = issues.size() - critical - high;
        List<String> parts = new ArrayList<>();
        if (critical > 0) {
            parts.add(critical + " critical");
        }
        if (high > 0) {
            parts.add(high + " high");
        }
        if (other > 0) {
            parts.add(other + " other");
        }
        return "Chain integrity FAILED: " + String.join(", ", parts) + " issue(s) found";
    }

    /** Recomputes a single entry's content hash against the stored one. */
    public boolean verifyContentHash(AuditLogEntry entry) {
        return hasher.computeContentHash(entry).equals(entry.chain().contentHash());
    }

    private ChainVerificationResult.EntryCheck checkEntry(AuditLogEntry entry, boolean linkValid) {
        String expected = hasher.computeContentHash(entry);
        String actual = entry.chain().contentHash();
        boolean contentValid = expected.equals(actual);

        String error = null;
        if (!contentValid && !linkValid) {
            error = "Content hash mismatch; chain link broken";
        } else if (!contentValid) {
            error = "Content hash mismatch";
        } else if (!linkValid) {
            error = "Chain link broken";
        }
        return new ChainVerificationResult.EntryCheck(entry.id(), entry.chain().sequence(),
            contentValid, linkValid, expected, actual, error);
    }

    private long elapsed(long started) {
        return System.currentTimeMillis() - started;
    }

    private record Gap(long afterSequence, String afterEntryId, long nextSequence, long missingStart, long missingEnd) {

        long count() {
            return missingEnd - missingStart + 1;
        }
    }
}
