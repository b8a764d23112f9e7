package com.policyledger.evidence;

import com.policyledger.config.PolicyLedgerProperties;
import com.policyledger.contract.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Gathers evidence for compliance controls from every registered source.
 *
 * A source that fails or reports itself unavailable is skipped with a warning;
 * the remaining sources still contribute.
 */
@Service
public class EvidenceCollector {

    private static final Logger log = LoggerFactory.getLogger(EvidenceCollector.class);

    private final List<EvidenceSource> sources;
    private final PolicyLedgerProperties.Evidence config;

    public EvidenceCollector(List<EvidenceSource> sources, PolicyLedgerProperties properties) {
        this.sources = List.copyOf(sources);
        this.config = properties.getEvidence();
    }

    public EvidenceCollectionResult collect(EvidenceQuery query) {
        validate(query);
        long started = System.currentTimeMillis();
        EvidenceQuery effective = query.withDefaults(config.getDefaultMaxPerSource(), config.isVerifyChainByDefault());

        List<CollectedEvidence> all = new ArrayList<>();
        for (EvidenceSource source : sources) {
            try {
                if (!source.isAvailable()) {
                    log.warn("Evidence source {} is not available", source.type().getValue());
                    continue;
                }
                all.addAll(source.collect(effective));
            } catch (RuntimeException ex) {
                log.warn("Evidence source {} failed for tenant={}: {}",
                    source.type().getValue(), query.tenantId(), ex.getMessage());
            }
        }
        all.sort(Comparator.comparingDouble(CollectedEvidence::relevanceScore).reversed());

        Map<EvidenceSourceType, Integer> bySource = new EnumMap<>(EvidenceSourceType.class);
        for (EvidenceSourceType type : EvidenceSourceType.values()) {
            bySource.put(type, 0);
        }
        Map<String, Integer> byControl = new LinkedHashMap<>();
        int verified = 0;
        int failed = 0;
        int skipped = 0;
        for (CollectedEvidence item : all) {
            bySource.merge(item.source(), 1, Integer::sum);
            item.relatedControlIds().forEach(id -> byControl.merge(id, 1, Integer::sum));
            if (item.chainVerification() == null) {
                skipped++;
            } else if (item.chainVerification().valid()) {
                verified++;
            } else {
                failed++;
            }
        }

        long duration = System.currentTimeMillis() - started;
        log.debug("Collected {} evidence items for tenant={} control={} in {}ms",
            all.size(), query.tenantId(), query.controlId(), duration);
        return new EvidenceCollectionResult(effective, List.copyOf(all), bySource, byControl,
            new EvidenceCollectionResult.VerificationSummary(verified, failed, skipped),
            new EvidenceCollectionResult.Metadata(Instant.now(), duration, query.tenantId(),
                query.startTime(), query.endTime()));
    }

    /** Evidence for one control, restricted to items that cite it. */
    public List<CollectedEvidence> collectForControl(String tenantId, ControlDefinition control,
                                                     Instant start, Instant end) {
        EvidenceQuery query = EvidenceQuery.forControl(tenantId, control.controlId(), start, end);
        if (control.category() != null) {
            query = query.withControlCategory(ControlMappings.normalizeCategory(control.category()));
        }
        return collect(query).evidence().stream()
            .filter(item -> item.supports(control.controlId()))
            .toList();
    }

    /** One unfocused collection over the window, grouped by the controls each item cites. */
    public Map<String, List<CollectedEvidence>> collectForControls(String tenantId, List<ControlDefinition> controls,
                                                                   Instant start, Instant end) {
        EvidenceCollectionResult result = collect(EvidenceQuery.forWindow(tenantId, start, end));
        Map<String, List<CollectedEvidence>> grouped = new LinkedHashMap<>();
        for (ControlDefinition control : controls) {
            grouped.put(control.controlId(), result.evidence().stream()
                .filter(item -> item.supports(control.controlId()))
                .toList());
        }
        return grouped;
    }

    public List<EvidenceSourceType> availableSources() {
        List<EvidenceSourceType> available = new ArrayList<>();
        for (EvidenceSource source : sources) {
            if (source.isAvailable()) {
                available.add(source.type());
            }
        }
        return available;
    }

    private void validate(EvidenceQuery query) {
        if (query == null || query.tenantId() == null || query.tenantId().isBlank()) {
            throw new ValidationException("tenantId is required");
        }
        if (query.startTime() != null && query.endTime() != null && query.endTime().isBefore(query.startTime())) {
            throw new ValidationException("endTime must not be before startTime");
        }
        if (query.maxPerSource() != null && (query.maxPerSource() < 1 || query.maxPerSource() > 1000)) {
            throw new ValidationException("maxPerSource must be between 1 and 1000");
        }
    }
}
