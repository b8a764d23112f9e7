package com.policyledger.api;

import com.policyledger.evidence.CollectedEvidence;
import com.policyledger.evidence.ControlDefinition;
import com.policyledger.evidence.DecisionTrace;
import com.policyledger.evidence.DecisionTraceStore;
import com.policyledger.evidence.EvidenceCollectionResult;
import com.policyledger.evidence.EvidenceCollector;
import com.policyledger.evidence.EvidenceQuery;
import com.policyledger.evidence.EvidenceSourceType;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/v1/evidence")
public class EvidenceController {

    private final EvidenceCollector collector;
    private final DecisionTraceStore traceStore;

    public EvidenceController(EvidenceCollector collector, DecisionTraceStore traceStore) {
        this.collector = collector;
        this.traceStore = traceStore;
    }

    @PostMapping("/collect")
    public EvidenceCollectionResult collect(@RequestBody EvidenceQuery query) {
        return collector.collect(query);
    }

    @GetMapping("/{tenantId}/controls/{controlId}")
    public List<CollectedEvidence> forControl(@PathVariable String tenantId,
                                              @PathVariable String controlId,
                                              @RequestParam(required = false) String category,
                                              @RequestParam(required = false) Instant startTime,
                                              @RequestParam(required = false) Instant endTime,
                                              @RequestParam(required = false) Double minRelevance) {
        List<CollectedEvidence> evidence = collector.collectForControl(tenantId,
            new ControlDefinition(controlId, controlId, category), startTime, endTime);
        if (minRelevance == null) {
            return evidence;
        }
        return evidence.stream().filter(e -> e.relevanceScore() >= minRelevance).toList();
    }

    @PostMapping("/traces")
    @ResponseStatus(HttpStatus.CREATED)
    public Map<String, Object> recordTrace(@RequestBody DecisionTrace trace) {
        traceStore.record(trace);
        return Map.of("status", "recorded", "trace_id", trace.id());
    }

    @GetMapping("/sources")
    public List<EvidenceSourceType> sources() {
        return collector.availableSources();
    }
}
