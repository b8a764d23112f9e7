package com.policyledger.evidence;

import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

@Component
public class InMemoryDecisionTraceStore implements DecisionTraceStore {

    private final List<DecisionTrace> traces = new CopyOnWriteArrayList<>();

    @Override
    public void record(DecisionTrace trace) {
        if (trace == null || trace.id() == null || trace.timestamp() == null) {
            throw new IllegalArgumentException("decision trace needs an id and a timestamp");
        }
        traces.add(trace);
    }

    @Override
    public List<DecisionTrace> query(DecisionTraceFilter filter) {
        int limit = filter.limit() == null ? Integer.MAX_VALUE : filter.limit();
        return traces.stream()
            .filter(filter::matches)
            .sorted(Comparator.comparing(DecisionTrace::timestamp).reversed())
            .limit(limit)
            .toList();
    }
}
