package com.policyledger.evidence;

import java.util.List;

public interface DecisionTraceStore {

    void record(DecisionTrace trace);

    /** Matching traces, newest first, at most {@code filter.limit()} of them. */
    List<DecisionTrace> query(DecisionTraceFilter filter);
}
