package com.policyledger.policy.store;

import com.policyledger.policy.model.PolicyDocument;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Result of merging an inheritance chain.
 *
 * @param chain       merged documents, most general first
 * @param ruleOrigins rule id to the name of the document that supplied it
 */
public record ResolvedPolicy(
    PolicyDocument policy,
    List<PolicyDocument> chain,
    Map<String, String> ruleOrigins,
    Metadata metadata
) {

    public record Metadata(Instant resolvedAt, int chainDepth, int totalRulesBeforeMerge, int totalRulesAfterMerge) {}
}
