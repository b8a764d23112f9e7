package com.policyledger.evidence;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.policyledger.chain.ChainVerificationResult;

import java.util.List;

/**
 * One piece of evidence with its relevance to the query and, for audit entries,
 * the verification of the window it was read from.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CollectedEvidence(
    EvidenceReference evidence,
    EvidenceSourceType source,
    double relevanceScore,
    List<String> relatedControlIds,
    ChainVerificationResult chainVerification
) {

    public CollectedEvidence {
        relatedControlIds = relatedControlIds == null ? List.of() : List.copyOf(relatedControlIds);
    }

    public boolean supports(String controlId) {
        return relatedControlIds.contains(controlId);
    }
}
