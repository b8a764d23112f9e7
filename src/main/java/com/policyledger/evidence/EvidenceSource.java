package com.policyledger.evidence;

import java.util.List;

/**
 * A place evidence can be read from. Implementations must not modify what they read.
 */
public interface EvidenceSource {

    EvidenceSourceType type();

    default boolean isAvailable() {
        return true;
    }

    List<CollectedEvidence> collect(EvidenceQuery query);
}
