package com.policyledger.policy.store;

import com.policyledger.policy.model.PolicyDocument;
import com.policyledger.policy.model.PolicyScope;

import java.util.List;
import java.util.Optional;

/**
 * Source of policy documents for inheritance resolution. Holds at most one
 * document per (scope, target); global documents use the target {@value #DEFAULT_TARGET}.
 */
public interface PolicyStore {

    String DEFAULT_TARGET = "default";

    void put(PolicyDocument document);

    Optional<PolicyDocument> getPolicy(PolicyScope scope, String target);

    /** Documents of the given scope, or of every scope when {@code scope} is null. */
    List<PolicyDocument> listPolicies(PolicyScope scope);

    /** Looks a document up by name; used to follow {@code parentPolicyId}. */
    Optional<PolicyDocument> findByName(String name);

    boolean remove(PolicyScope scope, String target);
}
