package com.policyledger.policy.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Set;

/**
 * A named, versioned set of rules. Immutable once loaded.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PolicyDocument(
    String version,
    String name,
    String description,
    PolicyScope scope,
    String scopeTarget,
    InheritanceMode inheritance,
    String parentPolicyId,
    List<PolicyRule> rules
) {

    public static final Set<String> SUPPORTED_VERSIONS = Set.of("1.0", "1.1", "2.0");
    public static final String CURRENT_VERSION = "2.0";

    public PolicyDocument {
        version = version == null ? CURRENT_VERSION : version;
        scope = scope == null ? PolicyScope.REPO : scope;
        inheritance = inheritance == null ? InheritanceMode.OVERRIDE : inheritance;
        rules = rules == null ? null : List.copyOf(rules);
    }

    public PolicyDocument withRules(List<PolicyRule> replacement) {
        return new PolicyDocument(version, name, description, scope, scopeTarget, inheritance,
            parentPolicyId, replacement);
    }
}
