package com.policyledger.policy.store;

import com.policyledger.contract.ValidationException;
import com.policyledger.policy.model.InheritanceMode;
import com.policyledger.policy.model.PolicyDocument;
import com.policyledger.policy.model.PolicyRule;
import com.policyledger.policy.model.PolicyScope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Merges the global, org, repo and branch documents that apply to a target into
 * one effective document.
 *
 * Each child combines with what it inherits according to its own mode:
 * {@code replace} discards the parent rules, {@code extend} only adds rules with
 * new ids, {@code override} lets child rules win on id collisions.
 */
@Component
public class PolicyInheritanceResolver {

    private static final Logger log = LoggerFactory.getLogger(PolicyInheritanceResolver.class);

    private final PolicyStore store;

    public PolicyInheritanceResolver(PolicyStore store) {
        this.store = store;
    }

    /**
     * Resolves the chain for a target. Absent levels are skipped; an empty chain
     * yields an empty document named {@code empty}.
     */
    public ResolvedPolicy resolve(String org, String repo, String branch) {
        List<PolicyDocument> chain = new ArrayList<>();
        store.getPolicy(PolicyScope.GLOBAL, PolicyStore.DEFAULT_TARGET).ifPresent(chain::add);
        if (org != null) {
            store.getPolicy(PolicyScope.ORG, org).ifPresent(chain::add);
        }
        if (repo != null) {
            store.getPolicy(PolicyScope.REPO, repo).ifPresent(chain::add);
        }
        if (branch != null) {
            store.getPolicy(PolicyScope.BRANCH, branch).ifPresent(chain::add);
        }
        return merge(chain);
    }

    /**
     * Resolves a named document together with its {@code parentPolicyId} ancestors.
     *
     * @throws ValidationException if the parent links loop or a parent is not
     *                             broader than its child
     */
    public Optional<ResolvedPolicy> resolvePolicy(String name) {
        Optional<PolicyDocument> start = store.findByName(name);
        if (start.isEmpty()) {
            return Optional.empty();
        }
        List<PolicyDocument> chain = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        PolicyDocument current = start.get();
        while (current != null) {
            if (!visited.add(current.name())) {
                throw new ValidationException("policy inheritance cycle at " + current.name());
            }
            chain.add(0, current);
            if (current.parentPolicyId() == null) {
                break;
            }
            PolicyDocument parent = store.findByName(current.parentPolicyId()).orElse(null);
            if (parent != null) {
                requireBroader(current, parent);
            } else {
                log.warn("Parent policy {} of {} not found; resolving without it",
                    current.parentPolicyId(), current.name());
            }
            current = parent;
        }
        return Optional.of(merge(chain));
    }

    static void requireBroader(PolicyDocument child, PolicyDocument parent) {
        if (child.scope().ordinal() <= parent.scope().ordinal()) {
            throw new ValidationException("child scope '" + child.scope().getValue()
                + "' must be more specific than parent scope '" + parent.scope().getValue() + "'");
        }
    }

    private ResolvedPolicy merge(List<PolicyDocument> chain) {
        Instant resolvedAt = Instant.now();
        if (chain.isEmpty()) {
            PolicyDocument empty = new PolicyDocument(null, "empty", null, null, null, null, null, List.of());
            return new ResolvedPolicy(empty, List.of(), Map.of(),
                new ResolvedPolicy.Metadata(resolvedAt, 0, 0, 0));
        }

        int before = chain.stream().mapToInt(document -> rulesOf(document).size()).sum();
        PolicyDocument root = chain.get(0);
        List<PolicyRule> rules = new ArrayList<>(rulesOf(root));
        Map<String, String> origins = new LinkedHashMap<>();
        rules.forEach(rule -> origins.put(rule.id(), root.name()));
        PolicyDocument merged = root.withRules(rules);

        for (PolicyDocument child : chain.subList(1, chain.size())) {
            rules = mergeRules(rules, child, origins);
            merged = child.withRules(rules);
        }

        log.debug("Resolved {} documents into {} ({} -> {} rules)",
            chain.size(), merged.name(), before, rules.size());
        return new ResolvedPolicy(merged, List.copyOf(chain), Map.copyOf(origins),
            new ResolvedPolicy.Metadata(resolvedAt, chain.size(), before, rules.size()));
    }

    private static List<PolicyRule> mergeRules(List<PolicyRule> inherited, PolicyDocument child,
                                               Map<String, String> origins) {
        List<PolicyRule> childRules = rulesOf(child);
        InheritanceMode mode = child.inheritance();

        if (mode == InheritanceMode.REPLACE) {
            origins.clear();
            childRules.forEach(rule -> origins.put(rule.id(), child.name()));
            return new ArrayList<>(childRules);
        }

        Map<String, PolicyRule> byId = new LinkedHashMap<>();
        inherited.forEach(rule -> byId.put(rule.id(), rule));
        for (PolicyRule rule : childRules) {
            boolean present = byId.containsKey(rule.id());
            if (mode == InheritanceMode.EXTEND && present) {
                continue;
            }
            byId.put(rule.id(), rule);
            origins.put(rule.id(), child.name());
        }
        List<PolicyRule> result = new ArrayList<>(byId.values());
        result.sort(Comparator.comparingInt(PolicyRule::priority).reversed());
        return result;
    }

    private static List<PolicyRule> rulesOf(PolicyDocument document) {
        return document.rules() == null ? List.of() : document.rules();
    }
}
