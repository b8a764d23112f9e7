package com.policyledger.policy.engine;

import com.policyledger.config.PolicyLedgerProperties;
import com.policyledger.contract.PolicyDocumentValidator;
import com.policyledger.contract.ValidationException;
import com.policyledger.policy.condition.CompiledCondition;
import com.policyledger.policy.condition.ConditionCompilationException;
import com.policyledger.policy.condition.ConditionEvaluator;
import com.policyledger.policy.condition.ConditionExplanation;
import com.policyledger.policy.condition.PolicyCondition;
import com.policyledger.policy.model.ApprovalConfig;
import com.policyledger.policy.model.ConditionGroup;
import com.policyledger.policy.model.Effect;
import com.policyledger.policy.model.EvaluationRequest;
import com.policyledger.policy.model.PolicyAction;
import com.policyledger.policy.model.PolicyDocument;
import com.policyledger.policy.model.PolicyRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Compiles policy documents and evaluates requests against them.
 *
 * Loaded documents live in an immutable snapshot swapped atomically on load and
 * unload; an evaluation works on whichever snapshot it read first. Deny is
 * absolute, approval requirements accumulate across matching rules, and the
 * first permissive match decides unless it asks to continue.
 */
public class PolicyEngine {

    private static final Logger log = LoggerFactory.getLogger(PolicyEngine.class);

    private final PolicyLedgerProperties.Engine config;
    private final PolicyDocumentValidator validator;
    private final AtomicReference<Snapshot> snapshot = new AtomicReference<>(Snapshot.EMPTY);

    public PolicyEngine(PolicyLedgerProperties.Engine config, PolicyDocumentValidator validator) {
        this.config = config;
        this.validator = validator;
    }

    // ---- loading ----

    /** Loads a document under its own name. */
    public void loadPolicy(PolicyDocument document) {
        Objects.requireNonNull(document, "document");
        loadPolicy(document.name(), document);
    }

    /**
     * Loads or replaces a document. Either every rule compiles and the new set is
     * published, or nothing changes.
     *
     * @throws ValidationException if the document is malformed
     * @throws PolicyConflictException if two rules share an id
     */
    public synchronized void loadPolicy(String policyId, PolicyDocument document) {
        if (policyId == null || policyId.isBlank()) {
            throw new ValidationException("policy id is required");
        }
        if (document == null) {
            throw new ValidationException("policy document cannot be null");
        }
        if (config.isValidateOnLoad()) {
            validator.validate(document);
        }
        List<PolicyRule> rules = document.rules() == null ? List.of() : document.rules();
        Set<String> seen = new HashSet<>();
        for (PolicyRule rule : rules) {
            if (!seen.add(rule.id())) {
                throw new PolicyConflictException(policyId, rule.id());
            }
        }

        List<CompiledRule> compiled = new ArrayList<>(rules.size());
        for (PolicyRule rule : rules) {
            compiled.add(compileRule(policyId, rule));
        }

        Snapshot current = snapshot.get();
        Map<String, LoadedPolicy> next = new LinkedHashMap<>(current.policies());
        next.put(policyId, new LoadedPolicy(policyId, document, List.copyOf(compiled), Instant.now()));
        snapshot.set(Snapshot.of(next));

        long enabled = rules.stream().filter(PolicyRule::enabled).count();
        log.info("Loaded policy {} ({} rules, {} enabled)", policyId, rules.size(), enabled);
    }

    public synchronized boolean unloadPolicy(String policyId) {
        Snapshot current = snapshot.get();
        if (!current.policies().containsKey(policyId)) {
            return false;
        }
        Map<String, LoadedPolicy> next = new LinkedHashMap<>(current.policies());
        next.remove(policyId);
        snapshot.set(Snapshot.of(next));
        log.info("Unloaded policy {}", policyId);
        return true;
    }

    public synchronized void clearPolicies() {
        snapshot.set(Snapshot.EMPTY);
        log.info("Cleared all loaded policies");
    }

    public List<String> getLoadedPolicies() {
        return List.copyOf(snapshot.get().policies().keySet());
    }

    public Optional<PolicyDocument> getPolicy(String policyId) {
        LoadedPolicy loaded = snapshot.get().policies().get(policyId);
        return loaded == null ? Optional.empty() : Optional.of(loaded.document());
    }

    // ---- evaluation ----

    public EvaluationResult evaluate(EvaluationRequest request) {
        Objects.requireNonNull(request, "request");
        long started = System.nanoTime();
        Instant evaluatedAt = Instant.now();
        Snapshot current = snapshot.get();

        List<String> triggered = new ArrayList<>();
        List<EvaluationResult.RequiredAction> actions = new ArrayList<>();
        List<CompiledRule> approvalRules = new ArrayList<>();
        CompiledRule candidate = null;
        int evaluated = 0;

        for (CompiledRule rule : current.orderedRules()) {
            evaluated++;
            if (!rule.matches(request)) {
                continue;
            }
            triggered.add(rule.id());
            PolicyAction action = rule.rule().action();

            if (action.effect() == Effect.DENY) {
                List<EvaluationResult.RequiredAction> denyActions = new ArrayList<>();
                addNotification(denyActions, action);
                return new EvaluationResult(false, Effect.DENY, reasonOf(rule), matched(rule),
                    denyActions, null, triggered,
                    metadata(evaluatedAt, started, evaluated, current));
            }
            if (action.effect() == Effect.REQUIRE_APPROVAL) {
                approvalRules.add(rule);
                actions.add(new EvaluationResult.RequiredAction(
                    EvaluationResult.RequiredAction.Type.APPROVAL, approvalConfig(action)));
                addNotification(actions, action);
                if (config.isStopOnFirstMatch()) {
                    break;
                }
                continue;
            }

            addNotification(actions, action);
            if (candidate == null) {
                candidate = rule;
            }
            if (!action.continueOnMatch()) {
                break;
            }
        }

        EvaluationResult.Metadata metadata = metadata(evaluatedAt, started, evaluated, current);

        if (!approvalRules.isEmpty()) {
            CompiledRule primary = approvalRules.get(0);
            EvaluationResult.MissingRequirements missing = missingRequirements(request, approvalRules);
            return new EvaluationResult(missing.satisfied(), Effect.REQUIRE_APPROVAL, reasonOf(primary),
                matched(primary), actions, missing, triggered, metadata);
        }
        if (candidate != null) {
            Effect effect = candidate.rule().action().effect();
            return new EvaluationResult(effect.isPermissive(), effect, reasonOf(candidate),
                matched(candidate), actions, null, triggered, metadata);
        }

        Effect fallback = config.getDefaultEffect();
        String reason = current.policies().isEmpty()
            ? "No policies loaded; applying default effect " + fallback.getValue()
            : "No matching rule; applying default effect " + fallback.getValue();
        return new EvaluationResult(fallback.isPermissive(), fallback, reason, null, List.of(), null,
            triggered, metadata);
    }

    /**
     * Evaluates every enabled rule without short-circuiting and explains each
     * condition. Has no side effects.
     */
    public DryRunResult dryRun(EvaluationRequest request) {
        Objects.requireNonNull(request, "request");
        long started = System.nanoTime();
        Snapshot current = snapshot.get();

        List<DryRunResult.RuleEvaluation> all = new ArrayList<>();
        List<DryRunResult.RuleEvaluation> matching = new ArrayList<>();
        List<DryRunResult.RuleEvaluation> nonMatching = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        for (LoadedPolicy policy : current.policies().values()) {
            for (CompiledRule rule : policy.rules()) {
                if (!rule.rule().enabled()) {
                    warnings.add("Rule " + rule.id() + " in policy " + policy.policyId() + " is disabled");
                }
            }
        }

        for (CompiledRule rule : current.orderedRules()) {
            boolean matched = rule.matches(request);
            List<ConditionExplanation> explanations = new ArrayList<>();
            for (PolicyCondition condition : leafConditions(rule.rule())) {
                boolean conditionMatched = ConditionEvaluator.evaluate(condition, request);
                explanations.add(ConditionEvaluator.explain(condition, request, conditionMatched));
            }
            DryRunResult.RuleEvaluation evaluation = new DryRunResult.RuleEvaluation(
                rule.id(), rule.rule().name(), rule.policyId(), rule.priority(), matched,
                explanations, rule.rule().action());
            all.add(evaluation);
            (matched ? matching : nonMatching).add(evaluation);
        }

        if (current.policies().isEmpty()) {
            warnings.add("No policies loaded");
        } else if (matching.isEmpty()) {
            warnings.add("No rules matched; default effect " + config.getDefaultEffect().getValue() + " would apply");
        } else if (matching.size() > 1) {
            warnings.add(matching.size() + " rules matched; the highest priority match applies");
        }

        DryRunResult.RuleEvaluation primary = matching.isEmpty() ? null : matching.get(0);
        Effect wouldEffect = primary == null ? config.getDefaultEffect() : primary.wouldApply().effect();
        String reason;
        if (primary == null) {
            reason = "No matching rule; default effect " + config.getDefaultEffect().getValue();
        } else if (primary.wouldApply().reason() != null) {
            reason = primary.wouldApply().reason();
        } else {
            reason = "Matched rule: " + primary.ruleName();
        }
        long elapsed = (System.nanoTime() - started) / 1_000_000;

        return new DryRunResult(true, wouldEffect.isPermissive(), wouldEffect, reason, primary,
            List.copyOf(all), List.copyOf(matching), List.copyOf(nonMatching),
            new DryRunResult.Summary(current.policies().size(), all.size(), matching.size(), elapsed),
            List.copyOf(warnings));
    }

    // ---- helpers ----

    private EvaluationResult.MissingRequirements missingRequirements(EvaluationRequest request,
                                                                     List<CompiledRule> approvalRules) {
        int minApprovers = 0;
        boolean allowSelf = true;
        Set<String> roles = new LinkedHashSet<>();
        for (CompiledRule rule : approvalRules) {
            ApprovalConfig approval = approvalConfig(rule.rule().action());
            minApprovers = Math.max(minApprovers, approval.minApprovers());
            allowSelf &= approval.allowSelfApproval();
            if (approval.requiredRoles() != null) {
                roles.addAll(approval.requiredRoles());
            }
        }
        boolean protectedBranch = request.resource() != null && request.resource().onProtectedBranch();
        int floor = protectedBranch ? config.getProtectedBranchApprovers() : config.getDefaultApprovers();
        int required = Math.max(minApprovers, floor);

        String requester = request.actor() == null ? null : request.actor().id();
        Set<String> approvers = new HashSet<>();
        Set<String> grantedScopes = new HashSet<>();
        for (EvaluationRequest.ExistingApproval approval : request.approvals()) {
            if (approval.approverId() == null || !approval.countsAsHuman()) {
                continue;
            }
            if (!allowSelf && approval.approverId().equals(requester)) {
                continue;
            }
            approvers.add(approval.approverId());
            grantedScopes.addAll(approval.scopes());
        }

        List<String> missingScopes = request.requiredScopes().stream()
            .filter(scope -> !grantedScopes.contains(scope))
            .distinct()
            .toList();
        int needed = Math.max(0, required - approvers.size());
        return new EvaluationResult.MissingRequirements(needed, missingScopes, List.copyOf(roles));
    }

    private ApprovalConfig approvalConfig(PolicyAction action) {
        return action.approval() != null ? action.approval() : ApprovalConfig.minApprovers(config.getDefaultApprovers());
    }

    private static void addNotification(List<EvaluationResult.RequiredAction> actions, PolicyAction action) {
        if (action.notification() != null) {
            actions.add(new EvaluationResult.RequiredAction(
                EvaluationResult.RequiredAction.Type.NOTIFICATION, action.notification()));
        }
    }

    private static String reasonOf(CompiledRule rule) {
        String reason = rule.rule().action().reason();
        return reason != null ? reason : "Matched rule: " + rule.rule().name();
    }

    private static EvaluationResult.MatchedRule matched(CompiledRule rule) {
        return new EvaluationResult.MatchedRule(rule.id(), rule.rule().name(), rule.policyId());
    }

    private static EvaluationResult.Metadata metadata(Instant evaluatedAt, long started, int evaluated,
                                                      Snapshot current) {
        return new EvaluationResult.Metadata(evaluatedAt, (System.nanoTime() - started) / 1_000_000,
            evaluated, current.policies().size());
    }

    private CompiledRule compileRule(String policyId, PolicyRule rule) {
        List<CompiledCondition> conditions = rule.conditions().stream()
            .map(this::compileCondition)
            .toList();
        CompiledRule.Group logic = rule.conditionLogic() == null ? null : compileGroup(rule.conditionLogic());
        return new CompiledRule(policyId, rule, conditions, logic);
    }

    private CompiledRule.Group compileGroup(ConditionGroup group) {
        List<CompiledCondition> conditions = group.conditions().stream()
            .map(this::compileCondition)
            .toList();
        List<CompiledRule.Group> groups = group.groups().stream()
            .map(this::compileGroup)
            .toList();
        return new CompiledRule.Group(group.operator(), conditions, groups);
    }

    private CompiledCondition compileCondition(PolicyCondition condition) {
        try {
            return ConditionEvaluator.compile(condition);
        } catch (ConditionCompilationException ex) {
            if (config.isValidateOnLoad()) {
                throw new ValidationException(ex.getMessage());
            }
            log.warn("Condition {} does not compile and will never match: {}", condition.kind(), ex.getMessage());
            return new CompiledCondition(condition, request -> false);
        }
    }

    private static List<PolicyCondition> leafConditions(PolicyRule rule) {
        if (rule.conditionLogic() == null) {
            return rule.conditions();
        }
        List<PolicyCondition> leaves = new ArrayList<>();
        collectLeaves(rule.conditionLogic(), leaves);
        return leaves;
    }

    private static void collectLeaves(ConditionGroup group, List<PolicyCondition> into) {
        into.addAll(group.conditions());
        for (ConditionGroup nested : group.groups()) {
            collectLeaves(nested, into);
        }
    }

    private record LoadedPolicy(String policyId, PolicyDocument document, List<CompiledRule> rules,
                                Instant loadedAt) {}

    private record Snapshot(Map<String, LoadedPolicy> policies, List<CompiledRule> orderedRules) {

        static final Snapshot EMPTY = new Snapshot(Map.of(), List.of());

        static Snapshot of(Map<String, LoadedPolicy> policies) {
            List<CompiledRule> ordered = new ArrayList<>();
            for (LoadedPolicy policy : policies.values()) {
                for (CompiledRule rule : policy.rules()) {
                    if (rule.rule().enabled()) {
                        ordered.add(rule);
                    }
                }
            }
            // List.sort is stable: ties keep load order
            ordered.sort(Comparator.comparingInt(CompiledRule::priority).reversed());
            return new Snapshot(Collections.unmodifiableMap(new LinkedHashMap<>(policies)), List.copyOf(ordered));
        }
    }
}
