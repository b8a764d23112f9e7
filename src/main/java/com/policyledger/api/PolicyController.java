package com.policyledger.api;

import com.policyledger.policy.engine.DryRunResult;
import com.policyledger.policy.engine.EvaluationResult;
import com.policyledger.policy.engine.PolicyEngine;
import com.policyledger.policy.model.EvaluationRequest;
import com.policyledger.policy.model.PolicyDocument;
import com.policyledger.policy.model.PolicyScope;
import com.policyledger.policy.store.PolicyInheritanceResolver;
import com.policyledger.policy.store.PolicyStore;
import com.policyledger.policy.store.ResolvedPolicy;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/v1/policies")
public class PolicyController {

    private final PolicyEngine engine;
    private final PolicyStore store;
    private final PolicyInheritanceResolver resolver;

    public PolicyController(PolicyEngine engine, PolicyStore store, PolicyInheritanceResolver resolver) {
        this.engine = engine;
        this.store = store;
        this.resolver = resolver;
    }

    @PostMapping
    public Map<String, Object> load(@RequestBody PolicyDocument document,
                                    @RequestParam(required = false) String policyId) {
        String id = policyId == null || policyId.isBlank() ? document.name() : policyId;
        engine.loadPolicy(id, document);
        return Map.of(
            "status", "loaded",
            "policy_id", id,
            "rule_count", document.rules() == null ? 0 : document.rules().size()
        );
    }

    @GetMapping
    public List<String> loaded() {
        return engine.getLoadedPolicies();
    }

    @GetMapping("/{policyId}")
    public PolicyDocument get(@PathVariable String policyId) {
        return engine.getPolicy(policyId)
            .orElseThrow(() -> new NotFoundException("Policy " + policyId + " is not loaded"));
    }

    @DeleteMapping("/{policyId}")
    public Map<String, Object> unload(@PathVariable String policyId) {
        if (!engine.unloadPolicy(policyId)) {
            throw new NotFoundException("Policy " + policyId + " is not loaded");
        }
        return Map.of("status", "unloaded", "policy_id", policyId);
    }

    @PostMapping("/evaluate")
    public EvaluationResult evaluate(@RequestBody EvaluationRequest request) {
        return engine.evaluate(request);
    }

    @PostMapping("/dry-run")
    public DryRunResult dryRun(@RequestBody EvaluationRequest request) {
        return engine.dryRun(request);
    }

    // ---- inheritance store ----

    @PutMapping("/store")
    public Map<String, Object> store(@RequestBody PolicyDocument document) {
        store.put(document);
        return Map.of(
            "status", "stored",
            "scope", document.scope().getValue(),
            "scope_target", document.scopeTarget() == null ? PolicyStore.DEFAULT_TARGET : document.scopeTarget()
        );
    }

    @GetMapping("/store")
    public List<PolicyDocument> stored(@RequestParam(required = false) String scope) {
        return store.listPolicies(scope == null ? null : PolicyScope.fromValue(scope));
    }

    @GetMapping("/resolve")
    public ResolvedPolicy resolve(@RequestParam(required = false) String org,
                                  @RequestParam(required = false) String repo,
                                  @RequestParam(required = false) String branch) {
        return resolver.resolve(org, repo, branch);
    }

    /**
     * Resolves the inheritance chain for a target and loads the merged document
     * into the engine under {@code resolved:{org}/{repo}/{branch}}.
     */
    @PostMapping("/resolve/activate")
    public Map<String, Object> activate(@RequestParam(required = false) String org,
                                        @RequestParam(required = false) String repo,
                                        @RequestParam(required = false) String branch) {
        ResolvedPolicy resolved = resolver.resolve(org, repo, branch);
        String id = "resolved:" + part(org) + "/" + part(repo) + "/" + part(branch);
        engine.loadPolicy(id, resolved.policy());
        return Map.of(
            "status", "loaded",
            "policy_id", id,
            "chain_depth", resolved.metadata().chainDepth(),
            "rule_count", resolved.metadata().totalRulesAfterMerge()
        );
    }

    private static String part(String value) {
        return value == null ? "*" : value;
    }
}
