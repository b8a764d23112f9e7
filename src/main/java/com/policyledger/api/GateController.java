package com.policyledger.api;

import com.policyledger.gate.GateDecision;
import com.policyledger.gate.PolicyGateService;
import com.policyledger.policy.model.EvaluationRequest;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * POST /v1/gate/{tenantId}/check
 *
 * Evaluates the request and records the decision in the tenant's audit log.
 * The response carries both the decision and the audit entry.
 */
@RestController
@RequestMapping("/v1/gate")
public class GateController {

    private final PolicyGateService gateService;

    public GateController(PolicyGateService gateService) {
        this.gateService = gateService;
    }

    @PostMapping("/{tenantId}/check")
    public GateDecision check(@PathVariable String tenantId, @RequestBody EvaluationRequest request) {
        return gateService.check(tenantId, request);
    }
}
