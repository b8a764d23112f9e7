package com.policyledger.gate;

import com.policyledger.audit.ActionCategory;
import com.policyledger.audit.ActorType;
import com.policyledger.audit.AgentType;
import com.policyledger.audit.AuditEntryInput;
import com.policyledger.audit.AuditLogEntry;
import com.policyledger.audit.AuditLogService;
import com.policyledger.audit.OutcomeStatus;
import com.policyledger.audit.ResourceType;
import com.policyledger.contract.ValidationException;
import com.policyledger.policy.engine.EvaluationResult;
import com.policyledger.policy.engine.PolicyEngine;
import com.policyledger.policy.model.Effect;
import com.policyledger.policy.model.EvaluationRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Evaluates a request and records the decision in the tenant's audit log.
 *
 * The decision is returned only once it is recorded; if the append fails the
 * caller gets the append error, never an unrecorded decision.
 */
@Service
public class PolicyGateService {

    private static final Logger log = LoggerFactory.getLogger(PolicyGateService.class);

    static final String DECISION_ACTION = "policy.decision.evaluated";

    private final PolicyEngine engine;
    private final AuditLogService auditLogService;

    public PolicyGateService(PolicyEngine engine, AuditLogService auditLogService) {
        this.engine = engine;
        this.auditLogService = auditLogService;
    }

    public GateDecision check(String tenantId, EvaluationRequest request) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new ValidationException("tenantId is required");
        }
        if (request == null) {
            throw new ValidationException("evaluation request is required");
        }
        EvaluationResult decision = engine.evaluate(request);
        AuditLogEntry entry = auditLogService.append(tenantId, toAuditInput(tenantId, request, decision));

        log.info("Gate decision tenant={} action={} effect={} allowed={} rule={} audit={}",
            tenantId, request.action() == null ? null : request.action().name(),
            decision.effect().getValue(), decision.allowed(),
            decision.matchedRule() == null ? null : decision.matchedRule().id(), entry.id());
        return new GateDecision(decision, entry);
    }

    static OutcomeStatus outcomeOf(EvaluationResult decision) {
        if (decision.allowed()) {
            return OutcomeStatus.SUCCESS;
        }
        return decision.effect() == Effect.REQUIRE_APPROVAL ? OutcomeStatus.PENDING : OutcomeStatus.DENIED;
    }

    private static AuditEntryInput toAuditInput(String tenantId, EvaluationRequest request, EvaluationResult decision) {
        EvaluationRequest.Actor requester = request.actor();
        EvaluationRequest.Action requested = request.action();
        boolean agent = requester != null && "agent".equalsIgnoreCase(requester.type());
        AgentType agentType = requested == null || requested.agentType() == null
            ? null
            : parseAgentType(requested.agentType());

        AuditLogEntry.Actor actor = new AuditLogEntry.Actor(
            agent ? ActorType.AGENT : ActorType.USER,
            requester == null || requester.id() == null ? "anonymous" : requester.id(),
            null, agentType, null);
        String actionName = requested == null ? null : requested.name();
        AuditLogEntry.Action action = new AuditLogEntry.Action(ActionCategory.POLICY, DECISION_ACTION,
            "Policy decision for " + actionName, false);

        AuditLogEntry.Outcome outcome = new AuditLogEntry.Outcome(outcomeOf(decision),
            decision.allowed() ? null : decision.effect().getValue(),
            decision.allowed() ? null : decision.reason(),
            decision.metadata() == null ? null : decision.metadata().evaluationTimeMs());

        AuditLogEntry.Context context = AuditLogEntry.Context.ofTenant(tenantId)
            .withTraceId(request.context().traceId())
            .withRequestId(request.context().requestId());

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("requestedAction", actionName);
        details.put("effect", decision.effect().getValue());
        details.put("allowed", decision.allowed());
        details.put("reason", decision.reason());
        if (decision.matchedRule() != null) {
            details.put("matchedRuleId", decision.matchedRule().id());
            details.put("policyId", decision.matchedRule().policyId());
        }
        details.put("triggeredRuleIds", decision.triggeredRuleIds());
        if (decision.missingRequirements() != null) {
            details.put("approvalsNeeded", decision.missingRequirements().approvalsNeeded());
            details.put("missingScopes", decision.missingRequirements().missingScopes());
        }

        List<String> tags = new ArrayList<>();
        tags.add("policy-decision");
        tags.add(decision.effect().getValue());

        return AuditEntryInput.of(actor, action, outcome)
            .withResource(resourceOf(request))
            .withContext(context)
            .withTags(tags)
            .withDetails(details);
    }

    private static AuditLogEntry.Resource resourceOf(EvaluationRequest request) {
        EvaluationRequest.Resource resource = request.resource();
        if (resource == null || resource.repo() == null) {
            return null;
        }
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("requestedResourceType", resource.type());
        if (resource.branch() != null) {
            attributes.put("branch", resource.branch());
            attributes.put("protected", resource.onProtectedBranch());
        }
        if (!resource.files().isEmpty()) {
            attributes.put("fileCount", resource.files().size());
        }
        return new AuditLogEntry.Resource(ResourceType.REPOSITORY, resource.repo().fullName(),
            resource.repo().name(), attributes);
    }

    private static AgentType parseAgentType(String raw) {
        try {
            return AgentType.fromValue(raw);
        } catch (IllegalArgumentException ex) {
            log.debug("Unrecognized agent type {} left off the audit actor", raw);
            return null;
        }
    }
}
