package com.policyledger.policy.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record PolicyAction(
    Effect effect,
    String reason,
    ApprovalConfig approval,
    NotificationConfig notification,
    boolean continueOnMatch
) {

    public static PolicyAction of(Effect effect, String reason) {
        return new PolicyAction(effect, reason, null, null, false);
    }

    public static PolicyAction requireApproval(String reason, ApprovalConfig approval) {
        return new PolicyAction(Effect.REQUIRE_APPROVAL, reason, approval, null, false);
    }
}
