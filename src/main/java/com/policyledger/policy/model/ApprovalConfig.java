package com.policyledger.policy.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApprovalConfig(
    Integer minApprovers,
    List<String> requiredRoles,
    List<String> requiredTeams,
    Integer timeoutHours,
    Boolean allowSelfApproval,
    String escalateTo
) {

    public ApprovalConfig {
        minApprovers = minApprovers == null ? 1 : minApprovers;
        allowSelfApproval = allowSelfApproval != null && allowSelfApproval;
    }

    public static ApprovalConfig minApprovers(int count) {
        return new ApprovalConfig(count, null, null, null, false, null);
    }
}
