package com.policyledger.audit;

import java.util.List;

/**
 * Action types that are always recorded as high risk. A listed type also covers
 * its sub-types, so {@code secret.delete} flags {@code secret.delete.all}.
 */
public final class HighRiskActions {

    public static final List<String> ACTION_TYPES = List.of(
        "git.push.force",
        "git.branch.delete",
        "git.push.main",
        "policy.rule.delete",
        "policy.document.delete",
        "secret.access",
        "secret.delete",
        "secret.rotate",
        "data.export",
        "data.delete.bulk",
        "admin.user.delete",
        "admin.role.revoke",
        "approval.bypass",
        "config.security.update",
        "agent.execute.destructive"
    );

    private HighRiskActions() {
    }

    public static boolean isHighRisk(String actionType) {
        if (actionType == null) {
            return false;
        }
        for (String pattern : ACTION_TYPES) {
            if (actionType.equals(pattern) || actionType.startsWith(pattern + ".")) {
                return true;
            }
        }
        return false;
    }
}
