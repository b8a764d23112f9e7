package com.policyledger.evidence;

import com.policyledger.audit.ActionCategory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import static com.policyledger.audit.ActionCategory.ADMIN;
import static com.policyledger.audit.ActionCategory.AGENT;
import static com.policyledger.audit.ActionCategory.APPROVAL;
import static com.policyledger.audit.ActionCategory.AUTH;
import static com.policyledger.audit.ActionCategory.BILLING;
import static com.policyledger.audit.ActionCategory.CONFIG;
import static com.policyledger.audit.ActionCategory.DATA;
import static com.policyledger.audit.ActionCategory.GIT;
import static com.policyledger.audit.ActionCategory.POLICY;
import static com.policyledger.audit.ActionCategory.SECURITY;

/**
 * Static tables linking compliance controls to the audit action categories that
 * evidence them: control categories, SOC 2 trust service criteria and ISO 27001
 * Annex A controls.
 */
public final class ControlMappings {

    /** Queried when nothing narrows the request; billing is left out. */
    public static final List<ActionCategory> OPERATIONAL_CATEGORIES =
        List.of(AUTH, SECURITY, POLICY, GIT, AGENT, APPROVAL, CONFIG, ADMIN);

    public static final Map<String, List<ActionCategory>> CONTROL_CATEGORIES = orderedMap(
        "access_control", List.of(AUTH, SECURITY, ADMIN),
        "logical_access", List.of(AUTH, SECURITY, ADMIN),
        "identity_management", List.of(AUTH, ADMIN),
        "change_management", List.of(GIT, CONFIG, APPROVAL),
        "system_changes", List.of(CONFIG, ADMIN),
        "configuration_management", List.of(CONFIG),
        "incident_response", List.of(SECURITY, AGENT),
        "security_monitoring", List.of(SECURITY, POLICY),
        "vulnerability_management", List.of(SECURITY),
        "risk_assessment", List.of(POLICY, AGENT, APPROVAL),
        "risk_management", List.of(POLICY, SECURITY),
        "data_protection", List.of(DATA, SECURITY),
        "encryption", List.of(SECURITY, CONFIG),
        "data_retention", List.of(DATA, ADMIN),
        "availability", List.of(CONFIG, ADMIN),
        "backup_recovery", List.of(DATA, ADMIN),
        "capacity_management", List.of(CONFIG, ADMIN),
        "ai_operations", List.of(AGENT, APPROVAL),
        "ai_governance", List.of(AGENT, POLICY, APPROVAL),
        "billing", List.of(BILLING),
        "compliance", List.of(POLICY, APPROVAL, SECURITY)
    );

    public static final Map<String, List<ActionCategory>> SOC2_CRITERIA = orderedMap(
        "CC6", List.of(AUTH, SECURITY, ADMIN),
        "CC6.1", List.of(AUTH, SECURITY),
        "CC6.2", List.of(AUTH, ADMIN),
        "CC6.3", List.of(AUTH, SECURITY),
        "CC6.4", List.of(SECURITY, CONFIG),
        "CC6.5", List.of(SECURITY, CONFIG),
        "CC6.6", List.of(AUTH, SECURITY),
        "CC6.7", List.of(SECURITY, CONFIG),
        "CC6.8", List.of(DATA, SECURITY),
        "CC7", List.of(CONFIG, SECURITY, AGENT),
        "CC7.1", List.of(SECURITY, AGENT),
        "CC7.2", List.of(SECURITY, CONFIG),
        "CC7.3", List.of(SECURITY, ADMIN),
        "CC7.4", List.of(SECURITY, AGENT),
        "CC7.5", List.of(ADMIN, SECURITY),
        "CC8", List.of(GIT, CONFIG, APPROVAL),
        "CC8.1", List.of(GIT, APPROVAL, AGENT),
        "CC3", List.of(POLICY, SECURITY, AGENT),
        "CC3.1", List.of(POLICY, SECURITY),
        "CC3.2", List.of(POLICY, AGENT),
        "CC3.3", List.of(POLICY, AGENT),
        "CC3.4", List.of(POLICY, SECURITY),
        "CC5", List.of(POLICY, APPROVAL, SECURITY),
        "CC5.1", List.of(POLICY, APPROVAL),
        "CC5.2", List.of(GIT, AGENT, APPROVAL),
        "CC5.3", List.of(CONFIG, ADMIN)
    );

    public static final Map<String, List<ActionCategory>> ISO27001_CONTROLS = orderedMap(
        "A.5", List.of(POLICY, ADMIN),
        "A.5.1", List.of(POLICY, ADMIN),
        "A.6", List.of(ADMIN, SECURITY),
        "A.6.1", List.of(ADMIN, SECURITY),
        "A.6.2", List.of(ADMIN, CONFIG),
        "A.8", List.of(DATA, CONFIG, ADMIN),
        "A.8.1", List.of(DATA, ADMIN),
        "A.8.2", List.of(DATA, SECURITY),
        "A.8.3", List.of(DATA, CONFIG),
        "A.9", List.of(AUTH, SECURITY, ADMIN),
        "A.9.1", List.of(AUTH, POLICY),
        "A.9.2", List.of(AUTH, ADMIN),
        "A.9.3", List.of(AUTH, SECURITY),
        "A.9.4", List.of(AUTH, SECURITY),
        "A.12", List.of(CONFIG, SECURITY, ADMIN),
        "A.12.1", List.of(CONFIG, ADMIN),
        "A.12.2", List.of(SECURITY, CONFIG),
        "A.12.3", List.of(DATA, ADMIN),
        "A.12.4", List.of(SECURITY, CONFIG),
        "A.12.5", List.of(CONFIG, ADMIN),
        "A.12.6", List.of(SECURITY, CONFIG),
        "A.14", List.of(GIT, CONFIG, APPROVAL),
        "A.14.1", List.of(GIT, SECURITY),
        "A.14.2", List.of(GIT, APPROVAL, AGENT),
        "A.14.3", List.of(DATA, SECURITY)
    );

    private ControlMappings() {
    }

    /**
     * Categories to query: explicit categories, then the SOC 2 or ISO 27001
     * control, then the parent control, then the control category, then every
     * operational category.
     */
    public static List<ActionCategory> resolveCategories(EvidenceQuery query) {
        if (!query.actionCategories().isEmpty()) {
            return query.actionCategories();
        }
        if (query.controlId() != null) {
            List<ActionCategory> direct = forControl(query.controlId());
            if (!direct.isEmpty()) {
                return direct;
            }
            String parent = parentControlId(query.controlId());
            if (SOC2_CRITERIA.containsKey(parent)) {
                return SOC2_CRITERIA.get(parent);
            }
            if (ISO27001_CONTROLS.containsKey(parent)) {
                return ISO27001_CONTROLS.get(parent);
            }
        }
        if (query.controlCategory() != null) {
            List<ActionCategory> mapped = CONTROL_CATEGORIES.get(normalizeCategory(query.controlCategory()));
            if (mapped != null) {
                return mapped;
            }
        }
        return OPERATIONAL_CATEGORIES;
    }

    /** Union of the SOC 2 and ISO 27001 mappings for exactly this control id. */
    public static List<ActionCategory> forControl(String controlId) {
        Set<ActionCategory> categories = new LinkedHashSet<>();
        categories.addAll(SOC2_CRITERIA.getOrDefault(controlId, List.of()));
        categories.addAll(ISO27001_CONTROLS.getOrDefault(controlId, List.of()));
        return List.copyOf(categories);
    }

    /** Every SOC 2 and ISO 27001 control that lists the category. */
    public static List<String> controlsFor(ActionCategory category) {
        Set<String> controls = new LinkedHashSet<>();
        SOC2_CRITERIA.forEach((id, categories) -> {
            if (categories.contains(category)) {
                controls.add(id);
            }
        });
        ISO27001_CONTROLS.forEach((id, categories) -> {
            if (categories.contains(category)) {
                controls.add(id);
            }
        });
        return List.copyOf(controls);
    }

    /** {@code CC6.1 -> CC6}; {@code A.9.2 -> A}. Ids without a dot are their own parent. */
    static String parentControlId(String controlId) {
        int dot = controlId.indexOf('.');
        return dot < 0 ? controlId : controlId.substring(0, dot);
    }

    /** "Access Control" and "access-control" both map to {@code access_control}. */
    public static String normalizeCategory(String category) {
        return category.trim().toLowerCase(Locale.ROOT).replaceAll("[\\s-]+", "_");
    }

    private static Map<String, List<ActionCategory>> orderedMap(Object... pairs) {
        Map<String, List<ActionCategory>> map = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            @SuppressWarnings("unchecked")
            List<ActionCategory> categories = (List<ActionCategory>) pairs[i + 1];
            map.put((String) pairs[i], categories);
        }
        return Collections.unmodifiableMap(map);
    }
}
