package com.finops.advisor.remediation;

import com.finops.advisor.domain.model.RemediationActionType;
import com.finops.advisor.domain.model.RiskLevel;

/**
 * Entry in the catalog of automations a caller can run directly by id.
 */
public record AutomationDescriptor(
        String id,
        String name,
        String description,
        String service,
        RiskLevel riskLevel,
        boolean costReducing
) {
    static AutomationDescriptor of(RemediationActionType type) {
        return new AutomationDescriptor(
                type.getActionId(),
                type.getDisplayName(),
                type.getDescription(),
                type.getService(),
                type.getRiskLevel(),
                type.getSavingsModel().isCostReducing()
        );
    }
}
