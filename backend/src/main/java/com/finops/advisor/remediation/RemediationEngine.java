package com.finops.advisor.remediation;

import com.finops.advisor.domain.model.ImplementationOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Entry point for executing remediations.
 *
 * RESOLUTION:
 * - By advisory check id through {@link ActionRegistry#lookup(String)}
 * - By automation id through {@link ActionRegistry#lookupAutomation(String)}
 *
 * An unknown or unwired id is a normal outcome (success=false, message names
 * the id), not an error. This service never throws: every path resolves to an
 * {@link ImplementationOutcome}, and every invocation writes one audit line.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RemediationEngine {

    static final String MDC_CHECK_ID = "checkId";
    static final String MDC_ACTION_ID = "actionId";
    static final String MDC_DRY_RUN = "dryRun";

    private final ActionRegistry actionRegistry;
    private final RemediationExecutor remediationExecutor;
    private final Clock clock;

    /**
     * Execute the remediation mapped to an advisory check.
     *
     * @param checkId advisory check identifier, e.g. {@code unusedEBSVolumeCheck}
     * @param dryRun  when true, report intended effects without mutating anything
     */
    public ImplementationOutcome execute(String checkId, boolean dryRun) {
        MDC.put(MDC_CHECK_ID, String.valueOf(checkId));
        try {
            return run(
                    actionRegistry.lookup(checkId),
                    "No implementation available for check_id: " + checkId,
                    "check_id " + checkId,
                    dryRun
            );
        } finally {
            MDC.remove(MDC_CHECK_ID);
        }
    }

    /**
     * Execute an automation directly by its id, e.g. {@code migrate_gp2_to_gp3}.
     */
    public ImplementationOutcome executeAutomation(String actionId, boolean dryRun) {
        return run(
                actionRegistry.lookupAutomation(actionId),
                "Automation " + actionId + " not found",
                "automation " + actionId,
                dryRun
        );
    }

    public List<AutomationDescriptor> listAvailableAutomations() {
        return actionRegistry.availableAutomations();
    }

    private ImplementationOutcome run(
            Optional<RemediationAction> resolved,
            String unimplementedMessage,
            String target,
            boolean dryRun
    ) {
        MDC.put(MDC_DRY_RUN, String.valueOf(dryRun));
        ImplementationOutcome outcome;
        try {
            if (resolved.isEmpty() || !resolved.get().implementable()) {
                log.info("No automation for {}", target);
                outcome = ImplementationOutcome.unimplemented(unimplementedMessage, dryRun, now());
            } else {
                RemediationAction action = resolved.get();
                MDC.put(MDC_ACTION_ID, action.actionId());
                log.info("Executing {} for {} (dryRun={})", action.actionId(), target, dryRun);
                outcome = remediationExecutor.run(action, dryRun);
            }
        } catch (RuntimeException e) {
            log.error("Remediation failed for {}", target, e);
            outcome = ImplementationOutcome.failed(
                    "Remediation failed for " + target + ": " + e.getMessage(), dryRun, now());
        }

        try {
            audit(target, outcome);
        } finally {
            MDC.remove(MDC_ACTION_ID);
            MDC.remove(MDC_DRY_RUN);
        }
        return outcome;
    }

    private void audit(String target, ImplementationOutcome outcome) {
        log.info("Remediation completed: target={}, dryRun={}, success={}, affected={}, failed={}, savings={}, message={}",
                target,
                outcome.dryRun(),
                outcome.success(),
                outcome.affectedResources().size(),
                outcome.failedResources().size(),
                outcome.savings(),
                outcome.message());
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
