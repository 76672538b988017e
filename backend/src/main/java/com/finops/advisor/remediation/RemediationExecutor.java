package com.finops.advisor.remediation;

import com.finops.advisor.adapters.MutationResult;
import com.finops.advisor.domain.model.ImplementationOutcome;
import com.finops.advisor.domain.model.RemediationActionType;
import com.finops.advisor.domain.model.ResourceCandidate;
import com.finops.advisor.eligibility.EligibilityDecision;
import com.finops.advisor.savings.SavingsEstimator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Runs one remediation pass for one action.
 *
 * PASS:
 * 1. LISTING      - enumerate the live population; failure ends the pass with success=false
 * 2. EVALUATING   - describe and filter each resource; a resource that fails is skipped
 * 3. DRY_RUN_REPORT or APPLYING - report intent, or mutate each candidate independently
 * 4. AGGREGATING  - fold per-resource results into (succeeded, failed-with-reason)
 *
 * Mutating calls happen only in APPLYING, only when dryRun=false, and only for
 * resources that passed eligibility. Per-resource work fans out on the
 * remediation task executor; results never depend on completion order.
 */
@Component
@Slf4j
public class RemediationExecutor {

    private final SavingsEstimator savingsEstimator;
    private final Executor taskExecutor;
    private final Clock clock;

    public RemediationExecutor(
            SavingsEstimator savingsEstimator,
            @Qualifier("remediationTaskExecutor") Executor taskExecutor,
            Clock clock
    ) {
        this.savingsEstimator = savingsEstimator;
        this.taskExecutor = taskExecutor;
        this.clock = clock;
    }

    public ImplementationOutcome run(RemediationAction action, boolean dryRun) {
        RemediationActionType type = action.type();
        if (!action.implementable()) {
            return ImplementationOutcome.unimplemented(
                    "No implementation available for action: " + type.getActionId(), dryRun, now());
        }

        enter(ExecutionPhase.LISTING, type);
        List<ResourceCandidate> population;
        try {
            population = action.lister().list();
        } catch (RuntimeException e) {
            log.error("Failed to list {} for {}", type.getResourceKind(), type.getActionId(), e);
            return ImplementationOutcome.failed(
                    "Failed to list " + type.getTargetNoun() + ": " + e.getMessage(), dryRun, now());
        }

        enter(ExecutionPhase.EVALUATING, type);
        List<ResourceCandidate> candidates = evaluate(action, population);
        log.info("{}: {} of {} listed resources are candidates",
                type.getActionId(), candidates.size(), population.size());

        if (candidates.isEmpty()) {
            enter(ExecutionPhase.DONE, type);
            return ImplementationOutcome.noneFound(
                    "No " + type.getTargetNoun() + " found", dryRun, now());
        }

        if (dryRun) {
            enter(ExecutionPhase.DRY_RUN_REPORT, type);
            BigDecimal savings = savingsEstimator.estimate(type.getSavingsModel(), candidates);
            Set<String> ids = idsOf(candidates);
            enter(ExecutionPhase.DONE, type);
            return new ImplementationOutcome(
                    true,
                    "Would " + type.describeIntent(candidates.size()),
                    savings,
                    ids,
                    Map.of(),
                    true,
                    now()
            );
        }

        enter(ExecutionPhase.APPLYING, type);
        MutationLedger ledger = apply(action, candidates);

        enter(ExecutionPhase.AGGREGATING, type);
        BigDecimal savings = savingsEstimator.estimate(type.getSavingsModel(), ledger.succeeded());
        String message = summarize(type, candidates.size(), ledger);

        enter(ExecutionPhase.DONE, type);
        return new ImplementationOutcome(
                true,
                message,
                savings,
                idsOf(ledger.succeeded()),
                ledger.failed(),
                false,
                now()
        );
    }

    private List<ResourceCandidate> evaluate(RemediationAction action, List<ResourceCandidate> population) {
        List<CompletableFuture<Optional<ResourceCandidate>>> evaluations = population.stream()
                .map(resource -> CompletableFuture.supplyAsync(
                        () -> evaluateOne(action, resource), taskExecutor))
                .toList();

        return evaluations.stream()
                .map(CompletableFuture::join)
                .flatMap(Optional::stream)
                .toList();
    }

    private Optional<ResourceCandidate> evaluateOne(RemediationAction action, ResourceCandidate resource) {
        RemediationActionType type = action.type();
        try {
            if (resource.kind() != type.getResourceKind()) {
                log.warn("Skipping {}: lister returned {} for {}", resource.id(), resource.kind(), type.getActionId());
                return Optional.empty();
            }
            ResourceCandidate described = action.lister().describe(resource, type);
            EligibilityDecision decision = action.eligibility().evaluate(described);
            log.debug("{} {} for {}: {}", resource.id(),
                    decision.eligible() ? "eligible" : "not eligible", type.getActionId(), decision.reason());
            return decision.eligible() ? Optional.of(described) : Optional.empty();
        } catch (RuntimeException e) {
            log.warn("Skipping {} for {}: metadata fetch failed: {}",
                    resource.id(), type.getActionId(), e.getMessage());
            return Optional.empty();
        }
    }

    private MutationLedger apply(RemediationAction action, List<ResourceCandidate> candidates) {
        List<CompletableFuture<MutationAttempt>> attempts = candidates.stream()
                .map(candidate -> CompletableFuture.supplyAsync(
                        () -> attempt(action, candidate), taskExecutor))
                .toList();

        MutationLedger ledger = new MutationLedger();
        attempts.stream()
                .map(CompletableFuture::join)
                .forEach(ledger::record);
        return ledger;
    }

    private MutationAttempt attempt(RemediationAction action, ResourceCandidate candidate) {
        MutationResult result;
        try {
            result = action.applyFn().apply(candidate);
            if (result == null) {
                result = MutationResult.failure("mutator returned no result");
            }
        } catch (RuntimeException e) {
            result = MutationResult.failure(e.getMessage());
        }

        if (result.success()) {
            log.info("{} applied to {}", action.actionId(), candidate.id());
        } else {
            log.warn("{} failed for {}: {}", action.actionId(), candidate.id(), result.reason());
        }
        return new MutationAttempt(candidate, result);
    }

    private static String summarize(RemediationActionType type, int attempted, MutationLedger ledger) {
        int succeeded = ledger.succeeded().size();
        int failed = ledger.failed().size();
        if (failed == 0) {
            return "Successfully " + type.describeResult(succeeded);
        }
        if (succeeded == 0) {
            return "Failed to " + type.describeIntent(attempted) + "; all " + failed + " attempts failed";
        }
        return "Successfully " + type.describeResult(succeeded) + "; " + failed + " failed";
    }

    private static Set<String> idsOf(List<ResourceCandidate> candidates) {
        Set<String> ids = new LinkedHashSet<>();
        candidates.forEach(c -> ids.add(c.id()));
        return ids;
    }

    private static void enter(ExecutionPhase phase, RemediationActionType type) {
        log.debug("{} -> {}", type.getActionId(), phase);
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    private record MutationAttempt(ResourceCandidate candidate, MutationResult result) {}

    /**
     * Accumulates per-resource results. Only touched from the calling thread.
     */
    private static final class MutationLedger {
        private final List<ResourceCandidate> succeeded = new ArrayList<>();
        private final Map<String, String> failed = new LinkedHashMap<>();

        void record(MutationAttempt attempt) {
            if (attempt.result().success()) {
                succeeded.add(attempt.candidate());
            } else {
                failed.put(attempt.candidate().id(), attempt.result().reason());
            }
        }

        List<ResourceCandidate> succeeded() {
            return succeeded;
        }

        Map<String, String> failed() {
            return failed;
        }
    }
}
