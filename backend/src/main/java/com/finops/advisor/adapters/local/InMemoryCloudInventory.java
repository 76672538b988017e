package com.finops.advisor.adapters.local;

import com.finops.advisor.adapters.AdvisoryCatalog;
import com.finops.advisor.adapters.AdvisoryCatalogException;
import com.finops.advisor.domain.model.AdvisoryCheck;
import com.finops.advisor.domain.model.AdvisoryFinding;
import com.finops.advisor.domain.model.ResourceCandidate;
import com.finops.advisor.domain.model.ResourceKind;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * In-memory stand-in for a cloud account: resources, advisory checks and
 * their results. Mutations really change state, so running an action twice
 * finds nothing the second time.
 *
 * Supports failure injection for resources (mutation or describe), whole
 * listings and the advisory catalog.
 */
@Slf4j
public class InMemoryCloudInventory implements AdvisoryCatalog {

    private final Map<String, ResourceCandidate> resources = new ConcurrentHashMap<>();
    private final Map<String, Long> insertionOrder = new ConcurrentHashMap<>();
    private final Map<String, AdvisoryCheck> checks = new ConcurrentHashMap<>();
    private final Map<String, AdvisoryFinding> findings = new ConcurrentHashMap<>();

    private final Set<String> failingMutations = ConcurrentHashMap.newKeySet();
    private final Set<String> failingDescribes = ConcurrentHashMap.newKeySet();
    private final Set<ResourceKind> failingListings = ConcurrentHashMap.newKeySet();
    private volatile boolean catalogReachable = true;
    private long sequence;

    // ---- resources ----

    public synchronized InMemoryCloudInventory add(ResourceCandidate resource) {
        resources.put(resource.id(), resource);
        insertionOrder.putIfAbsent(resource.id(), sequence++);
        return this;
    }

    public InMemoryCloudInventory addAll(Collection<ResourceCandidate> batch) {
        batch.forEach(this::add);
        return this;
    }

    public Optional<ResourceCandidate> find(String id) {
        return Optional.ofNullable(resources.get(id));
    }

    public List<ResourceCandidate> snapshot(ResourceKind kind) {
        List<ResourceCandidate> result = new ArrayList<>();
        resources.values().stream()
                .filter(r -> r.kind() == kind)
                .sorted((a, b) -> Long.compare(insertionOrder.get(a.id()), insertionOrder.get(b.id())))
                .forEach(result::add);
        return result;
    }

    /**
     * Replace a resource with an updated copy. Returns false when it no longer exists.
     */
    boolean update(String id, UnaryOperator<ResourceCandidate> change) {
        return resources.computeIfPresent(id, (key, current) -> change.apply(current)) != null;
    }

    boolean remove(String id) {
        return resources.remove(id) != null;
    }

    // ---- failure injection ----

    public InMemoryCloudInventory failMutationOf(String id) {
        failingMutations.add(id);
        return this;
    }

    public InMemoryCloudInventory failDescribeOf(String id) {
        failingDescribes.add(id);
        return this;
    }

    public InMemoryCloudInventory failListingOf(ResourceKind kind) {
        failingListings.add(kind);
        return this;
    }

    public InMemoryCloudInventory catalogReachable(boolean reachable) {
        this.catalogReachable = reachable;
        return this;
    }

    boolean mutationFails(String id) {
        return failingMutations.contains(id);
    }

    boolean describeFails(String id) {
        return failingDescribes.contains(id);
    }

    boolean listingFails(ResourceKind kind) {
        return failingListings.contains(kind);
    }

    // ---- advisory catalog ----

    public InMemoryCloudInventory addFinding(AdvisoryCheck check, AdvisoryFinding finding) {
        checks.put(check.checkId(), check);
        if (finding != null) {
            findings.put(check.checkId(), finding);
        }
        return this;
    }

    @Override
    public List<AdvisoryCheck> listChecks() {
        if (!catalogReachable) {
            throw new AdvisoryCatalogException("Advisory catalog unreachable", null);
        }
        return checks.values().stream()
                .sorted((a, b) -> a.checkId().compareTo(b.checkId()))
                .toList();
    }

    @Override
    public Optional<AdvisoryFinding> getCheckResult(String checkId) {
        if (!catalogReachable) {
            throw new AdvisoryCatalogException("Advisory catalog unreachable", null);
        }
        log.debug("MOCK: Fetching advisory result for {}", checkId);
        return Optional.ofNullable(findings.get(checkId));
    }
}
