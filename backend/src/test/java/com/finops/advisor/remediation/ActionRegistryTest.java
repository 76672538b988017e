package com.finops.advisor.remediation;

import com.finops.advisor.adapters.ResourceLister;
import com.finops.advisor.adapters.ResourceMutator;
import com.finops.advisor.adapters.local.InMemoryCloudInventory;
import com.finops.advisor.adapters.local.InMemoryResourceLister;
import com.finops.advisor.adapters.local.InMemoryResourceMutator;
import com.finops.advisor.config.RemediationProperties;
import com.finops.advisor.domain.model.RemediationActionType;
import com.finops.advisor.domain.model.ResourceKind;
import com.finops.advisor.domain.model.RiskLevel;
import com.finops.advisor.eligibility.EligibilityEvaluator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ActionRegistryTest {

    private EligibilityEvaluator evaluator;
    private InMemoryCloudInventory inventory;
    private Map<ResourceKind, ResourceLister> listers;

    @BeforeEach
    void setUp() {
        evaluator = new EligibilityEvaluator(Clock.systemUTC(), new RemediationProperties());
        inventory = new InMemoryCloudInventory();
        listers = Arrays.stream(ResourceKind.values())
                .collect(Collectors.toMap(k -> k, k -> new InMemoryResourceLister(k, inventory)));
    }

    @Test
    @DisplayName("Several check ids resolve to the same action")
    void shouldMapManyChecksToOneAction() {
        var registry = new ActionRegistry(evaluator, listers, List.of(new InMemoryResourceMutator(inventory)));

        var idleInstances = registry.lookup("idleEC2InstanceCheck").orElseThrow();
        var idleBalancers = registry.lookup("idleLoadBalancerCheck").orElseThrow();

        assertThat(idleInstances).isSameAs(idleBalancers);
        assertThat(idleInstances.type()).isEqualTo(RemediationActionType.STOP_IDLE_INSTANCES);
        assertThat(registry.checkIdsFor(RemediationActionType.DELETE_UNUSED_VOLUMES))
                .containsExactly("unattachedEBSVolumeCheck", "unusedEBSVolumeCheck");
    }

    @Test
    @DisplayName("Unknown and null check ids resolve to nothing")
    void shouldNotResolveUnknownCheck() {
        var registry = new ActionRegistry(evaluator, listers, List.of(new InMemoryResourceMutator(inventory)));

        assertThat(registry.lookup("doesNotExist")).isEmpty();
        assertThat(registry.lookup(null)).isEmpty();
        assertThat(registry.isImplementable("serviceLimitsCheck")).isFalse();
        assertThat(registry.lookupAutomation("reboot_everything")).isEmpty();
    }

    @Test
    @DisplayName("Actions without a mutator are registered but not implementable")
    void shouldReportPartiallyWiredRegistry() {
        ResourceMutator volumesOnly = mock(ResourceMutator.class);
        when(volumesOnly.getSupportedActions()).thenReturn(EnumSet.of(
                RemediationActionType.DELETE_UNUSED_VOLUMES, RemediationActionType.MIGRATE_GP2_TO_GP3));

        var registry = new ActionRegistry(evaluator, listers, List.of(volumesOnly));

        assertThat(registry.isImplementable("unusedEBSVolumeCheck")).isTrue();
        assertThat(registry.isImplementable("s3BucketVersioningCheck")).isFalse();
        assertThat(registry.lookup("s3BucketVersioningCheck")).isPresent();
        assertThat(registry.availableAutomations())
                .extracting(AutomationDescriptor::id)
                .containsExactly("delete_unused_volumes", "migrate_gp2_to_gp3");
    }

    @Test
    @DisplayName("Missing lister makes the action unimplementable")
    void shouldRequireLister() {
        listers.remove(ResourceKind.OBJECT_ENTRY);

        var registry = new ActionRegistry(evaluator, listers, List.of(new InMemoryResourceMutator(inventory)));

        assertThat(registry.isImplementable("s3StorageOptimizationCheck")).isFalse();
        assertThat(registry.isImplementable("eBSgp2Check")).isTrue();
    }

    @Test
    @DisplayName("Two mutators claiming one action is a wiring error")
    void shouldRejectDuplicateMutators() {
        ResourceMutator first = mock(ResourceMutator.class);
        ResourceMutator second = mock(ResourceMutator.class);
        when(first.getSupportedActions()).thenReturn(EnumSet.of(RemediationActionType.DELETE_UNUSED_VOLUMES));
        when(second.getSupportedActions()).thenReturn(EnumSet.of(RemediationActionType.DELETE_UNUSED_VOLUMES));

        assertThatThrownBy(() -> new ActionRegistry(evaluator, listers, List.of(first, second)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("delete_unused_volumes");
    }

    @Test
    @DisplayName("Automation catalog carries service, risk and cost flag")
    void shouldDescribeAutomations() {
        var registry = new ActionRegistry(evaluator, listers, List.of(new InMemoryResourceMutator(inventory)));

        var automations = registry.availableAutomations();

        assertThat(automations).hasSize(RemediationActionType.values().length);
        var deletion = automations.stream().filter(a -> a.id().equals("delete_unused_volumes")).findFirst().orElseThrow();
        assertThat(deletion.service()).isEqualTo("EBS");
        assertThat(deletion.riskLevel()).isEqualTo(RiskLevel.MEDIUM);
        assertThat(deletion.costReducing()).isTrue();
        var versioning = automations.stream().filter(a -> a.id().equals("enable_versioning")).findFirst().orElseThrow();
        assertThat(versioning.costReducing()).isFalse();
    }
}
