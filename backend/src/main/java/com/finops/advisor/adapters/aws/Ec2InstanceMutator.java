package com.finops.advisor.adapters.aws;

import com.finops.advisor.adapters.MutationResult;
import com.finops.advisor.adapters.ResourceMutator;
import com.finops.advisor.domain.model.RemediationActionType;
import com.finops.advisor.domain.model.ResourceCandidate;
import com.finops.advisor.eligibility.InstanceSizing;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.waiters.WaiterResponse;
import software.amazon.awssdk.services.ec2.Ec2Client;
import software.amazon.awssdk.services.ec2.model.AttributeValue;
import software.amazon.awssdk.services.ec2.model.DescribeInstancesRequest;
import software.amazon.awssdk.services.ec2.model.DescribeInstancesResponse;
import software.amazon.awssdk.services.ec2.model.ModifyInstanceAttributeRequest;
import software.amazon.awssdk.services.ec2.model.StartInstancesRequest;
import software.amazon.awssdk.services.ec2.model.StopInstancesRequest;
import software.amazon.awssdk.services.ec2.waiters.Ec2Waiter;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Stops idle instances and resizes oversized ones.
 *
 * Resizing requires a stopped instance: stop, wait, change type, start.
 * If the type change fails the instance is left stopped and reported as failed.
 */
@Component
@ConditionalOnProperty(name = "app.env", havingValue = "aws")
@RequiredArgsConstructor
@Slf4j
public class Ec2InstanceMutator implements ResourceMutator {

    private final Ec2Client ec2Client;

    @Override
    public Set<RemediationActionType> getSupportedActions() {
        return EnumSet.of(RemediationActionType.STOP_IDLE_INSTANCES, RemediationActionType.OPTIMIZE_INSTANCE_TYPES);
    }

    @Override
    public MutationResult apply(RemediationActionType action, ResourceCandidate candidate) {
        String instanceId = candidate.id();
        try {
            return switch (action) {
                case STOP_IDLE_INSTANCES -> stop(instanceId);
                case OPTIMIZE_INSTANCE_TYPES -> resize(instanceId, candidate.instanceType());
                default -> MutationResult.failure("Unsupported action " + action.getActionId());
            };
        } catch (SdkException e) {
            log.error("EC2 {} failed for {}: {}", action.getActionId(), instanceId, AwsErrors.describe(e));
            return MutationResult.failure(AwsErrors.describe(e));
        }
    }

    private MutationResult stop(String instanceId) {
        ec2Client.stopInstances(StopInstancesRequest.builder().instanceIds(instanceId).build());
        log.info("Stopped instance {}", instanceId);
        return MutationResult.ok();
    }

    private MutationResult resize(String instanceId, String currentType) {
        Optional<String> target = InstanceSizing.downsizeTarget(currentType);
        if (target.isEmpty()) {
            return MutationResult.failure("No smaller type for " + currentType);
        }

        ec2Client.stopInstances(StopInstancesRequest.builder().instanceIds(instanceId).build());
        try (Ec2Waiter waiter = ec2Client.waiter()) {
            WaiterResponse<DescribeInstancesResponse> stopped = waiter.waitUntilInstanceStopped(
                    DescribeInstancesRequest.builder().instanceIds(instanceId).build());
            if (stopped.matched().exception().isPresent()) {
                return MutationResult.failure("Instance " + instanceId + " did not stop");
            }
        }

        ec2Client.modifyInstanceAttribute(ModifyInstanceAttributeRequest.builder()
                .instanceId(instanceId)
                .instanceType(AttributeValue.builder().value(target.get()).build())
                .build());
        ec2Client.startInstances(StartInstancesRequest.builder().instanceIds(instanceId).build());

        log.info("Resized instance {} from {} to {}", instanceId, currentType, target.get());
        return MutationResult.ok();
    }
}
