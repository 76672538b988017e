package com.finops.advisor.adapters.aws;

import com.finops.advisor.adapters.ResourceEnumerationException;
import com.finops.advisor.adapters.ResourceLister;
import com.finops.advisor.domain.model.ResourceCandidate;
import com.finops.advisor.domain.model.ResourceKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.ec2.Ec2Client;
import software.amazon.awssdk.services.ec2.model.DescribeInstancesRequest;
import software.amazon.awssdk.services.ec2.model.DescribeInstancesResponse;
import software.amazon.awssdk.services.ec2.model.Instance;
import software.amazon.awssdk.services.ec2.model.Reservation;

import java.util.ArrayList;
import java.util.List;

@Component
@ConditionalOnProperty(name = "app.env", havingValue = "aws")
@RequiredArgsConstructor
@Slf4j
public class Ec2InstanceLister implements ResourceLister {

    private final Ec2Client ec2Client;

    @Override
    public ResourceKind getKind() {
        return ResourceKind.COMPUTE_INSTANCE;
    }

    @Override
    public List<ResourceCandidate> list() {
        List<ResourceCandidate> instances = new ArrayList<>();
        String nextToken = null;
        try {
            do {
                DescribeInstancesResponse response = ec2Client.describeInstances(
                        DescribeInstancesRequest.builder().nextToken(nextToken).build());
                for (Reservation reservation : response.reservations()) {
                    for (Instance instance : reservation.instances()) {
                        instances.add(toCandidate(instance));
                    }
                }
                nextToken = response.nextToken();
            } while (nextToken != null);
        } catch (SdkException e) {
            log.error("Failed to describe EC2 instances: {}", AwsErrors.describe(e));
            throw new ResourceEnumerationException("Failed to describe EC2 instances: " + AwsErrors.describe(e), e);
        }
        log.debug("Listed {} EC2 instances", instances.size());
        return instances;
    }

    private static ResourceCandidate toCandidate(Instance instance) {
        ResourceCandidate.ResourceCandidateBuilder builder = ResourceCandidate.builder()
                .id(instance.instanceId())
                .kind(ResourceKind.COMPUTE_INSTANCE)
                .state(instance.state() == null ? null : instance.state().nameAsString())
                .instanceType(instance.instanceTypeAsString())
                .createdAt(instance.launchTime());
        instance.tags().forEach(tag -> builder.tag(tag.key(), tag.value()));
        return builder.build();
    }
}
