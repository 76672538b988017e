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
import software.amazon.awssdk.services.ec2.model.DescribeVolumesRequest;
import software.amazon.awssdk.services.ec2.model.DescribeVolumesResponse;
import software.amazon.awssdk.services.ec2.model.Volume;

import java.util.ArrayList;
import java.util.List;

@Component
@ConditionalOnProperty(name = "app.env", havingValue = "aws")
@RequiredArgsConstructor
@Slf4j
public class EbsVolumeLister implements ResourceLister {

    private final Ec2Client ec2Client;

    @Override
    public ResourceKind getKind() {
        return ResourceKind.BLOCK_VOLUME;
    }

    @Override
    public List<ResourceCandidate> list() {
        List<ResourceCandidate> volumes = new ArrayList<>();
        String nextToken = null;
        try {
            do {
                DescribeVolumesResponse response = ec2Client.describeVolumes(
                        DescribeVolumesRequest.builder().nextToken(nextToken).build());
                response.volumes().forEach(v -> volumes.add(toCandidate(v)));
                nextToken = response.nextToken();
            } while (nextToken != null);
        } catch (SdkException e) {
            log.error("Failed to describe EBS volumes: {}", AwsErrors.describe(e));
            throw new ResourceEnumerationException("Failed to describe EBS volumes: " + AwsErrors.describe(e), e);
        }
        log.debug("Listed {} EBS volumes", volumes.size());
        return volumes;
    }

    private static ResourceCandidate toCandidate(Volume volume) {
        ResourceCandidate.ResourceCandidateBuilder builder = ResourceCandidate.builder()
                .id(volume.volumeId())
                .kind(ResourceKind.BLOCK_VOLUME)
                .state(volume.stateAsString())
                .volumeType(volume.volumeTypeAsString())
                .sizeGb(volume.size())
                .iops(volume.iops())
                .snapshotId(volume.snapshotId())
                .createdAt(volume.createTime());
        volume.tags().forEach(tag -> builder.tag(tag.key(), tag.value()));
        return builder.build();
    }
}
