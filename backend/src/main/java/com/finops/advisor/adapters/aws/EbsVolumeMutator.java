package com.finops.advisor.adapters.aws;

import com.finops.advisor.adapters.MutationResult;
import com.finops.advisor.adapters.ResourceMutator;
import com.finops.advisor.domain.model.RemediationActionType;
import com.finops.advisor.domain.model.ResourceCandidate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.ec2.Ec2Client;
import software.amazon.awssdk.services.ec2.model.DeleteVolumeRequest;
import software.amazon.awssdk.services.ec2.model.ModifyVolumeRequest;
import software.amazon.awssdk.services.ec2.model.VolumeType;

import java.util.EnumSet;
import java.util.Set;

@Component
@ConditionalOnProperty(name = "app.env", havingValue = "aws")
@RequiredArgsConstructor
@Slf4j
public class EbsVolumeMutator implements ResourceMutator {

    private final Ec2Client ec2Client;

    @Override
    public Set<RemediationActionType> getSupportedActions() {
        return EnumSet.of(
                RemediationActionType.DELETE_UNUSED_VOLUMES,
                RemediationActionType.MIGRATE_GP2_TO_GP3,
                RemediationActionType.OPTIMIZE_VOLUME_TYPES
        );
    }

    @Override
    public MutationResult apply(RemediationActionType action, ResourceCandidate candidate) {
        String volumeId = candidate.id();
        try {
            switch (action) {
                case DELETE_UNUSED_VOLUMES -> {
                    ec2Client.deleteVolume(DeleteVolumeRequest.builder().volumeId(volumeId).build());
                    log.info("Deleted volume {}", volumeId);
                }
                case MIGRATE_GP2_TO_GP3, OPTIMIZE_VOLUME_TYPES -> {
                    ec2Client.modifyVolume(ModifyVolumeRequest.builder()
                            .volumeId(volumeId)
                            .volumeType(VolumeType.GP3)
                            .build());
                    log.info("Converted volume {} from {} to gp3", volumeId, candidate.volumeType());
                }
                default -> {
                    return MutationResult.failure("Unsupported action " + action.getActionId());
                }
            }
            return MutationResult.ok();
        } catch (SdkException e) {
            log.error("EBS {} failed for {}: {}", action.getActionId(), volumeId, AwsErrors.describe(e));
            return MutationResult.failure(AwsErrors.describe(e));
        }
    }
}
