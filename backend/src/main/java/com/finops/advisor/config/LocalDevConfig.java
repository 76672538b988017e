package com.finops.advisor.config;

import com.finops.advisor.adapters.ResourceLister;
import com.finops.advisor.adapters.ResourceMutator;
import com.finops.advisor.adapters.local.InMemoryCloudInventory;
import com.finops.advisor.adapters.local.InMemoryResourceLister;
import com.finops.advisor.adapters.local.InMemoryResourceMutator;
import com.finops.advisor.domain.model.AdvisoryCheck;
import com.finops.advisor.domain.model.AdvisoryFinding;
import com.finops.advisor.domain.model.BucketAttributes;
import com.finops.advisor.domain.model.CheckCategory;
import com.finops.advisor.domain.model.CheckStatus;
import com.finops.advisor.domain.model.FlaggedResource;
import com.finops.advisor.domain.model.ResourceCandidate;
import com.finops.advisor.domain.model.ResourceKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Local development configuration.
 *
 * ENABLED WHEN: app.env=local (the default)
 *
 * This configuration:
 * 1. Provides an in-memory cloud inventory seeded with sample resources
 * 2. Serves advisory checks and findings from that inventory
 * 3. Wires in-memory listers and a mutator that change the inventory for real
 *
 * NO AWS CREDENTIALS REQUIRED!
 */
@Configuration
@ConditionalOnProperty(name = "app.env", havingValue = "local", matchIfMissing = true)
@Slf4j
public class LocalDevConfig {

    @Bean
    public InMemoryCloudInventory inMemoryCloudInventory(Clock clock) {
        log.info("LOCAL MODE: Using in-memory cloud inventory with sample resources");
        InMemoryCloudInventory inventory = new InMemoryCloudInventory();
        seedResources(inventory, clock.instant());
        seedFindings(inventory);
        return inventory;
    }

    @Bean
    public ResourceLister localInstanceLister(InMemoryCloudInventory inventory) {
        return new InMemoryResourceLister(ResourceKind.COMPUTE_INSTANCE, inventory);
    }

    @Bean
    public ResourceLister localVolumeLister(InMemoryCloudInventory inventory) {
        return new InMemoryResourceLister(ResourceKind.BLOCK_VOLUME, inventory);
    }

    @Bean
    public ResourceLister localBucketLister(InMemoryCloudInventory inventory) {
        return new InMemoryResourceLister(ResourceKind.OBJECT_BUCKET, inventory);
    }

    @Bean
    public ResourceLister localObjectLister(InMemoryCloudInventory inventory) {
        return new InMemoryResourceLister(ResourceKind.OBJECT_ENTRY, inventory);
    }

    @Bean
    public ResourceMutator localResourceMutator(InMemoryCloudInventory inventory) {
        log.info("LOCAL MODE: Mutations are applied to the in-memory inventory only");
        return new InMemoryResourceMutator(inventory);
    }

    private static void seedResources(InMemoryCloudInventory inventory, Instant now) {
        inventory.addAll(List.of(
                ResourceCandidate.builder()
                        .id("i-0dev000000000001").kind(ResourceKind.COMPUTE_INSTANCE).state("running")
                        .instanceType("t2.micro").createdAt(now.minus(Duration.ofDays(3)))
                        .tag("env", "dev").build(),
                ResourceCandidate.builder()
                        .id("i-0test00000000002").kind(ResourceKind.COMPUTE_INSTANCE).state("running")
                        .instanceType("t3.small").createdAt(now.minus(Duration.ofHours(2)))
                        .tag("Purpose", "staging").build(),
                ResourceCandidate.builder()
                        .id("i-0prod00000000003").kind(ResourceKind.COMPUTE_INSTANCE).state("running")
                        .instanceType("m5.2xlarge").createdAt(now.minus(Duration.ofDays(200)))
                        .tag("Environment", "production").build(),
                ResourceCandidate.builder()
                        .id("i-0batch0000000004").kind(ResourceKind.COMPUTE_INSTANCE).state("running")
                        .instanceType("c5.xlarge").createdAt(now.minus(Duration.ofDays(60)))
                        .tag("team", "analytics").build(),

                ResourceCandidate.builder()
                        .id("vol-0orphan0000001").kind(ResourceKind.BLOCK_VOLUME).state("available")
                        .volumeType("gp2").sizeGb(50).createdAt(now.minus(Duration.ofDays(90))).build(),
                ResourceCandidate.builder()
                        .id("vol-0keep000000002").kind(ResourceKind.BLOCK_VOLUME).state("available")
                        .volumeType("gp2").sizeGb(20).createdAt(now.minus(Duration.ofDays(100)))
                        .tag("Protected", "true").build(),
                ResourceCandidate.builder()
                        .id("vol-0data000000003").kind(ResourceKind.BLOCK_VOLUME).state("in-use")
                        .volumeType("gp2").sizeGb(500).createdAt(now.minus(Duration.ofDays(400))).build(),
                ResourceCandidate.builder()
                        .id("vol-0iops000000004").kind(ResourceKind.BLOCK_VOLUME).state("in-use")
                        .volumeType("io1").iops(400).sizeGb(100).createdAt(now.minus(Duration.ofDays(30))).build(),

                ResourceCandidate.builder()
                        .id("app-assets").kind(ResourceKind.OBJECT_BUCKET).state("active")
                        .attribute(BucketAttributes.VERSIONING_STATUS, BucketAttributes.UNVERSIONED)
                        .attribute(BucketAttributes.LOGGING_ENABLED, "false")
                        .attribute(BucketAttributes.PUBLIC_ACL_GRANT, "true")
                        .attribute(BucketAttributes.POLICY_PRESENT, "false").build(),
                ResourceCandidate.builder()
                        .id("audit-archive").kind(ResourceKind.OBJECT_BUCKET).state("active")
                        .attribute(BucketAttributes.VERSIONING_STATUS, "Enabled")
                        .attribute(BucketAttributes.LOGGING_ENABLED, "true")
                        .attribute(BucketAttributes.PUBLIC_ACL_GRANT, "false")
                        .attribute(BucketAttributes.POLICY_PRESENT, "false").build(),

                ResourceCandidate.builder()
                        .id("app-assets/exports/2024-q1.parquet").kind(ResourceKind.OBJECT_ENTRY)
                        .bucket("app-assets").storageClass("STANDARD").sizeBytes(64L * 1024 * 1024 * 1024)
                        .createdAt(now.minus(Duration.ofDays(180))).build()
        ));
    }

    private static void seedFindings(InMemoryCloudInventory inventory) {
        inventory.addFinding(
                new AdvisoryCheck("idleEC2InstanceCheck", "Low Utilization Amazon EC2 Instances",
                        "Checks for EC2 instances that appear to be idle", CheckCategory.COST_OPTIMIZATION),
                new AdvisoryFinding("idleEC2InstanceCheck", CheckCategory.COST_OPTIMIZATION, CheckStatus.WARNING,
                        List.of(flagged("i-0dev000000000001"), flagged("i-0test00000000002"))));
        inventory.addFinding(
                new AdvisoryCheck("unusedEBSVolumeCheck", "Underutilized Amazon EBS Volumes",
                        "Checks for unattached EBS volumes", CheckCategory.COST_OPTIMIZATION),
                new AdvisoryFinding("unusedEBSVolumeCheck", CheckCategory.COST_OPTIMIZATION, CheckStatus.WARNING,
                        List.of(flagged("vol-0orphan0000001"), flagged("vol-0keep000000002"))));
        inventory.addFinding(
                new AdvisoryCheck("s3BucketPublicReadCheck", "Amazon S3 Bucket Permissions",
                        "Checks buckets with open access permissions", CheckCategory.SECURITY),
                new AdvisoryFinding("s3BucketPublicReadCheck", CheckCategory.SECURITY, CheckStatus.ERROR,
                        List.of(flagged("app-assets"))));
        inventory.addFinding(
                new AdvisoryCheck("serviceLimitsCheck", "Service Limits",
                        "Checks usage against service limits", CheckCategory.PERFORMANCE),
                new AdvisoryFinding("serviceLimitsCheck", CheckCategory.PERFORMANCE, CheckStatus.OK, List.of()));
    }

    private static FlaggedResource flagged(String id) {
        return new FlaggedResource(id + "-ref", "us-east-1", "warning", List.of(id));
    }
}
