package com.finops.advisor.domain.model;

import lombok.Builder;
import lombok.Singular;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * A live cloud resource as seen during one evaluation pass.
 *
 * Candidates are fetched fresh from the provider on every run and never cached:
 * attachment state and age decide whether deleting or stopping is safe.
 *
 * Tag keys are case-insensitive ("Env", "env" and "ENV" resolve to the same tag).
 * Kind-specific fields are null when they do not apply.
 */
@Builder(toBuilder = true)
public record ResourceCandidate(
        String id,
        ResourceKind kind,
        String state,
        Instant createdAt,
        Integer sizeGb,
        Long sizeBytes,
        @Singular Map<String, String> tags,
        String instanceType,
        String volumeType,
        String storageClass,
        Integer iops,
        String snapshotId,
        String bucket,
        @Singular Map<String, String> attributes
) {
    private static final double BYTES_PER_GB = 1024d * 1024d * 1024d;

    public ResourceCandidate {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(kind, "kind");

        TreeMap<String, String> normalizedTags = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (tags != null) {
            tags.forEach((key, value) -> {
                if (key != null && value != null) {
                    normalizedTags.put(key, value);
                }
            });
        }
        tags = Collections.unmodifiableMap(normalizedTags);
        attributes = attributes == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public Optional<String> tag(String key) {
        return Optional.ofNullable(tags.get(key));
    }

    public Optional<String> attribute(String key) {
        return Optional.ofNullable(attributes.get(key));
    }

    /**
     * Size in GB: the provisioned capacity when known, otherwise bytes / 2^30.
     */
    public double sizeInGb() {
        if (sizeGb != null) {
            return sizeGb;
        }
        if (sizeBytes != null) {
            return sizeBytes / BYTES_PER_GB;
        }
        return 0d;
    }
}
