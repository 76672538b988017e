package com.finops.advisor.domain.model;

import java.util.List;

/**
 * A resource flagged by an advisory check. The provider puts the human-meaningful
 * identifier (instance id, volume id, bucket name) in the first metadata column.
 */
public record FlaggedResource(
        String resourceId,
        String region,
        String status,
        List<String> metadata
) {
    public FlaggedResource {
        metadata = metadata == null ? List.of() : List.copyOf(metadata.stream()
                .map(m -> m == null ? "" : m)
                .toList());
    }

    public String recommendationId() {
        if (!metadata.isEmpty() && !metadata.get(0).isBlank()) {
            return metadata.get(0);
        }
        return resourceId;
    }
}
