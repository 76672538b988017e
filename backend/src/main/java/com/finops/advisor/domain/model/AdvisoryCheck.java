package com.finops.advisor.domain.model;

/**
 * Descriptor of an advisory check, as returned by the catalog listing.
 */
public record AdvisoryCheck(
        String checkId,
        String name,
        String description,
        CheckCategory category
) {}
