package com.finops.advisor.adapters;

import com.finops.advisor.domain.model.AdvisoryCheck;
import com.finops.advisor.domain.model.AdvisoryFinding;

import java.util.List;
import java.util.Optional;

/**
 * Port for the provider's account-advisory service (AWS Trusted Advisor).
 *
 * IMPLEMENTATION REQUIREMENTS:
 * 1. listChecks() fails with {@link AdvisoryCatalogException} when the service is unreachable
 * 2. getCheckResult() returns empty when the check is unknown or has no result, and
 *    fails with {@link AdvisoryCatalogException} for any other provider error
 */
public interface AdvisoryCatalog {

    List<AdvisoryCheck> listChecks();

    Optional<AdvisoryFinding> getCheckResult(String checkId);
}
