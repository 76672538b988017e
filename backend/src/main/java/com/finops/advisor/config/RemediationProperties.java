package com.finops.advisor.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration properties for the remediation engine.
 *
 * Map keys containing dots (instance types) must be bracketed in YAML,
 * e.g. {@code remediation.pricing.compute."[t2.micro]": 8.47}.
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "remediation")
public class RemediationProperties {

    @Valid
    private PricingProperties pricing = new PricingProperties();

    @Valid
    private PolicyProperties policy = new PolicyProperties();

    @Valid
    private S3Properties s3 = new S3Properties();

    @Valid
    private ExecutionProperties execution = new ExecutionProperties();

    @Valid
    private AdvisoryProperties advisory = new AdvisoryProperties();

    @Valid
    private AutomationProperties automation = new AutomationProperties();

    /**
     * Static unit costs in USD per month. Not a live pricing lookup.
     */
    @Data
    public static class PricingProperties {
        private Map<String, BigDecimal> compute = new LinkedHashMap<>(Map.of(
                "t2.micro", new BigDecimal("8.47"),
                "t2.small", new BigDecimal("16.94"),
                "t2.medium", new BigDecimal("33.88"),
                "t3.micro", new BigDecimal("7.47"),
                "t3.small", new BigDecimal("14.94"),
                "t3.medium", new BigDecimal("29.88")
        ));

        @DecimalMin("0.0")
        private BigDecimal computeDefault = new BigDecimal("50.00");

        /** Per GB-month by volume type */
        private Map<String, BigDecimal> volume = new LinkedHashMap<>(Map.of(
                "gp2", new BigDecimal("0.10"),
                "gp3", new BigDecimal("0.08"),
                "io1", new BigDecimal("0.125"),
                "io2", new BigDecimal("0.125"),
                "st1", new BigDecimal("0.045"),
                "sc1", new BigDecimal("0.015")
        ));

        /** Per GB-month by storage class */
        private Map<String, BigDecimal> storage = new LinkedHashMap<>(Map.of(
                "STANDARD", new BigDecimal("0.023"),
                "STANDARD_IA", new BigDecimal("0.0125"),
                "GLACIER", new BigDecimal("0.004")
        ));

        /** Flat monthly saving per instance family when downsizing one step */
        private Map<String, BigDecimal> rightsizing = new LinkedHashMap<>(Map.of(
                "m5", new BigDecimal("20.00"),
                "c5", new BigDecimal("15.00")
        ));
    }

    @Data
    public static class PolicyProperties {
        private Duration volumeMinAge = Duration.ofDays(30);
        private Duration burstableMinAge = Duration.ofHours(24);

        @Min(0)
        private int largeGp2SizeGb = 100;

        @Min(0)
        private int lowIopsThreshold = 1000;
    }

    @Data
    public static class S3Properties {
        /**
         * Treat any bucket policy as public access. This over-approximates: a policy
         * can exist without granting public read. Kept on until product decides.
         */
        private boolean treatAnyPolicyAsPublic = true;

        @NotBlank
        private String loggingBucketSuffix = "-logs";
    }

    @Data
    public static class ExecutionProperties {
        @Min(1)
        private int corePoolSize = 4;

        @Min(1)
        private int maxPoolSize = 16;

        @Min(0)
        private int queueCapacity = 500;

        /** Seconds to let in-flight remediation finish when the context closes */
        @Min(0)
        private int shutdownAwaitSeconds = 60;
    }

    @Data
    public static class AdvisoryProperties {
        @NotBlank
        private String language = "en";

        /** Flat pre-remediation estimate per flagged resource */
        @DecimalMin("0.0")
        private BigDecimal perResourceEstimate = new BigDecimal("50.0");
    }

    @Data
    public static class AutomationProperties {
        private boolean enabled = false;
        private String cron = "0 0 3 * * *";

        @DecimalMin("0.0")
        private BigDecimal minSavings = new BigDecimal("10.0");

        private boolean dryRunOnly = true;
    }
}
