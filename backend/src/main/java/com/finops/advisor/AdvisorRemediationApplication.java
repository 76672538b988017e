package com.finops.advisor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Advisory Remediation Engine
 *
 * Maps AWS Trusted Advisor findings to executable remediations and runs them
 * against live EC2, EBS and S3 resources, with dry-run and per-resource
 * failure isolation.
 */
@SpringBootApplication
@EnableScheduling
public class AdvisorRemediationApplication {

    public static void main(String[] args) {
        SpringApplication.run(AdvisorRemediationApplication.class, args);
    }
}
