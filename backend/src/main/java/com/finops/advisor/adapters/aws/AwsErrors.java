package com.finops.advisor.adapters.aws;

import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.SdkException;

/**
 * Readable messages for SDK failures.
 */
final class AwsErrors {

    private AwsErrors() {
    }

    static String describe(SdkException e) {
        if (e instanceof AwsServiceException service && service.awsErrorDetails() != null) {
            return service.awsErrorDetails().errorCode() + ": " + service.awsErrorDetails().errorMessage();
        }
        return e.getMessage();
    }

    static boolean hasErrorCode(SdkException e, String errorCode) {
        return e instanceof AwsServiceException service
                && service.awsErrorDetails() != null
                && errorCode.equals(service.awsErrorDetails().errorCode());
    }
}
