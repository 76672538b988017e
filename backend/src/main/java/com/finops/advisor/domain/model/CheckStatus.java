package com.finops.advisor.domain.model;

import java.util.Arrays;

public enum CheckStatus {
    OK("ok"),
    WARNING("warning"),
    ERROR("error"),
    NOT_AVAILABLE("not_available");

    private final String providerValue;

    CheckStatus(String providerValue) {
        this.providerValue = providerValue;
    }

    public String getProviderValue() {
        return providerValue;
    }

    /**
     * True when the check flagged something worth acting on.
     */
    public boolean isActionable() {
        return this == WARNING || this == ERROR;
    }

    public static CheckStatus fromProviderValue(String value) {
        if (value == null) {
            return NOT_AVAILABLE;
        }
        return Arrays.stream(values())
                .filter(s -> s.providerValue.equalsIgnoreCase(value.trim()))
                .findFirst()
                .orElse(NOT_AVAILABLE);
    }
}
