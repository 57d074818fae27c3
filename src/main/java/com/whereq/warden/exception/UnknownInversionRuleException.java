package com.whereq.warden.exception;

/**
 * Thrown when an inversion rule name is not registered
 */
public class UnknownInversionRuleException extends WardenException {

    private final String ruleName;

    public UnknownInversionRuleException(String ruleName) {
        super("Unknown inversion mode: " + ruleName);
        this.ruleName = ruleName;
    }

    public String getRuleName() {
        return ruleName;
    }
}
