package com.aerox.common.exception;

/** Base of engine errors, tagged with the component that raised them. */
public class CreditEngineException extends RuntimeException {
    private final String component;

    public CreditEngineException(String component, String message) {
        super("[" + component + "] " + message);
        this.component = component;
    }

    public CreditEngineException(String component, String message, Throwable cause) {
        super("[" + component + "] " + message, cause);
        this.component = component;
    }

    public String getComponent() {
        return component;
    }
}
