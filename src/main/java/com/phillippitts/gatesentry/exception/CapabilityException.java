package com.phillippitts.gatesentry.exception;

/**
 * Thrown by collaborator adapters (language model, image classifier) when a call fails or times out.
 * Callers catch it at the call site and degrade to their documented fallback.
 */
public class CapabilityException extends GateSentryException {

    private final String capability;

    public CapabilityException(String message, String capability) {
        super(message + " (capability: " + capability + ")");
        this.capability = capability;
    }

    public CapabilityException(String message, String capability, Throwable cause) {
        super(message + " (capability: " + capability + ")", cause);
        this.capability = capability;
    }

    public String getCapability() {
        return capability;
    }
}
