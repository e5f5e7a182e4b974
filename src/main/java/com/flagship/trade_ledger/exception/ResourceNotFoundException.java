package com.flagship.trade_ledger.exception;

/**
 * A referenced record does not exist (or is no longer active).
 * Fatal for primary lookups; the balance mutation path treats it as a skip.
 */
public class ResourceNotFoundException extends RuntimeException {

    private final String resource;
    private final Object reference;

    public ResourceNotFoundException(String resource, Object reference) {
        super(resource + " not found: " + reference);
        this.resource = resource;
        this.reference = reference;
    }

    public String getResource() {
        return resource;
    }

    public Object getReference() {
        return reference;
    }
}
