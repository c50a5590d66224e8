package com.fintech.settlement.exception;

public class ResourceNotFoundException extends SettlementException {

    public ResourceNotFoundException(String resource, Object id) {
        super(resource + " not found: " + id);
    }
}
