package com.lendledger.exception;

public class ResourceNotFoundException extends LedgerException {

    public ResourceNotFoundException(String resourceType, Object identifier) {
        super(ErrorCode.NOT_FOUND, String.format("%s not found with identifier: %s", resourceType, identifier));
    }
}
