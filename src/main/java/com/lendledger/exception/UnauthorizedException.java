package com.lendledger.exception;

public class UnauthorizedException extends LedgerException {

    public UnauthorizedException(String message) {
        super(ErrorCode.UNAUTHORIZED, message);
    }
}
