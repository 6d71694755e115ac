package com.lendledger.exception;

import java.util.Map;

/**
 * Raised when a ledger operation fails a precondition or a settlement leg. The ledger is
 * unchanged when this propagates, so the caller may correct the input and retry.
 */
public class LedgerException extends BaseException {

    public LedgerException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public LedgerException(ErrorCode errorCode, String message, Map<String, Object> details) {
        super(errorCode, message, details);
    }

    public LedgerException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
