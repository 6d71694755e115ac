package com.lendledger.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Error kinds surfaced by the ledger. Every failure aborts the whole operation; the
 * code tells the caller which precondition failed and the HTTP status it maps to.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    BAD_REQUEST("BAD_REQUEST", 400),
    INVALID_AMOUNT("INVALID_AMOUNT", 400),
    INVALID_DURATION("INVALID_DURATION", 400),
    INVALID_INTEREST("INVALID_INTEREST", 400),
    INVALID_RISK_SCORE("INVALID_RISK_SCORE", 400),
    INVALID_COLLATERAL_TYPE("INVALID_COLLATERAL_TYPE", 400),
    INVALID_TOKEN_CONTRACT("INVALID_TOKEN_CONTRACT", 400),
    UNSUPPORTED_ASSET("UNSUPPORTED_ASSET", 400),
    UNAUTHORIZED("UNAUTHORIZED", 401),
    NOT_FOUND("NOT_FOUND", 404),
    INSUFFICIENT_COLLATERAL("INSUFFICIENT_COLLATERAL", 422),
    RATE_REJECTED("RATE_REJECTED", 422),
    LOAN_NOT_ACTIVE("LOAN_NOT_ACTIVE", 422),
    LOAN_NOT_FUNDED("LOAN_NOT_FUNDED", 422),
    ALREADY_FUNDED("ALREADY_FUNDED", 422),
    LOAN_NOT_OVERDUE("LOAN_NOT_OVERDUE", 422),
    INTERNAL_ERROR("INTERNAL_ERROR", 500),
    TRANSFER_FAILED("TRANSFER_FAILED", 502);

    private final String code;
    private final int httpStatus;
}
