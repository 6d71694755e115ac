package com.lendledger.settlement;

/**
 * Custody collaborator that moves the native asset between accounts.
 *
 * <p>Each call is all-or-nothing: it either moves the full amount and returns true, or
 * moves nothing and returns false. Implementations may also throw; the
 * {@link SettlementExecutor} treats an exception like a false return.
 */
public interface TransferService {

    boolean transfer(long amount, String from, String to);
}
