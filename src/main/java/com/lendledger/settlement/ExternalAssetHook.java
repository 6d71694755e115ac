package com.lendledger.settlement;

import com.lendledger.domain.vo.AssetRef;
import com.lendledger.domain.vo.CollateralSpec;

/**
 * Movement of non-native assets (fungible tokens, collectibles).
 *
 * <p>The ledger records loans in these assets but does not itself custody them; each
 * call marks the point where a token-specific transfer would run. The bundled
 * implementation is {@link LoggingExternalAssetHook}, which moves nothing.
 */
public interface ExternalAssetHook {

    void lockCollateral(long loanId, String borrower, CollateralSpec collateral);

    void releaseCollateral(long loanId, String borrower, CollateralSpec collateral);

    void seizeCollateral(long loanId, String lender, CollateralSpec collateral);

    void transferLoanAsset(long loanId, AssetRef asset, long amount, String from, String to);
}
