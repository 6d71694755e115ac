package com.lendledger.settlement;

import com.lendledger.domain.vo.AssetRef;
import com.lendledger.domain.vo.CollateralSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * No-op hook: token and collectible movements are recorded in the ledger only.
 * Callers relying on non-native collateral must settle it out of band.
 */
@Component
public class LoggingExternalAssetHook implements ExternalAssetHook {

    private static final Logger log = LoggerFactory.getLogger(LoggingExternalAssetHook.class);

    @Override
    public void lockCollateral(long loanId, String borrower, CollateralSpec collateral) {
        log.debug(
                "Loan {}: collateral {} from {} recorded without custody transfer",
                loanId,
                describe(collateral),
                borrower);
    }

    @Override
    public void releaseCollateral(long loanId, String borrower, CollateralSpec collateral) {
        log.debug("Loan {}: collateral {} release to {} recorded only", loanId, describe(collateral), borrower);
    }

    @Override
    public void seizeCollateral(long loanId, String lender, CollateralSpec collateral) {
        log.debug("Loan {}: collateral {} seizure by {} recorded only", loanId, describe(collateral), lender);
    }

    @Override
    public void transferLoanAsset(long loanId, AssetRef asset, long amount, String from, String to) {
        log.debug("Loan {}: {} of {} from {} to {} recorded without transfer", loanId, amount, asset, from, to);
    }

    private String describe(CollateralSpec collateral) {
        return collateral.getItemId() == null
                ? collateral.getAmount() + " " + collateral.getAsset()
                : collateral.getAsset() + "#" + collateral.getItemId();
    }
}
