package com.lendledger.admin;

import com.lendledger.asset.AssetRegistry;
import com.lendledger.core.LedgerExecutor;
import com.lendledger.domain.model.LedgerParameters;
import com.lendledger.domain.model.SupportedCollection;
import com.lendledger.domain.model.SupportedToken;
import com.lendledger.exception.ErrorCode;
import com.lendledger.exception.LedgerException;
import com.lendledger.exception.ResourceNotFoundException;
import com.lendledger.exception.UnauthorizedException;
import com.lendledger.settlement.InMemoryTransferService;
import com.lendledger.settlement.TransferService;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Privileged operations: asset whitelist maintenance and platform parameter changes.
 *
 * <p>Every operation requires the caller to be the configured platform owner and runs
 * inside {@link LedgerExecutor}, so parameter changes never interleave with a loan
 * operation that is reading them. Bounds:
 * <ul>
 *   <li>token decimals 0..18, risk score 1..10, collection floor price &gt; 0</li>
 *   <li>platform fee at most 1000 bps</li>
 *   <li>minimum collateral ratio 10000..50000 bps</li>
 *   <li>dynamic rate: base 50..1000, utilization multiplier &le; 500, risk multiplier
 *       &le; 300, max rate 500..5000, min rate 50..200, max &gt; min</li>
 * </ul>
 */
@Service
public class PlatformAdminService {

    private static final Logger log = LoggerFactory.getLogger(PlatformAdminService.class);

    static final int MAX_TOKEN_DECIMALS = 18;
    static final int MIN_RISK_SCORE = 1;
    static final int MAX_RISK_SCORE = 10;
    static final int MAX_PLATFORM_FEE_BPS = 1000;
    static final long MIN_COLLATERAL_RATIO_FLOOR_BPS = 10_000L;
    static final long MIN_COLLATERAL_RATIO_CEILING_BPS = 50_000L;

    private final AssetRegistry assetRegistry;
    private final LedgerParameters ledgerParameters;
    private final LedgerExecutor ledgerExecutor;
    private final TransferService transferService;

    public PlatformAdminService(
            AssetRegistry assetRegistry,
            LedgerParameters ledgerParameters,
            LedgerExecutor ledgerExecutor,
            TransferService transferService) {
        this.assetRegistry = assetRegistry;
        this.ledgerParameters = ledgerParameters;
        this.ledgerExecutor = ledgerExecutor;
        this.transferService = transferService;
    }

    // ========================
    // ASSET WHITELIST
    // ========================

    /** Registers a token, or re-enables and overwrites an existing one. */
    public SupportedToken addSupportedToken(String caller, String tokenRef, int decimals, int riskScore) {
        return ledgerExecutor.execute("addSupportedToken", () -> {
            requireOwner(caller);
            assetRegistry.requireWellFormed(tokenRef);
            if (decimals < 0 || decimals > MAX_TOKEN_DECIMALS) {
                throw new LedgerException(
                        ErrorCode.INVALID_AMOUNT, "Decimals must be in [0, " + MAX_TOKEN_DECIMALS + "]: " + decimals);
            }
            requireRiskScore(riskScore);

            SupportedToken token = SupportedToken.builder()
                    .reference(tokenRef)
                    .enabled(true)
                    .decimals(decimals)
                    .riskScore(riskScore)
                    .build();
            assetRegistry.putToken(token);
            return token;
        });
    }

    /** Disables a token; the entry stays so existing loans keep a resolvable reference. */
    public SupportedToken removeSupportedToken(String caller, String tokenRef) {
        return ledgerExecutor.execute("removeSupportedToken", () -> {
            requireOwner(caller);
            SupportedToken token = assetRegistry
                    .findToken(tokenRef)
                    .orElseThrow(() -> new ResourceNotFoundException("Token", tokenRef));
            token.setEnabled(false);
            assetRegistry.putToken(token);
            return token;
        });
    }

    public SupportedCollection addSupportedCollection(
            String caller, String collectionRef, long floorPrice, int riskScore) {
        return ledgerExecutor.execute("addSupportedCollection", () -> {
            requireOwner(caller);
            assetRegistry.requireWellFormed(collectionRef);
            requireFloorPrice(floorPrice);
            requireRiskScore(riskScore);

            SupportedCollection collection = SupportedCollection.builder()
                    .reference(collectionRef)
                    .enabled(true)
                    .floorPrice(floorPrice)
                    .riskScore(riskScore)
                    .build();
            assetRegistry.putCollection(collection);
            return collection;
        });
    }

    /** Replaces floor price, risk score and enabled flag of a registered collection. */
    public SupportedCollection updateCollection(
            String caller, String collectionRef, long floorPrice, int riskScore, boolean enabled) {
        return ledgerExecutor.execute("updateCollection", () -> {
            requireOwner(caller);
            SupportedCollection collection = assetRegistry
                    .findCollection(collectionRef)
                    .orElseThrow(() -> new ResourceNotFoundException("Collection", collectionRef));
            requireFloorPrice(floorPrice);
            requireRiskScore(riskScore);

            collection.setFloorPrice(floorPrice);
            collection.setRiskScore(riskScore);
            collection.setEnabled(enabled);
            assetRegistry.putCollection(collection);
            return collection;
        });
    }

    // ========================
    // PARAMETERS
    // ========================

    public void setPlatformFee(String caller, int feeBps) {
        ledgerExecutor.run("setPlatformFee", () -> {
            requireOwner(caller);
            if (feeBps < 0 || feeBps > MAX_PLATFORM_FEE_BPS) {
                throw new LedgerException(
                        ErrorCode.INVALID_AMOUNT,
                        "Platform fee must be in [0, " + MAX_PLATFORM_FEE_BPS + "]: " + feeBps);
            }
            int previous = ledgerParameters.getPlatformFeeBps();
            ledgerParameters.setPlatformFeeBps(feeBps);
            log.info("Platform fee changed: {} -> {} bps", previous, feeBps);
        });
    }

    public void setMinCollateralRatio(String caller, long ratioBps) {
        ledgerExecutor.run("setMinCollateralRatio", () -> {
            requireOwner(caller);
            if (ratioBps < MIN_COLLATERAL_RATIO_FLOOR_BPS || ratioBps > MIN_COLLATERAL_RATIO_CEILING_BPS) {
                throw new LedgerException(
                        ErrorCode.INVALID_AMOUNT,
                        "Minimum collateral ratio must be in [" + MIN_COLLATERAL_RATIO_FLOOR_BPS + ", "
                                + MIN_COLLATERAL_RATIO_CEILING_BPS + "]: " + ratioBps);
            }
            long previous = ledgerParameters.getMinCollateralRatioBps();
            ledgerParameters.setMinCollateralRatioBps(ratioBps);
            log.info("Minimum collateral ratio changed: {} -> {} bps", previous, ratioBps);
        });
    }

    /** Replaces all dynamic rate parameters at once; nothing changes if any bound fails. */
    public void setDynamicRateParams(String caller, DynamicRateParams params) {
        ledgerExecutor.run("setDynamicRateParams", () -> {
            requireOwner(caller);
            validate(params);

            ledgerParameters.setBaseRateBps(params.getBaseRateBps());
            ledgerParameters.setUtilizationMultiplier(params.getUtilizationMultiplier());
            ledgerParameters.setRiskMultiplier(params.getRiskMultiplier());
            ledgerParameters.setMaxDynamicRateBps(params.getMaxRateBps());
            ledgerParameters.setMinDynamicRateBps(params.getMinRateBps());
            log.info("Dynamic rate parameters changed: {}", params);
        });
    }

    /**
     * Funds an account in the bundled in-memory custody. Only available when no external
     * transfer service has replaced it.
     */
    public long creditAccount(String caller, String account, long amount) {
        return ledgerExecutor.execute("creditAccount", () -> {
            requireOwner(caller);
            if (!(transferService instanceof InMemoryTransferService inMemory)) {
                throw new LedgerException(
                        ErrorCode.BAD_REQUEST, "Account credit is only supported by the in-memory transfer service");
            }
            if (account == null || account.isBlank()) {
                throw new LedgerException(ErrorCode.BAD_REQUEST, "Account is required");
            }
            if (amount <= 0) {
                throw new LedgerException(ErrorCode.INVALID_AMOUNT, "Credit amount must be positive: " + amount);
            }
            inMemory.credit(account, amount);
            return inMemory.balanceOf(account);
        });
    }

    // ========================
    // INTERNALS
    // ========================

    private void requireOwner(String caller) {
        if (caller == null || !caller.equals(ledgerParameters.getOwner())) {
            throw new UnauthorizedException("Only the platform owner may perform this operation");
        }
    }

    private void requireRiskScore(int riskScore) {
        if (riskScore < MIN_RISK_SCORE || riskScore > MAX_RISK_SCORE) {
            throw new LedgerException(
                    ErrorCode.INVALID_RISK_SCORE,
                    "Risk score must be in [" + MIN_RISK_SCORE + ", " + MAX_RISK_SCORE + "]: " + riskScore);
        }
    }

    private void requireFloorPrice(long floorPrice) {
        if (floorPrice <= 0) {
            throw new LedgerException(ErrorCode.INVALID_AMOUNT, "Floor price must be positive: " + floorPrice);
        }
    }

    private void validate(DynamicRateParams params) {
        requireRange("baseRateBps", params.getBaseRateBps(), 50, 1000);
        requireRange("utilizationMultiplier", params.getUtilizationMultiplier(), 0, 500);
        requireRange("riskMultiplier", params.getRiskMultiplier(), 0, 300);
        requireRange("maxRateBps", params.getMaxRateBps(), 500, 5000);
        requireRange("minRateBps", params.getMinRateBps(), 50, 200);
        if (params.getMaxRateBps() <= params.getMinRateBps()) {
            throw new LedgerException(
                    ErrorCode.INVALID_INTEREST,
                    "maxRateBps must exceed minRateBps",
                    Map.of("maxRateBps", params.getMaxRateBps(), "minRateBps", params.getMinRateBps()));
        }
    }

    private void requireRange(String field, int value, int min, int max) {
        if (value < min || value > max) {
            throw new LedgerException(
                    ErrorCode.INVALID_INTEREST,
                    field + " must be in [" + min + ", " + max + "]: " + value,
                    Map.of("field", field, "value", value));
        }
    }
}
