package com.lendledger.api.controller;

import com.lendledger.asset.AssetRegistry;
import com.lendledger.domain.enums.AssetKind;
import com.lendledger.domain.model.AssetUtilization;
import com.lendledger.domain.model.PlatformStats;
import com.lendledger.domain.model.SupportedCollection;
import com.lendledger.domain.model.SupportedToken;
import com.lendledger.domain.model.UserStats;
import com.lendledger.domain.vo.AssetRef;
import com.lendledger.loan.DynamicRateQuote;
import com.lendledger.loan.LoanRegistry;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only ledger views: user stats, per-asset utilization, rate previews, platform
 * totals and the asset whitelist. None of these need a caller identity.
 */
@RestController
@RequestMapping("/api")
public class LedgerQueryController {

    private final LoanRegistry loanRegistry;
    private final AssetRegistry assetRegistry;

    public LedgerQueryController(LoanRegistry loanRegistry, AssetRegistry assetRegistry) {
        this.loanRegistry = loanRegistry;
        this.assetRegistry = assetRegistry;
    }

    @GetMapping("/users/{user}/stats")
    public ResponseEntity<UserStats> getUserStats(@PathVariable String user) {
        return ResponseEntity.ok(loanRegistry.getUserStats(user));
    }

    /** Utilization counters for an asset; an unknown asset reports zeros. */
    @GetMapping("/utilization")
    public ResponseEntity<AssetUtilization> getAssetUtilization(
            @RequestParam(defaultValue = "NATIVE") AssetKind kind, @RequestParam(required = false) String ref) {
        return ResponseEntity.ok(loanRegistry.getAssetUtilization(AssetRef.of(kind, ref)));
    }

    /**
     * Previews the dynamic rate {@code user} would get. The collateral asset defaults to
     * native and is not part of the pricing today.
     */
    @GetMapping("/rates/dynamic")
    public ResponseEntity<DynamicRateQuote> getDynamicRate(
            @RequestParam String user,
            @RequestParam(defaultValue = "NATIVE") AssetKind loanKind,
            @RequestParam(required = false) String loanRef,
            @RequestParam(defaultValue = "NATIVE") AssetKind collateralKind,
            @RequestParam(required = false) String collateralRef,
            @RequestParam long collateralRatioBps) {
        return ResponseEntity.ok(loanRegistry.getDynamicRate(
                user, AssetRef.of(loanKind, loanRef), AssetRef.of(collateralKind, collateralRef), collateralRatioBps));
    }

    @GetMapping("/platform/stats")
    public ResponseEntity<PlatformStats> getPlatformStats() {
        return ResponseEntity.ok(loanRegistry.getPlatformStats());
    }

    @GetMapping("/assets/tokens")
    public ResponseEntity<List<SupportedToken>> getSupportedTokens() {
        return ResponseEntity.ok(assetRegistry.getTokens());
    }

    @GetMapping("/assets/collections")
    public ResponseEntity<List<SupportedCollection>> getSupportedCollections() {
        return ResponseEntity.ok(assetRegistry.getCollections());
    }
}
