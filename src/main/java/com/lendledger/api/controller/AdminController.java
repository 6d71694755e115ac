package com.lendledger.api.controller;

import com.lendledger.admin.DynamicRateParams;
import com.lendledger.admin.PlatformAdminService;
import com.lendledger.api.dto.request.CreditAccountRequest;
import com.lendledger.api.dto.request.DynamicRateParamsRequest;
import com.lendledger.api.dto.request.MinCollateralRatioRequest;
import com.lendledger.api.dto.request.PlatformFeeRequest;
import com.lendledger.api.dto.request.SupportedCollectionRequest;
import com.lendledger.api.dto.request.SupportedTokenRequest;
import com.lendledger.domain.model.SupportedCollection;
import com.lendledger.domain.model.SupportedToken;
import jakarta.validation.Valid;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Owner-only endpoints: asset whitelist and platform parameters.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>POST /api/admin/tokens -- register or re-enable a token</li>
 *   <li>DELETE /api/admin/tokens/{ref} -- disable a token</li>
 *   <li>POST /api/admin/collections -- register a collection</li>
 *   <li>PUT /api/admin/collections/{ref} -- update floor price, risk score, enabled</li>
 *   <li>PUT /api/admin/platform-fee, /min-collateral-ratio, /dynamic-rate-params</li>
 *   <li>POST /api/admin/accounts/credit -- fund an account in the in-memory custody</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/admin")
public class AdminController {

    private static final Logger log = LoggerFactory.getLogger(AdminController.class);

    private final PlatformAdminService platformAdminService;

    public AdminController(PlatformAdminService platformAdminService) {
        this.platformAdminService = platformAdminService;
    }

    @PostMapping("/tokens")
    public ResponseEntity<SupportedToken> addSupportedToken(
            @RequestHeader(LoanController.CALLER_HEADER) String caller,
            @Valid @RequestBody SupportedTokenRequest request) {
        return ResponseEntity.ok(platformAdminService.addSupportedToken(
                caller, request.getTokenRef(), request.getDecimals(), request.getRiskScore()));
    }

    @DeleteMapping("/tokens/{ref}")
    public ResponseEntity<SupportedToken> removeSupportedToken(
            @RequestHeader(LoanController.CALLER_HEADER) String caller, @PathVariable String ref) {
        return ResponseEntity.ok(platformAdminService.removeSupportedToken(caller, ref));
    }

    @PostMapping("/collections")
    public ResponseEntity<SupportedCollection> addSupportedCollection(
            @RequestHeader(LoanController.CALLER_HEADER) String caller,
            @Valid @RequestBody SupportedCollectionRequest request) {
        return ResponseEntity.ok(platformAdminService.addSupportedCollection(
                caller, request.getCollectionRef(), request.getFloorPrice(), request.getRiskScore()));
    }

    /** The path reference wins over any reference in the body. */
    @PutMapping("/collections/{ref}")
    public ResponseEntity<SupportedCollection> updateCollection(
            @RequestHeader(LoanController.CALLER_HEADER) String caller,
            @PathVariable String ref,
            @Valid @RequestBody SupportedCollectionRequest request) {
        boolean enabled = request.getEnabled() == null || request.getEnabled();
        return ResponseEntity.ok(platformAdminService.updateCollection(
                caller, ref, request.getFloorPrice(), request.getRiskScore(), enabled));
    }

    @PutMapping("/platform-fee")
    public ResponseEntity<Map<String, Object>> setPlatformFee(
            @RequestHeader(LoanController.CALLER_HEADER) String caller,
            @Valid @RequestBody PlatformFeeRequest request) {
        log.info("Platform fee update requested by {}: {}", caller, request.getFeeBps());
        platformAdminService.setPlatformFee(caller, request.getFeeBps());
        return ResponseEntity.ok(Map.of("platformFeeBps", request.getFeeBps()));
    }

    @PutMapping("/min-collateral-ratio")
    public ResponseEntity<Map<String, Object>> setMinCollateralRatio(
            @RequestHeader(LoanController.CALLER_HEADER) String caller,
            @Valid @RequestBody MinCollateralRatioRequest request) {
        log.info("Minimum collateral ratio update requested by {}: {}", caller, request.getRatioBps());
        platformAdminService.setMinCollateralRatio(caller, request.getRatioBps());
        return ResponseEntity.ok(Map.of("minCollateralRatioBps", request.getRatioBps()));
    }

    @PutMapping("/dynamic-rate-params")
    public ResponseEntity<DynamicRateParams> setDynamicRateParams(
            @RequestHeader(LoanController.CALLER_HEADER) String caller,
            @Valid @RequestBody DynamicRateParamsRequest request) {
        DynamicRateParams params = DynamicRateParams.builder()
                .baseRateBps(request.getBaseRateBps())
                .utilizationMultiplier(request.getUtilizationMultiplier())
                .riskMultiplier(request.getRiskMultiplier())
                .maxRateBps(request.getMaxRateBps())
                .minRateBps(request.getMinRateBps())
                .build();
        platformAdminService.setDynamicRateParams(caller, params);
        return ResponseEntity.ok(params);
    }

    @PostMapping("/accounts/credit")
    public ResponseEntity<Map<String, Object>> creditAccount(
            @RequestHeader(LoanController.CALLER_HEADER) String caller,
            @Valid @RequestBody CreditAccountRequest request) {
        long balance = platformAdminService.creditAccount(caller, request.getAccount(), request.getAmount());
        return ResponseEntity.ok(Map.of("account", request.getAccount(), "balance", balance));
    }
}
