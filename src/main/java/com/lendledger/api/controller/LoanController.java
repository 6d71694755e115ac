package com.lendledger.api.controller;

import com.lendledger.api.dto.request.CreateLoanRequest;
import com.lendledger.api.dto.request.CreateNftCollateralLoanRequest;
import com.lendledger.api.dto.request.CreateTokenCollateralLoanRequest;
import com.lendledger.api.dto.request.CreateTokenLoanRequest;
import com.lendledger.api.dto.response.LoanCreatedResponse;
import com.lendledger.api.dto.response.LoanResponse;
import com.lendledger.loan.LoanRegistry;
import com.lendledger.loan.LoanTerms;
import com.lendledger.loan.RepaymentResult;
import com.lendledger.mapper.LoanMapper;
import jakarta.validation.Valid;
import java.util.Map;
import org.mapstruct.factory.Mappers;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for the loan lifecycle.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>POST /api/loans -- native loan, native collateral</li>
 *   <li>POST /api/loans/token-collateral -- native loan, token collateral</li>
 *   <li>POST /api/loans/nft-collateral -- native loan, collectible collateral</li>
 *   <li>POST /api/loans/token -- token-denominated loan, native collateral</li>
 *   <li>POST /api/loans/{id}/fund, /fund-token -- lender funds a pending loan</li>
 *   <li>POST /api/loans/{id}/repay -- borrower repays principal plus interest</li>
 *   <li>POST /api/loans/{id}/liquidate -- lender seizes collateral of an overdue loan</li>
 *   <li>GET /api/loans/{id}, /api/loans/{id}/overdue</li>
 * </ul>
 *
 * <p>The caller is identified by the {@value #CALLER_HEADER} header.
 */
@RestController
@RequestMapping("/api/loans")
public class LoanController {

    public static final String CALLER_HEADER = "X-Caller-Id";

    private final LoanRegistry loanRegistry;
    private final LoanMapper loanMapper = Mappers.getMapper(LoanMapper.class);

    public LoanController(LoanRegistry loanRegistry) {
        this.loanRegistry = loanRegistry;
    }

    @PostMapping
    public ResponseEntity<LoanCreatedResponse> createLoan(
            @RequestHeader(CALLER_HEADER) String caller, @Valid @RequestBody CreateLoanRequest request) {
        LoanTerms terms = terms(
                request.getPrincipal(),
                request.getInterestRateBps(),
                request.getMaxAcceptableRateBps(),
                request.getDurationBlocks());
        long loanId = loanRegistry.createLoan(caller, terms, request.getCollateralAmount());
        return created(loanId);
    }

    @PostMapping("/token-collateral")
    public ResponseEntity<LoanCreatedResponse> createLoanWithTokenCollateral(
            @RequestHeader(CALLER_HEADER) String caller,
            @Valid @RequestBody CreateTokenCollateralLoanRequest request) {
        LoanTerms terms = terms(
                request.getPrincipal(),
                request.getInterestRateBps(),
                request.getMaxAcceptableRateBps(),
                request.getDurationBlocks());
        long loanId = loanRegistry.createLoanWithTokenCollateral(
                caller, terms, request.getTokenRef(), request.getCollateralAmount());
        return created(loanId);
    }

    @PostMapping("/nft-collateral")
    public ResponseEntity<LoanCreatedResponse> createLoanWithNftCollateral(
            @RequestHeader(CALLER_HEADER) String caller,
            @Valid @RequestBody CreateNftCollateralLoanRequest request) {
        LoanTerms terms = terms(
                request.getPrincipal(),
                request.getInterestRateBps(),
                request.getMaxAcceptableRateBps(),
                request.getDurationBlocks());
        long loanId = loanRegistry.createLoanWithNftCollateral(
                caller, terms, request.getCollectionRef(), request.getItemId());
        return created(loanId);
    }

    @PostMapping("/token")
    public ResponseEntity<LoanCreatedResponse> createTokenLoan(
            @RequestHeader(CALLER_HEADER) String caller, @Valid @RequestBody CreateTokenLoanRequest request) {
        LoanTerms terms = terms(
                request.getPrincipal(),
                request.getInterestRateBps(),
                request.getMaxAcceptableRateBps(),
                request.getDurationBlocks());
        long loanId =
                loanRegistry.createTokenLoan(caller, terms, request.getLoanTokenRef(), request.getCollateralAmount());
        return created(loanId);
    }

    @PostMapping("/{id}/fund")
    public ResponseEntity<LoanResponse> fundLoan(@RequestHeader(CALLER_HEADER) String caller, @PathVariable long id) {
        loanRegistry.fundLoan(caller, id);
        return ResponseEntity.ok(loanMapper.toResponse(loanRegistry.getLoan(id)));
    }

    @PostMapping("/{id}/fund-token")
    public ResponseEntity<LoanResponse> fundTokenLoan(
            @RequestHeader(CALLER_HEADER) String caller, @PathVariable long id) {
        loanRegistry.fundTokenLoan(caller, id);
        return ResponseEntity.ok(loanMapper.toResponse(loanRegistry.getLoan(id)));
    }

    @PostMapping("/{id}/repay")
    public ResponseEntity<RepaymentResult> repayLoan(
            @RequestHeader(CALLER_HEADER) String caller, @PathVariable long id) {
        return ResponseEntity.ok(loanRegistry.repayLoan(caller, id));
    }

    @PostMapping("/{id}/liquidate")
    public ResponseEntity<LoanResponse> liquidateLoan(
            @RequestHeader(CALLER_HEADER) String caller, @PathVariable long id) {
        loanRegistry.liquidateLoan(caller, id);
        return ResponseEntity.ok(loanMapper.toResponse(loanRegistry.getLoan(id)));
    }

    @GetMapping("/{id}")
    public ResponseEntity<LoanResponse> getLoan(@PathVariable long id) {
        return ResponseEntity.ok(loanMapper.toResponse(loanRegistry.getLoan(id)));
    }

    @GetMapping("/{id}/overdue")
    public ResponseEntity<Map<String, Object>> isLoanOverdue(@PathVariable long id) {
        return ResponseEntity.ok(Map.of("loanId", id, "overdue", loanRegistry.isLoanOverdue(id)));
    }

    private static LoanTerms terms(Long principal, Integer rateBps, Integer maxAcceptableRateBps, Long durationBlocks) {
        return LoanTerms.builder()
                .principal(principal)
                .requestedRateBps(rateBps == null ? 0 : rateBps)
                .maxAcceptableRateBps(maxAcceptableRateBps)
                .durationBlocks(durationBlocks)
                .build();
    }

    private static ResponseEntity<LoanCreatedResponse> created(long loanId) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(LoanCreatedResponse.builder().loanId(loanId).build());
    }
}
