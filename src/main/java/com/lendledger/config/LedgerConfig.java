package com.lendledger.config;

import com.lendledger.clock.LedgerClock;
import com.lendledger.clock.SystemBlockClock;
import com.lendledger.domain.model.LedgerParameters;
import com.lendledger.settlement.InMemoryTransferService;
import java.time.Clock;
import java.time.Instant;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the {@link LedgerParameters} bean and the default collaborators from
 * application.properties.
 *
 * <p>Defaults describe a one-year maximum term at ten-minute blocks, 150% minimum
 * collateral and a 2.5% platform fee. Properties prefix: {@code lendledger.*}
 */
@Configuration
public class LedgerConfig {

    @Bean
    public LedgerParameters ledgerParameters(
            @Value("${lendledger.owner:platform-owner}") String owner,
            @Value("${lendledger.custody-account:ledger-custody}") String custodyAccount,
            @Value("${lendledger.platform-fee-bps:250}") int platformFeeBps,
            @Value("${lendledger.max-duration-blocks:52560}") long maxDurationBlocks,
            @Value("${lendledger.min-collateral-ratio-bps:15000}") long minCollateralRatioBps,
            @Value("${lendledger.rate.base-bps:500}") int baseRateBps,
            @Value("${lendledger.rate.utilization-multiplier:200}") int utilizationMultiplier,
            @Value("${lendledger.rate.risk-multiplier:100}") int riskMultiplier,
            @Value("${lendledger.rate.min-bps:100}") int minDynamicRateBps,
            @Value("${lendledger.rate.max-bps:2000}") int maxDynamicRateBps) {
        return LedgerParameters.builder()
                .owner(owner)
                .custodyAccount(custodyAccount)
                .platformFeeBps(platformFeeBps)
                .maxDurationBlocks(maxDurationBlocks)
                .minCollateralRatioBps(minCollateralRatioBps)
                .baseRateBps(baseRateBps)
                .utilizationMultiplier(utilizationMultiplier)
                .riskMultiplier(riskMultiplier)
                .minDynamicRateBps(minDynamicRateBps)
                .maxDynamicRateBps(maxDynamicRateBps)
                .build();
    }

    @Bean
    public LedgerClock ledgerClock(
            @Value("${lendledger.clock.genesis:2024-01-01T00:00:00Z}") String genesis,
            @Value("${lendledger.clock.block-interval-seconds:600}") long blockIntervalSeconds) {
        return new SystemBlockClock(Clock.systemUTC(), Instant.parse(genesis), blockIntervalSeconds);
    }

    @Bean
    public InMemoryTransferService transferService() {
        return new InMemoryTransferService();
    }
}
