package com.slb.reward_ledger.modules.ledger.config;

import com.slb.reward_ledger.modules.ledger.asset.FungibleAsset;
import com.slb.reward_ledger.modules.ledger.asset.InMemoryFungibleAsset;
import com.slb.reward_ledger.modules.ledger.clock.LedgerClock;
import com.slb.reward_ledger.modules.ledger.clock.SystemLedgerClock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * 默认装配：两份内存资产 + 系统时钟。接入真实资产时覆盖对应 bean 即可。
 */
@Configuration
public class RewardLedgerConfig {

    @Bean
    @ConditionalOnMissingBean(name = "stakingAsset")
    public FungibleAsset stakingAsset(RewardLedgerProperties properties) {
        return new InMemoryFungibleAsset(properties.getStakingSymbol());
    }

    @Bean
    @ConditionalOnMissingBean(name = "rewardAsset")
    public FungibleAsset rewardAsset(RewardLedgerProperties properties) {
        return new InMemoryFungibleAsset(properties.getRewardSymbol());
    }

    @Bean
    @ConditionalOnMissingBean(LedgerClock.class)
    public LedgerClock ledgerClock() {
        return new SystemLedgerClock(Clock.systemUTC());
    }
}
