package com.slb.reward_ledger.modules.ledger.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "app.ledger")
@Data
public class RewardLedgerProperties {

    /**
     * 唯一管理员身份：仅该身份可注资、修改发放周期。
     */
    private String admin;

    /**
     * 账本自身在资产侧的账户标识（质押资产与奖励资产均托管在该账户下）。
     */
    private String ledgerAddress = "reward-ledger";

    /**
     * 初始发放周期（秒）。0 表示尚未设置，注资前需先调用 setRewardsDuration。
     */
    private long rewardsDuration = 0L;

    /** 默认装配的质押资产符号 */
    private String stakingSymbol = "STK";

    /** 默认装配的奖励资产符号 */
    private String rewardSymbol = "RWD";
}
