package com.slb.reward_ledger.modules.ledger.entity;

import lombok.Data;

import java.io.Serializable;
import java.math.BigInteger;

/**
 * 单个账户的质押与奖励结算快照。首次访问时隐式创建（全 0）。
 */
@Data
public class AccountPosition implements Serializable {
    private static final long serialVersionUID = 1L;

    /** 当前质押量 */
    private BigInteger stake = BigInteger.ZERO;
    /** 上次结算时记录的 rewardPerTokenStored */
    private BigInteger rewardPerTokenPaid = BigInteger.ZERO;
    /** 已累计未领取的奖励 */
    private BigInteger rewardsOwed = BigInteger.ZERO;

    public AccountPosition copy() {
        AccountPosition copy = new AccountPosition();
        copy.setStake(stake);
        copy.setRewardPerTokenPaid(rewardPerTokenPaid);
        copy.setRewardsOwed(rewardsOwed);
        return copy;
    }
}
