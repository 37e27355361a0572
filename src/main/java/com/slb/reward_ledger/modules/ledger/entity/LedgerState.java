package com.slb.reward_ledger.modules.ledger.entity;

import lombok.Data;

import java.io.Serializable;
import java.math.BigInteger;

/**
 * 账本全局状态，仅由 RewardLedgerService 修改。
 * 初始时所有计数为 0，finishAt = 0。
 */
@Data
public class LedgerState implements Serializable {
    private static final long serialVersionUID = 1L;

    /** 全部账户质押量之和 */
    private BigInteger totalStaked = BigInteger.ZERO;
    /** 每单位质押累计奖励（按 PRECISION 放大），截至 lastUpdateTime，单调不减 */
    private BigInteger rewardPerTokenStored = BigInteger.ZERO;
    /** 每秒发放的奖励数量；finishAt 之后视为 0 */
    private BigInteger rewardRate = BigInteger.ZERO;
    /** 当前/下一个发放周期长度（秒） */
    private long rewardsDuration;
    /** 当前发放周期结束时间 */
    private long finishAt;
    /** 上次全局结算时间 */
    private long lastUpdateTime;

    public LedgerState copy() {
        LedgerState copy = new LedgerState();
        copy.setTotalStaked(totalStaked);
        copy.setRewardPerTokenStored(rewardPerTokenStored);
        copy.setRewardRate(rewardRate);
        copy.setRewardsDuration(rewardsDuration);
        copy.setFinishAt(finishAt);
        copy.setLastUpdateTime(lastUpdateTime);
        return copy;
    }

    public void restoreFrom(LedgerState other) {
        this.totalStaked = other.totalStaked;
        this.rewardPerTokenStored = other.rewardPerTokenStored;
        this.rewardRate = other.rewardRate;
        this.rewardsDuration = other.rewardsDuration;
        this.finishAt = other.finishAt;
        this.lastUpdateTime = other.lastUpdateTime;
    }
}
