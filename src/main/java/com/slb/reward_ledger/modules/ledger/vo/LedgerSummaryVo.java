package com.slb.reward_ledger.modules.ledger.vo;

import lombok.Builder;
import lombok.Data;

import java.math.BigInteger;

/**
 * 账本全局概览。
 */
@Data
@Builder
public class LedgerSummaryVo {
    private BigInteger totalStaked;
    private BigInteger rewardRate;
    private long rewardsDuration;
    private long finishAt;
    private long lastUpdateTime;
    /** 已结算的累计值 */
    private BigInteger rewardPerTokenStored;
    /** 按当前时间推算的累计值 */
    private BigInteger rewardPerToken;
    /** 一个完整周期按当前速率的发放量 */
    private BigInteger rewardForDuration;
    private boolean windowActive;
    private long observedAt;
}
