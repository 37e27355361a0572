package com.slb.reward_ledger.modules.ledger.vo;

import lombok.Builder;
import lombok.Data;

import java.math.BigInteger;

@Data
@Builder
public class AccountRewardVo {
    private String account;
    private BigInteger stake;
    /** 截至当前可领取的奖励（含未结算部分） */
    private BigInteger earned;
    private BigInteger rewardsOwed;
    private BigInteger rewardPerTokenPaid;
}
