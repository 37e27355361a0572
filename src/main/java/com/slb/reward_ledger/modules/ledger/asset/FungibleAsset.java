package com.slb.reward_ledger.modules.ledger.asset;

import java.math.BigInteger;

/**
 * 同质化资产接口。调用方身份显式传入（from / spender）。
 * 转账失败返回 false，由账本决定是否整体回滚。
 */
public interface FungibleAsset {

    /**
     * 从 from 账户向 to 账户转出 amount。
     */
    boolean transfer(String from, String to, BigInteger amount);

    /**
     * spender 在 from 授权额度内，把 amount 从 from 划转到 to。
     */
    boolean transferFrom(String spender, String from, String to, BigInteger amount);

    BigInteger balanceOf(String account);
}
