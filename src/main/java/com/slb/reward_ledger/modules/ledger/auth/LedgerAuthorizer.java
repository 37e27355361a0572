package com.slb.reward_ledger.modules.ledger.auth;

/**
 * 管理操作（注资、修改发放周期）的鉴权协作方。
 */
public interface LedgerAuthorizer {

    /**
     * 校验调用方是否为管理员，否则抛出 NOT_AUTHORIZED。
     */
    void checkAdmin(String caller);
}
