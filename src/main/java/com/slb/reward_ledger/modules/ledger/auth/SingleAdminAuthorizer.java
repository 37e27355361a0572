package com.slb.reward_ledger.modules.ledger.auth;

import com.slb.reward_ledger.common.exception.BizException;
import com.slb.reward_ledger.common.exception.LedgerErrorType;
import com.slb.reward_ledger.modules.ledger.config.RewardLedgerProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

@Slf4j
@Component
public class SingleAdminAuthorizer implements LedgerAuthorizer {

    private final RewardLedgerProperties properties;

    public SingleAdminAuthorizer(RewardLedgerProperties properties) {
        this.properties = properties;
    }

    @Override
    public void checkAdmin(String caller) {
        String admin = properties.getAdmin();
        if (!StringUtils.hasText(admin)) {
            // 未配置管理员时拒绝一切管理操作
            log.warn("app.ledger.admin 未配置，拒绝管理操作: caller={}", caller);
            throw new BizException(LedgerErrorType.NOT_AUTHORIZED, "Ledger administrator is not configured");
        }
        if (!admin.equals(caller)) {
            throw new BizException(LedgerErrorType.NOT_AUTHORIZED, "Caller " + caller + " is not the ledger administrator");
        }
    }
}
