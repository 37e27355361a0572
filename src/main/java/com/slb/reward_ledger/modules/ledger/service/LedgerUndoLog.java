package com.slb.reward_ledger.modules.ledger.service;

import com.slb.reward_ledger.modules.ledger.entity.AccountPosition;
import com.slb.reward_ledger.modules.ledger.entity.LedgerState;

import java.util.HashMap;
import java.util.Map;

/**
 * 单次修改操作的回滚日志：开启时保存全局状态副本，账户首次被修改前保存其原值。
 * 同一时刻最多只有一个打开的日志帧。
 */
class LedgerUndoLog {

    private LedgerState globals;
    private final Map<String, AccountPosition> accounts = new HashMap<>();

    void begin(LedgerState state) {
        if (globals != null) {
            throw new IllegalStateException("Ledger undo log is already open");
        }
        globals = state.copy();
    }

    boolean isOpen() {
        return globals != null;
    }

    /**
     * 在账户被修改前调用；original 为 null 表示该账户此前不存在。
     */
    void recordAccount(String account, AccountPosition original) {
        if (globals == null) {
            throw new IllegalStateException("Ledger undo log is not open");
        }
        if (!accounts.containsKey(account)) {
            accounts.put(account, original == null ? null : original.copy());
        }
    }

    void commit() {
        clear();
    }

    void rollback(LedgerState state, Map<String, AccountPosition> positions) {
        state.restoreFrom(globals);
        accounts.forEach((account, original) -> {
            if (original == null) {
                positions.remove(account);
            } else {
                positions.put(account, original);
            }
        });
        clear();
    }

    private void clear() {
        globals = null;
        accounts.clear();
    }
}
