package com.slb.reward_ledger.modules.ledger.service;

import com.slb.reward_ledger.common.exception.BizException;
import com.slb.reward_ledger.common.exception.LedgerErrorType;
import com.slb.reward_ledger.modules.ledger.asset.FungibleAsset;
import com.slb.reward_ledger.modules.ledger.auth.LedgerAuthorizer;
import com.slb.reward_ledger.modules.ledger.clock.LedgerClock;
import com.slb.reward_ledger.modules.ledger.config.RewardLedgerProperties;
import com.slb.reward_ledger.modules.ledger.entity.AccountPosition;
import com.slb.reward_ledger.modules.ledger.entity.LedgerState;
import com.slb.reward_ledger.modules.ledger.vo.AccountRewardVo;
import com.slb.reward_ledger.modules.ledger.vo.LedgerSummaryVo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/**
 * 按时间加权的质押奖励账本。
 * <p>
 * 奖励按 rewardRate 在 [注资时刻, finishAt) 内线性发放，并按质押量分摊到每单位质押的累计值
 * rewardPerTokenStored 上；账户奖励 = 质押量 × (当前累计值 - 上次结算时的累计值)。
 * <p>
 * 所有对外修改操作遵循：先结算（全局 → 账户），再改账本状态，最后才调用资产转账。
 * 任一步失败则整体回滚，账本状态与调用前完全一致。转账回调中只允许只读查询。
 */
@Slf4j
@Service
public class RewardLedgerService {

    /** 累计值的定点放大倍数 */
    public static final BigInteger PRECISION = BigInteger.TEN.pow(18);

    private final FungibleAsset stakingAsset;
    private final FungibleAsset rewardAsset;
    private final LedgerAuthorizer authorizer;
    private final LedgerClock clock;
    private final String ledgerAddress;

    private final LedgerState state = new LedgerState();
    private final Map<String, AccountPosition> positions = new HashMap<>();
    private final LedgerUndoLog undoLog = new LedgerUndoLog();

    public RewardLedgerService(RewardLedgerProperties properties,
                               @Qualifier("stakingAsset") FungibleAsset stakingAsset,
                               @Qualifier("rewardAsset") FungibleAsset rewardAsset,
                               LedgerAuthorizer authorizer,
                               LedgerClock clock) {
        this.stakingAsset = stakingAsset;
        this.rewardAsset = rewardAsset;
        this.authorizer = authorizer;
        this.clock = clock;
        this.ledgerAddress = properties.getLedgerAddress();
        if (properties.getRewardsDuration() < 0) {
            throw new IllegalArgumentException("app.ledger.rewards-duration must not be negative");
        }
        this.state.setRewardsDuration(properties.getRewardsDuration());
    }

    /* ----------------------------------------------------------------------
     * 账户操作
     * ----------------------------------------------------------------------*/

    /**
     * 质押：账户需预先授权账本划转 amount 数量的质押资产。
     */
    public synchronized void stake(String account, BigInteger amount) {
        requireAccount(account);
        requirePositive(amount);
        atomically("stake", () -> {
            settle(currentTime(), account);
            AccountPosition position = writable(account);
            position.setStake(position.getStake().add(amount));
            state.setTotalStaked(state.getTotalStaked().add(amount));
            invokeTransfer("stake pull from " + account,
                    () -> stakingAsset.transferFrom(ledgerAddress, account, ledgerAddress, amount));
            return null;
        });
        log.debug("stake: account={} amount={} totalStaked={}", account, amount, state.getTotalStaked());
    }

    /**
     * 提取质押本金。
     */
    public synchronized void withdraw(String account, BigInteger amount) {
        requireAccount(account);
        requirePositive(amount);
        atomically("withdraw", () -> {
            BigInteger staked = stakeOf(account);
            if (amount.compareTo(staked) > 0) {
                throw new BizException(LedgerErrorType.INSUFFICIENT_BALANCE,
                        "Withdraw amount " + amount + " exceeds staked balance " + staked);
            }
            settle(currentTime(), account);
            AccountPosition position = writable(account);
            position.setStake(position.getStake().subtract(amount));
            state.setTotalStaked(state.getTotalStaked().subtract(amount));
            invokeTransfer("withdraw to " + account,
                    () -> stakingAsset.transfer(ledgerAddress, account, amount));
            return null;
        });
        log.debug("withdraw: account={} amount={} totalStaked={}", account, amount, state.getTotalStaked());
    }

    /**
     * 领取全部已累计奖励；没有可领取奖励时直接返回 0。
     *
     * @return 本次实际转出的奖励数量
     */
    public synchronized BigInteger claim(String account) {
        requireAccount(account);
        BigInteger reward = atomically("claim", () -> {
            settle(currentTime(), account);
            AccountPosition position = writable(account);
            BigInteger owed = position.getRewardsOwed();
            if (owed.signum() > 0) {
                position.setRewardsOwed(BigInteger.ZERO);
                invokeTransfer("reward payout to " + account,
                        () -> rewardAsset.transfer(ledgerAddress, account, owed));
            }
            return owed;
        });
        if (reward.signum() > 0) {
            log.debug("claim: account={} reward={}", account, reward);
        }
        return reward;
    }

    /**
     * 退出：取回全部质押，再领取奖励。两步各自原子，领取失败不影响已完成的取回。
     *
     * @return 本次领取的奖励数量
     */
    public synchronized BigInteger exit(String account) {
        requireAccount(account);
        BigInteger staked = stakeOf(account);
        if (staked.signum() == 0) {
            throw new BizException(LedgerErrorType.INVALID_AMOUNT, "Account " + account + " has nothing staked");
        }
        withdraw(account, staked);
        return claim(account);
    }

    /* ----------------------------------------------------------------------
     * 管理操作
     * ----------------------------------------------------------------------*/

    /**
     * 注资并开启新的发放周期。奖励资产须已转入账本账户。
     * 若上一周期尚未结束，剩余未发放部分并入新周期重新摊开。
     *
     * @return 新的 rewardRate
     */
    public synchronized BigInteger fundRewards(String caller, BigInteger amount) {
        authorizer.checkAdmin(caller);
        if (amount == null || amount.signum() < 0) {
            throw new BizException(LedgerErrorType.INVALID_AMOUNT, "Funding amount must not be negative");
        }
        return atomically("fundRewards", () -> {
            long now = currentTime();
            settle(now, null);

            long duration = state.getRewardsDuration();
            if (duration <= 0) {
                throw new BizException(LedgerErrorType.ZERO_RATE, "Rewards duration is not set");
            }
            BigInteger durationUnits = BigInteger.valueOf(duration);
            BigInteger rate;
            if (now >= state.getFinishAt()) {
                rate = amount.divide(durationUnits);
            } else {
                BigInteger remaining = BigInteger.valueOf(state.getFinishAt() - now).multiply(state.getRewardRate());
                rate = amount.add(remaining).divide(durationUnits);
            }
            if (rate.signum() == 0) {
                throw new BizException(LedgerErrorType.ZERO_RATE,
                        "Funding " + amount + " over " + duration + "s yields a zero reward rate");
            }

            BigInteger committed = rate.multiply(durationUnits);
            BigInteger held = rewardAsset.balanceOf(ledgerAddress);
            if (committed.compareTo(held) > 0) {
                throw new BizException(LedgerErrorType.INSUFFICIENT_FUNDING,
                        "Committed payout " + committed + " exceeds reward balance " + held);
            }

            state.setRewardRate(rate);
            state.setFinishAt(windowEnd(now, duration));
            state.setLastUpdateTime(now);
            log.info("fundRewards: amount={} rewardRate={} finishAt={} held={}", amount, rate, state.getFinishAt(), held);
            return rate;
        });
    }

    /**
     * 修改发放周期，仅在当前周期结束后允许。
     */
    public synchronized void setRewardsDuration(String caller, long duration) {
        authorizer.checkAdmin(caller);
        requireNotReentrant("setRewardsDuration");
        if (duration < 0) {
            throw new BizException(LedgerErrorType.INVALID_AMOUNT, "Rewards duration must not be negative");
        }
        long now = currentTime();
        if (now < state.getFinishAt()) {
            throw new BizException(LedgerErrorType.WINDOW_ACTIVE,
                    "Reward window is active until " + state.getFinishAt() + ", now " + now);
        }
        windowEnd(now, duration);
        state.setRewardsDuration(duration);
        log.info("setRewardsDuration: duration={}", duration);
    }

    /* ----------------------------------------------------------------------
     * 只读查询
     * ----------------------------------------------------------------------*/

    public synchronized long lastApplicableTime() {
        return lastApplicableTime(currentTime());
    }

    public synchronized BigInteger rewardPerToken() {
        return rewardPerTokenAt(currentTime());
    }

    public synchronized BigInteger earned(String account) {
        return earnedAt(readable(account), rewardPerToken());
    }

    public synchronized BigInteger rewardForDuration() {
        return state.getRewardRate().multiply(BigInteger.valueOf(state.getRewardsDuration()));
    }

    public synchronized BigInteger totalStaked() {
        return state.getTotalStaked();
    }

    public synchronized BigInteger stakeOf(String account) {
        return readable(account).getStake();
    }

    public synchronized BigInteger rewardPerTokenPaid(String account) {
        return readable(account).getRewardPerTokenPaid();
    }

    public synchronized BigInteger rewardsOwed(String account) {
        return readable(account).getRewardsOwed();
    }

    public synchronized BigInteger rewardPerTokenStored() {
        return state.getRewardPerTokenStored();
    }

    public synchronized BigInteger rewardRate() {
        return state.getRewardRate();
    }

    public synchronized long rewardsDuration() {
        return state.getRewardsDuration();
    }

    public synchronized long finishAt() {
        return state.getFinishAt();
    }

    public synchronized long lastUpdateTime() {
        return state.getLastUpdateTime();
    }

    public synchronized LedgerSummaryVo summary() {
        long now = currentTime();
        return LedgerSummaryVo.builder()
                .totalStaked(state.getTotalStaked())
                .rewardRate(state.getRewardRate())
                .rewardsDuration(state.getRewardsDuration())
                .finishAt(state.getFinishAt())
                .lastUpdateTime(state.getLastUpdateTime())
                .rewardPerTokenStored(state.getRewardPerTokenStored())
                .rewardPerToken(rewardPerTokenAt(now))
                .rewardForDuration(rewardForDuration())
                .windowActive(now < state.getFinishAt())
                .observedAt(now)
                .build();
    }

    public synchronized AccountRewardVo accountView(String account) {
        AccountPosition position = readable(account);
        return AccountRewardVo.builder()
                .account(account)
                .stake(position.getStake())
                .earned(earnedAt(position, rewardPerToken()))
                .rewardsOwed(position.getRewardsOwed())
                .rewardPerTokenPaid(position.getRewardPerTokenPaid())
                .build();
    }

    /* ----------------------------------------------------------------------
     * 结算
     * ----------------------------------------------------------------------*/

    /**
     * 先把经过的时间折入全局累计值，再（可选）把累计值增量折入账户待领奖励。
     */
    private void settle(long now, String account) {
        settleGlobal(now);
        if (account != null) {
            settleAccount(account);
        }
    }

    private void settleGlobal(long now) {
        state.setRewardPerTokenStored(rewardPerTokenAt(now));
        state.setLastUpdateTime(Math.max(state.getLastUpdateTime(), lastApplicableTime(now)));
    }

    private void settleAccount(String account) {
        AccountPosition position = writable(account);
        BigInteger stored = state.getRewardPerTokenStored();
        position.setRewardsOwed(earnedAt(position, stored));
        position.setRewardPerTokenPaid(stored);
    }

    /**
     * 账本视角的当前时间：系统时钟回拨时不早于上次结算时间，已结算的区间不会被重复计入。
     */
    private long currentTime() {
        return Math.max(clock.currentTime(), state.getLastUpdateTime());
    }

    private static long windowEnd(long now, long duration) {
        try {
            return Math.addExact(now, duration);
        } catch (ArithmeticException e) {
            throw new BizException(LedgerErrorType.INVALID_AMOUNT,
                    "Rewards duration " + duration + " overflows the window end at " + now, e);
        }
    }

    private long lastApplicableTime(long now) {
        return Math.min(now, state.getFinishAt());
    }

    // 无人质押期间累计值冻结，这段时间的发放不再分配给任何人
    private BigInteger rewardPerTokenAt(long now) {
        BigInteger stored = state.getRewardPerTokenStored();
        if (state.getTotalStaked().signum() == 0) {
            return stored;
        }
        long elapsed = lastApplicableTime(now) - state.getLastUpdateTime();
        if (elapsed <= 0) {
            return stored;
        }
        return stored.add(BigInteger.valueOf(elapsed)
                .multiply(state.getRewardRate())
                .multiply(PRECISION)
                .divide(state.getTotalStaked()));
    }

    private BigInteger earnedAt(AccountPosition position, BigInteger rewardPerToken) {
        BigInteger delta = rewardPerToken.subtract(position.getRewardPerTokenPaid());
        return position.getRewardsOwed().add(position.getStake().multiply(delta).divide(PRECISION));
    }

    /* ----------------------------------------------------------------------
     * 内部工具
     * ----------------------------------------------------------------------*/

    /**
     * 在回滚日志中执行一次修改操作。转账回调中再次进入修改操作会被拒绝：
     * 外部转账无法随账本一起回滚。
     */
    private <T> T atomically(String operation, Supplier<T> body) {
        requireNotReentrant(operation);
        undoLog.begin(state);
        try {
            T result = body.get();
            undoLog.commit();
            return result;
        } catch (RuntimeException | Error e) {
            undoLog.rollback(state, positions);
            if (e instanceof BizException biz) {
                log.warn("{} rolled back: code={} display={} detail={}", operation, biz.getCode(),
                        biz.getErrorType().getDisplayMessage(), biz.getMessage());
            } else {
                log.warn("{} rolled back: {}", operation, e.getMessage());
            }
            throw e;
        }
    }

    private void requireNotReentrant(String operation) {
        if (undoLog.isOpen()) {
            throw new BizException(LedgerErrorType.REENTRANT_CALL,
                    operation + " called while another ledger operation is in progress");
        }
    }

    private AccountPosition readable(String account) {
        AccountPosition position = positions.get(account);
        return position != null ? position : new AccountPosition();
    }

    private AccountPosition writable(String account) {
        AccountPosition position = positions.get(account);
        undoLog.recordAccount(account, position);
        if (position == null) {
            position = new AccountPosition();
            positions.put(account, position);
        }
        return position;
    }

    private void invokeTransfer(String description, BooleanSupplier transfer) {
        boolean succeeded;
        try {
            succeeded = transfer.getAsBoolean();
        } catch (BizException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new BizException(LedgerErrorType.TRANSFER_FAILED, "Transfer failed: " + description, e);
        }
        if (!succeeded) {
            throw new BizException(LedgerErrorType.TRANSFER_FAILED, "Transfer rejected: " + description);
        }
    }

    private static void requireAccount(String account) {
        if (account == null || account.isBlank()) {
            throw new IllegalArgumentException("account must not be blank");
        }
    }

    private static void requirePositive(BigInteger amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new BizException(LedgerErrorType.INVALID_AMOUNT, "Amount must be greater than zero, got " + amount);
        }
    }
}
