package com.slb.reward_ledger.modules.ledger.service;

import com.slb.reward_ledger.common.exception.BizException;
import com.slb.reward_ledger.common.exception.LedgerErrorType;
import com.slb.reward_ledger.modules.ledger.asset.FungibleAsset;
import com.slb.reward_ledger.modules.ledger.asset.InMemoryFungibleAsset;
import com.slb.reward_ledger.modules.ledger.auth.LedgerAuthorizer;
import com.slb.reward_ledger.modules.ledger.clock.ManualLedgerClock;
import com.slb.reward_ledger.modules.ledger.config.RewardLedgerProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RewardLedgerAtomicityTest {

    private static final String ADMIN = "admin";
    private static final String LEDGER = "reward-ledger";
    private static final String ALICE = "alice";
    private static final String BOB = "bob";

    @Mock
    private FungibleAsset rewardAsset;
    @Mock
    private LedgerAuthorizer authorizer;
    @Mock
    private FungibleAsset custodyAsset;

    private RewardLedgerProperties properties;
    private ManualLedgerClock clock;

    @BeforeEach
    void setup() {
        properties = new RewardLedgerProperties();
        properties.setAdmin(ADMIN);
        properties.setLedgerAddress(LEDGER);
        properties.setRewardsDuration(100);
        clock = new ManualLedgerClock(0);
    }

    @Test
    void failedStakePullLeavesAccumulatorAndBalancesUntouched() {
        InMemoryFungibleAsset stakingAsset = new InMemoryFungibleAsset("STK");
        InMemoryFungibleAsset rewards = new InMemoryFungibleAsset("RWD");
        RewardLedgerService ledger = new RewardLedgerService(properties, stakingAsset, rewards, authorizer, clock);

        rewards.mint(LEDGER, bi(1000));
        ledger.fundRewards(ADMIN, bi(1000));
        stakingAsset.mint(ALICE, bi(100));
        stakingAsset.approve(ALICE, LEDGER, bi(100));
        ledger.stake(ALICE, bi(100));

        clock.setTime(30);
        // bob 未授权
        stakingAsset.mint(BOB, bi(50));
        BizException ex = assertThrows(BizException.class, () -> ledger.stake(BOB, bi(50)));

        assertEquals(LedgerErrorType.TRANSFER_FAILED, ex.getErrorType());
        assertEquals(BigInteger.ZERO, ledger.stakeOf(BOB));
        assertEquals(BigInteger.ZERO, ledger.rewardPerTokenPaid(BOB));
        assertEquals(bi(100), ledger.totalStaked());
        assertEquals(BigInteger.ZERO, ledger.rewardPerTokenStored());
        assertEquals(0L, ledger.lastUpdateTime());
        assertEquals(bi(300), ledger.earned(ALICE));
        assertEquals(bi(50), stakingAsset.balanceOf(BOB));
    }

    @Test
    void rejectedRewardTransferRestoresOwedReward() {
        when(rewardAsset.balanceOf(LEDGER)).thenReturn(bi(1_000_000));
        RewardLedgerService ledger = ledgerWithMockedRewards();
        ledger.fundRewards(ADMIN, bi(1000));
        stakeFor(ledger, ALICE, 100);

        clock.setTime(50);
        when(rewardAsset.transfer(LEDGER, ALICE, bi(500))).thenReturn(false);
        BizException ex = assertThrows(BizException.class, () -> ledger.claim(ALICE));

        assertEquals(LedgerErrorType.TRANSFER_FAILED, ex.getErrorType());
        assertEquals(BigInteger.ZERO, ledger.rewardsOwed(ALICE));
        assertEquals(BigInteger.ZERO, ledger.rewardPerTokenPaid(ALICE));
        assertEquals(bi(500), ledger.earned(ALICE));

        when(rewardAsset.transfer(LEDGER, ALICE, bi(500))).thenReturn(true);
        assertEquals(bi(500), ledger.claim(ALICE));
        assertEquals(BigInteger.ZERO, ledger.earned(ALICE));
    }

    @Test
    void assetExceptionIsWrappedAsTransferFailed() {
        when(rewardAsset.balanceOf(LEDGER)).thenReturn(bi(1_000_000));
        RewardLedgerService ledger = ledgerWithMockedRewards();
        ledger.fundRewards(ADMIN, bi(1000));
        stakeFor(ledger, ALICE, 100);

        clock.setTime(10);
        IllegalStateException cause = new IllegalStateException("asset node unavailable");
        when(rewardAsset.transfer(any(), any(), any())).thenThrow(cause);

        BizException ex = assertThrows(BizException.class, () -> ledger.claim(ALICE));
        assertEquals(LedgerErrorType.TRANSFER_FAILED, ex.getErrorType());
        assertThat(ex.getCause()).isSameAs(cause);
        assertEquals(bi(100), ledger.earned(ALICE));
    }

    @Test
    void rejectedWithdrawTransferRestoresStakeAndAccumulator() {
        RewardLedgerService ledger = ledgerWithMockedCustody();
        when(custodyAsset.transfer(LEDGER, ALICE, bi(60))).thenReturn(false);

        clock.setTime(40);
        BizException ex = assertThrows(BizException.class, () -> ledger.withdraw(ALICE, bi(60)));

        assertEquals(LedgerErrorType.TRANSFER_FAILED, ex.getErrorType());
        assertStateBeforeWithdraw(ledger);
    }

    @Test
    void throwingWithdrawTransferIsWrappedAndRolledBack() {
        RewardLedgerService ledger = ledgerWithMockedCustody();
        IllegalStateException cause = new IllegalStateException("custody node unavailable");
        when(custodyAsset.transfer(LEDGER, ALICE, bi(60))).thenThrow(cause);

        clock.setTime(40);
        BizException ex = assertThrows(BizException.class, () -> ledger.withdraw(ALICE, bi(60)));

        assertEquals(LedgerErrorType.TRANSFER_FAILED, ex.getErrorType());
        assertThat(ex.getCause()).isSameAs(cause);
        assertStateBeforeWithdraw(ledger);
    }

    @Test
    void failedClaimDuringExitKeepsCompletedWithdraw() {
        when(rewardAsset.balanceOf(LEDGER)).thenReturn(bi(1_000_000));
        RewardLedgerService ledger = ledgerWithMockedRewards();
        ledger.fundRewards(ADMIN, bi(1000));
        InMemoryFungibleAsset stakingAsset = stakeFor(ledger, ALICE, 100);

        clock.setTime(100);
        when(rewardAsset.transfer(LEDGER, ALICE, bi(1000))).thenReturn(false);
        assertThrows(BizException.class, () -> ledger.exit(ALICE));

        assertEquals(BigInteger.ZERO, ledger.stakeOf(ALICE));
        assertEquals(bi(100), stakingAsset.balanceOf(ALICE));
        assertEquals(bi(1000), ledger.rewardsOwed(ALICE));
        assertEquals(bi(1000), ledger.earned(ALICE));
    }

    @Test
    void unauthorizedFundingNeverReadsRewardBalance() {
        RewardLedgerService ledger = ledgerWithMockedRewards();
        doThrow(new BizException(LedgerErrorType.NOT_AUTHORIZED)).when(authorizer).checkAdmin("mallory");

        BizException ex = assertThrows(BizException.class, () -> ledger.fundRewards("mallory", bi(1000)));
        assertEquals(LedgerErrorType.NOT_AUTHORIZED, ex.getErrorType());
        verify(rewardAsset, never()).balanceOf(any());
        assertEquals(BigInteger.ZERO, ledger.rewardRate());
    }

    @Test
    void reentrantWithdrawFromTransferCallbackIsRejectedAfterStateUpdate() {
        ReentrantStakingAsset stakingAsset = new ReentrantStakingAsset();
        InMemoryFungibleAsset rewards = new InMemoryFungibleAsset("RWD");
        RewardLedgerService ledger = new RewardLedgerService(properties, stakingAsset, rewards, authorizer, clock);
        stakingAsset.ledger = ledger;

        stakingAsset.mint(ALICE, bi(100));
        stakingAsset.approve(ALICE, LEDGER, bi(100));
        ledger.stake(ALICE, bi(100));

        ledger.withdraw(ALICE, bi(100));

        assertEquals(LedgerErrorType.REENTRANT_CALL, stakingAsset.observedError);
        // 转账回调时账本已完成扣减
        assertEquals(BigInteger.ZERO, stakingAsset.stakeSeenDuringTransfer);
        assertEquals(bi(100), stakingAsset.balanceOf(ALICE));
        assertEquals(BigInteger.ZERO, stakingAsset.balanceOf(LEDGER));
        assertEquals(BigInteger.ZERO, ledger.totalStaked());
    }

    @Test
    void rateIsNotChangedWhenFundingCheckFails() {
        when(rewardAsset.balanceOf(LEDGER)).thenReturn(bi(1000));
        RewardLedgerService ledger = ledgerWithMockedRewards();
        ledger.fundRewards(ADMIN, bi(1000));

        clock.setTime(40);
        // (500 + 60 * 10) / 100 = 11，承诺 1100 > 1000
        BizException ex = assertThrows(BizException.class, () -> ledger.fundRewards(ADMIN, bi(500)));
        assertEquals(LedgerErrorType.INSUFFICIENT_FUNDING, ex.getErrorType());
        assertEquals(bi(10), ledger.rewardRate());
        assertEquals(100L, ledger.finishAt());
        assertEquals(0L, ledger.lastUpdateTime());
        verify(authorizer, times(2)).checkAdmin(eq(ADMIN));
    }

    private RewardLedgerService ledgerWithMockedRewards() {
        return new RewardLedgerService(properties, new InMemoryFungibleAsset("STK"), rewardAsset, authorizer, clock);
    }

    private RewardLedgerService ledgerWithMockedCustody() {
        InMemoryFungibleAsset rewards = new InMemoryFungibleAsset("RWD");
        RewardLedgerService ledger = new RewardLedgerService(properties, custodyAsset, rewards, authorizer, clock);
        rewards.mint(LEDGER, bi(1000));
        ledger.fundRewards(ADMIN, bi(1000));
        when(custodyAsset.transferFrom(LEDGER, ALICE, LEDGER, bi(100))).thenReturn(true);
        ledger.stake(ALICE, bi(100));
        return ledger;
    }

    // 质押于 t=0，失败的提取发生在 t=40
    private void assertStateBeforeWithdraw(RewardLedgerService ledger) {
        assertEquals(bi(100), ledger.stakeOf(ALICE));
        assertEquals(bi(100), ledger.totalStaked());
        assertEquals(BigInteger.ZERO, ledger.rewardsOwed(ALICE));
        assertEquals(BigInteger.ZERO, ledger.rewardPerTokenPaid(ALICE));
        assertEquals(BigInteger.ZERO, ledger.rewardPerTokenStored());
        assertEquals(0L, ledger.lastUpdateTime());
        assertEquals(bi(400), ledger.earned(ALICE));
    }

    private InMemoryFungibleAsset stakeFor(RewardLedgerService ledger, String account, long amount) {
        InMemoryFungibleAsset stakingAsset = (InMemoryFungibleAsset) ReflectionTestUtils.getField(ledger, "stakingAsset");
        stakingAsset.mint(account, bi(amount));
        stakingAsset.approve(account, LEDGER, bi(amount));
        ledger.stake(account, bi(amount));
        return stakingAsset;
    }

    private static BigInteger bi(long value) {
        return BigInteger.valueOf(value);
    }

    /**
     * 在转出质押资产时尝试再次提取的恶意资产。
     */
    private static class ReentrantStakingAsset extends InMemoryFungibleAsset {
        private RewardLedgerService ledger;
        private LedgerErrorType observedError;
        private BigInteger stakeSeenDuringTransfer;

        ReentrantStakingAsset() {
            super("STK");
        }

        @Override
        public synchronized boolean transfer(String from, String to, BigInteger amount) {
            if (ledger != null && observedError == null) {
                stakeSeenDuringTransfer = ledger.stakeOf(to);
                try {
                    ledger.withdraw(to, amount);
                } catch (BizException e) {
                    observedError = e.getErrorType();
                }
            }
            return super.transfer(from, to, amount);
        }
    }
}
