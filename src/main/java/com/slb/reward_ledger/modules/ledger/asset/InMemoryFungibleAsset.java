package com.slb.reward_ledger.modules.ledger.asset;

import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;

/**
 * 内存版同质化资产：余额 + 授权额度。
 * 余额或额度不足时返回 false，不抛异常。
 */
@Slf4j
public class InMemoryFungibleAsset implements FungibleAsset {

    private final String symbol;
    private final Map<String, BigInteger> balances = new HashMap<>();
    // owner -> (spender -> allowance)
    private final Map<String, Map<String, BigInteger>> allowances = new HashMap<>();
    private BigInteger totalSupply = BigInteger.ZERO;

    public InMemoryFungibleAsset(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    public synchronized void mint(String to, BigInteger amount) {
        if (to == null || amount == null || amount.signum() < 0) {
            throw new IllegalArgumentException("mint requires a recipient and a non-negative amount");
        }
        balances.merge(to, amount, BigInteger::add);
        totalSupply = totalSupply.add(amount);
    }

    public synchronized void approve(String owner, String spender, BigInteger amount) {
        if (owner == null || spender == null || amount == null || amount.signum() < 0) {
            throw new IllegalArgumentException("approve requires owner, spender and a non-negative amount");
        }
        allowances.computeIfAbsent(owner, k -> new HashMap<>()).put(spender, amount);
    }

    public synchronized BigInteger allowance(String owner, String spender) {
        Map<String, BigInteger> granted = allowances.get(owner);
        if (granted == null) {
            return BigInteger.ZERO;
        }
        return granted.getOrDefault(spender, BigInteger.ZERO);
    }

    public synchronized BigInteger totalSupply() {
        return totalSupply;
    }

    @Override
    public synchronized boolean transfer(String from, String to, BigInteger amount) {
        if (!isValid(from, to, amount)) {
            return false;
        }
        BigInteger balance = balanceOf(from);
        if (balance.compareTo(amount) < 0) {
            log.debug("[{}] transfer rejected: from={} balance={} amount={}", symbol, from, balance, amount);
            return false;
        }
        move(from, to, amount);
        return true;
    }

    @Override
    public synchronized boolean transferFrom(String spender, String from, String to, BigInteger amount) {
        if (spender == null || !isValid(from, to, amount)) {
            return false;
        }
        BigInteger allowed = allowance(from, spender);
        if (allowed.compareTo(amount) < 0) {
            log.debug("[{}] transferFrom rejected: owner={} spender={} allowance={} amount={}",
                    symbol, from, spender, allowed, amount);
            return false;
        }
        BigInteger balance = balanceOf(from);
        if (balance.compareTo(amount) < 0) {
            log.debug("[{}] transferFrom rejected: owner={} balance={} amount={}", symbol, from, balance, amount);
            return false;
        }
        allowances.get(from).put(spender, allowed.subtract(amount));
        move(from, to, amount);
        return true;
    }

    @Override
    public synchronized BigInteger balanceOf(String account) {
        return balances.getOrDefault(account, BigInteger.ZERO);
    }

    private boolean isValid(String from, String to, BigInteger amount) {
        return from != null && to != null && amount != null && amount.signum() >= 0;
    }

    private void move(String from, String to, BigInteger amount) {
        balances.put(from, balanceOf(from).subtract(amount));
        balances.merge(to, amount, BigInteger::add);
    }
}
