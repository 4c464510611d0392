package com.learn.pairexchange.assets;

import com.learn.pairexchange.enums.UserType;
import com.learn.pairexchange.support.LoggerSupport;
import com.learn.pairexchange.util.UnsignedMath;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

@Component
public class AssetService extends LoggerSupport {
    // AccountId -> Map(AssetId -> Asset(available/frozen))
    final ConcurrentMap<String, ConcurrentMap<String, Asset>> userAssets = new ConcurrentHashMap<>();

    public Asset getAsset(String accountId, String assetId) {
        ConcurrentMap<String, Asset> assets = userAssets.get(accountId);
        if(assets == null)
            return null;
        return assets.get(assetId);
    }

    public Map<String, Asset> getAssets(String accountId) {
        Map<String, Asset> assets = userAssets.get(accountId);
        if(assets == null)
            return Map.of();
        return assets;
    }

    public ConcurrentMap<String, ConcurrentMap<String, Asset>> getUserAssets() {
        return this.userAssets;
    }

    // 从 DEBT 账户充值, 不检查余额
    public Asset deposit(String accountId, String assetId, BigInteger amount) {
        tryTransfer(Transfer.AVAILABLE_TO_AVAILABLE, UserType.DEBT.getInternalAccountId(), accountId,
                assetId, amount, false);
        logger.info("deposit {} {} to {}", amount, assetId, accountId);
        return getAsset(accountId, assetId);
    }

    // 下单方可用资产转入托管账户冻结
    public boolean tryLock(String caller, String custodyAccount, String assetId, long amount) {
        boolean ok = tryTransfer(Transfer.AVAILABLE_TO_FROZEN, caller, custodyAccount, assetId,
                UnsignedMath.toBigInteger(amount), true);
        if(ok && logger.isDebugEnabled())
            logger.debug("lock {} {} from {} into {}", UnsignedMath.toString(amount), assetId, caller, custodyAccount);
        return ok;
    }

    // 托管账户冻结资产交割给受益人
    public void deliver(String custodyAccount, String beneficiary, String assetId, long amount) {
        transfer(Transfer.FROZEN_TO_AVAILABLE, custodyAccount, beneficiary, assetId, UnsignedMath.toBigInteger(amount));
    }

    // 撤销 tryLock
    public void refund(String custodyAccount, String caller, String assetId, long amount) {
        transfer(Transfer.FROZEN_TO_AVAILABLE, custodyAccount, caller, assetId, UnsignedMath.toBigInteger(amount));
    }

    public void transfer(Transfer type, String fromAccount, String toAccount, String assetId, BigInteger amount) {
        if(!tryTransfer(type, fromAccount, toAccount, assetId, amount, true))
            throw new RuntimeException("Transfer failed for type: " + type +
                    ", from account " + fromAccount + ", to account " + toAccount +
                    ", asset = " + assetId + ", amount = " + amount);
        if(logger.isDebugEnabled())
            logger.debug("transfer asset {} from {} ==> {}, amount={}", assetId, fromAccount, toAccount, amount);
    }

    // 余额检查与修改须原子完成, 不同交易对的提交和充值会并发调用
    public synchronized boolean tryTransfer(Transfer type, String fromAccount, String toAccount, String assetId,
                               BigInteger amount, boolean checkBalance) {
        if(amount.signum() == 0)
            return true;
        if(amount.signum() < 0)
            throw new IllegalArgumentException("Negative amount.");
        Asset fromAsset = getAsset(fromAccount, assetId);
        if(fromAsset == null)
            fromAsset = initAsset(fromAccount, assetId);
        Asset toAsset = getAsset(toAccount, assetId);
        if(toAsset == null)
            toAsset = initAsset(toAccount, assetId);
        return switch (type) {
            case AVAILABLE_TO_AVAILABLE -> {
                if(checkBalance && fromAsset.available.compareTo(amount) < 0)
                    yield false;
                fromAsset.available = fromAsset.available.subtract(amount);
                toAsset.available = toAsset.available.add(amount);
                yield true;
            }
            case AVAILABLE_TO_FROZEN -> {
                if(checkBalance && fromAsset.available.compareTo(amount) < 0)
                    yield false;
                fromAsset.available = fromAsset.available.subtract(amount);
                toAsset.frozen = toAsset.frozen.add(amount);
                yield true;
            }
            case FROZEN_TO_AVAILABLE -> {
                if(checkBalance && fromAsset.frozen.compareTo(amount) < 0)
                    yield false;
                fromAsset.frozen = fromAsset.frozen.subtract(amount);
                toAsset.available = toAsset.available.add(amount);
                yield true;
            }
        };
    }

    private Asset initAsset(String accountId, String assetId) {
        ConcurrentMap<String, Asset> map = userAssets.computeIfAbsent(accountId,
                k -> new ConcurrentHashMap<>());
        return map.computeIfAbsent(assetId, k -> new Asset());
    }
}
