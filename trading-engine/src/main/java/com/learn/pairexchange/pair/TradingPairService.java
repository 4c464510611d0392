package com.learn.pairexchange.pair;

import com.learn.pairexchange.ApiError;
import com.learn.pairexchange.ApiException;
import com.learn.pairexchange.assets.Asset;
import com.learn.pairexchange.assets.AssetService;
import com.learn.pairexchange.clearing.ClearingService;
import com.learn.pairexchange.enums.Direction;
import com.learn.pairexchange.match.HeapEntry;
import com.learn.pairexchange.match.HeapView;
import com.learn.pairexchange.match.MatchEngine;
import com.learn.pairexchange.match.MatchResult;
import com.learn.pairexchange.match.Offer;
import com.learn.pairexchange.match.PairBook;
import com.learn.pairexchange.support.LoggerSupport;
import com.learn.pairexchange.util.UnsignedMath;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/**
 * Registry of trading pairs and the single entry point for mutating them.
 * <p>
 * Every submission holds the pair's monitor for its whole duration, so one pair has
 * at most one writer and readers never observe a book in the middle of matching.
 */
@Component
public class TradingPairService extends LoggerSupport {

    @Value("#{exchangeConfiguration.debugMode}")
    boolean debugMode = false;

    final AssetService assetService;
    final MatchEngine matchEngine;
    final ClearingService clearingService;

    // 账本与订单簿不一致时停止接收新订单
    volatile boolean fatalError = false;

    final ConcurrentMap<Long, PairBook> pairs = new ConcurrentHashMap<>();
    private final AtomicLong lastPairId = new AtomicLong();

    public TradingPairService(@Autowired AssetService assetService, @Autowired MatchEngine matchEngine,
                              @Autowired ClearingService clearingService) {
        this.assetService = assetService;
        this.matchEngine = matchEngine;
        this.clearingService = clearingService;
    }

    // 同一资产组合允许创建多个交易对, 由调用方自行选择
    public PairBook createPair(String baseAsset, String quoteAsset) {
        PairBook book = new PairBook(lastPairId.incrementAndGet(), baseAsset, quoteAsset);
        this.pairs.put(book.pairId, book);
        logger.info("created pair {}: {}/{}", book.pairId, baseAsset, quoteAsset);
        return book;
    }

    public PairBook getPair(long pairId) {
        PairBook book = this.pairs.get(pairId);
        if(book == null)
            throw new ApiException(ApiError.PAIR_NOT_FOUND, String.valueOf(pairId), "pair not found.");
        return book;
    }

    public List<PairBook> getPairs() {
        return this.pairs.values().stream()
                .sorted(Comparator.comparingLong(book -> book.pairId))
                .toList();
    }

    public List<PairBook> findPairs(String baseAsset, String quoteAsset) {
        return getPairs().stream()
                .filter(book -> baseAsset == null || book.baseAsset.equals(baseAsset))
                .filter(book -> quoteAsset == null || book.quoteAsset.equals(quoteAsset))
                .toList();
    }

    // 在交易对的锁内读取, 保证看到的是撮合完成后的状态
    public <R> R read(long pairId, Function<PairBook, R> reader) {
        PairBook book = getPair(pairId);
        synchronized (book) {
            return reader.apply(book);
        }
    }

    public MatchResult submitBid(long pairId, String caller, String beneficiary, long price, long quantity) {
        return submit(pairId, Direction.BID, caller, beneficiary, price, quantity);
    }

    public MatchResult submitAsk(long pairId, String caller, String beneficiary, long price, long quantity) {
        return submit(pairId, Direction.ASK, caller, beneficiary, price, quantity);
    }

    MatchResult submit(long pairId, Direction direction, String caller, String beneficiary,
                       long price, long quantity) {
        if(this.fatalError)
            throw new IllegalStateException("trading halted after fatal error.");
        PairBook book = getPair(pairId);
        synchronized (book) {
            String assetId = direction == Direction.BID ? book.baseAsset : book.quoteAsset;
            if(!assetService.tryLock(caller, book.custodyAccount, assetId, quantity)) {
                logger.warn("reject {} from {}: not enough {} to lock {}", direction, caller, assetId,
                        UnsignedMath.toString(quantity));
                throw new ApiException(ApiError.NO_ENOUGH_ASSET, assetId, "No enough available asset.");
            }
            MatchResult result;
            try {
                result = direction == Direction.BID
                        ? matchEngine.submitBid(book, price, beneficiary, quantity)
                        : matchEngine.submitAsk(book, price, beneficiary, quantity);
            } catch (RuntimeException e) {
                // 撮合失败时订单簿已回滚, 退回冻结的资产
                assetService.refund(book.custodyAccount, caller, assetId, quantity);
                logger.warn("reject {} on pair {}: {}", direction, pairId, e.getMessage());
                throw e;
            }
            try {
                clearingService.clearMatchResult(book, result);
            } catch (RuntimeException e) {
                logger.error("clear match result failed on pair " + pairId + ".", e);
                panic();
                throw e;
            }
            if(logger.isDebugEnabled())
                logger.debug("pair {} after {}: {}, {}", pairId, direction, result, book);
            if(debugMode)
                validate(book);
            return result;
        }
    }

    // 验证订单簿、托管池与账本的一致性
    public void validate(PairBook book) {
        synchronized (book) {
            long baseSum = sumQuantities(book.getBids());
            long quoteSum = sumQuantities(book.getAsks());
            require(baseSum == book.getBasePool(), "base pool " + UnsignedMath.toString(book.getBasePool()) +
                    " != sum of bids " + UnsignedMath.toString(baseSum));
            require(quoteSum == book.getQuotePool(), "quote pool " + UnsignedMath.toString(book.getQuotePool()) +
                    " != sum of asks " + UnsignedMath.toString(quoteSum));
            HeapEntry<Offer> bestBid = book.getBids().peek();
            HeapEntry<Offer> bestAsk = book.getAsks().peek();
            if(bestBid != null && bestAsk != null)
                require(Long.compareUnsigned(bestBid.priority(), bestAsk.priority()) < 0,
                        "crossing pair remains: bid " + UnsignedMath.toString(bestBid.priority()) +
                                " >= ask " + UnsignedMath.toString(bestAsk.priority()));
            require(frozen(book.custodyAccount, book.baseAsset)
                            .equals(UnsignedMath.toBigInteger(book.getBasePool())),
                    "custody frozen " + book.baseAsset + " does not match base pool");
            require(frozen(book.custodyAccount, book.quoteAsset)
                            .equals(UnsignedMath.toBigInteger(book.getQuotePool())),
                    "custody frozen " + book.quoteAsset + " does not match quote pool");
        }
    }

    private long sumQuantities(HeapView<Offer> side) {
        long sum = 0;
        for(int i = 0; i < side.size(); i++) {
            long quantity = side.peekAt(i).payload().quantity();
            require(quantity != 0, "resting offer with zero quantity: " + side.peekAt(i));
            sum = UnsignedMath.addExact(sum, quantity);
        }
        return sum;
    }

    private BigInteger frozen(String accountId, String assetId) {
        Asset asset = assetService.getAsset(accountId, assetId);
        return asset == null ? BigInteger.ZERO : asset.getFrozen();
    }

    private void panic() {
        logger.error("trading engine panic, reject all further orders.");
        this.fatalError = true;
    }

    void require(boolean condition, String errorMessage) {
        if(!condition) {
            logger.error("validated failed: {}", errorMessage);
            panic();
            throw new IllegalStateException(errorMessage);
        }
    }
}
