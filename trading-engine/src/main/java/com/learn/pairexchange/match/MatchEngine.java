package com.learn.pairexchange.match;

import com.learn.pairexchange.ApiError;
import com.learn.pairexchange.ApiException;
import com.learn.pairexchange.enums.Direction;
import com.learn.pairexchange.support.LoggerSupport;
import com.learn.pairexchange.util.UnsignedMath;
import org.springframework.stereotype.Component;

@Component
public class MatchEngine extends LoggerSupport {

    public MatchResult submitBid(PairBook book, long price, String beneficiary, long quantity) {
        return processOrder(book, Direction.BID, price, beneficiary, quantity);
    }

    public MatchResult submitAsk(PairBook book, long price, String beneficiary, long quantity) {
        return processOrder(book, Direction.ASK, price, beneficiary, quantity);
    }

    // 挂单后撮合; 任何异常都会把订单簿恢复到调用前的状态
    MatchResult processOrder(PairBook book, Direction direction, long price, String beneficiary, long quantity) {
        if(quantity == 0)
            throw new ApiException(ApiError.ZERO_QUANTITY, "quantity", "quantity must be positive.");
        if(direction == Direction.ASK && price == 0)
            throw new ApiException(ApiError.ZERO_PRICE, "price", "ask price must be positive.");
        PairBook.UndoLog undo = book.beginUndo();
        try {
            Offer offer = new Offer(book.nextOrderId(), beneficiary, quantity);
            switch (direction) {
                case BID -> {
                    book.basePool.lock(quantity);
                    undo.insert(book.bids, price, offer);
                }
                case ASK -> {
                    book.quotePool.lock(quantity);
                    undo.insert(book.asks, price, offer);
                }
                default -> throw new IllegalArgumentException("Invalid direction.");
            }
            if(logger.isDebugEnabled())
                logger.debug("pair {}: new {} at {}: {}", book.pairId, direction, UnsignedMath.toString(price), offer);
            MatchResult result = new MatchResult(book.pairId, direction, price, offer);
            match(book, undo, result);
            return result;
        } catch (ArithmeticException e) {
            book.rollback(undo);
            throw new ApiException(ApiError.ARITHMETIC_OVERFLOW, null, e.getMessage(), e);
        } catch (RuntimeException e) {
            book.rollback(undo);
            throw e;
        }
    }

    private void match(PairBook book, PairBook.UndoLog undo, MatchResult result) {
        while(!book.bids.isEmpty() && !book.asks.isEmpty()) {
            HeapEntry<Offer> ask = undo.extractMax(book.asks);
            HeapEntry<Offer> bid = undo.extractMax(book.bids);
            long askPrice = ask.priority();
            if(UnsignedMath.compare(bid.priority(), askPrice) < 0) {
                // 最高买价低于最低卖价, 不会再有成交
                undo.insert(book.asks, ask);
                undo.insert(book.bids, bid);
                break;
            }
            Offer bidOffer = bid.payload();
            Offer askOffer = ask.payload();
            // 以卖单挂单价成交, 买单的 A 数量折算为 B
            long bidValue = UnsignedMath.multiplyExact(bidOffer.quantity(), askPrice);
            long matchedQuote = UnsignedMath.min(bidValue, askOffer.quantity());
            long matchedBase = UnsignedMath.divide(matchedQuote, askPrice);
            long dust = UnsignedMath.subtractExact(matchedQuote, matchedBase * askPrice);

            book.basePool.release(matchedBase);
            book.quotePool.release(matchedQuote);
            book.addDust(dust);
            result.add(askPrice, matchedBase, matchedQuote, dust, bidOffer, askOffer);
            if(logger.isDebugEnabled()) {
                logger.debug("pair {}: matched price = {}, base = {}, quote = {}, dust = {}, bid = {}, ask = {}",
                        book.pairId, UnsignedMath.toString(askPrice), UnsignedMath.toString(matchedBase),
                        UnsignedMath.toString(matchedQuote), UnsignedMath.toString(dust), bidOffer, askOffer);
            }

            long bidUnfilled = UnsignedMath.subtractExact(bidOffer.quantity(), matchedBase);
            long askUnfilled = UnsignedMath.subtractExact(askOffer.quantity(), matchedQuote);
            // 数量为 0 的挂单直接丢弃
            if(bidUnfilled != 0)
                undo.insert(book.bids, bid.withPayload(bidOffer.withQuantity(bidUnfilled)));
            if(askUnfilled != 0)
                undo.insert(book.asks, ask.withPayload(askOffer.withQuantity(askUnfilled)));
        }
    }
}
