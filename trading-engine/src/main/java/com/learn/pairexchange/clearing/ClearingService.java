package com.learn.pairexchange.clearing;

import com.learn.pairexchange.assets.Asset;
import com.learn.pairexchange.assets.AssetService;
import com.learn.pairexchange.match.MatchDetailRecord;
import com.learn.pairexchange.match.MatchResult;
import com.learn.pairexchange.match.PairBook;
import com.learn.pairexchange.support.LoggerSupport;
import com.learn.pairexchange.util.UnsignedMath;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.math.BigInteger;

@Component
public class ClearingService extends LoggerSupport {

    final AssetService assetService;

    public ClearingService(@Autowired AssetService assetService) {
        this.assetService = assetService;
    }

    public void clearMatchResult(PairBook book, MatchResult result) {
        if(result.matchDetails.isEmpty())
            return;
        // 交割前先核对托管余额, 保证要么全部交割要么都不交割
        BigInteger totalBase = BigInteger.ZERO;
        BigInteger totalQuote = BigInteger.ZERO;
        for(MatchDetailRecord detail : result.matchDetails) {
            totalBase = totalBase.add(UnsignedMath.toBigInteger(detail.baseQuantity()));
            totalQuote = totalQuote.add(UnsignedMath.toBigInteger(detail.quoteQuantity()));
        }
        requireCustody(book.custodyAccount, book.baseAsset, totalBase);
        requireCustody(book.custodyAccount, book.quoteAsset, totalQuote);

        for(MatchDetailRecord detail : result.matchDetails) {
            if(logger.isDebugEnabled()) {
                logger.debug("clear matched detail: pair = {}, price = {}, base = {}, quote = {}, bidOrderId = {}, askOrderId = {}",
                        book.pairId, UnsignedMath.toString(detail.price()),
                        UnsignedMath.toString(detail.baseQuantity()), UnsignedMath.toString(detail.quoteQuantity()),
                        detail.bidOffer().orderId(), detail.askOffer().orderId());
            }
            // 卖单受益人收到 A
            assetService.deliver(book.custodyAccount, detail.askOffer().beneficiary(), book.baseAsset,
                    detail.baseQuantity());
            // 买单受益人收到 B
            assetService.deliver(book.custodyAccount, detail.bidOffer().beneficiary(), book.quoteAsset,
                    detail.quoteQuantity());
        }
    }

    private void requireCustody(String custodyAccount, String assetId, BigInteger amount) {
        Asset custody = assetService.getAsset(custodyAccount, assetId);
        BigInteger frozen = custody == null ? BigInteger.ZERO : custody.getFrozen();
        if(frozen.compareTo(amount) < 0)
            throw new IllegalStateException("Custody " + custodyAccount + " holds " + frozen + " " + assetId +
                    " but " + amount + " must be delivered.");
    }
}
