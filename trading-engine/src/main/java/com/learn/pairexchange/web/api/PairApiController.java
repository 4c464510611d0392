package com.learn.pairexchange.web.api;

import com.learn.pairexchange.ApiError;
import com.learn.pairexchange.ApiException;
import com.learn.pairexchange.bean.MatchResultBean;
import com.learn.pairexchange.bean.OfferBean;
import com.learn.pairexchange.bean.OrderRequestBean;
import com.learn.pairexchange.bean.PairBean;
import com.learn.pairexchange.bean.PairRequestBean;
import com.learn.pairexchange.bean.SimpleMatchDetailRecord;
import com.learn.pairexchange.match.HeapEntry;
import com.learn.pairexchange.match.HeapView;
import com.learn.pairexchange.match.MatchResult;
import com.learn.pairexchange.match.Offer;
import com.learn.pairexchange.match.PairBook;
import com.learn.pairexchange.pair.TradingPairService;
import com.learn.pairexchange.support.AbstractApiController;
import com.learn.pairexchange.util.UnsignedMath;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.List;

@RestController
@RequestMapping("/api")
public class PairApiController extends AbstractApiController {

    @Value("#{exchangeConfiguration.orderBookDepth}")
    int orderBookDepth = 100;

    @Autowired
    TradingPairService tradingPairService;

    @PostMapping("/pairs")
    public PairBean createPair(@RequestBody PairRequestBean request) {
        request.validate();
        PairBook book = tradingPairService.createPair(request.baseAsset, request.quoteAsset);
        return tradingPairService.read(book.pairId, this::toPairBean);
    }

    @GetMapping("/pairs")
    public List<PairBean> getPairs(@RequestParam(value = "base", required = false) String base,
                                   @RequestParam(value = "quote", required = false) String quote) {
        return tradingPairService.findPairs(base, quote).stream()
                .map(book -> tradingPairService.read(book.pairId, this::toPairBean))
                .toList();
    }

    @GetMapping("/pairs/{pairId}")
    public PairBean getPair(@PathVariable("pairId") long pairId) {
        return tradingPairService.read(pairId, this::toPairBean);
    }

    @GetMapping("/pairs/{pairId}/bids")
    public List<OfferBean> getBids(@PathVariable("pairId") long pairId,
                                   @RequestParam(value = "maxDepth", required = false) Integer maxDepth) {
        int depth = checkDepth(maxDepth);
        return tradingPairService.read(pairId, book -> toOfferBeans(book.getBids(), depth));
    }

    @GetMapping("/pairs/{pairId}/asks")
    public List<OfferBean> getAsks(@PathVariable("pairId") long pairId,
                                   @RequestParam(value = "maxDepth", required = false) Integer maxDepth) {
        int depth = checkDepth(maxDepth);
        return tradingPairService.read(pairId, book -> toOfferBeans(book.getAsks(), depth));
    }

    @PostMapping("/pairs/{pairId}/bids")
    public MatchResultBean submitBid(@PathVariable("pairId") long pairId,
                                     @RequestHeader(value = "X-Account-Id", required = false) String caller,
                                     @RequestBody OrderRequestBean request) {
        checkCaller(caller);
        request.validate();
        MatchResult result = tradingPairService.submitBid(pairId, caller, request.beneficiary,
                request.priceValue(), request.quantityValue());
        return toMatchResultBean(result);
    }

    @PostMapping("/pairs/{pairId}/asks")
    public MatchResultBean submitAsk(@PathVariable("pairId") long pairId,
                                     @RequestHeader(value = "X-Account-Id", required = false) String caller,
                                     @RequestBody OrderRequestBean request) {
        checkCaller(caller);
        request.validate();
        MatchResult result = tradingPairService.submitAsk(pairId, caller, request.beneficiary,
                request.priceValue(), request.quantityValue());
        return toMatchResultBean(result);
    }

    private void checkCaller(String caller) {
        if(caller == null || caller.isBlank())
            throw new ApiException(ApiError.PARAMETER_INVALID, "X-Account-Id", "caller account is required.");
    }

    private int checkDepth(Integer maxDepth) {
        if(maxDepth == null)
            return this.orderBookDepth;
        if(maxDepth < 1 || maxDepth > 1000)
            throw new ApiException(ApiError.PARAMETER_INVALID, "maxDepth", "Invalid maxDepth value.");
        return maxDepth;
    }

    PairBean toPairBean(PairBook book) {
        PairBean bean = new PairBean();
        bean.pairId = book.pairId;
        bean.baseAsset = book.baseAsset;
        bean.quoteAsset = book.quoteAsset;
        bean.custodyAccount = book.custodyAccount;
        bean.basePool = UnsignedMath.toBigInteger(book.getBasePool());
        bean.quotePool = UnsignedMath.toBigInteger(book.getQuotePool());
        bean.bidCount = book.getBids().size();
        bean.askCount = book.getAsks().size();
        HeapEntry<Offer> bestBid = book.getBids().peek();
        HeapEntry<Offer> bestAsk = book.getAsks().peek();
        bean.bestBid = bestBid == null ? null : UnsignedMath.toBigInteger(bestBid.priority());
        bean.bestAsk = bestAsk == null ? null : UnsignedMath.toBigInteger(bestAsk.priority());
        bean.dust = UnsignedMath.toBigInteger(book.getDust());
        return bean;
    }

    // 按堆数组位置输出, 不排序
    List<OfferBean> toOfferBeans(HeapView<Offer> side, int maxDepth) {
        int n = Math.min(side.size(), maxDepth);
        List<OfferBean> offers = new ArrayList<>(n);
        for(int i = 0; i < n; i++) {
            HeapEntry<Offer> entry = side.peekAt(i);
            offers.add(new OfferBean(entry.payload().orderId(), entry.payload().beneficiary(),
                    UnsignedMath.toBigInteger(entry.priority()),
                    UnsignedMath.toBigInteger(entry.payload().quantity())));
        }
        return offers;
    }

    MatchResultBean toMatchResultBean(MatchResult result) {
        MatchResultBean bean = new MatchResultBean();
        bean.pairId = result.pairId;
        bean.orderId = result.takerOffer.orderId();
        bean.direction = result.direction;
        bean.price = UnsignedMath.toBigInteger(result.price);
        bean.quantity = UnsignedMath.toBigInteger(result.takerOffer.quantity());
        bean.matchDetails = result.matchDetails.stream()
                .map(detail -> new SimpleMatchDetailRecord(
                        UnsignedMath.toBigInteger(detail.price()),
                        UnsignedMath.toBigInteger(detail.baseQuantity()),
                        UnsignedMath.toBigInteger(detail.quoteQuantity()),
                        UnsignedMath.toBigInteger(detail.dust()),
                        detail.bidOffer().orderId(), detail.askOffer().orderId(),
                        detail.bidOffer().beneficiary(), detail.askOffer().beneficiary()))
                .toList();
        return bean;
    }
}
