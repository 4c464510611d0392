package com.learn.pairexchange.match;

import com.learn.pairexchange.enums.Direction;

import java.util.ArrayList;
import java.util.List;

public class MatchResult {
    public final long pairId;
    public final Direction direction;
    public final long price;
    public final Offer takerOffer;
    public final List<MatchDetailRecord> matchDetails = new ArrayList<>();

    public MatchResult(long pairId, Direction direction, long price, Offer takerOffer) {
        this.pairId = pairId;
        this.direction = direction;
        this.price = price;
        this.takerOffer = takerOffer;
    }

    public void add(long price, long baseQuantity, long quoteQuantity, long dust, Offer bidOffer, Offer askOffer) {
        this.matchDetails.add(new MatchDetailRecord(price, baseQuantity, quoteQuantity, dust, bidOffer, askOffer));
    }

    @Override
    public String toString() {
        if(matchDetails.isEmpty())
            return "No matched.";
        return matchDetails.size() + " matched: " +
                String.join(", ", matchDetails.stream()
                        .map(MatchDetailRecord::toString)
                        .toArray(String[]::new));
    }
}
