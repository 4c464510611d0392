package com.learn.pairexchange.match;

import com.learn.pairexchange.util.UnsignedMath;

import java.util.ArrayList;
import java.util.List;

/**
 * Order book and escrow state of one base/quote trading pair.
 * <p>
 * Bids escrow the base asset and are served highest price first. Asks escrow the quote asset
 * and are served lowest price first. Mutation goes through {@link MatchEngine} only.
 */
public class PairBook {
    public final long pairId;
    public final String baseAsset;
    public final String quoteAsset;
    // 托管账户, 冻结的资产在账本中记在该账户下
    public final String custodyAccount;

    final PriorityHeap<Offer> bids = new PriorityHeap<>(PriorityOrder.HIGHEST_FIRST);
    final PriorityHeap<Offer> asks = new PriorityHeap<>(PriorityOrder.LOWEST_FIRST);
    final EscrowPool basePool;
    final EscrowPool quotePool;

    private long lastOrderId = 0;
    private long dust = 0;

    public PairBook(long pairId, String baseAsset, String quoteAsset) {
        this.pairId = pairId;
        this.baseAsset = baseAsset;
        this.quoteAsset = quoteAsset;
        this.custodyAccount = "pair-" + pairId;
        this.basePool = new EscrowPool(baseAsset);
        this.quotePool = new EscrowPool(quoteAsset);
    }

    public HeapView<Offer> getBids() {
        return this.bids;
    }

    public HeapView<Offer> getAsks() {
        return this.asks;
    }

    public long getBasePool() {
        return this.basePool.getLocked();
    }

    public long getQuotePool() {
        return this.quotePool.getLocked();
    }

    // 因整除舍去而未换得 A 资产的 B 资产累计量
    public long getDust() {
        return this.dust;
    }

    long nextOrderId() {
        return ++this.lastOrderId;
    }

    void addDust(long amount) {
        this.dust = UnsignedMath.addExact(this.dust, amount);
    }

    UndoLog beginUndo() {
        return new UndoLog();
    }

    // 逆序撤销本次提交对挂单的修改, 计数器和托管量直接恢复
    void rollback(UndoLog undo) {
        for(int i = undo.changes.size() - 1; i >= 0; i--) {
            HeapChange change = undo.changes.get(i);
            if(change.inserted()) {
                if(!change.heap().remove(change.entry()))
                    throw new IllegalStateException("Cannot roll back entry " + change.entry());
            } else {
                change.heap().insert(change.entry());
            }
        }
        this.bids.resetSequence(undo.bidSequence);
        this.asks.resetSequence(undo.askSequence);
        this.basePool.reset(undo.baseLocked);
        this.quotePool.reset(undo.quoteLocked);
        this.lastOrderId = undo.lastOrderId;
        this.dust = undo.dust;
    }

    record HeapChange(PriorityHeap<Offer> heap, HeapEntry<Offer> entry, boolean inserted) {
    }

    // 一次提交开始时的状态以及之后的挂单增删记录
    final class UndoLog {
        final long bidSequence = bids.getNextSequence();
        final long askSequence = asks.getNextSequence();
        final long baseLocked = basePool.getLocked();
        final long quoteLocked = quotePool.getLocked();
        final long lastOrderId = PairBook.this.lastOrderId;
        final long dust = PairBook.this.dust;
        final List<HeapChange> changes = new ArrayList<>();

        HeapEntry<Offer> insert(PriorityHeap<Offer> heap, long price, Offer offer) {
            HeapEntry<Offer> entry = heap.insert(price, offer);
            this.changes.add(new HeapChange(heap, entry, true));
            return entry;
        }

        void insert(PriorityHeap<Offer> heap, HeapEntry<Offer> entry) {
            heap.insert(entry);
            this.changes.add(new HeapChange(heap, entry, true));
        }

        HeapEntry<Offer> extractMax(PriorityHeap<Offer> heap) {
            HeapEntry<Offer> entry = heap.extractMax();
            this.changes.add(new HeapChange(heap, entry, false));
            return entry;
        }
    }

    @Override
    public String toString() {
        return "PairBook [pairId=" + pairId + ", base=" + baseAsset + ", quote=" + quoteAsset +
                ", bids=" + bids.size() + ", asks=" + asks.size() +
                ", basePool=" + UnsignedMath.toString(basePool.getLocked()) +
                ", quotePool=" + UnsignedMath.toString(quotePool.getLocked()) + ']';
    }
}
