package com.learn.pairexchange.match;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

public class PriorityHeapTest {

    @Test
    void extractHighestFirst() {
        PriorityHeap<String> heap = new PriorityHeap<>(PriorityOrder.HIGHEST_FIRST);
        Random r = new Random(20240601);
        for(int i = 0; i < 500; i++)
            heap.insert(r.nextInt(1000), "v" + i);
        assertEquals(500, heap.size());
        long prev = Long.MAX_VALUE;
        while(!heap.isEmpty()) {
            long priority = heap.extractMax().priority();
            assertTrue(priority <= prev, "expected non-increasing but " + priority + " after " + prev);
            prev = priority;
        }
        assertEquals(0, heap.size());
    }

    @Test
    void extractLowestFirst() {
        PriorityHeap<String> heap = new PriorityHeap<>(PriorityOrder.LOWEST_FIRST);
        Random r = new Random(987654321);
        for(int i = 0; i < 500; i++)
            heap.insert(r.nextInt(1000), "v" + i);
        long prev = Long.MIN_VALUE;
        while(!heap.isEmpty()) {
            long priority = heap.extractMax().priority();
            assertTrue(priority >= prev, "expected non-decreasing but " + priority + " after " + prev);
            prev = priority;
        }
    }

    @Test
    void comparePrioritiesAsUnsigned() {
        PriorityHeap<String> heap = new PriorityHeap<>(PriorityOrder.HIGHEST_FIRST);
        heap.insert(Long.MAX_VALUE, "max-signed");
        heap.insert(-1L, "max-unsigned");
        heap.insert(0L, "zero");
        heap.insert(Long.MIN_VALUE, "2^63");
        assertEquals("max-unsigned", heap.extractMax().payload());
        assertEquals("2^63", heap.extractMax().payload());
        assertEquals("max-signed", heap.extractMax().payload());
        assertEquals("zero", heap.extractMax().payload());
    }

    @Test
    void equalPrioritiesInInsertionOrder() {
        PriorityHeap<String> heap = new PriorityHeap<>(PriorityOrder.LOWEST_FIRST);
        for(int i = 0; i < 20; i++)
            heap.insert(i % 2 == 0 ? 7 : 9, "o" + i);
        List<String> sevens = new ArrayList<>();
        for(int i = 0; i < 10; i++)
            sevens.add(heap.extractMax().payload());
        assertEquals(List.of("o0", "o2", "o4", "o6", "o8", "o10", "o12", "o14", "o16", "o18"), sevens);
    }

    @Test
    void reinsertKeepsSequence() {
        PriorityHeap<String> heap = new PriorityHeap<>(PriorityOrder.HIGHEST_FIRST);
        heap.insert(10, "first");
        heap.insert(10, "second");
        HeapEntry<String> first = heap.extractMax();
        assertEquals("first", first.payload());
        heap.insert(first.withPayload("first-partially-filled"));
        assertEquals("first-partially-filled", heap.extractMax().payload());
        assertEquals("second", heap.extractMax().payload());
    }

    @Test
    void extractFromEmptyQueue() {
        PriorityHeap<String> heap = new PriorityHeap<>(PriorityOrder.HIGHEST_FIRST);
        assertNull(heap.peek());
        assertThrows(IllegalStateException.class, heap::extractMax);
    }

    @Test
    void peekAtChecksRange() {
        PriorityHeap<String> heap = new PriorityHeap<>(PriorityOrder.HIGHEST_FIRST);
        heap.insert(3, "a");
        heap.insert(5, "b");
        assertEquals(5, heap.peekAt(0).priority());
        assertEquals(3, heap.peekAt(1).priority());
        assertThrows(IndexOutOfBoundsException.class, () -> heap.peekAt(2));
        assertThrows(IndexOutOfBoundsException.class, () -> heap.peekAt(-1));
        assertEquals(2, heap.size());
    }

    @Test
    void removeArbitraryEntry() {
        PriorityHeap<String> heap = new PriorityHeap<>(PriorityOrder.LOWEST_FIRST);
        Random r = new Random(42);
        List<HeapEntry<String>> inserted = new ArrayList<>();
        for(int i = 0; i < 100; i++)
            inserted.add(heap.insert(r.nextInt(50), "v" + i));
        for(int i = 0; i < 100; i += 3)
            assertTrue(heap.remove(inserted.get(i)));
        assertFalse(heap.remove(inserted.get(0)));
        // 同价同序但不是同一对象的元素不会被删除
        assertFalse(heap.remove(inserted.get(1).withPayload("other")));
        assertEquals(66, heap.size());
        long prev = Long.MIN_VALUE;
        while(!heap.isEmpty()) {
            HeapEntry<String> entry = heap.extractMax();
            assertNotEquals(0, Integer.parseInt(entry.payload().substring(1)) % 3);
            assertTrue(entry.priority() >= prev);
            prev = entry.priority();
        }
    }
}
