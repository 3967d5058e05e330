package com.questrail.gridlink.protocol.lludp.internal.reliability;

import java.util.ArrayDeque;
import java.util.HashSet;
import java.util.Set;

/**
 * InboundSeenWindow
 * -----------------------------------------------------------------------------
 * Bounded record of recently received sequence numbers.
 *
 * <p>Arrival order, not sequence order, decides eviction: once the window is
 * full the sequence number received longest ago is forgotten.</p>
 */
final class InboundSeenWindow
{
    private final int capacity;
    private final ArrayDeque<Long> order;
    private final Set<Long> seen;

    InboundSeenWindow(int capacity)
    {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
        this.order = new ArrayDeque<>(capacity);
        this.seen = new HashSet<>(capacity * 2);
    }

    /**
     * Record {@code sequence}.
     *
     * @return {@code true} if it was not in the window
     */
    boolean record(long sequence)
    {
        if (!seen.add(sequence)) {
            return false;
        }
        order.addLast(sequence);
        if (order.size() > capacity) {
            seen.remove(order.removeFirst());
        }
        return true;
    }

    boolean contains(long sequence)
    {
        return seen.contains(sequence);
    }

    int size()
    {
        return order.size();
    }

    void clear()
    {
        order.clear();
        seen.clear();
    }
}
