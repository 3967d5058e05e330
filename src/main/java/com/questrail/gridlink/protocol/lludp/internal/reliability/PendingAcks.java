package com.questrail.gridlink.protocol.lludp.internal.reliability;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.Iterator;
import java.util.List;

/**
 * Sequence numbers owed to the peer, oldest first. A sequence number queued
 * twice before being flushed is acknowledged once.
 */
final class PendingAcks
{
    private final LinkedHashSet<Long> owed = new LinkedHashSet<>();

    void add(long sequence)
    {
        owed.add(sequence);
    }

    List<Long> drain(int max)
    {
        List<Long> out = new ArrayList<>(Math.min(max, owed.size()));
        Iterator<Long> it = owed.iterator();
        while (it.hasNext() && out.size() < max) {
            out.add(it.next());
            it.remove();
        }
        return out;
    }

    int size()
    {
        return owed.size();
    }

    void clear()
    {
        owed.clear();
    }
}
