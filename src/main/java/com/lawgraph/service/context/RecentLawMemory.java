package com.lawgraph.service.context;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.Optional;

/**
 * Bounded FIFO of recently mentioned laws, used for 同法. The oldest entry is
 * evicted when capacity is exceeded.
 */
public class RecentLawMemory {

    /**
     * A law mention. {@code lawId} is null when the name could not be resolved,
     * so a later 同法 refers to that unknown law rather than an older one.
     */
    public record Mention(String name, String lawId, int offset) {
    }

    private final int capacity;
    private final Deque<Mention> mentions = new ArrayDeque<>();

    public RecentLawMemory(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
    }

    public void remember(String name, String lawId, int offset) {
        mentions.addLast(new Mention(name, lawId, offset));
        while (mentions.size() > capacity) {
            mentions.removeFirst();
        }
    }

    /**
     * Latest mention whose offset is strictly before {@code offset}.
     */
    public Optional<Mention> nearestBefore(int offset) {
        Mention best = null;
        Iterator<Mention> it = mentions.descendingIterator();
        while (it.hasNext()) {
            Mention mention = it.next();
            if (mention.offset() < offset && (best == null || mention.offset() > best.offset())) {
                best = mention;
            }
        }
        return Optional.ofNullable(best);
    }

    public int size() {
        return mentions.size();
    }
}
