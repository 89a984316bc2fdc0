package org.calista.parrot.ai.think;

import java.util.List;
import java.util.Objects;
import java.util.random.RandomGenerator;

/**
 * Injected randomness. Generation never touches global random state, so a fixed
 * sequence of values reproduces a response exactly.
 */
@FunctionalInterface
public interface RandomSource {

    /** Next raw 64-bit value. Interpreted as unsigned by {@link #pick(List)}. */
    long nextLong();

    /** {@code items[next mod size]}, the value taken as unsigned 64-bit. */
    default <T> T pick(List<T> items) {
        Objects.requireNonNull(items, "items");
        if (items.isEmpty()) throw new IllegalArgumentException("cannot pick from an empty list");
        return items.get((int) Long.remainderUnsigned(nextLong(), items.size()));
    }

    static RandomSource of(RandomGenerator generator) {
        Objects.requireNonNull(generator, "generator");
        return generator::nextLong;
    }
}
