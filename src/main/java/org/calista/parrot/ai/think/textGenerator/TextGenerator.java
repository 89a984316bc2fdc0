package org.calista.parrot.ai.think.textGenerator;

import org.calista.parrot.ai.think.RandomSource;

import java.util.Optional;

/**
 * Pluggable response backend.
 *
 * <h3>Determinism contract</h3>
 * For the same knowledge state, input line and sequence of random values the output must be
 * identical. All randomness comes from the given {@link RandomSource}.
 */
public interface TextGenerator {

    /**
     * @return a response, or empty when the input gives nothing to build on
     */
    Optional<String> respondTo(String line, RandomSource random);
}
