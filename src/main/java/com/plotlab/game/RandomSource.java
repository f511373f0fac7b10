package com.plotlab.game;

import java.util.Random;

/** Source of the random choices a session makes (templates, hints). */
public interface RandomSource {

    /** Uniform index in {@code [0, bound)}. */
    int nextInt(int bound);

    static RandomSource seeded(long seed) {
        Random random = new Random(seed);
        return random::nextInt;
    }

    static RandomSource system() {
        Random random = new Random();
        return random::nextInt;
    }
}
