package com.plotlab.game;

import java.util.Locale;

/** Difficulty brackets in ascending order; EXPERT is the catch-all. */
public enum DifficultyTier {
    EASY,
    MEDIUM,
    HARD,
    EXPERT;

    /** Lower-case name used in configuration files and shown to players. */
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static DifficultyTier fromId(String id) {
        if (id == null) throw new IllegalArgumentException("tier id must not be null");
        for (DifficultyTier t : values()) {
            if (t.id().equals(id.trim().toLowerCase(Locale.ROOT))) return t;
        }
        throw new IllegalArgumentException("Unknown difficulty tier: " + id);
    }
}
