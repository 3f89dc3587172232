package com.teknolojikpanda.findings.synth.model;

/**
 * Priority scale of the external task tracker. Levels follow the beads convention: 1..5,
 * higher is more important.
 */
public enum TaskPriority {
    HIGHEST(5),
    MEDIUM(3),
    LOWEST(1);

    private final int level;

    TaskPriority(int level) {
        this.level = level;
    }

    public int getLevel() {
        return level;
    }
}
