package com.movesim.repository;

/**
 * Derives store keys from entity identifiers. One key per entity, stable across sessions and
 * restarts.
 */
public final class SampleKeys {

    public static final String KEY_PREFIX = "user.";
    public static final String KEY_SUFFIX = ".location";

    private SampleKeys() {}

    public static String forEntity(String entityId) {
        return KEY_PREFIX + entityId + KEY_SUFFIX;
    }
}
