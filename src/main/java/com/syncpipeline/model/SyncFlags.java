package com.syncpipeline.model;

/**
 * Sync mode flags passed through to storage untouched.
 */
public record SyncFlags(
    boolean manualSync,
    boolean providerManualSync
) {
    public static final SyncFlags DEFAULT = new SyncFlags(false, false);
}
