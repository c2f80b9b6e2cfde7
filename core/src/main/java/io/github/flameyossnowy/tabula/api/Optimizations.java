package io.github.flameyossnowy.tabula.api;

/**
 * Connection-level tuning switches. Each backend maps the ones it understands onto its own
 * driver settings and ignores the rest.
 */
public enum Optimizations {
    /**
     * Write-ahead journal, so readers do not block the single writer.
     */
    WRITE_AHEAD_LOGGING,

    /**
     * Fewer fsyncs; committed data survives a process crash but not a power loss.
     */
    RELAXED_SYNCHRONOUS,

    /**
     * Keep temporary tables and indexes in memory.
     */
    MEMORY_TEMP_STORE,

    /**
     * Wait for a locked database instead of failing immediately.
     */
    BUSY_TIMEOUT
}
