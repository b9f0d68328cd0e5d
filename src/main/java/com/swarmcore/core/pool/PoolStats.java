package com.swarmcore.core.pool;

/**
 * @param maxSize   configured capacity
 * @param total     open connections, idle plus in use
 * @param idle      connections ready for reuse
 * @param inUse     connections currently lent out
 * @param waiting   callers blocked in acquire
 * @param created   lifetime connections opened
 * @param destroyed lifetime connections closed
 * @param draining  true once drain has started
 */
public record PoolStats(
    int maxSize,
    int total,
    int idle,
    int inUse,
    int waiting,
    long created,
    long destroyed,
    boolean draining
) {

    public double utilization() {
        return maxSize == 0 ? 0.0 : (double) inUse / maxSize;
    }
}
