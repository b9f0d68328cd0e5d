package com.swarmcore.core.events;

/**
 * Delivery counters for one subscriber.
 */
public record SubscriberStats(String name, int queued, long delivered, long dropped) {}
