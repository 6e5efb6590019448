package com.propertyintel.estate.client;

import com.propertyintel.estate.config.EstateScraperProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Adaptive delay between API requests.
 *
 * The delay is the gap between consecutive requests across all workers:
 * each caller reserves the next free slot and sleeps until it comes round.
 * After every response the delay moves halfway towards
 * {@code latency / targetConcurrency}, clamped to [minDelay, maxDelay].
 * Failed responses may raise the delay but never lower it.
 */
@Component
@Slf4j
public class AutoThrottle {

    private final boolean enabled;
    private final long minDelayMs;
    private final long maxDelayMs;
    private final double targetConcurrency;

    private long delayMs;
    private long nextRequestAtMs;

    public AutoThrottle(EstateScraperProperties properties) {
        EstateScraperProperties.Api.Throttle cfg = properties.getApi().getThrottle();
        this.enabled = cfg.isEnabled();
        this.minDelayMs = cfg.getMinDelayMs();
        this.maxDelayMs = Math.max(cfg.getMaxDelayMs(), cfg.getMinDelayMs());
        this.targetConcurrency = cfg.getTargetConcurrency() > 0 ? cfg.getTargetConcurrency() : 1.0;
        this.delayMs = clamp(cfg.getStartDelayMs());
    }

    public synchronized long currentDelayMs() {
        return delayMs;
    }

    /** Block until this caller's request slot comes up */
    public void awaitTurn() {
        if (!enabled) return;
        long ms = reserveSlot(System.currentTimeMillis());
        if (ms <= 0) return;
        try {
            Thread.sleep(ms);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Take the earliest free slot at or after {@code nowMs} and push the next
     * one back by the current delay.
     *
     * @return milliseconds the caller has to wait for its slot
     */
    synchronized long reserveSlot(long nowMs) {
        long slot = Math.max(nowMs, nextRequestAtMs);
        nextRequestAtMs = slot + delayMs;
        return slot - nowMs;
    }

    public synchronized void onResponse(long latencyMs, boolean success) {
        if (!enabled) return;
        long target = (long) (latencyMs / targetConcurrency);
        long next = clamp((delayMs + target) / 2);
        if (!success && next < delayMs) {
            return;
        }
        if (next != delayMs) {
            log.debug("Throttle delay {}ms -> {}ms (latency {}ms)", delayMs, next, latencyMs);
        }
        delayMs = next;
    }

    private long clamp(long ms) {
        return Math.max(minDelayMs, Math.min(maxDelayMs, ms));
    }
}
