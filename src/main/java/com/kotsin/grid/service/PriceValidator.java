package com.kotsin.grid.service;

import com.kotsin.grid.config.GridProps;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Screens feed prices. Rejected prices leave the last known good one in place.
 */
@Component
@Slf4j
public class PriceValidator {

    private final double maxJump;
    private final int maxConsecutiveRejects;

    private double lastKnownGood;
    private int rejectStreak;

    public PriceValidator(GridProps props) {
        this.maxJump = props.maxPriceJump();
        this.maxConsecutiveRejects = props.maxConsecutiveRejects();
    }

    /**
     * Pure check of one candidate against the last accepted price
     * (0 when none yet).
     */
    public static PriceDecision validatePrice(double candidate, double lastKnown, double maxJump) {
        if (!Double.isFinite(candidate) || candidate <= 0) {
            return PriceDecision.reject(lastKnown, "non-positive");
        }
        if (lastKnown > 0 && Math.abs(candidate - lastKnown) / lastKnown > maxJump) {
            return PriceDecision.reject(lastKnown, "jump");
        }
        return PriceDecision.accept(candidate);
    }

    /**
     * Stateful wrapper. After too many jump rejections in a row the candidate
     * is taken as the new anchor; a real gap must not freeze the feed.
     */
    public synchronized PriceDecision validate(double candidate) {
        PriceDecision d = validatePrice(candidate, lastKnownGood, maxJump);
        if (d.accepted()) {
            lastKnownGood = candidate;
            rejectStreak = 0;
            return d;
        }
        if ("jump".equals(d.reason()) && rejectStreak >= maxConsecutiveRejects) {
            log.warn("PRICE_REANCHORED from={} to={} after {} rejects", lastKnownGood, candidate, rejectStreak);
            lastKnownGood = candidate;
            rejectStreak = 0;
            return PriceDecision.accept(candidate);
        }
        if ("jump".equals(d.reason())) rejectStreak++;
        log.warn("PRICE_REJECTED candidate={} lastKnown={} reason={}", candidate, lastKnownGood, d.reason());
        return d;
    }

    public synchronized double lastKnownGood() {
        return lastKnownGood;
    }
}
