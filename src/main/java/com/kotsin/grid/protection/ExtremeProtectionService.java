package com.kotsin.grid.protection;

import com.kotsin.grid.config.GridProps;
import com.kotsin.grid.config.ProtectionProps;
import com.kotsin.grid.model.KlineBar;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Extreme-market protection.
 *
 * <p>Tracks consecutive same-direction closed bars. Once the cumulative move
 * of the current run reaches the threshold, cancels everything, closes both
 * legs and hibernates. Hibernation ends only after the minimum duration has
 * passed <em>and</em> short-term volatility has fallen back near its baseline.
 *
 * <p>State changes are persisted immediately so a restart resumes hibernation.
 */
@Service
@Slf4j
public class ExtremeProtectionService {

    private final ProtectionProps props;
    private final String symbol;
    private final ProtectionStateStore store;
    private final EmergencyFlattener flattener;
    private final ProtectionEventPublisher publisher;
    private final Clock clock;

    private final ProtectionState state;
    private final VolatilityTracker volatility;
    private final ReentrantLock triggerLock = new ReentrantLock();
    private volatile Instant lastFailedTrigger;

    public ExtremeProtectionService(ProtectionProps props,
                                    GridProps gridProps,
                                    ProtectionStateStore store,
                                    EmergencyFlattener flattener,
                                    ProtectionEventPublisher publisher,
                                    Clock clock) {
        this.props = props;
        this.symbol = gridProps.symbol();
        this.store = store;
        this.flattener = flattener;
        this.publisher = publisher;
        this.clock = clock;

        Optional<ProtectionState> loaded = store.load();
        this.state = loaded.orElseGet(ProtectionState::initial);
        state.normalize(clock.instant());
        this.volatility = new VolatilityTracker(props.volatilityPeriod(), props.baselineSamples(),
                state.getBaselineVolatility());

        if (loaded.isPresent()) {
            persist();
            log.info("PROTECTION_STATE_RESTORED active={} hibernationStart={} run={} bars={} cumulative={}% baseline={}",
                    state.isProtectionActive(), state.getHibernationStart(), state.getDirection(),
                    state.getBarCount(), state.getCumulativeMovePercent(), state.getBaselineVolatility());
        }
    }

    // ---------------------------------------------------------------------
    // Inputs
    // ---------------------------------------------------------------------

    /**
     * Folds a closed bar into the run. Bars at or before the last one seen are
     * ignored, so the stream and the polling fallback can both deliver.
     *
     * @return true if the bar was applied
     */
    public synchronized boolean onBar(KlineBar bar) {
        if (bar == null || bar.getTimestamp() == null) return false;
        Instant last = state.getLastBarTime();
        if (last != null && !bar.getTimestamp().isAfter(last)) {
            return false;
        }

        ProtectionState.RunTransition transition = state.applyBar(bar);
        state.setLastBarTime(bar.getTimestamp());
        persist();

        log.info("PROTECTION_BAR time={} barDirection={} change={}% run={} bars={} cumulative={}%",
                bar.getTimestamp(), bar.getDirection(), String.format("%.3f", bar.getChangePercent()),
                state.getDirection(), state.getBarCount(), String.format("%.3f", state.getCumulativeMovePercent()));

        Instant now = clock.instant();
        if (transition == ProtectionState.RunTransition.STARTED) {
            publisher.publish(ProtectionEvent.runStarted(symbol, state.copy(), now));
        } else if (transition == ProtectionState.RunTransition.ENDED) {
            publisher.publish(ProtectionEvent.runEnded(symbol, state.copy(), now));
        }
        return true;
    }

    /** Feeds one price sample into the volatility tracker. */
    public synchronized void recordPrice(double price) {
        volatility.addSample(price);
        if (state.getBaselineVolatility() == null && volatility.baseline() != null) {
            state.setBaselineVolatility(volatility.baseline());
            persist();
            log.info("PROTECTION_BASELINE_CAPTURED baseline={}", volatility.baseline());
        }
    }

    // ---------------------------------------------------------------------
    // Decisions
    // ---------------------------------------------------------------------

    /**
     * Runs the protection check for one price tick. May block for the whole
     * emergency sequence.
     */
    public ProtectionDecision evaluate(double price, double bid, double ask) {
        synchronized (this) {
            if (state.isProtectionActive()) {
                return evaluateHibernationEnd() ? ProtectionDecision.RESUMED : ProtectionDecision.HIBERNATING;
            }
            if (!isExtreme()) {
                return ProtectionDecision.PROCEED;
            }
        }
        return triggerEmergency(price, bid, ask);
    }

    public synchronized boolean isExtreme() {
        return Math.abs(state.getCumulativeMovePercent()) >= props.extremeThreshold();
    }

    public synchronized boolean isHibernating() {
        return state.isProtectionActive();
    }

    /**
     * Single-flight: a second caller while the sequence runs gets
     * EXTREME_COOLDOWN, as does any caller inside the retry cooldown after a
     * failed attempt.
     */
    ProtectionDecision triggerEmergency(double price, double bid, double ask) {
        if (!triggerLock.tryLock()) {
            log.warn("PROTECTION_TRIGGER_IN_FLIGHT ignoring concurrent trigger");
            return ProtectionDecision.EXTREME_COOLDOWN;
        }
        try {
            Instant now = clock.instant();
            Instant lastFail = lastFailedTrigger;
            if (lastFail != null && Duration.between(lastFail, now).compareTo(props.emergencyRetry()) < 0) {
                log.debug("PROTECTION_TRIGGER_COOLDOWN lastFailure={}", lastFail);
                return ProtectionDecision.EXTREME_COOLDOWN;
            }

            ProtectionState run;
            synchronized (this) {
                run = state.copy();
            }
            log.error("🚨 PROTECTION_TRIGGER direction={} bars={} cumulative={}% threshold={}% price={}",
                    run.getDirection(), run.getBarCount(), String.format("%.2f", run.getCumulativeMovePercent()),
                    props.extremeThreshold(), price);

            boolean cancelled = flattener.cancelAllOrders();
            boolean flattened = flattener.flattenAllPositions(bid, ask, price);

            if (cancelled && flattened) {
                synchronized (this) {
                    state.setProtectionActive(true);
                    state.setHibernationStart(clock.instant());
                    state.resetRun();
                    persist();
                }
                lastFailedTrigger = null;
                log.error("🚨 PROTECTION_ACTIVE flattened, hibernating for at least {}h", props.hibernationHours());
                publisher.publish(ProtectionEvent.triggered(symbol, run, price, clock.instant()));
                return ProtectionDecision.TRIGGERED;
            }

            lastFailedTrigger = clock.instant();
            log.error("🚨 PROTECTION_TRIGGER_INCOMPLETE ordersCancelled={} positionsClosed={} protection stays inactive, retry in {}s",
                    cancelled, flattened, props.emergencyRetry().toSeconds());
            publisher.publish(ProtectionEvent.triggerFailed(symbol, run, price, cancelled, flattened, clock.instant()));
            return ProtectionDecision.TRIGGER_FAILED;
        } finally {
            triggerLock.unlock();
        }
    }

    /**
     * Ends hibernation when both the minimum duration has elapsed and
     * volatility has recovered.
     *
     * @return true if protection was just deactivated
     */
    public synchronized boolean evaluateHibernationEnd() {
        if (!state.isProtectionActive()) return false;
        double elapsed = elapsedHours(clock.instant());
        if (elapsed < props.hibernationHours()) {
            return false;
        }
        double current = volatility.current();
        Double baseline = state.getBaselineVolatility();
        if (!isRecovered(current, baseline, props.recoveryMultiplier())) {
            log.debug("PROTECTION_STILL_VOLATILE elapsed={}h current={} baseline={}", elapsed, current, baseline);
            return false;
        }

        state.setProtectionActive(false);
        state.setHibernationStart(null);
        state.resetRun();
        persist();
        log.warn("PROTECTION_RESUMED after {}h volatility={} baseline={}", String.format("%.1f", elapsed), current, baseline);
        publisher.publish(ProtectionEvent.resumed(symbol, state.copy(), current, clock.instant()));
        return true;
    }

    static boolean isRecovered(double current, Double baseline, double multiplier) {
        return baseline != null && current > 0 && current <= baseline * multiplier;
    }

    private double elapsedHours(Instant now) {
        Instant start = state.getHibernationStart();
        if (start == null) return 0.0;
        return Duration.between(start, now).toMillis() / 3_600_000.0;
    }

    // ---------------------------------------------------------------------
    // Operator
    // ---------------------------------------------------------------------

    public synchronized ProtectionStatus status() {
        double elapsed = state.isProtectionActive() ? elapsedHours(clock.instant()) : 0.0;
        Double baseline = state.getBaselineVolatility();
        return ProtectionStatus.builder()
                .protectionActive(state.isProtectionActive())
                .hibernationStart(state.getHibernationStart())
                .elapsedHours(elapsed)
                .remainingHours(state.isProtectionActive() ? Math.max(0.0, props.hibernationHours() - elapsed) : 0.0)
                .baselineVolatility(baseline)
                .currentVolatility(volatility.current())
                .recoveryThreshold(baseline == null ? null : baseline * props.recoveryMultiplier())
                .direction(state.getDirection())
                .barCount(state.getBarCount())
                .cumulativeMovePercent(state.getCumulativeMovePercent())
                .runStartPrice(state.getRunStartPrice())
                .runStartTime(state.getRunStartTime())
                .lastBarTime(state.getLastBarTime())
                .extremeThreshold(props.extremeThreshold())
                .hibernationHours(props.hibernationHours())
                .recoveryMultiplier(props.recoveryMultiplier())
                .build();
    }

    /** Clears hibernation and the run. The volatility baseline is kept. */
    public synchronized void forceReset() {
        state.setProtectionActive(false);
        state.setHibernationStart(null);
        state.resetRun();
        persist();
        lastFailedTrigger = null;
        log.warn("PROTECTION_FORCE_RESET by operator");
        publisher.publish(ProtectionEvent.forceReset(symbol, state.copy(), clock.instant()));
    }

    private void persist() {
        state.setLastUpdate(clock.instant());
        store.save(state.copy());
    }
}
