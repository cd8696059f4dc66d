package com.kotsin.grid.signal;

import com.kotsin.grid.broker.MarketGateway;
import com.kotsin.grid.config.SignalProps;
import com.kotsin.grid.engine.GridEngine;
import com.kotsin.grid.model.KlineBar;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Hourly trend classification. A change of classification widens the spacing
 * of the leg that trades against the trend.
 */
@Service
@Slf4j
public class TrendSignalService {

    private final MarketGateway gateway;
    private final SignalProps props;
    private final GridEngine engine;
    private final Clock clock;
    private final TrendClassifier classifier;

    private volatile SignalSnapshot current;
    private volatile Instant lastRefresh;

    public TrendSignalService(MarketGateway gateway, SignalProps props, GridEngine engine, Clock clock) {
        this.gateway = gateway;
        this.props = props;
        this.engine = engine;
        this.clock = clock;
        this.classifier = new TrendClassifier(props);
    }

    /**
     * Startup classification. Sets the current signal without touching spacing.
     */
    public void initialize() {
        if (!props.enabled()) {
            log.info("SIGNAL_DISABLED");
            return;
        }
        lastRefresh = clock.instant();
        SignalSnapshot s = evaluate();
        if (s != null) {
            current = s;
            log.info("SIGNAL_INITIALIZED signal={} adx={} confidence={}", s.getSignal(), s.getAdx(), s.getConfidence());
        }
    }

    /** @return true when a refresh was attempted */
    public boolean refreshIfDue(Instant now) {
        if (!props.enabled()) return false;
        Instant last = lastRefresh;
        if (last != null && Duration.between(last, now).compareTo(props.refreshInterval()) < 0) {
            return false;
        }
        refresh();
        return true;
    }

    public void refresh() {
        lastRefresh = clock.instant();
        SignalSnapshot s = evaluate();
        if (s == null) return;

        TrendSignal previous = current == null ? TrendSignal.RANGING : current.getSignal();
        current = s;
        if (previous != s.getSignal()) {
            SpacingAdjustment adj = SpacingAdjustment.forSignal(s.getSignal());
            log.info("SIGNAL_CHANGED from={} to={} adx={} confidence={} adjustment={}",
                    previous, s.getSignal(), s.getAdx(), s.getConfidence(), adj);
            engine.applySpacingAdjustment(adj);
        } else {
            log.debug("SIGNAL_UNCHANGED signal={} adx={}", s.getSignal(), s.getAdx());
        }
    }

    private SignalSnapshot evaluate() {
        List<KlineBar> bars = gateway.fetchKlines(props.timeframe(), props.limit());
        if (bars.size() < classifier.minimumBars()) {
            log.warn("SIGNAL_SKIPPED bars={} required={}", bars.size(), classifier.minimumBars());
            return null;
        }
        return classifier.classify(bars, clock.instant());
    }

    public SignalSnapshot current() {
        return current;
    }

    public Instant lastRefresh() {
        return lastRefresh;
    }
}
