package com.kotsin.grid.service;

import com.kotsin.grid.engine.TradeRecordSink;
import com.kotsin.grid.model.TradeRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * Keeps recent fills in memory and publishes each one for downstream reporting.
 */
@Service
@Slf4j
public class TradeRecordService implements TradeRecordSink {

    static final String TRADE_RECORDS_TOPIC = "grid-trade-records";
    static final int MAX_RECORDS = 1000;

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final Clock clock;
    private final Deque<TradeRecord> recent = new ConcurrentLinkedDeque<>();

    public TradeRecordService(KafkaTemplate<String, Object> kafkaTemplate, Clock clock) {
        this.kafkaTemplate = kafkaTemplate;
        this.clock = clock;
    }

    @Override
    public void record(TradeRecord trade) {
        recent.addLast(trade);
        while (recent.size() > MAX_RECORDS) recent.pollFirst();
        log.info("TRADE_RECORDED id={} {} {} qty={} price={}",
                trade.getOrderId(), trade.getSide(), trade.getPositionSide(), trade.getQuantity(), trade.getPrice());
        try {
            kafkaTemplate.send(TRADE_RECORDS_TOPIC, trade.getSymbol(), trade);
        } catch (Exception e) {
            log.error("TRADE_RECORD_PUBLISH_FAILED id={} error={}", trade.getOrderId(), e.getMessage());
        }
    }

    /** Records within the window, oldest first. */
    public List<TradeRecord> recentTrades(Duration window) {
        Instant cutoff = clock.instant().minus(window);
        List<TradeRecord> out = new ArrayList<>();
        for (TradeRecord t : recent) {
            if (t.getTimestamp() != null && !t.getTimestamp().isBefore(cutoff)) out.add(t);
        }
        return out;
    }
}
