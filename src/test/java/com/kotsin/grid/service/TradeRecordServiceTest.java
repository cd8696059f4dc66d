package com.kotsin.grid.service;

import com.kotsin.grid.model.OrderSide;
import com.kotsin.grid.model.PositionSide;
import com.kotsin.grid.model.TradeRecord;
import com.kotsin.grid.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.kafka.core.KafkaTemplate;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class TradeRecordServiceTest {

    private KafkaTemplate<String, Object> kafkaTemplate;
    private MutableClock clock;
    private TradeRecordService service;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        kafkaTemplate = mock(KafkaTemplate.class);
        clock = new MutableClock(Instant.parse("2026-06-01T12:00:00Z"));
        service = new TradeRecordService(kafkaTemplate, clock);
    }

    private TradeRecord trade(String id, Instant at) {
        return TradeRecord.builder()
                .timestamp(at).symbol("XRPUSDC").orderId(id)
                .side(OrderSide.SELL).positionSide(PositionSide.LONG)
                .price(0.52).quantity(3).reduceOnly(true).gridType("long")
                .build();
    }

    @Test
    @DisplayName("Each fill is published keyed by symbol")
    void testPublished() {
        TradeRecord t = trade("1", clock.instant());
        service.record(t);
        verify(kafkaTemplate).send(TradeRecordService.TRADE_RECORDS_TOPIC, "XRPUSDC", t);
    }

    @Test
    @DisplayName("Publish failure does not lose the in-memory record")
    void testPublishFailure() {
        when(kafkaTemplate.send(anyString(), anyString(), any())).thenThrow(new IllegalStateException("broker down"));
        service.record(trade("1", clock.instant()));
        assertEquals(1, service.recentTrades(Duration.ofHours(1)).size());
    }

    @Test
    @DisplayName("Window query returns recent trades oldest first")
    void testRecentWindow() {
        Instant now = clock.instant();
        service.record(trade("old", now.minus(Duration.ofHours(3))));
        service.record(trade("a", now.minus(Duration.ofMinutes(30))));
        service.record(trade("b", now.minus(Duration.ofMinutes(5))));

        List<TradeRecord> recent = service.recentTrades(Duration.ofHours(1));
        assertEquals(List.of("a", "b"), recent.stream().map(TradeRecord::getOrderId).toList());
    }

    @Test
    @DisplayName("Memory keeps only the newest records")
    void testBounded() {
        for (int i = 0; i < TradeRecordService.MAX_RECORDS + 25; i++) {
            service.record(trade(String.valueOf(i), clock.instant()));
        }
        List<TradeRecord> all = service.recentTrades(Duration.ofDays(1));
        assertEquals(TradeRecordService.MAX_RECORDS, all.size());
        assertEquals("25", all.get(0).getOrderId());
        verify(kafkaTemplate, times(TradeRecordService.MAX_RECORDS + 25)).send(eq(TradeRecordService.TRADE_RECORDS_TOPIC), anyString(), any());
    }
}
