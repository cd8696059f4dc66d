package com.kotsin.grid.engine;

import com.kotsin.grid.model.PositionSnapshot;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Read-only view of the engine for the status API.
 */
@Value
@Builder
public class GridSnapshot {
    String symbol;
    double latestPrice;
    double bestBid;
    double bestAsk;
    PositionSnapshot positions;
    Map<OrderRole, Double> pendingOrders;
    double longGridSpacing;
    double longProfitSpacing;
    double shortGridSpacing;
    double shortProfitSpacing;
    Instant lastLongEntry;
    Instant lastShortEntry;
}
