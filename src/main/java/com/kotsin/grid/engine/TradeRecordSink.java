package com.kotsin.grid.engine;

import com.kotsin.grid.model.TradeRecord;

/**
 * Receives every fill the engine applies.
 */
public interface TradeRecordSink {

    void record(TradeRecord trade);
}
