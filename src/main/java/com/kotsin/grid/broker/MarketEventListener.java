package com.kotsin.grid.broker;

import com.kotsin.grid.model.BookTicker;
import com.kotsin.grid.model.KlineBar;
import com.kotsin.grid.model.OrderUpdateEvent;

/**
 * Receives decoded stream events, one at a time, on the stream reader thread.
 */
public interface MarketEventListener {

    void onBookTicker(BookTicker ticker);

    /**
     * @param closed true once the exchange marks the bar final
     */
    void onKline(KlineBar bar, boolean closed);

    void onOrderUpdate(OrderUpdateEvent event);

    default void onStreamConnected() {
    }

    default void onStreamDisconnected(String reason) {
    }
}
