package com.kotsin.grid.broker;

import com.kotsin.grid.model.BarDirection;
import com.kotsin.grid.model.BookTicker;
import com.kotsin.grid.model.KlineBar;
import com.kotsin.grid.model.OrderSide;
import com.kotsin.grid.model.OrderStatus;
import com.kotsin.grid.model.OrderUpdateEvent;
import com.kotsin.grid.model.PositionSide;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BinanceStreamParserTest {

    private final BinanceStreamParser parser = new BinanceStreamParser();
    private final Recorder recorder = new Recorder();

    static class Recorder implements MarketEventListener {
        final List<BookTicker> tickers = new ArrayList<>();
        final List<KlineBar> bars = new ArrayList<>();
        final List<Boolean> closedFlags = new ArrayList<>();
        final List<OrderUpdateEvent> orders = new ArrayList<>();

        @Override
        public void onBookTicker(BookTicker ticker) {
            tickers.add(ticker);
        }

        @Override
        public void onKline(KlineBar bar, boolean closed) {
            bars.add(bar);
            closedFlags.add(closed);
        }

        @Override
        public void onOrderUpdate(OrderUpdateEvent event) {
            orders.add(event);
        }
    }

    @Test
    @DisplayName("Book ticker frame inside the combined-stream envelope")
    void testBookTicker() {
        String frame = "{\"stream\":\"xrpusdc@bookTicker\",\"data\":{\"e\":\"bookTicker\",\"s\":\"XRPUSDC\","
                + "\"b\":\"0.5120\",\"B\":\"1000\",\"a\":\"0.5122\",\"A\":\"800\",\"E\":1700000000123}}";

        assertEquals(BinanceStreamParser.BOOK_TICKER, parser.dispatch(frame, recorder));
        BookTicker t = recorder.tickers.get(0);
        assertEquals(0.5120, t.bid(), 1e-12);
        assertEquals(0.5122, t.ask(), 1e-12);
        assertEquals(0.5121, t.mid(), 1e-12);
    }

    @Test
    @DisplayName("Kline frame carries the closed flag")
    void testKline() {
        String frame = "{\"stream\":\"xrpusdc@kline_1h\",\"data\":{\"e\":\"kline\",\"s\":\"XRPUSDC\",\"k\":{"
                + "\"t\":1700000000000,\"o\":\"0.5000\",\"h\":\"0.5200\",\"l\":\"0.4990\",\"c\":\"0.5100\","
                + "\"v\":\"12345\",\"x\":true}}}";

        assertEquals(BinanceStreamParser.KLINE, parser.dispatch(frame, recorder));
        KlineBar bar = recorder.bars.get(0);
        assertTrue(recorder.closedFlags.get(0));
        assertEquals(Instant.ofEpochMilli(1700000000000L), bar.getTimestamp());
        assertEquals(BarDirection.UP, bar.getDirection());
        assertEquals(2.0, bar.getChangePercent(), 1e-9);
    }

    @Test
    @DisplayName("Order update maps hedge-mode closes to reduce-only")
    void testOrderUpdate() {
        String frame = "{\"e\":\"ORDER_TRADE_UPDATE\",\"E\":1700000001000,\"o\":{\"s\":\"XRPUSDC\",\"c\":\"grid_abc\","
                + "\"S\":\"BUY\",\"o\":\"LIMIT\",\"q\":\"3\",\"p\":\"0.4990\",\"ap\":\"0.4990\",\"X\":\"FILLED\","
                + "\"i\":555,\"L\":\"0.4990\",\"z\":\"3\",\"T\":1700000001000,\"R\":false,\"ps\":\"SHORT\"}}";

        assertEquals(BinanceStreamParser.ORDER_TRADE_UPDATE, parser.dispatch(frame, recorder));
        OrderUpdateEvent e = recorder.orders.get(0);
        assertEquals("555", e.getOrderId());
        assertEquals(OrderSide.BUY, e.getSide());
        assertEquals(PositionSide.SHORT, e.getPositionSide());
        assertEquals(OrderStatus.FILLED, e.getStatus());
        assertTrue(e.isReduceOnly(), "Buying the short leg closes it");
        assertEquals(3.0, e.getFilledQty(), 1e-12);
        assertEquals("555:FILLED:3.0", e.dedupKey());
    }

    @Test
    @DisplayName("One-way order updates are dropped")
    void testOneWayOrderDropped() {
        String frame = "{\"e\":\"ORDER_TRADE_UPDATE\",\"o\":{\"s\":\"XRPUSDC\",\"S\":\"BUY\",\"X\":\"NEW\",\"i\":1,\"ps\":\"BOTH\"}}";
        assertEquals(BinanceStreamParser.ORDER_TRADE_UPDATE, parser.dispatch(frame, recorder));
        assertTrue(recorder.orders.isEmpty());
    }

    @Test
    @DisplayName("Listen key expiry is reported without a callback")
    void testListenKeyExpired() {
        assertEquals(BinanceStreamParser.LISTEN_KEY_EXPIRED,
                parser.dispatch("{\"stream\":\"abc\",\"data\":{\"e\":\"listenKeyExpired\",\"E\":1}}", recorder));
        assertTrue(recorder.tickers.isEmpty() && recorder.bars.isEmpty() && recorder.orders.isEmpty());
    }

    @Test
    @DisplayName("Garbage frames are ignored")
    void testGarbage() {
        assertNull(parser.dispatch("not json", recorder));
        assertNull(parser.dispatch("{\"result\":null,\"id\":1}", recorder));
    }
}
