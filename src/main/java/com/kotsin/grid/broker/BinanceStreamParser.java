package com.kotsin.grid.broker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kotsin.grid.model.BookTicker;
import com.kotsin.grid.model.KlineBar;
import com.kotsin.grid.model.OrderSide;
import com.kotsin.grid.model.OrderStatus;
import com.kotsin.grid.model.OrderType;
import com.kotsin.grid.model.OrderUpdateEvent;
import com.kotsin.grid.model.PositionSide;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Instant;
import java.util.Locale;

/**
 * Decodes combined-stream frames ({"stream":..,"data":{..}}) and hands the
 * payload to a {@link MarketEventListener}.
 */
@Component
@Slf4j
public class BinanceStreamParser {

    public static final String BOOK_TICKER = "bookTicker";
    public static final String KLINE = "kline";
    public static final String ORDER_TRADE_UPDATE = "ORDER_TRADE_UPDATE";
    public static final String LISTEN_KEY_EXPIRED = "listenKeyExpired";

    private final ObjectMapper mapper = new ObjectMapper();

    /**
     * @return the event type ("e") of the frame, or null when it could not be read
     */
    public String dispatch(String text, MarketEventListener listener) {
        JsonNode root;
        try {
            root = mapper.readTree(text);
        } catch (IOException e) {
            log.warn("STREAM_FRAME_UNREADABLE error={}", e.getMessage());
            return null;
        }
        JsonNode data = root.has("data") ? root.get("data") : root;
        String type = data.path("e").asText(null);
        if (type == null) return null;

        switch (type) {
            case BOOK_TICKER -> listener.onBookTicker(toBookTicker(data));
            case KLINE -> {
                JsonNode k = data.path("k");
                listener.onKline(toKlineBar(k), k.path("x").asBoolean(false));
            }
            case ORDER_TRADE_UPDATE -> {
                OrderUpdateEvent event = toOrderUpdate(data.path("o"));
                if (event != null) listener.onOrderUpdate(event);
            }
            default -> log.debug("STREAM_EVENT_IGNORED type={}", type);
        }
        return type;
    }

    BookTicker toBookTicker(JsonNode d) {
        return new BookTicker(d.path("s").asText(), d.path("b").asDouble(), d.path("a").asDouble(), d.path("E").asLong());
    }

    KlineBar toKlineBar(JsonNode k) {
        return KlineBar.of(Instant.ofEpochMilli(k.path("t").asLong()),
                k.path("o").asDouble(), k.path("h").asDouble(), k.path("l").asDouble(),
                k.path("c").asDouble(), k.path("v").asDouble());
    }

    OrderUpdateEvent toOrderUpdate(JsonNode o) {
        PositionSide positionSide = BinanceFuturesGateway.parsePositionSide(o.path("ps").asText());
        if (positionSide == null) {
            log.debug("ORDER_UPDATE_IGNORED one-way order id={}", o.path("i").asText());
            return null;
        }
        OrderSide side = OrderSide.valueOf(o.path("S").asText().toUpperCase(Locale.ROOT));
        return OrderUpdateEvent.builder()
                .symbol(o.path("s").asText())
                .orderId(o.path("i").asText())
                .clientOrderId(o.path("c").asText(null))
                .side(side)
                .positionSide(positionSide)
                .type("MARKET".equalsIgnoreCase(o.path("o").asText()) ? OrderType.MARKET : OrderType.LIMIT)
                .status(OrderStatus.fromExchange(o.path("X").asText()))
                .reduceOnly(o.path("R").asBoolean(false) || side == positionSide.closingSide())
                .price(o.path("p").asDouble())
                .origQty(o.path("q").asDouble())
                .filledQty(o.path("z").asDouble())
                .lastFillPrice(o.path("L").asDouble())
                .avgPrice(o.path("ap").asDouble())
                .eventTime(o.path("T").asLong())
                .build();
    }
}
