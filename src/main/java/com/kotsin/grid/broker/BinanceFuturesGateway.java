package com.kotsin.grid.broker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kotsin.grid.config.BinanceProps;
import com.kotsin.grid.config.GridProps;
import com.kotsin.grid.model.KlineBar;
import com.kotsin.grid.model.OpenOrder;
import com.kotsin.grid.model.OrderSide;
import com.kotsin.grid.model.OrderStatus;
import com.kotsin.grid.model.OrderType;
import com.kotsin.grid.model.PositionSide;
import com.kotsin.grid.model.PositionSnapshot;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.springframework.stereotype.Service;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Binance USDⓈ-M futures adapter. Signed REST calls over OkHttp, hedge mode only.
 */
@Service
@Slf4j
public class BinanceFuturesGateway implements MarketGateway {

    private static final MediaType FORM = MediaType.parse("application/x-www-form-urlencoded");
    private static final String API_KEY_HEADER = "X-MBX-APIKEY";

    private final BinanceProps props;
    private final String symbol;
    private final int leverage;
    private final OkHttpClient http;
    private final ObjectMapper mapper = new ObjectMapper();

    // Metrics --------------------------------------------
    private final Counter requestTotal;
    private final Counter requestFailed;
    private final Timer requestLatency;

    private volatile SymbolPrecision precision;

    public BinanceFuturesGateway(BinanceProps props,
                                 GridProps gridProps,
                                 OkHttpClient exchangeHttpClient,
                                 MeterRegistry registry) {
        this.props = props;
        this.symbol = gridProps.symbol();
        this.leverage = gridProps.leverage();
        this.http = exchangeHttpClient;
        this.requestTotal = registry.counter("grid.gateway.requests.total");
        this.requestFailed = registry.counter("grid.gateway.requests.failed");
        this.requestLatency = registry.timer("grid.gateway.requests.latency");
    }

    // ---------------------------------------------------------------------
    // Startup
    // ---------------------------------------------------------------------
    @Override
    public void initialize() {
        this.precision = loadPrecision();
        ensureHedgeMode();
        try {
            Map<String, String> params = new LinkedHashMap<>();
            params.put("symbol", symbol);
            params.put("leverage", String.valueOf(leverage));
            signedRequest("POST", "/fapi/v1/leverage", params);
            log.info("LEVERAGE_SET symbol={} leverage={}", symbol, leverage);
        } catch (GatewayException e) {
            // keep whatever leverage the account already has
            log.warn("LEVERAGE_SET_FAILED symbol={} leverage={} error={}", symbol, leverage, e.getMessage());
        }
    }

    private SymbolPrecision loadPrecision() {
        JsonNode info = publicRequest("/fapi/v1/exchangeInfo", Map.of());
        for (JsonNode s : info.path("symbols")) {
            if (!symbol.equals(s.path("symbol").asText())) continue;
            String tick = null, step = null, minQty = null;
            for (JsonNode f : s.path("filters")) {
                switch (f.path("filterType").asText()) {
                    case "PRICE_FILTER" -> tick = f.path("tickSize").asText();
                    case "LOT_SIZE" -> {
                        step = f.path("stepSize").asText();
                        minQty = f.path("minQty").asText();
                    }
                    default -> { }
                }
            }
            if (tick == null || step == null) {
                throw new GatewayException("Precision filters missing for " + symbol);
            }
            SymbolPrecision p = SymbolPrecision.of(tick, step, minQty == null ? step : minQty);
            log.info("PRECISION_LOADED symbol={} tick={} step={} minQty={}", symbol, p.tickSize(), p.stepSize(), p.minQty());
            return p;
        }
        throw new GatewayException("Symbol " + symbol + " not listed on futures exchange");
    }

    private void ensureHedgeMode() {
        if (isDualSidePosition()) {
            log.info("HEDGE_MODE_CONFIRMED symbol={}", symbol);
            return;
        }
        log.warn("HEDGE_MODE_OFF enabling dual-side position mode");
        signedRequest("POST", "/fapi/v1/positionSide/dual", Map.of("dualSidePosition", "true"));
        if (!isDualSidePosition()) {
            throw new GatewayException("Account is not in hedge mode and could not be switched");
        }
    }

    private boolean isDualSidePosition() {
        return signedRequest("GET", "/fapi/v1/positionSide/dual", Map.of()).path("dualSidePosition").asBoolean(false);
    }

    // ---------------------------------------------------------------------
    // Orders
    // ---------------------------------------------------------------------
    @Override
    public String placeOrder(OrderSide side, Double price, double quantity, boolean reduceOnly,
                             PositionSide positionSide, OrderType type) {
        if (type == OrderType.LIMIT && (price == null || price <= 0)) {
            throw new GatewayException("LIMIT order requires a positive price");
        }
        SymbolPrecision p = requirePrecision();
        Map<String, String> params = new LinkedHashMap<>();
        params.put("symbol", symbol);
        params.put("side", side.name());
        params.put("positionSide", positionSide.name());
        params.put("type", type.name());
        params.put("quantity", p.formatQuantity(quantity));
        if (type == OrderType.LIMIT) {
            params.put("price", p.formatPrice(price));
            params.put("timeInForce", "GTC");
        }
        // Hedge mode rejects reduceOnly; side + positionSide already make a closing order reduce-only.
        params.put("newClientOrderId", "grid_" + UUID.randomUUID().toString().replace("-", "").substring(0, 24));

        JsonNode res = signedRequest("POST", "/fapi/v1/order", params);
        String orderId = res.path("orderId").asText(null);
        if (orderId == null || orderId.isBlank()) {
            throw new GatewayException("Order response without orderId: " + res);
        }
        log.info("ORDER_PLACED id={} side={} positionSide={} type={} price={} qty={} reduceOnly={}",
                orderId, side, positionSide, type, params.get("price"), params.get("quantity"), reduceOnly);
        return orderId;
    }

    @Override
    public void cancelOrder(String orderId) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("symbol", symbol);
        params.put("orderId", orderId);
        signedRequest("DELETE", "/fapi/v1/order", params);
        log.info("ORDER_CANCELED id={}", orderId);
    }

    @Override
    public List<OpenOrder> fetchOpenOrders() {
        JsonNode arr = signedRequest("GET", "/fapi/v1/openOrders", Map.of("symbol", symbol));
        List<OpenOrder> out = new ArrayList<>();
        for (JsonNode n : arr) {
            OpenOrder o = toOpenOrder(n);
            if (o != null) out.add(o);
        }
        return out;
    }

    @Override
    public OpenOrder fetchOrder(String orderId) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("symbol", symbol);
        params.put("orderId", orderId);
        OpenOrder o = toOpenOrder(signedRequest("GET", "/fapi/v1/order", params));
        if (o == null) throw new GatewayException("Order " + orderId + " has no hedge position side");
        return o;
    }

    OpenOrder toOpenOrder(JsonNode n) {
        PositionSide positionSide = parsePositionSide(n.path("positionSide").asText());
        if (positionSide == null) {
            log.warn("ORDER_SKIPPED_ONE_WAY id={} positionSide={}", n.path("orderId").asText(), n.path("positionSide").asText());
            return null;
        }
        OrderSide side = OrderSide.valueOf(n.path("side").asText().toUpperCase(Locale.ROOT));
        boolean closing = side == positionSide.closingSide();
        return OpenOrder.builder()
                .orderId(n.path("orderId").asText())
                .clientOrderId(n.path("clientOrderId").asText(null))
                .side(side)
                .positionSide(positionSide)
                .type("MARKET".equalsIgnoreCase(n.path("type").asText()) ? OrderType.MARKET : OrderType.LIMIT)
                .reduceOnly(n.path("reduceOnly").asBoolean(false) || closing)
                .price(n.path("price").asDouble())
                .origQty(n.path("origQty").asDouble())
                .executedQty(n.path("executedQty").asDouble())
                .status(OrderStatus.fromExchange(n.path("status").asText()))
                .updateTime(n.path("updateTime").asLong())
                .build();
    }

    static PositionSide parsePositionSide(String raw) {
        if ("LONG".equalsIgnoreCase(raw)) return PositionSide.LONG;
        if ("SHORT".equalsIgnoreCase(raw)) return PositionSide.SHORT;
        return null;
    }

    // ---------------------------------------------------------------------
    // Market / account data
    // ---------------------------------------------------------------------
    @Override
    public PositionSnapshot fetchPosition() {
        JsonNode arr = signedRequest("GET", "/fapi/v2/positionRisk", Map.of("symbol", symbol));
        double longQty = 0.0, shortQty = 0.0;
        for (JsonNode n : arr) {
            if (!symbol.equals(n.path("symbol").asText())) continue;
            PositionSide ps = parsePositionSide(n.path("positionSide").asText());
            double amt = Math.abs(n.path("positionAmt").asDouble());
            if (ps == PositionSide.LONG) longQty = amt;
            else if (ps == PositionSide.SHORT) shortQty = amt;
        }
        return new PositionSnapshot(longQty, shortQty);
    }

    @Override
    public double fetchTicker() {
        double price = publicRequest("/fapi/v1/ticker/price", Map.of("symbol", symbol)).path("price").asDouble();
        if (price <= 0) throw new GatewayException("Ticker returned non-positive price for " + symbol);
        return price;
    }

    @Override
    public List<KlineBar> fetchKlines(String timeframe, int limit) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("symbol", symbol);
        params.put("interval", timeframe);
        params.put("limit", String.valueOf(limit));
        JsonNode arr = publicRequest("/fapi/v1/klines", params);
        List<KlineBar> bars = new ArrayList<>(arr.size());
        for (JsonNode k : arr) {
            bars.add(KlineBar.of(Instant.ofEpochMilli(k.get(0).asLong()),
                    k.get(1).asDouble(), k.get(2).asDouble(), k.get(3).asDouble(),
                    k.get(4).asDouble(), k.get(5).asDouble()));
        }
        return bars;
    }

    @Override
    public double roundPrice(double price) {
        SymbolPrecision p = precision;
        return p == null ? price : p.roundPrice(price);
    }

    @Override
    public double roundQuantity(double quantity) {
        SymbolPrecision p = precision;
        return p == null ? quantity : p.roundQuantity(quantity);
    }

    // ---------------------------------------------------------------------
    // User data stream
    // ---------------------------------------------------------------------
    @Override
    public String openUserDataStream() {
        String key = apiKeyRequest("POST", "/fapi/v1/listenKey", Map.of()).path("listenKey").asText(null);
        if (key == null || key.isBlank()) throw new GatewayException("listenKey missing in response");
        log.info("LISTEN_KEY_OPENED");
        return key;
    }

    @Override
    public void keepAliveUserDataStream(String listenKey) {
        apiKeyRequest("PUT", "/fapi/v1/listenKey", Map.of("listenKey", listenKey));
        log.debug("LISTEN_KEY_KEPT_ALIVE");
    }

    // ---------------------------------------------------------------------
    // HTTP helpers
    // ---------------------------------------------------------------------
    private SymbolPrecision requirePrecision() {
        SymbolPrecision p = precision;
        if (p == null) throw new GatewayException("Gateway not initialized: precision unknown");
        return p;
    }

    private JsonNode publicRequest(String path, Map<String, String> params) {
        String query = buildQueryString(params);
        String url = props.restBaseUrl() + path + (query.isEmpty() ? "" : "?" + query);
        return execute(new Request.Builder().url(url).get().build());
    }

    private JsonNode apiKeyRequest(String method, String path, Map<String, String> params) {
        String query = buildQueryString(params);
        String url = props.restBaseUrl() + path + (query.isEmpty() ? "" : "?" + query);
        Request.Builder b = new Request.Builder().url(url).header(API_KEY_HEADER, requireApiKey());
        return execute(withMethod(b, method).build());
    }

    private JsonNode signedRequest(String method, String path, Map<String, String> params) {
        Map<String, String> all = new LinkedHashMap<>(params);
        all.put("recvWindow", String.valueOf(props.recvWindow()));
        all.put("timestamp", String.valueOf(System.currentTimeMillis()));
        String query = buildQueryString(all);
        String url = props.restBaseUrl() + path + "?" + query + "&signature=" + sign(query);
        Request.Builder b = new Request.Builder().url(url).header(API_KEY_HEADER, requireApiKey());
        return execute(withMethod(b, method).build());
    }

    private static Request.Builder withMethod(Request.Builder b, String method) {
        return switch (method) {
            case "GET" -> b.get();
            case "POST" -> b.post(RequestBody.create("", FORM));
            case "PUT" -> b.put(RequestBody.create("", FORM));
            case "DELETE" -> b.delete();
            default -> throw new IllegalArgumentException("Unsupported method " + method);
        };
    }

    private JsonNode execute(Request req) {
        long start = System.nanoTime();
        requestTotal.increment();
        try (Response res = http.newCall(req).execute()) {
            String body = res.body() != null ? res.body().string() : "";
            if (!res.isSuccessful()) {
                requestFailed.increment();
                throw new GatewayException(describeError(req, res.code(), body));
            }
            return body.isBlank() ? mapper.createObjectNode() : mapper.readTree(body);
        } catch (IOException e) {
            requestFailed.increment();
            throw new GatewayException(req.method() + " " + req.url().encodedPath() + " failed", e);
        } finally {
            requestLatency.record(System.nanoTime() - start, TimeUnit.NANOSECONDS);
        }
    }

    private String describeError(Request req, int httpCode, String body) {
        try {
            JsonNode err = mapper.readTree(body);
            return String.format("%s %s -> HTTP %d code=%s msg=%s", req.method(), req.url().encodedPath(),
                    httpCode, err.path("code").asText(), err.path("msg").asText());
        } catch (IOException e) {
            return req.method() + " " + req.url().encodedPath() + " -> HTTP " + httpCode + ": " + body;
        }
    }

    private String requireApiKey() {
        if (props.apiKey() == null || props.apiKey().isBlank()) {
            throw new GatewayException("binance.api-key is not configured");
        }
        return props.apiKey();
    }

    private String sign(String payload) {
        if (props.apiSecret() == null || props.apiSecret().isBlank()) {
            throw new GatewayException("binance.api-secret is not configured");
        }
        return hmacSha256Hex(props.apiSecret(), payload);
    }

    static String hmacSha256Hex(String secret, String payload) {
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
            byte[] raw = mac.doFinal(payload.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder(raw.length * 2);
            for (byte b : raw) sb.append(String.format("%02x", b));
            return sb.toString();
        } catch (Exception e) {
            throw new GatewayException("Failed to sign request", e);
        }
    }

    static String buildQueryString(Map<String, String> params) {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, String> e : params.entrySet()) {
            if (sb.length() > 0) sb.append('&');
            sb.append(e.getKey()).append('=').append(URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8));
        }
        return sb.toString();
    }
}
