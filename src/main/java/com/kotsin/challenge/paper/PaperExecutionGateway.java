package com.kotsin.challenge.paper;

import com.kotsin.challenge.broker.BrokerOrder;
import com.kotsin.challenge.broker.BrokerPosition;
import com.kotsin.challenge.broker.ExecutionGateway;
import com.kotsin.challenge.broker.Fill;
import com.kotsin.challenge.broker.OrderRejectedException;
import com.kotsin.challenge.broker.OrderRequest;
import com.kotsin.challenge.broker.OrderStatus;
import com.kotsin.challenge.broker.Quote;
import com.kotsin.challenge.broker.TransientBrokerException;
import com.kotsin.challenge.model.Direction;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory simulated venue. Market orders fill at the touch, resting limits fill at their
 * limit price once a quote trades through them. Used for paper trading and backtests.
 * <p>
 * Faults can be queued per operation name to exercise the engine's error paths.
 */
@Slf4j
public class PaperExecutionGateway implements ExecutionGateway {

    public enum Fault {
        /** Throws a transient error without touching venue state. */
        TRANSIENT,
        /** Applies the request, then reports a transient error as if the reply was lost. */
        ACCEPT_THEN_TIMEOUT,
        REJECT
    }

    private final Clock clock;
    private final Map<String, Quote> quotes = new LinkedHashMap<>();
    private final Map<String, PaperOrder> orders = new LinkedHashMap<>();
    private final Map<String, PaperPosition> positions = new LinkedHashMap<>();
    private final Map<String, Deque<Fault>> faults = new LinkedHashMap<>();
    private final AtomicLong orderSeq = new AtomicLong();
    private final AtomicLong positionSeq = new AtomicLong();
    private final List<String> callLog = new ArrayList<>();

    public PaperExecutionGateway(Clock clock) {
        this.clock = clock;
    }

    // ===== FEED =====

    public synchronized void updateQuote(Quote quote) {
        quotes.put(quote.symbol(), quote);
        for (PaperOrder order : orders.values()) {
            if (order.status == OrderStatus.OPEN && order.symbol.equals(quote.symbol()) && limitTouched(order, quote)) {
                openPosition(order, order.limitPrice);
            }
        }
    }

    public synchronized void updateQuote(String symbol, double bid, double ask) {
        updateQuote(new Quote(symbol, bid, ask, Math.max(bid, ask), Math.min(bid, ask), clock.instant()));
    }

    public synchronized void queueFault(String operation, Fault fault) {
        faults.computeIfAbsent(operation, k -> new ArrayDeque<>()).add(fault);
    }

    /** Adds a position the engine did not open, as if placed manually at the venue. */
    public synchronized String seedPosition(String symbol, Direction direction, double size, double openPrice, double stopLoss) {
        String handle = "P" + positionSeq.incrementAndGet();
        positions.put(handle, new PaperPosition(handle, symbol, direction, size, openPrice, stopLoss, clock.instant()));
        return handle;
    }

    public synchronized List<String> callLog() {
        return List.copyOf(callLog);
    }

    public synchronized Optional<BrokerPosition> position(String handle) {
        PaperPosition p = positions.get(handle);
        return p == null ? Optional.empty() : Optional.of(p.view());
    }

    // ===== CAPABILITY =====

    @Override
    public synchronized Quote currentPrice(String symbol) {
        Fault fault = before("currentPrice");
        Quote quote = quotes.get(symbol);
        if (quote == null) {
            throw new TransientBrokerException("no quote for " + symbol);
        }
        after(fault, "currentPrice");
        return quote;
    }

    @Override
    public synchronized Fill placeMarketOrder(OrderRequest request) {
        Fault fault = before("placeMarketOrder");
        Quote quote = quotes.get(request.symbol());
        if (quote == null) {
            throw new OrderRejectedException("market closed for " + request.symbol());
        }
        PaperOrder order = newOrder(request, 0.0);
        double price = request.direction() == Direction.LONG ? quote.ask() : quote.bid();
        PaperPosition position = openPosition(order, price);
        after(fault, "placeMarketOrder");
        return new Fill(order.orderId, position.handle, request.symbol(), price, request.size(), clock.instant());
    }

    @Override
    public synchronized String placeLimitOrder(OrderRequest request, double limitPrice) {
        Fault fault = before("placeLimitOrder");
        PaperOrder order = newOrder(request, limitPrice);
        Quote quote = quotes.get(request.symbol());
        if (quote != null && limitTouched(order, quote)) {
            openPosition(order, limitPrice);
        }
        after(fault, "placeLimitOrder");
        return order.orderId;
    }

    @Override
    public synchronized Fill partialClose(String positionHandle, double size) {
        Fault fault = before("partialClose");
        PaperPosition p = requirePosition(positionHandle);
        if (size <= 0 || size > p.size + 1e-9) {
            throw new OrderRejectedException("invalid close size " + size + " for " + positionHandle);
        }
        double price = exitPrice(p);
        p.size = Math.round((p.size - size) * 1e8) / 1e8;
        if (p.size <= 1e-9) {
            positions.remove(positionHandle);
        }
        after(fault, "partialClose");
        return new Fill(null, positionHandle, p.symbol, price, size, clock.instant());
    }

    @Override
    public synchronized Fill close(String positionHandle) {
        Fault fault = before("close");
        PaperPosition p = requirePosition(positionHandle);
        double price = exitPrice(p);
        positions.remove(positionHandle);
        after(fault, "close");
        return new Fill(null, positionHandle, p.symbol, price, p.size, clock.instant());
    }

    @Override
    public synchronized void modifyStop(String positionHandle, double newStop) {
        Fault fault = before("modifyStop");
        requirePosition(positionHandle).stopLoss = newStop;
        after(fault, "modifyStop");
    }

    @Override
    public synchronized List<BrokerPosition> listOpenPositions() {
        Fault fault = before("listOpenPositions");
        List<BrokerPosition> out = new ArrayList<>();
        positions.values().forEach(p -> out.add(p.view()));
        after(fault, "listOpenPositions");
        return out;
    }

    @Override
    public synchronized void cancelOrder(String orderId) {
        Fault fault = before("cancelOrder");
        PaperOrder order = orders.get(orderId);
        if (order == null) {
            throw new OrderRejectedException("unknown order " + orderId);
        }
        if (order.status == OrderStatus.OPEN) {
            order.status = OrderStatus.CANCELLED;
        }
        after(fault, "cancelOrder");
    }

    @Override
    public synchronized BrokerOrder orderStatus(String orderId) {
        Fault fault = before("orderStatus");
        PaperOrder order = orders.get(orderId);
        if (order == null) {
            throw new OrderRejectedException("unknown order " + orderId);
        }
        after(fault, "orderStatus");
        return order.view();
    }

    @Override
    public synchronized Optional<BrokerOrder> findOrderByClientId(String clientOrderId) {
        Fault fault = before("findOrderByClientId");
        Optional<BrokerOrder> found = orders.values().stream()
                .filter(o -> clientOrderId.equals(o.clientOrderId))
                .map(PaperOrder::view)
                .findFirst();
        after(fault, "findOrderByClientId");
        return found;
    }

    // ===== INTERNALS =====

    private Fault before(String operation) {
        callLog.add(operation);
        Deque<Fault> queue = faults.get(operation);
        Fault fault = queue == null ? null : queue.poll();
        if (fault == Fault.TRANSIENT) {
            throw new TransientBrokerException("simulated transient failure in " + operation);
        }
        if (fault == Fault.REJECT) {
            throw new OrderRejectedException("simulated rejection in " + operation);
        }
        return fault;
    }

    private void after(Fault fault, String operation) {
        if (fault == Fault.ACCEPT_THEN_TIMEOUT) {
            throw new TransientBrokerException("simulated lost reply in " + operation);
        }
    }

    private PaperOrder newOrder(OrderRequest request, double limitPrice) {
        PaperOrder order = new PaperOrder();
        order.orderId = "O" + orderSeq.incrementAndGet();
        order.clientOrderId = request.clientOrderId();
        order.symbol = request.symbol();
        order.direction = request.direction();
        order.size = request.size();
        order.limitPrice = limitPrice;
        order.stopLoss = request.stopPrice();
        order.status = OrderStatus.OPEN;
        orders.put(order.orderId, order);
        return order;
    }

    private PaperPosition openPosition(PaperOrder order, double price) {
        String handle = "P" + positionSeq.incrementAndGet();
        PaperPosition p = new PaperPosition(handle, order.symbol, order.direction, order.size, price, order.stopLoss, clock.instant());
        positions.put(handle, p);
        order.status = OrderStatus.FILLED;
        order.positionHandle = handle;
        order.fillPrice = price;
        log.debug("PAPER_FILL order={} symbol={} price={} size={}", order.orderId, order.symbol, price, order.size);
        return p;
    }

    private static boolean limitTouched(PaperOrder order, Quote quote) {
        return order.direction == Direction.LONG
                ? Math.min(quote.ask(), quote.low()) <= order.limitPrice
                : Math.max(quote.bid(), quote.high()) >= order.limitPrice;
    }

    private double exitPrice(PaperPosition p) {
        Quote quote = quotes.get(p.symbol);
        if (quote == null) {
            return p.openPrice;
        }
        return p.direction == Direction.LONG ? quote.bid() : quote.ask();
    }

    private PaperPosition requirePosition(String handle) {
        PaperPosition p = positions.get(handle);
        if (p == null) {
            throw new OrderRejectedException("unknown position " + handle);
        }
        return p;
    }

    private static final class PaperOrder {
        String orderId;
        String clientOrderId;
        String symbol;
        Direction direction;
        double size;
        double limitPrice;
        double stopLoss;
        OrderStatus status;
        String positionHandle;
        double fillPrice;

        BrokerOrder view() {
            return new BrokerOrder(orderId, clientOrderId, symbol, direction, size, limitPrice, status, positionHandle, fillPrice);
        }
    }

    private static final class PaperPosition {
        final String handle;
        final String symbol;
        final Direction direction;
        double size;
        final double openPrice;
        double stopLoss;
        final Instant openedAt;

        PaperPosition(String handle, String symbol, Direction direction, double size, double openPrice, double stopLoss, Instant openedAt) {
            this.handle = handle;
            this.symbol = symbol;
            this.direction = direction;
            this.size = size;
            this.openPrice = openPrice;
            this.stopLoss = stopLoss;
            this.openedAt = openedAt;
        }

        BrokerPosition view() {
            return new BrokerPosition(handle, symbol, direction, size, openPrice, stopLoss, openedAt);
        }
    }
}
