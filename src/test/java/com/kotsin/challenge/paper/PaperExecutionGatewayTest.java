package com.kotsin.challenge.paper;

import com.kotsin.challenge.broker.BrokerOrder;
import com.kotsin.challenge.broker.Fill;
import com.kotsin.challenge.broker.OrderRejectedException;
import com.kotsin.challenge.broker.OrderRequest;
import com.kotsin.challenge.broker.OrderStatus;
import com.kotsin.challenge.broker.TransientBrokerException;
import com.kotsin.challenge.model.Direction;
import com.kotsin.challenge.support.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class PaperExecutionGatewayTest {

    private final PaperExecutionGateway venue = new PaperExecutionGateway(new MutableClock(Instant.parse("2026-03-02T10:00:00Z")));

    @Test
    @DisplayName("Short market order fills at the bid and exits at the ask")
    void shortFillsAtBid() {
        venue.updateQuote("EURUSD", 1.1000, 1.1002);
        Fill fill = venue.placeMarketOrder(new OrderRequest("c1", "EURUSD", Direction.SHORT, 0.10, 1.1050));
        assertEquals(1.1000, fill.price(), 1e-12);

        Fill exit = venue.close(fill.positionHandle());
        assertEquals(1.1002, exit.price(), 1e-12);
        assertTrue(venue.listOpenPositions().isEmpty());
    }

    @Test
    @DisplayName("Limit rests until a quote trades through it, then fills at the limit")
    void limitFillsWhenTouched() {
        venue.updateQuote("EURUSD", 1.1010, 1.1011);
        String orderId = venue.placeLimitOrder(new OrderRequest("c1", "EURUSD", Direction.LONG, 0.20, 1.0950), 1.1000);
        assertEquals(OrderStatus.OPEN, venue.orderStatus(orderId).status());

        venue.updateQuote("EURUSD", 1.0998, 1.0999);

        BrokerOrder order = venue.orderStatus(orderId);
        assertEquals(OrderStatus.FILLED, order.status());
        assertEquals(1.1000, order.fillPrice(), 1e-12);
        assertEquals(0.20, venue.position(order.positionHandle()).orElseThrow().size(), 1e-12);
    }

    @Test
    @DisplayName("Partial close reduces size; closing more than held is rejected")
    void partialClose() {
        venue.updateQuote("EURUSD", 1.1000, 1.1001);
        String handle = venue.placeMarketOrder(new OrderRequest("c1", "EURUSD", Direction.LONG, 0.40, 1.0950)).positionHandle();

        venue.partialClose(handle, 0.08);

        assertEquals(0.32, venue.position(handle).orElseThrow().size(), 1e-12);
        assertThrows(OrderRejectedException.class, () -> venue.partialClose(handle, 0.50));
    }

    @Test
    @DisplayName("Unknown handles and orders are rejected")
    void unknownIdsRejected() {
        assertThrows(OrderRejectedException.class, () -> venue.close("P404"));
        assertThrows(OrderRejectedException.class, () -> venue.orderStatus("O404"));
        assertTrue(venue.findOrderByClientId("nope").isEmpty());
    }

    @Test
    @DisplayName("Queued faults fire once each")
    void faultsFireOnce() {
        venue.queueFault("currentPrice", PaperExecutionGateway.Fault.TRANSIENT);
        assertThrows(TransientBrokerException.class, () -> venue.currentPrice("EURUSD"));
        assertThrows(TransientBrokerException.class, () -> venue.currentPrice("EURUSD"), "no quote yet");

        venue.updateQuote("EURUSD", 1.1000, 1.1001);
        assertEquals(1.1001, venue.currentPrice("EURUSD").ask(), 1e-12);
    }
}
