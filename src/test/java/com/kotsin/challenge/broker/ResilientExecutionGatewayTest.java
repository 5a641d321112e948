package com.kotsin.challenge.broker;

import com.kotsin.challenge.config.EngineProperties;
import com.kotsin.challenge.model.Direction;
import com.kotsin.challenge.paper.PaperExecutionGateway;
import com.kotsin.challenge.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ResilientExecutionGatewayTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-02T10:00:00Z"));
    private final List<Duration> sleeps = new ArrayList<>();
    private EngineProperties.Broker props;
    private PaperExecutionGateway venue;
    private ResilientExecutionGateway gateway;

    @BeforeEach
    void setUp() {
        props = new EngineProperties.Broker();
        props.setOrderPermitsPerSecond(10_000);
        venue = new PaperExecutionGateway(clock);
        venue.updateQuote("EURUSD", 1.1000, 1.1001);
        gateway = new ResilientExecutionGateway(venue, props, sleeps::add);
    }

    @AfterEach
    void tearDown() {
        gateway.close();
    }

    private long calls(String operation) {
        return venue.callLog().stream().filter(operation::equals).count();
    }

    @Test
    @DisplayName("Transient failures are retried with growing backoff")
    void retriesTransientFailures() {
        venue.queueFault("currentPrice", PaperExecutionGateway.Fault.TRANSIENT);
        venue.queueFault("currentPrice", PaperExecutionGateway.Fault.TRANSIENT);

        Quote quote = gateway.currentPrice("EURUSD");

        assertEquals(1.1000, quote.bid(), 1e-12);
        assertEquals(3, calls("currentPrice"));
        assertEquals(List.of(Duration.ofMillis(500), Duration.ofMillis(1000)), sleeps);
    }

    @Test
    @DisplayName("Gives up after max attempts")
    void givesUpAfterMaxAttempts() {
        for (int i = 0; i < 3; i++) {
            venue.queueFault("currentPrice", PaperExecutionGateway.Fault.TRANSIENT);
        }

        TransientBrokerException e = assertThrows(TransientBrokerException.class, () -> gateway.currentPrice("EURUSD"));

        assertTrue(e.getMessage().contains("after 3 attempts"));
        assertEquals(3, calls("currentPrice"));
    }

    @Test
    @DisplayName("Rejections are not retried")
    void rejectionsPropagateImmediately() {
        venue.queueFault("cancelOrder", PaperExecutionGateway.Fault.REJECT);

        assertThrows(OrderRejectedException.class, () -> gateway.cancelOrder("O1"));
        assertEquals(1, calls("cancelOrder"));
        assertTrue(sleeps.isEmpty());
    }

    @Test
    @DisplayName("Lost reply on a limit placement is recovered by client id, not resubmitted")
    void limitPlacementNotDuplicated() {
        venue.queueFault("placeLimitOrder", PaperExecutionGateway.Fault.ACCEPT_THEN_TIMEOUT);

        String orderId = gateway.placeLimitOrder(new OrderRequest("e1-L1", "EURUSD", Direction.LONG, 0.24, 1.0950), 1.0990);

        assertEquals("O1", orderId);
        assertEquals(1, calls("placeLimitOrder"));
        assertEquals(1, calls("findOrderByClientId"));
    }

    @Test
    @DisplayName("Lost reply on a market placement returns the existing fill")
    void marketPlacementNotDuplicated() {
        venue.queueFault("placeMarketOrder", PaperExecutionGateway.Fault.ACCEPT_THEN_TIMEOUT);

        Fill fill = gateway.placeMarketOrder(new OrderRequest("e1-M1", "EURUSD", Direction.LONG, 0.24, 1.0950));

        assertEquals(1.1001, fill.price(), 1e-12);
        assertNotNull(fill.positionHandle());
        assertEquals(1, venue.listOpenPositions().size());
        assertEquals(1, calls("placeMarketOrder"));
    }

    @Test
    @DisplayName("Market order left open at the venue is never placed a second time")
    void openMarketOrderNotResubmitted() {
        int[] marketCalls = {0};
        PaperExecutionGateway resting = new PaperExecutionGateway(clock) {
            @Override
            public synchronized Fill placeMarketOrder(OrderRequest request) {
                marketCalls[0]++;
                placeLimitOrder(request, 1.0500);
                throw new TransientBrokerException("reply lost");
            }
        };
        resting.updateQuote("EURUSD", 1.1000, 1.1001);
        OrderRequest request = new OrderRequest("e1-M1", "EURUSD", Direction.LONG, 0.24, 1.0950);

        try (ResilientExecutionGateway retrying = new ResilientExecutionGateway(resting, props, sleeps::add)) {
            TransientBrokerException e = assertThrows(TransientBrokerException.class, () -> retrying.placeMarketOrder(request));
            assertTrue(e.getCause().getMessage().contains("accepted but not filled"));
        }

        assertEquals(1, marketCalls[0]);
        assertEquals(OrderStatus.OPEN, resting.findOrderByClientId("e1-M1").orElseThrow().status());
        assertTrue(resting.listOpenPositions().isEmpty());
    }

    @Test
    @DisplayName("Market order the venue rejected may be placed again")
    void rejectedMarketOrderResubmitted() {
        int[] marketCalls = {0};
        PaperExecutionGateway flaky = new PaperExecutionGateway(clock) {
            @Override
            public synchronized Fill placeMarketOrder(OrderRequest request) {
                if (++marketCalls[0] == 1) {
                    String orderId = placeLimitOrder(request, 1.0500);
                    cancelOrder(orderId);
                    throw new TransientBrokerException("reply lost");
                }
                return super.placeMarketOrder(request);
            }
        };
        flaky.updateQuote("EURUSD", 1.1000, 1.1001);

        try (ResilientExecutionGateway retrying = new ResilientExecutionGateway(flaky, props, sleeps::add)) {
            Fill fill = retrying.placeMarketOrder(new OrderRequest("e1-M1", "EURUSD", Direction.LONG, 0.24, 1.0950));
            assertEquals(1.1001, fill.price(), 1e-12);
        }

        assertEquals(2, marketCalls[0]);
        assertEquals(1, flaky.listOpenPositions().size());
    }

    @Test
    @DisplayName("A hung venue call times out as a transient failure")
    void hungCallTimesOut() {
        props.setCallTimeout(Duration.ofMillis(50));
        props.setMaxAttempts(1);
        PaperExecutionGateway slow = new PaperExecutionGateway(clock) {
            @Override
            public List<BrokerPosition> listOpenPositions() {
                try {
                    Thread.sleep(5_000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return List.of();
            }
        };
        try (ResilientExecutionGateway timed = new ResilientExecutionGateway(slow, props, sleeps::add)) {
            TransientBrokerException e = assertThrows(TransientBrokerException.class, timed::listOpenPositions);
            assertTrue(e.getCause().getMessage().contains("timed out"));
        }
    }
}
