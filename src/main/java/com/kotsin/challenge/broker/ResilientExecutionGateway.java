package com.kotsin.challenge.broker;

import com.google.common.util.concurrent.RateLimiter;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.kotsin.challenge.config.EngineProperties;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Wraps a venue with a hard per-call timeout, bounded retry of transient failures and an
 * order rate limit.
 * <p>
 * Placements are never blindly resubmitted: before each retry the venue is asked whether it
 * already holds an order with the same client id.
 */
@Slf4j
public class ResilientExecutionGateway implements ExecutionGateway, AutoCloseable {

    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final ExecutionGateway delegate;
    private final EngineProperties.Broker props;
    private final RateLimiter orderLimiter;
    private final Sleeper sleeper;
    private final ExecutorService executor;

    public ResilientExecutionGateway(ExecutionGateway delegate, EngineProperties.Broker props) {
        this(delegate, props, d -> Thread.sleep(d.toMillis()));
    }

    public ResilientExecutionGateway(ExecutionGateway delegate, EngineProperties.Broker props, Sleeper sleeper) {
        this.delegate = delegate;
        this.props = props;
        this.sleeper = sleeper;
        this.orderLimiter = RateLimiter.create(props.getOrderPermitsPerSecond());
        this.executor = Executors.newCachedThreadPool(new ThreadFactoryBuilder()
                .setNameFormat("venue-call-%d")
                .setDaemon(true)
                .build());
    }

    @Override
    public Quote currentPrice(String symbol) {
        return withRetry("currentPrice " + symbol, () -> delegate.currentPrice(symbol));
    }

    @Override
    public Fill placeMarketOrder(OrderRequest request) {
        acquireOrderPermit(request.symbol());
        return withRetry("placeMarketOrder " + request.clientOrderId(), new Callable<>() {
            private boolean first = true;

            @Override
            public Fill call() {
                if (!first) {
                    Optional<BrokerOrder> existing = liveOrder(request.clientOrderId());
                    if (existing.isPresent()) {
                        BrokerOrder o = existing.get();
                        if (o.status() != OrderStatus.FILLED) {
                            // The venue took the order; a second one would double the exposure
                            throw new TransientBrokerException("market order " + request.clientOrderId() + " is "
                                    + o.status() + " at the venue, accepted but not filled; reconcile by client id");
                        }
                        log.info("PLACEMENT_RECOVERED clientOrderId={} orderId={}", request.clientOrderId(), o.orderId());
                        return new Fill(o.orderId(), o.positionHandle(), o.symbol(), o.fillPrice(), o.size(), null);
                    }
                }
                first = false;
                return delegate.placeMarketOrder(request);
            }
        });
    }

    @Override
    public String placeLimitOrder(OrderRequest request, double limitPrice) {
        acquireOrderPermit(request.symbol());
        return withRetry("placeLimitOrder " + request.clientOrderId(), new Callable<>() {
            private boolean first = true;

            @Override
            public String call() {
                if (!first) {
                    Optional<BrokerOrder> existing = liveOrder(request.clientOrderId());
                    if (existing.isPresent()) {
                        log.info("PLACEMENT_RECOVERED clientOrderId={} orderId={}", request.clientOrderId(), existing.get().orderId());
                        return existing.get().orderId();
                    }
                }
                first = false;
                return delegate.placeLimitOrder(request, limitPrice);
            }
        });
    }

    /** The venue's order for a client id, unless it was rejected or cancelled and may be placed again. */
    private Optional<BrokerOrder> liveOrder(String clientOrderId) {
        return delegate.findOrderByClientId(clientOrderId)
                .filter(o -> o.status() != OrderStatus.REJECTED && o.status() != OrderStatus.CANCELLED);
    }

    @Override
    public Fill partialClose(String positionHandle, double size) {
        acquireOrderPermit(positionHandle);
        return withRetry("partialClose " + positionHandle, () -> delegate.partialClose(positionHandle, size));
    }

    @Override
    public Fill close(String positionHandle) {
        acquireOrderPermit(positionHandle);
        return withRetry("close " + positionHandle, () -> delegate.close(positionHandle));
    }

    @Override
    public void modifyStop(String positionHandle, double newStop) {
        withRetry("modifyStop " + positionHandle, () -> {
            delegate.modifyStop(positionHandle, newStop);
            return null;
        });
    }

    @Override
    public List<BrokerPosition> listOpenPositions() {
        return withRetry("listOpenPositions", delegate::listOpenPositions);
    }

    @Override
    public void cancelOrder(String orderId) {
        withRetry("cancelOrder " + orderId, () -> {
            delegate.cancelOrder(orderId);
            return null;
        });
    }

    @Override
    public BrokerOrder orderStatus(String orderId) {
        return withRetry("orderStatus " + orderId, () -> delegate.orderStatus(orderId));
    }

    @Override
    public Optional<BrokerOrder> findOrderByClientId(String clientOrderId) {
        return withRetry("findOrderByClientId " + clientOrderId, () -> delegate.findOrderByClientId(clientOrderId));
    }

    <T> T withRetry(String operation, Callable<T> call) {
        int maxAttempts = Math.max(1, props.getMaxAttempts());
        TransientBrokerException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return callWithTimeout(operation, call);
            } catch (TransientBrokerException e) {
                last = e;
                log.warn("VENUE_RETRY op={} attempt={}/{} reason={}", operation, attempt, maxAttempts, e.getMessage());
                if (attempt < maxAttempts) {
                    pause(props.getBackoff().multipliedBy(attempt), operation);
                }
            }
        }
        throw new TransientBrokerException(operation + " failed after " + maxAttempts + " attempts", last);
    }

    private <T> T callWithTimeout(String operation, Callable<T> call) {
        Future<T> future = executor.submit(call);
        try {
            return future.get(props.getCallTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new TransientBrokerException(operation + " timed out after " + props.getCallTimeout(), e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new TransientBrokerException(operation + " interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof BrokerException be) {
                throw be;
            }
            throw new BrokerException(operation + " failed: " + cause.getMessage(), cause);
        }
    }

    private void acquireOrderPermit(String key) {
        if (!orderLimiter.tryAcquire(props.getPermitTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
            log.error("ORDER_RATE_LIMIT key={} rate={}/s", key, orderLimiter.getRate());
            throw new TransientBrokerException("order rate limit timeout for " + key);
        }
    }

    private void pause(Duration duration, String operation) {
        try {
            sleeper.sleep(duration);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientBrokerException(operation + " interrupted during backoff", e);
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
