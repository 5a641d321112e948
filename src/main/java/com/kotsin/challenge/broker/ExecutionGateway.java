package com.kotsin.challenge.broker;

import java.util.List;
import java.util.Optional;

/**
 * Venue capability the engine trades through. Live and simulated venues are two
 * implementations of this interface.
 * <p>
 * Every method throws {@link TransientBrokerException} for retryable failures and
 * {@link OrderRejectedException} when the venue refuses the request.
 */
public interface ExecutionGateway {

    Quote currentPrice(String symbol) throws BrokerException;

    Fill placeMarketOrder(OrderRequest request) throws BrokerException;

    /**
     * Places a resting limit order and returns the venue order id.
     */
    String placeLimitOrder(OrderRequest request, double limitPrice) throws BrokerException;

    Fill partialClose(String positionHandle, double size) throws BrokerException;

    Fill close(String positionHandle) throws BrokerException;

    void modifyStop(String positionHandle, double newStop) throws BrokerException;

    /**
     * Open positions at the venue. Only used for startup reconciliation.
     */
    List<BrokerPosition> listOpenPositions() throws BrokerException;

    void cancelOrder(String orderId) throws BrokerException;

    BrokerOrder orderStatus(String orderId) throws BrokerException;

    /**
     * Looks an order up by the id the engine sent with it. Empty if the venue never received it.
     */
    Optional<BrokerOrder> findOrderByClientId(String clientOrderId) throws BrokerException;
}
