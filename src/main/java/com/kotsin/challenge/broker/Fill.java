package com.kotsin.challenge.broker;

import java.time.Instant;

public record Fill(String orderId, String positionHandle, String symbol, double price, double size, Instant time) {
}
