package com.kotsin.challenge.service;

import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One lock per symbol. Every transition that creates, promotes or fills an entry runs under it.
 */
@Component
public class SymbolLockRegistry {

    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public ReentrantLock lockFor(String symbol) {
        return locks.computeIfAbsent(symbol, k -> new ReentrantLock());
    }
}
