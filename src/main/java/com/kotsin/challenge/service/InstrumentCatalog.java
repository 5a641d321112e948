package com.kotsin.challenge.service;

import com.kotsin.challenge.config.EngineProperties;
import com.kotsin.challenge.model.InstrumentSpec;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Contract specs per symbol. Configured entries win; otherwise metals, yen crosses and other
 * FX pairs get the venue's standard specs.
 */
@Service
@RequiredArgsConstructor
public class InstrumentCatalog {

    private final EngineProperties properties;
    private final Map<String, InstrumentSpec> cache = new ConcurrentHashMap<>();

    public InstrumentSpec spec(String symbol) {
        return cache.computeIfAbsent(symbol, this::resolve);
    }

    private InstrumentSpec resolve(String symbol) {
        EngineProperties.Instrument configured = properties.getInstruments().get(symbol);
        if (configured != null) {
            return new InstrumentSpec(symbol, configured.getPipSize(), configured.getPipValuePerLot(),
                    configured.getMinLot(), configured.getMaxLot(), configured.getLotStep());
        }
        String s = symbol.toUpperCase(Locale.ROOT);
        if (s.startsWith("XAU")) {
            return new InstrumentSpec(symbol, 0.01, 1.0, 0.01, 100.0, 0.01);
        }
        if (s.contains("JPY")) {
            return new InstrumentSpec(symbol, 0.01, 10.0, 0.01, 100.0, 0.01);
        }
        return new InstrumentSpec(symbol, 0.0001, 10.0, 0.01, 100.0, 0.01);
    }
}
