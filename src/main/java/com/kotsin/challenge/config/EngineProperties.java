package com.kotsin.challenge.config;

import com.kotsin.challenge.model.TakeProfitLevel;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * All engine tunables, bound from {@code engine.*}. Field initializers are the production defaults,
 * so {@code new EngineProperties()} is a complete configuration.
 */
@Data
@ConfigurationProperties(prefix = "engine")
public class EngineProperties {

    private Entry entry = new Entry();
    private Sizing sizing = new Sizing();
    private Exits exits = new Exits();
    private Drawdown drawdown = new Drawdown();
    private Weekend weekend = new Weekend();
    private Broker broker = new Broker();
    private Account account = new Account();
    private Map<String, Instrument> instruments = new HashMap<>();
    private State state = new State();
    private Events events = new Events();
    private Tick tick = new Tick();
    private Kafka kafka = new Kafka();

    @Data
    public static class Entry {
        /** At or below this R-distance the entry fills at market. */
        private double immediateThresholdR = 0.05;
        /** At or below this R-distance a resting limit order is placed. */
        private double proximityThresholdR = 0.3;
        private Duration maxWait = Duration.ofHours(120);
        private Duration spreadRetryMaxWait = Duration.ofHours(120);
        private boolean cancelBeyondMaxDistance = false;
        private double maxDistanceR = 1.5;
        private Duration pendingOrderExpiry = Duration.ofHours(24);
        private boolean cancelPendingOnStopBreach = true;
        private boolean blockWhilePositionOpen = true;
        private double defaultMaxSpreadPips = 3.0;
        private Map<String, Double> maxSpreadPips = new HashMap<>();

        public double maxSpreadPipsFor(String symbol) {
            return maxSpreadPips.getOrDefault(symbol, defaultMaxSpreadPips);
        }
    }

    @Data
    public static class Sizing {
        /** Fraction of balance risked per trade before multipliers (0.006 = 0.6 %). */
        private double baseRiskFraction = 0.006;

        private double confluenceBaseScore = 4.0;
        private double confluenceStep = 0.15;
        private double confluenceMin = 0.6;
        private double confluenceMax = 1.5;

        private double winStreakStep = 0.05;
        private double lossStreakStep = 0.10;
        private double streakMin = 0.5;
        private double streakMax = 1.25;

        private double riskSanityMultiple = 2.0;
        private int maxOpenPositions = 7;
        private boolean portfolioRiskCapEnabled = false;
        private double maxPortfolioRiskFraction = 0.05;
        /** Positions opened per trading day; 0 disables. */
        private int maxTradesPerDay = 10;

        // Profit versus the initial balance at which risk drops to the ultra-safe fraction
        private double profitUltraSafeThresholdPct = 9.0;
        private double ultraSafeRiskFraction = 0.0025;
    }

    @Data
    public static class Exits {
        private List<TakeProfitLevel> defaultLevels = new ArrayList<>(List.of(
                new TakeProfitLevel(0.6, 0.35),
                new TakeProfitLevel(1.2, 0.30),
                new TakeProfitLevel(2.0, 0.35)));
        /** Stop after level n (n greater than 1) goes to level n-1 target plus this many R. */
        private double ratchetBufferR = 0.5;
        /** After TP1 and before TP2, reaching this R moves the stop to the TP1 price. 0 disables. */
        private double progressiveTrailTriggerR = 0.9;
        private double fractionTolerance = 1e-6;
    }

    @Data
    public static class Drawdown {
        // Percent of the day start baseline
        private double dailyWarningPct = 2.0;
        private double dailyReducePct = 3.0;
        private double dailyHaltPct = 3.5;
        private double reduceRiskMultiplier = 0.67;

        // Percent of the initial balance
        private double totalWarningPct = 5.0;
        private double totalEmergencyPct = 9.5;
        private double totalStopOutPct = 10.0;
        private double totalWarningRiskMultiplier = 0.5;

        private String rolloverZone = "UTC";
        private LocalTime rolloverTime = LocalTime.MIDNIGHT;
        private Duration warningCooldown = Duration.ofMinutes(5);
    }

    /**
     * Friday handling of positions that would be exposed to the weekend gap. Crypto trades
     * through the weekend and is never touched.
     */
    @Data
    public static class Weekend {
        private boolean enabled = true;
        private String zone = "UTC";
        private DayOfWeek reviewDay = DayOfWeek.FRIDAY;
        private int reviewHour = 16;

        // Close everything from this hour when the day is already down this much
        private int closeHour = 22;
        private double closeDddThresholdPct = 2.0;

        private double takeProfitAboveR = 1.6;
        private double reduceBelowR = 0.5;
        private double reduceFraction = 0.5;
        private int maxPerGroup = 2;
        private int maxTotalHeld = 5;

        private List<String> cryptoSymbols = new ArrayList<>(List.of("BTCUSD", "ETHUSD", "XRPUSD", "ADAUSD"));

        /** First listed group wins for a symbol in several. */
        private Map<String, List<String>> correlationGroups = defaultGroups();

        private static Map<String, List<String>> defaultGroups() {
            Map<String, List<String>> groups = new LinkedHashMap<>();
            groups.put("USD_MAJORS", List.of("EURUSD", "GBPUSD", "AUDUSD", "NZDUSD"));
            groups.put("USD_INVERSE", List.of("USDJPY", "USDCHF", "USDCAD"));
            groups.put("EUR_CROSSES", List.of("EURGBP", "EURJPY", "EURCHF", "EURAUD", "EURCAD", "EURNZD"));
            groups.put("GBP_CROSSES", List.of("GBPJPY", "GBPCHF", "GBPAUD", "GBPCAD", "GBPNZD"));
            groups.put("JPY_CROSSES", List.of("AUDJPY", "NZDJPY", "CADJPY", "CHFJPY", "EURJPY", "GBPJPY"));
            groups.put("COMMODITY_FX", List.of("AUDNZD", "AUDCHF", "AUDCAD", "NZDCHF", "NZDCAD", "CADCHF"));
            groups.put("METALS", List.of("XAUUSD", "XAGUSD"));
            groups.put("US_INDICES", List.of("SPX500USD", "NAS100USD"));
            groups.put("OTHER_INDICES", List.of("UK100USD"));
            groups.put("CRYPTO_MAJOR", List.of("BTCUSD", "ETHUSD"));
            groups.put("CRYPTO_ALT", List.of("XRPUSD", "ADAUSD"));
            return groups;
        }

        public boolean isCrypto(String symbol) {
            return cryptoSymbols.contains(symbol);
        }

        public String groupOf(String symbol) {
            return correlationGroups.entrySet().stream()
                    .filter(e -> e.getValue().contains(symbol))
                    .map(Map.Entry::getKey)
                    .findFirst()
                    .orElse("UNCORRELATED");
        }
    }

    @Data
    public static class Broker {
        private Duration callTimeout = Duration.ofSeconds(10);
        private int maxAttempts = 3;
        private Duration backoff = Duration.ofMillis(500);
        private double orderPermitsPerSecond = 10.0;
        private Duration permitTimeout = Duration.ofSeconds(5);
    }

    @Data
    public static class Account {
        private double initialBalance = 20_000.0;
    }

    @Data
    public static class Instrument {
        private double pipSize = 0.0001;
        private double pipValuePerLot = 10.0;
        private double minLot = 0.01;
        private double maxLot = 100.0;
        private double lotStep = 0.01;
    }

    @Data
    public static class State {
        /** redis or memory */
        private String store = "redis";
        private String keyPrefix = "challenge:engine:";
    }

    @Data
    public static class Events {
        private boolean kafkaEnabled = false;
        private String topic = "engine-transitions";
        private int retainInMemory = 500;
    }

    @Data
    public static class Tick {
        private boolean enabled = true;
        private long intervalMs = 1000;
    }

    /** Signal and quote ingestion. Off unless a broker is available. */
    @Data
    public static class Kafka {
        private boolean listenersEnabled = false;
        private String signalTopic = "trading-signals";
        private String quoteTopic = "market-quotes";
        private String signalGroupId = "challenge-engine-signals";
        private String quoteGroupId = "challenge-engine-quotes";
    }
}
