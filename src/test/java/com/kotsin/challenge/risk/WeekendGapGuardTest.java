package com.kotsin.challenge.risk;

import com.kotsin.challenge.config.EngineProperties;
import com.kotsin.challenge.event.LoggingTransitionEventPublisher;
import com.kotsin.challenge.event.TransitionType;
import com.kotsin.challenge.model.Direction;
import com.kotsin.challenge.model.Position;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WeekendGapGuardTest {

    private static final Instant FRIDAY_REVIEW = Instant.parse("2026-03-06T16:00:00Z");

    private EngineProperties props;
    private LoggingTransitionEventPublisher events;
    private WeekendGapGuard guard;

    @BeforeEach
    void setUp() {
        props = new EngineProperties();
        events = new LoggingTransitionEventPublisher(100);
        guard = new WeekendGapGuard(props, events);
    }

    /** Long with a 100-point stop distance, marked at the given R. */
    private static Position at(String symbol, double r) {
        double entry = 100.0;
        return Position.builder()
                .positionId(symbol + "@" + r)
                .symbol(symbol)
                .direction(Direction.LONG)
                .entryPrice(entry)
                .initialStop(entry - 1.0)
                .currentStop(entry - 1.0)
                .originalSize(1.0)
                .remainingSize(1.0)
                .lastPrice(entry + r)
                .build();
    }

    private static List<String> ids(List<Position> positions) {
        return positions.stream().map(Position::getPositionId).toList();
    }

    // ======================== TIMING ========================

    @ParameterizedTest(name = "{0} ddd={1}% -> {2}")
    @CsvSource({
            "2026-03-06T22:00:00Z, 2.0, true",
            "2026-03-06T23:30:00Z, 3.1, true",
            "2026-03-06T21:59:59Z, 3.0, false",
            "2026-03-06T22:00:00Z, 1.99, false",
            "2026-03-05T22:00:00Z, 3.0, false"
    })
    @DisplayName("Close-all only late Friday with the day already in drawdown")
    void closeAllWindow(String at, double ddd, boolean expected) {
        assertEquals(expected, guard.shouldCloseAll(Instant.parse(at), ddd));
    }

    @Test
    @DisplayName("Review runs once per Friday from the review hour")
    void reviewOncePerFriday() {
        assertFalse(guard.isReviewDue(Instant.parse("2026-03-06T15:59:00Z"), null));
        assertTrue(guard.isReviewDue(FRIDAY_REVIEW, null));
        assertTrue(guard.isReviewDue(FRIDAY_REVIEW, LocalDate.parse("2026-02-27")));
        assertFalse(guard.isReviewDue(FRIDAY_REVIEW.plusSeconds(3600), LocalDate.parse("2026-03-06")));
        assertFalse(guard.isReviewDue(Instant.parse("2026-03-07T16:00:00Z"), null), "not on Saturday");
    }

    @Test
    @DisplayName("Disabled protection never acts")
    void disabled() {
        props.getWeekend().setEnabled(false);
        assertFalse(guard.shouldCloseAll(Instant.parse("2026-03-06T23:00:00Z"), 5.0));
        assertFalse(guard.isReviewDue(FRIDAY_REVIEW, null));
    }

    // ======================== SELECTION ========================

    @ParameterizedTest(name = "{0}R -> {1}")
    @CsvSource({"-0.2, CLOSE", "0.0, REDUCE", "0.49, REDUCE", "0.5, HOLD", "1.6, HOLD", "1.61, CLOSE"})
    @DisplayName("Each position is sorted by its open R")
    void bucketsByR(double r, String expected) {
        WeekendGapGuard.WeekendPlan plan = guard.plan(List.of(at("EURUSD", r)), FRIDAY_REVIEW);

        List<Position> bucket = switch (expected) {
            case "CLOSE" -> plan.close();
            case "REDUCE" -> plan.reduce();
            default -> plan.hold();
        };
        assertEquals(1, bucket.size());
    }

    @Test
    @DisplayName("Crypto is held whatever its R")
    void cryptoAlwaysHeld() {
        WeekendGapGuard.WeekendPlan plan = guard.plan(List.of(at("BTCUSD", -0.8), at("ETHUSD", 3.0)), FRIDAY_REVIEW);

        assertEquals(2, plan.hold().size());
        assertTrue(plan.close().isEmpty());
    }

    @Test
    @DisplayName("At most two per correlation group, highest R kept")
    void groupCap() {
        Position eur = at("EURUSD", 0.7);
        Position gbp = at("GBPUSD", 1.2);
        Position aud = at("AUDUSD", 0.9);
        Position jpy = at("USDJPY", 0.6);

        WeekendGapGuard.WeekendPlan plan = guard.plan(List.of(eur, gbp, aud, jpy), FRIDAY_REVIEW);

        assertEquals(List.of(eur.getPositionId()), ids(plan.close()));
        assertTrue(ids(plan.hold()).containsAll(ids(List.of(gbp, aud, jpy))));
    }

    @Test
    @DisplayName("A symbol in two groups counts in the first one listed")
    void firstGroupWins() {
        assertEquals("EUR_CROSSES", props.getWeekend().groupOf("EURJPY"));
        assertEquals("JPY_CROSSES", props.getWeekend().groupOf("CADJPY"));
        assertEquals("UNCORRELATED", props.getWeekend().groupOf("USDSEK"));
    }

    @Test
    @DisplayName("No more than five non-crypto positions held, lowest R closed first")
    void totalCap() {
        List<Position> positions = new ArrayList<>(List.of(
                at("EURUSD", 1.5), at("USDJPY", 1.4), at("EURGBP", 1.3),
                at("GBPJPY", 1.2), at("XAUUSD", 1.1), at("SPX500USD", 0.8), at("AUDNZD", 0.6)));
        positions.add(at("BTCUSD", 0.1));

        WeekendGapGuard.WeekendPlan plan = guard.plan(positions, FRIDAY_REVIEW);

        assertEquals(6, plan.hold().size(), "five non-crypto plus crypto");
        assertEquals(List.of("SPX500USD@0.8", "AUDNZD@0.6"), ids(plan.close()));
        assertEquals(1, events.recent().stream().filter(e -> e.getType() == TransitionType.WEEKEND_REVIEW).count());
    }

    @Test
    @DisplayName("Short positions measure R the other way")
    void shortR() {
        Position shortWinner = at("EURUSD", 0.0).toBuilder()
                .direction(Direction.SHORT)
                .initialStop(101.0)
                .lastPrice(99.0)
                .build();

        assertEquals(1.0, WeekendGapGuard.currentR(shortWinner), 1e-9);
    }
}
