package com.kotsin.challenge.risk;

import com.kotsin.challenge.config.EngineProperties;
import com.kotsin.challenge.event.TransitionEvent;
import com.kotsin.challenge.event.TransitionEventPublisher;
import com.kotsin.challenge.event.TransitionType;
import com.kotsin.challenge.model.Position;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Friday protection against the weekend gap.
 * <p>
 * Late Friday, a day already in drawdown closes everything. From the review hour a single review
 * decides per position: crypto is held, losers and big winners are closed, young positions are
 * halved, and the rest are held subject to a per correlation group and an overall cap.
 */
@Service
@Slf4j
public class WeekendGapGuard {

    private final EngineProperties.Weekend props;
    private final TransitionEventPublisher events;
    private final ZoneId zone;

    public WeekendGapGuard(EngineProperties properties, TransitionEventPublisher events) {
        this.props = properties.getWeekend();
        this.events = events;
        this.zone = ZoneId.of(props.getZone());
    }

    /**
     * @param close  to be closed in full
     * @param reduce to be cut by the configured fraction
     * @param hold   left untouched over the weekend
     */
    public record WeekendPlan(LocalDate reviewDate, List<Position> close, List<Position> reduce, List<Position> hold) {
    }

    public boolean shouldCloseAll(Instant now, double dailyDdPct) {
        if (!props.isEnabled()) {
            return false;
        }
        ZonedDateTime local = now.atZone(zone);
        if (local.getDayOfWeek() != props.getReviewDay() || local.getHour() < props.getCloseHour()) {
            return false;
        }
        if (dailyDdPct >= props.getCloseDddThresholdPct()) {
            log.warn("WEEKEND_CLOSE_ALL {} {}:00 ddd={}% >= {}%", local.getDayOfWeek(), local.getHour(),
                    String.format("%.2f", dailyDdPct), props.getCloseDddThresholdPct());
            return true;
        }
        return false;
    }

    /** True once per review day, from the review hour on. */
    public boolean isReviewDue(Instant now, LocalDate lastReview) {
        if (!props.isEnabled()) {
            return false;
        }
        ZonedDateTime local = now.atZone(zone);
        return local.getDayOfWeek() == props.getReviewDay()
                && local.getHour() >= props.getReviewHour()
                && !local.toLocalDate().equals(lastReview);
    }

    public WeekendPlan plan(List<Position> positions, Instant now) {
        List<Position> close = new ArrayList<>();
        List<Position> reduce = new ArrayList<>();
        List<Position> hold = new ArrayList<>();
        Map<String, List<Position>> candidates = new LinkedHashMap<>();

        for (Position position : positions) {
            double r = currentR(position);
            if (props.isCrypto(position.getSymbol())) {
                hold.add(position);
                log.info("WEEKEND_HOLD {} crypto {}R", position.getSymbol(), fmt(r));
            } else if (r < 0) {
                close.add(position);
                log.info("WEEKEND_CLOSE {} losing {}R", position.getSymbol(), fmt(r));
            } else if (r > props.getTakeProfitAboveR()) {
                close.add(position);
                log.info("WEEKEND_CLOSE {} take profit {}R", position.getSymbol(), fmt(r));
            } else if (r < props.getReduceBelowR()) {
                reduce.add(position);
                log.info("WEEKEND_REDUCE {} young {}R", position.getSymbol(), fmt(r));
            } else {
                candidates.computeIfAbsent(props.groupOf(position.getSymbol()), g -> new ArrayList<>()).add(position);
            }
        }

        Comparator<Position> byRDesc = Comparator.comparingDouble(WeekendGapGuard::currentR).reversed();
        List<Position> selected = new ArrayList<>();
        candidates.forEach((group, members) -> {
            members.sort(byRDesc);
            for (int i = 0; i < members.size(); i++) {
                if (i < props.getMaxPerGroup()) {
                    selected.add(members.get(i));
                } else {
                    close.add(members.get(i));
                    log.info("WEEKEND_CLOSE {} excess in {} {}R", members.get(i).getSymbol(), group, fmt(currentR(members.get(i))));
                }
            }
        });
        if (selected.size() > props.getMaxTotalHeld()) {
            selected.sort(byRDesc);
            List<Position> excess = new ArrayList<>(selected.subList(props.getMaxTotalHeld(), selected.size()));
            selected.removeAll(excess);
            excess.forEach(p -> log.info("WEEKEND_CLOSE {} over total limit {}R", p.getSymbol(), fmt(currentR(p))));
            close.addAll(excess);
        }
        hold.addAll(selected);

        LocalDate reviewDate = now.atZone(zone).toLocalDate();
        events.publish(TransitionEvent.of(now, TransitionType.WEEKEND_REVIEW, null, "account",
                        String.format("hold %d, close %d, reduce %d", hold.size(), close.size(), reduce.size()))
                .after("close", close.stream().map(Position::getSymbol).toList())
                .after("reduce", reduce.stream().map(Position::getSymbol).toList())
                .after("hold", hold.stream().map(Position::getSymbol).toList()));
        return new WeekendPlan(reviewDate, close, reduce, hold);
    }

    public double reduceFraction() {
        return props.getReduceFraction();
    }

    /** Open R at the last mark; 0 when the position has no stop distance. */
    static double currentR(Position position) {
        double risk = position.riskDistance();
        if (risk <= 0 || position.getLastPrice() <= 0) {
            return 0.0;
        }
        return position.getDirection().sign() * (position.getLastPrice() - position.getEntryPrice()) / risk;
    }

    private static String fmt(double r) {
        return String.format("%+.2f", r);
    }
}
