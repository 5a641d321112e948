package com.kotsin.challenge.controller;

import com.kotsin.challenge.event.TransitionEvent;
import com.kotsin.challenge.event.TransitionEventPublisher;
import com.kotsin.challenge.model.AccountState;
import com.kotsin.challenge.model.ClosedTrade;
import com.kotsin.challenge.model.DrawdownSnapshot;
import com.kotsin.challenge.model.Position;
import com.kotsin.challenge.model.QueuedEntry;
import com.kotsin.challenge.model.Signal;
import com.kotsin.challenge.risk.DrawdownGuard;
import com.kotsin.challenge.service.AccountLedger;
import com.kotsin.challenge.service.ChallengeEngine;
import com.kotsin.challenge.service.EntryQueue;
import com.kotsin.challenge.service.PositionBook;
import com.kotsin.challenge.state.EngineStateRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only view of engine state, plus manual signal submission.
 */
@RestController
@RequestMapping("/api/engine")
@RequiredArgsConstructor
@Slf4j
public class EngineController {

    private final ChallengeEngine engine;
    private final EntryQueue entryQueue;
    private final PositionBook positionBook;
    private final AccountLedger ledger;
    private final DrawdownGuard drawdownGuard;
    private final TransitionEventPublisher events;
    private final EngineStateRepository repository;

    /**
     * GET /api/engine/status
     */
    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> status() {
        AccountState account = ledger.snapshot();
        DrawdownSnapshot dd = DrawdownSnapshot.of(account);
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("started", engine.isStarted());
        response.put("account", account);
        response.put("dailyDrawdownPct", dd.dailyDdPct());
        response.put("totalDrawdownPct", dd.totalDdPct());
        response.put("ultraSafe", drawdownGuard.isUltraSafe());
        response.put("riskMultiplier", drawdownGuard.riskMultiplier());
        response.put("tradesToday", account.getTradesToday());
        response.put("openPositions", positionBook.size());
        response.put("activeEntries", entryQueue.active().size());
        return ResponseEntity.ok(response);
    }

    @GetMapping("/queue")
    public List<QueuedEntry> queue() {
        return engine.queueView();
    }

    @GetMapping("/positions")
    public List<Position> positions() {
        return engine.positionsView();
    }

    @GetMapping("/events")
    public List<TransitionEvent> events(@RequestParam(defaultValue = "100") int limit) {
        List<TransitionEvent> recent = events.recent();
        int from = Math.max(0, recent.size() - Math.max(0, limit));
        return recent.subList(from, recent.size());
    }

    @GetMapping("/trades")
    public List<ClosedTrade> closedTrades() {
        return repository.closedTrades();
    }

    /**
     * POST /api/engine/signals
     */
    @PostMapping("/signals")
    public ResponseEntity<Map<String, Object>> submit(@RequestBody Signal signal) {
        EntryQueue.SubmitResult result = engine.submit(signal);
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("accepted", result.isAccepted());
        if (result.isAccepted()) {
            response.put("entryId", result.getEntry().getEntryId());
            return ResponseEntity.ok(response);
        }
        log.warn("Manual signal {} rejected: {}", signal.signalId(), result.getReason());
        response.put("reason", result.getReason());
        return ResponseEntity.unprocessableEntity().body(response);
    }
}
