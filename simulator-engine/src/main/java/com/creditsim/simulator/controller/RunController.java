package com.creditsim.simulator.controller;

import com.creditsim.common.event.SimulatorEvent;
import com.creditsim.common.exception.RunNotFoundException;
import com.creditsim.common.exception.RunStateException;
import com.creditsim.common.exception.ScenarioNotFoundException;
import com.creditsim.common.exception.SimulatorException;
import com.creditsim.simulator.event.SimulatorEventBus;
import com.creditsim.simulator.run.RunService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/runs")
public class RunController {

    private static final Logger log = LoggerFactory.getLogger(RunController.class);

    private final RunService        runService;
    private final SimulatorEventBus eventBus;

    public RunController(RunService runService, SimulatorEventBus eventBus) {
        this.runService = runService;
        this.eventBus   = eventBus;
    }

    @PostMapping
    public Mono<ResponseEntity<RunView>> create(@RequestBody CreateRunRequest request) {
        return runService.create(request.scenarioId(), request.seed(), request.intensityOrDefault())
            .map(run -> ResponseEntity.status(HttpStatus.CREATED).body(RunView.of(run)));
    }

    @GetMapping("/{runId}")
    public ResponseEntity<RunView> get(@PathVariable String runId) {
        return ResponseEntity.ok(RunView.of(runService.get(runId)));
    }

    @PostMapping("/{runId}/pause")
    public Mono<ResponseEntity<RunView>> pause(@PathVariable String runId) {
        return runService.pause(runId).map(run -> ResponseEntity.ok(RunView.of(run)));
    }

    @PostMapping("/{runId}/resume")
    public Mono<ResponseEntity<RunView>> resume(@PathVariable String runId) {
        return runService.resume(runId).map(run -> ResponseEntity.ok(RunView.of(run)));
    }

    @PostMapping("/{runId}/stop")
    public Mono<ResponseEntity<RunView>> stop(@PathVariable String runId) {
        return runService.stop(runId).map(run -> ResponseEntity.ok(RunView.of(run)));
    }

    @PutMapping("/{runId}/intensity")
    public Mono<ResponseEntity<RunView>> intensity(@PathVariable String runId,
                                                   @RequestBody IntensityRequest request) {
        return runService.setIntensity(runId, request.intensityPercent())
            .map(run -> ResponseEntity.ok(RunView.of(run)));
    }

    /** Live events of one run; {@code id} carries the per-run event id. */
    @GetMapping(value = "/{runId}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<SimulatorEvent>> events(@PathVariable String runId) {
        runService.get(runId);
        return eventBus.stream(runId)
            .map(e -> ServerSentEvent.<SimulatorEvent>builder(e)
                .id(String.valueOf(e.eventId()))
                .event(e.type())
                .build());
    }

    // ── error mapping ─────────────────────────────────────────────────────────

    @ExceptionHandler({RunNotFoundException.class, ScenarioNotFoundException.class})
    public ResponseEntity<Map<String, String>> notFound(SimulatorException e) {
        return error(HttpStatus.NOT_FOUND, e);
    }

    @ExceptionHandler(RunStateException.class)
    public ResponseEntity<Map<String, String>> conflict(RunStateException e) {
        return error(HttpStatus.CONFLICT, e);
    }

    @ExceptionHandler(SimulatorException.class)
    public ResponseEntity<Map<String, String>> badRequest(SimulatorException e) {
        return error(HttpStatus.BAD_REQUEST, e);
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, SimulatorException e) {
        log.warn("[Api] Request failed. status={} code={} message={}", status.value(), e.getCode(), e.getMessage());
        return ResponseEntity.status(status).body(Map.of("code", e.getCode(), "message", e.getMessage()));
    }
}
