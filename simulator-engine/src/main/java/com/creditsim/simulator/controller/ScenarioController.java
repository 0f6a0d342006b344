package com.creditsim.simulator.controller;

import com.creditsim.common.exception.ScenarioNotFoundException;
import com.creditsim.common.exception.ScenarioValidationException;
import com.creditsim.common.exception.SimulatorException;
import com.creditsim.common.model.Scenario;
import com.creditsim.simulator.scenario.ScenarioStore;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/scenarios")
public class ScenarioController {

    private final ScenarioStore scenarioStore;

    public ScenarioController(ScenarioStore scenarioStore) {
        this.scenarioStore = scenarioStore;
    }

    @PostMapping
    public Mono<ResponseEntity<Scenario>> save(@RequestBody Scenario scenario) {
        return scenarioStore.save(scenario)
            .map(saved -> ResponseEntity.status(HttpStatus.CREATED).body(saved));
    }

    @GetMapping
    public Flux<Scenario> list() {
        return scenarioStore.list();
    }

    @GetMapping("/{scenarioId}")
    public Mono<Scenario> get(@PathVariable String scenarioId) {
        return scenarioStore.get(scenarioId)
            .switchIfEmpty(Mono.error(() -> new ScenarioNotFoundException(scenarioId)));
    }

    @ExceptionHandler(ScenarioNotFoundException.class)
    public ResponseEntity<Map<String, String>> notFound(ScenarioNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(body(e));
    }

    @ExceptionHandler(ScenarioValidationException.class)
    public ResponseEntity<Map<String, String>> invalid(ScenarioValidationException e) {
        return ResponseEntity.badRequest().body(body(e));
    }

    private static Map<String, String> body(SimulatorException e) {
        return Map.of("code", e.getCode(), "message", e.getMessage());
    }
}
