package com.creditsim.common.trace;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class RunContextUtilTest {

    @Test
    @DisplayName("withRunId() makes the run id readable downstream of the context write")
    void contextCarriesRunId() {
        Mono<String> read = Mono.deferContextual(ctx -> Mono.just(RunContextUtil.getRunId(ctx)));

        StepVerifier.create(RunContextUtil.withRunId(read, "run-7"))
            .expectNext("run-7")
            .verifyComplete();
    }

    @Test
    @DisplayName("getRunId() falls back to unknown without a context entry")
    void missingRunId() {
        StepVerifier.create(Mono.deferContextual(ctx -> Mono.just(RunContextUtil.getRunId(ctx))))
            .expectNext("unknown")
            .verifyComplete();
    }

    @Test
    @DisplayName("withMdc() scopes the MDC entry to the log action")
    void mdcScoped() {
        AtomicReference<String> seen = new AtomicReference<>();

        RunContextUtil.withMdc("run-7", () -> seen.set(MDC.get(RunContextUtil.RUN_ID_KEY)));

        assertEquals("run-7", seen.get());
        assertNull(MDC.get(RunContextUtil.RUN_ID_KEY));
    }
}
