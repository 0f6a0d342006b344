package com.creditsim.simulator.run;

import java.time.Instant;

public record RunError(String code, String message, Instant at) {}
