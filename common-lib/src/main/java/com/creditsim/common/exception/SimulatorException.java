package com.creditsim.common.exception;

/**
 * Base of all simulator failures. {@code code} is stable and surfaces as the
 * run's last error code.
 */
public class SimulatorException extends RuntimeException {
    private final String code;

    public SimulatorException(String code, String message) {
        super("[" + code + "] " + message);
        this.code = code;
    }

    public SimulatorException(String code, String message, Throwable cause) {
        super("[" + code + "] " + message, cause);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
