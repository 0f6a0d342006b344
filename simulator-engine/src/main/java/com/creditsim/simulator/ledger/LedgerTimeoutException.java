package com.creditsim.simulator.ledger;

import com.creditsim.common.exception.SimulatorException;

public class LedgerTimeoutException extends SimulatorException {

    public LedgerTimeoutException(String message) {
        super("LEDGER_TIMEOUT", message);
    }

    public LedgerTimeoutException(String message, Throwable cause) {
        super("LEDGER_TIMEOUT", message, cause);
    }
}
