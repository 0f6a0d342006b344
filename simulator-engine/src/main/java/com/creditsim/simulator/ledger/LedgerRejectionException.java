package com.creditsim.simulator.ledger;

import com.creditsim.common.exception.SimulatorException;

/**
 * Client-side rejection raised by the ledger. Carries the ledger's diagnostic code
 * ({@code E001} no route, {@code E002} no capacity, {@code E003} limit exceeded,
 * {@code E004} trust line not active) and an HTTP-like status in the 4xx range.
 */
public class LedgerRejectionException extends SimulatorException {

    public enum Kind { ROUTING, TRUSTLINE, NOT_FOUND, BAD_REQUEST, CONFLICT, UNAUTHORIZED, FORBIDDEN, SIGNATURE, OTHER }

    private final Kind kind;
    private final int  statusCode;

    public LedgerRejectionException(Kind kind, String diagnosticCode, String message) {
        this(kind, diagnosticCode, message, 400);
    }

    public LedgerRejectionException(Kind kind, String diagnosticCode, String message, int statusCode) {
        super(diagnosticCode, message);
        this.kind       = kind;
        this.statusCode = statusCode;
    }

    public Kind getKind()        { return kind; }
    public int  getStatusCode()  { return statusCode; }

    public boolean isClientError() {
        return statusCode >= 400 && statusCode < 500;
    }

    public static LedgerRejectionException noRoute(String message) {
        return new LedgerRejectionException(Kind.ROUTING, "E001", message);
    }

    public static LedgerRejectionException noCapacity(String message) {
        return new LedgerRejectionException(Kind.ROUTING, "E002", message);
    }

    public static LedgerRejectionException notFound(String message) {
        return new LedgerRejectionException(Kind.NOT_FOUND, "NOT_FOUND", message, 404);
    }

    public static LedgerRejectionException badRequest(String message) {
        return new LedgerRejectionException(Kind.BAD_REQUEST, "BAD_REQUEST", message, 400);
    }
}
