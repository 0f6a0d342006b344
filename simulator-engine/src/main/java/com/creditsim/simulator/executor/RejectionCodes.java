package com.creditsim.simulator.executor;

import com.creditsim.simulator.ledger.LedgerRejectionException;

/**
 * Stable rejection codes reported to observers, mapped from the ledger's diagnostics.
 */
public final class RejectionCodes {

    public static final String ROUTING_NO_CAPACITY      = "ROUTING_NO_CAPACITY";
    public static final String ROUTING_NO_ROUTE         = "ROUTING_NO_ROUTE";
    public static final String ROUTING_REJECTED         = "ROUTING_REJECTED";
    public static final String TRUSTLINE_LIMIT_EXCEEDED = "TRUSTLINE_LIMIT_EXCEEDED";
    public static final String TRUSTLINE_NOT_ACTIVE     = "TRUSTLINE_NOT_ACTIVE";
    public static final String TRUSTLINE_REJECTED       = "TRUSTLINE_REJECTED";
    public static final String EQUIVALENT_NOT_FOUND     = "EQUIVALENT_NOT_FOUND";
    public static final String PARTICIPANT_NOT_FOUND    = "PARTICIPANT_NOT_FOUND";
    public static final String TX_NOT_FOUND             = "TX_NOT_FOUND";
    public static final String NOT_FOUND                = "NOT_FOUND";
    public static final String INVALID_INPUT            = "INVALID_INPUT";
    public static final String CONFLICT                 = "CONFLICT";
    public static final String UNAUTHORIZED             = "UNAUTHORIZED";
    public static final String FORBIDDEN                = "FORBIDDEN";
    public static final String INVALID_SIGNATURE        = "INVALID_SIGNATURE";
    public static final String PAYMENT_REJECTED         = "PAYMENT_REJECTED";

    public static final String PAYMENT_TIMEOUT          = "PAYMENT_TIMEOUT";
    public static final String SENDER_NOT_FOUND         = "SENDER_NOT_FOUND";
    public static final String INTERNAL_ERROR           = "INTERNAL_ERROR";

    private RejectionCodes() {}

    public static String map(LedgerRejectionException e) {
        String diag = e.getCode() != null ? e.getCode().toUpperCase() : "";
        return switch (e.getKind()) {
            case ROUTING      -> switch (diag) {
                case "E002" -> ROUTING_NO_CAPACITY;
                case "E001" -> ROUTING_NO_ROUTE;
                default     -> ROUTING_REJECTED;
            };
            case TRUSTLINE    -> switch (diag) {
                case "E003" -> TRUSTLINE_LIMIT_EXCEEDED;
                case "E004" -> TRUSTLINE_NOT_ACTIVE;
                default     -> TRUSTLINE_REJECTED;
            };
            case NOT_FOUND    -> notFoundCode(e.getMessage());
            case BAD_REQUEST  -> INVALID_INPUT;
            case CONFLICT     -> CONFLICT;
            case UNAUTHORIZED -> UNAUTHORIZED;
            case FORBIDDEN    -> FORBIDDEN;
            case SIGNATURE    -> INVALID_SIGNATURE;
            case OTHER        -> PAYMENT_REJECTED;
        };
    }

    /** Maps the diagnostic code of a rejected receipt. */
    public static String fromDiagnostic(String diagnosticCode) {
        if (diagnosticCode == null) return PAYMENT_REJECTED;
        return switch (diagnosticCode.toUpperCase()) {
            case "E001" -> ROUTING_NO_ROUTE;
            case "E002" -> ROUTING_NO_CAPACITY;
            case "E003" -> TRUSTLINE_LIMIT_EXCEEDED;
            case "E004" -> TRUSTLINE_NOT_ACTIVE;
            default     -> PAYMENT_REJECTED;
        };
    }

    private static String notFoundCode(String message) {
        String msg = message != null ? message.toLowerCase() : "";
        if (msg.contains("equivalent"))  return EQUIVALENT_NOT_FOUND;
        if (msg.contains("participant")) return PARTICIPANT_NOT_FOUND;
        if (msg.contains("transaction") || msg.contains(" tx")) return TX_NOT_FOUND;
        return NOT_FOUND;
    }
}
