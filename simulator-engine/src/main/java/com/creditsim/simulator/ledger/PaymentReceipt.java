package com.creditsim.simulator.ledger;

import java.util.List;

/**
 * Outcome of one routed payment. {@code route} lists participant ids from sender
 * to receiver; a rejected receipt carries the ledger's diagnostic code.
 */
public record PaymentReceipt(
    String txId,
    Status status,
    List<String> route,
    String errorCode,
    String message
) {

    public enum Status { COMMITTED, REJECTED }

    public PaymentReceipt {
        route = route != null ? List.copyOf(route) : List.of();
    }

    public static PaymentReceipt committed(String txId, List<String> route) {
        return new PaymentReceipt(txId, Status.COMMITTED, route, null, null);
    }

    public static PaymentReceipt rejected(String errorCode, String message) {
        return new PaymentReceipt(null, Status.REJECTED, List.of(), errorCode, message);
    }

    public int routeLength() {
        return Math.max(0, route.size() - 1);
    }
}
