package com.creditsim.simulator.executor;

import com.creditsim.common.event.EdgePatch;
import com.creditsim.common.event.NodePatch;
import com.creditsim.common.model.PaymentIntent;

import java.util.List;

/**
 * Classified result of one intent, emitted in {@code seq} order.
 *
 * @param route participant ids sender → receiver; empty unless committed
 */
public record PaymentOutcome(
    PaymentIntent   intent,
    Kind            kind,
    String          code,
    String          message,
    List<String>    route,
    List<EdgePatch> edges,
    List<NodePatch> nodes
) {

    public enum Kind { COMMITTED, REJECTED, TIMEOUT, ERROR }

    public PaymentOutcome {
        route = route != null ? List.copyOf(route) : List.of();
        edges = edges != null ? List.copyOf(edges) : List.of();
        nodes = nodes != null ? List.copyOf(nodes) : List.of();
    }

    public static PaymentOutcome committed(PaymentIntent intent, List<String> route,
                                           List<EdgePatch> edges, List<NodePatch> nodes) {
        return new PaymentOutcome(intent, Kind.COMMITTED, null, null, route, edges, nodes);
    }

    public static PaymentOutcome rejected(PaymentIntent intent, String code, String message) {
        return new PaymentOutcome(intent, Kind.REJECTED, code, message, null, null, null);
    }

    public static PaymentOutcome timeout(PaymentIntent intent, String message) {
        return new PaymentOutcome(intent, Kind.TIMEOUT, RejectionCodes.PAYMENT_TIMEOUT, message, null, null, null);
    }

    public static PaymentOutcome error(PaymentIntent intent, String code, String message) {
        return new PaymentOutcome(intent, Kind.ERROR, code, message, null, null, null);
    }

    public int seq() {
        return intent.seq();
    }

    public int routeLength() {
        return Math.max(0, route.size() - 1);
    }

    /** Timeouts count as errors for run accounting. */
    public boolean isError() {
        return kind == Kind.ERROR || kind == Kind.TIMEOUT;
    }
}
