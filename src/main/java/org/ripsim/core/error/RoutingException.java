package org.ripsim.core.error;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Local precondition violation raised while building or mutating a routing network.
 *
 * <p>Every failure carries one {@link Reason}; its stable code prefixes the message as
 * {@code [DV_...] detail}. Failures are reported synchronously and never retried.</p>
 */
@Getter
public final class RoutingException extends RuntimeException {

    /**
     * Error kinds of the distance-vector core.
     */
    @Getter
    @Accessors(fluent = true)
    @RequiredArgsConstructor
    public enum Reason {
        /** Node id is null or blank. */
        NODE_ID_REQUIRED("DV_NODE_ID_REQUIRED"),
        /** Node id is not part of the network. */
        UNKNOWN_NODE_ID("DV_UNKNOWN_NODE_ID"),
        /** Node id was already added. */
        DUPLICATE_NODE_ID("DV_DUPLICATE_NODE_ID"),
        /** Link cost below zero. */
        NEGATIVE_COST("DV_NEGATIVE_COST"),
        /** Link cost equal to the unreachable sentinel. */
        INFINITE_COST("DV_INFINITE_COST"),
        /** Link whose endpoints are the same node. */
        SELF_LINK("DV_SELF_LINK"),
        /** Table advertised by a node that is not a neighbor of the receiver. */
        NOT_A_NEIGHBOR("DV_NOT_A_NEIGHBOR");

        /** Stable code used as message prefix. */
        private final String code;
    }

    private final Reason reason;

    /**
     * Creates a routing failure of the given kind.
     *
     * @param reason error kind.
     * @param detail description of the offending input.
     */
    public RoutingException(Reason reason, String detail) {
        super("[" + Objects.requireNonNull(reason, "reason").code() + "] " + Objects.requireNonNull(detail, "detail"));
        this.reason = reason;
    }

    /**
     * Returns the stable code of {@link #getReason()}.
     */
    public String getReasonCode() {
        return reason.code();
    }
}
