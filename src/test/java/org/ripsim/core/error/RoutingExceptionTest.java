package org.ripsim.core.error;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("RoutingException Tests")
class RoutingExceptionTest {

    @Test
    @DisplayName("Reason and its code prefix the message")
    void testReasonPrefixesMessage() {
        RoutingException ex = new RoutingException(RoutingException.Reason.UNKNOWN_NODE_ID, "unknown node: X");

        assertEquals(RoutingException.Reason.UNKNOWN_NODE_ID, ex.getReason());
        assertEquals("DV_UNKNOWN_NODE_ID", ex.getReasonCode());
        assertEquals("[DV_UNKNOWN_NODE_ID] unknown node: X", ex.getMessage());
        assertNull(ex.getCause());
    }

    @Test
    @DisplayName("Null reason or detail is rejected")
    void testNullArgumentsRejected() {
        assertThrows(NullPointerException.class, () -> new RoutingException(null, "details"));
        assertThrows(NullPointerException.class,
                () -> new RoutingException(RoutingException.Reason.SELF_LINK, null));
    }

    @Test
    @DisplayName("Reason codes are unique and carry the DV_ prefix")
    void testReasonCodesAreStable() {
        Set<String> codes = new HashSet<>();
        for (RoutingException.Reason reason : RoutingException.Reason.values()) {
            assertTrue(reason.code().startsWith("DV_"), reason.name());
            assertTrue(codes.add(reason.code()), "duplicate code " + reason.code());
        }
        assertEquals("DV_NOT_A_NEIGHBOR", RoutingException.Reason.NOT_A_NEIGHBOR.code());
    }
}
