package com.nuti.fleet.protocol;

import com.nuti.fleet.model.Route;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TextProtocolTest {

    @Test
    void parseRoute_route_returnsEdges() throws ProtocolException {
        Optional<Route> r = TextProtocol.parseRoute("ROUTE 12.500 3 4 7 9\n");

        assertTrue(r.isPresent());
        assertEquals(12.5, r.get().eta(), 1e-9);
        assertEquals(List.of(4, 7, 9), r.get().edges());
        assertEquals(List.of(), r.get().nodes());
    }

    @Test
    void parseRoute_route2_returnsNodesAndEdges() throws ProtocolException {
        Optional<Route> r = TextProtocol.parseRoute("ROUTE2 3.000 3 0 1 2 2 10 11");

        assertTrue(r.isPresent());
        assertEquals(List.of(0, 1, 2), r.get().nodes());
        assertEquals(List.of(10, 11), r.get().edges());
    }

    @Test
    void parseRoute_emptyRoute_isAccepted() throws ProtocolException {
        Optional<Route> r = TextProtocol.parseRoute("ROUTE 0.000 0");

        assertTrue(r.isPresent());
        assertTrue(r.get().isEmpty());
    }

    @Test
    void parseRoute_err_returnsEmpty() throws ProtocolException {
        assertFalse(TextProtocol.parseRoute("ERR NO_ROUTE").isPresent());
    }

    @Test
    void parseRoute_declaredEdgeCountTooHigh_throws() {
        assertThrows(ProtocolException.class, () -> TextProtocol.parseRoute("ROUTE 5.0 3 1 2"));
    }

    @Test
    void parseRoute_declaredEdgeCountTooLow_throws() {
        assertThrows(ProtocolException.class, () -> TextProtocol.parseRoute("ROUTE 5.0 1 1 2"));
    }

    @Test
    void parseRoute_route2MissingEdgeCount_throws() {
        assertThrows(ProtocolException.class, () -> TextProtocol.parseRoute("ROUTE2 5.0 3 0 1 2"));
    }

    @Test
    void parseRoute_route2HugeNodeCount_throws() {
        assertThrows(ProtocolException.class, () -> TextProtocol.parseRoute("ROUTE2 1.0 2147483647 5"));
        assertThrows(ProtocolException.class, () -> TextProtocol.parseRoute("ROUTE2 1.0 2147483645 5 6 7"));
    }

    @Test
    void parseRoute_route2EdgeCountMismatch_throws() {
        assertThrows(ProtocolException.class, () -> TextProtocol.parseRoute("ROUTE2 5.0 2 0 1 2 10"));
    }

    @Test
    void parseRoute_unknownOrGarbage_throws() {
        assertThrows(ProtocolException.class, () -> TextProtocol.parseRoute("HELLO 1 2 3"));
        assertThrows(ProtocolException.class, () -> TextProtocol.parseRoute(""));
        assertThrows(ProtocolException.class, () -> TextProtocol.parseRoute("ROUTE x 1 2"));
        assertThrows(ProtocolException.class, () -> TextProtocol.parseRoute("ROUTE 1.0 -1"));
    }

    @Test
    void parseAck_ackErrAndGarbage() throws ProtocolException {
        assertTrue(TextProtocol.parseAck("ACK\n"));
        assertFalse(TextProtocol.parseAck("ERR BAD_EDGE"));
        assertThrows(ProtocolException.class, () -> TextProtocol.parseAck("ROUTE 1 0"));
    }

    @Test
    void parsePrediction_matchingEdge_returnsSeconds() throws ProtocolException {
        OptionalDouble t = TextProtocol.parsePrediction(42, "PRED 42 17.250");

        assertTrue(t.isPresent());
        assertEquals(17.25, t.getAsDouble(), 1e-9);
        assertFalse(TextProtocol.parsePrediction(42, "ERR BAD_EDGE").isPresent());
    }

    @Test
    void parsePrediction_otherEdge_throws() {
        assertThrows(ProtocolException.class, () -> TextProtocol.parsePrediction(42, "PRED 41 17.250"));
    }

    @Test
    void encodeUpdate_usesThreeDecimals() {
        assertEquals("UPD 7 12.500 0.250", TextProtocol.encodeUpdate(7, 12.5, 0.25));
        assertEquals("UPD 7 3.142", TextProtocol.encodeUpdate(7, Math.PI));
        assertEquals("REQ 1 3", TextProtocol.encodeRouteRequest(1, 3));
    }
}
