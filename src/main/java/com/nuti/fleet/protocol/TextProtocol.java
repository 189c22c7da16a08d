package com.nuti.fleet.protocol;

import com.nuti.fleet.model.Route;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Encoding and decoding of the line-oriented command set:
 * {@code REQ}, {@code UPD}, {@code PRED} and their replies.
 */
final class TextProtocol {

    private TextProtocol() {
    }

    static String encodeRouteRequest(int src, int dst) {
        return "REQ " + src + " " + dst;
    }

    static String encodeUpdate(int edgeId, double speed) {
        return String.format(Locale.ROOT, "UPD %d %.3f", edgeId, speed);
    }

    static String encodeUpdate(int edgeId, double speed, double position) {
        return String.format(Locale.ROOT, "UPD %d %.3f %.3f", edgeId, speed, position);
    }

    static String encodePrediction(int edgeId) {
        return "PRED " + edgeId;
    }

    static Optional<Route> parseRoute(String reply) throws ProtocolException {
        String[] parts = reply.trim().split("\\s+");
        if (parts[0].equals("ERR")) {
            return Optional.empty();
        }
        if (parts.length < 3) {
            throw new ProtocolException("Not a ROUTE response: '" + reply + "'");
        }

        if (parts[0].equals("ROUTE2")) {
            double eta = parseDouble(parts[1], reply);
            int nodeCount = parseCount(parts[2], reply);
            if (nodeCount > parts.length - 4) {
                throw new ProtocolException("ROUTE2 missing edge_count: '" + reply + "'");
            }
            int edgeCountIdx = 3 + nodeCount;
            List<Integer> nodes = parseIds(parts, 3, edgeCountIdx, reply);
            int edgeCount = parseCount(parts[edgeCountIdx], reply);
            List<Integer> edges = parseIds(parts, edgeCountIdx + 1, parts.length, reply);
            requireCount(edgeCount, edges.size(), reply);
            return Optional.of(new Route(eta, nodes, edges));
        }

        if (parts[0].equals("ROUTE")) {
            double eta = parseDouble(parts[1], reply);
            int edgeCount = parseCount(parts[2], reply);
            List<Integer> edges = parseIds(parts, 3, parts.length, reply);
            requireCount(edgeCount, edges.size(), reply);
            return Optional.of(Route.ofEdges(eta, edges));
        }

        throw new ProtocolException("Not a ROUTE response: '" + reply + "'");
    }

    static boolean parseAck(String reply) throws ProtocolException {
        String trimmed = reply.trim();
        if (trimmed.equals("ACK")) {
            return true;
        }
        if (trimmed.equals("ERR") || trimmed.startsWith("ERR ")) {
            return false;
        }
        throw new ProtocolException("Expected ACK or ERR, got '" + reply + "'");
    }

    static OptionalDouble parsePrediction(int edgeId, String reply) throws ProtocolException {
        String[] parts = reply.trim().split("\\s+");
        if (parts[0].equals("ERR")) {
            return OptionalDouble.empty();
        }
        if (parts.length != 3 || !parts[0].equals("PRED")) {
            throw new ProtocolException("Not a PRED response: '" + reply + "'");
        }
        int echoed = parseId(parts[1], reply);
        if (echoed != edgeId) {
            throw new ProtocolException("PRED answered edge " + echoed + " instead of " + edgeId);
        }
        return OptionalDouble.of(parseDouble(parts[2], reply));
    }

    private static List<Integer> parseIds(String[] parts, int from, int to, String reply) throws ProtocolException {
        List<Integer> out = new ArrayList<>(Math.max(0, Math.min(to, parts.length) - from));
        for (int i = from; i < to; i++) {
            out.add(parseId(parts[i], reply));
        }
        return out;
    }

    private static void requireCount(int declared, int actual, String reply) throws ProtocolException {
        if (declared != actual) {
            throw new ProtocolException("edge_count mismatch: declared=" + declared + " got=" + actual + " resp='" + reply + "'");
        }
    }

    private static int parseCount(String raw, String reply) throws ProtocolException {
        int n = parseId(raw, reply);
        if (n < 0) {
            throw new ProtocolException("Negative count " + n + " in '" + reply + "'");
        }
        return n;
    }

    private static int parseId(String raw, String reply) throws ProtocolException {
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new ProtocolException("Invalid integer '" + raw + "' in '" + reply + "'", e);
        }
    }

    private static double parseDouble(String raw, String reply) throws ProtocolException {
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException e) {
            throw new ProtocolException("Invalid number '" + raw + "' in '" + reply + "'", e);
        }
    }
}
