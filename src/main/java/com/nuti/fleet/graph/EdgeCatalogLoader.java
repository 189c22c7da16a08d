package com.nuti.fleet.graph;

import com.nuti.fleet.model.Edge;
import com.nuti.fleet.model.EdgeCatalog;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads a graph directory made of {@code graph.meta} and {@code edges.csv}.
 */
public final class EdgeCatalogLoader {

    public static final String META_FILE = "graph.meta";
    public static final String EDGES_FILE = "edges.csv";

    private static final String[] REQUIRED_COLUMNS = {
            "edge_id", "from_node", "to_node", "base_length", "base_speed_limit"
    };

    public EdgeCatalog load(Path graphDir) {
        Path metaPath = graphDir.resolve(META_FILE);
        Path edgesPath = graphDir.resolve(EDGES_FILE);

        int[] meta = loadMeta(metaPath);
        int nodeCount = meta[0];
        int declaredEdges = meta[1];

        List<Edge> edges = loadEdges(edgesPath, nodeCount);
        if (edges.size() != declaredEdges) {
            throw new GraphValidationException("Edge count mismatch: " + metaPath + " declares num_edges=" + declaredEdges + " but " + edgesPath + " has " + edges.size());
        }
        return new EdgeCatalog(nodeCount, edges);
    }

    int[] loadMeta(Path path) {
        List<String> lines = readLines(path);

        int nodeCount = -1;
        int edgeCount = -1;
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i).trim();
            if (line.isEmpty()) {
                continue;
            }
            String[] parts = line.split("\\s+");
            if (parts.length != 2) {
                continue;
            }
            if (parts[0].equals("num_nodes")) {
                nodeCount = parseInt(parts[1], path, i + 1, "num_nodes");
            } else if (parts[0].equals("num_edges")) {
                edgeCount = parseInt(parts[1], path, i + 1, "num_edges");
            }
        }

        if (nodeCount < 0 || edgeCount < 0) {
            throw new GraphValidationException("Invalid graph meta (requires num_nodes and num_edges >= 0): " + path);
        }
        return new int[] { nodeCount, edgeCount };
    }

    List<Edge> loadEdges(Path path, int nodeCount) {
        List<String> lines = readLines(path);
        if (lines.isEmpty()) {
            throw new GraphValidationException("Edges file is empty: " + path);
        }

        String[] header = lines.get(0).trim().split(",");
        int[] columns = new int[REQUIRED_COLUMNS.length];
        for (int c = 0; c < REQUIRED_COLUMNS.length; c++) {
            columns[c] = indexOf(header, REQUIRED_COLUMNS[c]);
            if (columns[c] < 0) {
                throw new GraphValidationException("Missing column '" + REQUIRED_COLUMNS[c] + "' in " + path);
            }
        }

        List<Edge> edges = new ArrayList<>();
        Set<Integer> seen = new HashSet<>();
        for (int i = 1; i < lines.size(); i++) {
            String line = lines.get(i).trim();
            if (line.isEmpty()) {
                continue;
            }
            int lineNo = i + 1;
            String[] cells = line.split(",", -1);
            if (cells.length != header.length) {
                throw new GraphValidationException("Expected " + header.length + " columns at " + path + ":" + lineNo + " got=" + cells.length);
            }

            int edgeId = parseInt(cells[columns[0]], path, lineNo, "edge_id");
            int from = parseInt(cells[columns[1]], path, lineNo, "from_node");
            int to = parseInt(cells[columns[2]], path, lineNo, "to_node");
            double length = parseDouble(cells[columns[3]], path, lineNo, "base_length");
            double speedLimit = parseDouble(cells[columns[4]], path, lineNo, "base_speed_limit");

            if (edgeId < 0) {
                throw new GraphValidationException("Negative edge_id " + edgeId + " at " + path + ":" + lineNo);
            }
            if (!seen.add(edgeId)) {
                throw new GraphValidationException("Duplicate edge_id " + edgeId + " at " + path + ":" + lineNo);
            }
            if (from < 0 || from >= nodeCount || to < 0 || to >= nodeCount) {
                throw new GraphValidationException("Edge " + edgeId + " references a node outside [0," + nodeCount + ") at " + path + ":" + lineNo);
            }
            if (length < 0.0) {
                throw new GraphValidationException("Edge " + edgeId + " has negative base_length at " + path + ":" + lineNo);
            }
            if (speedLimit <= 0.0) {
                throw new GraphValidationException("Edge " + edgeId + " requires base_speed_limit > 0 at " + path + ":" + lineNo);
            }
            edges.add(new Edge(edgeId, from, to, length, speedLimit));
        }
        return edges;
    }

    private static List<String> readLines(Path path) {
        try {
            return Files.readAllLines(path);
        } catch (IOException e) {
            throw new GraphValidationException("Failed to read graph file: " + path, e);
        }
    }

    private static int indexOf(String[] header, String column) {
        for (int i = 0; i < header.length; i++) {
            if (header[i].trim().equals(column)) {
                return i;
            }
        }
        return -1;
    }

    private static int parseInt(String raw, Path path, int lineNo, String field) {
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new GraphValidationException("Invalid " + field + " '" + raw + "' at " + path + ":" + lineNo, e);
        }
    }

    private static double parseDouble(String raw, Path path, int lineNo, String field) {
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            throw new GraphValidationException("Invalid " + field + " '" + raw + "' at " + path + ":" + lineNo, e);
        }
    }
}
