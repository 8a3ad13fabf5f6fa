package SocialNetwork.util;

import SocialNetwork.objects.Graph;
import SocialNetwork.objects.GraphException;
import SocialNetwork.objects.TraversalResult;
import SocialNetwork.objects.Vertex;
import com.google.common.base.Joiner;
import com.google.common.base.Strings;

import java.util.List;

/**
 * Text renderings of a graph for the shell. Every method reads the graph only.
 */
public class GraphFormatter {
    private static final Joiner ARROW = Joiner.on(" -> ");
    private static final Joiner COMMA = Joiner.on(", ");

    /**
     * One line per vertex: index, name and neighbor names in adjacency-list order.
     */
    public static String adjacencyList(Graph graph) throws GraphException {
        StringBuilder sb = new StringBuilder("Adjacency list:\n");
        for (int i = 0; i < graph.size(); i++) {
            List<String> neighbors = graph.neighborNames(i);
            sb.append(String.format(" %d: %s -> %s\n", i, graph.nameOf(i),
                    neighbors.isEmpty() ? "NULL" : ARROW.join(neighbors)));
        }
        return sb.toString();
    }

    public static String adjacencyMatrix(Graph graph) {
        boolean[][] matrix = graph.adjacencyMatrix();
        List<Vertex> vertices = graph.vertices();
        StringBuilder sb = new StringBuilder("Adjacency matrix (0/1):\n");
        appendHeader(sb, vertices.size());
        for (int i = 0; i < vertices.size(); i++) {
            appendRow(sb, i, matrix[i], vertices.get(i).getName());
        }
        return sb.toString();
    }

    public static String incidenceMatrix(Graph graph) {
        boolean[][] matrix = graph.incidenceMatrix();
        List<Vertex> vertices = graph.vertices();
        int m = graph.edgeCount();
        StringBuilder sb = new StringBuilder(String.format(
                "Incidence matrix (%d vertices x %d edges):\n", vertices.size(), m));
        appendHeader(sb, m);
        for (int i = 0; i < vertices.size(); i++) {
            appendRow(sb, i, matrix[i], vertices.get(i).getName());
        }
        if (m == 0) sb.append("(no edges)\n");
        return sb.toString();
    }

    /**
     * Compact friend list per vertex.
     */
    public static String ascii(Graph graph) throws GraphException {
        StringBuilder sb = new StringBuilder("ASCII view:\n");
        for (int i = 0; i < graph.size(); i++) {
            List<String> neighbors = graph.neighborNames(i);
            sb.append(String.format("[%d] %s -- %s\n", i, graph.nameOf(i),
                    neighbors.isEmpty() ? "(no friends)" : COMMA.join(neighbors)));
        }
        return sb.toString();
    }

    /**
     * Lists the visited vertices of a traversal, labelled with their index and name.
     *
     * @param title     Name of the traversal, e.g. "BFS".
     * @param start     Name of the starting vertex.
     */
    public static String traversal(Graph graph, String title, String start, TraversalResult result)
            throws GraphException {
        StringBuilder sb = new StringBuilder(String.format("%s order (from %s):\n", title, start));
        if (result.isEmpty()) {
            return sb.append("(none)\n").toString();
        }
        for (int index : result.getOrder()) {
            sb.append(String.format(" %d: %s\n", index, graph.nameOf(index)));
        }
        sb.append(String.format("Total visited: %d\n", result.getVisitedCount()));
        return sb.toString();
    }

    private static void appendHeader(StringBuilder sb, int columns) {
        sb.append("    ");
        for (int j = 0; j < columns; j++) {
            sb.append(String.format("%3d", j));
        }
        sb.append("\n   +").append(Strings.repeat("---", columns)).append("\n");
    }

    private static void appendRow(StringBuilder sb, int index, boolean[] cells, String name) {
        sb.append(String.format("%2d |", index));
        for (boolean cell : cells) {
            sb.append(String.format("%3d", cell ? 1 : 0));
        }
        sb.append(String.format("   %s\n", name));
    }
}
