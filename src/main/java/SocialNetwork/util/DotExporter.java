package SocialNetwork.util;

import SocialNetwork.objects.Edge;
import SocialNetwork.objects.Graph;
import SocialNetwork.objects.Vertex;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes a graph as an undirected Graphviz ({@code .dot}) description. Vertices
 * appear in index order and edges in {@code (u, v)} order with {@code u < v}, so
 * the same graph always produces the same bytes.
 */
public class DotExporter {

    public static String toDot(Graph graph) {
        StringBuilder sb = new StringBuilder();
        sb.append("graph ").append(Constants.DOT_GRAPH_NAME).append(" {\n");
        List<Vertex> vertices = graph.vertices();
        for (int i = 0; i < vertices.size(); i++) {
            sb.append("  ").append(GraphUtil.nodeId(i))
                    .append(" [label=\"").append(escape(vertices.get(i).getName())).append("\"];\n");
        }
        for (Edge edge : graph.edges()) {
            sb.append("  ").append(GraphUtil.nodeId(edge.getU()))
                    .append(" -- ").append(GraphUtil.nodeId(edge.getV())).append(";\n");
        }
        sb.append("}\n");
        return sb.toString();
    }

    /**
     * Writes {@link #toDot(Graph)} to {@code path}, replacing any existing file.
     */
    public static void export(Graph graph, Path path) throws IOException {
        Files.writeString(path, toDot(graph), StandardCharsets.UTF_8);
        Logging.logInfo("Wrote " + graph.size() + " vertices and " + graph.edgeCount() + " edges to " + path);
    }

    private static String escape(String label) {
        return label.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
