package SocialNetwork.util;

import SocialNetwork.objects.Edge;
import SocialNetwork.objects.Graph;
import SocialNetwork.objects.Vertex;
import org.graphstream.graph.Node;
import org.graphstream.graph.implementations.SingleGraph;

import java.util.List;

/**
 * Shows a friendship graph in the GraphStream viewer.
 */
public class GraphVisualizer {

    private static final String STYLESHEET = """
            node {
                fill-color: orange;
                size: 14px;
                text-size: 14;
            }

            node.isolated {
                fill-color: gray;
            }

            edge {
                size: 2px;
                fill-color: black;
            }
            """;

    /**
     * Builds a GraphStream copy of {@code graph}. Node ids come from
     * {@link GraphUtil#nodeId(int)} and edge ids from {@link GraphUtil#edgeLabel(int, int)}.
     *
     * @param graph     The friendship graph.
     * @return          A GraphStream graph with the same vertices and edges.
     */
    public org.graphstream.graph.Graph toGraphStream(Graph graph) {
        org.graphstream.graph.Graph graphVis = new SingleGraph(Constants.DOT_GRAPH_NAME);
        List<Vertex> vertices = graph.vertices();
        for (int i = 0; i < vertices.size(); i++) {
            Node node = graphVis.addNode(GraphUtil.nodeId(i));
            node.addAttribute("ui.label", vertices.get(i).getName());
            if (vertices.get(i).degree() == 0) {
                node.setAttribute("ui.class", "isolated");
            }
        }
        for (Edge edge : graph.edges()) {
            graphVis.addEdge(GraphUtil.edgeLabel(edge.getU(), edge.getV()),
                    GraphUtil.nodeId(edge.getU()), GraphUtil.nodeId(edge.getV()));
        }
        graphVis.setAttribute("ui.stylesheet", STYLESHEET);
        return graphVis;
    }

    /**
     * Opens a viewer window on a snapshot of {@code graph}. Later changes to the
     * graph are not reflected in the window.
     */
    public void display(Graph graph) {
        Logging.logInfo("Opening viewer for " + graph.size() + " vertices");
        toGraphStream(graph).display();
    }
}
