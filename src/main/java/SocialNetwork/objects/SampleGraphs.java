package SocialNetwork.objects;

import SocialNetwork.util.Logging;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;

import java.util.Map;

/**
 * Sample networks that can be loaded into a graph from the shell.
 */
public class SampleGraphs {

    /**
     * Six people, inserted in this order.
     */
    public static final ImmutableList<String> FRIENDSHIP_NAMES =
            ImmutableList.of("Alice", "Bob", "Carol", "Dave", "Eve", "Frank");

    /**
     * Seven friendships, inserted in this order.
     */
    public static final ImmutableList<Map.Entry<String, String>> FRIENDSHIP_EDGES = ImmutableList.of(
            Maps.immutableEntry("Alice", "Bob"),
            Maps.immutableEntry("Alice", "Carol"),
            Maps.immutableEntry("Bob", "Dave"),
            Maps.immutableEntry("Carol", "Eve"),
            Maps.immutableEntry("Eve", "Frank"),
            Maps.immutableEntry("Bob", "Carol"),
            Maps.immutableEntry("Dave", "Frank"));

    /**
     * Adds the sample friendship network to {@code graph}. People or friendships
     * that cannot be added (name taken, graph full, edge present) are skipped and
     * logged, so the sample can be merged into a graph that already has data.
     *
     * @param graph     Graph to populate.
     * @return          The number of vertices in the graph afterwards.
     */
    public static int loadFriendshipNetwork(Graph graph) {
        for (String name : FRIENDSHIP_NAMES) {
            try {
                graph.insertVertex(name);
            } catch (GraphException ex) {
                Logging.logWarn("Skipped sample vertex " + name + ": " + ex.getMessage());
            }
        }
        for (Map.Entry<String, String> edge : FRIENDSHIP_EDGES) {
            try {
                graph.insertEdge(edge.getKey(), edge.getValue());
            } catch (GraphException ex) {
                Logging.logWarn("Skipped sample edge " + edge.getKey() + "-" + edge.getValue()
                        + ": " + ex.getMessage());
            }
        }
        Logging.logInfo("Sample graph loaded (" + graph.size() + " vertices)");
        return graph.size();
    }
}
