package SocialNetwork.util;

public class GraphUtil {
    /**
     * Label for the undirected edge between two vertex indices. The smaller
     * index always comes first, so (u,v) and (v,u) share a label.
     */
    public static String edgeLabel(int start, int end) {
        if (start > end) {
            return String.format("(%d,%d)", end, start);
        } else {
            return String.format("(%d,%d)", start, end);
        }
    }

    /**
     * Identifier used for the vertex at {@code index} in exported and displayed graphs.
     */
    public static String nodeId(int index) {
        return "v" + index;
    }
}
