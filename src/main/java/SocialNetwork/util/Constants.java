package SocialNetwork.util;

public class Constants {
    /**
     * Default maximum number of people a graph can hold.
     */
    public static final int MAX_VERTICES = 20;

    /**
     * System property which overrides {@link #MAX_VERTICES} when the shell starts.
     */
    public static final String CAPACITY_PROPERTY = "socialnetwork.capacity";

    public static final String DOT_GRAPH_NAME = "FriendshipNetwork";
    public static final String DEFAULT_DOT_FILE = "graph.dot";
}
