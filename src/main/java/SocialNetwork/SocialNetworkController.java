package SocialNetwork;

import SocialNetwork.objects.Graph;
import SocialNetwork.util.Constants;
import SocialNetwork.util.GraphVisualizer;
import SocialNetwork.util.Logging;

import java.util.Scanner;

public class SocialNetworkController {

    /**
     * Reads the vertex capacity from the {@value Constants#CAPACITY_PROPERTY} system
     * property, falling back to {@link Constants#MAX_VERTICES}.
     */
    static int configuredCapacity() {
        Integer capacity = Integer.getInteger(Constants.CAPACITY_PROPERTY, Constants.MAX_VERTICES);
        if (capacity < 1) {
            Logging.logWarn("Ignoring non-positive capacity " + capacity + ", using " + Constants.MAX_VERTICES);
            return Constants.MAX_VERTICES;
        }
        return capacity;
    }

    public static void main(String[] args) {
        int capacity = configuredCapacity();
        Logging.logInfo("Starting with capacity " + capacity);

        Graph graph = new Graph(capacity);
        Scanner inputReader = new Scanner(System.in);
        new SocialNetworkShell(graph, inputReader, System.out, new GraphVisualizer()).run();
    }
}
