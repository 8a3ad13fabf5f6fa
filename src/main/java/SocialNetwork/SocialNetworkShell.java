package SocialNetwork;

import SocialNetwork.objects.Graph;
import SocialNetwork.objects.GraphException;
import SocialNetwork.objects.SampleGraphs;
import SocialNetwork.objects.TraversalResult;
import SocialNetwork.util.Constants;
import SocialNetwork.util.DotExporter;
import SocialNetwork.util.GraphFormatter;
import SocialNetwork.util.GraphVisualizer;
import SocialNetwork.util.Logging;

import java.awt.HeadlessException;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Scanner;

/**
 * Numbered text menu over a {@link Graph}. Reads one option per line until the
 * user picks 0 or the input ends. Errors reported by the graph are turned into
 * messages here.
 */
public class SocialNetworkShell {

    private static final String MENU = """

            ===== Friendship Network (Graph) =====
            1 - Insert person
            2 - Insert friendship
            3 - Remove person
            4 - Remove friendship
            5 - Show graph (list, matrix, incidence)
            6 - BFS (friends / connections)
            7 - DFS (visit order)
            8 - Load sample graph
            9 - Export .dot file (Graphviz)
            10 - ASCII view
            11 - Open graph viewer
            0 - Exit
            Choice:\s""";

    private final Graph graph;
    private final Scanner input;
    private final PrintStream out;
    private final GraphVisualizer visualizer;

    public SocialNetworkShell(Graph graph, Scanner input, PrintStream out, GraphVisualizer visualizer) {
        this.graph = graph;
        this.input = input;
        this.out = out;
        this.visualizer = visualizer;
    }

    /**
     * Main loop. Releases the graph before returning.
     */
    public void run() {
        while (true) {
            out.print(MENU);
            if (!input.hasNextLine()) break;
            String line = input.nextLine().trim();
            int option;
            try {
                option = Integer.parseInt(line);
            } catch (NumberFormatException ex) {
                out.println("Invalid option.");
                continue;
            }
            if (option == 0) break;
            execute(option);
        }
        graph.clear();
        out.println("Exiting.");
    }

    /**
     * Runs a single menu option. Unknown options print an error.
     */
    public void execute(int option) {
        try {
            switch (option) {
                case 1 -> insertPerson();
                case 2 -> insertFriendship();
                case 3 -> removePerson();
                case 4 -> removeFriendship();
                case 5 -> {
                    out.print(GraphFormatter.adjacencyList(graph));
                    out.println();
                    out.print(GraphFormatter.adjacencyMatrix(graph));
                    out.println();
                    out.print(GraphFormatter.incidenceMatrix(graph));
                }
                case 6 -> traverse("BFS");
                case 7 -> traverse("DFS");
                case 8 -> {
                    SampleGraphs.loadFriendshipNetwork(graph);
                    out.println("Sample graph inserted (" + graph.size() + " vertices).");
                }
                case 9 -> exportDot();
                case 10 -> out.print(GraphFormatter.ascii(graph));
                case 11 -> openViewer();
                default -> out.println("Invalid option.");
            }
        } catch (GraphException ex) {
            Logging.logDebug("Rejected option " + option + ": " + ex.getKind() + " " + ex.getMessage());
            out.println(describe(ex));
        }
    }

    private void insertPerson() throws GraphException {
        String name = prompt("Name of the new person: ");
        int index = graph.insertVertex(name);
        out.println("Person '" + name + "' added (index " + index + ").");
    }

    private void insertFriendship() throws GraphException {
        String first = prompt("Name of person 1: ");
        String second = prompt("Name of person 2: ");
        graph.insertEdge(first, second);
        out.println("Friendship between '" + first + "' and '" + second + "' added.");
    }

    private void removePerson() throws GraphException {
        String name = prompt("Name of the person to remove: ");
        graph.removeVertex(name);
        out.println("Person '" + name + "' removed.");
    }

    private void removeFriendship() throws GraphException {
        String first = prompt("Name of person 1: ");
        String second = prompt("Name of person 2: ");
        graph.removeEdge(first, second);
        out.println("Friendship between '" + first + "' and '" + second + "' removed.");
    }

    private void traverse(String title) throws GraphException {
        String name = prompt("Name of the person for " + title + ": ");
        int start = graph.requireIndex(name);
        TraversalResult result = title.equals("BFS")
                ? GraphTraversal.bfs(graph, start)
                : GraphTraversal.dfs(graph, start);
        out.print(GraphFormatter.traversal(graph, title, name, result));
    }

    private void exportDot() {
        String file = prompt("Output file [" + Constants.DEFAULT_DOT_FILE + "]: ");
        Path path = Paths.get(file.isEmpty() ? Constants.DEFAULT_DOT_FILE : file);
        try {
            DotExporter.export(graph, path);
            out.println("File '" + path + "' written. Render it with: dot -Tpng " + path + " -o graph.png");
        } catch (IOException ex) {
            Logging.logError("Failed to write " + path, ex);
            out.println("Error: could not write '" + path + "': " + ex.getMessage());
        }
    }

    private void openViewer() {
        try {
            visualizer.display(graph);
        } catch (HeadlessException ex) {
            Logging.logError("No display available for the graph viewer", ex);
            out.println("Error: no display available.");
        }
    }

    private String prompt(String message) {
        out.print(message);
        return input.hasNextLine() ? input.nextLine().trim() : "";
    }

    private String describe(GraphException ex) {
        return switch (ex.getKind()) {
            case CAPACITY_EXCEEDED -> "Error: vertex limit reached (" + graph.capacity() + ").";
            case DUPLICATE_NAME -> "Error: a person with that name already exists.";
            case INVALID_NAME -> "Empty name. Cancelled.";
            case VERTEX_NOT_FOUND -> "Error: person not found.";
            case INVALID_INDEX -> "Error: invalid vertex index.";
            case SELF_LOOP -> "A person cannot be friends with themselves.";
            case EDGE_EXISTS -> "Error: that friendship already exists.";
            case EDGE_NOT_FOUND -> "Error: that friendship does not exist.";
        };
    }
}
