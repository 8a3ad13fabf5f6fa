package SocialNetwork.objects;

/**
 * Raised when a graph operation is rejected. The graph is left exactly as it
 * was before the call.
 */
public class GraphException extends Exception {

    public enum Kind {
        CAPACITY_EXCEEDED,
        DUPLICATE_NAME,
        INVALID_NAME,
        VERTEX_NOT_FOUND,
        INVALID_INDEX,
        SELF_LOOP,
        EDGE_EXISTS,
        EDGE_NOT_FOUND
    }

    private final Kind kind;

    public GraphException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
