package symreg.model;

/**
 * Program representation a search run works with. Plain trees never share
 * children; graph programs may, and must stay acyclic.
 */
public enum NodeType {
    TREE,
    GRAPH;

    public static NodeType parseOrNull(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        for (NodeType type : values()) {
            if (type.name().equalsIgnoreCase(raw.trim())) {
                return type;
            }
        }
        return null;
    }
}
