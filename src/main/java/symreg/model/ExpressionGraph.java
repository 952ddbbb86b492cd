package symreg.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;

/**
 * Expression program whose nodes may be shared by several parents.
 *
 * <p>Nodes live in an arena and are addressed by stable {@code int}
 * identifiers; an edge is the identifier stored in a parent's left or right
 * slot. Nodes that become unreachable stay in the arena until
 * {@link #compact()} is called. The graph must stay acyclic: callers adding
 * edges are responsible for checking {@link #reaches(int, int)} or for
 * choosing endpoints from {@link #randomizedTopologicalSort(Random)}.
 */
public final class ExpressionGraph {

    public static final int NONE = -1;
    private static final int INITIAL_CAPACITY = 16;

    private int[] degree;
    private boolean[] constant;
    private double[] value;
    private int[] feature;
    private int[] op;
    private int[] left;
    private int[] right;
    private int size;
    private int root = NONE;

    public ExpressionGraph() {
        this(INITIAL_CAPACITY);
    }

    public ExpressionGraph(int capacity) {
        int cap = Math.max(capacity, 1);
        degree = new int[cap];
        constant = new boolean[cap];
        value = new double[cap];
        feature = new int[cap];
        op = new int[cap];
        left = new int[cap];
        right = new int[cap];
    }

    // ---------------------------------------------------------------- building

    public int addConstant(double v) {
        int id = allocate(0);
        constant[id] = true;
        value[id] = v;
        return id;
    }

    public int addFeature(int f) {
        if (f < 1) {
            throw new IllegalArgumentException("Feature index must be >= 1 but was " + f);
        }
        int id = allocate(0);
        feature[id] = f;
        return id;
    }

    public int addUnary(int operator, int child) {
        requireOperator(operator);
        requireNode(child);
        int id = allocate(1);
        op[id] = operator;
        left[id] = child;
        return id;
    }

    public int addBinary(int operator, int leftChild, int rightChild) {
        requireOperator(operator);
        requireNode(leftChild);
        requireNode(rightChild);
        int id = allocate(2);
        op[id] = operator;
        left[id] = leftChild;
        right[id] = rightChild;
        return id;
    }

    private int allocate(int nodeDegree) {
        if (size == degree.length) {
            grow();
        }
        int id = size++;
        degree[id] = nodeDegree;
        constant[id] = false;
        value[id] = 0.0;
        feature[id] = 0;
        op[id] = 0;
        left[id] = NONE;
        right[id] = NONE;
        return id;
    }

    private void grow() {
        int cap = degree.length * 2;
        degree = Arrays.copyOf(degree, cap);
        constant = Arrays.copyOf(constant, cap);
        value = Arrays.copyOf(value, cap);
        feature = Arrays.copyOf(feature, cap);
        op = Arrays.copyOf(op, cap);
        left = Arrays.copyOf(left, cap);
        right = Arrays.copyOf(right, cap);
    }

    // ---------------------------------------------------------------- accessors

    public int root() {
        return root;
    }

    public void setRoot(int id) {
        requireNode(id);
        root = id;
    }

    /** Number of allocated nodes, reachable or not. */
    public int arenaSize() {
        return size;
    }

    public int degree(int id) {
        requireNode(id);
        return degree[id];
    }

    public boolean isConstant(int id) {
        return degree(id) == 0 && constant[id];
    }

    public double value(int id) {
        if (!isConstant(id)) {
            throw new IllegalStateException("Node " + id + " is not a constant leaf");
        }
        return value[id];
    }

    public void setValue(int id, double v) {
        if (!isConstant(id)) {
            throw new IllegalStateException("Node " + id + " is not a constant leaf");
        }
        value[id] = v;
    }

    public int feature(int id) {
        if (degree(id) != 0 || constant[id]) {
            throw new IllegalStateException("Node " + id + " is not a feature leaf");
        }
        return feature[id];
    }

    public int op(int id) {
        if (degree(id) == 0) {
            throw new IllegalStateException("Leaf node " + id + " carries no operator");
        }
        return op[id];
    }

    public void setOp(int id, int operator) {
        if (degree(id) == 0) {
            throw new IllegalStateException("Leaf node " + id + " carries no operator");
        }
        requireOperator(operator);
        op[id] = operator;
    }

    public int left(int id) {
        requireNode(id);
        return left[id];
    }

    public int right(int id) {
        requireNode(id);
        return right[id];
    }

    public void setLeft(int parent, int child) {
        if (degree(parent) < 1) {
            throw new IllegalStateException("Leaf node " + parent + " has no left child");
        }
        requireEdge(parent, child);
        left[parent] = child;
    }

    public void setRight(int parent, int child) {
        if (degree(parent) < 2) {
            throw new IllegalStateException("Node " + parent + " has no right child");
        }
        requireEdge(parent, child);
        right[parent] = child;
    }

    /**
     * Overwrites node {@code target} with the contents of {@code source}:
     * degree, leaf payload, operator and child ids. Every parent of
     * {@code target} sees the new contents.
     *
     * @throws IllegalArgumentException if a child of {@code source} reaches
     *                                  {@code target}, which would close a cycle
     */
    public void setFrom(int target, int source) {
        requireNode(target);
        requireNode(source);
        if (target == source) {
            return;
        }
        for (int slot = 0; slot < degree[source]; slot++) {
            int child = slot == 0 ? left[source] : right[source];
            if (reaches(child, target)) {
                throw new IllegalArgumentException("Copying node " + source + " into " + target
                        + " would make " + target + " its own descendant");
            }
        }
        degree[target] = degree[source];
        constant[target] = constant[source];
        value[target] = value[source];
        feature[target] = feature[source];
        op[target] = op[source];
        left[target] = left[source];
        right[target] = right[source];
    }

    // ---------------------------------------------------------------- traversal

    /** Identifiers reachable from the root in pre-order, each listed once. */
    public int[] reachable() {
        if (root == NONE) {
            return new int[0];
        }
        boolean[] visited = new boolean[size];
        int[] order = new int[size];
        int count = 0;
        int[] stack = new int[size];
        int top = 0;
        stack[top++] = root;
        while (top > 0) {
            int id = stack[--top];
            if (visited[id]) {
                continue;
            }
            visited[id] = true;
            order[count++] = id;
            if (degree[id] == 2 && !visited[right[id]]) {
                stack = push(stack, top++, right[id]);
            }
            if (degree[id] >= 1 && !visited[left[id]]) {
                stack = push(stack, top++, left[id]);
            }
        }
        return Arrays.copyOf(order, count);
    }

    /** Distinct nodes reachable from the root. */
    public int countNodes() {
        return reachable().length;
    }

    public boolean hasConstants() {
        for (int id : reachable()) {
            if (degree[id] == 0 && constant[id]) {
                return true;
            }
        }
        return false;
    }

    /** Whether {@code target} is {@code from} or lies below it. */
    public boolean reaches(int from, int target) {
        requireNode(from);
        requireNode(target);
        boolean[] visited = new boolean[size];
        int[] stack = new int[size];
        int top = 0;
        stack[top++] = from;
        while (top > 0) {
            int id = stack[--top];
            if (id == target) {
                return true;
            }
            if (visited[id]) {
                continue;
            }
            visited[id] = true;
            if (degree[id] == 2) {
                stack = push(stack, top++, right[id]);
            }
            if (degree[id] >= 1) {
                stack = push(stack, top++, left[id]);
            }
        }
        return false;
    }

    /** Whether any cycle is reachable from the root. */
    public boolean hasCycle() {
        if (root == NONE) {
            return false;
        }
        // 0 = unseen, 1 = on the current path, 2 = finished
        int[] state = new int[size];
        int[] stack = new int[2 * size + 2];
        int top = 0;
        stack[top++] = root;
        while (top > 0) {
            int entry = stack[--top];
            if (entry < 0) {
                state[-entry - 1] = 2;
                continue;
            }
            if (state[entry] == 2) {
                continue;
            }
            if (state[entry] == 1) {
                return true;
            }
            state[entry] = 1;
            stack = push(stack, top++, -entry - 1);
            for (int slot = 0; slot < degree[entry]; slot++) {
                int child = slot == 0 ? left[entry] : right[entry];
                if (state[child] == 1) {
                    return true;
                }
                if (state[child] == 0) {
                    stack = push(stack, top++, child);
                }
            }
        }
        return false;
    }

    /**
     * Topological order of the reachable nodes with every child placed before
     * each of its parents. Ties between ready nodes are broken uniformly at
     * random, so repeated calls cover the different valid orders.
     */
    public int[] randomizedTopologicalSort(Random random) {
        Objects.requireNonNull(random, "random");
        int[] nodes = reachable();
        int[] pending = new int[size];
        List<List<Integer>> parents = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            parents.add(null);
        }
        int[] ready = new int[nodes.length];
        int readyCount = 0;
        for (int id : nodes) {
            pending[id] = degree[id];
            if (degree[id] == 0) {
                ready[readyCount++] = id;
            }
            for (int slot = 0; slot < degree[id]; slot++) {
                int child = slot == 0 ? left[id] : right[id];
                if (parents.get(child) == null) {
                    parents.set(child, new ArrayList<>(2));
                }
                parents.get(child).add(id);
            }
        }

        int[] order = new int[nodes.length];
        int count = 0;
        while (readyCount > 0) {
            int pick = random.nextInt(readyCount);
            int id = ready[pick];
            ready[pick] = ready[--readyCount];
            order[count++] = id;
            List<Integer> owners = parents.get(id);
            if (owners == null) {
                continue;
            }
            for (int parent : owners) {
                if (--pending[parent] == 0) {
                    ready[readyCount++] = parent;
                }
            }
        }
        if (count != nodes.length) {
            throw new IllegalStateException("Graph contains a cycle; no topological order exists");
        }
        return order;
    }

    /** Number of child slots among reachable nodes that reference {@code id}. */
    public int parentCount(int id) {
        requireNode(id);
        int count = 0;
        for (int node : reachable()) {
            if (degree[node] >= 1 && left[node] == id) {
                count++;
            }
            if (degree[node] == 2 && right[node] == id) {
                count++;
            }
        }
        return count;
    }

    private static int[] push(int[] stack, int index, int id) {
        int[] target = stack;
        if (index == stack.length) {
            target = Arrays.copyOf(stack, stack.length * 2 + 1);
        }
        target[index] = id;
        return target;
    }

    // ---------------------------------------------------------------- copying

    /**
     * Appends a structural copy of the subgraph below {@code id} to this arena
     * and returns the identifier of the copied node. Sharing inside the
     * subgraph is preserved; nothing outside it references the copy.
     */
    public int copySubtree(int id) {
        requireNode(id);
        int[] mapping = new int[size];
        Arrays.fill(mapping, NONE);
        return copyInto(id, mapping);
    }

    private int copyInto(int id, int[] mapping) {
        if (mapping[id] != NONE) {
            return mapping[id];
        }
        int copy;
        switch (degree[id]) {
            case 0 -> copy = constant[id] ? addConstant(value[id]) : addFeature(feature[id]);
            case 1 -> copy = addUnary(op[id], copyInto(left[id], mapping));
            default -> {
                int l = copyInto(left[id], mapping);
                int r = copyInto(right[id], mapping);
                copy = addBinary(op[id], l, r);
            }
        }
        mapping[id] = copy;
        return copy;
    }

    /**
     * Allocates a node with the same contents as {@code id}, pointing at the
     * same children, and returns its identifier.
     */
    public int copyNode(int id) {
        requireNode(id);
        int copy = allocate(degree[id]);
        constant[copy] = constant[id];
        value[copy] = value[id];
        feature[copy] = feature[id];
        op[copy] = op[id];
        left[copy] = left[id];
        right[copy] = right[id];
        return copy;
    }

    /** New graph holding only the reachable nodes, renumbered children first. */
    public ExpressionGraph compact() {
        ExpressionGraph graph = new ExpressionGraph(Math.max(size, 1));
        if (root == NONE) {
            return graph;
        }
        int[] mapping = new int[size];
        Arrays.fill(mapping, NONE);
        graph.setRoot(copyAcross(root, mapping, graph));
        return graph;
    }

    private int copyAcross(int id, int[] mapping, ExpressionGraph target) {
        if (mapping[id] != NONE) {
            return mapping[id];
        }
        int copy;
        switch (degree[id]) {
            case 0 -> copy = constant[id] ? target.addConstant(value[id]) : target.addFeature(feature[id]);
            case 1 -> copy = target.addUnary(op[id], copyAcross(left[id], mapping, target));
            default -> {
                int l = copyAcross(left[id], mapping, target);
                int r = copyAcross(right[id], mapping, target);
                copy = target.addBinary(op[id], l, r);
            }
        }
        mapping[id] = copy;
        return copy;
    }

    // ---------------------------------------------------------------- conversion

    /**
     * Builds a graph from a node structure. Nodes referenced more than once
     * (by identity) become a single shared arena node.
     */
    public static ExpressionGraph fromTree(ExprNode tree) {
        Objects.requireNonNull(tree, "tree");
        ExpressionGraph graph = new ExpressionGraph();
        Map<ExprNode, Integer> ids = new IdentityHashMap<>();
        graph.setRoot(graph.importNode(tree, ids));
        return graph;
    }

    private int importNode(ExprNode node, Map<ExprNode, Integer> ids) {
        Integer known = ids.get(node);
        if (known != null) {
            return known;
        }
        int id;
        switch (node.degree()) {
            case 0 -> id = node.isConstant() ? addConstant(node.value()) : addFeature(node.feature());
            case 1 -> id = addUnary(node.op(), importNode(node.left(), ids));
            default -> {
                int l = importNode(node.left(), ids);
                int r = importNode(node.right(), ids);
                id = addBinary(node.op(), l, r);
            }
        }
        ids.put(node, id);
        return id;
    }

    /** Expands the graph into a plain tree; shared nodes are duplicated. */
    public ExprNode toTree() {
        if (root == NONE) {
            throw new IllegalStateException("Graph has no root");
        }
        return exportNode(root);
    }

    private ExprNode exportNode(int id) {
        return switch (degree[id]) {
            case 0 -> constant[id] ? ExprNode.constant(value[id]) : ExprNode.feature(feature[id]);
            case 1 -> ExprNode.unary(op[id], exportNode(left[id]));
            default -> ExprNode.binary(op[id], exportNode(left[id]), exportNode(right[id]));
        };
    }

    public String toString(OperatorSet operators) {
        return root == NONE ? "<empty>" : toTree().toString(operators);
    }

    @Override
    public String toString() {
        return toString(OperatorSet.DEFAULT);
    }

    // ---------------------------------------------------------------- checks

    private void requireNode(int id) {
        if (id < 0 || id >= size) {
            throw new IllegalArgumentException("Unknown node id " + id + " (arena size " + size + ")");
        }
    }

    private void requireEdge(int parent, int child) {
        requireNode(child);
        if (parent == child) {
            throw new IllegalArgumentException("Node " + parent + " cannot be its own child");
        }
    }

    private static void requireOperator(int operator) {
        if (operator < 1) {
            throw new IllegalArgumentException("Operator index must be >= 1 but was " + operator);
        }
    }
}
