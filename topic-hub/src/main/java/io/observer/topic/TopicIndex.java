package io.observer.topic;

import java.util.*;

/**
 * N-dimensional index from topic strings to subscription ids.
 *
 * <h2>Structure</h2>
 * The index is a trie of depth {@code N}. The root stands for dimension 0; its children are
 * keyed by the dimension-0 topics, their children by the dimension-1 topics, and so on. A
 * subscription registered for topic sets {@code (S0, S1, ..., SN-1)} is stored along every path
 * {@code (t0, t1, ..., tN-1)} with {@code ti} in {@code Si}: its id ends up in the
 * {@code subscriberIds} of each node reached at depth {@code N}. The nesting encodes the AND
 * across dimensions and the branching encodes the OR within a dimension.
 *
 * <h2>Matching</h2>
 * For a query {@code (Q0, ..., QN-1)}, at each depth the candidate children are:
 * <ol>
 *   <li>the child named after each query topic, if present;</li>
 *   <li>the {@link #WILDCARD} child, if present, since a wildcard subscriber matches any topic;</li>
 *   <li>every child, when the query itself contains {@link #WILDCARD}.</li>
 * </ol>
 * The result is the union of the ids found at depth {@code N} under every candidate path.
 * An empty query list at any dimension matches nothing, and so does a subscription registered
 * with an empty set at any dimension: such a subscription is not stored at all.
 *
 * <h2>Pruning</h2>
 * A node with no subscriber ids and no children is removed from its parent as soon as it
 * becomes empty, so subscribe/unsubscribe churn does not grow the trie.
 *
 * <p><b>Thread Safety:</b> This class is NOT thread-safe. {@link TopicHub} guards it with the
 * hub lock.
 */
public final class TopicIndex {

    /**
     * Topic that matches every topic within its dimension, on either the subscriber or the
     * query side.
     */
    public static final String WILDCARD = "*";

    private static final class Node {
        final Set<Long> subscriberIds = new HashSet<>();
        final Map<String, Node> children = new HashMap<>();

        boolean isEmpty() {
            return subscriberIds.isEmpty() && children.isEmpty();
        }
    }

    private final int dimensions;
    private final Node root = new Node();

    // Number of nodes below the root
    private int nodeCount = 0;

    /**
     * Creates an empty index.
     *
     * @param dimensions the number of topic dimensions, at least 1
     * @throws IllegalArgumentException if dimensions is less than 1
     */
    public TopicIndex(int dimensions) {
        if (dimensions < 1) {
            throw new IllegalArgumentException("dimensions must be at least 1, got " + dimensions);
        }
        this.dimensions = dimensions;
    }

    public int dimensions() {
        return dimensions;
    }

    /**
     * Stores the id along every path spanned by the topic sets.
     *
     * @param topicSets one collection of topics per dimension
     * @param id the subscription id
     * @return true if the id was stored, false if some dimension was empty and the subscription
     *         therefore can never match
     * @throws IllegalArgumentException if the number of topic sets differs from {@link #dimensions()}
     * @throws NullPointerException if a collection or a topic is null
     */
    public boolean insert(List<? extends Collection<String>> topicSets, long id) {
        checkTopicSets(topicSets);
        if (hasEmptyDimension(topicSets)) {
            return false;
        }
        insert(root, topicSets, 0, id);
        return true;
    }

    private void insert(Node node, List<? extends Collection<String>> topicSets, int depth, long id) {
        boolean last = depth == dimensions - 1;
        for (String topic : topicSets.get(depth)) {
            Node child = node.children.get(topic);
            if (child == null) {
                child = new Node();
                node.children.put(topic, child);
                nodeCount++;
            }
            if (last) {
                child.subscriberIds.add(id);
            } else {
                insert(child, topicSets, depth + 1, id);
            }
        }
    }

    /**
     * Removes the id from every path spanned by the topic sets and prunes the nodes left empty.
     * Paths that do not exist are ignored, so removing something never inserted is a no-op.
     *
     * @param topicSets the topic sets the id was inserted with
     * @param id the subscription id
     * @throws IllegalArgumentException if the number of topic sets differs from {@link #dimensions()}
     * @throws NullPointerException if a collection or a topic is null
     */
    public void remove(List<? extends Collection<String>> topicSets, long id) {
        checkTopicSets(topicSets);
        remove(root, topicSets, 0, id);
    }

    private void remove(Node node, List<? extends Collection<String>> topicSets, int depth, long id) {
        boolean last = depth == dimensions - 1;
        for (String topic : topicSets.get(depth)) {
            Node child = node.children.get(topic);
            if (child == null) {
                continue;
            }
            if (last) {
                child.subscriberIds.remove(id);
            } else {
                remove(child, topicSets, depth + 1, id);
            }
            if (child.isEmpty()) {
                node.children.remove(topic);
                nodeCount--;
            }
        }
    }

    /**
     * Finds every id whose topic sets intersect the query in all dimensions.
     *
     * @param query one collection of topics per dimension
     * @return the matching ids (never {@code null}, possibly empty)
     * @throws IllegalArgumentException if the number of query lists differs from {@link #dimensions()}
     * @throws NullPointerException if a collection or a topic is null
     */
    public Set<Long> match(List<? extends Collection<String>> query) {
        checkTopicSets(query);
        if (root.children.isEmpty() || hasEmptyDimension(query)) {
            return Collections.emptySet();
        }
        Set<Long> matched = new HashSet<>();
        collect(root, query, 0, matched);
        return matched;
    }

    private void collect(Node node, List<? extends Collection<String>> query, int depth, Set<Long> matched) {
        boolean last = depth == dimensions - 1;
        for (Node candidate : candidates(node, query.get(depth))) {
            if (last) {
                matched.addAll(candidate.subscriberIds);
            } else {
                collect(candidate, query, depth + 1, matched);
            }
        }
    }

    private static Collection<Node> candidates(Node node, Collection<String> topics) {
        if (node.children.isEmpty()) {
            return Collections.emptyList();
        }
        if (topics.contains(WILDCARD)) {
            return node.children.values();
        }
        // Identity semantics: each subtree is visited once even if several topics lead to it
        Set<Node> candidates = Collections.newSetFromMap(new IdentityHashMap<>());
        for (String topic : topics) {
            Node child = node.children.get(topic);
            if (child != null) {
                candidates.add(child);
            }
        }
        Node wildcard = node.children.get(WILDCARD);
        if (wildcard != null) {
            candidates.add(wildcard);
        }
        return candidates;
    }

    /**
     * Checks whether the index holds no subscription at all.
     *
     * @return true if the trie has no node below the root
     */
    public boolean isEmpty() {
        return root.children.isEmpty();
    }

    /**
     * Gets the number of trie nodes below the root, mainly to observe pruning.
     *
     * @return the node count
     */
    public int nodeCount() {
        return nodeCount;
    }

    public void clear() {
        root.children.clear();
        root.subscriberIds.clear();
        nodeCount = 0;
    }

    /**
     * Validates topic sets and returns an immutable copy suitable for keeping alongside an id.
     *
     * @param topicSets one collection of topics per dimension
     * @return an unmodifiable list of unmodifiable, insertion-ordered sets
     */
    List<Set<String>> copyOf(List<? extends Collection<String>> topicSets) {
        checkTopicSets(topicSets);
        List<Set<String>> copy = new ArrayList<>(topicSets.size());
        for (Collection<String> topics : topicSets) {
            copy.add(Collections.unmodifiableSet(new LinkedHashSet<>(topics)));
        }
        return Collections.unmodifiableList(copy);
    }

    private void checkTopicSets(List<? extends Collection<String>> topicSets) {
        Objects.requireNonNull(topicSets, "Topic sets must not be null");
        if (topicSets.size() != dimensions) {
            throw new IllegalArgumentException(
                "Expected topics for " + dimensions + " dimension(s), got " + topicSets.size());
        }
        for (Collection<String> topics : topicSets) {
            Objects.requireNonNull(topics, "Topics of a dimension must not be null");
            for (String topic : topics) {
                Objects.requireNonNull(topic, "Topic must not be null");
            }
        }
    }

    private static boolean hasEmptyDimension(List<? extends Collection<String>> topicSets) {
        for (Collection<String> topics : topicSets) {
            if (topics.isEmpty()) {
                return true;
            }
        }
        return false;
    }
}
