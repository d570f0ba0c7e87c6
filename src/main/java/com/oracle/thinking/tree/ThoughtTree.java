package com.oracle.thinking.tree;

import com.oracle.thinking.exception.TreeException;
import com.oracle.thinking.model.ThoughtRecord;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The thought tree of one session.
 *
 * <p>New thoughts attach under the cursor unless they branch from, or revise, an earlier
 * thought number. The cursor always moves to the node just admitted. When the tree grows past
 * its ceiling it is pruned, lowest-value leaves first; root and cursor are never removed.
 *
 * <p>When only a chain is left, pruning splices interior nodes out instead. Their children
 * move up to the removed node's parent and the depths of that subtree drop by one, so parent
 * and depth of a node are not fixed once it is admitted. This keeps the tree within its ceiling
 * at the cost of the path shape it was built with.
 *
 * <p>Not thread-safe. Callers hold the lock of the owning manager.
 */
@Slf4j
public class ThoughtTree {

    static final int MAX_SERIALIZED_THOUGHT_LENGTH = 100;

    /**
     * Removal order: evaluated nodes before unvisited ones, then lowest average value,
     * then least recently touched, then oldest.
     */
    static final Comparator<ThoughtNode> PRUNE_ORDER = Comparator
            .comparing((ThoughtNode n) -> n.getVisitCount() == 0)
            .thenComparingDouble(ThoughtNode::getAverageValue)
            .thenComparingLong(ThoughtNode::getLastAccessed)
            .thenComparingLong(ThoughtNode::getSequence);

    private final String sessionId;
    private final int maxNodes;
    private final Clock clock;
    private final Map<String, ThoughtNode> nodes = new LinkedHashMap<>();
    private final Map<Integer, List<String>> thoughtNumberIndex = new HashMap<>();
    private String rootId;
    private String cursorId;
    private long nodeCounter;
    private long lastAccessed;

    public ThoughtTree(String sessionId, int maxNodes, Clock clock) {
        if (maxNodes < 2) {
            throw new IllegalArgumentException("A thought tree needs room for at least 2 nodes, got " + maxNodes);
        }
        this.sessionId = sessionId;
        this.maxNodes = maxNodes;
        this.clock = clock;
        this.lastAccessed = clock.millis();
    }

    /**
     * Places the record in the tree, moves the cursor onto it and prunes if over capacity.
     */
    public ThoughtNode addThought(ThoughtRecord record) {
        long now = clock.millis();
        ThoughtNode parent = resolveParent(record);
        int depth = parent == null ? 0 : parent.getDepth() + 1;
        String nodeId = "node_" + (++nodeCounter) + "_" + Long.toString(now, 36);

        ThoughtNode node = new ThoughtNode(nodeId, nodeCounter, record,
                parent == null ? null : parent.getNodeId(), depth, now);
        nodes.put(nodeId, node);
        thoughtNumberIndex.computeIfAbsent(node.getThoughtNumber(), k -> new ArrayList<>()).add(nodeId);

        if (parent == null) {
            rootId = nodeId;
        } else {
            parent.addChild(nodeId);
            parent.setLastAccessed(now);
        }
        cursorId = nodeId;
        lastAccessed = now;

        if (nodes.size() > maxNodes) {
            prune();
        }
        return node;
    }

    private ThoughtNode resolveParent(ThoughtRecord record) {
        if (rootId == null) {
            return null;
        }
        ThoughtNode cursor = nodes.get(cursorId);

        if (record.isBranch()) {
            return findNodeByThoughtNumber(record.getBranchFromThought()).orElseGet(() -> {
                log.debug("Branch origin #{} not found in session {}, attaching to cursor",
                        record.getBranchFromThought(), sessionId);
                return cursor;
            });
        }

        if (record.isRevisionOf()) {
            Optional<ThoughtNode> revised = findNodeByThoughtNumber(record.getRevisesThought());
            if (revised.isEmpty()) {
                return cursor;
            }
            ThoughtNode target = revised.get();
            // a revision of the root cannot be its sibling, so it becomes its child
            return target.getParentId() == null ? target : nodes.get(target.getParentId());
        }

        return cursor;
    }

    /**
     * Node carrying the given thought number. When several do, the one on the cursor's
     * ancestor chain wins, otherwise the oldest.
     */
    public Optional<ThoughtNode> findNodeByThoughtNumber(int thoughtNumber) {
        List<String> ids = thoughtNumberIndex.get(thoughtNumber);
        if (ids == null || ids.isEmpty()) {
            return Optional.empty();
        }
        if (ids.size() > 1 && cursorId != null) {
            Set<String> chain = new HashSet<>();
            for (ThoughtNode n : getAncestorPath(cursorId)) {
                chain.add(n.getNodeId());
            }
            for (String id : ids) {
                if (chain.contains(id)) {
                    return Optional.of(nodes.get(id));
                }
            }
        }
        return Optional.of(nodes.get(ids.get(0)));
    }

    public ThoughtNode setCursor(String nodeId) {
        ThoughtNode node = getNode(nodeId);
        cursorId = nodeId;
        long now = clock.millis();
        node.setLastAccessed(now);
        lastAccessed = now;
        return node;
    }

    public Optional<ThoughtNode> findNode(String nodeId) {
        return Optional.ofNullable(nodes.get(nodeId));
    }

    public ThoughtNode getNode(String nodeId) {
        ThoughtNode node = nodes.get(nodeId);
        if (node == null) {
            throw TreeException.nodeNotFound(nodeId);
        }
        return node;
    }

    public Optional<ThoughtNode> getRoot() {
        return rootId == null ? Optional.empty() : Optional.of(nodes.get(rootId));
    }

    public Optional<ThoughtNode> getCursor() {
        return cursorId == null ? Optional.empty() : Optional.of(nodes.get(cursorId));
    }

    /**
     * Path from the root down to the given node, both inclusive.
     */
    public List<ThoughtNode> getAncestorPath(String nodeId) {
        List<ThoughtNode> path = new ArrayList<>();
        ThoughtNode current = getNode(nodeId);
        while (current != null) {
            path.add(current);
            current = current.getParentId() == null ? null : nodes.get(current.getParentId());
        }
        Collections.reverse(path);
        return path;
    }

    public List<ThoughtNode> getChildren(String nodeId) {
        List<ThoughtNode> children = new ArrayList<>();
        for (String childId : getNode(nodeId).getChildren()) {
            children.add(nodes.get(childId));
        }
        return children;
    }

    public List<ThoughtNode> getLeafNodes() {
        return nodes.values().stream().filter(ThoughtNode::isLeaf).toList();
    }

    public List<ThoughtNode> getExpandableNodes() {
        return nodes.values().stream().filter(n -> !n.isTerminal()).toList();
    }

    public Collection<ThoughtNode> getAllNodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    public int size() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    public String getSessionId() {
        return sessionId;
    }

    public int getMaxNodes() {
        return maxNodes;
    }

    public long getLastAccessed() {
        return lastAccessed;
    }

    public void touch() {
        lastAccessed = clock.millis();
    }

    /**
     * Depth-limited structure rooted at the root node, or null for an empty tree.
     * Children below {@code maxDepth} are replaced by a {@link TreeStructure.Truncated} marker.
     */
    public TreeStructure toStructure(Integer maxDepth) {
        if (rootId == null) {
            return null;
        }
        return toStructure(nodes.get(rootId), 0, maxDepth == null ? Integer.MAX_VALUE : maxDepth);
    }

    private TreeStructure toStructure(ThoughtNode node, int currentDepth, int maxDepth) {
        List<TreeStructure> children;
        if (node.isLeaf()) {
            children = List.of();
        } else if (currentDepth >= maxDepth) {
            children = List.of(new TreeStructure.Truncated(node.getChildCount()));
        } else {
            children = new ArrayList<>();
            for (String childId : node.getChildren()) {
                children.add(toStructure(nodes.get(childId), currentDepth + 1, maxDepth));
            }
        }
        String text = node.getThought();
        if (text.length() > MAX_SERIALIZED_THOUGHT_LENGTH) {
            text = text.substring(0, MAX_SERIALIZED_THOUGHT_LENGTH) + "...";
        }
        return TreeStructure.Node.builder()
                .nodeId(node.getNodeId())
                .thoughtNumber(node.getThoughtNumber())
                .thought(text)
                .depth(node.getDepth())
                .visitCount(node.getVisitCount())
                .averageValue(node.getAverageValue())
                .terminal(node.isTerminal())
                .cursor(node.getNodeId().equals(cursorId))
                .childCount(node.getChildCount())
                .children(children)
                .build();
    }

    /**
     * Removes prunable leaves until the tree fits. If only the cursor's own ancestor chain is
     * left, interior nodes on it are spliced out and their children re-attached one level up.
     */
    void prune() {
        int removed = 0;
        while (nodes.size() > maxNodes) {
            Optional<ThoughtNode> leaf = nodes.values().stream()
                    .filter(n -> n.isLeaf() && isPrunable(n))
                    .min(PRUNE_ORDER);
            if (leaf.isPresent()) {
                removeLeaf(leaf.get());
                removed++;
                continue;
            }
            Optional<ThoughtNode> interior = nodes.values().stream()
                    .filter(this::isPrunable)
                    .min(PRUNE_ORDER);
            if (interior.isEmpty()) {
                break;
            }
            splice(interior.get());
            removed++;
        }
        log.debug("Pruned {} nodes from tree of session {}, size now {}", removed, sessionId, nodes.size());
    }

    private boolean isPrunable(ThoughtNode node) {
        return !node.getNodeId().equals(rootId) && !node.getNodeId().equals(cursorId);
    }

    private void removeLeaf(ThoughtNode node) {
        ThoughtNode parent = nodes.get(node.getParentId());
        if (parent != null) {
            parent.removeChild(node.getNodeId());
        }
        unregister(node);
    }

    private void splice(ThoughtNode node) {
        ThoughtNode parent = nodes.get(node.getParentId());
        List<String> orphans = new ArrayList<>(node.getChildren());
        parent.replaceChild(node.getNodeId(), orphans);
        for (String childId : orphans) {
            ThoughtNode child = nodes.get(childId);
            child.setParentId(parent.getNodeId());
            shiftDepth(child, -1);
        }
        unregister(node);
    }

    private void shiftDepth(ThoughtNode subtreeRoot, int delta) {
        Deque<ThoughtNode> pending = new ArrayDeque<>();
        pending.push(subtreeRoot);
        while (!pending.isEmpty()) {
            ThoughtNode node = pending.pop();
            node.setDepth(node.getDepth() + delta);
            for (String childId : node.getChildren()) {
                pending.push(nodes.get(childId));
            }
        }
    }

    private void unregister(ThoughtNode node) {
        nodes.remove(node.getNodeId());
        List<String> ids = thoughtNumberIndex.get(node.getThoughtNumber());
        if (ids != null) {
            ids.remove(node.getNodeId());
            if (ids.isEmpty()) {
                thoughtNumberIndex.remove(node.getThoughtNumber());
            }
        }
    }
}
