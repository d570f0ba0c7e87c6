package com.oracle.thinking.tree;

import com.oracle.thinking.model.ThoughtRecord;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A thought placed in a session tree. Visit statistics change only through
 * {@link MctsEngine#backpropagate}; structure changes only through {@link ThoughtTree}.
 */
@Getter
public class ThoughtNode {

    private final String nodeId;
    private final long sequence;
    private final int thoughtNumber;
    private final String thought;
    private final String sessionId;
    private final String branchId;
    private final boolean revision;
    private final Integer revisesThought;
    private final Integer branchFromThought;
    private final boolean terminal;
    private final long createdAt;

    @Setter(AccessLevel.PACKAGE)
    private String parentId;

    @Setter(AccessLevel.PACKAGE)
    private int depth;

    @Getter(AccessLevel.NONE)
    private final List<String> children = new ArrayList<>();

    private int visitCount;
    private double totalValue;

    @Setter(AccessLevel.PACKAGE)
    private long lastAccessed;

    @Setter
    private Double confidence;

    ThoughtNode(String nodeId, long sequence, ThoughtRecord record, String parentId, int depth, long now) {
        this.nodeId = nodeId;
        this.sequence = sequence;
        this.thoughtNumber = record.getThoughtNumber();
        this.thought = record.getThought();
        this.sessionId = record.getSessionId();
        this.branchId = record.getBranchId();
        this.revision = Boolean.TRUE.equals(record.getRevision());
        this.revisesThought = record.getRevisesThought();
        this.branchFromThought = record.getBranchFromThought();
        this.terminal = record.isTerminal();
        this.parentId = parentId;
        this.depth = depth;
        this.createdAt = now;
        this.lastAccessed = now;
    }

    public List<String> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public int getChildCount() {
        return children.size();
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    public double getAverageValue() {
        return visitCount == 0 ? 0.0 : totalValue / visitCount;
    }

    void addChild(String childId) {
        children.add(childId);
    }

    void removeChild(String childId) {
        children.remove(childId);
    }

    void replaceChild(String childId, List<String> replacements) {
        int index = children.indexOf(childId);
        if (index < 0) {
            children.addAll(replacements);
            return;
        }
        children.remove(index);
        children.addAll(index, replacements);
    }

    void recordVisit(double value) {
        visitCount++;
        totalValue += value;
    }
}
