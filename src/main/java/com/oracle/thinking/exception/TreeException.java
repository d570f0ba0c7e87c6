package com.oracle.thinking.exception;

/**
 * A tree operation addressed a session without a tree, or a node that does not exist.
 */
public class TreeException extends ThinkingException {

    public TreeException(String message) {
        super(message);
    }

    public static TreeException noTree(String sessionId) {
        return new TreeException("No thought tree found for session: " + sessionId);
    }

    public static TreeException nodeNotFound(String nodeId) {
        return new TreeException("Node not found: " + nodeId);
    }

    @Override
    public String getCode() {
        return "TREE_ERROR";
    }
}
