package org.carball.rlsguard.model.ast;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.BiFunction;
import java.util.function.Predicate;

/**
 * Generic walks over a condition tree. Every analysis pass is expressed as a fold or a
 * visitor on top of these instead of its own recursion.
 */
public final class PolicyTrees {

    private PolicyTrees() {
        // Utility class - prevent instantiation
    }

    /**
     * Pre-order, left to right.
     */
    public static List<PolicyConditionNode> preOrder(PolicyConditionNode root) {
        List<PolicyConditionNode> nodes = new ArrayList<>();
        if (root == null) {
            return nodes;
        }
        Deque<PolicyConditionNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            PolicyConditionNode node = stack.pop();
            nodes.add(node);
            List<PolicyConditionNode> children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return nodes;
    }

    public static <R> R fold(PolicyConditionNode root, R identity,
                             BiFunction<R, PolicyConditionNode, R> reducer) {
        R acc = identity;
        for (PolicyConditionNode node : preOrder(root)) {
            acc = reducer.apply(acc, node);
        }
        return acc;
    }

    /**
     * Runs the visitor on every node in pre-order and collects non-null results.
     */
    public static <R> List<R> collect(PolicyConditionNode root, PolicyNodeVisitor<R> visitor) {
        return fold(root, new ArrayList<>(), (acc, node) -> {
            R result = node.accept(visitor);
            if (result != null) {
                acc.add(result);
            }
            return acc;
        });
    }

    /**
     * A leaf has depth 1.
     */
    public static int depth(PolicyConditionNode node) {
        if (node == null) {
            return 0;
        }
        int max = 0;
        for (PolicyConditionNode child : node.children()) {
            max = Math.max(max, depth(child));
        }
        return max + 1;
    }

    public static int count(PolicyConditionNode root, NodeType type) {
        return fold(root, 0, (acc, node) -> node.nodeType() == type ? acc + 1 : acc);
    }

    public static boolean anyMatch(PolicyConditionNode root, Predicate<PolicyConditionNode> predicate) {
        return preOrder(root).stream().anyMatch(predicate);
    }
}
