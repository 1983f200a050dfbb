package org.dxworks.flowframe.analyzer;

import org.treesitter.TSNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

public class TreeSitterHelper {

    static final String[] FUNCTION_LITERAL_TYPES = {"arrow_function", "function_expression", "function"};

    static final String[] FUNCTION_SCOPE_TYPES = {
            "function_declaration", "generator_function_declaration", "function_expression", "function",
            "generator_function", "arrow_function", "method_definition", "program"
    };

    static final String[] BLOCK_SCOPE_TYPES = {
            "statement_block", "for_statement", "for_in_statement", "switch_body", "catch_clause",
            "function_declaration", "generator_function_declaration", "function_expression", "function",
            "generator_function", "arrow_function", "method_definition", "program"
    };

    private TreeSitterHelper() {
    }

    public static boolean isPresent(TSNode node) {
        return node != null && !node.isNull();
    }

    /**
     * Named child for a grammar field, or null when the field is absent.
     */
    public static TSNode field(TSNode parent, String fieldName) {
        if (!isPresent(parent)) return null;
        TSNode child = parent.getChildByFieldName(fieldName);
        return isPresent(child) ? child : null;
    }

    public static TSNode parent(TSNode node) {
        if (!isPresent(node)) return null;
        TSNode parent = node.getParent();
        return isPresent(parent) ? parent : null;
    }

    /**
     * Named children without comment nodes.
     */
    public static List<TSNode> namedChildren(TSNode parent) {
        List<TSNode> result = new ArrayList<>();
        if (!isPresent(parent)) return result;
        int count = parent.getNamedChildCount();
        for (int i = 0; i < count; i++) {
            TSNode child = parent.getNamedChild(i);
            if (isPresent(child) && !"comment".equals(child.getType())) {
                result.add(child);
            }
        }
        return result;
    }

    public static TSNode firstNamedChild(TSNode parent) {
        List<TSNode> children = namedChildren(parent);
        return children.isEmpty() ? null : children.get(0);
    }

    public static boolean hasAnonymousChild(TSNode parent, String tokenType) {
        if (!isPresent(parent)) return false;
        for (int i = 0; i < parent.getChildCount(); i++) {
            TSNode child = parent.getChild(i);
            if (isPresent(child) && !child.isNamed() && tokenType.equals(child.getType())) {
                return true;
            }
        }
        return false;
    }

    public static boolean isTypeOneOf(String type, String... types) {
        if (type == null) return false;
        for (String t : types) if (type.equals(t)) return true;
        return false;
    }

    public static boolean isNodeTypeOneOf(TSNode node, String... types) {
        if (!isPresent(node)) return false;
        return isTypeOneOf(node.getType(), types);
    }

    public static boolean isFunctionLiteral(TSNode node) {
        return isNodeTypeOneOf(node, FUNCTION_LITERAL_TYPES);
    }

    /**
     * Pre-order (source order) list of all named descendants of the given types, root included.
     */
    public static List<TSNode> findAllDescendantsOfTypes(TSNode root, String... types) {
        List<TSNode> result = new ArrayList<>();
        if (!isPresent(root)) return result;
        Deque<TSNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            TSNode node = stack.pop();
            if (!isPresent(node)) continue;
            if (isTypeOneOf(node.getType(), types)) result.add(node);
            for (int i = node.getNamedChildCount() - 1; i >= 0; i--) {
                TSNode child = node.getNamedChild(i);
                if (isPresent(child)) stack.push(child);
            }
        }
        return result;
    }

    public static boolean sameNode(TSNode a, TSNode b) {
        if (!isPresent(a) || !isPresent(b)) return false;
        return a.getStartByte() == b.getStartByte()
                && a.getEndByte() == b.getEndByte()
                && a.getType().equals(b.getType());
    }

    /**
     * True when {@code ancestor} is a strict ancestor of {@code node}.
     */
    public static boolean isDescendantOf(TSNode node, TSNode ancestor) {
        if (!isPresent(ancestor)) return false;
        TSNode current = parent(node);
        while (current != null) {
            if (sameNode(current, ancestor)) return true;
            current = parent(current);
        }
        return false;
    }

    public static TSNode nearestAncestorOfTypes(TSNode node, String... types) {
        TSNode current = parent(node);
        while (current != null) {
            if (isTypeOneOf(current.getType(), types)) return current;
            current = parent(current);
        }
        return null;
    }

    public static TSNode nearestFunctionScope(TSNode node) {
        return nearestAncestorOfTypes(node, FUNCTION_SCOPE_TYPES);
    }

    public static TSNode unwrapParentheses(TSNode node) {
        TSNode current = node;
        while (isNodeTypeOneOf(current, "parenthesized_expression")) {
            TSNode inner = firstNamedChild(current);
            if (inner == null) break;
            current = inner;
        }
        return current;
    }

    /**
     * Strips parentheses and {@code await} until an identifier is reached; null for any other callee shape.
     */
    public static TSNode calleeIdentifier(TSNode expression) {
        TSNode current = expression;
        while (true) {
            current = unwrapParentheses(current);
            if (isNodeTypeOneOf(current, "await_expression")) {
                current = firstNamedChild(current);
                continue;
            }
            break;
        }
        return isNodeTypeOneOf(current, "identifier") ? current : null;
    }

    public static List<TSNode> callArguments(TSNode call) {
        TSNode args = field(call, "arguments");
        if (!isNodeTypeOneOf(args, "arguments")) return new ArrayList<>();
        return namedChildren(args);
    }

    public static TSNode argument(List<TSNode> args, int index) {
        return index < args.size() ? args.get(index) : null;
    }

    /**
     * Body of an arrow function, function expression, function declaration or method.
     */
    public static TSNode functionBody(TSNode function) {
        return field(function, "body");
    }

    /**
     * Declared parameters of a function-like node. An unparenthesised arrow parameter is returned as a single entry.
     */
    public static List<TSNode> functionParameters(TSNode function) {
        TSNode single = field(function, "parameter");
        if (single != null) {
            List<TSNode> result = new ArrayList<>();
            result.add(single);
            return result;
        }
        return namedChildren(field(function, "parameters"));
    }

    /**
     * The binding pattern of a parameter, looking through TypeScript parameter wrappers.
     */
    public static TSNode parameterPattern(TSNode parameter) {
        if (isNodeTypeOneOf(parameter, "required_parameter", "optional_parameter")) {
            return field(parameter, "pattern");
        }
        return parameter;
    }

    /**
     * Last segment of a dotted callee: {@code deps.fetchUser} gives {@code fetchUser}.
     */
    public static String lastSegment(String callee) {
        int dot = callee.lastIndexOf('.');
        return dot >= 0 ? callee.substring(dot + 1) : callee;
    }

    /**
     * Collapse all whitespace (including newlines and tabs) to single spaces and trim.
     */
    public static String normalizeInline(String s) {
        if (s == null) return null;
        return s.replaceAll("\\s+", " ").trim();
    }

    /**
     * Traverses left in a member_expression chain to find the base identifier node.
     */
    public static TSNode getLeftmostIdentifier(TSNode memberExpr) {
        TSNode current = memberExpr;
        while (isNodeTypeOneOf(current, "member_expression")) {
            TSNode left = unwrapParentheses(field(current, "object"));
            if (isNodeTypeOneOf(left, "identifier")) {
                return left;
            }
            current = left;
        }
        return null;
    }
}
