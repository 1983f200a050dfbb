package org.dxworks.flowframe.analyzer;

import org.dxworks.flowframe.model.StepNode;
import org.treesitter.TSNode;

import java.util.ArrayList;
import java.util.List;

import static org.dxworks.flowframe.analyzer.TreeSitterHelper.*;

/**
 * Static values of literal expressions.
 */
public class LiteralValues {

    private LiteralValues() {
    }

    public static boolean isStringLiteral(TSNode node) {
        return isNodeTypeOneOf(node, "string");
    }

    public static boolean isPlainTemplate(TSNode node) {
        return isNodeTypeOneOf(node, "template_string")
                && findAllDescendantsOfTypes(node, "template_substitution").isEmpty();
    }

    /**
     * A string literal or a template literal without substitutions.
     */
    public static boolean isStaticString(TSNode node) {
        return isStringLiteral(node) || isPlainTemplate(node);
    }

    /**
     * Content of a string or template literal without its delimiters, with simple escapes resolved.
     */
    public static String stringContent(ParsedSource source, TSNode node) {
        String text = source.text(node);
        if (text.length() < 2) return text;
        return unescape(text.substring(1, text.length() - 1));
    }

    /**
     * Value of a static string, or null for anything else.
     */
    public static String staticString(ParsedSource source, TSNode node) {
        return isStaticString(node) ? stringContent(source, node) : null;
    }

    /**
     * Static string value, or the source text of any other expression.
     */
    public static String literalOrText(ParsedSource source, TSNode node) {
        String value = staticString(source, node);
        return value != null ? value : source.text(node);
    }

    /**
     * Static string value; {@code <dynamic>} for a template with substitutions; source text otherwise.
     */
    public static String stringValue(ParsedSource source, TSNode node) {
        if (isStaticString(node)) return stringContent(source, node);
        if (isNodeTypeOneOf(node, "template_string")) return StepNode.DYNAMIC;
        return source.text(node);
    }

    /**
     * Identifier of a step-family call from its first argument: the literal value, or {@code <dynamic>}.
     */
    public static String stepIdValue(ParsedSource source, TSNode node) {
        if (node == null) return StepNode.MISSING;
        String value = staticString(source, node);
        return value != null ? value : StepNode.DYNAMIC;
    }

    /**
     * Static strings of an array literal; template literals with substitutions are skipped.
     */
    public static List<String> stringArray(ParsedSource source, TSNode array) {
        List<String> values = new ArrayList<>();
        for (TSNode element : namedChildren(array)) {
            String value = stringValue(source, element);
            if (!StepNode.DYNAMIC.equals(value)) values.add(value);
        }
        return values;
    }

    /**
     * Value of a numeric literal as Long or Double, or null when it is not a plain number.
     */
    public static Number numberValue(ParsedSource source, TSNode node) {
        if (!isNodeTypeOneOf(node, "number")) return null;
        String text = source.text(node).replace("_", "");
        try {
            String lower = text.toLowerCase();
            if (lower.startsWith("0x")) return Long.parseLong(text.substring(2), 16);
            if (lower.startsWith("0o")) return Long.parseLong(text.substring(2), 8);
            if (lower.startsWith("0b")) return Long.parseLong(text.substring(2), 2);
            if (lower.contains(".") || lower.contains("e")) return Double.parseDouble(text);
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public static Boolean booleanValue(TSNode node) {
        if (isNodeTypeOneOf(node, "true")) return Boolean.TRUE;
        if (isNodeTypeOneOf(node, "false")) return Boolean.FALSE;
        return null;
    }

    /**
     * Name of an object property key: identifiers verbatim, string keys by value.
     */
    public static String propertyName(ParsedSource source, TSNode key) {
        if (isStaticString(key)) return stringContent(source, key);
        return source.text(key);
    }

    static String unescape(String raw) {
        if (raw.indexOf('\\') < 0) return raw;
        StringBuilder sb = new StringBuilder(raw.length());
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (c != '\\' || i + 1 >= raw.length()) {
                sb.append(c);
                continue;
            }
            char next = raw.charAt(++i);
            switch (next) {
                case 'n' -> sb.append('\n');
                case 't' -> sb.append('\t');
                case 'r' -> sb.append('\r');
                case '0' -> sb.append('\0');
                case '\n' -> {
                    // line continuation
                }
                default -> sb.append(next);
            }
        }
        return sb.toString();
    }
}
