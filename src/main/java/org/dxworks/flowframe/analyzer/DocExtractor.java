package org.dxworks.flowframe.analyzer;

import org.dxworks.flowframe.model.DocComment;
import org.dxworks.flowframe.model.JsDocParam;
import org.treesitter.TSNode;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.dxworks.flowframe.analyzer.TreeSitterHelper.*;

/**
 * Associates {@code /** ... *}{@code /} comments with statements and parses their tags.
 */
public class DocExtractor {

    private static final Pattern PARAM_TAG = Pattern.compile(
            "^(?:@?\\w+\\s+)?(?:\\{[^}]*\\}\\s*)?\\[?(\\w+)\\]?\\s*[-–—]\\s*(.*)$", Pattern.DOTALL);
    private static final Pattern TAG_START = Pattern.compile("^@(\\w+)");
    private static final Pattern TRAILING_STARS = Pattern.compile("\\s*\\*+\\s*$");
    private static final Pattern LEADING_TYPE = Pattern.compile("^\\s*\\{[^}]*\\}\\s*");

    private final ParsedSource source;

    public DocExtractor(ParsedSource source) {
        this.source = source;
    }

    /**
     * Documentation of the statement that contains {@code node}.
     */
    public DocComment forContainingStatement(TSNode node) {
        return forStatement(containingStatement(node));
    }

    /**
     * Documentation directly preceding a statement, looking through an {@code export} wrapper.
     */
    public DocComment forStatement(TSNode statement) {
        if (statement == null) return null;
        TSNode anchor = statement;
        TSNode parent = parent(anchor);
        if (isNodeTypeOneOf(parent, "export_statement")) anchor = parent;

        String comment = precedingDocComment(anchor);
        return comment != null ? parse(comment) : null;
    }

    /**
     * Nearest enclosing expression or variable statement, or the direct child of a block.
     */
    static TSNode containingStatement(TSNode node) {
        TSNode current = node;
        while (true) {
            TSNode parent = parent(current);
            if (parent == null) return current;
            if (isNodeTypeOneOf(parent, "expression_statement", "lexical_declaration", "variable_declaration")) {
                return parent;
            }
            if (isNodeTypeOneOf(parent, "statement_block", "program")) return current;
            current = parent;
        }
    }

    private String precedingDocComment(TSNode anchor) {
        String text = source.getSourceCode();
        int anchorStart = source.charOffset(anchor.getStartByte());
        String before = text.substring(0, anchorStart);
        int end = before.length();
        while (end > 0 && Character.isWhitespace(before.charAt(end - 1))) end--;
        if (end < 2 || !before.startsWith("*/", end - 2)) return null;
        int start = before.lastIndexOf("/**", end - 2);
        if (start < 0 || before.indexOf("*/", start + 2) != end - 2) return null;
        return before.substring(start, end).replace("\r\n", "\n");
    }

    static DocComment parse(String comment) {
        String body = comment.substring(3, comment.length() - 2);
        List<String> descriptionLines = new ArrayList<>();
        List<StringBuilder> tags = new ArrayList<>();
        for (String rawLine : body.split("\n", -1)) {
            String line = rawLine.replaceFirst("^\\s*\\*(?!/)\\s?", "");
            String trimmed = line.trim();
            if (trimmed.startsWith("@")) {
                tags.add(new StringBuilder(trimmed));
            } else if (!tags.isEmpty()) {
                tags.get(tags.size() - 1).append('\n').append(line);
            } else {
                descriptionLines.add(line);
            }
        }

        DocComment doc = new DocComment();
        String description = String.join("\n", descriptionLines).trim();
        doc.description = description.isEmpty() ? null : description;

        for (StringBuilder tagText : tags) {
            String text = tagText.toString().trim();
            Matcher tag = TAG_START.matcher(text);
            if (!tag.find()) continue;
            switch (tag.group(1)) {
                case "param", "arg", "argument" -> {
                    JsDocParam param = parseParam(text);
                    if (param != null) doc.params.add(param);
                }
                case "returns", "return" -> doc.returns = emptyToNull(tagValue(text));
                case "throws", "exception" -> doc.throwsDescriptions.add(tagValue(text));
                case "example" -> doc.example = emptyToNull(text.substring(tag.end()).trim());
                default -> {
                }
            }
        }
        return doc.isEmpty() ? null : doc;
    }

    static JsDocParam parseParam(String text) {
        Matcher matcher = PARAM_TAG.matcher(text);
        if (matcher.matches()) {
            return new JsDocParam(matcher.group(1), cleanDescription(matcher.group(2)));
        }

        String[] words = text.split("\\s+");
        List<String> candidates = new ArrayList<>();
        for (int i = 1; i < words.length; i++) {
            if (!isTypeToken(words[i])) candidates.add(words[i]);
        }
        if (candidates.isEmpty()) return null;
        String rawName = candidates.get(0);
        String name = rawName.replaceFirst("^@", "").replaceAll("^\\[|\\]$", "").split("=", 2)[0];
        if (name.isEmpty()) return null;
        String description = String.join(" ", candidates.subList(1, candidates.size()))
                .replaceFirst("^[-–—]\\s*", "");
        return new JsDocParam(name, cleanDescription(description));
    }

    private static boolean isTypeToken(String word) {
        return word.startsWith("{") && word.endsWith("}");
    }

    /**
     * Tag text without the tag marker and a leading {@code {Type}}.
     */
    private static String tagValue(String text) {
        String afterTag = text.replaceFirst("^@\\w+\\s*", "");
        afterTag = LEADING_TYPE.matcher(afterTag).replaceFirst("");
        return TRAILING_STARS.matcher(afterTag).replaceFirst("").trim();
    }

    private static String cleanDescription(String description) {
        if (description == null) return null;
        return emptyToNull(TRAILING_STARS.matcher(description).replaceFirst("").trim());
    }

    private static String emptyToNull(String s) {
        return s == null || s.isEmpty() ? null : s;
    }
}
