package org.dxworks.flowframe.analyzer;

import org.dxworks.flowframe.model.DependencyInfo;
import org.treesitter.TSNode;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.dxworks.flowframe.analyzer.TreeSitterHelper.*;

public class DependencyExtractor {

    private static final Pattern RESULT_TYPE = Pattern.compile("Result\\s*<");
    private static final Pattern UNION_SEPARATOR = Pattern.compile("\\s*\\|\\s*");
    private static final Pattern ERROR_TAG = Pattern.compile("^[A-Z_][A-Z0-9_]*$", Pattern.CASE_INSENSITIVE);

    private final ParsedSource source;
    private final TypeTextResolver types;

    public DependencyExtractor(ParsedSource source, TypeTextResolver types) {
        this.source = source;
        this.types = types;
    }

    /**
     * One entry per {@code key: value} and shorthand property of the dependency object literal.
     */
    public List<DependencyInfo> extract(TSNode depsNode) {
        List<DependencyInfo> dependencies = new ArrayList<>();
        TSNode object = unwrapParentheses(depsNode);
        if (!isNodeTypeOneOf(object, "object")) return dependencies;

        for (TSNode property : namedChildren(object)) {
            switch (property.getType()) {
                case "pair" -> {
                    TSNode key = field(property, "key");
                    if (key == null) continue;
                    String typeText = types.typeOfValue(field(property, "value"));
                    dependencies.add(new DependencyInfo(LiteralValues.propertyName(source, key), typeText,
                            inferErrorTypes(typeText)));
                }
                case "shorthand_property_identifier" -> {
                    String typeText = types.typeOfValue(property);
                    dependencies.add(new DependencyInfo(source.text(property), typeText, inferErrorTypes(typeText)));
                }
                default -> {
                }
            }
        }
        return dependencies;
    }

    static Set<String> dependencyNames(ParsedSource source, TSNode object) {
        Set<String> names = new LinkedHashSet<>();
        if (!isNodeTypeOneOf(object, "object")) return names;
        for (TSNode property : namedChildren(object)) {
            if ("pair".equals(property.getType())) {
                TSNode key = field(property, "key");
                if (key != null) names.add(LiteralValues.propertyName(source, key));
            } else if ("shorthand_property_identifier".equals(property.getType())) {
                names.add(source.text(property));
            }
        }
        return names;
    }

    /**
     * Error tags from the second type argument of the first {@code Result<T, E>} in a type text.
     */
    static List<String> inferErrorTypes(String typeText) {
        List<String> errors = new ArrayList<>();
        if (typeText == null) return errors;
        Matcher matcher = RESULT_TYPE.matcher(typeText);
        if (!matcher.find()) return errors;

        int depth = 1;
        int comma = -1;
        int i = matcher.end();
        for (; i < typeText.length() && depth > 0; i++) {
            char c = typeText.charAt(i);
            if (c == '<' || c == '[' || c == '{' || c == '(') {
                depth++;
            } else if (c == '>' || c == ']' || c == '}' || c == ')') {
                depth--;
            } else if (c == ',' && depth == 1 && comma < 0) {
                comma = i;
            }
        }
        if (depth != 0 || comma < 0) return errors;

        String errorArgument = typeText.substring(comma + 1, i - 1).trim();
        for (String member : UNION_SEPARATOR.split(errorArgument)) {
            String tag = stripQuotes(member.trim());
            if (ERROR_TAG.matcher(tag).matches()) errors.add(tag);
        }
        return errors;
    }

    private static String stripQuotes(String s) {
        return s.replaceAll("^['\"`]", "").replaceAll("['\"`]$", "");
    }
}
