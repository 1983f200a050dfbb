package org.dxworks.flowframe.analyzer;

import org.treesitter.TSNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.dxworks.flowframe.analyzer.TreeSitterHelper.*;

/**
 * First parameter of a workflow callback: either a plain name ({@code step}, {@code saga}) or a destructured
 * object whose properties ({@code step}, {@code tryStep}) are bound to local aliases.
 */
public class CallbackParameter {

    static final String DEFAULT_STEP_NAME = "step";

    private final boolean destructured;
    private final String name;
    // property name -> local binding name
    private final Map<String, String> aliases;

    CallbackParameter(boolean destructured, String name, Map<String, String> aliases) {
        this.destructured = destructured;
        this.name = name;
        this.aliases = aliases;
    }

    public static CallbackParameter of(ParsedSource source, TSNode callback) {
        List<TSNode> parameters = functionParameters(callback);
        if (parameters.isEmpty()) return new CallbackParameter(false, null, Collections.emptyMap());

        TSNode pattern = parameterPattern(parameters.get(0));
        if (isNodeTypeOneOf(pattern, "assignment_pattern")) pattern = field(pattern, "left");
        if (!isNodeTypeOneOf(pattern, "object_pattern")) {
            return new CallbackParameter(false, pattern != null ? source.text(pattern) : null, Collections.emptyMap());
        }

        Map<String, String> aliases = new LinkedHashMap<>();
        for (TSNode element : namedChildren(pattern)) {
            switch (element.getType()) {
                case "shorthand_property_identifier_pattern" -> aliases.put(source.text(element), source.text(element));
                case "object_assignment_pattern" -> {
                    TSNode left = field(element, "left");
                    if (left != null) aliases.put(source.text(left), source.text(left));
                }
                case "pair_pattern" -> {
                    TSNode key = field(element, "key");
                    TSNode value = field(element, "value");
                    if (isNodeTypeOneOf(value, "assignment_pattern")) value = field(value, "left");
                    if (key != null && isNodeTypeOneOf(value, "identifier")) {
                        aliases.put(LiteralValues.propertyName(source, key), source.text(value));
                    }
                }
                default -> {
                }
            }
        }
        return new CallbackParameter(true, null, aliases);
    }

    public boolean isDestructured() {
        return destructured;
    }

    public String getName() {
        return name;
    }

    public String aliasOf(String property) {
        return aliases.get(property);
    }

    /**
     * Names that denote the step function inside the callback body.
     */
    public Set<String> stepNames() {
        Set<String> names = new LinkedHashSet<>();
        if (destructured) {
            String alias = aliasOf("step");
            if (alias != null) names.add(alias);
        } else if (name != null) {
            names.add(name);
        }
        if (names.isEmpty()) names.add(DEFAULT_STEP_NAME);
        return names;
    }
}
