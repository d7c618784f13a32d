package com.patcharbiter.selector.tool;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A tool call argument in one of the shapes the helper scripts accept.
 *
 * Each variant renders itself as a single shell word. Anything else, such
 * as nested objects, fractional numbers or lists of non-integers, is
 * rejected by {@link #of(String, JsonNode)}.
 */
public interface ToolArgument {

    String render();

    record Text(String value) implements ToolArgument {
        @Override public String render() { return ShellQuoting.quote(value); }
    }

    record Int(long value) implements ToolArgument {
        @Override public String render() { return Long.toString(value); }
    }

    // The scripts compare against "true" case-insensitively.
    record Bool(boolean value) implements ToolArgument {
        @Override public String render() { return value ? "True" : "False"; }
    }

    /** Rendered the way the scripts parse it back, e.g. {@code '[1, 20]'}. */
    record IntList(List<Long> values) implements ToolArgument {
        @Override public String render() {
            return ShellQuoting.quote(values.stream()
                    .map(String::valueOf)
                    .collect(Collectors.joining(", ", "[", "]")));
        }
    }

    /**
     * Classify a JSON value.
     *
     * @return the argument, or null for a JSON null (the flag is then omitted)
     * @throws ToolArgumentException if the value has no command-line form
     */
    static ToolArgument of(String key, JsonNode node) {
        switch (node.getNodeType()) {
            case NULL:
            case MISSING:
                return null;
            case STRING:
                return new Text(node.asText());
            case BOOLEAN:
                return new Bool(node.booleanValue());
            case NUMBER:
                if (node.isIntegralNumber()) {
                    return new Int(node.longValue());
                }
                throw new ToolArgumentException("Failed call tool. Argument '" + key
                        + "' must be an integer, got " + node);
            case ARRAY:
                List<Long> values = new ArrayList<>();
                for (JsonNode element : node) {
                    values.add(integerElement(key, element));
                }
                return new IntList(values);
            default:
                throw new ToolArgumentException("Failed call tool. Argument '" + key + "' is "
                        + node.getNodeType().name().toLowerCase()
                        + " type, you need to check the definition of the tool.");
        }
    }

    private static long integerElement(String key, JsonNode element) {
        if (element.isIntegralNumber()) {
            return element.longValue();
        }
        if (element.isTextual()) {
            try {
                return Long.parseLong(element.asText().strip());
            } catch (NumberFormatException e) {
                // fall through to the shared error below
            }
        }
        throw new ToolArgumentException("Failed call tool. Argument '" + key
                + "' must be a list of integers, got " + element);
    }
}
