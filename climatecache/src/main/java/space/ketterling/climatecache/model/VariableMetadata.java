package space.ketterling.climatecache.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Descriptive metadata stored next to each cache variable.
 *
 * <p>
 * Every field is optional on disk; absent fields stay {@code null} and are
 * not written back.
 * </p>
 */
public record VariableMetadata(
        String units,
        String sourceVariable,
        String sourceDataset,
        String temporalDefinition,
        Integer precision) {

    /**
     * Reads metadata from a parsed mapping, ignoring unknown keys.
     */
    public static VariableMetadata fromNode(JsonNode node) {
        if (node == null || !node.isObject())
            return new VariableMetadata(null, null, null, null, null);
        JsonNode precision = node.get("precision");
        Integer p = null;
        if (precision != null && precision.canConvertToInt() && !precision.isTextual())
            p = precision.asInt();
        else if (precision != null && precision.isTextual()) {
            try {
                p = Integer.parseInt(precision.asText().trim());
            } catch (NumberFormatException e) {
                p = null;
            }
        }
        return new VariableMetadata(
                textOrNull(node, "units"),
                textOrNull(node, "source_variable"),
                textOrNull(node, "source_dataset"),
                textOrNull(node, "temporal_definition"),
                p);
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode v = node.get(field);
        if (v == null || v.isNull())
            return null;
        return v.asText();
    }
}
