package io.surfworks.filebridge.server;

/**
 * JSON input schemas for tools whose arguments are all strings.
 */
final class ToolSchema {

    private final String[] required;
    private String[] optional;

    private ToolSchema(String[] required, String[] optional) {
        this.required = required;
        this.optional = optional;
    }

    static String empty() {
        return "{\"type\": \"object\", \"properties\": {}}";
    }

    static ToolSchema optional(String... props) {
        return new ToolSchema(new String[0], props);
    }

    static ToolSchema required(String... props) {
        return new ToolSchema(props, new String[0]);
    }

    ToolSchema with(String... props) {
        this.optional = props;
        return this;
    }

    @Override
    public String toString() {
        var sb = new StringBuilder("{\"type\": \"object\"");
        if (required.length > 0) {
            sb.append(", \"required\": [");
            for (int i = 0; i < required.length; i++) {
                if (i > 0) sb.append(", ");
                sb.append("\"").append(required[i]).append("\"");
            }
            sb.append("]");
        }
        sb.append(", \"properties\": {");
        boolean first = true;
        for (String prop : required) {
            if (!first) sb.append(", ");
            sb.append("\"").append(prop).append("\": {\"type\": \"string\"}");
            first = false;
        }
        for (String prop : optional) {
            if (!first) sb.append(", ");
            sb.append("\"").append(prop).append("\": {\"type\": \"string\"}");
            first = false;
        }
        sb.append("}}");
        return sb.toString();
    }
}
