package io.surfworks.filebridge.server;

import java.util.Map;

final class ToolArgs {

    private ToolArgs() {}

    static String getString(Map<String, Object> args, String key) {
        Object value = args.get(key);
        return value != null ? value.toString() : null;
    }

    static String require(Map<String, Object> args, String key) {
        String value = getString(args, key);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Missing required argument '" + key + "'");
        }
        return value;
    }
}
