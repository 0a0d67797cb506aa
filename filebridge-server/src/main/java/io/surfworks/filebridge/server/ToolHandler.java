package io.surfworks.filebridge.server;

import java.io.IOException;
import java.util.Map;

/**
 * Runs one tool. Returns the text shown to the caller.
 *
 * <p>{@link IOException} and {@link IllegalArgumentException} become error results.
 */
@FunctionalInterface
public interface ToolHandler {

    String handle(Map<String, Object> args) throws IOException;
}
