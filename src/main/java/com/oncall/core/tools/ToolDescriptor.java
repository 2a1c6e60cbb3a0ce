package com.oncall.core.tools;

/**
 * A tool the executor can run, as described to the reasoning oracle.
 *
 * @param name function name
 * @param description what the tool returns
 * @param inputSchema JSON schema of the arguments, as text; may be empty
 */
public record ToolDescriptor(String name, String description, String inputSchema) {
}
