package com.oncall.core.model;

import java.io.Serializable;

public record ToolError(ToolErrorType type, String message) implements Serializable {
}
