package com.oncall.core.tools;

import java.util.List;

/**
 * Lists the tools currently offered by the tool executor.
 */
public interface ToolCatalog {

    List<ToolDescriptor> availableTools();
}
