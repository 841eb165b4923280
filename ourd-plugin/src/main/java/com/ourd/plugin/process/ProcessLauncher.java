package com.ourd.plugin.process;

import com.ourd.plugin.PluginDescriptor;

import java.io.IOException;

/**
 * Starts plugin instances for a descriptor.
 */
@FunctionalInterface
public interface ProcessLauncher {

    LaunchedProcess launch(PluginDescriptor descriptor, int instanceId) throws IOException;
}
