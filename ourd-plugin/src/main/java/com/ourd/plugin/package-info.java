/**
 * Plugins: external processes that contribute actions, hooks, lambdas and timers.
 * <ul>
 *   <li>{@link com.ourd.plugin.PluginManager} - one pool per configured plugin, startup to shutdown</li>
 *   <li>{@link com.ourd.plugin.PluginRegistrar} - handshake and installation into router and registries</li>
 *   <li>{@link com.ourd.plugin.PluginErrors} - plugin failures to client-facing errors</li>
 * </ul>
 * Wire protocol lives in {@code com.ourd.plugin.protocol}; process lifecycle in {@code com.ourd.plugin.process}.
 */
package com.ourd.plugin;
