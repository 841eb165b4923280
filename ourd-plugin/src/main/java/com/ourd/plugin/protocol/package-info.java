/**
 * Plugin wire protocol: newline-delimited JSON messages over a process's stdin/stdout.
 * <ul>
 *   <li>{@link com.ourd.plugin.protocol.PluginRequest} - {@code init} or {@code op}, sent by the server</li>
 *   <li>{@link com.ourd.plugin.protocol.PluginResponse} - {@code result} or {@code error}, echoing the id</li>
 *   <li>{@link com.ourd.plugin.protocol.StreamTransport} - one in-flight call per session, deadline per call</li>
 * </ul>
 */
package com.ourd.plugin.protocol;
