/**
 * The ourd server process: configuration, registration phase, HTTP listener and shutdown.
 */
package com.ourd.server;
