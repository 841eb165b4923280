/**
 * Plugin process lifecycle: launching, the per-process state machine and the fixed-width pool
 * with FIFO checkout and rate-limited replacement.
 */
package com.ourd.plugin.process;
