/**
 * Extension registries consulted by the write path and by callers of named functions.
 * <ul>
 *   <li>{@link com.ourd.hook.HookRegistry} – (record type, trigger point) → ordered hooks; before-hooks can veto</li>
 *   <li>{@link com.ourd.hook.LambdaRegistry} – named callable functions</li>
 *   <li>{@link com.ourd.hook.TimerRegistry} – scheduled invocables, started through a {@link com.ourd.hook.TimerScheduler}</li>
 * </ul>
 * All three are filled during startup registration and frozen before the server accepts requests.
 */
package com.ourd.hook;
