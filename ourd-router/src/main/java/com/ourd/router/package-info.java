/**
 * Action routing core.
 * <ul>
 *   <li>{@link com.ourd.router.RequestContext} – per-request mutable state passed through the chain</li>
 *   <li>{@link com.ourd.router.Preprocessor} / {@link com.ourd.router.Handler} – chain gates and business logic</li>
 *   <li>{@link com.ourd.router.Router} – registration phase, then lock-free dispatch by action or path rule</li>
 *   <li>{@link com.ourd.router.ActionError} / {@link com.ourd.router.ErrorCode} – caller-visible errors</li>
 * </ul>
 */
package com.ourd.router;
