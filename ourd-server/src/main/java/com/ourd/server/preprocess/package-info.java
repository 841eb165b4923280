/**
 * Built-in preprocessors. Chains are assembled in {@link com.ourd.server.ServerBootstrap}:
 * <ul>
 *   <li>read: token store, authenticator, connection</li>
 *   <li>write: hook registry, token store, authenticator, connection, require user</li>
 *   <li>plugin actions and lambdas: token store, authenticator, connection</li>
 * </ul>
 */
package com.ourd.server.preprocess;
