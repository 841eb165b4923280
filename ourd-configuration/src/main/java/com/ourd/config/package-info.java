/**
 * Server configuration: a single JSON file located by the first command-line argument or
 * {@code OD_CONFIG}.
 */
package com.ourd.config;
