package com.ourd.server.storage;

/**
 * Opens per-request storage connections for an application.
 */
public interface StorageDriver extends AutoCloseable {

    String getName();

    RecordConnection open(String appName, String option);

    @Override
    default void close() {
    }
}
