package com.ourd.router;

/**
 * Storage connection opened for one request by a preprocessor and closed when the request completes.
 * Record persistence itself lives in the storage engine behind this handle.
 */
public interface StorageConnection extends AutoCloseable {

    /** Application (database) this connection is bound to. */
    String getAppName();

    boolean isOpen();

    @Override
    void close();
}
