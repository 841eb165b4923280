package com.ourd.server.storage;

import com.ourd.router.StorageConnection;

import java.util.Map;
import java.util.Optional;

/**
 * Storage connection that can persist records keyed by type and id.
 */
public interface RecordConnection extends StorageConnection {

    /** Stores the record, assigning {@code _id} when absent; returns the stored copy. */
    Map<String, Object> save(String recordType, Map<String, Object> record);

    Optional<Map<String, Object>> fetch(String recordType, String id);

    /** @return true when a record was removed */
    boolean delete(String recordType, String id);
}
