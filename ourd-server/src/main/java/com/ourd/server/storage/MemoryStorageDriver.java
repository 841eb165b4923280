package com.ourd.server.storage;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Process-local storage: one record map per application, shared by all connections to it.
 * Records do not survive a restart.
 */
public final class MemoryStorageDriver implements StorageDriver {

    public static final String NAME = "memory";

    private final ConcurrentMap<String, ConcurrentMap<String, Map<String, Object>>> apps = new ConcurrentHashMap<>();
    private final AtomicInteger openConnections = new AtomicInteger();

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public RecordConnection open(String appName, String option) {
        openConnections.incrementAndGet();
        return new Connection(appName, apps.computeIfAbsent(appName, k -> new ConcurrentHashMap<>()));
    }

    /** Connections opened and not yet closed. */
    public int getOpenConnections() {
        return openConnections.get();
    }

    private final class Connection implements RecordConnection {

        private final String appName;
        private final ConcurrentMap<String, Map<String, Object>> records;
        private volatile boolean open = true;

        Connection(String appName, ConcurrentMap<String, Map<String, Object>> records) {
            this.appName = appName;
            this.records = records;
        }

        @Override
        public String getAppName() {
            return appName;
        }

        @Override
        public boolean isOpen() {
            return open;
        }

        @Override
        public Map<String, Object> save(String recordType, Map<String, Object> record) {
            ensureOpen();
            Map<String, Object> stored = new LinkedHashMap<>(record);
            Object id = stored.get("_id");
            if (id == null || id.toString().isBlank()) {
                stored.put("_id", UUID.randomUUID().toString());
            }
            records.put(key(recordType, stored.get("_id").toString()), stored);
            return new LinkedHashMap<>(stored);
        }

        @Override
        public Optional<Map<String, Object>> fetch(String recordType, String id) {
            ensureOpen();
            Map<String, Object> record = records.get(key(recordType, id));
            return record != null ? Optional.of(new LinkedHashMap<>(record)) : Optional.empty();
        }

        @Override
        public boolean delete(String recordType, String id) {
            ensureOpen();
            return records.remove(key(recordType, id)) != null;
        }

        @Override
        public void close() {
            if (open) {
                open = false;
                openConnections.decrementAndGet();
            }
        }

        private void ensureOpen() {
            if (!open) {
                throw new IllegalStateException("connection to " + appName + " is closed");
            }
        }

        private String key(String recordType, String id) {
            return recordType + "/" + id;
        }
    }
}
