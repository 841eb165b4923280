package com.ourd.server.storage;

import com.ourd.config.ConfigurationException;

/** Resolves {@code db.implName} to a driver. */
public final class StorageDrivers {

    private StorageDrivers() {
    }

    public static StorageDriver forName(String implName) {
        if (MemoryStorageDriver.NAME.equals(implName)) {
            return new MemoryStorageDriver();
        }
        throw new ConfigurationException("Unknown db.implName '" + implName + "'; available: " + MemoryStorageDriver.NAME);
    }
}
