package com.ourd.server.preprocess;

import com.ourd.router.ErrorCode;
import com.ourd.router.Preprocessor;
import com.ourd.router.RequestContext;
import com.ourd.server.storage.StorageDriver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Opens a storage connection for the request. The request context closes it when the request ends.
 */
public final class ConnectionPreprocessor implements Preprocessor {

    private static final Logger log = LoggerFactory.getLogger(ConnectionPreprocessor.class);

    private final StorageDriver driver;
    private final String appName;
    private final String option;

    public ConnectionPreprocessor(StorageDriver driver, String appName, String option) {
        this.driver = driver;
        this.appName = appName;
        this.option = option;
    }

    @Override
    public void process(RequestContext context) {
        try {
            context.setStorage(driver.open(appName, option));
        } catch (RuntimeException e) {
            log.error("Failed to open {} storage for app {}: {}", driver.getName(), appName, e.getMessage(), e);
            context.abort(ErrorCode.UNEXPECTED_ERROR, "failed to open database");
        }
    }
}
