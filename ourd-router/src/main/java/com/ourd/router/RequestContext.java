package com.ourd.router;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Mutable state of one in-flight request, threaded by reference through the preprocessor chain and the handler.
 * Preprocessors assemble everything the handler needs here (principal, storage connection, registries) and
 * may abort the request by setting an error; the handler's result or error ends up in the same slots.
 * <p>
 * Owned by a single request's execution path; not thread-safe and never shared across requests.
 * {@link #close()} releases the storage connection and must be called once the response is written.
 */
public final class RequestContext implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RequestContext.class);

    private final String action;
    private final Map<String, Object> payload;
    private final List<String> pathParams;
    private final Map<String, Object> attributes = new HashMap<>();
    private AuthPrincipal principal = AuthPrincipal.none();
    private StorageConnection storage;
    private Object result;
    private ActionError error;
    private boolean closed;

    public RequestContext(String action, Map<String, Object> payload) {
        this(action, payload, List.of());
    }

    /**
     * @param action     colon-qualified action name, or the rule key ({@code GET files/(.+)}) for path routes
     * @param payload    decoded request body; null = empty
     * @param pathParams capture groups of the matched path rule; null = none
     */
    public RequestContext(String action, Map<String, Object> payload, List<String> pathParams) {
        this.action = action != null ? action : "";
        this.payload = payload != null ? new LinkedHashMap<>(payload) : new LinkedHashMap<>();
        this.pathParams = pathParams != null ? List.copyOf(pathParams) : List.of();
    }

    public String getAction() {
        return action;
    }

    /** Decoded payload. Unmodifiable view; preprocessors use {@link #putPayload(String, Object)}. */
    public Map<String, Object> getPayload() {
        return Collections.unmodifiableMap(payload);
    }

    public void putPayload(String key, Object value) {
        payload.put(key, value);
    }

    /** Payload value as string, or null when absent or blank. */
    public String getPayloadString(String key) {
        Object v = payload.get(key);
        if (v == null) return null;
        String s = v.toString();
        return s.isBlank() ? null : s;
    }

    public List<String> getPathParams() {
        return pathParams;
    }

    public AuthPrincipal getPrincipal() {
        return principal;
    }

    public void setPrincipal(AuthPrincipal principal) {
        this.principal = Objects.requireNonNull(principal, "principal");
    }

    public StorageConnection getStorage() {
        return storage;
    }

    /** Attaches the request's storage connection; a previously attached one is closed first. */
    public void setStorage(StorageConnection storage) {
        if (this.storage != null && this.storage != storage) {
            closeStorage();
        }
        this.storage = storage;
    }

    public void setAttribute(String key, Object value) {
        Objects.requireNonNull(key, "key");
        if (value == null) {
            attributes.remove(key);
        } else {
            attributes.put(key, value);
        }
    }

    @SuppressWarnings("unchecked")
    public <T> T getAttribute(String key, Class<T> type) {
        Object v = attributes.get(key);
        return (v != null && type.isInstance(v)) ? (T) v : null;
    }

    /**
     * Sets the error slot. Once set, no further preprocessor and no handler runs for this request.
     * The first error wins; later calls are ignored.
     */
    public void abort(ActionError error) {
        Objects.requireNonNull(error, "error");
        if (this.error == null) {
            this.error = error;
        }
    }

    public void abort(ErrorCode code, String message) {
        abort(ActionError.of(code, message));
    }

    public boolean hasError() {
        return error != null;
    }

    public ActionError getError() {
        return error;
    }

    public Object getResult() {
        return result;
    }

    public void setResult(Object result) {
        this.result = result;
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        closeStorage();
    }

    private void closeStorage() {
        if (storage == null) return;
        try {
            storage.close();
        } catch (RuntimeException e) {
            log.warn("Failed to close storage connection for action {}: {}", action, e.getMessage(), e);
        } finally {
            storage = null;
        }
    }
}
