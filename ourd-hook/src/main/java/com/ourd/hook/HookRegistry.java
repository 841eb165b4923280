package com.ourd.hook;

import com.ourd.router.ActionError;
import com.ourd.router.ActionException;
import com.ourd.router.DuplicateRegistrationException;
import com.ourd.router.ErrorCode;
import com.ourd.router.RequestContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Dispatch table from (record type, trigger point) to an ordered list of hooks. Native and plugin hooks
 * coexist: registration appends, in registration order. Populated during startup, then {@link #freeze() frozen}
 * and read without locking.
 * <p>
 * Ordering rules applied by {@link #invokeHooks}:
 * <ul>
 *   <li>{@code before-*}: hooks run in order; the first failure stops the list and is rethrown unchanged.</li>
 *   <li>{@code after-*}: every hook runs; failures are logged and, once the list completed, the first one is rethrown.</li>
 * </ul>
 * The registry holds no business logic; write handlers consult it, typically through
 * {@link #executeWrite} / {@link #executeDelete}.
 */
public final class HookRegistry {

    /** Context attribute under which the hook registry preprocessor exposes the registry. */
    public static final String CONTEXT_ATTRIBUTE = "ourd.hookRegistry";

    private static final Logger log = LoggerFactory.getLogger(HookRegistry.class);

    /** "recordType" → trigger → bindings */
    private volatile Map<String, Map<TriggerPoint, List<HookBinding>>> bindings = new LinkedHashMap<>();
    private volatile boolean frozen;

    /**
     * Registered hook with its name (unique per owner within its slot) and owner (plugin name, or null for native hooks).
     */
    public record HookBinding(String name, Hook hook, String owner) {
        public HookBinding {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(hook, "hook");
        }
    }

    /** Registers a native hook; see {@link #registerHook(String, TriggerPoint, String, Hook, String)}. */
    public void registerHook(String recordType, TriggerPoint trigger, String name, Hook hook) {
        registerHook(recordType, trigger, name, hook, null);
    }

    /**
     * Appends a hook to the list of {@code (recordType, trigger)}.
     *
     * @param name  hook name, unique within the slot for this owner
     * @param owner plugin that provides the hook; null for native hooks
     * @throws DuplicateRegistrationException if the slot already holds a hook with this name and owner
     * @throws IllegalStateException          if the registry is frozen
     */
    public synchronized void registerHook(String recordType, TriggerPoint trigger, String name, Hook hook, String owner) {
        String type = requireText(recordType, "recordType");
        Objects.requireNonNull(trigger, "trigger");
        String hookName = requireText(name, "name");
        if (frozen) {
            throw new IllegalStateException("Hook registry is frozen; hooks can only be registered during startup");
        }
        List<HookBinding> list = bindings
                .computeIfAbsent(type, k -> new LinkedHashMap<>())
                .computeIfAbsent(trigger, k -> new ArrayList<>());
        for (HookBinding b : list) {
            if (b.name().equals(hookName) && Objects.equals(b.owner(), owner)) {
                throw new DuplicateRegistrationException("Hook",
                        type + "/" + trigger + "/" + (owner != null ? owner + "/" : "") + hookName);
            }
        }
        list.add(new HookBinding(hookName, hook, owner));
        log.debug("Registered hook {} for {} {} (owner={})", hookName, type, trigger, owner != null ? owner : "native");
    }

    /** Ends the registration phase; later registrations fail. Idempotent. */
    public synchronized void freeze() {
        if (frozen) return;
        Map<String, Map<TriggerPoint, List<HookBinding>>> copy = new LinkedHashMap<>();
        bindings.forEach((type, byTrigger) -> {
            Map<TriggerPoint, List<HookBinding>> t = new LinkedHashMap<>();
            byTrigger.forEach((trigger, list) -> t.put(trigger, List.copyOf(list)));
            copy.put(type, Collections.unmodifiableMap(t));
        });
        bindings = Collections.unmodifiableMap(copy);
        frozen = true;
    }

    /** Hooks bound to the slot, in registration order; empty when none. */
    public List<HookBinding> getHooks(String recordType, TriggerPoint trigger) {
        Map<TriggerPoint, List<HookBinding>> byTrigger = bindings.get(recordType);
        if (byTrigger == null) return List.of();
        List<HookBinding> list = byTrigger.get(trigger);
        return list != null ? List.copyOf(list) : List.of();
    }

    /** Number of hook bindings across all slots. */
    public int size() {
        int n = 0;
        for (Map<TriggerPoint, List<HookBinding>> byTrigger : bindings.values()) {
            for (List<HookBinding> list : byTrigger.values()) n += list.size();
        }
        return n;
    }

    /**
     * Runs the hooks bound to {@code (recordType, trigger)} per the ordering rules of this registry.
     *
     * @return the record after all replacements made by {@code before-*} hooks (the input record for {@code after-*})
     * @throws ActionException the first hook failure, unchanged
     */
    public Map<String, Object> invokeHooks(String recordType, TriggerPoint trigger, Map<String, Object> record,
                                           RequestContext context) {
        HookEvent event = new HookEvent(recordType, trigger, record, context);
        List<HookBinding> list = getHooks(recordType, trigger);
        if (trigger.isBefore()) {
            for (HookBinding binding : list) {
                Map<String, Object> replaced = invokeOne(binding, event);
                if (replaced != null) {
                    event = event.withRecord(replaced);
                }
            }
            return event.record();
        }
        ActionException first = null;
        for (HookBinding binding : list) {
            try {
                invokeOne(binding, event);
            } catch (ActionException e) {
                log.warn("After hook {} for {} {} failed: {}", binding.name(), recordType, trigger, e.getError().message());
                if (first == null) first = e;
            }
        }
        if (first != null) throw first;
        return event.record();
    }

    /**
     * Guarded save: {@code before-save} hooks, then {@code write}, then {@code after-save} hooks with the written record.
     * If a {@code before-save} hook fails, {@code write} is never called and that hook's error is thrown.
     *
     * @param write performs the save and returns the stored record
     * @return the stored record
     */
    public Map<String, Object> executeWrite(String recordType, Map<String, Object> record, RequestContext context,
                                            UnaryOperator<Map<String, Object>> write) {
        return guarded(recordType, TriggerPoint.BEFORE_SAVE, TriggerPoint.AFTER_SAVE, record, context, write);
    }

    /** Guarded delete; same rules as {@link #executeWrite} with the delete trigger points. */
    public Map<String, Object> executeDelete(String recordType, Map<String, Object> record, RequestContext context,
                                             UnaryOperator<Map<String, Object>> delete) {
        return guarded(recordType, TriggerPoint.BEFORE_DELETE, TriggerPoint.AFTER_DELETE, record, context, delete);
    }

    private Map<String, Object> guarded(String recordType, TriggerPoint before, TriggerPoint after,
                                        Map<String, Object> record, RequestContext context,
                                        UnaryOperator<Map<String, Object>> operation) {
        Objects.requireNonNull(operation, "operation");
        Map<String, Object> prepared = invokeHooks(recordType, before, record, context);
        Map<String, Object> written = operation.apply(prepared);
        Map<String, Object> stored = written != null ? written : prepared;
        invokeHooks(recordType, after, stored, context);
        return stored;
    }

    private static Map<String, Object> invokeOne(HookBinding binding, HookEvent event) {
        try {
            return binding.hook().invoke(event);
        } catch (ActionException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Hook {} for {} {} failed unexpectedly: {}", binding.name(), event.recordType(), event.trigger(), e.getMessage(), e);
            throw new ActionException(ActionError.of(ErrorCode.UNEXPECTED_ERROR,
                    "Hook " + binding.name() + " failed: " + e.getMessage()), e);
        }
    }

    private static String requireText(String value, String field) {
        Objects.requireNonNull(value, field);
        String v = value.trim();
        if (v.isEmpty()) {
            throw new IllegalArgumentException(field + " must be non-blank");
        }
        return v;
    }
}
