package com.ourd.hook;

import com.ourd.router.ActionException;
import com.ourd.router.DuplicateRegistrationException;
import com.ourd.router.ErrorCode;
import com.ourd.router.RequestContext;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HookRegistryTest {

    private final RequestContext context = new RequestContext("record:save", Map.of());

    @Test
    void executeWrite_failingBeforeSave_preventsSaveAndAfterSave() {
        AtomicInteger saves = new AtomicInteger();
        List<String> calls = new ArrayList<>();
        HookRegistry registry = new HookRegistry();
        registry.registerHook("note", TriggerPoint.BEFORE_SAVE, "validate", e -> {
            calls.add("validate");
            throw new ActionException(ErrorCode.INVALID_ARGUMENT, "title required");
        });
        registry.registerHook("note", TriggerPoint.BEFORE_SAVE, "stamp", e -> {
            calls.add("stamp");
            return null;
        });
        registry.registerHook("note", TriggerPoint.AFTER_SAVE, "notify", e -> {
            calls.add("notify");
            return null;
        });
        registry.freeze();

        ActionException e = assertThrows(ActionException.class, () -> registry.executeWrite("note", Map.of(), context, r -> {
            saves.incrementAndGet();
            return r;
        }));

        assertTrue(e.getError().is(ErrorCode.INVALID_ARGUMENT));
        assertEquals("title required", e.getError().message());
        assertEquals(0, saves.get());
        assertEquals(List.of("validate"), calls);
    }

    @Test
    void executeWrite_beforeHooksReplaceRecordInOrder() {
        HookRegistry registry = new HookRegistry();
        registry.registerHook("note", TriggerPoint.BEFORE_SAVE, "a", e -> with(e.record(), "trail", "a"));
        registry.registerHook("note", TriggerPoint.BEFORE_SAVE, "b", e -> with(e.record(), "trail", e.record().get("trail") + "b"));
        List<Object> seenAfter = new ArrayList<>();
        registry.registerHook("note", TriggerPoint.AFTER_SAVE, "audit", e -> {
            seenAfter.add(e.record().get("id"));
            return Map.of("ignored", true);
        });

        Map<String, Object> stored = registry.executeWrite("note", Map.of("title", "t"), context, r -> with(r, "id", "n1"));

        assertEquals("ab", stored.get("trail"));
        assertEquals("n1", stored.get("id"));
        assertEquals(List.of("n1"), seenAfter);
    }

    @Test
    void invokeHooks_afterTrigger_runsEveryHookThenReportsFirstFailure() {
        List<String> calls = new ArrayList<>();
        HookRegistry registry = new HookRegistry();
        registry.registerHook("note", TriggerPoint.AFTER_DELETE, "one", e -> {
            calls.add("one");
            throw new ActionException(ErrorCode.UNEXPECTED_ERROR, "one failed");
        });
        registry.registerHook("note", TriggerPoint.AFTER_DELETE, "two", e -> {
            calls.add("two");
            throw new ActionException(ErrorCode.UNEXPECTED_ERROR, "two failed");
        });
        registry.registerHook("note", TriggerPoint.AFTER_DELETE, "three", e -> {
            calls.add("three");
            return null;
        });

        ActionException e = assertThrows(ActionException.class,
                () -> registry.invokeHooks("note", TriggerPoint.AFTER_DELETE, Map.of(), context));

        assertEquals(List.of("one", "two", "three"), calls);
        assertEquals("one failed", e.getError().message());
    }

    @Test
    void invokeHooks_passesEventDetails() {
        HookRegistry registry = new HookRegistry();
        List<HookEvent> events = new ArrayList<>();
        registry.registerHook("note", TriggerPoint.BEFORE_DELETE, "capture", e -> {
            events.add(e);
            return null;
        });

        registry.invokeHooks("note", TriggerPoint.BEFORE_DELETE, Map.of("id", "n1"), context);

        assertEquals(1, events.size());
        assertEquals("note", events.get(0).recordType());
        assertEquals(TriggerPoint.BEFORE_DELETE, events.get(0).trigger());
        assertSame(context, events.get(0).context());
    }

    @Test
    void invokeHooks_unexpectedFailure_isWrapped() {
        HookRegistry registry = new HookRegistry();
        registry.registerHook("note", TriggerPoint.BEFORE_SAVE, "npe", e -> {
            throw new NullPointerException("x");
        });

        ActionException e = assertThrows(ActionException.class,
                () -> registry.invokeHooks("note", TriggerPoint.BEFORE_SAVE, Map.of(), context));

        assertTrue(e.getError().is(ErrorCode.UNEXPECTED_ERROR));
    }

    @Test
    void registerHook_appendsAcrossOwnersButRejectsSameNameInSlot() {
        HookRegistry registry = new HookRegistry();
        registry.registerHook("note", TriggerPoint.AFTER_SAVE, "native", e -> null);
        registry.registerHook("note", TriggerPoint.AFTER_SAVE, "plugin", e -> null, "sample");
        registry.registerHook("note", TriggerPoint.BEFORE_SAVE, "native", e -> null);

        assertThrows(DuplicateRegistrationException.class,
                () -> registry.registerHook("note", TriggerPoint.AFTER_SAVE, "native", e -> null));
        assertEquals(2, registry.getHooks("note", TriggerPoint.AFTER_SAVE).size());
        assertEquals("sample", registry.getHooks("note", TriggerPoint.AFTER_SAVE).get(1).owner());
        assertEquals(3, registry.size());
    }

    @Test
    void registerHook_sameNameUnderDifferentOwners_coexists() {
        HookRegistry registry = new HookRegistry();
        registry.registerHook("note", TriggerPoint.BEFORE_SAVE, "note:before-save", e -> null, "a");
        registry.registerHook("note", TriggerPoint.BEFORE_SAVE, "note:before-save", e -> null, "b");
        registry.registerHook("note", TriggerPoint.BEFORE_SAVE, "note:before-save", e -> null);

        List<HookRegistry.HookBinding> bound = registry.getHooks("note", TriggerPoint.BEFORE_SAVE);
        assertEquals(3, bound.size());
        assertEquals("a", bound.get(0).owner());
        assertEquals("b", bound.get(1).owner());
        assertNull(bound.get(2).owner());
        DuplicateRegistrationException dup = assertThrows(DuplicateRegistrationException.class,
                () -> registry.registerHook("note", TriggerPoint.BEFORE_SAVE, "note:before-save", e -> null, "b"));
        assertTrue(dup.getMessage().contains("note:before-save"));
    }

    @Test
    void registerHook_afterFreeze_isRejected() {
        HookRegistry registry = new HookRegistry();
        registry.freeze();

        assertThrows(IllegalStateException.class,
                () -> registry.registerHook("note", TriggerPoint.AFTER_SAVE, "late", e -> null));
    }

    @Test
    void triggerPoint_parsesWireNames() {
        assertEquals(TriggerPoint.BEFORE_SAVE, TriggerPoint.fromWireName("before-save"));
        assertEquals(TriggerPoint.AFTER_DELETE, TriggerPoint.fromWireName(" AFTER-DELETE "));
        assertThrows(IllegalArgumentException.class, () -> TriggerPoint.fromWireName("on-save"));
    }

    private static Map<String, Object> with(Map<String, Object> record, String key, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(record);
        copy.put(key, value);
        return copy;
    }
}
