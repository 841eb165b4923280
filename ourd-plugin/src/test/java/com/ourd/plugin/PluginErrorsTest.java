package com.ourd.plugin;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ourd.router.ActionError;
import com.ourd.router.ErrorCode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PluginErrorsTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void toActionError_mapsEachFailureClass() {
        ActionError callError = ActionError.of(ErrorCode.PERMISSION_DENIED, "no");

        assertSame(callError, PluginErrors.toActionError(new PluginCallException("p", callError)));
        assertTrue(PluginErrors.toActionError(new PluginTimeoutException("p", "slow")).is(ErrorCode.PLUGIN_TIMEOUT));
        assertTrue(PluginErrors.toActionError(new PluginUnavailableException("p", "busy")).is(ErrorCode.PLUGIN_UNAVAILABLE));
        ActionError protocol = PluginErrors.toActionError(new PluginProtocolException("p", "bad id"));
        assertTrue(protocol.is(ErrorCode.UNEXPECTED_ERROR));
        assertEquals("p", protocol.info().get("plugin"));
    }

    @Test
    void decodeError_readsCodeMessageAndInfo() throws Exception {
        ActionError known = PluginErrors.decodeError(mapper.readTree("""
                {"code": 108, "message": "title required", "info": {"field": "title"}}
                """));
        ActionError text = PluginErrors.decodeError(mapper.readTree("\"boom\""));

        assertEquals("InvalidArgument", known.name());
        assertEquals("title required", known.message());
        assertEquals("title", known.info().get("field"));
        assertTrue(text.is(ErrorCode.UNEXPECTED_ERROR));
        assertEquals("boom", text.message());
    }

    @Test
    void registrationInfo_rejectsMalformedDeclarations() throws Exception {
        PluginRegistrationInfo empty = PluginRegistrationInfo.fromJson(mapper.readTree("{}"));

        assertTrue(empty.isEmpty());
        assertThrows(IllegalArgumentException.class,
                () -> PluginRegistrationInfo.fromJson(mapper.readTree("{\"hooks\":[{\"type\":\"note\",\"trigger\":\"on-save\"}]}")));
        assertThrows(IllegalArgumentException.class,
                () -> PluginRegistrationInfo.fromJson(mapper.readTree("{\"timers\":[{\"name\":\"t\"}]}")));
        assertThrows(IllegalArgumentException.class,
                () -> PluginRegistrationInfo.fromJson(mapper.readTree("{\"lambdas\":[1]}")));
        assertThrows(IllegalArgumentException.class, () -> PluginRegistrationInfo.fromJson(mapper.readTree("[]")));
    }
}
