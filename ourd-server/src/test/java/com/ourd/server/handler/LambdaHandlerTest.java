package com.ourd.server.handler;

import com.ourd.hook.LambdaRegistry;
import com.ourd.router.ActionException;
import com.ourd.router.ErrorCode;
import com.ourd.router.RequestContext;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LambdaHandlerTest {

    @Test
    void handle_passesArgsToLambda() {
        LambdaRegistry registry = new LambdaRegistry();
        registry.registerLambda("math:add", (args, ctx) ->
                ((Number) args.get("a")).intValue() + ((Number) args.get("b")).intValue());

        Object result = new LambdaHandler(registry, "math:add")
                .handle(new RequestContext("math:add", Map.of("args", Map.of("a", 2, "b", 3))));

        assertEquals(5, result);
    }

    @Test
    void handle_missingArgs_passesEmptyMap() {
        LambdaRegistry registry = new LambdaRegistry();
        registry.registerLambda("echo", (args, ctx) -> args);

        assertEquals(Map.of(), new LambdaHandler(registry, "echo").handle(new RequestContext("echo", Map.of())));
    }

    @Test
    void handle_nonObjectArgs_isInvalidArgument() {
        LambdaRegistry registry = new LambdaRegistry();
        registry.registerLambda("echo", (args, ctx) -> args);

        ActionException e = assertThrows(ActionException.class,
                () -> new LambdaHandler(registry, "echo").handle(new RequestContext("echo", Map.of("args", "nope"))));

        assertTrue(e.getError().is(ErrorCode.INVALID_ARGUMENT));
    }

    @Test
    void homeHandler_reportsOk() {
        assertEquals(Map.of("status", "OK"), new HomeHandler().handle(new RequestContext("", Map.of())));
    }
}
