package com.ourd.plugin.process;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ourd.plugin.PluginCallException;
import com.ourd.plugin.PluginDescriptor;
import com.ourd.plugin.PluginHandshakeException;
import com.ourd.plugin.PluginTimeoutException;
import com.ourd.plugin.PluginTransportException;
import com.ourd.plugin.PluginUnavailableException;
import com.ourd.plugin.ScriptedPlugin;
import com.ourd.plugin.TransportKind;
import com.ourd.plugin.protocol.PluginCodec;
import com.ourd.router.ErrorCode;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PluginProcessPoolTest {

    private static final String EMPTY_REGISTRATION = "{\"handlers\":[],\"hooks\":[],\"lambdas\":[],\"timers\":[]}";

    private final SimpleMeterRegistry meters = new SimpleMeterRegistry();
    private final List<ScriptedPlugin> launched = new CopyOnWriteArrayList<>();
    private final List<PluginProcessPool> pools = new ArrayList<>();

    @AfterEach
    void tearDown() {
        pools.forEach(PluginProcessPool::shutdown);
    }

    private PluginProcessPool pool(int width, Duration callTimeout, Duration acquireTimeout,
                                   ReplacementPolicy policy, ProcessLauncher launcher) {
        PluginDescriptor descriptor = new PluginDescriptor("sample", TransportKind.EXEC, "sample", List.of(), width,
                callTimeout, Duration.ofSeconds(5), acquireTimeout);
        PluginProcessPool pool = new PluginProcessPool(descriptor, launcher, new PluginCodec(new ObjectMapper()), meters, policy);
        pools.add(pool);
        return pool;
    }

    private PluginProcessPool pool(int width, ScriptedPlugin.Script ops) {
        return pool(width, Duration.ofSeconds(5), Duration.ofSeconds(5), ReplacementPolicy.defaults(),
                ScriptedPlugin.launcher(ScriptedPlugin.declaring(EMPTY_REGISTRATION, ops), launched));
    }

    @Test
    void call_widthPlusOneConcurrentCalls_neverExceedWidthInFlight() throws Exception {
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        CountDownLatch release = new CountDownLatch(1);
        PluginProcessPool pool = pool(2, Duration.ofSeconds(5), Duration.ofMillis(300), ReplacementPolicy.defaults(),
                ScriptedPlugin.launcher(ScriptedPlugin.declaring(EMPTY_REGISTRATION, (req, p) -> {
                    maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
                    release.await(5, TimeUnit.SECONDS);
                    inFlight.decrementAndGet();
                    return ScriptedPlugin.result(req, "\"done\"");
                }), launched));
        pool.start();
        ExecutorService callers = Executors.newFixedThreadPool(3);
        try {
            List<Future<JsonNode>> calls = new ArrayList<>();
            for (int i = 0; i < 2; i++) {
                calls.add(callers.submit(() -> pool.call("slow", Map.of())));
            }
            await().atMost(Duration.ofSeconds(5)).until(() -> inFlight.get() == 2);

            Future<JsonNode> third = callers.submit(() -> pool.call("slow", Map.of()));
            Exception e = assertThrows(Exception.class, () -> third.get(5, TimeUnit.SECONDS));
            assertInstanceOf(PluginUnavailableException.class, e.getCause());

            release.countDown();
            for (Future<JsonNode> call : calls) {
                assertEquals("done", call.get(5, TimeUnit.SECONDS).asText());
            }
            assertEquals(2, maxInFlight.get());
        } finally {
            callers.shutdownNow();
        }
    }

    @Test
    void acquire_waitsForCheckIn() throws Exception {
        PluginProcessPool pool = pool(1, (req, p) -> ScriptedPlugin.result(req, "1"));
        pool.start();
        PluginProcess held = pool.acquire(Duration.ofSeconds(1));
        CountDownLatch waiting = new CountDownLatch(1);
        ExecutorService waiter = Executors.newSingleThreadExecutor();
        try {
            Future<PluginProcess> next = waiter.submit(() -> {
                waiting.countDown();
                return pool.acquire(Duration.ofSeconds(5));
            });
            assertTrue(waiting.await(5, TimeUnit.SECONDS));
            Thread.sleep(100);
            assertFalse(next.isDone());

            pool.release(held);

            assertSame(held, next.get(5, TimeUnit.SECONDS));
        } finally {
            waiter.shutdownNow();
        }
    }

    @Test
    void release_returnsProcessToTailOfQueue() throws Exception {
        PluginProcessPool pool = pool(2, (req, p) -> ScriptedPlugin.result(req, "1"));
        pool.start();
        PluginProcess first = pool.acquire(Duration.ofSeconds(1));
        PluginProcess second = pool.acquire(Duration.ofSeconds(1));

        pool.release(second);
        pool.release(first);

        assertSame(second, pool.acquire(Duration.ofSeconds(1)));
        assertSame(first, pool.acquire(Duration.ofSeconds(1)));
    }

    @Test
    void call_timeout_killsProcessAndReplacesIt() throws Exception {
        PluginProcessPool pool = pool(1, Duration.ofMillis(200), Duration.ofSeconds(5), ReplacementPolicy.defaults(),
                ScriptedPlugin.launcher(ScriptedPlugin.declaring(EMPTY_REGISTRATION,
                        (req, p) -> "hang".equals(req.path("name").asText()) ? null : ScriptedPlugin.result(req, "\"ok\"")),
                        launched));
        pool.start();

        assertThrows(PluginTimeoutException.class, () -> pool.call("hang", Map.of()));

        PluginProcess next = pool.acquire(Duration.ofSeconds(5));
        assertNotEquals(0, next.getInstanceId());
        assertEquals(ProcessState.BUSY, next.getState());
        assertFalse(launched.get(0).isAlive());
        pool.release(next);
        assertEquals("ok", pool.call("fine", Map.of()).asText());
        assertEquals(1.0, meters.get("ourd.plugin.calls").tag("outcome", "timeout").counter().count());
        assertEquals(1.0, meters.get("ourd.plugin.replacements").counter().count());
    }

    @Test
    void acquire_processExitedWhileIdle_isReplaced() throws Exception {
        PluginProcessPool pool = pool(1, (req, p) -> ScriptedPlugin.result(req, "\"ok\""));
        pool.start();

        launched.get(0).exit();

        assertEquals("ok", pool.call("x", Map.of()).asText());
        assertEquals(2, launched.size());
    }

    @Test
    void call_errorReply_keepsProcessReady() throws Exception {
        PluginProcessPool pool = pool(1, (req, p) -> ScriptedPlugin.error(req,
                "{\"code\":108,\"message\":\"title required\",\"info\":{\"field\":\"title\"}}"));
        pool.start();

        PluginCallException e = assertThrows(PluginCallException.class, () -> pool.call("note:validate", Map.of()));

        assertTrue(e.getError().is(ErrorCode.INVALID_ARGUMENT));
        assertEquals("title", e.getError().info().get("field"));
        assertEquals(1, pool.getReadyCount());
        assertEquals(1, launched.size());
    }

    @Test
    void deathsAboveRateLimit_disablePool() throws Exception {
        ReplacementPolicy policy = new ReplacementPolicy(1, Duration.ofMinutes(1), Clock.systemUTC());
        PluginProcessPool pool = pool(1, Duration.ofSeconds(5), Duration.ofSeconds(1), policy,
                ScriptedPlugin.launcher(id -> id == 0
                        ? ScriptedPlugin.declaring(EMPTY_REGISTRATION, (req, p) -> {
                            p.exit();
                            return null;
                        })
                        : (req, p) -> {
                            p.exit();
                            return null;
                        }, launched));
        pool.start();

        assertThrows(PluginTransportException.class, () -> pool.call("crash", Map.of()));

        await().atMost(Duration.ofSeconds(5)).until(pool::isDisabled);
        PluginUnavailableException e = assertThrows(PluginUnavailableException.class, () -> pool.call("x", Map.of()));
        assertTrue(e.getMessage().contains("disabled"));
        assertEquals(0, pool.getLiveCount());
    }

    @Test
    void start_handshakeFailure_shutsPoolDown() {
        PluginProcessPool pool = pool(2, Duration.ofSeconds(1), Duration.ofSeconds(1), ReplacementPolicy.defaults(),
                ScriptedPlugin.launcher(id -> id == 0
                        ? ScriptedPlugin.declaring(EMPTY_REGISTRATION, (req, p) -> null)
                        : (req, p) -> "{\"id\":0,\"kind\":\"result\",\"data\":{\"handlers\":\"not-a-list\"}}", launched));

        assertThrows(PluginHandshakeException.class, pool::start);

        assertTrue(pool.isShutdown());
        assertTrue(launched.stream().noneMatch(ScriptedPlugin::isAlive));
    }

    @Test
    void shutdown_failsLaterCalls() throws Exception {
        PluginProcessPool pool = pool(1, (req, p) -> ScriptedPlugin.result(req, "1"));
        pool.start();

        pool.shutdown();

        assertThrows(PluginUnavailableException.class, () -> pool.call("x", Map.of()));
        assertFalse(launched.get(0).isAlive());
    }

    @Test
    void replacementPolicy_countsOnlyDeathsInsideWindow() {
        MutableClock clock = new MutableClock();
        ReplacementPolicy policy = new ReplacementPolicy(2, Duration.ofSeconds(60), clock);

        assertFalse(policy.recordDeath());
        assertFalse(policy.recordDeath());
        clock.advance(Duration.ofSeconds(61));
        assertFalse(policy.recordDeath());
        assertFalse(policy.recordDeath());
        assertTrue(policy.recordDeath());
    }

    private static final class MutableClock extends Clock {
        private Instant now = Instant.parse("2024-01-01T00:00:00Z");

        void advance(Duration d) {
            now = now.plus(d);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
