package com.ourd.plugin.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.ourd.plugin.PluginException;
import com.ourd.plugin.PluginProtocolException;
import com.ourd.plugin.PluginTimeoutException;
import com.ourd.plugin.PluginTransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link PluginTransport} over a byte stream pair (a process's stdout and stdin).
 * <p>
 * A daemon reader thread turns each line into an {@link Inbound} item; callers wait on the queue
 * with a deadline. After a timeout, protocol violation or stream failure the transport is closed
 * and every later call fails with {@link PluginTransportException}.
 * <p>
 * A caller interrupted while waiting keeps waiting until the response or the deadline; the
 * interrupt flag is restored afterwards.
 */
public final class StreamTransport implements PluginTransport {

    private static final Logger log = LoggerFactory.getLogger(StreamTransport.class);

    private final String pluginName;
    private final PluginCodec codec;
    private final BufferedReader reader;
    private final Writer writer;
    private final BlockingQueue<Inbound> inbox = new LinkedBlockingQueue<>();
    private final AtomicBoolean open = new AtomicBoolean(true);
    private final Thread readerThread;
    private long nextId;

    public StreamTransport(String pluginName, InputStream fromProcess, OutputStream toProcess, PluginCodec codec) {
        this.pluginName = pluginName;
        this.codec = codec;
        this.reader = new BufferedReader(new InputStreamReader(fromProcess, StandardCharsets.UTF_8));
        this.writer = new OutputStreamWriter(toProcess, StandardCharsets.UTF_8);
        this.readerThread = new Thread(this::readLoop, "ourd-plugin-reader-" + pluginName);
        this.readerThread.setDaemon(true);
        this.readerThread.start();
    }

    @Override
    public PluginResponse init(Duration timeout) throws PluginException {
        return exchange(PluginRequest.KIND_INIT, PluginRequest.KIND_INIT, null, timeout);
    }

    @Override
    public PluginResponse call(String name, Object context, Duration timeout) throws PluginException {
        return exchange(PluginRequest.KIND_OP, name, context, timeout);
    }

    private synchronized PluginResponse exchange(String kind, String name, Object context, Duration timeout)
            throws PluginException {
        if (!open.get()) {
            throw new PluginTransportException(pluginName, "transport is closed");
        }
        long id = nextId++;
        PluginRequest request = new PluginRequest(id, kind, name, context);
        write(request);
        Inbound inbound = await(id, timeout);
        if (inbound.failure() != null) {
            close();
            throw inbound.failure();
        }
        PluginResponse response = inbound.response();
        if (response.id() != id) {
            close();
            throw new PluginProtocolException(pluginName,
                    "expected response id " + id + " but received " + response.id());
        }
        return response;
    }

    private void write(PluginRequest request) throws PluginException {
        String line;
        try {
            line = codec.encode(request);
        } catch (JsonProcessingException e) {
            throw new PluginProtocolException(pluginName, "cannot encode request '" + request.name() + "': " + e.getOriginalMessage(), e);
        }
        try {
            writer.write(line);
            writer.write('\n');
            writer.flush();
        } catch (IOException e) {
            close();
            throw new PluginTransportException(pluginName, "write failed: " + e.getMessage(), e);
        }
    }

    private Inbound await(long id, Duration timeout) throws PluginTimeoutException {
        long deadline = System.nanoTime() + timeout.toNanos();
        boolean interrupted = false;
        try {
            while (true) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    close();
                    throw new PluginTimeoutException(pluginName,
                            "no response to request " + id + " within " + timeout.toMillis() + "ms");
                }
                try {
                    Inbound inbound = inbox.poll(remaining, TimeUnit.NANOSECONDS);
                    if (inbound != null) {
                        return inbound;
                    }
                } catch (InterruptedException e) {
                    interrupted = true;
                }
            }
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private void readLoop() {
        try {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                try {
                    inbox.add(Inbound.of(codec.decode(line)));
                } catch (IllegalArgumentException e) {
                    inbox.add(Inbound.failed(new PluginProtocolException(pluginName, "malformed message: " + e.getMessage(), e)));
                    return;
                }
            }
            inbox.add(Inbound.failed(new PluginTransportException(pluginName, "plugin output closed")));
        } catch (IOException e) {
            if (open.get()) {
                log.debug("Plugin {} output failed: {}", pluginName, e.getMessage());
            }
            inbox.add(Inbound.failed(new PluginTransportException(pluginName, "plugin output failed: " + e.getMessage(), e)));
        }
    }

    @Override
    public boolean isOpen() {
        return open.get();
    }

    @Override
    public void close() {
        if (!open.compareAndSet(true, false)) {
            return;
        }
        try {
            writer.close();
        } catch (IOException e) {
            log.debug("Closing input of plugin {} failed: {}", pluginName, e.getMessage());
        }
    }

    private record Inbound(PluginResponse response, PluginException failure) {

        static Inbound of(PluginResponse response) {
            return new Inbound(response, null);
        }

        static Inbound failed(PluginException failure) {
            return new Inbound(null, failure);
        }
    }
}
