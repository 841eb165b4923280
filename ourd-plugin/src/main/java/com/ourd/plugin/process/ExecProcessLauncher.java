package com.ourd.plugin.process;

import com.ourd.plugin.PluginDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;

/**
 * Launches plugins as operating system processes. The plugin's stderr is forwarded to the log
 * line by line.
 */
public final class ExecProcessLauncher implements ProcessLauncher {

    private static final Logger log = LoggerFactory.getLogger(ExecProcessLauncher.class);
    private static final long DESTROY_GRACE_MILLIS = 2_000;

    @Override
    public LaunchedProcess launch(PluginDescriptor descriptor, int instanceId) throws IOException {
        ProcessBuilder builder = new ProcessBuilder(descriptor.command());
        builder.redirectError(ProcessBuilder.Redirect.PIPE);
        Process process = builder.start();
        String label = descriptor.name() + "#" + instanceId;
        log.debug("Started plugin {} (pid {}): {}", label, process.pid(), descriptor.command());
        Thread stderr = new Thread(() -> forwardStderr(label, process.getErrorStream()), "ourd-plugin-stderr-" + label);
        stderr.setDaemon(true);
        stderr.start();
        return new OsProcess(label, process);
    }

    private static void forwardStderr(String label, InputStream stderr) {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(stderr, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                log.info("[plugin {}] {}", label, line);
            }
        } catch (IOException e) {
            log.debug("stderr of plugin {} closed: {}", label, e.getMessage());
        }
    }

    private static final class OsProcess implements LaunchedProcess {

        private final String label;
        private final Process process;

        OsProcess(String label, Process process) {
            this.label = label;
            this.process = process;
        }

        @Override
        public InputStream getInputStream() {
            return process.getInputStream();
        }

        @Override
        public OutputStream getOutputStream() {
            return process.getOutputStream();
        }

        @Override
        public boolean isAlive() {
            return process.isAlive();
        }

        @Override
        public void destroy() {
            if (!process.isAlive()) {
                return;
            }
            process.destroy();
            try {
                if (!process.waitFor(DESTROY_GRACE_MILLIS, TimeUnit.MILLISECONDS)) {
                    log.warn("Plugin {} ignored termination, killing it", label);
                    process.destroyForcibly();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                process.destroyForcibly();
            }
        }
    }
}
