package com.ourd.server;

import ch.qos.logback.classic.Level;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class OurdServerApplicationTest {

    @Test
    void resolveConfigPath_prefersArgument() {
        Path path = OurdServerApplication.resolveConfigPath(new String[]{"ourd.json"},
                Map.of("OD_CONFIG", "env.json"), System.out);

        assertEquals(Path.of("ourd.json"), path);
    }

    @Test
    void resolveConfigPath_fallsBackToEnvironment() {
        Path path = OurdServerApplication.resolveConfigPath(new String[0], Map.of("OD_CONFIG", "env.json"), System.out);

        assertEquals(Path.of("env.json"), path);
    }

    @Test
    void resolveConfigPath_withNothing_printsUsage() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);

        assertNull(OurdServerApplication.resolveConfigPath(new String[0], Map.of(), out));
        assertEquals("Usage: ourd [<config file>]", buffer.toString(StandardCharsets.UTF_8).trim());
    }

    @Test
    void parseLevel_mapsConfiguredNames() {
        assertEquals(Level.INFO, LoggingSetup.parseLevel("info"));
        assertEquals(Level.WARN, LoggingSetup.parseLevel("warning"));
        assertEquals(Level.ERROR, LoggingSetup.parseLevel("fatal"));
        assertEquals(Level.ERROR, LoggingSetup.parseLevel("panic"));
        assertEquals(Level.DEBUG, LoggingSetup.parseLevel("chatty"));
        assertEquals(Level.DEBUG, LoggingSetup.parseLevel(null));
    }
}
