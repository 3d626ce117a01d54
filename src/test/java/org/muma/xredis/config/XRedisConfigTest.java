package org.muma.xredis.config;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class XRedisConfigTest {

    @Test
    void testDefaults() {
        XRedisConfig config = new XRedisConfig(Map.of());
        assertEquals(6379, config.getPort());
        assertEquals(0, config.getWorkerThreads());
        assertEquals(10, config.getSlowlogThresholdMillis());
        assertEquals(Path.of(".", "xredis_dump.db"), config.snapshotFile());
    }

    @Test
    void testLoadFromClasspathFile() {
        XRedisConfig config = new XRedisConfig(Map.of());
        config.loadConfig("xredis-test.properties");

        assertEquals(7000, config.getPort());
        assertEquals(2, config.getWorkerThreads());
        assertEquals(25, config.getSlowlogThresholdMillis());
        assertEquals(Path.of("data", "test_dump.db"), config.snapshotFile());
    }

    @Test
    void testMissingFileKeepsDefaults() {
        XRedisConfig config = new XRedisConfig(Map.of());
        config.loadConfig("does-not-exist.properties");
        assertEquals(6379, config.getPort());
    }

    @Test
    void testPrecedenceArgsOverEnvOverFile() {
        XRedisConfig envOnly = new XRedisConfig(Map.of("XREDIS_PORT", "7100", "XREDIS_DIR", "/var/lib/xredis"));
        envOnly.load(new String[]{"--config", "xredis-test.properties"});
        assertEquals(7100, envOnly.getPort());
        assertEquals(Path.of("/var/lib/xredis", "test_dump.db"), envOnly.snapshotFile());

        XRedisConfig withArgs = new XRedisConfig(Map.of("XREDIS_PORT", "7100"));
        withArgs.load(new String[]{"--config", "xredis-test.properties", "--port", "7200", "--dbfilename", "x.db"});
        assertEquals(7200, withArgs.getPort());
        assertEquals(Path.of("data", "x.db"), withArgs.snapshotFile());
    }

    @Test
    void testInvalidArguments() {
        XRedisConfig config = new XRedisConfig(Map.of());
        assertThrows(IllegalArgumentException.class, () -> config.parseArgs(new String[]{"--port"}));
        assertThrows(IllegalArgumentException.class, () -> config.parseArgs(new String[]{"--port", "abc"}));
        assertThrows(IllegalArgumentException.class, () -> config.parseArgs(new String[]{"--port", "70000"}));
        assertThrows(IllegalArgumentException.class, () -> config.parseArgs(new String[]{"--bogus", "1"}));
    }

    @Test
    void testInvalidEnvPort() {
        XRedisConfig config = new XRedisConfig(Map.of("XREDIS_PORT", "not-a-port"));
        assertThrows(IllegalArgumentException.class, () -> config.loadConfig("does-not-exist.properties"));
    }
}
