package redislite;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ConfigTest {

    @TempDir
    Path tmp;

    @Test
    public void testDefaults() {
        Config config = new Config();
        assertEquals("127.0.0.1", config.host);
        assertEquals(6379, config.port);
        assertEquals(0, config.workerThreads);
        assertEquals("INFO", config.logLevel);
    }

    @Test
    public void testLoadYaml() throws Exception {
        Path file = tmp.resolve("redis-lite.yaml");
        Files.write(file, ("host: 0.0.0.0\n" +
                "port: 7001\n" +
                "workerThreads: 4\n" +
                "logLevel: DEBUG\n" +
                "somethingElse: ignored\n").getBytes(StandardCharsets.UTF_8));

        Config config = Config.load(file.toString());
        assertEquals("0.0.0.0", config.host);
        assertEquals(7001, config.port);
        assertEquals(4, config.workerThreads);
        assertEquals("DEBUG", config.logLevel);
    }

    @Test
    public void testMissingFileUsesDefaults() {
        Config config = Config.load(tmp.resolve("absent.yaml").toString());
        assertEquals(Config.DEFAULT_PORT, config.port);
    }

    @Test
    public void testBrokenFileUsesDefaults() throws Exception {
        Path file = tmp.resolve("broken.yaml");
        Files.write(file, "port: [not, a, number\n".getBytes(StandardCharsets.UTF_8));
        Config config = Config.load(file.toString());
        assertEquals(Config.DEFAULT_HOST, config.host);
    }

    @Test
    public void testEnvironmentOverrides() {
        Config config = new Config();
        Map<String, String> env = new HashMap<>();
        env.put("REDIS_LITE_HOST", " 10.0.0.5 ");
        env.put("REDIS_LITE_PORT", "6380");
        config.applyEnv(env);
        assertEquals("10.0.0.5", config.host);
        assertEquals(6380, config.port);
    }

    @Test
    public void testBadPortOverrideIgnored() {
        Config config = new Config("localhost", 1234);
        Map<String, String> env = new HashMap<>();
        env.put("REDIS_LITE_PORT", "sixty");
        config.applyEnv(env);
        assertEquals(1234, config.port);
        assertEquals("localhost", config.host);
    }
}
