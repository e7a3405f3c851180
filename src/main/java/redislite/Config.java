package redislite;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import redislite.utils.Log;

import java.io.File;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public class Config {
    public static final String DEFAULT_FILE = "redis-lite.yaml";
    public static final String DEFAULT_HOST = "127.0.0.1";
    public static final int DEFAULT_PORT = 6379;

    public String host = DEFAULT_HOST;
    public int port = DEFAULT_PORT;
    public int workerThreads = 0; // 0 = Netty default (2 * cores)
    public String logLevel = "INFO";

    public Config() {
        // Default constructor for Jackson
    }

    public Config(String host, int port) {
        this.host = host;
        this.port = port;
    }

    public static Config load(String filename) {
        File f = new File(filename);
        Config config = new Config();

        if (!f.exists()) {
            Log.warn("Config file not found: " + filename + ". Using defaults.");
        } else {
            try {
                ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
                Config loaded = mapper.readValue(f, Config.class);
                if (loaded != null) config = loaded;
            } catch (Exception e) {
                Log.warn("Failed to load config " + filename + " (" + e.getMessage() + "). Using defaults.");
                config = new Config();
            }
        }

        config.applyEnv(System.getenv());
        return config;
    }

    void applyEnv(Map<String, String> env) {
        String envHost = env.get("REDIS_LITE_HOST");
        if (envHost != null && !envHost.isBlank()) {
            host = envHost.trim();
        }
        String envPort = env.get("REDIS_LITE_PORT");
        if (envPort != null && !envPort.isBlank()) {
            try {
                port = Integer.parseInt(envPort.trim());
            } catch (NumberFormatException e) {
                Log.warn("Ignoring REDIS_LITE_PORT='" + envPort + "': not a number");
            }
        }
    }
}
