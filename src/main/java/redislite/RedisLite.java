package redislite;

import redislite.server.RedisLiteServer;
import redislite.server.ServerStartException;
import redislite.utils.Log;

/**
 * Project: Redis-Lite
 * Entry point: load config, start the server, stop it on JVM shutdown.
 */
public class RedisLite {

    public static final String VERSION = "0.1.0";

    public static void printBanner(Config config) {
        Log.info("\n" +
                " :: Redis-Lite ::   (v" + VERSION + ")\n" +
                " :: Engine ::       Java " + System.getProperty("java.version") + " / Netty\n" +
                " :: Listen ::       " + config.host + ":" + config.port + "\n");
    }

    public static void main(String[] args) {
        Config config = Config.load(args.length > 0 ? args[0] : Config.DEFAULT_FILE);
        Log.setLevel(config.logLevel);
        printBanner(config);

        RedisLiteServer server = new RedisLiteServer(config);
        try {
            server.start();
        } catch (ServerStartException e) {
            Log.error(e.getMessage());
            System.exit(1);
            return;
        }

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            Log.info("Received shutdown signal, stopping server...");
            server.stop();
        }, "shutdown-hook"));

        try {
            server.awaitTermination();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            server.stop();
        }
    }
}
