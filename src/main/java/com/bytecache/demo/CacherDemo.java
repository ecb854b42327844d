package com.bytecache.demo;

import com.bytecache.cache.MemCache;
import com.bytecache.cache.SizeOf;
import com.bytecache.cache.StoreResult;
import com.bytecache.config.CacheConfig;
import com.bytecache.path.PathGen;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

/**
 * Interactive client for a byte cache.
 *
 * Usage:
 *   java -cp target/bytecache-1.0-SNAPSHOT.jar com.bytecache.demo.CacherDemo [--config cache.yaml]
 *
 * Without --config the bundled cache-config.yaml (40 bytes) is used. Commands: SET key value, GET key,
 * REMOVE key, PATH key, STATUS, HELP, QUIT. Band usages are printed after
 * every command so the aging of generations can be watched.
 */
public class CacherDemo {
    private static final Logger logger = LoggerFactory.getLogger(CacherDemo.class);

    static final String DEFAULT_CONFIG = "cache-config.yaml";

    private final MemCache<String, byte[]> cache;
    private final PrintStream out;

    public CacherDemo(CacheConfig config, PrintStream out) {
        this.cache = new MemCache<>(config, SizeOf.byteArray());
        this.out = out;
    }

    public static void main(String[] args) throws IOException {
        CacheConfig config;
        if (args.length >= 2 && args[0].equals("--config")) {
            config = CacheConfig.load(args[1]);
        } else if (args.length == 0) {
            config = CacheConfig.loadFromClasspath(DEFAULT_CONFIG);
        } else {
            System.err.println("Usage: java CacherDemo [--config <path-to-yaml>]");
            System.exit(1);
            return;
        }

        CacherDemo demo = new CacherDemo(config, System.out);
        demo.run(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)));
    }

    /**
     * Read commands until end of input or QUIT.
     */
    public void run(BufferedReader in) throws IOException {
        out.println("cache max: " + cache.limit() + " bytes");
        printHelp();
        printState();

        String line;
        while ((line = in.readLine()) != null) {
            line = line.trim();
            if (line.isEmpty()) {
                continue;
            }
            if (!execute(line)) {
                logger.info("Exiting...");
                return;
            }
            printState();
        }
    }

    /**
     * Execute a single command line.
     *
     * @return false if the client should stop
     */
    boolean execute(String line) {
        String[] parts = line.split("\\s+", 3);
        String command = parts[0].toUpperCase();

        switch (command) {
            case "SET":
                if (parts.length < 3) {
                    out.println("Usage: SET <key> <value>");
                    break;
                }
                handleSet(parts[1], parts[2]);
                break;

            case "GET":
                if (parts.length < 2) {
                    out.println("Usage: GET <key>");
                    break;
                }
                handleGet(parts[1]);
                break;

            case "REMOVE":
                if (parts.length < 2) {
                    out.println("Usage: REMOVE <key>");
                    break;
                }
                out.println(cache.remove(parts[1]) ? "removed" : "not found");
                break;

            case "PATH":
                if (parts.length < 2) {
                    out.println("Usage: PATH <key>");
                    break;
                }
                handlePath(parts[1]);
                break;

            case "STATUS":
                handleStatus();
                break;

            case "HELP":
                printHelp();
                break;

            case "QUIT":
            case "EXIT":
                return false;

            default:
                out.println("Unknown command: " + command);
                out.println("Type HELP for available commands");
        }
        return true;
    }

    MemCache<String, byte[]> getCache() {
        return cache;
    }

    private void handleSet(String key, String value) {
        StoreResult result = cache.set(key, value.getBytes(StandardCharsets.UTF_8));
        if (result == StoreResult.STORED) {
            out.println("stored");
        } else {
            out.println("out of memory");
        }
    }

    private void handleGet(String key) {
        byte[] value = cache.get(key);
        if (value != null) {
            out.println(new String(value, StandardCharsets.UTF_8));
        } else {
            out.println("not found");
        }
    }

    private void handlePath(String key) {
        PathGen paths = PathGen.withDefaults(key);
        out.println("file: " + paths.filePath() + ", meta: " + paths.metaPath());
    }

    private void handleStatus() {
        out.println("===== Cache Status =====");
        cache.getStats().forEach((name, value) -> out.println(name + ": " + value));
        out.println("========================");
    }

    private void printState() {
        out.println("mem usage: " + cache.usage() + ", buckets: " + cache.detailedUsage());
    }

    private void printHelp() {
        out.println("commands: SET <key> <value>, GET <key>, REMOVE <key>, PATH <key>, STATUS, HELP, QUIT");
    }
}
