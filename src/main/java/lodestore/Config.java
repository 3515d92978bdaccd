package lodestore;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lodestore.persistence.FsyncPolicy;
import lodestore.protocol.RespDecoder;
import lodestore.utils.Log;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileReader;
import java.io.IOException;
import java.util.Locale;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public class Config {
    public static final String DEFAULT_FILE = "lodestore.yaml";

    public int port = 6379;
    public boolean appendOnly = true;
    public String appendFilename = "lodestore.aof";
    public String appendFsync = "everysec";
    public long flushIntervalMillis = 1000;
    public long maxBulkLength = RespDecoder.DEFAULT_MAX_BULK_LENGTH;
    public boolean debug = false;

    public Config() {
        // Default constructor for Jackson
    }

    public FsyncPolicy fsyncPolicy() {
        return FsyncPolicy.parse(appendFsync);
    }

    public static Config load(String filename) {
        return load(filename, System.getenv());
    }

    static Config load(String filename, Map<String, String> env) {
        File f = new File(filename);
        if (!f.exists()) {
            // Try looking for .yaml extension if .conf was passed
            if (filename.endsWith(".conf")) {
                File yamlFile = new File(filename.substring(0, filename.length() - 5) + ".yaml");
                if (yamlFile.exists()) f = yamlFile;
            }
        }

        Config config = new Config();

        if (!f.exists()) {
            Log.warn("Config file not found: " + filename + ". Using defaults.");
        } else if (f.getName().endsWith(".conf")) {
            config = loadLegacy(f, config);
        } else {
            try {
                ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
                config = mapper.readValue(f, Config.class);
            } catch (IOException e) {
                throw new IllegalArgumentException("Failed to load config " + f + ": " + e.getMessage(), e);
            }
        }

        if (env.get("LODESTORE_PORT") != null) {
            config.port = Integer.parseInt(env.get("LODESTORE_PORT").trim());
        }
        if (env.get("LODESTORE_AOF") != null) {
            config.appendFilename = env.get("LODESTORE_AOF").trim();
        }

        config.validate();
        return config;
    }

    // redis.conf style: one "key value" pair per line, # comments
    private static Config loadLegacy(File f, Config config) {
        try (BufferedReader br = new BufferedReader(new FileReader(f))) {
            String line;
            while ((line = br.readLine()) != null) {
                line = line.trim();
                if (line.isEmpty() || line.startsWith("#")) continue;
                String[] parts = line.split("\\s+", 2);
                if (parts.length < 2) continue;

                String key = parts[0].toLowerCase(Locale.ROOT);
                String val = parts[1].trim();

                switch (key) {
                    case "port": config.port = Integer.parseInt(val); break;
                    case "appendonly": config.appendOnly = val.equalsIgnoreCase("yes"); break;
                    case "appendfilename": config.appendFilename = unquote(val); break;
                    case "appendfsync": config.appendFsync = val; break;
                    case "proto-max-bulk-len": config.maxBulkLength = parseMemory(val); break;
                    case "loglevel": config.debug = val.equalsIgnoreCase("debug") || val.equalsIgnoreCase("verbose"); break;
                    default:
                        Log.warn("Ignoring unsupported config directive: " + key);
                }
            }
            Log.info("Loaded legacy config " + f);
        } catch (IOException | NumberFormatException e) {
            throw new IllegalArgumentException("Failed to load legacy config " + f + ": " + e.getMessage(), e);
        }
        return config;
    }

    void validate() {
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
        if (appendFilename == null || appendFilename.isEmpty()) {
            throw new IllegalArgumentException("appendFilename must not be empty");
        }
        if (flushIntervalMillis <= 0) {
            throw new IllegalArgumentException("flushIntervalMillis must be positive: " + flushIntervalMillis);
        }
        if (maxBulkLength <= 0) {
            throw new IllegalArgumentException("maxBulkLength must be positive: " + maxBulkLength);
        }
        fsyncPolicy();
    }

    private static String unquote(String val) {
        if (val.length() >= 2 && val.startsWith("\"") && val.endsWith("\"")) {
            return val.substring(1, val.length() - 1);
        }
        return val;
    }

    static long parseMemory(String val) {
        val = val.toUpperCase(Locale.ROOT);
        long factor = 1;
        if (val.endsWith("GB")) { factor = 1024 * 1024 * 1024L; val = val.replace("GB", ""); }
        else if (val.endsWith("MB")) { factor = 1024 * 1024L; val = val.replace("MB", ""); }
        else if (val.endsWith("KB")) { factor = 1024L; val = val.replace("KB", ""); }
        return Long.parseLong(val.trim()) * factor;
    }
}
