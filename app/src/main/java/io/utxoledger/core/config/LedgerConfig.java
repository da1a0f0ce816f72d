package io.utxoledger.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/** Simple config holder for a local ledger. */
public final class LedgerConfig {
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final String DEFAULTS_RESOURCE = "/ledger-defaults.json";

    public final int maxMempoolSize;
    public final int verifierThreads;
    public final String dataDir;

    public LedgerConfig(int maxMempoolSize, int verifierThreads, String dataDir) {
        if (maxMempoolSize <= 0) throw new IllegalArgumentException("maxMempoolSize must be > 0");
        if (verifierThreads < 0) throw new IllegalArgumentException("verifierThreads must be >= 0");
        this.maxMempoolSize = maxMempoolSize;
        this.verifierThreads = verifierThreads;
        this.dataDir = dataDir;
    }

    public static LedgerConfig defaultLocal() {
        return new LedgerConfig(
                200,          // pending txs kept locally
                0,            // verify signatures on the caller thread
                null          // in-memory store
        );
    }

    /** Defaults bundled on the classpath, falling back to {@link #defaultLocal()}. */
    public static LedgerConfig loadDefaults() {
        try (InputStream in = LedgerConfig.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                return defaultLocal();
            }
            return fromJson(JSON.readTree(in), defaultLocal());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + DEFAULTS_RESOURCE, e);
        }
    }

    /** Reads a JSON config file; absent keys keep the bundled defaults. */
    public static LedgerConfig load(Path path) {
        if (!Files.exists(path)) {
            throw new IllegalArgumentException("Config file not found: " + path);
        }
        try {
            return fromJson(JSON.readTree(path.toFile()), loadDefaults());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read ledger config from " + path, e);
        }
    }

    private static LedgerConfig fromJson(JsonNode node, LedgerConfig defaults) {
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("Ledger config must be a JSON object");
        }
        int maxMempool = node.path("maxMempoolSize").asInt(defaults.maxMempoolSize);
        int threads = node.path("verifierThreads").asInt(defaults.verifierThreads);
        JsonNode dir = node.get("dataDir");
        String dataDir = dir == null || dir.isNull() ? defaults.dataDir : dir.asText();
        return new LedgerConfig(maxMempool, threads, dataDir);
    }

    public LedgerConfig withDataDir(String dataDir) {
        return new LedgerConfig(this.maxMempoolSize, this.verifierThreads, dataDir);
    }

    /** Daemon pool for signature checks, or null when {@code verifierThreads < 2}. */
    public ExecutorService newVerifierExecutor() {
        if (verifierThreads < 2) {
            return null;
        }
        AtomicInteger seq = new AtomicInteger();
        return Executors.newFixedThreadPool(verifierThreads, r -> {
            Thread t = new Thread(r, "utxo-ledger-verifier-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
