package io.chainnode.core;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.chainnode.core.metrics.NodeMetrics;
import io.chainnode.core.node.Node;
import io.chainnode.core.node.NodeConfig;
import io.chainnode.core.p2p.P2pConfig;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

public class Main {
    private static final Logger LOG = Logger.getLogger(Main.class.getName());
    private static final ObjectMapper JSON = new ObjectMapper();

    public static void main(String[] args) throws Exception {
        configureLogging();
        CliOptions options = CliOptions.parse(args);
        if (options.showHelp()) {
            options.printHelp();
            if (options.errorMessage() != null) {
                System.exit(1);
            }
            return;
        }

        NodeConfig config = buildConfig(options);
        Node node;
        if (options.inMemory()) {
            node = Node.inMemory(config);
        } else {
            Path dataPath = options.dataDir().toAbsolutePath().normalize();
            Files.createDirectories(dataPath);
            node = Node.rocks(config, dataPath.resolve("ledger").toString());
        }

        CountDownLatch shutdownLatch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(shutdownLatch::countDown, "chain-node-shutdown"));
        try {
            node.start();
            if (config.p2p != null) {
                LOG.info("P2P node id=" + config.p2p.nodeId + " port=" + node.p2p().boundPort());
            } else {
                LOG.info("P2P disabled (--no-p2p)");
            }
            LOG.info("Node running at " + node.currentHead() + ". Press CTRL+C to exit.");
            shutdownLatch.await();
        } finally {
            node.close();
            LOG.info("=== Final metrics ===\n" + NodeMetrics.scrapeMetrics());
        }
    }

    static NodeConfig buildConfig(CliOptions options) {
        NodeConfig.Builder builder = NodeConfig.defaultLocal().toBuilder();
        if (options.chainId() > 0) {
            builder.chainId(options.chainId());
        }
        if (options.difficultyBits() >= 0) {
            builder.difficultyBits(options.difficultyBits());
        }
        Path allocFile = options.genesisAllocFile();
        if (allocFile == null && options.dataDir() != null && !options.inMemory()) {
            Path candidate = options.dataDir().resolve("genesis-alloc.json");
            if (Files.exists(candidate)) {
                allocFile = candidate;
            }
        }
        if (allocFile != null) {
            builder.genesisAllocations(loadAllocations(allocFile));
        }
        if (options.enableP2p()) {
            String nodeId = options.nodeId();
            if (nodeId == null) {
                nodeId = UUID.randomUUID().toString();
            }
            builder.p2p(P2pConfig.builder(nodeId)
                    .port(options.p2pPort())
                    .bootstrapPeers(options.p2pPeers())
                    .build());
        } else {
            builder.p2p(null);
        }
        return builder.build();
    }

    static Map<String, Long> loadAllocations(Path path) {
        if (!Files.exists(path)) {
            throw new IllegalStateException("Genesis allocations file not found: " + path);
        }
        try {
            return JSON.readValue(path.toFile(), new TypeReference<Map<String, Long>>() {});
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read genesis allocations from " + path, e);
        }
    }

    /** Falls back to the bundled logging.properties unless the JVM was given a config. */
    private static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null
                || System.getProperty("java.util.logging.config.class") != null) {
            return;
        }
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            LOG.log(Level.WARNING, "Could not load bundled logging.properties", e);
        }
    }

    static record CliOptions(
            boolean showHelp,
            String errorMessage,
            Path dataDir,
            boolean inMemory,
            Path genesisAllocFile,
            int chainId,
            long difficultyBits,
            boolean enableP2p,
            int p2pPort,
            String nodeId,
            List<String> p2pPeers
    ) {
        static CliOptions parse(String[] args) {
            boolean showHelp = false;
            String error = null;

            Path dataDir = envPath("CHAIN_NODE_DATA_DIR", Path.of("./data/chain"));
            boolean inMemory = "true".equalsIgnoreCase(System.getenv("CHAIN_NODE_IN_MEMORY"));
            Path allocFile = envPath("CHAIN_NODE_GENESIS_ALLOC", null);
            int chainId = -1;
            long difficultyBits = -1;
            boolean enableP2p = !"false".equalsIgnoreCase(System.getenv("CHAIN_NODE_ENABLE_P2P"));
            int p2pPort = 9000;
            String nodeId = envOrDefault("CHAIN_NODE_NODE_ID", null);
            List<String> p2pPeers = new ArrayList<>();
            try {
                p2pPort = envPort("CHAIN_NODE_P2P_PORT", 9000);
                String chainEnv = System.getenv("CHAIN_NODE_CHAIN_ID");
                if (chainEnv != null && !chainEnv.isBlank()) {
                    chainId = (int) parseBounded(chainEnv, "CHAIN_NODE_CHAIN_ID", 1, Integer.MAX_VALUE);
                }
                String bitsEnv = System.getenv("CHAIN_NODE_DIFFICULTY_BITS");
                if (bitsEnv != null && !bitsEnv.isBlank()) {
                    difficultyBits = parseBounded(bitsEnv, "CHAIN_NODE_DIFFICULTY_BITS", 0, 256);
                }
            } catch (IllegalArgumentException ex) {
                showHelp = true;
                error = ex.getMessage();
            }
            String peersEnv = System.getenv("CHAIN_NODE_P2P_PEERS");
            if (peersEnv != null && !peersEnv.isBlank()) {
                for (String endpoint : peersEnv.split(",")) {
                    if (!endpoint.isBlank()) {
                        p2pPeers.add(endpoint.trim());
                    }
                }
            }

            if (args != null) {
                for (String arg : args) {
                    if (arg == null || arg.isBlank()) {
                        continue;
                    }
                    try {
                        if ("--help".equals(arg) || "-h".equals(arg)) {
                            showHelp = true;
                        } else if (arg.startsWith("--data-dir=")) {
                            dataDir = Path.of(arg.substring("--data-dir=".length()));
                        } else if (arg.equals("--in-memory")) {
                            inMemory = true;
                        } else if (arg.startsWith("--genesis-alloc=")) {
                            allocFile = Path.of(arg.substring("--genesis-alloc=".length()));
                        } else if (arg.startsWith("--chain-id=")) {
                            chainId = (int) parseBounded(arg.substring("--chain-id=".length()), "--chain-id", 1, Integer.MAX_VALUE);
                        } else if (arg.startsWith("--difficulty-bits=")) {
                            difficultyBits = parseBounded(arg.substring("--difficulty-bits=".length()), "--difficulty-bits", 0, 256);
                        } else if (arg.equals("--no-p2p")) {
                            enableP2p = false;
                        } else if (arg.startsWith("--p2p-port=")) {
                            p2pPort = parsePort(arg.substring("--p2p-port=".length()), "--p2p-port");
                        } else if (arg.startsWith("--p2p-peer=")) {
                            p2pPeers.add(arg.substring("--p2p-peer=".length()));
                        } else if (arg.startsWith("--node-id=")) {
                            nodeId = arg.substring("--node-id=".length());
                        } else if (!arg.startsWith("--")) {
                            dataDir = Path.of(arg);
                        } else if (error == null) {
                            showHelp = true;
                            error = "Unknown option: " + arg;
                        }
                    } catch (IllegalArgumentException ex) {
                        showHelp = true;
                        if (error == null) {
                            error = ex.getMessage();
                        }
                    }
                }
            }

            if (nodeId != null && nodeId.isBlank()) {
                nodeId = null;
            }
            return new CliOptions(
                    showHelp,
                    error,
                    dataDir,
                    inMemory,
                    allocFile,
                    chainId,
                    difficultyBits,
                    enableP2p,
                    p2pPort,
                    nodeId,
                    List.copyOf(p2pPeers)
            );
        }

        void printHelp() {
            if (errorMessage != null) {
                System.err.println("Error: " + errorMessage);
            }
            System.out.println("""
Usage: chain-node [options] [data-dir]

Options:
  --help, -h                 Show this help message and exit
  --data-dir=<path>          Path for ledger data (default ./data/chain)
  --in-memory                Keep the ledger in memory only
  --genesis-alloc=<file>     JSON object of address -> initial balance
                             (default <data-dir>/genesis-alloc.json when present)
  --chain-id=<id>            Chain identifier transactions must carry (default 1)
  --difficulty-bits=<n>      Minimum proof-of-work leading zero bits (default 12)
  --no-p2p                   Disable the Netty P2P listener
  --p2p-port=<port>          Port for the P2P listener (default 9000, 0 = ephemeral)
  --p2p-peer=<host:port>     Add a bootstrap peer (repeatable)
  --node-id=<id>             Node identifier advertised to peers (default random)

Environment overrides:
  CHAIN_NODE_DATA_DIR        Override --data-dir
  CHAIN_NODE_IN_MEMORY       Set to "true" for --in-memory
  CHAIN_NODE_GENESIS_ALLOC   Override --genesis-alloc
  CHAIN_NODE_CHAIN_ID        Override --chain-id
  CHAIN_NODE_DIFFICULTY_BITS Override --difficulty-bits
  CHAIN_NODE_ENABLE_P2P      Set to "false" to disable P2P without CLI flag
  CHAIN_NODE_P2P_PORT        Override --p2p-port
  CHAIN_NODE_P2P_PEERS       Comma-separated bootstrap peers (host:port)
  CHAIN_NODE_NODE_ID         Override --node-id
""");
        }

        private static Path envPath(String key, Path fallback) {
            String value = System.getenv(key);
            return (value == null || value.isBlank()) ? fallback : Path.of(value);
        }

        private static String envOrDefault(String key, String fallback) {
            String value = System.getenv(key);
            return (value == null || value.isBlank()) ? fallback : value;
        }

        private static int envPort(String key, int fallback) {
            String value = System.getenv(key);
            if (value == null || value.isBlank()) {
                return fallback;
            }
            return parsePort(value, key);
        }

        private static int parsePort(String value, String flag) {
            try {
                int port = Integer.parseInt(value);
                if (port < 0 || port > 65_535) {
                    throw new NumberFormatException();
                }
                return port;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid port for " + flag + ": " + value);
            }
        }

        private static long parseBounded(String value, String flag, long min, long max) {
            try {
                long parsed = Long.parseLong(value.trim());
                if (parsed < min || parsed > max) {
                    throw new NumberFormatException();
                }
                return parsed;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid value for " + flag + ": " + value);
            }
        }
    }
}
