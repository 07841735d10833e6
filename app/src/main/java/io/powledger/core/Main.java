package io.powledger.core;

import io.powledger.core.metrics.BlockMetrics;
import io.powledger.core.node.Node;
import io.powledger.core.node.NodeConfig;
import io.powledger.core.wallet.Wallet;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

public class Main {
    private static final Logger LOG = Logger.getLogger(Main.class.getName());

    public static void main(String[] args) throws Exception {
        CliOptions options = CliOptions.parse(args);
        if (options.showHelp()) {
            options.printHelp();
            if (options.errorMessage() != null) {
                System.exit(1);
            }
            return;
        }

        Path dataPath = options.dataDir().toAbsolutePath().normalize();
        Files.createDirectories(dataPath);

        Path infoFile = dataPath.resolve(NodeConfig.FILE_NAME);
        NodeConfig config = ensureWallet(NodeConfig.load(infoFile), infoFile);
        if (options.maxNonce() >= 0) {
            config = config.withMaxNonce(options.maxNonce());
        }
        Wallet wallet = config.wallet().orElseThrow();

        Node node = options.inMemory()
                ? Node.inMemory(config, wallet)
                : Node.rocks(config, wallet, dataPath.resolve("ledger").toString());

        CountDownLatch shutdownLatch;
        ScheduledExecutorService miner = null;
        try {
            node.start();
            LOG.info("Wallet addr=" + wallet.getAddress() + " balance=" + node.balance(wallet.getAddress()));
            LOG.info("Version " + config.currentVersion + " at difficulty " + config.currentDifficulty());

            if (options.keepAlive()) {
                shutdownLatch = new CountDownLatch(1);
                CountDownLatch latchRef = shutdownLatch;
                Runtime.getRuntime().addShutdownHook(new Thread(latchRef::countDown, "pow-ledger-shutdown"));
                miner = startMiner(node, options.mineIntervalMillis());
                LOG.info("Node running. Press CTRL+C to exit.");
                shutdownLatch.await();
            } else {
                LOG.info("Chain length=" + node.chain().size() + ", tip=" + node.store().getTip().orElse("<none>"));
                LOG.info("=== Metrics ===\n" + BlockMetrics.scrapeMetrics());
            }
        } finally {
            if (miner != null) {
                miner.shutdownNow();
            }
            node.close();
        }
    }

    private static ScheduledExecutorService startMiner(Node node, long intervalMillis) {
        ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "pow-ledger-miner");
            t.setDaemon(true);
            return t;
        });
        Runnable task = () -> {
            try {
                node.tick();
            } catch (Exception e) {
                LOG.log(Level.WARNING, "Background mining tick failed", e);
            }
        };
        executor.scheduleWithFixedDelay(task, 0, intervalMillis, TimeUnit.MILLISECONDS);
        return executor;
    }

    /** Generate node keys on first start and persist them to node-info. */
    static NodeConfig ensureWallet(NodeConfig config, Path infoFile) {
        Optional<Wallet> existing = config.wallet();
        if (existing.isPresent() && Files.exists(infoFile)) {
            return config;
        }
        NodeConfig updated = existing.isPresent() ? config : config.withWallet(Wallet.generate());
        updated.save(infoFile);
        LOG.info("Wrote node info to " + infoFile);
        return updated;
    }

    static record CliOptions(
            boolean showHelp,
            String errorMessage,
            Path dataDir,
            boolean inMemory,
            boolean keepAlive,
            long mineIntervalMillis,
            long maxNonce
    ) {
        static CliOptions parse(String[] args) {
            Path dataDir = envPath("POW_LEDGER_DATA_DIR", Path.of("./data/ledger"));
            boolean inMemory = "true".equalsIgnoreCase(System.getenv("POW_LEDGER_IN_MEMORY"));
            boolean keepAlive = "true".equalsIgnoreCase(System.getenv("POW_LEDGER_KEEP_ALIVE"));
            long mineIntervalMillis = 1_000L;
            long maxNonce = -1L; // keep node-info value
            boolean showHelp = false;
            String error = null;

            try {
                String intervalEnv = System.getenv("POW_LEDGER_MINE_INTERVAL_MS");
                if (intervalEnv != null && !intervalEnv.isBlank()) {
                    mineIntervalMillis = parsePositiveLong(intervalEnv, "POW_LEDGER_MINE_INTERVAL_MS");
                }
                String nonceEnv = System.getenv("POW_LEDGER_MAX_NONCE");
                if (nonceEnv != null && !nonceEnv.isBlank()) {
                    maxNonce = parseNonNegativeLong(nonceEnv, "POW_LEDGER_MAX_NONCE");
                }
            } catch (IllegalArgumentException ex) {
                showHelp = true;
                error = ex.getMessage();
            }

            if (args != null) {
                for (String arg : args) {
                    if (arg == null || arg.isBlank()) {
                        continue;
                    }
                    if ("--help".equals(arg) || "-h".equals(arg)) {
                        showHelp = true;
                    } else if (arg.startsWith("--data-dir=")) {
                        dataDir = Path.of(arg.substring("--data-dir=".length()));
                    } else if (arg.equals("--in-memory")) {
                        inMemory = true;
                    } else if (arg.equals("--keep-alive")) {
                        keepAlive = true;
                    } else if (arg.startsWith("--mine-interval-ms=")) {
                        try {
                            mineIntervalMillis = parsePositiveLong(arg.substring("--mine-interval-ms=".length()), "--mine-interval-ms");
                        } catch (IllegalArgumentException ex) {
                            showHelp = true;
                            error = ex.getMessage();
                        }
                    } else if (arg.startsWith("--max-nonce=")) {
                        try {
                            maxNonce = parseNonNegativeLong(arg.substring("--max-nonce=".length()), "--max-nonce");
                        } catch (IllegalArgumentException ex) {
                            showHelp = true;
                            error = ex.getMessage();
                        }
                    } else if (!arg.startsWith("--")) {
                        dataDir = Path.of(arg);
                    } else if (error == null) {
                        showHelp = true;
                        error = "Unknown option: " + arg;
                    }
                }
            }

            return new CliOptions(showHelp, error, dataDir, inMemory, keepAlive, mineIntervalMillis, maxNonce);
        }

        void printHelp() {
            if (errorMessage != null) {
                System.err.println("Error: " + errorMessage);
            }
            System.out.println("""
Usage: pow-ledger [options]

Options:
  --help, -h                 Show this help message and exit
  --data-dir=<path>          Path for node-info.json and ledger data (default ./data/ledger)
  --in-memory                Keep the ledger in memory instead of RocksDB
  --keep-alive               Keep mining until interrupted
  --mine-interval-ms=<ms>    Delay between mining ticks (default 1000)
  --max-nonce=<n>            Give up a mining attempt after n nonces (0 = unbounded)

Environment overrides:
  POW_LEDGER_DATA_DIR          Override --data-dir
  POW_LEDGER_IN_MEMORY         Set to "true" to use the in-memory ledger
  POW_LEDGER_KEEP_ALIVE        Set to "true" to force keep-alive mode
  POW_LEDGER_MINE_INTERVAL_MS  Delay between mining ticks
  POW_LEDGER_MAX_NONCE         Nonce ceiling per mining attempt
""");
        }

        private static Path envPath(String key, Path fallback) {
            String value = System.getenv(key);
            return (value == null || value.isBlank()) ? fallback : Path.of(value);
        }

        private static long parsePositiveLong(String value, String flag) {
            long parsed = parseNonNegativeLong(value, flag);
            if (parsed == 0) {
                throw new IllegalArgumentException("Invalid value for " + flag + ": " + value);
            }
            return parsed;
        }

        private static long parseNonNegativeLong(String value, String flag) {
            try {
                long parsed = Long.parseLong(value);
                if (parsed < 0) {
                    throw new NumberFormatException();
                }
                return parsed;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid value for " + flag + ": " + value);
            }
        }
    }
}
