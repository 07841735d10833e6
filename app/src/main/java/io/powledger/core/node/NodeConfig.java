package io.powledger.core.node;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.powledger.core.wallet.Wallet;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Config holder for a local node, persisted as {@code node-info.json}:
 * <pre>
 * {
 *   "current_version": "1.0",
 *   "versions": { "1.0": { "difficulty": 5 } },
 *   "max_tx_per_block": 100,
 *   "max_nonce": 0,
 *   "check_interval": 4096,
 *   "genesis_allocations": { "&lt;address&gt;": 100 },
 *   "wallet": { "private_key": "...", "public_key": "...", "address": "..." }
 * }
 * </pre>
 */
public final class NodeConfig {
    public static final String FILE_NAME = "node-info.json";
    private static final ObjectMapper JSON = new ObjectMapper();

    public final String currentVersion;
    public final Map<String, Integer> versions;
    public final int maxTxPerBlock;
    public final long maxNonce;          // 0 = unbounded
    public final int checkInterval;
    public final Map<String, Long> genesisAllocations;
    public final String walletPrivateKey;
    public final String walletPublicKey;

    public NodeConfig(String currentVersion,
                      Map<String, Integer> versions,
                      int maxTxPerBlock,
                      long maxNonce,
                      int checkInterval,
                      Map<String, Long> genesisAllocations,
                      String walletPrivateKey,
                      String walletPublicKey) {
        if (versions == null || !versions.containsKey(currentVersion)) {
            throw new IllegalArgumentException("No difficulty configured for current version " + currentVersion);
        }
        if (maxTxPerBlock <= 0) {
            throw new IllegalArgumentException("max_tx_per_block must be > 0");
        }
        if (maxNonce < 0 || checkInterval <= 0) {
            throw new IllegalArgumentException("max_nonce must be >= 0 and check_interval > 0");
        }
        this.currentVersion = currentVersion;
        this.versions = Map.copyOf(versions);
        this.maxTxPerBlock = maxTxPerBlock;
        this.maxNonce = maxNonce;
        this.checkInterval = checkInterval;
        this.genesisAllocations = genesisAllocations == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(genesisAllocations));
        this.walletPrivateKey = blankToNull(walletPrivateKey);
        this.walletPublicKey = blankToNull(walletPublicKey);
    }

    public static NodeConfig defaultLocal() {
        return new NodeConfig(
                "1.0",
                Map.of("1.0", 5),
                100,          // tx per block cap
                0L,           // no nonce ceiling
                4096,
                Map.of(),     // genesis pays the node wallet
                null,
                null
        );
    }

    public int currentDifficulty() {
        return versions.get(currentVersion);
    }

    /** The node wallet, if both keys are configured. */
    public Optional<Wallet> wallet() {
        if (walletPrivateKey == null || walletPublicKey == null) {
            return Optional.empty();
        }
        return Optional.of(Wallet.fromPortable(walletPrivateKey, walletPublicKey));
    }

    public NodeConfig withWallet(Wallet wallet) {
        return new NodeConfig(currentVersion, versions, maxTxPerBlock, maxNonce, checkInterval,
                genesisAllocations, wallet.portablePrivateKey(), wallet.portablePublicKey());
    }

    /** Switch to {@code version} mined at {@code difficulty}, keeping older versions verifiable. */
    public NodeConfig withVersion(String version, int difficulty) {
        Map<String, Integer> v = new LinkedHashMap<>(versions);
        v.put(version, difficulty);
        return new NodeConfig(version, v, maxTxPerBlock, maxNonce, checkInterval,
                genesisAllocations, walletPrivateKey, walletPublicKey);
    }

    public NodeConfig withMaxNonce(long maxNonce) {
        return new NodeConfig(currentVersion, versions, maxTxPerBlock, maxNonce, checkInterval,
                genesisAllocations, walletPrivateKey, walletPublicKey);
    }

    public NodeConfig withGenesisAllocations(Map<String, Long> allocations) {
        return new NodeConfig(currentVersion, versions, maxTxPerBlock, maxNonce, checkInterval,
                allocations, walletPrivateKey, walletPublicKey);
    }

    // -------------------- persistence --------------------

    /** Load from {@code path}, or {@link #defaultLocal()} if the file does not exist. */
    public static NodeConfig load(Path path) {
        if (!Files.exists(path)) {
            return defaultLocal();
        }
        try {
            return fromNode(JSON.readTree(path.toFile()));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read node info from " + path, e);
        }
    }

    public void save(Path path) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            JSON.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), toMap());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to persist node info to " + path, e);
        }
    }

    static NodeConfig fromNode(JsonNode n) {
        NodeConfig defaults = defaultLocal();

        Map<String, Integer> versions = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = n.path("versions").fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            JsonNode d = e.getValue().path("difficulty");
            if (!d.canConvertToInt()) {
                throw new IllegalArgumentException("Version " + e.getKey() + " has no difficulty");
            }
            versions.put(e.getKey(), d.asInt());
        }
        if (versions.isEmpty()) {
            versions.putAll(defaults.versions);
        }

        Map<String, Long> allocations = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> alloc = n.path("genesis_allocations").fields();
        while (alloc.hasNext()) {
            Map.Entry<String, JsonNode> e = alloc.next();
            allocations.put(e.getKey(), e.getValue().asLong());
        }

        JsonNode wallet = n.path("wallet");
        return new NodeConfig(
                n.path("current_version").asText(defaults.currentVersion),
                versions,
                n.path("max_tx_per_block").asInt(defaults.maxTxPerBlock),
                n.path("max_nonce").asLong(defaults.maxNonce),
                n.path("check_interval").asInt(defaults.checkInterval),
                allocations,
                wallet.path("private_key").asText(null),
                wallet.path("public_key").asText(null));
    }

    Map<String, Object> toMap() {
        Map<String, Object> versionMap = new LinkedHashMap<>();
        for (Map.Entry<String, Integer> e : versions.entrySet()) {
            versionMap.put(e.getKey(), Map.of("difficulty", e.getValue()));
        }
        Map<String, Object> walletMap = new LinkedHashMap<>();
        walletMap.put("private_key", walletPrivateKey == null ? "" : walletPrivateKey);
        walletMap.put("public_key", walletPublicKey == null ? "" : walletPublicKey);
        walletMap.put("address", wallet().map(Wallet::getAddress).orElse(""));

        Map<String, Object> m = new LinkedHashMap<>();
        m.put("current_version", currentVersion);
        m.put("versions", versionMap);
        m.put("max_tx_per_block", maxTxPerBlock);
        m.put("max_nonce", maxNonce);
        m.put("check_interval", checkInterval);
        m.put("genesis_allocations", genesisAllocations);
        m.put("wallet", walletMap);
        return m;
    }

    private static String blankToNull(String s) {
        return (s == null || s.isBlank()) ? null : s;
    }
}
