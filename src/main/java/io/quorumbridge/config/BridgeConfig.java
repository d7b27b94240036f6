package io.quorumbridge.config;

import io.quorumbridge.model.TokenUnits;

import java.math.BigInteger;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

public final class BridgeConfig {
    public static final String DEFAULT_NAMESPACE = "default";
    public static final String DEFAULT_NAMESPACES_DIR = "namespaces";
    public static final BigInteger DEFAULT_MAX_BRIDGE_IN_AMOUNT = TokenUnits.parse("10000");
    public static final long DEFAULT_BRIDGE_IN_COOLDOWN_SECONDS = 60L;
    public static final int DEFAULT_REPLAY_CAPACITY = 100;
    public static final int MAX_REPLAY_CAPACITY = 10_000;
    public static final String DEFAULT_TOKEN_NAME = "Quorum Bridge Token";
    public static final String DEFAULT_TOKEN_SYMBOL = "QBT";
    public static final String DEFAULT_ORIGIN_TOKEN_NAME = "Origin Token";
    public static final String DEFAULT_ORIGIN_TOKEN_SYMBOL = "ORIG";

    private final Path rootDir;
    private final Path rootBaseDir;
    private final String namespace;

    public BridgeConfig(Path rootDir, Path rootBaseDir, String namespace) {
        this.rootDir = rootDir;
        this.rootBaseDir = rootBaseDir;
        this.namespace = namespace;
    }

    public static BridgeConfig fromRoot(String root) {
        return fromRoot(root, DEFAULT_NAMESPACE);
    }

    public static BridgeConfig fromRoot(String root, String namespace) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get("data")
                : Paths.get(root);
        Path base = resolved.toAbsolutePath().normalize();
        String safeNamespace = sanitizeName(namespace, DEFAULT_NAMESPACE);
        Path scoped = DEFAULT_NAMESPACE.equals(safeNamespace)
                ? base
                : base.resolve(DEFAULT_NAMESPACES_DIR).resolve(safeNamespace);
        return new BridgeConfig(scoped, base, safeNamespace);
    }

    /**
     * Lowercases and replaces anything outside {@code [a-z0-9_.-]}; also used for deployment names.
     */
    public static String sanitizeName(String raw, String fallback) {
        String normalized = raw == null || raw.isBlank() ? fallback : raw.trim().toLowerCase(Locale.ROOT);
        StringBuilder sb = new StringBuilder(normalized.length());
        for (int i = 0; i < normalized.length(); i++) {
            char ch = normalized.charAt(i);
            boolean ok = (ch >= 'a' && ch <= 'z')
                    || (ch >= '0' && ch <= '9')
                    || ch == '_' || ch == '-' || ch == '.';
            sb.append(ok ? ch : '-');
        }
        String value = sb.toString();
        if (value.isBlank()) {
            return fallback;
        }
        while (value.contains("--")) {
            value = value.replace("--", "-");
        }
        if (value.startsWith(".")) {
            value = "ns" + value;
        }
        return value;
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path rootBaseDir() {
        return rootBaseDir;
    }

    public String namespace() {
        return namespace;
    }

    public Path dbFile() {
        return rootDir.resolve("quorum-bridge.db");
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path journalFile() {
        return auditRoot().resolve("ledger-events.log");
    }

    public Path securityRoot() {
        return rootDir.resolve("security");
    }

    public Path journalKeyFile() {
        return securityRoot().resolve("journal-signing.key");
    }
}
