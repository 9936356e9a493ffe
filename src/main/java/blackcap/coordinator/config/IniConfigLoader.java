package blackcap.coordinator.config;

import blackcap.coordinator.cluster.ClusterSettings;
import org.ini4j.Ini;
import org.ini4j.Profile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Reads coordinator settings from an INI file.
 * Supports sections [server], [database], [scheduler], [reconciler], [auth], [users],
 * [read_only] and one [cluster &lt;id&gt;] per backend. Absent sections keep the defaults.
 */
public final class IniConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(IniConfigLoader.class);

    private static final String CLUSTER_PREFIX = "cluster ";
    private static final Set<String> CLUSTER_KEYS = Set.of("type", "capabilities", "limit");

    private IniConfigLoader() {
    }

    public static CoordinatorConfig load(Path file) {
        return apply(file, CoordinatorConfig.defaults());
    }

    /**
     * @throws IllegalArgumentException if the file cannot be read or holds invalid values
     */
    public static CoordinatorConfig apply(Path file, CoordinatorConfig config) {
        try (Reader reader = Files.newBufferedReader(file)) {
            apply(reader, config);
            log.info("Loaded configuration from {}", file);
            return config;
        } catch (IOException e) {
            throw new IllegalArgumentException("Cannot read config file " + file, e);
        }
    }

    public static CoordinatorConfig parse(String ini) {
        try {
            return apply(new StringReader(ini), CoordinatorConfig.defaults());
        } catch (IOException e) {
            throw new IllegalArgumentException("Invalid INI content", e);
        }
    }

    private static CoordinatorConfig apply(Reader reader, CoordinatorConfig config) throws IOException {
        Ini ini = new Ini(reader);

        Profile.Section server = ini.get("server");
        if (server != null) {
            String host = opt(server, "host");
            if (host != null) config.withServerHost(host);
            String port = opt(server, "port");
            if (port != null) config.withServerPort(parseInt(port, "server.port"));
        }

        Profile.Section database = ini.get("database");
        if (database != null) {
            String url = opt(database, "url");
            if (url != null) config.withDatabaseUrl(url);
            String pool = opt(database, "pool_size");
            if (pool != null) config.withDatabasePoolSize(parseInt(pool, "database.pool_size"));
        }

        Profile.Section scheduler = ini.get("scheduler");
        if (scheduler != null) {
            String strategy = opt(scheduler, "strategy");
            if (strategy != null) config.withSchedulerStrategy(strategy);
            String dispatch = opt(scheduler, "dispatch_interval_ms");
            if (dispatch != null) config.withDispatchInterval(millis(dispatch, "scheduler.dispatch_interval_ms"));
        }

        Profile.Section reconciler = ini.get("reconciler");
        if (reconciler != null) {
            String interval = opt(reconciler, "interval_ms");
            if (interval != null) config.withReconcileInterval(millis(interval, "reconciler.interval_ms"));
            String parallelism = opt(reconciler, "parallelism");
            if (parallelism != null) config.withPollParallelism(parseInt(parallelism, "reconciler.parallelism"));
            String timeout = opt(reconciler, "call_timeout_ms");
            if (timeout != null) config.withClusterCallTimeout(millis(timeout, "reconciler.call_timeout_ms"));
            config.withRetry(
                    parseInt(opt(reconciler, "retry_attempts", String.valueOf(config.retryAttempts())),
                            "reconciler.retry_attempts"),
                    parseInt(opt(reconciler, "retry_multiplier_ms", String.valueOf(config.retryMultiplierMs())),
                            "reconciler.retry_multiplier_ms"),
                    millis(opt(reconciler, "retry_max_wait_ms", String.valueOf(config.retryMaxWait().toMillis())),
                            "reconciler.retry_max_wait_ms"));
        }

        Profile.Section auth = ini.get("auth");
        if (auth != null) {
            String secret = opt(auth, "secret_key");
            if (secret != null) config.withSecretKey(secret);
            String ttl = opt(auth, "token_ttl_minutes");
            if (ttl != null) config.withTokenTtl(Duration.ofMinutes(parseInt(ttl, "auth.token_ttl_minutes")));
        }

        Profile.Section users = ini.get("users");
        if (users != null) {
            for (String email : users.keySet()) {
                config.withUser(email.trim(), users.get(email).trim());
            }
        }

        Profile.Section readOnly = ini.get("read_only");
        if (readOnly != null) {
            // entries are "email = true"
            for (String email : readOnly.keySet()) {
                if (!"false".equalsIgnoreCase(opt(readOnly, email, "true"))) {
                    config.withReadOnlyUser(email.trim());
                }
            }
        }

        for (String name : ini.keySet()) {
            if (name.startsWith(CLUSTER_PREFIX)) {
                config.withCluster(cluster(name.substring(CLUSTER_PREFIX.length()).trim(), ini.get(name)));
            }
        }

        return config;
    }

    private static ClusterSettings cluster(String id, Profile.Section section) {
        if (id.isEmpty()) {
            throw new IllegalArgumentException("Cluster section needs an id: [cluster <id>]");
        }
        String type = opt(section, "type");
        if (type == null) {
            throw new IllegalArgumentException("cluster " + id + ": 'type' is required");
        }

        Set<String> capabilities = new TreeSet<>();
        String labels = opt(section, "capabilities");
        if (labels != null) {
            Arrays.stream(labels.split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .forEach(capabilities::add);
        }

        Map<String, String> properties = new LinkedHashMap<>();
        for (String key : section.keySet()) {
            if (!CLUSTER_KEYS.contains(key)) {
                properties.put(key, section.get(key));
            }
        }

        int limit = parseInt(opt(section, "limit", "0"), "cluster " + id + ".limit");
        return new ClusterSettings(id, type, capabilities, limit, properties);
    }

    // ===== helpers =====
    private static String opt(Profile.Section s, String key) {
        String v = s == null ? null : s.get(key);
        return (v == null || v.isBlank()) ? null : v.trim();
    }

    private static String opt(Profile.Section s, String key, String def) {
        String v = opt(s, key);
        return v == null ? def : v;
    }

    private static int parseInt(String value, String key) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer, got '" + value + "'", e);
        }
    }

    private static Duration millis(String value, String key) {
        return Duration.ofMillis(parseInt(value, key));
    }
}
