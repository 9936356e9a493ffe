package blackcap.coordinator.config;

import blackcap.coordinator.cluster.ClusterSettings;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Configuration holder for Coordinator settings.
 * All settings have sensible defaults.
 */
public final class CoordinatorConfig {

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./data/blackcap;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 10;

    // Server settings
    private int serverPort = 8080;
    private String serverHost = "0.0.0.0";

    // Scheduling
    private String schedulerStrategy = "least-loaded";
    private Duration dispatchInterval = Duration.ofSeconds(5);

    // Reconciliation
    private Duration reconcileInterval = Duration.ofSeconds(10);
    private int pollParallelism = 4;
    private Duration clusterCallTimeout = Duration.ofSeconds(10);
    private int retryAttempts = 3;
    private long retryMultiplierMs = 200;
    private Duration retryMaxWait = Duration.ofSeconds(5);
    private int lockStripes = 64;

    // Auth
    private String secretKey = null;
    private Duration tokenTtl = Duration.ofMinutes(30);
    private final Map<String, String> users = new LinkedHashMap<>();
    private final Set<String> readOnlyUsers = new LinkedHashSet<>();

    private final List<ClusterSettings> clusters = new ArrayList<>();

    private CoordinatorConfig() {
    }

    public static CoordinatorConfig defaults() {
        return new CoordinatorConfig();
    }

    /**
     * Defaults, then the INI file named by {@code BLACKCAP_CONFIG} if any, then the
     * remaining environment overrides.
     */
    public static CoordinatorConfig fromEnv() {
        CoordinatorConfig config = new CoordinatorConfig();

        String configPath = System.getenv("BLACKCAP_CONFIG");
        if (configPath != null && !configPath.isBlank()) {
            IniConfigLoader.apply(Path.of(configPath), config);
        }

        String dbUrl = System.getenv("BLACKCAP_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            config.databaseUrl = dbUrl;
        }

        String port = System.getenv("BLACKCAP_PORT");
        if (port != null && !port.isBlank()) {
            config.serverPort = Integer.parseInt(port);
        }

        String secret = System.getenv("BLACKCAP_SECRET_KEY");
        if (secret != null && !secret.isBlank()) {
            config.secretKey = secret;
        }

        return config;
    }

    // Getters
    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public int serverPort() {
        return serverPort;
    }

    public String serverHost() {
        return serverHost;
    }

    public String schedulerStrategy() {
        return schedulerStrategy;
    }

    public Duration dispatchInterval() {
        return dispatchInterval;
    }

    public Duration reconcileInterval() {
        return reconcileInterval;
    }

    public int pollParallelism() {
        return pollParallelism;
    }

    public Duration clusterCallTimeout() {
        return clusterCallTimeout;
    }

    public int retryAttempts() {
        return retryAttempts;
    }

    public long retryMultiplierMs() {
        return retryMultiplierMs;
    }

    public Duration retryMaxWait() {
        return retryMaxWait;
    }

    public int lockStripes() {
        return lockStripes;
    }

    public String secretKey() {
        return secretKey;
    }

    public Duration tokenTtl() {
        return tokenTtl;
    }

    public Map<String, String> users() {
        return Map.copyOf(users);
    }

    public Set<String> readOnlyUsers() {
        return Set.copyOf(readOnlyUsers);
    }

    public List<ClusterSettings> clusters() {
        return List.copyOf(clusters);
    }

    // Fluent setters for testing/customization
    public CoordinatorConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public CoordinatorConfig withDatabasePoolSize(int size) {
        this.databasePoolSize = size;
        return this;
    }

    public CoordinatorConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public CoordinatorConfig withServerHost(String host) {
        this.serverHost = host;
        return this;
    }

    public CoordinatorConfig withSchedulerStrategy(String strategy) {
        this.schedulerStrategy = strategy;
        return this;
    }

    public CoordinatorConfig withDispatchInterval(Duration interval) {
        this.dispatchInterval = interval;
        return this;
    }

    public CoordinatorConfig withReconcileInterval(Duration interval) {
        this.reconcileInterval = interval;
        return this;
    }

    public CoordinatorConfig withPollParallelism(int parallelism) {
        this.pollParallelism = parallelism;
        return this;
    }

    public CoordinatorConfig withClusterCallTimeout(Duration timeout) {
        this.clusterCallTimeout = timeout;
        return this;
    }

    /**
     * @param attempts total status query attempts, at least 2 so a transient failure is retried once
     * @throws IllegalArgumentException for fewer than 2 attempts or a negative backoff
     */
    public CoordinatorConfig withRetry(int attempts, long multiplierMs, Duration maxWait) {
        if (attempts < 2) {
            throw new IllegalArgumentException("retry_attempts must be at least 2, got " + attempts);
        }
        if (multiplierMs < 0 || maxWait.isNegative()) {
            throw new IllegalArgumentException("retry backoff must not be negative");
        }
        this.retryAttempts = attempts;
        this.retryMultiplierMs = multiplierMs;
        this.retryMaxWait = maxWait;
        return this;
    }

    public CoordinatorConfig withLockStripes(int stripes) {
        this.lockStripes = stripes;
        return this;
    }

    public CoordinatorConfig withSecretKey(String key) {
        this.secretKey = key;
        return this;
    }

    public CoordinatorConfig withTokenTtl(Duration ttl) {
        this.tokenTtl = ttl;
        return this;
    }

    public CoordinatorConfig withUser(String email, String apiKey) {
        this.users.put(email, apiKey);
        return this;
    }

    public CoordinatorConfig withReadOnlyUser(String email) {
        this.readOnlyUsers.add(email);
        return this;
    }

    public CoordinatorConfig withCluster(ClusterSettings cluster) {
        this.clusters.add(cluster);
        return this;
    }

    @Override
    public String toString() {
        return "CoordinatorConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", serverPort=" + serverPort +
                ", scheduler=" + schedulerStrategy +
                ", clusters=" + clusters.size() +
                ", users=" + users.size() +
                ", secretKeySet=" + (secretKey != null && !secretKey.isBlank()) +
                '}';
    }
}
