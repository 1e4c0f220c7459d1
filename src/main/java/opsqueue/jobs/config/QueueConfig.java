package opsqueue.jobs.config;

import java.time.Duration;

/**
 * Configuration holder for queue settings.
 * All settings have sensible defaults.
 */
public final class QueueConfig {

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./data/opsqueue;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 10;

    // Server settings
    private int serverPort = 8080;
    private String serverHost = "0.0.0.0";

    // Job settings
    private int defaultMaxAttempts = 3;
    private Duration defaultJobTimeout = Duration.ofSeconds(120);
    private int workerThreads = 4;
    private Duration staleLockThreshold = Duration.ofMinutes(15);

    // Embedded ticker (off unless an interval is configured)
    private Duration tickInterval = Duration.ZERO;
    private int tickLimit = 10;

    // Auth settings (optional)
    private String triggerKey = null; // If set, /internal/ calls must send X-Opsqueue-Key

    private QueueConfig() {
    }

    public static QueueConfig defaults() {
        return new QueueConfig();
    }

    public static QueueConfig fromEnv() {
        QueueConfig config = new QueueConfig();

        String dbUrl = System.getenv("OPSQUEUE_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            config.databaseUrl = dbUrl;
        }

        String port = System.getenv("OPSQUEUE_PORT");
        if (port != null && !port.isBlank()) {
            config.serverPort = Integer.parseInt(port);
        }

        String triggerKey = System.getenv("OPSQUEUE_TRIGGER_KEY");
        if (triggerKey != null && !triggerKey.isBlank()) {
            config.triggerKey = triggerKey;
        }

        String maxAttempts = System.getenv("OPSQUEUE_MAX_ATTEMPTS");
        if (maxAttempts != null && !maxAttempts.isBlank()) {
            config.defaultMaxAttempts = Integer.parseInt(maxAttempts);
        }

        String staleMinutes = System.getenv("OPSQUEUE_STALE_MINUTES");
        if (staleMinutes != null && !staleMinutes.isBlank()) {
            config.staleLockThreshold = Duration.ofMinutes(Long.parseLong(staleMinutes));
        }

        String tickSeconds = System.getenv("OPSQUEUE_TICK_INTERVAL_SECONDS");
        if (tickSeconds != null && !tickSeconds.isBlank()) {
            config.tickInterval = Duration.ofSeconds(Long.parseLong(tickSeconds));
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

    public int defaultMaxAttempts() {
        return defaultMaxAttempts;
    }

    public Duration defaultJobTimeout() {
        return defaultJobTimeout;
    }

    public int workerThreads() {
        return workerThreads;
    }

    public Duration staleLockThreshold() {
        return staleLockThreshold;
    }

    public Duration tickInterval() {
        return tickInterval;
    }

    public boolean embeddedTickerEnabled() {
        return !tickInterval.isZero() && !tickInterval.isNegative();
    }

    public int tickLimit() {
        return tickLimit;
    }

    public String triggerKey() {
        return triggerKey;
    }

    public boolean hasTriggerKey() {
        return triggerKey != null && !triggerKey.isBlank();
    }

    // Fluent setters for testing/customization
    public QueueConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public QueueConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public QueueConfig withTriggerKey(String key) {
        this.triggerKey = key;
        return this;
    }

    public QueueConfig withMaxAttempts(int attempts) {
        this.defaultMaxAttempts = attempts;
        return this;
    }

    public QueueConfig withDefaultJobTimeout(Duration timeout) {
        this.defaultJobTimeout = timeout;
        return this;
    }

    public QueueConfig withWorkerThreads(int threads) {
        this.workerThreads = threads;
        return this;
    }

    public QueueConfig withStaleLockThreshold(Duration threshold) {
        this.staleLockThreshold = threshold;
        return this;
    }

    public QueueConfig withTickInterval(Duration interval) {
        this.tickInterval = interval;
        return this;
    }

    @Override
    public String toString() {
        return "QueueConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", serverPort=" + serverPort +
                ", maxAttempts=" + defaultMaxAttempts +
                ", staleLockThreshold=" + staleLockThreshold +
                ", tickInterval=" + tickInterval +
                ", triggerKeySet=" + hasTriggerKey() +
                '}';
    }
}
