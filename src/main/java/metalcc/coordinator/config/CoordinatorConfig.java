package metalcc.coordinator.config;

import org.ini4j.Ini;
import org.ini4j.Profile;

import java.io.File;
import java.io.IOException;
import java.time.Duration;
import java.util.Map;

/**
 * Configuration holder for control plane settings.
 * All settings have sensible defaults; an INI file and then environment variables override them.
 */
public final class CoordinatorConfig {

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./data/metalcc;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE;LOCK_TIMEOUT=10000";
    private int databasePoolSize = 10;

    // Server settings
    private int serverPort = 8080;
    private String serverHost = "0.0.0.0";

    // Auth settings (optional). Unset keys leave the matching endpoints open.
    private String adminApiKey = null;
    private String nodeApiKey = null;

    // Placement settings
    private Duration nodeLivenessThreshold = Duration.ofMinutes(1);

    // Metering settings
    private boolean meteringEnabled = true;
    private Duration meteringInterval = Duration.ofMinutes(1);

    // DNS settings
    private String workloadsDnsZone = "workloads.public.localhost";
    private String nodesDnsZone = "agents.private.localhost";

    // Agent settings
    private String agentScheme = "https";
    private int agentPort = 443;
    private Duration agentRequestTimeout = Duration.ofSeconds(30);

    private CoordinatorConfig() {
    }

    public static CoordinatorConfig defaults() {
        return new CoordinatorConfig();
    }

    public static CoordinatorConfig fromEnv() {
        return new CoordinatorConfig().applyEnv(System.getenv());
    }

    /**
     * Load settings from an INI file, then apply environment overrides.
     */
    public static CoordinatorConfig fromIni(File file) throws IOException {
        return fromIni(file, System.getenv());
    }

    static CoordinatorConfig fromIni(File file, Map<String, String> env) throws IOException {
        CoordinatorConfig config = new CoordinatorConfig();
        Ini ini = new Ini(file);

        Profile.Section database = ini.get("DATABASE");
        if (database != null) {
            config.databaseUrl = opt(database, "url", config.databaseUrl);
            config.databasePoolSize = Integer.parseInt(opt(database, "pool_size", String.valueOf(config.databasePoolSize)));
        }

        Profile.Section server = ini.get("SERVER");
        if (server != null) {
            config.serverHost = opt(server, "host", config.serverHost);
            config.serverPort = Integer.parseInt(opt(server, "port", String.valueOf(config.serverPort)));
        }

        Profile.Section auth = ini.get("AUTH");
        if (auth != null) {
            config.adminApiKey = opt(auth, "admin_api_key", config.adminApiKey);
            config.nodeApiKey = opt(auth, "node_api_key", config.nodeApiKey);
        }

        Profile.Section placement = ini.get("PLACEMENT");
        if (placement != null) {
            config.nodeLivenessThreshold = seconds(placement, "node_liveness_seconds", config.nodeLivenessThreshold);
        }

        Profile.Section metering = ini.get("METERING");
        if (metering != null) {
            config.meteringEnabled = Boolean.parseBoolean(opt(metering, "enabled", String.valueOf(config.meteringEnabled)));
            config.meteringInterval = seconds(metering, "interval_seconds", config.meteringInterval);
        }

        Profile.Section dns = ini.get("DNS");
        if (dns != null) {
            config.workloadsDnsZone = opt(dns, "workloads_zone", config.workloadsDnsZone);
            config.nodesDnsZone = opt(dns, "nodes_zone", config.nodesDnsZone);
        }

        Profile.Section agent = ini.get("AGENT");
        if (agent != null) {
            config.agentScheme = opt(agent, "scheme", config.agentScheme);
            config.agentPort = Integer.parseInt(opt(agent, "port", String.valueOf(config.agentPort)));
            config.agentRequestTimeout = seconds(agent, "timeout_seconds", config.agentRequestTimeout);
        }

        return config.applyEnv(env);
    }

    CoordinatorConfig applyEnv(Map<String, String> env) {
        String dbUrl = env.get("METALCC_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            databaseUrl = dbUrl;
        }

        String port = env.get("METALCC_PORT");
        if (port != null && !port.isBlank()) {
            serverPort = Integer.parseInt(port);
        }

        String adminKey = env.get("METALCC_ADMIN_KEY");
        if (adminKey != null && !adminKey.isBlank()) {
            adminApiKey = adminKey;
        }

        String nodeKey = env.get("METALCC_NODE_KEY");
        if (nodeKey != null && !nodeKey.isBlank()) {
            nodeApiKey = nodeKey;
        }

        String liveness = env.get("METALCC_NODE_LIVENESS_SECONDS");
        if (liveness != null && !liveness.isBlank()) {
            nodeLivenessThreshold = Duration.ofSeconds(Long.parseLong(liveness));
        }

        String meteringSeconds = env.get("METALCC_METERING_INTERVAL_SECONDS");
        if (meteringSeconds != null && !meteringSeconds.isBlank()) {
            meteringInterval = Duration.ofSeconds(Long.parseLong(meteringSeconds));
        }

        String workloadsZone = env.get("METALCC_WORKLOADS_ZONE");
        if (workloadsZone != null && !workloadsZone.isBlank()) {
            workloadsDnsZone = workloadsZone;
        }

        String nodesZone = env.get("METALCC_NODES_ZONE");
        if (nodesZone != null && !nodesZone.isBlank()) {
            nodesDnsZone = nodesZone;
        }

        String agentPortEnv = env.get("METALCC_AGENT_PORT");
        if (agentPortEnv != null && !agentPortEnv.isBlank()) {
            agentPort = Integer.parseInt(agentPortEnv);
        }

        return this;
    }

    private static String opt(Profile.Section section, String key, String fallback) {
        String value = section.get(key);
        return value == null || value.isBlank() ? fallback : value.trim();
    }

    private static Duration seconds(Profile.Section section, String key, Duration fallback) {
        String value = section.get(key);
        return value == null || value.isBlank() ? fallback : Duration.ofSeconds(Long.parseLong(value.trim()));
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

    public String adminApiKey() {
        return adminApiKey;
    }

    public boolean hasAdminApiKey() {
        return adminApiKey != null && !adminApiKey.isBlank();
    }

    public String nodeApiKey() {
        return nodeApiKey;
    }

    public boolean hasNodeApiKey() {
        return nodeApiKey != null && !nodeApiKey.isBlank();
    }

    public Duration nodeLivenessThreshold() {
        return nodeLivenessThreshold;
    }

    public boolean meteringEnabled() {
        return meteringEnabled;
    }

    public Duration meteringInterval() {
        return meteringInterval;
    }

    public String workloadsDnsZone() {
        return workloadsDnsZone;
    }

    public String nodesDnsZone() {
        return nodesDnsZone;
    }

    public String agentScheme() {
        return agentScheme;
    }

    public int agentPort() {
        return agentPort;
    }

    public Duration agentRequestTimeout() {
        return agentRequestTimeout;
    }

    // Fluent setters for testing/customization
    public CoordinatorConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public CoordinatorConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public CoordinatorConfig withAdminApiKey(String key) {
        this.adminApiKey = key;
        return this;
    }

    public CoordinatorConfig withNodeApiKey(String key) {
        this.nodeApiKey = key;
        return this;
    }

    public CoordinatorConfig withNodeLivenessThreshold(Duration threshold) {
        this.nodeLivenessThreshold = threshold;
        return this;
    }

    public CoordinatorConfig withMetering(boolean enabled, Duration interval) {
        this.meteringEnabled = enabled;
        this.meteringInterval = interval;
        return this;
    }

    public CoordinatorConfig withDnsZones(String workloadsZone, String nodesZone) {
        this.workloadsDnsZone = workloadsZone;
        this.nodesDnsZone = nodesZone;
        return this;
    }

    @Override
    public String toString() {
        return "CoordinatorConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", serverPort=" + serverPort +
                ", nodeLiveness=" + nodeLivenessThreshold +
                ", metering=" + (meteringEnabled ? meteringInterval : "off") +
                ", workloadsZone='" + workloadsDnsZone + '\'' +
                ", nodesZone='" + nodesDnsZone + '\'' +
                ", adminKeySet=" + hasAdminApiKey() +
                ", nodeKeySet=" + hasNodeApiKey() +
                '}';
    }
}
