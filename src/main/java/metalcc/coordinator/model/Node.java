package metalcc.coordinator.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Immutable domain model of a registered bare-metal node.
 * GPUs are never reserved for the host OS.
 */
public final class Node {
    private final String id;
    private final String hostname;
    private final String publicIp;
    private final String token;
    private final String agentVersion;
    private final ResourceShape total;
    private final ResourceShape reserved;
    private final String gpuModel;
    private final Instant lastSeenAt;
    private final Instant createdAt;
    private final Instant updatedAt;

    private Node(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.hostname = Objects.requireNonNull(builder.hostname, "hostname is required");
        this.publicIp = Objects.requireNonNull(builder.publicIp, "publicIp is required");
        this.token = Objects.requireNonNull(builder.token, "token is required");
        this.agentVersion = builder.agentVersion;
        this.total = Objects.requireNonNull(builder.total, "total is required");
        this.reserved = Objects.requireNonNull(builder.reserved, "reserved is required");
        this.gpuModel = builder.gpuModel;
        this.lastSeenAt = builder.lastSeenAt;
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt;
    }

    public String id() {
        return id;
    }

    public String hostname() {
        return hostname;
    }

    public String publicIp() {
        return publicIp;
    }

    public String token() {
        return token;
    }

    public String agentVersion() {
        return agentVersion;
    }

    public ResourceShape total() {
        return total;
    }

    public ResourceShape reserved() {
        return reserved;
    }

    public String gpuModel() {
        return gpuModel;
    }

    public Instant lastSeenAt() {
        return lastSeenAt;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    /** Capacity available to workloads before any placement. */
    public ResourceShape allocatable() {
        return total.minus(reserved);
    }

    public boolean isAlive(Instant now, Duration livenessThreshold) {
        return lastSeenAt != null && !lastSeenAt.isBefore(now.minus(livenessThreshold));
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .hostname(hostname)
                .publicIp(publicIp)
                .token(token)
                .agentVersion(agentVersion)
                .total(total)
                .reserved(reserved)
                .gpuModel(gpuModel)
                .lastSeenAt(lastSeenAt)
                .createdAt(createdAt)
                .updatedAt(updatedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String hostname;
        private String publicIp;
        private String token;
        private String agentVersion;
        private ResourceShape total;
        private ResourceShape reserved = ResourceShape.ZERO;
        private String gpuModel;
        private Instant lastSeenAt;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder hostname(String hostname) {
            this.hostname = hostname;
            return this;
        }

        public Builder publicIp(String publicIp) {
            this.publicIp = publicIp;
            return this;
        }

        public Builder token(String token) {
            this.token = token;
            return this;
        }

        public Builder agentVersion(String agentVersion) {
            this.agentVersion = agentVersion;
            return this;
        }

        public Builder total(ResourceShape total) {
            this.total = total;
            return this;
        }

        public Builder reserved(ResourceShape reserved) {
            this.reserved = reserved;
            return this;
        }

        public Builder gpuModel(String gpuModel) {
            this.gpuModel = gpuModel;
            return this;
        }

        public Builder lastSeenAt(Instant lastSeenAt) {
            this.lastSeenAt = lastSeenAt;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Node build() {
            return new Node(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Node node))
            return false;
        return Objects.equals(id, node.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Node{id='" + id + "', hostname='" + hostname + "', total=" + total + "}";
    }
}
