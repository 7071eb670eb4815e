package metalcc.coordinator.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable domain model of a tenant workload placed on a node.
 * The payload (compose file, env vars, files, registry credentials) is kept as an
 * opaque JSON document and only interpreted by the agent.
 */
public final class Workload {
    private final String id;
    private final String name;
    private final String accountId;
    private final String nodeId;
    private final ResourceShape shape;
    private final long creditRate;
    private final WorkloadStatus status;
    private final String domain;
    private final boolean managedDomain;
    private final String payload;
    private final Instant createdAt;
    private final Instant updatedAt;

    private Workload(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.name = Objects.requireNonNull(builder.name, "name is required");
        this.accountId = Objects.requireNonNull(builder.accountId, "accountId is required");
        this.nodeId = Objects.requireNonNull(builder.nodeId, "nodeId is required");
        this.shape = Objects.requireNonNull(builder.shape, "shape is required");
        this.creditRate = builder.creditRate;
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.domain = Objects.requireNonNull(builder.domain, "domain is required");
        this.managedDomain = builder.managedDomain;
        this.payload = Objects.requireNonNull(builder.payload, "payload is required");
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt;
    }

    public String id() {
        return id;
    }

    public String name() {
        return name;
    }

    public String accountId() {
        return accountId;
    }

    public String nodeId() {
        return nodeId;
    }

    public ResourceShape shape() {
        return shape;
    }

    public long creditRate() {
        return creditRate;
    }

    public WorkloadStatus status() {
        return status;
    }

    public String domain() {
        return domain;
    }

    /** True when the domain was generated and its DNS record is owned by this control plane. */
    public boolean managedDomain() {
        return managedDomain;
    }

    public String payload() {
        return payload;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    public boolean isActive() {
        return status.isActive();
    }

    public boolean isOwnedBy(Account account) {
        return accountId.equals(account.id());
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .name(name)
                .accountId(accountId)
                .nodeId(nodeId)
                .shape(shape)
                .creditRate(creditRate)
                .status(status)
                .domain(domain)
                .managedDomain(managedDomain)
                .payload(payload)
                .createdAt(createdAt)
                .updatedAt(updatedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String name;
        private String accountId;
        private String nodeId;
        private ResourceShape shape;
        private long creditRate;
        private WorkloadStatus status = WorkloadStatus.SCHEDULED;
        private String domain;
        private boolean managedDomain;
        private String payload = "{}";
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder accountId(String accountId) {
            this.accountId = accountId;
            return this;
        }

        public Builder nodeId(String nodeId) {
            this.nodeId = nodeId;
            return this;
        }

        public Builder shape(ResourceShape shape) {
            this.shape = shape;
            return this;
        }

        public Builder creditRate(long creditRate) {
            this.creditRate = creditRate;
            return this;
        }

        public Builder status(WorkloadStatus status) {
            this.status = status;
            return this;
        }

        public Builder domain(String domain) {
            this.domain = domain;
            return this;
        }

        public Builder managedDomain(boolean managedDomain) {
            this.managedDomain = managedDomain;
            return this;
        }

        public Builder payload(String payload) {
            this.payload = payload;
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

        public Workload build() {
            return new Workload(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Workload workload))
            return false;
        return Objects.equals(id, workload.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Workload{id='" + id + "', node='" + nodeId + "', status=" + status + ", rate=" + creditRate + "}";
    }
}
