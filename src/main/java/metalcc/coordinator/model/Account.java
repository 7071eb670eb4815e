package metalcc.coordinator.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable domain model of a tenant account and its credit balance.
 */
public final class Account {
    private final String id;
    private final String name;
    private final String apiToken;
    private final long credits;
    private final Instant createdAt;

    private Account(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.name = Objects.requireNonNull(builder.name, "name is required");
        this.apiToken = Objects.requireNonNull(builder.apiToken, "apiToken is required");
        if (builder.credits < 0) {
            throw new IllegalArgumentException("credits can't be negative");
        }
        this.credits = builder.credits;
        this.createdAt = builder.createdAt;
    }

    public String id() {
        return id;
    }

    public String name() {
        return name;
    }

    public String apiToken() {
        return apiToken;
    }

    public long credits() {
        return credits;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .name(name)
                .apiToken(apiToken)
                .credits(credits)
                .createdAt(createdAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String name;
        private String apiToken;
        private long credits;
        private Instant createdAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder apiToken(String apiToken) {
            this.apiToken = apiToken;
            return this;
        }

        public Builder credits(long credits) {
            this.credits = credits;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Account build() {
            return new Account(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Account account))
            return false;
        return Objects.equals(id, account.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Account{id='" + id + "', name='" + name + "', credits=" + credits + "}";
    }
}
