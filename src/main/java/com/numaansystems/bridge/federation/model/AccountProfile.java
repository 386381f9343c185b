package com.numaansystems.bridge.federation.model;

import java.util.Objects;

/**
 * Account on the target service: stable id and display name.
 *
 * <p>The only pipeline value that may be persisted or sent to the client.</p>
 */
public final class AccountProfile {

    private final String id;
    private final String name;

    public AccountProfile(String id, String name) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = Objects.requireNonNull(name, "name");
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AccountProfile other)) {
            return false;
        }
        return id.equals(other.id) && name.equals(other.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name);
    }

    @Override
    public String toString() {
        return "AccountProfile[id=" + id + ", name=" + name + "]";
    }
}
