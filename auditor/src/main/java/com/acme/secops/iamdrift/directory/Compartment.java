package com.acme.secops.iamdrift.directory;

import java.util.Objects;

public record Compartment(String id, String name, String parentId) {
    public Compartment {
        Objects.requireNonNull(id, "id");
        name = name == null || name.isBlank() ? id : name;
    }
}
