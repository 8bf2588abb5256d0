package com.acme.secops.iamdrift.policy;

import java.util.List;
import java.util.Objects;

public record Policy(
    String id,
    String name,
    String description,
    String compartmentId,
    List<String> statements
) {
    public Policy {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(compartmentId, "compartmentId");
        name = name == null ? id : name;
        description = description == null ? "" : description;
        statements = statements == null ? List.of() : List.copyOf(statements);
    }
}
