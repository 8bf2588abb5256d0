package com.acme.secops.iamdrift.directory;

import java.util.Objects;

public record User(String id, String name, boolean active, boolean mfaActivated) {
    public User {
        Objects.requireNonNull(id, "id");
        name = name == null ? id : name;
    }
}
