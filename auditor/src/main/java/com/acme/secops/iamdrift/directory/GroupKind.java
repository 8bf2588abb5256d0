package com.acme.secops.iamdrift.directory;

public enum GroupKind {
    GROUP,
    DYNAMIC_GROUP
}
