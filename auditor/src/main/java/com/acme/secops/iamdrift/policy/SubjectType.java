package com.acme.secops.iamdrift.policy;

public enum SubjectType {
    GROUP("group"),
    DYNAMIC_GROUP("dynamic-group"),
    ANY_USER("any-user"),
    ANY_GROUP("any-group"),
    SERVICE("service");

    private final String keyword;

    SubjectType(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    /** True for subjects that name a directory group. */
    public boolean isNamedGroup() {
        return this == GROUP || this == DYNAMIC_GROUP;
    }

    /** True for subjects that expand to every principal in the tenancy. */
    public boolean isTenancyWide() {
        return this == ANY_USER || this == ANY_GROUP;
    }
}
