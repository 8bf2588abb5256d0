package com.acme.secops.iamdrift.policy;

import java.util.Objects;

/**
 * Location a grant applies to. {@code target} is empty for tenancy and unspecified
 * scope and holds the compartment name, path ({@code a:b}) or OCID otherwise.
 * {@link Kind#UNSPECIFIED} is a statement written without an {@code in} clause.
 */
public record Scope(Kind kind, String target, boolean byId) {
    public enum Kind { TENANCY, COMPARTMENT, UNSPECIFIED }

    public Scope {
        Objects.requireNonNull(kind, "kind");
        target = target == null ? "" : target;
    }

    public static Scope tenancy() {
        return new Scope(Kind.TENANCY, "", false);
    }

    public static Scope unspecified() {
        return new Scope(Kind.UNSPECIFIED, "", false);
    }

    public static Scope compartment(String name) {
        return new Scope(Kind.COMPARTMENT, name, false);
    }

    public static Scope compartmentId(String ocid) {
        return new Scope(Kind.COMPARTMENT, ocid, true);
    }

    public boolean isTenancy() {
        return kind == Kind.TENANCY;
    }
}
