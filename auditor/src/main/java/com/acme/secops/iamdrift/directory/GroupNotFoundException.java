package com.acme.secops.iamdrift.directory;

/**
 * Thrown when a policy references a group the directory does not know, typically
 * because it was deleted or renamed after the policy was written.
 */
public class GroupNotFoundException extends Exception {
    private final GroupKind kind;
    private final String reference;

    public GroupNotFoundException(GroupKind kind, String reference) {
        super(kind + " not found: " + reference);
        this.kind = kind;
        this.reference = reference;
    }

    public GroupKind kind() { return kind; }
    public String reference() { return reference; }
}
