package com.acme.secops.iamdrift.risk;

import java.util.Set;

/**
 * Resource-type vocabularies the standard rules key on. Tokens are lower case.
 */
public final class ResourceFamilies {
    public static final Set<String> ALL_RESOURCES = Set.of("all-resources", "all_resources");

    public static final Set<String> SENSITIVE = Set.of(
        "policies",
        "groups",
        "users",
        "dynamic-groups",
        "compartments",
        "identity-providers",
        "domains",
        "tag-namespaces",
        "authentication-policies",
        "network-sources",
        "credentials"
    );

    public static final Set<String> BROAD = Set.of(
        "object-family",
        "instance-family",
        "virtual-network-family",
        "database-family",
        "volume-family",
        "cluster-family",
        "file-family",
        "buckets",
        "objects",
        "instances"
    );

    private ResourceFamilies() {
    }

    public static boolean isAllResources(String resourceType) {
        return resourceType != null && ALL_RESOURCES.contains(resourceType);
    }

    public static boolean isSensitive(String resourceType) {
        return resourceType != null && SENSITIVE.contains(resourceType);
    }

    public static boolean isBroad(String resourceType) {
        return isAllResources(resourceType) || (resourceType != null && BROAD.contains(resourceType));
    }
}
