package com.acme.secops.iamdrift.snapshot;

import com.acme.secops.iamdrift.audit.AuditEvent;
import com.acme.secops.iamdrift.audit.AuditEventType;
import com.acme.secops.iamdrift.audit.WindowedAuditCorrelator;
import com.acme.secops.iamdrift.directory.Compartment;
import com.acme.secops.iamdrift.directory.DirectorySnapshot;
import com.acme.secops.iamdrift.directory.Group;
import com.acme.secops.iamdrift.directory.GroupKind;
import com.acme.secops.iamdrift.directory.InMemoryGroupDirectory;
import com.acme.secops.iamdrift.directory.SkippedCompartment;
import com.acme.secops.iamdrift.directory.User;
import com.acme.secops.iamdrift.engine.SnapshotMissingException;
import com.acme.secops.iamdrift.policy.Policy;
import com.acme.secops.iamdrift.util.JsonCodec;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Snapshot source over a JSON export of the tenancy's identity data.
 *
 * <p>Applies the collection-side rules: compartment scoping, membership counting and
 * audit event normalization with de-duplication by event id.
 */
public final class JsonFileSnapshotSource implements SnapshotSource {
    private static final Logger LOG = Logger.getLogger(JsonFileSnapshotSource.class.getName());

    private final Path file;
    private final boolean includeSubcompartments;
    private final String rootCompartmentOverride;
    private JsonNode root;

    public JsonFileSnapshotSource(Path file, boolean includeSubcompartments, String rootCompartmentOverride) {
        this.file = Objects.requireNonNull(file, "file");
        this.includeSubcompartments = includeSubcompartments;
        this.rootCompartmentOverride = rootCompartmentOverride == null || rootCompartmentOverride.isBlank()
            ? null
            : rootCompartmentOverride.trim();
    }

    public JsonFileSnapshotSource(Path file, boolean includeSubcompartments) {
        this(file, includeSubcompartments, null);
    }

    @Override
    public DirectorySnapshot loadSnapshot() {
        JsonNode node = root();
        try {
            String tenancyId = JsonCodec.optionalText(node, "tenancyId", "");
            String rootId = rootCompartmentOverride != null
                ? rootCompartmentOverride
                : JsonCodec.optionalText(node, "rootCompartmentId", tenancyId);

            List<Compartment> compartments = scopeCompartments(
                parseCompartments(node.get("compartments")),
                rootId,
                JsonCodec.optionalText(node, "tenancyName", rootId)
            );
            Set<String> inScope = new HashSet<>();
            for (Compartment c : compartments) {
                inScope.add(c.id());
            }

            List<Policy> policies = new ArrayList<>();
            int outOfScope = 0;
            for (JsonNode p : elements(node.get("policies"))) {
                Policy policy = parsePolicy(p);
                if (inScope.contains(policy.compartmentId())) {
                    policies.add(policy);
                } else {
                    outOfScope++;
                }
            }
            if (outOfScope > 0) {
                LOG.info("Ignored " + outOfScope + " policies outside the compartment scope");
            }

            List<User> users = parseUsers(node.get("users"));
            int activeUsers = (int) users.stream().filter(User::active).count();
            List<Group> groups = new ArrayList<>(parseGroups(node.get("groups"), node.get("memberships")));
            for (JsonNode g : elements(node.get("dynamicGroups"))) {
                groups.add(new Group(
                    JsonCodec.requiredText(g, "id"),
                    JsonCodec.requiredText(g, "name"),
                    GroupKind.DYNAMIC_GROUP,
                    optionalCount(g, "memberCount")
                ));
            }

            DirectorySnapshot snapshot = new DirectorySnapshot(
                tenancyId,
                JsonCodec.optionalText(node, "region", ""),
                parseInstant(JsonCodec.optionalText(node, "collectedAt", null)),
                compartments,
                parseSkipped(node.get("skippedCompartments")),
                policies,
                new InMemoryGroupDirectory(groups),
                users,
                JsonCodec.optionalInt(node, "activePrincipalCount", activeUsers)
            );
            LOG.info("Loaded snapshot from " + file + ": " + compartments.size() + " compartments, "
                + policies.size() + " policies, " + groups.size() + " groups, " + users.size() + " users");
            return snapshot;
        } catch (IllegalArgumentException e) {
            throw new SnapshotMissingException("malformed snapshot " + file + ": " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<List<AuditEvent>> loadAuditEvents() {
        JsonNode events = root().get("auditEvents");
        if (events == null || !events.isArray()) {
            LOG.warning("Snapshot " + file + " carries no auditEvents array");
            return Optional.empty();
        }
        List<AuditEvent> out = new ArrayList<>();
        Set<String> seenIds = new HashSet<>();
        int skipped = 0;
        for (JsonNode e : events) {
            AuditEvent event = parseAuditEvent(e);
            if (event == null) {
                skipped++;
                continue;
            }
            if (!event.eventId().isEmpty() && !seenIds.add(event.eventId())) {
                continue;
            }
            out.add(event);
        }
        if (skipped > 0) {
            LOG.warning("Skipped " + skipped + " audit events without a readable eventTime");
        }
        out.sort(WindowedAuditCorrelator.NEWEST_FIRST);
        return Optional.of(List.copyOf(out));
    }

    private JsonNode root() {
        if (root != null) {
            return root;
        }
        if (!Files.exists(file)) {
            throw new SnapshotMissingException("snapshot file not found: " + file);
        }
        try {
            JsonNode parsed = JsonCodec.readTree(Files.readString(file, StandardCharsets.UTF_8));
            if (parsed == null || !parsed.isObject()) {
                throw new SnapshotMissingException("snapshot file is not a JSON object: " + file);
            }
            root = parsed;
            return root;
        } catch (IOException e) {
            throw new SnapshotMissingException("cannot read snapshot file " + file, e);
        }
    }

    private static Iterable<JsonNode> elements(JsonNode array) {
        if (array == null || !array.isArray()) {
            return List.of();
        }
        return array;
    }

    private static List<Compartment> parseCompartments(JsonNode array) {
        List<Compartment> out = new ArrayList<>();
        for (JsonNode c : elements(array)) {
            out.add(new Compartment(
                JsonCodec.requiredText(c, "id"),
                JsonCodec.optionalText(c, "name", null),
                JsonCodec.optionalText(c, "parentId", JsonCodec.optionalText(c, "compartmentId", null))
            ));
        }
        return out;
    }

    /**
     * Keeps the root and either its whole subtree or only its direct children, then
     * de-duplicates by id and orders by name.
     */
    List<Compartment> scopeCompartments(List<Compartment> all, String rootId, String rootName) {
        if (rootId == null || rootId.isBlank()) {
            return List.of();
        }
        Map<String, List<Compartment>> children = new HashMap<>();
        Compartment rootCompartment = null;
        for (Compartment c : all) {
            if (c.id().equals(rootId)) {
                rootCompartment = c;
            } else if (c.parentId() != null) {
                children.computeIfAbsent(c.parentId(), k -> new ArrayList<>()).add(c);
            }
        }

        Map<String, Compartment> unique = new LinkedHashMap<>();
        unique.put(rootId, rootCompartment != null ? rootCompartment : new Compartment(rootId, rootName, null));
        Deque<String> queue = new ArrayDeque<>();
        queue.add(rootId);
        Set<String> visited = new HashSet<>();
        while (!queue.isEmpty()) {
            String parentId = queue.poll();
            if (!visited.add(parentId)) {
                continue;
            }
            for (Compartment child : children.getOrDefault(parentId, List.of())) {
                unique.putIfAbsent(child.id(), child);
                if (includeSubcompartments) {
                    queue.add(child.id());
                }
            }
        }

        List<Compartment> out = new ArrayList<>(unique.values());
        out.sort(Comparator.comparing((Compartment c) -> c.name().toLowerCase(Locale.ROOT)));
        return out;
    }

    private static List<SkippedCompartment> parseSkipped(JsonNode array) {
        List<SkippedCompartment> out = new ArrayList<>();
        for (JsonNode s : elements(array)) {
            out.add(new SkippedCompartment(
                JsonCodec.requiredText(s, "compartmentId"),
                JsonCodec.optionalText(s, "reason", "")
            ));
        }
        return out;
    }

    private static Policy parsePolicy(JsonNode p) {
        List<String> statements = new ArrayList<>();
        for (JsonNode s : elements(p.get("statements"))) {
            if (s.isTextual() && !s.asText().isBlank()) {
                statements.add(s.asText().trim());
            }
        }
        return new Policy(
            JsonCodec.requiredText(p, "id"),
            JsonCodec.optionalText(p, "name", null),
            JsonCodec.optionalText(p, "description", ""),
            JsonCodec.requiredText(p, "compartmentId"),
            statements
        );
    }

    private static List<User> parseUsers(JsonNode array) {
        List<User> out = new ArrayList<>();
        for (JsonNode u : elements(array)) {
            String state = JsonCodec.optionalText(u, "lifecycleState", "ACTIVE");
            boolean mfa = JsonCodec.optionalBoolean(u, "isMfaActivated",
                JsonCodec.optionalBoolean(u, "mfaActivated", false));
            out.add(new User(
                JsonCodec.requiredText(u, "id"),
                JsonCodec.optionalText(u, "name", null),
                "ACTIVE".equalsIgnoreCase(state),
                mfa
            ));
        }
        return out;
    }

    /**
     * Group counts come from an explicit {@code memberCount}, else from the membership list
     * when one was collected. Without either the count stays unknown.
     */
    private static List<Group> parseGroups(JsonNode groupsNode, JsonNode membershipsNode) {
        boolean membershipsCollected = membershipsNode != null && membershipsNode.isArray();
        Map<String, Integer> counts = new HashMap<>();
        Set<String> seenMemberships = new HashSet<>();
        for (JsonNode m : elements(membershipsNode)) {
            String membershipId = JsonCodec.optionalText(m, "id", null);
            if (membershipId != null && !seenMemberships.add(membershipId)) {
                continue;
            }
            String groupId = JsonCodec.optionalText(m, "groupId", null);
            if (groupId != null) {
                counts.merge(groupId, 1, Integer::sum);
            }
        }

        List<Group> out = new ArrayList<>();
        for (JsonNode g : elements(groupsNode)) {
            String id = JsonCodec.requiredText(g, "id");
            OptionalInt count = optionalCount(g, "memberCount");
            if (count.isEmpty() && membershipsCollected) {
                count = OptionalInt.of(counts.getOrDefault(id, 0));
            }
            out.add(new Group(id, JsonCodec.requiredText(g, "name"), GroupKind.GROUP, count));
        }
        return out;
    }

    private static OptionalInt optionalCount(JsonNode node, String field) {
        int value = JsonCodec.optionalInt(node, field, -1);
        return value < 0 ? OptionalInt.empty() : OptionalInt.of(value);
    }

    private static AuditEvent parseAuditEvent(JsonNode e) {
        if (e == null || !e.isObject()) {
            return null;
        }
        Instant eventTime = parseInstant(JsonCodec.optionalText(e, "eventTime", null));
        if (eventTime == null) {
            return null;
        }
        JsonNode data = e.get("data");
        if (data == null || !data.isObject()) {
            data = e;
        }
        JsonNode identity = data.get("identity");

        String rawType = JsonCodec.optionalText(e, "eventType", "");
        String eventName = firstText(data, "eventName", "event_name");
        String label = JsonCodec.optionalText(e, "type", null);
        AuditEventType type = label != null
            ? AuditEventType.fromLabel(label)
            : AuditEventType.classify(rawType, eventName);

        return new AuditEvent(
            JsonCodec.optionalText(e, "eventId", ""),
            eventTime,
            type,
            rawType,
            eventName,
            firstText(identity, "principalName", "principal_name"),
            firstText(data, "resourceId", "resource_id"),
            firstText(data, "resourceName", "resource_name"),
            firstText(data, "compartmentId", "compartment_id")
        );
    }

    private static String firstText(JsonNode node, String camel, String snake) {
        return JsonCodec.optionalText(node, camel, JsonCodec.optionalText(node, snake, ""));
    }

    private static Instant parseInstant(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(raw.trim()).toInstant();
        } catch (DateTimeParseException e) {
            try {
                return Instant.parse(raw.trim());
            } catch (DateTimeParseException ignored) {
                return null;
            }
        }
    }
}
