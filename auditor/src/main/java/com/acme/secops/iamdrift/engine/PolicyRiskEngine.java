package com.acme.secops.iamdrift.engine;

import com.acme.secops.iamdrift.audit.AuditCorrelator;
import com.acme.secops.iamdrift.audit.AuditEvent;
import com.acme.secops.iamdrift.audit.AuditEventType;
import com.acme.secops.iamdrift.audit.AuditWindow;
import com.acme.secops.iamdrift.audit.WindowedAuditCorrelator;
import com.acme.secops.iamdrift.directory.Compartment;
import com.acme.secops.iamdrift.directory.DirectorySnapshot;
import com.acme.secops.iamdrift.directory.Group;
import com.acme.secops.iamdrift.directory.GroupKind;
import com.acme.secops.iamdrift.directory.User;
import com.acme.secops.iamdrift.finding.Finding;
import com.acme.secops.iamdrift.policy.IamStatementParser;
import com.acme.secops.iamdrift.policy.ParseResult;
import com.acme.secops.iamdrift.policy.Policy;
import com.acme.secops.iamdrift.policy.PolicyStatement;
import com.acme.secops.iamdrift.policy.StatementParser;
import com.acme.secops.iamdrift.radius.BlastRadiusResolver;
import com.acme.secops.iamdrift.radius.CachingBlastRadiusResolver;
import com.acme.secops.iamdrift.risk.OrderedRiskRuleEngine;
import com.acme.secops.iamdrift.risk.RiskRuleEngine;
import com.acme.secops.iamdrift.risk.Severity;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Entry point of the evaluation pipeline: parse, classify, resolve blast radius,
 * correlate with audit events, order.
 *
 * <p>A run is single-threaded and synchronous over a fully collected snapshot. The
 * engine itself is stateless; per-run state (the group lookup cache) is created inside
 * {@link #evaluate} and discarded with it.
 */
public final class PolicyRiskEngine {
    private static final Logger LOG = Logger.getLogger(PolicyRiskEngine.class.getName());
    private static final Set<AuditEventType> CHANGE_EVENT_TYPES = Set.of(
        AuditEventType.POLICY_CHANGED,
        AuditEventType.GROUP_CHANGED,
        AuditEventType.DYNAMIC_GROUP_CHANGED
    );
    private static final Comparator<Finding> REPORT_ORDER = Comparator
        .comparingInt((Finding f) -> f.severity().rank())
        .thenComparingInt(f -> f.statement().ordinal());

    private final StatementParser parser;
    private final RiskRuleEngine ruleEngine;
    private final Supplier<? extends BlastRadiusResolver> resolverFactory;
    private final AuditCorrelator correlator;
    private final Clock clock;

    public PolicyRiskEngine(Clock clock) {
        this(new IamStatementParser(), new OrderedRiskRuleEngine(), CachingBlastRadiusResolver::new,
            new WindowedAuditCorrelator(clock), clock);
    }

    public PolicyRiskEngine(StatementParser parser,
                            RiskRuleEngine ruleEngine,
                            Supplier<? extends BlastRadiusResolver> resolverFactory,
                            AuditCorrelator correlator,
                            Clock clock) {
        this.parser = Objects.requireNonNull(parser, "parser");
        this.ruleEngine = Objects.requireNonNull(ruleEngine, "ruleEngine");
        this.resolverFactory = Objects.requireNonNull(resolverFactory, "resolverFactory");
        this.correlator = Objects.requireNonNull(correlator, "correlator");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Evaluates one snapshot.
     *
     * @param snapshot mandatory directory and policy data
     * @param events   recent audit events, or null when they could not be collected; null
     *                 disables correlation
     * @param config   run settings
     * @throws SnapshotMissingException if the snapshot is absent or has no compartments or policies
     */
    public EvaluationResult evaluate(DirectorySnapshot snapshot, List<AuditEvent> events, EngineConfig config) {
        Objects.requireNonNull(config, "config");
        requireComplete(snapshot);
        Instant evaluatedAt = clock.instant();

        List<PolicyStatement> statements = collectStatements(snapshot);
        BlastRadiusResolver resolver = resolverFactory.get();
        List<Finding> findings = new ArrayList<>(statements.size());
        for (PolicyStatement statement : statements) {
            findings.add(evaluate(statement, snapshot, resolver));
        }

        boolean correlationEnabled = events != null;
        List<AuditEvent> windowed = List.of();
        if (correlationEnabled) {
            // correlation and the summary share one window
            AuditWindow window = AuditWindow.endingAt(evaluatedAt, config.lookbackHours());
            findings = correlator.correlate(findings, events, window);
            windowed = WindowedAuditCorrelator.inWindow(events, window);
        } else {
            LOG.warning("Audit events unavailable, drift correlation disabled");
        }

        List<Finding> ordered = new ArrayList<>(findings);
        ordered.sort(REPORT_ORDER);

        List<AuditEvent> changeEvents = windowed.stream()
            .filter(e -> CHANGE_EVENT_TYPES.contains(e.type()))
            .toList();
        FindingSummary summary = summarize(snapshot, ordered, windowed, changeEvents.size());

        LOG.info("Evaluated " + statements.size() + " statements: "
            + summary.count(Severity.CRITICAL) + " critical, "
            + summary.count(Severity.HIGH) + " high, "
            + summary.count(Severity.MEDIUM) + " medium, "
            + summary.count(Severity.LOW) + " low, "
            + summary.recentlyModifiedFindings() + " recently modified");

        return new EvaluationResult(
            evaluatedAt,
            snapshot.tenancyId(),
            snapshot.region(),
            config,
            correlationEnabled,
            ordered,
            summary,
            changeEvents.subList(0, Math.min(changeEvents.size(), config.recentEventLimit())),
            groupsByMemberCount(snapshot),
            snapshot.skippedCompartments()
        );
    }

    private Finding evaluate(PolicyStatement statement, DirectorySnapshot snapshot, BlastRadiusResolver resolver) {
        if (statement.parsed() instanceof ParseResult.Parsed parsed) {
            return Finding.classified(
                statement,
                ruleEngine.classify(parsed.grant()),
                resolver.resolve(parsed.grant(), snapshot)
            );
        }
        return Finding.unparsed(statement);
    }

    private static void requireComplete(DirectorySnapshot snapshot) {
        if (snapshot == null) {
            throw new SnapshotMissingException("no snapshot supplied");
        }
        if (snapshot.compartments().isEmpty()) {
            throw new SnapshotMissingException("snapshot has no compartments");
        }
        if (snapshot.policies().isEmpty()) {
            throw new SnapshotMissingException("snapshot has no policies");
        }
    }

    private List<PolicyStatement> collectStatements(DirectorySnapshot snapshot) {
        Map<String, String> compartmentNames = new HashMap<>();
        for (Compartment c : snapshot.compartments()) {
            compartmentNames.putIfAbsent(c.id(), c.name());
        }
        List<PolicyStatement> out = new ArrayList<>();
        int ordinal = 0;
        for (Policy policy : snapshot.policies()) {
            String compartmentName = compartmentNames.getOrDefault(policy.compartmentId(), policy.compartmentId());
            for (String raw : policy.statements()) {
                PolicyStatement statement = PolicyStatement.of(ordinal++, policy, compartmentName, raw, parser);
                if (statement.parsed() instanceof ParseResult.Unparsed u) {
                    LOG.fine("Unparsed statement in policy " + policy.name() + ": " + u.error().kind() + " " + u.error().message());
                }
                out.add(statement);
            }
        }
        return out;
    }

    private static FindingSummary summarize(DirectorySnapshot snapshot,
                                            List<Finding> findings,
                                            List<AuditEvent> windowed,
                                            int changeEvents) {
        Map<Severity, Integer> bySeverity = new EnumMap<>(Severity.class);
        for (Severity s : Severity.values()) {
            bySeverity.put(s, 0);
        }
        Map<String, Integer> byCompartment = new HashMap<>();
        Map<String, Integer> elevatedByCompartment = new HashMap<>();
        int unparsed = 0;
        int unresolved = 0;
        int recentlyModified = 0;
        for (Finding f : findings) {
            bySeverity.merge(f.severity(), 1, Integer::sum);
            String compartment = f.statement().compartmentName();
            byCompartment.merge(compartment, 1, Integer::sum);
            if (f.severity().isElevated()) {
                elevatedByCompartment.merge(compartment, 1, Integer::sum);
            }
            if (!f.parsed()) unparsed++;
            if (f.blastRadiusUnresolved()) unresolved++;
            if (f.recentlyModified()) recentlyModified++;
        }

        int statementCount = 0;
        for (Policy p : snapshot.policies()) {
            statementCount += p.statements().size();
        }
        int mfaEnabled = 0;
        for (User u : snapshot.users()) {
            if (u.mfaActivated()) mfaEnabled++;
        }
        int identityEvents = (int) windowed.stream().filter(AuditEvent::isIdentityEvent).count();

        return new FindingSummary(
            bySeverity,
            byCountDescending(byCompartment),
            byCountDescending(elevatedByCompartment),
            snapshot.compartments().size(),
            snapshot.skippedCompartments().size(),
            snapshot.policies().size(),
            statementCount,
            unparsed,
            unresolved,
            recentlyModified,
            identityEvents,
            changeEvents,
            snapshot.groups().list(GroupKind.GROUP).size(),
            snapshot.groups().list(GroupKind.DYNAMIC_GROUP).size(),
            snapshot.users().size(),
            mfaEnabled,
            snapshot.activePrincipalCount()
        );
    }

    private static Map<String, Integer> byCountDescending(Map<String, Integer> counts) {
        Map<String, Integer> out = new LinkedHashMap<>();
        counts.entrySet().stream()
            .sorted(Map.Entry.<String, Integer>comparingByValue().reversed().thenComparing(Map.Entry.comparingByKey()))
            .forEach(e -> out.put(e.getKey(), e.getValue()));
        return out;
    }

    private static List<Group> groupsByMemberCount(DirectorySnapshot snapshot) {
        List<Group> groups = new ArrayList<>(snapshot.groups().list(GroupKind.GROUP));
        groups.sort(Comparator.comparingInt((Group g) -> g.memberCount().orElse(-1)).reversed());
        return groups;
    }
}
