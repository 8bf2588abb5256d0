package com.acme.secops.iamdrift.audit;

import com.acme.secops.iamdrift.finding.Finding;
import com.acme.secops.iamdrift.policy.Grant;
import com.acme.secops.iamdrift.policy.SubjectType;
import com.acme.secops.iamdrift.radius.BlastRadius;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

public final class WindowedAuditCorrelator implements AuditCorrelator {
    public static final Comparator<AuditEvent> NEWEST_FIRST = Comparator.comparing(AuditEvent::eventTime).reversed();

    private final Clock clock;

    public WindowedAuditCorrelator(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public List<Finding> correlate(List<Finding> findings, List<AuditEvent> events, int lookbackHours) {
        return correlate(findings, events, AuditWindow.endingNow(clock, lookbackHours));
    }

    @Override
    public List<Finding> correlate(List<Finding> findings, List<AuditEvent> events, AuditWindow window) {
        Objects.requireNonNull(findings, "findings");
        Objects.requireNonNull(window, "window");
        if (events == null || events.isEmpty()) {
            return List.copyOf(findings);
        }

        List<AuditEvent> windowed = inWindow(events, window);
        List<Finding> out = new ArrayList<>(findings.size());
        for (Finding finding : findings) {
            Set<AuditEvent> matches = new LinkedHashSet<>();
            for (AuditEvent event : windowed) {
                if (matchesPolicy(finding, event) || matchesGroup(finding, event)) {
                    matches.add(event);
                }
            }
            out.add(matches.isEmpty() ? finding : finding.withCorrelatedEvents(List.copyOf(matches)));
        }
        return List.copyOf(out);
    }

    /** Events inside the window, newest first. */
    public static List<AuditEvent> inWindow(List<AuditEvent> events, AuditWindow window) {
        List<AuditEvent> out = new ArrayList<>();
        for (AuditEvent event : events) {
            if (event != null && window.contains(event.eventTime())) {
                out.add(event);
            }
        }
        out.sort(NEWEST_FIRST);
        return out;
    }

    private static boolean matchesPolicy(Finding finding, AuditEvent event) {
        if (event.resourceId().equals(finding.statement().policyId())) {
            return true;
        }
        return event.type() == AuditEventType.POLICY_CHANGED
            && event.resourceName().equals(finding.statement().policyName());
    }

    private static boolean matchesGroup(Finding finding, AuditEvent event) {
        Optional<Grant> grant = finding.statement().grant();
        if (grant.isEmpty() || !grant.get().subjectType().isNamedGroup()) {
            return false;
        }
        SubjectType subjectType = grant.get().subjectType();
        boolean relevantType = subjectType == SubjectType.DYNAMIC_GROUP
            ? event.type() == AuditEventType.DYNAMIC_GROUP_CHANGED
            : event.type() == AuditEventType.GROUP_MEMBERSHIP_CHANGED || event.type() == AuditEventType.GROUP_CHANGED;
        if (!relevantType) {
            return false;
        }
        if (event.affects(grant.get().subjectName())) {
            return true;
        }
        return finding.blastRadius() instanceof BlastRadius.Counted counted && event.affects(counted.groupId());
    }
}
