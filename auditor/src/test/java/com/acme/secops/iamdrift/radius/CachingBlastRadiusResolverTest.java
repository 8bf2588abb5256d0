package com.acme.secops.iamdrift.radius;

import com.acme.secops.iamdrift.directory.DirectorySnapshot;
import com.acme.secops.iamdrift.directory.Group;
import com.acme.secops.iamdrift.directory.GroupDirectory;
import com.acme.secops.iamdrift.directory.GroupKind;
import com.acme.secops.iamdrift.directory.GroupNotFoundException;
import com.acme.secops.iamdrift.directory.InMemoryGroupDirectory;
import com.acme.secops.iamdrift.policy.Grant;
import com.acme.secops.iamdrift.policy.Scope;
import com.acme.secops.iamdrift.policy.SubjectType;
import com.acme.secops.iamdrift.policy.Verb;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;

class CachingBlastRadiusResolverTest {

    @Test
    void shouldResolveSameGroupOnlyOnce() {
        CountingDirectory directory = new CountingDirectory(new InMemoryGroupDirectory(List.of(
            Group.group("g1", "Auditors", 7)
        )));
        DirectorySnapshot snapshot = snapshot(directory, 40);
        CachingBlastRadiusResolver resolver = new CachingBlastRadiusResolver();

        BlastRadius first = resolver.resolve(group("Auditors"), snapshot);
        BlastRadius second = resolver.resolve(group("Auditors"), snapshot);

        assertEquals(first, second);
        assertEquals(7, BlastRadius.countOrNull(first));
        assertEquals(1, directory.lookups);
        assertEquals(1, resolver.directoryLookups());
    }

    @Test
    void shouldCacheMissesToo() {
        CountingDirectory directory = new CountingDirectory(InMemoryGroupDirectory.empty());
        DirectorySnapshot snapshot = snapshot(directory, 40);
        CachingBlastRadiusResolver resolver = new CachingBlastRadiusResolver();

        BlastRadius.Unresolved unresolved = assertInstanceOf(BlastRadius.Unresolved.class,
            resolver.resolve(group("LegacyAdmins"), snapshot));
        resolver.resolve(group("LegacyAdmins"), snapshot);

        assertEquals("LegacyAdmins", unresolved.reference());
        assertEquals(CachingBlastRadiusResolver.REASON_NOT_FOUND, unresolved.reason());
        assertEquals(1, directory.lookups);
    }

    @Test
    void shouldMatchGroupNamesCaseSensitively() {
        DirectorySnapshot snapshot = snapshot(new InMemoryGroupDirectory(List.of(Group.group("g1", "Auditors", 7))), 40);

        assertInstanceOf(BlastRadius.Unresolved.class, new CachingBlastRadiusResolver().resolve(group("auditors"), snapshot));
    }

    @Test
    void shouldCountTenancyPrincipalsForAnyUserAndAnyGroup() {
        DirectorySnapshot snapshot = snapshot(InMemoryGroupDirectory.empty(), 128);
        CachingBlastRadiusResolver resolver = new CachingBlastRadiusResolver();

        BlastRadius.Counted anyUser = assertInstanceOf(BlastRadius.Counted.class,
            resolver.resolve(new Grant(Verb.MANAGE, "all-resources", SubjectType.ANY_USER, "", false, Scope.tenancy(), null), snapshot));
        BlastRadius.Counted anyGroup = assertInstanceOf(BlastRadius.Counted.class,
            resolver.resolve(new Grant(Verb.USE, "instances", SubjectType.ANY_GROUP, "", false, Scope.tenancy(), null), snapshot));

        assertEquals(128, anyUser.principals());
        assertEquals(BlastRadius.Source.TENANCY_PRINCIPALS, anyUser.source());
        assertNull(anyUser.groupId());
        assertEquals(128, anyGroup.principals());
        assertEquals(0, resolver.directoryLookups());
    }

    @Test
    void shouldResolveByIdAndDynamicGroups() {
        DirectorySnapshot snapshot = snapshot(new InMemoryGroupDirectory(List.of(
            Group.group("ocid1.group.oc1..ops", "Ops", 3),
            Group.dynamicGroup("ocid1.dynamicgroup.oc1..fn", "fn-runtime")
        )), 10);
        CachingBlastRadiusResolver resolver = new CachingBlastRadiusResolver();

        Grant byId = new Grant(Verb.USE, "instances", SubjectType.GROUP, "ocid1.group.oc1..ops", true, Scope.tenancy(), null);
        Grant dynamic = new Grant(Verb.READ, "buckets", SubjectType.DYNAMIC_GROUP, "fn-runtime", false, Scope.tenancy(), null);

        assertEquals(3, BlastRadius.countOrNull(resolver.resolve(byId, snapshot)));
        BlastRadius.Unresolved noCount = assertInstanceOf(BlastRadius.Unresolved.class, resolver.resolve(dynamic, snapshot));
        assertEquals(CachingBlastRadiusResolver.REASON_NO_COUNT, noCount.reason());
    }

    @Test
    void shouldNotApplyToServices() {
        DirectorySnapshot snapshot = snapshot(InMemoryGroupDirectory.empty(), 10);
        Grant service = new Grant(Verb.MANAGE, "object-family", SubjectType.SERVICE, "objectstorage", false, Scope.tenancy(), null);

        assertInstanceOf(BlastRadius.NotApplicable.class, new CachingBlastRadiusResolver().resolve(service, snapshot));
    }

    private static Grant group(String name) {
        return new Grant(Verb.INSPECT, "buckets", SubjectType.GROUP, name, false, Scope.compartment("finance"), null);
    }

    private static DirectorySnapshot snapshot(GroupDirectory groups, int activePrincipals) {
        return new DirectorySnapshot("ocid1.tenancy.oc1..t", "us-ashburn-1", null, List.of(), List.of(), List.of(),
            groups, List.of(), activePrincipals);
    }

    private static final class CountingDirectory implements GroupDirectory {
        private final GroupDirectory delegate;
        private int lookups;

        private CountingDirectory(GroupDirectory delegate) {
            this.delegate = delegate;
        }

        @Override
        public Group findByName(GroupKind kind, String name) throws GroupNotFoundException {
            lookups++;
            return delegate.findByName(kind, name);
        }

        @Override
        public Group findById(GroupKind kind, String id) throws GroupNotFoundException {
            lookups++;
            return delegate.findById(kind, id);
        }

        @Override
        public List<Group> list(GroupKind kind) {
            return delegate.list(kind);
        }
    }
}
