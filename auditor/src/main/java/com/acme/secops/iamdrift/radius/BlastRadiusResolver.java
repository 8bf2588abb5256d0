package com.acme.secops.iamdrift.radius;

import com.acme.secops.iamdrift.directory.DirectorySnapshot;
import com.acme.secops.iamdrift.policy.Grant;

/**
 * Maps a grant's subject to the number of principals it covers.
 *
 * <p>Unknown groups are not an error: they resolve to {@link BlastRadius.Unresolved}.
 */
public interface BlastRadiusResolver {
    BlastRadius resolve(Grant grant, DirectorySnapshot snapshot);
}
