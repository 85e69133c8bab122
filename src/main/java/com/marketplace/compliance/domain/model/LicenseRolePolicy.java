package com.marketplace.compliance.domain.model;

import lombok.Getter;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Store roles allowed to act on licenses, per operation.
 */
@Getter
public class LicenseRolePolicy {

    private final Set<MemberRole> createRoles;
    private final Set<MemberRole> deleteRoles;

    public LicenseRolePolicy(Collection<MemberRole> createRoles, Collection<MemberRole> deleteRoles) {
        if (createRoles == null || createRoles.isEmpty()) {
            throw new IllegalArgumentException("create roles must not be empty");
        }
        if (deleteRoles == null || deleteRoles.isEmpty()) {
            throw new IllegalArgumentException("delete roles must not be empty");
        }
        this.createRoles = Collections.unmodifiableSet(EnumSet.copyOf(createRoles));
        this.deleteRoles = Collections.unmodifiableSet(EnumSet.copyOf(deleteRoles));
    }

    public static LicenseRolePolicy defaults() {
        return new LicenseRolePolicy(
                EnumSet.of(MemberRole.OWNER, MemberRole.ADMIN, MemberRole.MANAGER, MemberRole.STAFF, MemberRole.OPS),
                EnumSet.of(MemberRole.OWNER, MemberRole.MANAGER));
    }
}
