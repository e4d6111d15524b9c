package com.example.inventoryjobs.store;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Membership lookups used to pick notification recipients.
 */
public interface WorkspaceMemberStore {

    String ROLE_OWNER = "owner";
    String ROLE_ADMIN = "admin";

    List<UUID> findUserIdsByRoles(UUID workspaceId, Collection<String> roles);
}
