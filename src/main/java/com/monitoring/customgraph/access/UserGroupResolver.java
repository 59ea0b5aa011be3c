package com.monitoring.customgraph.access;

import com.monitoring.customgraph.access.AccessModels.GroupMembership;

import java.util.Map;

public interface UserGroupResolver {
    Map<Integer, GroupMembership> resolveAccessibleGroups(String userId, String requiredPrivileges, boolean includeAllGroup);
}
