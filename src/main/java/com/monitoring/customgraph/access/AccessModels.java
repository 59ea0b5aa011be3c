package com.monitoring.customgraph.access;

import java.util.Set;

public class AccessModels {
    public static final int ALL_GROUP_ID = 0;
    public static final String ALL_GROUP_NAME = "All";

    public record GroupMembership(int groupId, String name) {}

    public record UserAccount(String userId, boolean admin) {}

    public record ProfileGrant(int groupId, Set<Privilege> privileges) {}

    private AccessModels() {}
}
