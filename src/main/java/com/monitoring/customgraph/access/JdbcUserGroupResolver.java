package com.monitoring.customgraph.access;

import com.monitoring.customgraph.access.AccessModels.GroupMembership;
import com.monitoring.customgraph.access.AccessModels.ProfileGrant;
import com.monitoring.customgraph.access.AccessModels.UserAccount;
import com.monitoring.customgraph.repository.AccessJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;

@Service
public class JdbcUserGroupResolver implements UserGroupResolver {
    private static final Logger log = LoggerFactory.getLogger(JdbcUserGroupResolver.class);

    private final AccessJdbcRepository repository;

    public JdbcUserGroupResolver(AccessJdbcRepository repository) {
        this.repository = repository;
    }

    @Override
    public Map<Integer, GroupMembership> resolveAccessibleGroups(String userId, String requiredPrivileges, boolean includeAllGroup) {
        Set<Privilege> required = Privilege.parse(requiredPrivileges);

        Optional<UserAccount> user = repository.findUser(userId);
        if (user.isEmpty()) {
            log.debug("Unknown user {}, no accessible groups", userId);
            return new TreeMap<>();
        }

        Map<Integer, GroupMembership> allGroups = new TreeMap<>();
        repository.loadGroups().stream()
                .filter(g -> g.groupId() != AccessModels.ALL_GROUP_ID)
                .forEach(g -> allGroups.put(g.groupId(), g));

        Map<Integer, GroupMembership> groups = new TreeMap<>();
        if (user.get().admin()) {
            groups.putAll(allGroups);
        } else {
            for (ProfileGrant grant : repository.loadProfileGrants(userId)) {
                if (!grant.privileges().containsAll(required)) continue;

                if (grant.groupId() == AccessModels.ALL_GROUP_ID) {
                    groups.putAll(allGroups);
                } else {
                    groups.put(grant.groupId(), allGroups.getOrDefault(grant.groupId(),
                            new GroupMembership(grant.groupId(), "group #" + grant.groupId())));
                }
            }
        }

        groups.remove(AccessModels.ALL_GROUP_ID);
        if (includeAllGroup && !groups.isEmpty()) {
            groups.put(AccessModels.ALL_GROUP_ID, new GroupMembership(AccessModels.ALL_GROUP_ID, AccessModels.ALL_GROUP_NAME));
        }

        log.debug("User {} has {} accessible groups for {}", userId, groups.size(), required);
        return groups;
    }
}
