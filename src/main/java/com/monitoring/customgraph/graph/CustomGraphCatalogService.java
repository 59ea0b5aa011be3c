package com.monitoring.customgraph.graph;

import com.monitoring.customgraph.access.AccessModels.GroupMembership;
import com.monitoring.customgraph.access.UserGroupResolver;
import com.monitoring.customgraph.config.CustomGraphProperties;
import com.monitoring.customgraph.domain.DomainModels.GraphDefinition;
import com.monitoring.customgraph.graph.CustomGraphModels.VisibleGraphEntry;
import com.monitoring.customgraph.repository.CustomGraphJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;

@Service
public class CustomGraphCatalogService {
    private static final Logger log = LoggerFactory.getLogger(CustomGraphCatalogService.class);

    private final CustomGraphJdbcRepository repository;
    private final UserGroupResolver groupResolver;
    private final CustomGraphProperties properties;

    public CustomGraphCatalogService(CustomGraphJdbcRepository repository,
                                     UserGroupResolver groupResolver,
                                     CustomGraphProperties properties) {
        this.repository = repository;
        this.groupResolver = groupResolver;
        this.properties = properties;
    }

    public Map<Integer, VisibleGraphEntry> listVisibleGraphs(String userId,
                                                             boolean namesOnly,
                                                             boolean includeAllGroup,
                                                             String requiredPrivileges) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId is required");
        }
        String privileges = requiredPrivileges == null || requiredPrivileges.isBlank()
                ? properties.defaultPrivileges()
                : requiredPrivileges;

        Map<Integer, GroupMembership> groups = groupResolver.resolveAccessibleGroups(userId, privileges, includeAllGroup);

        Optional<List<GraphDefinition>> catalog = repository.findAllGraphsOrderedByName();
        if (catalog.isEmpty()) return new LinkedHashMap<>();

        List<GraphDefinition> visible = catalog.get().stream()
                .filter(g -> isVisible(g, userId, groups))
                .toList();
        log.debug("User {} sees {} of {} custom graphs", userId, visible.size(), catalog.get().size());

        Map<Integer, VisibleGraphEntry> result = new LinkedHashMap<>();
        if (namesOnly) {
            visible.forEach(g -> result.put(g.id(), VisibleGraphEntry.nameOnly(g)));
            return result;
        }

        if (properties.batchSourceCounts()) {
            Map<Integer, Integer> counts = repository.countSourcesByGraph(visible.stream().map(GraphDefinition::id).toList());
            visible.forEach(g -> result.put(g.id(), VisibleGraphEntry.annotated(g, counts.getOrDefault(g.id(), 0))));
        } else {
            visible.forEach(g -> result.put(g.id(), VisibleGraphEntry.annotated(g, repository.countSources(g.id()))));
        }
        return result;
    }

    public Map<Integer, String> visibleGraphNames(String userId, boolean includeAllGroup, String requiredPrivileges) {
        Map<Integer, String> names = new LinkedHashMap<>();
        listVisibleGraphs(userId, true, includeAllGroup, requiredPrivileges)
                .forEach((id, entry) -> names.put(id, entry.name()));
        return names;
    }

    /**
     * Group membership is checked before ownership: the owner of a private graph in a group
     * they cannot access does not see it.
     */
    static boolean isVisible(GraphDefinition graph, String userId, Map<Integer, GroupMembership> groups) {
        if (!groups.containsKey(graph.groupId())) return false;

        if (graph.isPrivate() && !userId.equals(graph.ownerUserId())) return false;

        return graph.groupId() <= 0 || groups.containsKey(graph.groupId());
    }
}
