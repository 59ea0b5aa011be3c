package com.monitoring.customgraph;

import com.monitoring.customgraph.access.Privilege;
import com.monitoring.customgraph.graph.CustomGraphCatalogService;
import com.monitoring.customgraph.graph.CustomGraphModels.VisibleGraphEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class CustomGraphCatalogServiceTest {
    @Autowired
    private CustomGraphCatalogService catalogService;
    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void seed() {
        CatalogFixtures fixtures = new CatalogFixtures(jdbcTemplate);
        fixtures.reset();
        fixtures.user("alice", false)
                .user("bob", false)
                .user("carol", false)
                .group(5, "Servers")
                .group(7, "Network")
                .profile(1, Privilege.IR, Privilege.AR)
                .profile(2, Privilege.AW)
                .grant("alice", 1, 7)
                .grant("bob", 1, 5)
                .grant("bob", 1, 7)
                .grant("carol", 2, 5)
                .graph(1, "Network load", "bob", 7, false)
                .graph(2, "Bob private", "bob", 7, true)
                .graph(3, "Alice private", "alice", 7, true)
                .graph(4, "Everywhere", "bob", 0, false)
                .graph(5, "Servers only", "bob", 5, false)
                .graph(6, "Alice hidden private", "alice", 5, true)
                .source(1, 1, 100, 1.0)
                .source(2, 1, 101, 0.5)
                .source(3, 1, 102, 3.0)
                .source(4, 4, 100, 1.0);
    }

    @Test
    void hidesPrivateGraphsOfOtherOwners() {
        Map<Integer, VisibleGraphEntry> visible = catalogService.listVisibleGraphs("alice", false, true, "IR");

        assertFalse(visible.containsKey(2));
        assertTrue(visible.containsKey(3));
        assertTrue(visible.containsKey(1));
    }

    @Test
    void ownerWithoutGroupAccessDoesNotSeeOwnPrivateGraph() {
        Map<Integer, VisibleGraphEntry> visible = catalogService.listVisibleGraphs("alice", false, true, "IR");

        assertFalse(visible.containsKey(6));
        assertFalse(visible.containsKey(5));
    }

    @Test
    void allGroupGraphsFollowIncludeAllGroupFlag() {
        Map<Integer, VisibleGraphEntry> without = catalogService.listVisibleGraphs("alice", false, false, "IR");
        Map<Integer, VisibleGraphEntry> with = catalogService.listVisibleGraphs("alice", false, true, "IR");

        assertFalse(without.containsKey(4));
        assertTrue(with.containsKey(4));
        assertTrue(with.keySet().containsAll(without.keySet()));
    }

    @Test
    void positiveGroupGraphVisibleOnlyWhenGroupAccessible() {
        assertTrue(catalogService.listVisibleGraphs("bob", false, true, "IR").containsKey(5));
        assertFalse(catalogService.listVisibleGraphs("alice", false, true, "IR").containsKey(5));
    }

    @Test
    void privilegesDecideWhichGroupsCount() {
        assertTrue(catalogService.listVisibleGraphs("carol", false, true, "IR").isEmpty());
        assertEquals(List.of(4, 5), List.copyOf(catalogService.listVisibleGraphs("carol", false, true, "AW").keySet()));
    }

    @Test
    void namesOnlyListsTheSameGraphsInNameOrder() {
        Map<Integer, VisibleGraphEntry> full = catalogService.listVisibleGraphs("bob", false, true, "IR");
        Map<Integer, VisibleGraphEntry> names = catalogService.listVisibleGraphs("bob", true, true, "IR");

        assertEquals(List.copyOf(full.keySet()), List.copyOf(names.keySet()));
        assertEquals(List.of(2, 4, 1, 5), List.copyOf(names.keySet()));
        assertEquals("Bob private", names.get(2).name());
        assertNull(names.get(2).definition());
        assertNull(names.get(2).sourceCount());
        assertEquals(Map.of(2, "Bob private", 4, "Everywhere", 1, "Network load", 5, "Servers only"),
                catalogService.visibleGraphNames("bob", true, "IR"));
    }

    @Test
    void countsSourcesOfEachVisibleGraph() {
        Map<Integer, VisibleGraphEntry> visible = catalogService.listVisibleGraphs("bob", false, true, "IR");

        assertEquals(3, visible.get(1).sourceCount());
        assertEquals(1, visible.get(4).sourceCount());
        assertEquals(0, visible.get(5).sourceCount());
        assertEquals("bob", visible.get(1).definition().ownerUserId());
        assertEquals(7, visible.get(1).definition().groupId());
    }

    @Test
    void blankPrivilegesUseConfiguredDefault() {
        assertEquals(catalogService.listVisibleGraphs("bob", false, true, "IR").keySet(),
                catalogService.listVisibleGraphs("bob", false, true, null).keySet());
    }

    @Test
    void unknownUserSeesNothing() {
        assertTrue(catalogService.listVisibleGraphs("mallory", false, true, "IR").isEmpty());
    }

    @Test
    void rejectsMissingUserAndMalformedPrivileges() {
        assertThrows(IllegalArgumentException.class, () -> catalogService.listVisibleGraphs(" ", false, true, "IR"));
        assertThrows(IllegalArgumentException.class, () -> catalogService.listVisibleGraphs("bob", false, true, "XX"));
    }
}
