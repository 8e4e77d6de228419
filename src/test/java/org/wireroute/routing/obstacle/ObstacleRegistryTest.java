package org.wireroute.routing.obstacle;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.wireroute.routing.geometry.Rectangle;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Obstacle Registry Tests")
class ObstacleRegistryTest {

    private ObstacleRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new ObstacleRegistry();
    }

    private static RoutingObstacle obstacle(String id, double x, double y) {
        return RoutingObstacle.builder().id(id).bounds(Rectangle.of(x, y, 10, 10)).build();
    }

    @Test
    @DisplayName("Snapshot keeps insertion order and default type")
    void testSnapshotOrder() {
        registry.add(obstacle("b", 0, 0));
        registry.add(obstacle("a", 20, 0));

        List<RoutingObstacle> snapshot = registry.snapshot();
        assertEquals(List.of("b", "a"), snapshot.stream().map(RoutingObstacle::getId).toList());
        assertEquals(ObstacleType.COMPONENT, snapshot.get(0).getType());
        assertThrows(UnsupportedOperationException.class, () -> snapshot.add(obstacle("c", 0, 0)));
    }

    @Test
    @DisplayName("Adding an existing id replaces the entry")
    void testAddReplaces() {
        registry.add(obstacle("u1", 0, 0));
        registry.add(obstacle("u1", 50, 50));

        assertEquals(1, registry.size());
        assertEquals(Rectangle.of(50, 50, 10, 10), registry.get("u1").getBounds());
    }

    @Test
    @DisplayName("Partial update keeps untouched fields")
    void testPartialUpdate() {
        registry.add(RoutingObstacle.builder()
                .id("k")
                .bounds(Rectangle.of(0, 0, 10, 10))
                .type(ObstacleType.KEEPOUT)
                .priority(3)
                .build());

        assertTrue(registry.update("k", ObstacleUpdate.bounds(Rectangle.of(5, 5, 20, 20))));

        RoutingObstacle updated = registry.get("k");
        assertEquals(Rectangle.of(5, 5, 20, 20), updated.getBounds());
        assertEquals(ObstacleType.KEEPOUT, updated.getType());
        assertEquals(3, updated.getPriority());
    }

    @Test
    @DisplayName("Generation moves only on effective mutations")
    void testGenerationTracking() {
        assertEquals(0L, registry.generation());

        registry.add(obstacle("a", 0, 0));
        assertEquals(1L, registry.generation());

        assertFalse(registry.update("missing", ObstacleUpdate.bounds(Rectangle.of(0, 0, 1, 1))));
        assertFalse(registry.remove("missing"));
        assertEquals(1L, registry.generation(), "no-op calls must not invalidate derived state");

        assertTrue(registry.update("a", ObstacleUpdate.builder().priority(9).build()));
        assertEquals(2L, registry.generation());

        assertTrue(registry.remove("a"));
        assertEquals(3L, registry.generation());

        registry.clear();
        assertEquals(3L, registry.generation(), "clearing an empty registry is a no-op");

        registry.add(obstacle("b", 0, 0));
        registry.clear();
        assertEquals(5L, registry.generation());
        assertTrue(registry.isEmpty());
    }

    @Test
    @DisplayName("Null obstacle parts are rejected")
    void testRejectsNulls() {
        assertThrows(NullPointerException.class, () -> registry.add(null));
        assertThrows(NullPointerException.class,
                () -> registry.add(RoutingObstacle.builder().bounds(Rectangle.of(0, 0, 1, 1)).build()));
        assertThrows(NullPointerException.class,
                () -> registry.add(RoutingObstacle.builder().id("x").build()));
        assertEquals(0L, registry.generation());
    }
}
