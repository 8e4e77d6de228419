package org.wireroute.routing.obstacle;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Mutable obstacle store owned by one routing engine.
 * <p>
 * Entries are immutable and keyed by id. Every effective mutation increments
 * {@link #generation()}, which derived state (the occupancy grid) compares against
 * to detect staleness. Calls that change nothing, such as removing an unknown id,
 * leave the generation untouched.
 * </p>
 * <p><strong>Thread Safety:</strong> none. The registry must not be mutated while a
 * route is being computed on another thread.</p>
 */
public final class ObstacleRegistry {
    private static final Logger log = LoggerFactory.getLogger(ObstacleRegistry.class);

    private final Map<String, RoutingObstacle> entries = new LinkedHashMap<>();

    @Getter
    @Accessors(fluent = true)
    private long generation;

    /**
     * Adds an obstacle, replacing any entry with the same id.
     *
     * @param obstacle obstacle with non-null id and bounds.
     */
    public void add(RoutingObstacle obstacle) {
        Objects.requireNonNull(obstacle, "obstacle");
        Objects.requireNonNull(obstacle.getId(), "obstacle.id");
        Objects.requireNonNull(obstacle.getBounds(), "obstacle.bounds");
        RoutingObstacle previous = entries.put(obstacle.getId(), obstacle);
        if (previous != null) {
            log.debug("Replaced obstacle {}", obstacle.getId());
        }
        generation++;
    }

    /**
     * Merges a partial update into an existing obstacle.
     *
     * @param id obstacle id.
     * @param update partial change.
     * @return {@code true} if the obstacle existed and was updated.
     */
    public boolean update(String id, ObstacleUpdate update) {
        Objects.requireNonNull(update, "update");
        RoutingObstacle existing = entries.get(id);
        if (existing == null) {
            log.debug("Ignoring update for unknown obstacle {}", id);
            return false;
        }
        entries.put(id, update.applyTo(existing));
        generation++;
        return true;
    }

    /**
     * Removes an obstacle by id.
     *
     * @return {@code true} if an entry was removed.
     */
    public boolean remove(String id) {
        if (entries.remove(id) == null) {
            return false;
        }
        generation++;
        return true;
    }

    /**
     * Removes all obstacles.
     */
    public void clear() {
        if (entries.isEmpty()) {
            return;
        }
        entries.clear();
        generation++;
    }

    /**
     * Looks up one obstacle.
     *
     * @return the obstacle or {@code null} when unknown.
     */
    public RoutingObstacle get(String id) {
        return entries.get(id);
    }

    /**
     * Returns an immutable snapshot in insertion order.
     */
    public List<RoutingObstacle> snapshot() {
        return List.copyOf(entries.values());
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }
}
