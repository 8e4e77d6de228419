package org.wireroute.routing.core;

import lombok.Builder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.wireroute.routing.evaluation.CollisionInspector;
import org.wireroute.routing.evaluation.RouteEvaluator;
import org.wireroute.routing.evaluation.RouteMetrics;
import org.wireroute.routing.geometry.Point;
import org.wireroute.routing.geometry.Rectangle;
import org.wireroute.routing.geometry.WireSegment;
import org.wireroute.routing.grid.GridRegion;
import org.wireroute.routing.grid.GridSettings;
import org.wireroute.routing.grid.OccupancyGrid;
import org.wireroute.routing.grid.OccupancyGridBuilder;
import org.wireroute.routing.heuristic.HeuristicType;
import org.wireroute.routing.obstacle.ObstacleRegistry;
import org.wireroute.routing.obstacle.ObstacleUpdate;
import org.wireroute.routing.obstacle.RoutingObstacle;
import org.wireroute.routing.search.GridPath;
import org.wireroute.routing.search.GridPathfinder;
import org.wireroute.routing.search.SearchBudget;
import org.wireroute.routing.synthesis.SegmentOptimizer;
import org.wireroute.routing.synthesis.SegmentSynthesizer;

import java.util.ArrayList;
import java.util.List;

/**
 * Main wire routing entry point.
 *
 * <p>The engine owns its obstacle registry, its constraints and a transient occupancy grid.
 * Execution flow for one wire:</p>
 * <ul>
 * <li>Validate endpoints and normalize options.</li>
 * <li>If avoidance is requested and obstacles exist, reuse or rebuild the grid for the query
 * window, run A* and synthesize segments from the cell path.</li>
 * <li>If no search runs, or it finds nothing, use the direct L-route.</li>
 * <li>Optionally merge collinear segments, then evaluate length, bends and quality.</li>
 * </ul>
 * <p>The grid is reused only while the obstacle generation and avoidance margin are unchanged
 * and its window covers the new query; otherwise it is rebuilt.</p>
 * <p><strong>Thread Safety:</strong> none. One engine serves one UI thread.</p>
 */
public final class WireRoutingEngine implements WireRouter {
    private static final Logger log = LoggerFactory.getLogger(WireRoutingEngine.class);

    public static final String REASON_START_REQUIRED = "ROUTE_START_REQUIRED";
    public static final String REASON_END_REQUIRED = "ROUTE_END_REQUIRED";
    public static final String REASON_NON_FINITE_POINT = "ROUTE_NON_FINITE_POINT";
    public static final String REASON_REQUESTS_REQUIRED = "ROUTE_REQUESTS_REQUIRED";
    public static final String REASON_REQUEST_REQUIRED = "ROUTE_REQUEST_REQUIRED";
    public static final String REASON_OBSTACLE_REQUIRED = "OBSTACLE_REQUIRED";
    public static final String REASON_OBSTACLE_ID_REQUIRED = "OBSTACLE_ID_REQUIRED";
    public static final String REASON_OBSTACLE_BOUNDS_INVALID = "OBSTACLE_BOUNDS_INVALID";
    public static final String REASON_OBSTACLE_UPDATE_REQUIRED = "OBSTACLE_UPDATE_REQUIRED";
    public static final String REASON_CONSTRAINTS_REQUIRED = "CONSTRAINTS_REQUIRED";
    public static final String REASON_CONSTRAINTS_INVALID = "CONSTRAINTS_INVALID";

    private final ObstacleRegistry registry = new ObstacleRegistry();
    private final GridSettings gridSettings;
    private final SearchBudget searchBudget;
    private final GridPathfinder pathfinder;
    private final OccupancyGridBuilder gridBuilder = new OccupancyGridBuilder();
    private final SegmentSynthesizer synthesizer = new SegmentSynthesizer();
    private final SegmentOptimizer optimizer = new SegmentOptimizer();
    private final RouteEvaluator evaluator = new RouteEvaluator();
    private final CollisionInspector collisionInspector = new CollisionInspector();

    private RoutingConstraints constraints;
    private OccupancyGrid cachedGrid;
    private int gridBuilds;

    /**
     * Creates an engine with explicit collaborators. Every argument is optional.
     *
     * @param constraints initial constraints; defaults when null.
     * @param gridSettings raster parameters; system-property defaults when null.
     * @param searchBudget expansion bound; system-property defaults when null.
     * @param heuristicType A* heuristic; {@link HeuristicType#MANHATTAN} when null.
     */
    @Builder
    public WireRoutingEngine(
            RoutingConstraints constraints,
            GridSettings gridSettings,
            SearchBudget searchBudget,
            HeuristicType heuristicType
    ) {
        this.constraints = validateConstraints(constraints == null ? RoutingConstraints.defaults() : constraints);
        this.gridSettings = gridSettings == null ? GridSettings.defaults() : gridSettings;
        this.searchBudget = searchBudget == null ? SearchBudget.defaults() : searchBudget;
        this.pathfinder = new GridPathfinder(
                heuristicType == null ? HeuristicType.MANHATTAN : heuristicType,
                this.searchBudget
        );
    }

    /**
     * Creates an engine with default constraints and settings.
     */
    public WireRoutingEngine() {
        this(null, null, null, null);
    }

    // --- Obstacle lifecycle ---

    /**
     * Registers an obstacle, replacing any obstacle with the same id.
     *
     * @throws WireRoutingException when the obstacle, its id or its bounds are invalid.
     */
    public void addObstacle(RoutingObstacle obstacle) {
        if (obstacle == null) {
            throw new WireRoutingException(REASON_OBSTACLE_REQUIRED, "obstacle must be provided");
        }
        if (obstacle.getId() == null || obstacle.getId().isBlank()) {
            throw new WireRoutingException(REASON_OBSTACLE_ID_REQUIRED, "obstacle id must be non-blank");
        }
        requireWellFormed(obstacle.getId(), obstacle.getBounds());
        registry.add(obstacle);
    }

    /**
     * Applies a partial update. Unknown ids are ignored.
     *
     * @throws WireRoutingException when the update is missing or carries invalid bounds.
     */
    public void updateObstacle(String id, ObstacleUpdate update) {
        if (update == null) {
            throw new WireRoutingException(REASON_OBSTACLE_UPDATE_REQUIRED, "obstacle update must be provided");
        }
        if (update.getBounds() != null) {
            requireWellFormed(id, update.getBounds());
        }
        registry.update(id, update);
    }

    /**
     * Removes an obstacle. Unknown ids are ignored.
     */
    public void removeObstacle(String id) {
        registry.remove(id);
    }

    public void clearObstacles() {
        registry.clear();
    }

    /**
     * Returns the obstacle registered under {@code id}, or null.
     */
    public RoutingObstacle obstacle(String id) {
        return registry.get(id);
    }

    /**
     * Returns an immutable snapshot of the registered obstacles in insertion order.
     */
    public List<RoutingObstacle> obstacles() {
        return registry.snapshot();
    }

    // --- Constraints ---

    /**
     * Merges a partial constraints change and drops the cached grid.
     *
     * @throws WireRoutingException when the update is missing or yields invalid constraints.
     */
    public void setConstraints(ConstraintsUpdate update) {
        if (update == null) {
            throw new WireRoutingException(REASON_CONSTRAINTS_REQUIRED, "constraints update must be provided");
        }
        this.constraints = validateConstraints(update.applyTo(constraints));
        invalidateGrid();
    }

    public RoutingConstraints getConstraints() {
        return constraints;
    }

    // --- Routing ---

    @Override
    public RoutingResult routeWire(Point start, Point end, RouteOptions options) {
        requirePoint(start, REASON_START_REQUIRED, "start");
        requirePoint(end, REASON_END_REQUIRED, "end");
        RouteOptions effective = options == null ? RouteOptions.defaults() : options;
        if (effective.getRoutingStyle() == RoutingStyle.DIAGONAL) {
            log.debug("Diagonal style requested; routing orthogonally");
        }

        List<WireSegment> segments;
        RouteSource source;
        int expandedCells = 0;

        if (start.equals(end)) {
            segments = List.of();
            source = RouteSource.DIRECT;
        } else if (effective.isAvoidObstacles() && !registry.isEmpty()) {
            GridPath path = searchGrid(start, end);
            expandedCells = path.expandedCells();
            if (path.found() && !path.isDegenerate()) {
                segments = synthesizer.fromGridPath(start, end, path.waypoints());
                source = RouteSource.GRID_SEARCH;
            } else {
                segments = synthesizer.direct(start, end);
                source = RouteSource.FALLBACK_DIRECT;
            }
        } else {
            segments = synthesizer.direct(start, end);
            source = RouteSource.DIRECT;
        }

        if (effective.isOptimize()) {
            segments = optimizer.optimize(segments);
        }
        return toResult(segments, start, end, source, expandedCells);
    }

    @Override
    public List<RoutingResult> routeWires(List<WireRequest> requests) {
        if (requests == null) {
            throw new WireRoutingException(REASON_REQUESTS_REQUIRED, "requests must be provided");
        }
        List<RoutingResult> results = new ArrayList<>(requests.size());
        for (int i = 0; i < requests.size(); i++) {
            WireRequest request = requests.get(i);
            if (request == null) {
                throw new WireRoutingException(REASON_REQUEST_REQUIRED, "requests[" + i + "] must be non-null");
            }
            RoutingResult result = routeWire(request.getStart(), request.getEnd(), request.getOptions());
            log.debug("Routed wire {}: {} segments, source {}", request.getId(), result.getSegments().size(), result.getSource());
            results.add(result);
        }
        return List.copyOf(results);
    }

    /**
     * Number of grid builds since construction. Exposed for cache-policy tests.
     */
    int gridBuildCount() {
        return gridBuilds;
    }

    /**
     * Runs A* on a valid grid. An oversized window or budget exhaustion is reported as not found.
     */
    private GridPath searchGrid(Point start, Point end) {
        long cells = GridRegion.cellCountAround(start, end, gridSettings);
        if (!searchBudget.allowsGridCells(cells)) {
            log.warn("Grid search skipped ({}): {} cells > {}; using direct route",
                    SearchBudget.REASON_GRID_TOO_LARGE, cells, searchBudget.maxGridCells());
            return GridPath.notFound(0);
        }
        OccupancyGrid grid = ensureGrid(GridRegion.around(start, end, gridSettings));
        try {
            return pathfinder.find(grid, start, end);
        } catch (SearchBudget.BudgetExceededException ex) {
            log.warn("Grid search stopped ({}): {}; using direct route", ex.reasonCode(), ex.getMessage());
            return GridPath.notFound(ex.expandedCells());
        }
    }

    /**
     * Returns the cached grid when it still answers this query, otherwise rebuilds it.
     */
    private OccupancyGrid ensureGrid(GridRegion queryRegion) {
        double margin = constraints.getAvoidanceMargin();
        if (cachedGrid != null && cachedGrid.isValidFor(queryRegion, registry.generation(), margin)) {
            log.debug("Reusing occupancy grid at generation {}", cachedGrid.obstacleGeneration());
            return cachedGrid;
        }
        cachedGrid = gridBuilder.build(queryRegion, registry.snapshot(), margin, registry.generation());
        gridBuilds++;
        return cachedGrid;
    }

    private void invalidateGrid() {
        cachedGrid = null;
    }

    private RoutingResult toResult(
            List<WireSegment> segments,
            Point start,
            Point end,
            RouteSource source,
            int expandedCells
    ) {
        RouteMetrics metrics = evaluator.evaluate(segments, start, end);
        List<RoutingObstacle> obstacles = registry.snapshot();
        return RoutingResult.builder()
                .segments(segments)
                .totalLength(metrics.totalLength())
                .bendCount(metrics.bendCount())
                .quality(metrics.quality())
                .obstacles(obstacles)
                .source(source)
                .expandedCells(expandedCells)
                .collidingObstacleIds(collisionInspector.collidingObstacleIds(segments, obstacles))
                .build();
    }

    private static void requirePoint(Point point, String requiredReasonCode, String fieldName) {
        if (point == null) {
            throw new WireRoutingException(requiredReasonCode, fieldName + " must be provided");
        }
        if (!point.isFinite()) {
            throw new WireRoutingException(REASON_NON_FINITE_POINT, fieldName + " must be finite, got " + point);
        }
    }

    private static void requireWellFormed(String id, Rectangle bounds) {
        if (bounds == null || !bounds.isWellFormed()) {
            throw new WireRoutingException(
                    REASON_OBSTACLE_BOUNDS_INVALID,
                    "obstacle " + id + " needs finite bounds with non-negative size, got " + bounds
            );
        }
    }

    private static RoutingConstraints validateConstraints(RoutingConstraints candidate) {
        double margin = candidate.getAvoidanceMargin();
        if (!Double.isFinite(margin) || margin < 0.0d) {
            throw new WireRoutingException(
                    REASON_CONSTRAINTS_INVALID,
                    "avoidanceMargin must be finite and >= 0, got " + margin
            );
        }
        return candidate;
    }
}
