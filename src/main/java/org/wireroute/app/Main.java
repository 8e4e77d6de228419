package org.wireroute.app;

import org.wireroute.routing.core.RoutingResult;
import org.wireroute.routing.core.WireRoutingEngine;
import org.wireroute.routing.geometry.Point;
import org.wireroute.routing.geometry.Rectangle;
import org.wireroute.routing.geometry.WireSegment;
import org.wireroute.routing.obstacle.RoutingObstacle;

import java.util.Locale;

/**
 * Minimal application entry point used for local smoke runs.
 *
 * <p>Routes one wire around a single component and prints the segments.</p>
 */
public class Main {
    /**
     * Launches the sample routing scene.
     *
     * @param args command-line arguments (ignored).
     */
    public static void main(String[] args) {
        WireRoutingEngine engine = new WireRoutingEngine();
        engine.addObstacle(RoutingObstacle.builder()
                .id("U1")
                .bounds(Rectangle.of(40, -30, 20, 60))
                .build());

        RoutingResult result = engine.routeWire(Point.of(0, 0), Point.of(100, 0));
        System.out.printf(Locale.ROOT, "source=%s segments=%d length=%.1f bends=%d quality=%.2f%n",
                result.getSource(),
                result.getSegments().size(),
                result.getTotalLength(),
                result.getBendCount(),
                result.getQuality());
        for (WireSegment segment : result.getSegments()) {
            System.out.printf(Locale.ROOT, "  %s (%.1f, %.1f) -> (%.1f, %.1f)%n",
                    segment.getOrientation(),
                    segment.getStart().getX(), segment.getStart().getY(),
                    segment.getEnd().getX(), segment.getEnd().getY());
        }
    }
}
