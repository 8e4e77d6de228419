package org.wireroute.routing.synthesis;

import org.wireroute.routing.geometry.WireSegment;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Collapses runs of same-orientation segments into single segments.
 *
 * <p>Merged segments keep the first start and the last end. Their length is recomputed from
 * those endpoints, which equals the sum of the run for straight runs and also removes
 * back-tracking (for example a lead-in stub followed by a step the other way). Segments that
 * end up zero-length are dropped and the run continues against the previous kept segment, so
 * the output never holds two adjacent segments of the same orientation and a second pass
 * returns the list unchanged.</p>
 */
public final class SegmentOptimizer {

    /**
     * Merges collinear runs and drops zero-length segments.
     *
     * @param segments route in path order.
     * @return optimized immutable list.
     */
    public List<WireSegment> optimize(List<WireSegment> segments) {
        Objects.requireNonNull(segments, "segments");
        List<WireSegment> merged = new ArrayList<>(segments.size());
        for (WireSegment next : segments) {
            if (next.isZeroLength()) {
                continue;
            }
            int last = merged.size() - 1;
            if (last >= 0 && merged.get(last).getOrientation() == next.getOrientation()) {
                WireSegment combined = WireSegment.between(merged.get(last).getStart(), next.getEnd());
                if (combined.isZeroLength()) {
                    merged.remove(last);
                } else {
                    merged.set(last, combined);
                }
                continue;
            }
            merged.add(next);
        }
        return List.copyOf(merged);
    }
}
