package org.wireroute.routing.heuristic;

import lombok.experimental.UtilityClass;
import org.wireroute.routing.grid.GridRegion;

/**
 * Strict heuristic factory.
 *
 * <p>Centralizes validation so every provider is created against the grid region the
 * search will run on.</p>
 */
@UtilityClass
public final class HeuristicFactory {
    public static final String REASON_TYPE_REQUIRED = "HEURISTIC_TYPE_REQUIRED";
    public static final String REASON_REGION_REQUIRED = "HEURISTIC_REGION_REQUIRED";

    /**
     * Creates a heuristic provider for one grid region.
     *
     * @param type requested heuristic type.
     * @param region grid region the provider decodes cell indices against.
     * @return initialized heuristic provider.
     * @throws HeuristicConfigurationException when a required argument is missing.
     */
    public static HeuristicProvider create(HeuristicType type, GridRegion region) {
        if (type == null) {
            throw new HeuristicConfigurationException(REASON_TYPE_REQUIRED, "heuristic type must be provided");
        }
        if (region == null) {
            throw new HeuristicConfigurationException(REASON_REGION_REQUIRED, "grid region must be provided");
        }
        return switch (type) {
            case NONE -> new NullHeuristicProvider(region);
            case MANHATTAN -> new ManhattanHeuristicProvider(region);
        };
    }
}
