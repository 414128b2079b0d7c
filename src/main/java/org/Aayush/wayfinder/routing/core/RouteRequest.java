package org.Aayush.wayfinder.routing.core;

import lombok.Builder;
import lombok.Value;

/**
 * Client-facing point-to-point route request.
 *
 * <p>Node identifiers are expressed in external id space (station names, {@code "(row, col)"}
 * cells). Mapping into internal graph node ids is handled by {@link RouteCore}.</p>
 */
@Value
@Builder
public class RouteRequest {
    /** External identifier for route origin node. */
    String sourceExternalId;
    /** External identifier for route destination node. */
    String targetExternalId;
    /** Search algorithm to execute. */
    RoutingAlgorithm algorithm;
}
