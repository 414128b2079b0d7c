package org.Aayush.wayfinder.routing.core;

/**
 * Public route service contract.
 *
 * <p>Implementations are expected to perform deterministic input validation and
 * throw reason-coded runtime exceptions for contract failures. An unreachable target
 * is a normal response, not an exception.</p>
 */
public interface RouterService {
    /**
     * Executes one point-to-point route request.
     *
     * @param request client route request.
     * @return route response for the requested source/target pair.
     */
    RouteResponse route(RouteRequest request);
}
