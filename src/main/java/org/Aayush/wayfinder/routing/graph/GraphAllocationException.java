package org.Aayush.wayfinder.routing.graph;

import lombok.experimental.StandardException;

/**
 * Thrown when storage for a graph cannot be obtained.
 * <p>
 * Construction-time only. Callers are not expected to recover.
 */
@StandardException
public class GraphAllocationException extends IllegalStateException {
}
