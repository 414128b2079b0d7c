package org.Aayush.wayfinder.routing.graph;

import lombok.experimental.StandardException;

/**
 * Thrown when an edge is added with a negative weight.
 */
@StandardException
public class InvalidWeightException extends IllegalArgumentException {
}
