package org.Aayush.wayfinder.routing.path;

import lombok.experimental.StandardException;

/**
 * Thrown when a predecessor chain does not reach its source within node-count steps.
 * Indicates a defect in the traversal that produced the array.
 */
@StandardException
public class PredecessorCycleException extends IllegalStateException {
}
