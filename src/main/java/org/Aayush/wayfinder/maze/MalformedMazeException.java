package org.Aayush.wayfinder.maze;

import lombok.experimental.StandardException;

/**
 * Thrown for empty or ragged maze text, or duplicated endpoint markers.
 */
@StandardException
public class MalformedMazeException extends IllegalArgumentException {
}
