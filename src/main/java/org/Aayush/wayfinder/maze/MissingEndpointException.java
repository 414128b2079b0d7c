package org.Aayush.wayfinder.maze;

import lombok.Getter;

/**
 * Thrown when a maze lacks its start ({@code S}) or end ({@code E}) marker.
 * Recoverable: callers report it and carry on with another maze.
 */
@Getter
public class MissingEndpointException extends RuntimeException {
    private final char marker;

    public MissingEndpointException(char marker, String message) {
        super(message);
        this.marker = marker;
    }
}
