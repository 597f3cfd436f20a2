package com.rastertopo.server.contour;

/** Internal contract violation inside the border follower; not recoverable. */
public class TracerInvariantException extends RuntimeException {
    public TracerInvariantException(String message) {
        super(message);
    }
}
