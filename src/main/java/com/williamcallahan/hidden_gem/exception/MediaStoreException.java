/**
 * Exception thrown when the media store cannot read or write a game's files
 *
 * Features:
 * - Fatal to the current resolution and surfaced to the caller
 * - Covers I/O errors and corrupt sidecar metadata
 */
package com.williamcallahan.hidden_gem.exception;

public class MediaStoreException extends RuntimeException {

    public MediaStoreException(String message) {
        super(message);
    }

    public MediaStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
