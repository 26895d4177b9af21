package org.learningjava.embbench.application.port;

/**
 * One embedding request did not complete successfully.
 */
public class EmbeddingRequestException extends RuntimeException {

    private final int status;

    public EmbeddingRequestException(String message, int status) {
        super(message);
        this.status = status;
    }

    public EmbeddingRequestException(String message, Throwable cause) {
        super(message, cause);
        this.status = -1;
    }

    /** HTTP status, or -1 when the request never got a response. */
    public int status() { return status; }
}
