package villagecompute.webapp.exceptions;

/**
 * Exception thrown when the distributed cache cannot be read or written, including payloads that fail to
 * (de)serialize.
 *
 * <p>
 * Callers that only use the cache as an optimization catch it and fall back to computing the value.
 */
public class CacheAccessException extends RuntimeException {

    public CacheAccessException(String message) {
        super(message);
    }

    public CacheAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
