package io.observer.hub;

/**
 * Exception thrown when a hub cannot complete an operation on behalf of user code,
 * for example when the state supplier of a {@link ReactiveHub} fails.
 */
public class HubException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public HubException(String message) {
        super(message);
    }

    public HubException(String message, Throwable cause) {
        super(message, cause);
    }
}
