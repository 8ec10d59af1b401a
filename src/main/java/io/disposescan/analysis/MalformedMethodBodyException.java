package io.disposescan.analysis;

import io.disposescan.model.MethodInfo;

/**
 * Thrown when a method's instruction sequence cannot be interpreted.
 */
public class MalformedMethodBodyException extends RuntimeException {

    private final String method;

    public MalformedMethodBodyException(MethodInfo method, String message) {
        super(method + ": " + message);
        this.method = method.toString();
    }

    /**
     * Returns the method whose body was rejected.
     */
    public String getMethod() {
        return method;
    }
}
