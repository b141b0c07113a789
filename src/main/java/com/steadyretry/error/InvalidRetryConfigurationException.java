package com.steadyretry.error;

/**
 * Thrown when retry arguments fail validation. Raised before the operation is ever invoked.
 */
public class InvalidRetryConfigurationException extends RetryException {

    public InvalidRetryConfigurationException(String message) {
        super(message);
    }

    /**
     * "missing &lt;field&gt; not valid".
     */
    public static InvalidRetryConfigurationException missing(String field) {
        return new InvalidRetryConfigurationException("missing " + field + " not valid");
    }

    /**
     * "&lt;what&gt; of &lt;value&gt; not valid".
     */
    public static InvalidRetryConfigurationException invalidValue(String what, Object value) {
        return new InvalidRetryConfigurationException(what + " of " + value + " not valid");
    }
}
