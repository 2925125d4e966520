package com.forensicalpha.alpha.ai;

/** Model output that does not satisfy the recommendation contract. Always recovered by the fallback. */
public class AdvisorResponseException extends RuntimeException {

    public AdvisorResponseException(String message) {
        super(message);
    }

    public AdvisorResponseException(String message, Throwable cause) {
        super(message, cause);
    }
}
