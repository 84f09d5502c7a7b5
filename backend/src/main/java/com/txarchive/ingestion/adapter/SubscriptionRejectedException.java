package com.txarchive.ingestion.adapter;

/**
 * The endpoint refused the subscription outright (authentication or protocol rejection).
 * Retrying immediately will not help; the endpoint is taken out of rotation.
 */
public class SubscriptionRejectedException extends RpcException {

    public SubscriptionRejectedException(String message) {
        super(message);
    }

    public SubscriptionRejectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
