package com.txarchive.ingestion.endpoint;

public enum EndpointOutcome {
    SUCCESS,
    FAILURE
}
