package com.eainde.salary.model;

/**
 * Provider family an {@link Observation} came from.
 */
public enum ObservationOrigin {
    KNOWLEDGE_STORE,
    WEB_SEARCH
}
