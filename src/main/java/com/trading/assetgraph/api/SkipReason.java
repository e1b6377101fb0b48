package com.trading.assetgraph.api;

/** Why a candidate relationship was dropped during inference. */
public enum SkipReason {
    /** The event's own asset id has no asset record. */
    UNKNOWN_EVENT_SOURCE,
    /** A related asset id of an event has no asset record. */
    UNKNOWN_EVENT_TARGET,
    /** A tuple with the same (source, target, type) already exists. */
    DUPLICATE,
    /** Source and target are the same asset. */
    SELF_REFERENCE
}
