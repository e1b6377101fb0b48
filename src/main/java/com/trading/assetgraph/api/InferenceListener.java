package com.trading.assetgraph.api;

/**
 * Observability hook for relationship inference.
 *
 * Registered on an {@code AssetGraph}, a listener receives callbacks while
 * the relationship store is being rebuilt. With no listener registered,
 * skipped candidates are dropped without any signal.
 *
 * Callbacks run on the thread performing the rebuild and, when the graph is
 * guarded, while the guard's lock is held. Implementations must be cheap and
 * must not call back into the graph from another thread.
 */
public interface InferenceListener {

    /**
     * Called before the store is cleared.
     *
     * @param run Incrementing rebuild counter of the graph.
     */
    void onInferenceStart(long run);

    /**
     * Called for every candidate relationship that was not stored.
     *
     * @param run    Current rebuild counter.
     * @param source Source asset id.
     * @param target Target asset id.
     * @param type   Relationship type tag.
     * @param reason Why it was dropped.
     */
    void onRelationshipSkipped(long run, String source, String target, String type, SkipReason reason);

    /**
     * Called once the store has been fully regenerated.
     *
     * @param run               Current rebuild counter.
     * @param relationshipCount Total number of directed relationships stored.
     */
    void onInferenceEnd(long run, int relationshipCount);
}
