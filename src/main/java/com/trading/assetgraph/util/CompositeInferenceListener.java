package com.trading.assetgraph.util;

import com.trading.assetgraph.api.InferenceListener;
import com.trading.assetgraph.api.SkipReason;

import java.util.Arrays;

/** Fans inference callbacks out to every registered listener, in order. */
public class CompositeInferenceListener implements InferenceListener {
    private volatile InferenceListener[] listeners = new InferenceListener[0];

    public synchronized void add(InferenceListener listener) {
        InferenceListener[] old = listeners;
        InferenceListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
    }

    public int size() {
        return listeners.length;
    }

    @Override
    public void onInferenceStart(long run) {
        for (InferenceListener l : listeners)
            l.onInferenceStart(run);
    }

    @Override
    public void onRelationshipSkipped(long run, String source, String target, String type, SkipReason reason) {
        for (InferenceListener l : listeners)
            l.onRelationshipSkipped(run, source, target, type, reason);
    }

    @Override
    public void onInferenceEnd(long run, int relationshipCount) {
        for (InferenceListener l : listeners)
            l.onInferenceEnd(run, relationshipCount);
    }
}
