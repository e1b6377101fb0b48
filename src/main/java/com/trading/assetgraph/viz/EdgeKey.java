package com.trading.assetgraph.viz;

/** Identity of one directed edge in the visualization index. */
public record EdgeKey(String source, String target, String type) {

    public EdgeKey reverse() {
        return new EdgeKey(target, source, type);
    }

    /** Order-independent key: endpoints sorted, type unchanged. */
    public EdgeKey canonical() {
        return source.compareTo(target) <= 0 ? this : reverse();
    }
}
