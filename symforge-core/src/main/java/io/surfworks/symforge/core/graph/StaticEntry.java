package io.surfworks.symforge.core.graph;

/**
 * Edge of a static graph: output {@code index} of node {@code sourceId}.
 *
 * @param sourceId id of the producing node
 * @param index    output slot on the producing node
 */
public record StaticEntry(int sourceId, int index) {

    @Override
    public String toString() {
        return sourceId + ":" + index;
    }
}
