package io.surfworks.symforge.core.symbol;

import java.util.Objects;

/**
 * Edge of the symbolic graph: output {@code index} of node {@code source}.
 *
 * @param source the producing node
 * @param index  output slot on the producing node
 */
public record DataEntry(Node source, int index) {

    public DataEntry {
        Objects.requireNonNull(source, "source");
        if (index < 0) {
            throw new IllegalArgumentException("Output index must be non-negative, got " + index);
        }
    }

    @Override
    public String toString() {
        return source.name() + "(" + index + ")";
    }
}
