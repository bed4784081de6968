package io.surfworks.symforge.core.symbol;

import java.util.List;

/**
 * Descriptor of an operator that can appear in a symbolic graph.
 *
 * <p>The graph layer never looks at numeric semantics. It only needs to
 * duplicate a descriptor, name it, and know which arguments it binds and
 * which outputs it produces.
 */
public interface OperatorProperty {

    /**
     * Duplicate this descriptor. The copy must be independent of the receiver.
     */
    OperatorProperty copy();

    /**
     * Type name used in textual dumps, e.g. "FullyConnected".
     */
    String typeString();

    /**
     * Declared argument names. The order defines positional binding.
     */
    default List<String> listArguments() {
        return List.of("data");
    }

    /**
     * Declared output names, one per output slot.
     */
    default List<String> listReturns() {
        return List.of("output");
    }

    /**
     * Number of outputs the operator produces.
     */
    default int numReturns() {
        return listReturns().size();
    }

    /**
     * Number of outputs exposed as heads when the operator is wrapped in a graph.
     */
    default int numVisibleReturns() {
        return numReturns();
    }
}
