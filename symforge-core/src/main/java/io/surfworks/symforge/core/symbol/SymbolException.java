package io.surfworks.symforge.core.symbol;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Exception thrown when a symbolic graph operation is given arguments it cannot bind.
 *
 * <p>Carries the {@link ErrorKind} and, for name lookups, the offending keys
 * together with the candidate names they were checked against.
 */
public class SymbolException extends RuntimeException {

    private final ErrorKind kind;
    private final List<String> mismatchedKeys;
    private final List<String> candidates;

    public SymbolException(String message, ErrorKind kind) {
        this(message, kind, List.of(), List.of());
    }

    public SymbolException(String message, ErrorKind kind,
                           List<String> mismatchedKeys, List<String> candidates) {
        super(message);
        this.kind = kind;
        this.mismatchedKeys = List.copyOf(mismatchedKeys);
        this.candidates = List.copyOf(candidates);
    }

    public ErrorKind kind() {
        return kind;
    }

    /**
     * Keys that did not resolve. Empty unless the kind is a name lookup failure.
     */
    public List<String> mismatchedKeys() {
        return mismatchedKeys;
    }

    /**
     * Names the keys were resolved against, in argument order.
     */
    public List<String> candidates() {
        return candidates;
    }

    /**
     * Symbol error kinds.
     */
    public enum ErrorKind {
        /** Positional argument count differs from the free argument count */
        ARITY_MISMATCH,

        /** An argument graph has more than one head */
        TUPLE_ARGUMENT,

        /** Keyword binding against a graph with duplicated variable names */
        AMBIGUOUS_NAME,

        /** A key is not among the candidate argument names */
        UNKNOWN_KEYWORD,

        /** Composition on a multi-head graph or on a bare variable */
        NON_SCALAR_RECEIVER
    }

    public static SymbolException arityMismatch(int required, int provided) {
        return new SymbolException(
                String.format("Incorrect number of arguments, requires %d, provided %d", required, provided),
                ErrorKind.ARITY_MISMATCH);
    }

    public static SymbolException tupleArgument(String argument) {
        return new SymbolException(
                argument + " is a tuple, scalar is required",
                ErrorKind.TUPLE_ARGUMENT);
    }

    public static SymbolException nonScalarReceiver(String reason) {
        return new SymbolException(reason, ErrorKind.NON_SCALAR_RECEIVER);
    }

    /**
     * Build the ambiguity error for keyword binding.
     *
     * @param duplicated names carried by more than one variable node
     */
    public static SymbolException ambiguousName(Collection<String> duplicated) {
        StringBuilder msg = new StringBuilder();
        for (String name : duplicated) {
            msg.append("Argument name=\"").append(name)
               .append("\" occurred in more than one place in the symbol. ");
        }
        msg.append("Keyword argument call is not supported because of this duplication.");
        return new SymbolException(msg.toString(), ErrorKind.AMBIGUOUS_NAME,
                List.copyOf(duplicated), List.of());
    }

    /**
     * Report every user key absent from the candidate list in one error.
     *
     * @param source     operation name used as message prefix
     * @param userKeys   keys supplied by the caller
     * @param candidates argument names the keys were matched against
     */
    public static SymbolException unknownKeyword(String source, Collection<String> userKeys,
                                                 List<String> candidates) {
        Set<String> known = new HashSet<>(candidates);
        List<String> missing = new ArrayList<>();
        for (String key : userKeys) {
            if (!known.contains(key)) {
                missing.add(key);
            }
        }
        StringBuilder msg = new StringBuilder(source).append(": ");
        if (missing.isEmpty()) {
            msg.append("Keyword arguments ").append(userKeys).append(" could not all be bound.");
        } else {
            msg.append("Keyword argument name");
            msg.append(missing.size() == 1 ? " " : "s ");
            msg.append(String.join(", ", missing)).append(" not found.");
        }
        msg.append("\nCandidate arguments:\n");
        for (int i = 0; i < candidates.size(); i++) {
            msg.append("\t[").append(i).append(']').append(candidates.get(i)).append('\n');
        }
        return new SymbolException(msg.toString(), ErrorKind.UNKNOWN_KEYWORD, missing, candidates);
    }
}
