package io.surfworks.symforge.core.shape;

import java.util.Arrays;

/**
 * Immutable array shape exchanged with shape inference.
 * A shape with zero dimensions means "not known yet".
 */
public final class Shape {

    private static final Shape UNKNOWN = new Shape(new int[0]);

    private final int[] dims;

    private Shape(int[] dims) {
        this.dims = dims;
    }

    /**
     * Create a shape from explicit dimensions.
     *
     * @throws IllegalArgumentException if any dimension is negative
     */
    public static Shape of(int... dims) {
        for (int i = 0; i < dims.length; i++) {
            if (dims[i] < 0) {
                throw new IllegalArgumentException(
                    "Dimension " + i + " must be non-negative, got " + dims[i]);
            }
        }
        return dims.length == 0 ? UNKNOWN : new Shape(dims.clone());
    }

    /**
     * The placeholder shape for an argument or output whose shape is not yet resolved.
     */
    public static Shape unknown() {
        return UNKNOWN;
    }

    /**
     * Number of dimensions.
     */
    public int ndim() {
        return dims.length;
    }

    /**
     * Size of one dimension.
     */
    public int dim(int axis) {
        return dims[axis];
    }

    /**
     * Whether this shape carries any dimensions.
     */
    public boolean isKnown() {
        return dims.length != 0;
    }

    /**
     * Total number of elements, 0 for an unknown shape.
     */
    public long size() {
        if (dims.length == 0) {
            return 0;
        }
        long count = 1;
        for (int dim : dims) {
            count *= dim;
        }
        return count;
    }

    public int[] dims() {
        return dims.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Shape other)) return false;
        return Arrays.equals(dims, other.dims);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(dims);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < dims.length; i++) {
            if (i > 0) sb.append(",");
            sb.append(dims[i]);
        }
        return sb.append(")").toString();
    }
}
