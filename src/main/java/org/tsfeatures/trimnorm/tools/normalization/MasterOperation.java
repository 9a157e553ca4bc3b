package org.tsfeatures.trimnorm.tools.normalization;

import org.tsfeatures.trimnorm.utils.Utils;

import java.util.Objects;

/**
 * A piece of code that, evaluated once per time series, produces the values of one or more {@link Feature}s.
 * Master operations are passed through normalization unchanged; they are not re-indexed after features are
 * removed.
 */
public final class MasterOperation {

    private final int id;
    private final String label;
    private final String code;

    public MasterOperation(final int id, final String label, final String code) {
        this.id = id;
        this.label = Utils.nonEmpty(label, "the master operation label cannot be null or empty");
        this.code = Utils.nonNull(code, "the master operation code cannot be null");
    }

    public int getId() {
        return id;
    }

    public String getLabel() {
        return label;
    }

    public String getCode() {
        return code;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final MasterOperation that = (MasterOperation) o;
        return id == that.id && label.equals(that.label) && code.equals(that.code);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, label, code);
    }

    @Override
    public String toString() {
        return "MasterOperation{id=" + id + ", label='" + label + "'}";
    }
}
