package org.tsfeatures.trimnorm.tools.normalization;

import java.util.Objects;

/**
 * Where a feature matrix came from.  Carried through normalization unchanged.
 */
public final class Provenance {

    /**
     * Matrices written before the source flag existed were always retrieved from a database.
     */
    public static final Provenance LEGACY = new Provenance(true, null);

    private final boolean fromDatabase;
    private final String versionControl;

    /**
     * @param fromDatabase   whether the matrix was retrieved from an external database.
     * @param versionControl description of the code revision that computed the matrix, {@code null} if unknown.
     */
    public Provenance(final boolean fromDatabase, final String versionControl) {
        this.fromDatabase = fromDatabase;
        this.versionControl = versionControl;
    }

    public boolean isFromDatabase() {
        return fromDatabase;
    }

    /**
     * @return {@code null} if no version-control information was recorded.
     */
    public String getVersionControl() {
        return versionControl;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final Provenance that = (Provenance) o;
        return fromDatabase == that.fromDatabase && Objects.equals(versionControl, that.versionControl);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fromDatabase, versionControl);
    }
}
