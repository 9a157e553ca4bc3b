package org.tsfeatures.trimnorm.tools.normalization;

import org.tsfeatures.trimnorm.utils.Utils;

import java.util.Objects;

/**
 * Descriptor of one observed time series, i.e. one row of a feature matrix.
 */
public final class Observation {

    private final int id;
    private final String name;
    private final String keywords;
    private final String group;

    /**
     * @param id       identifier of the time series in the upstream store.
     * @param name     unique name; never {@code null}.
     * @param keywords comma-separated keywords; never {@code null}, may be empty.
     * @param group    class label, {@code null} if the observation has not been assigned to a class.
     */
    public Observation(final int id, final String name, final String keywords, final String group) {
        this.id = id;
        this.name = Utils.nonEmpty(name, "the observation name cannot be null or empty");
        this.keywords = Utils.nonNull(keywords, "the keywords cannot be null");
        this.group = group;
    }

    public Observation(final int id, final String name, final String keywords) {
        this(id, name, keywords, null);
    }

    public int getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getKeywords() {
        return keywords;
    }

    /**
     * @return {@code null} if the observation carries no class label.
     */
    public String getGroup() {
        return group;
    }

    public boolean hasGroup() {
        return group != null;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final Observation that = (Observation) o;
        return id == that.id && name.equals(that.name) && keywords.equals(that.keywords) && Objects.equals(group, that.group);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, keywords, group);
    }

    @Override
    public String toString() {
        return "Observation{" +
                "id=" + id +
                ", name='" + name + '\'' +
                ", group=" + group +
                '}';
    }
}
