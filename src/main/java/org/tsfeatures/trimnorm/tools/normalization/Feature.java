package org.tsfeatures.trimnorm.tools.normalization;

import org.tsfeatures.trimnorm.utils.Utils;

import java.util.Objects;

/**
 * Descriptor of one computed feature (operation), i.e. one column of a feature matrix.
 */
public final class Feature {

    private final int id;
    private final String name;
    private final String keywords;
    private final String codeString;
    private final int masterId;

    /**
     * @param id         identifier of the feature in the upstream store.
     * @param name       unique name; never {@code null}.
     * @param keywords   comma-separated keywords; never {@code null}, may be empty.
     * @param codeString the output of the master operation this feature reads; never {@code null}.
     * @param masterId   identifier of the {@link MasterOperation} that computes this feature.
     */
    public Feature(final int id, final String name, final String keywords, final String codeString, final int masterId) {
        this.id = id;
        this.name = Utils.nonEmpty(name, "the feature name cannot be null or empty");
        this.keywords = Utils.nonNull(keywords, "the keywords cannot be null");
        this.codeString = Utils.nonNull(codeString, "the code string cannot be null");
        this.masterId = masterId;
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

    public String getCodeString() {
        return codeString;
    }

    public int getMasterId() {
        return masterId;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final Feature that = (Feature) o;
        return id == that.id && masterId == that.masterId && name.equals(that.name)
                && keywords.equals(that.keywords) && codeString.equals(that.codeString);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, keywords, codeString, masterId);
    }

    @Override
    public String toString() {
        return "Feature{" +
                "id=" + id +
                ", name='" + name + '\'' +
                ", masterId=" + masterId +
                '}';
    }
}
