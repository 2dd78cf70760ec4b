package eu.fbk.funowl.data;

import java.io.Serializable;
import java.util.Objects;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.collect.ComparisonChain;

/**
 * A namespaced identifier, consisting of a prefix, a local identifier and an optional display
 * name.
 * <p>
 * A {@code Reference} is rendered as the CURIE {@code prefix:identifier}. The display name is
 * carried for convenience only: it is ignored by {@link #equals(Object)},
 * {@link #hashCode()}, {@link #compareTo(Reference)} and by any serialization of the
 * identifier. {@code Reference} objects are immutable.
 * </p>
 */
public final class Reference implements Referenced, Comparable<Reference>, Serializable {

    private static final long serialVersionUID = 1L;

    private final String prefix;

    private final String identifier;

    @Nullable
    private final String name;

    private Reference(final String prefix, final String identifier, @Nullable final String name) {
        this.prefix = prefix;
        this.identifier = identifier;
        this.name = name;
    }

    /**
     * Creates a new reference without display name.
     *
     * @param prefix
     *            the prefix, not empty
     * @param identifier
     *            the local identifier, not empty
     * @return the created reference
     */
    public static Reference create(final String prefix, final String identifier) {
        return create(prefix, identifier, null);
    }

    /**
     * Creates a new reference with an optional display name.
     *
     * @param prefix
     *            the prefix, not empty
     * @param identifier
     *            the local identifier, not empty
     * @param name
     *            the display name, possibly null
     * @return the created reference
     * @throws IllegalArgumentException
     *             in case prefix or identifier are empty
     */
    public static Reference create(final String prefix, final String identifier,
            @Nullable final String name) {
        Preconditions.checkArgument(!prefix.isEmpty(), "Empty prefix");
        Preconditions.checkArgument(!identifier.isEmpty(), "Empty identifier for prefix %s",
                prefix);
        return new Reference(prefix, identifier, name);
    }

    /**
     * Parses a CURIE of the form {@code prefix:identifier}. The prefix ends at the first colon.
     *
     * @param curie
     *            the CURIE to parse
     * @return the corresponding reference
     * @throws IllegalArgumentException
     *             if the supplied string is not a valid CURIE
     */
    public static Reference parse(final String curie) {
        final int index = curie.indexOf(':');
        Preconditions.checkArgument(index > 0 && index < curie.length() - 1,
                "Not a valid CURIE: '%s'", curie);
        return new Reference(curie.substring(0, index), curie.substring(index + 1), null);
    }

    public String getPrefix() {
        return this.prefix;
    }

    public String getIdentifier() {
        return this.identifier;
    }

    @Nullable
    public String getName() {
        return this.name;
    }

    public String getCurie() {
        return this.prefix + ":" + this.identifier;
    }

    /**
     * Returns a reference with the same prefix and identifier and the supplied display name.
     *
     * @param name
     *            the new display name, possibly null
     * @return the resulting reference (this reference if the name is unchanged)
     */
    public Reference withName(@Nullable final String name) {
        return Objects.equals(name, this.name) ? this : new Reference(this.prefix,
                this.identifier, name);
    }

    @Override
    public Reference getReference() {
        return this;
    }

    @Override
    public int compareTo(final Reference other) {
        return ComparisonChain.start().compare(this.prefix, other.prefix)
                .compare(this.identifier, other.identifier).result();
    }

    @Override
    public boolean equals(final Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof Reference)) {
            return false;
        }
        final Reference other = (Reference) object;
        return this.prefix.equals(other.prefix) && this.identifier.equals(other.identifier);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.prefix, this.identifier);
    }

    @Override
    public String toString() {
        return getCurie();
    }

}
