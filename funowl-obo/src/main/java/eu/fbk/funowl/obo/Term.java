package eu.fbk.funowl.obo;

import java.util.Collections;
import java.util.List;

import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ListMultimap;

import eu.fbk.funowl.data.Reference;

/**
 * An OBO {@code [Term]} or {@code [Instance]} stanza.
 */
public interface Term extends Stanza {

    /**
     * Returns whether the stanza is an {@code [Instance]} stanza, converted to a named
     * individual rather than a class.
     *
     * @return true for instances
     */
    default boolean isInstance() {
        return false;
    }

    /**
     * Returns the {@code intersection_of} elements, each either a {@link Reference} or a
     * {@code Map.Entry} of a relation and a target {@link Reference}.
     *
     * @return the elements, possibly empty
     */
    default List<Object> getIntersectionOf() {
        return Collections.emptyList();
    }

    default List<Object> getUnionOf() {
        return Collections.emptyList();
    }

    default List<Reference> getEquivalentTo() {
        return Collections.emptyList();
    }

    default List<Reference> getDisjointFrom() {
        return Collections.emptyList();
    }

    /**
     * Returns the {@code relationship} values, keyed by relation.
     *
     * @return the relationships
     */
    default ListMultimap<Reference, Reference> getRelationships() {
        return ImmutableListMultimap.of();
    }

}
