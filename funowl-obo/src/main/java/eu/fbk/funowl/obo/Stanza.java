package eu.fbk.funowl.obo;

import java.util.Collections;
import java.util.List;

import javax.annotation.Nullable;

import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ListMultimap;

import eu.fbk.funowl.data.Reference;
import eu.fbk.funowl.data.Referenced;

/**
 * A stanza of an OBO ontology, as exposed by an external OBO object model.
 * <p>
 * Only {@link #getReference()} is mandatory: the remaining accessors default to an unset or
 * empty value, meaning the corresponding OBO tag is absent. Boolean tags are represented with
 * {@link Boolean} objects, null meaning the tag is absent.
 * </p>
 */
public interface Stanza extends Referenced {

    @Nullable
    default String getName() {
        return null;
    }

    @Nullable
    default String getNamespace() {
        return null;
    }

    @Nullable
    default Boolean isAnonymous() {
        return null;
    }

    default List<Reference> getAltIds() {
        return Collections.emptyList();
    }

    @Nullable
    default String getDefinition() {
        return null;
    }

    default List<Reference> getSubsets() {
        return Collections.emptyList();
    }

    default List<Synonym> getSynonyms() {
        return Collections.emptyList();
    }

    default List<Reference> getXrefs() {
        return Collections.emptyList();
    }

    @Nullable
    default Boolean isBuiltin() {
        return null;
    }

    /**
     * Returns the property values of the stanza, each either an {@link OboLiteral} or a
     * {@link Reference}, grouped by property in OBO order.
     *
     * @return the property values
     */
    default ListMultimap<Reference, Object> getProperties() {
        return ImmutableListMultimap.of();
    }

    default List<Reference> getParents() {
        return Collections.emptyList();
    }

    @Nullable
    default Boolean isObsolete() {
        return null;
    }

    /**
     * Returns the annotations qualifying a value of this stanza, such as the provenance of its
     * definition.
     *
     * @param predicate
     *            the predicate of the value, e.g., {@code dcterms:description} for the definition
     * @param value
     *            the value, a {@link String}, {@link Reference} or {@link OboLiteral}
     * @return the annotations of the value, possibly empty
     */
    default List<OboAnnotation> getAnnotations(final Reference predicate, final Object value) {
        return Collections.emptyList();
    }

}
