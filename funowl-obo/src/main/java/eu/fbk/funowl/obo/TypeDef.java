package eu.fbk.funowl.obo;

import java.util.Collections;
import java.util.List;

import javax.annotation.Nullable;

import eu.fbk.funowl.data.Reference;

/**
 * An OBO {@code [Typedef]} stanza, i.e., a relation or, if it is a metadata tag, an annotation
 * property.
 */
public interface TypeDef extends Stanza {

    default boolean isMetadataTag() {
        return false;
    }

    @Nullable
    default String getComment() {
        return null;
    }

    @Nullable
    default Reference getDomain() {
        return null;
    }

    @Nullable
    default Reference getRange() {
        return null;
    }

    default List<List<Reference>> getHoldsOverChains() {
        return Collections.emptyList();
    }

    default boolean isAntiSymmetric() {
        return false;
    }

    @Nullable
    default Boolean isCyclic() {
        return null;
    }

    default boolean isReflexive() {
        return false;
    }

    default boolean isSymmetric() {
        return false;
    }

    default boolean isTransitive() {
        return false;
    }

    default boolean isFunctional() {
        return false;
    }

    default boolean isInverseFunctional() {
        return false;
    }

    default List<Reference> getEquivalentTo() {
        return Collections.emptyList();
    }

    default List<Reference> getDisjointFrom() {
        return Collections.emptyList();
    }

    @Nullable
    default Reference getInverse() {
        return null;
    }

    default List<Reference> getTransitiveOver() {
        return Collections.emptyList();
    }

    default List<List<Reference>> getEquivalentToChains() {
        return Collections.emptyList();
    }

    default List<Reference> getReplacedBy() {
        return Collections.emptyList();
    }

    default List<Reference> getSeeAlso() {
        return Collections.emptyList();
    }

    @Nullable
    default Boolean isClassLevel() {
        return null;
    }

}
