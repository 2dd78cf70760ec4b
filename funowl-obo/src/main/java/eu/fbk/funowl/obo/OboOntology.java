package eu.fbk.funowl.obo;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import javax.annotation.Nullable;

import eu.fbk.funowl.data.Reference;

/**
 * An OBO ontology: header information plus the typedef and term stanzas.
 */
public interface OboOntology {

    /**
     * Returns the ontology prefix, e.g., "go", used to build the ontology IRI.
     *
     * @return the prefix
     */
    String getPrefix();

    @Nullable
    default String getName() {
        return null;
    }

    @Nullable
    default String getDataVersion() {
        return null;
    }

    /**
     * Returns the {@code idspace} prefix to namespace declarations of the header.
     *
     * @return the id spaces, possibly empty
     */
    default Map<String, String> getIdSpaces() {
        return Collections.emptyMap();
    }

    default List<Reference> getRootTerms() {
        return Collections.emptyList();
    }

    default List<SubsetDef> getSubsetDefs() {
        return Collections.emptyList();
    }

    default List<SynonymTypeDef> getSynonymTypeDefs() {
        return Collections.emptyList();
    }

    default List<OboAnnotation> getPropertyValues() {
        return Collections.emptyList();
    }

    default List<TypeDef> getTypeDefs() {
        return Collections.emptyList();
    }

    List<Term> getTerms();

}
