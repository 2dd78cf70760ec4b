package eu.fbk.funowl.data;

import org.openrdf.model.URI;
import org.openrdf.model.vocabulary.RDFS;

import eu.fbk.funowl.vocabulary.OWL2;

/**
 * The kinds of OWL 2 entities that can be declared.
 */
public enum EntityType {

    /** Classes, typed {@code owl:Class}. */
    CLASS("Class", OWL2.CLASS),

    /** Object properties, typed {@code owl:ObjectProperty}. */
    OBJECT_PROPERTY("ObjectProperty", OWL2.OBJECT_PROPERTY),

    /** Data properties, typed {@code owl:DatatypeProperty}. */
    DATA_PROPERTY("DataProperty", OWL2.DATATYPE_PROPERTY),

    /** Datatypes, typed {@code rdfs:Datatype}. */
    DATATYPE("Datatype", RDFS.DATATYPE),

    /** Annotation properties, typed {@code owl:AnnotationProperty}. */
    ANNOTATION_PROPERTY("AnnotationProperty", OWL2.ANNOTATION_PROPERTY),

    /** Named individuals, typed {@code owl:NamedIndividual}. */
    NAMED_INDIVIDUAL("NamedIndividual", OWL2.NAMED_INDIVIDUAL);

    private final String tag;

    private final URI type;

    private EntityType(final String tag, final URI type) {
        this.tag = tag;
        this.type = type;
    }

    /**
     * Returns the functional-syntax tag, e.g., {@code ObjectProperty}.
     *
     * @return the tag
     */
    public String getTag() {
        return this.tag;
    }

    /**
     * Returns the RDF class entities of this kind are typed with.
     *
     * @return the type IRI
     */
    public URI getType() {
        return this.type;
    }

}
