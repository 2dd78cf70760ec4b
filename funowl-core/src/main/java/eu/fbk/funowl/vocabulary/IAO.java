package eu.fbk.funowl.vocabulary;

import org.openrdf.model.Namespace;
import org.openrdf.model.impl.NamespaceImpl;

import eu.fbk.funowl.data.Reference;

/**
 * Constants for the Information Artifact Ontology terms used for ontology curation metadata.
 * <p>
 * Terms are exposed as {@link Reference} objects, so that they are rendered as CURIEs in
 * functional-syntax output and expanded through the document prefix map in RDF output.
 * </p>
 *
 * @see <a href="http://purl.obolibrary.org/obo/iao.owl">vocabulary specification</a>
 */
public final class IAO {

    /** Recommended prefix for the vocabulary namespace: "IAO". */
    public static final String PREFIX = "IAO";

    /** Vocabulary namespace: "http://purl.obolibrary.org/obo/IAO_". */
    public static final String NAMESPACE = "http://purl.obolibrary.org/obo/IAO_";

    /** Immutable {@link Namespace} constant for the vocabulary namespace. */
    public static final Namespace NS = new NamespaceImpl(PREFIX, NAMESPACE);

    // PROPERTIES

    /** Property IAO:0000118 (alternative term). */
    public static final Reference ALTERNATIVE_TERM = createReference("0000118",
            "alternative term");

    /** Property IAO:0100001 (term replaced by). */
    public static final Reference TERM_REPLACED_BY = createReference("0100001",
            "term replaced by");

    /** Property IAO:0700000 (has ontology root term). */
    public static final Reference HAS_ONTOLOGY_ROOT_TERM = createReference("0700000",
            "has ontology root term");

    // HELPER METHODS

    private static Reference createReference(final String identifier, final String name) {
        return Reference.create(PREFIX, identifier, name);
    }

    private IAO() {
    }

}
