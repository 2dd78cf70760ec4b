package eu.fbk.funowl.vocabulary;

import org.openrdf.model.Namespace;
import org.openrdf.model.impl.NamespaceImpl;

import eu.fbk.funowl.data.Reference;

/**
 * Constants for the Simple Standard for Sharing Ontological Mappings.
 * <p>
 * Terms are exposed as {@link Reference} objects, so that they are rendered as CURIEs in
 * functional-syntax output and expanded through the document prefix map in RDF output.
 * </p>
 *
 * @see <a href="https://w3id.org/sssom/">vocabulary specification</a>
 */
public final class SSSOM {

    /** Recommended prefix for the vocabulary namespace: "sssom". */
    public static final String PREFIX = "sssom";

    /** Vocabulary namespace: "https://w3id.org/sssom/". */
    public static final String NAMESPACE = "https://w3id.org/sssom/";

    /** Immutable {@link Namespace} constant for the vocabulary namespace. */
    public static final Namespace NS = new NamespaceImpl(PREFIX, NAMESPACE);

    // PROPERTIES

    /** Property sssom:has_mapping_justification. */
    public static final Reference HAS_MAPPING_JUSTIFICATION = createReference("has_mapping_justification");

    // HELPER METHODS

    private static Reference createReference(final String identifier) {
        return Reference.create(PREFIX, identifier);
    }

    private SSSOM() {
    }

}
