package eu.fbk.funowl.vocabulary;

import org.openrdf.model.Namespace;
import org.openrdf.model.impl.NamespaceImpl;

import eu.fbk.funowl.data.Reference;

/**
 * Constants for the oboInOwl vocabulary used to encode OBO flat-file tags in OWL.
 * <p>
 * Terms are exposed as {@link Reference} objects, so that they are rendered as CURIEs in
 * functional-syntax output and expanded through the document prefix map in RDF output.
 * </p>
 *
 * @see <a href="http://www.geneontology.org/formats/oboInOwl">vocabulary specification</a>
 */
public final class OBOINOWL {

    /** Recommended prefix for the vocabulary namespace: "oboInOwl". */
    public static final String PREFIX = "oboInOwl";

    /** Vocabulary namespace: "http://www.geneontology.org/formats/oboInOwl#". */
    public static final String NAMESPACE = "http://www.geneontology.org/formats/oboInOwl#";

    /** Immutable {@link Namespace} constant for the vocabulary namespace. */
    public static final Namespace NS = new NamespaceImpl(PREFIX, NAMESPACE);

    // PROPERTY GROUPS

    /** Annotation property oboInOwl:SubsetProperty. */
    public static final Reference SUBSET_PROPERTY = createReference("SubsetProperty");

    /** Annotation property oboInOwl:SynonymTypeProperty. */
    public static final Reference SYNONYM_TYPE_PROPERTY = createReference("SynonymTypeProperty");

    // PROPERTIES

    /** Property oboInOwl:hasExactSynonym. */
    public static final Reference HAS_EXACT_SYNONYM = createReference("hasExactSynonym");

    /** Property oboInOwl:hasBroadSynonym. */
    public static final Reference HAS_BROAD_SYNONYM = createReference("hasBroadSynonym");

    /** Property oboInOwl:hasNarrowSynonym. */
    public static final Reference HAS_NARROW_SYNONYM = createReference("hasNarrowSynonym");

    /** Property oboInOwl:hasRelatedSynonym. */
    public static final Reference HAS_RELATED_SYNONYM = createReference("hasRelatedSynonym");

    /** Property oboInOwl:hasSynonymType. */
    public static final Reference HAS_SYNONYM_TYPE = createReference("hasSynonymType");

    /** Property oboInOwl:hasScope. */
    public static final Reference HAS_SCOPE = createReference("hasScope");

    /** Property oboInOwl:hasDbXref. */
    public static final Reference HAS_DB_XREF = createReference("hasDbXref");

    /** Property oboInOwl:hasOBONamespace. */
    public static final Reference HAS_OBO_NAMESPACE = createReference("hasOBONamespace");

    /** Property oboInOwl:inSubset. */
    public static final Reference IN_SUBSET = createReference("inSubset");

    /** Property oboInOwl:consider. */
    public static final Reference CONSIDER = createReference("consider");

    /** Property oboInOwl:is_anonymous. */
    public static final Reference IS_ANONYMOUS = createReference("is_anonymous");

    /** Property oboInOwl:builtin. */
    public static final Reference BUILTIN = createReference("builtin");

    /** Property oboInOwl:is_class_level. */
    public static final Reference IS_CLASS_LEVEL = createReference("is_class_level");

    /** Property oboInOwl:is_cyclic. */
    public static final Reference IS_CYCLIC = createReference("is_cyclic");

    // HELPER METHODS

    private static Reference createReference(final String identifier) {
        return Reference.create(PREFIX, identifier);
    }

    private OBOINOWL() {
    }

}
