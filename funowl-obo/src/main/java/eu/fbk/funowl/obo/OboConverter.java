package eu.fbk.funowl.obo;

import java.util.List;
import java.util.Map;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.fbk.funowl.Document;
import eu.fbk.funowl.Ontology;
import eu.fbk.funowl.data.Annotation;
import eu.fbk.funowl.data.AnnotationAxiom;
import eu.fbk.funowl.data.Assertion;
import eu.fbk.funowl.data.Axiom;
import eu.fbk.funowl.data.ClassAxiom;
import eu.fbk.funowl.data.Converter;
import eu.fbk.funowl.data.Declaration;
import eu.fbk.funowl.data.EntityType;
import eu.fbk.funowl.data.ObjectPropertyAxiom;
import eu.fbk.funowl.data.ObjectPropertyChain;
import eu.fbk.funowl.data.Reference;
import eu.fbk.funowl.macro.Macro;
import eu.fbk.funowl.vocabulary.IAO;
import eu.fbk.funowl.vocabulary.OBOINOWL;

/**
 * Converts OBO stanzas and ontologies into OWL 2 axioms and functional-syntax documents.
 * <p>
 * Axioms are produced stanza by stanza, in the order of the OBO tags they derive from; tags
 * that are absent produce no axiom. Annotations qualifying a single OBO value (e.g., the
 * provenance of a definition) become annotations of the corresponding axiom.
 * </p>
 */
public final class OboConverter {

    private static final Logger LOGGER = LoggerFactory.getLogger(OboConverter.class);

    /** Default base IRI of the converted ontologies. */
    public static final String DEFAULT_BASE = "https://w3id.org/biopragmatics/resources/";

    private static final Reference TITLE = Reference.create("dcterms", "title");

    private static final Reference DESCRIPTION = Reference.create("dcterms", "description");

    private final String base;

    public OboConverter() {
        this(DEFAULT_BASE);
    }

    /**
     * Creates a converter minting ontology IRIs in the base namespace specified.
     *
     * @param base
     *            the base IRI, to which the ontology prefix is appended
     */
    public OboConverter(final String base) {
        Preconditions.checkArgument(!base.isEmpty(), "Empty base IRI");
        this.base = base;
    }

    public String getBase() {
        return this.base;
    }

    public String getOntologyIRI(final OboOntology ontology) {
        final String prefix = ontology.getPrefix();
        return this.base + prefix + "/" + prefix + ".ofn";
    }

    @Nullable
    public String getVersionIRI(final OboOntology ontology) {
        final String version = ontology.getDataVersion();
        if (version == null || version.isEmpty()) {
            return null;
        }
        final String prefix = ontology.getPrefix();
        return this.base + prefix + "/" + version + "/" + prefix + ".ofn";
    }

    /**
     * Converts a whole OBO ontology. The document declares the default prefixes plus the id
     * spaces of the ontology, the former taking precedence.
     *
     * @param ontology
     *            the OBO ontology
     * @return the resulting document, with a single ontology
     */
    public Document convert(final OboOntology ontology) {
        final List<Axiom> axioms = getOntologyAxioms(ontology);
        final Ontology result = Ontology.builder().iri(getOntologyIRI(ontology))
                .versionIRI(getVersionIRI(ontology))
                .annotations(getOntologyAnnotations(ontology)).axioms(axioms).build();
        final Map<String, String> prefixes = Converter.getDefault()
                .withPrefixes(ontology.getIdSpaces()).getPrefixes();
        LOGGER.info("Converted OBO ontology {}: {} typedefs, {} terms, {} axioms",
                ontology.getPrefix(), ontology.getTypeDefs().size(), ontology.getTerms().size(),
                axioms.size());
        return new Document(prefixes, result);
    }

    /**
     * Returns the ontology annotations: title, root terms and header property values.
     *
     * @param ontology
     *            the OBO ontology
     * @return the annotations, in order
     */
    public List<Annotation> getOntologyAnnotations(final OboOntology ontology) {
        final List<Annotation> annotations = Lists.newArrayList();
        if (ontology.getName() != null) {
            annotations.add(Annotation.create(TITLE, OboLiteral.string(ontology.getName())
                    .toLiteralBox()));
        }
        for (final Reference root : ontology.getRootTerms()) {
            annotations.add(Annotation.create(IAO.HAS_ONTOLOGY_ROOT_TERM, root));
        }
        for (final OboAnnotation value : ontology.getPropertyValues()) {
            annotations.add(value.toAnnotation());
        }
        return annotations;
    }

    /**
     * Returns the axioms of a whole ontology: header declarations for root terms, subsets and
     * synonym types, then the axioms of each typedef and of each term.
     *
     * @param ontology
     *            the OBO ontology
     * @return the axioms, in order
     */
    public List<Axiom> getOntologyAxioms(final OboOntology ontology) {
        final List<Axiom> axioms = Lists.newArrayList();
        if (!ontology.getRootTerms().isEmpty()) {
            final Reference property = IAO.HAS_ONTOLOGY_ROOT_TERM;
            axioms.add(Declaration.create(property, EntityType.ANNOTATION_PROPERTY));
            axioms.add(Macro.label(property, property.getName()));
        }
        if (!ontology.getSubsetDefs().isEmpty()) {
            axioms.add(Declaration.create(OBOINOWL.SUBSET_PROPERTY,
                    EntityType.ANNOTATION_PROPERTY));
            for (final SubsetDef subset : ontology.getSubsetDefs()) {
                axioms.add(Declaration.create(subset, EntityType.ANNOTATION_PROPERTY));
                axioms.add(Macro.label(subset, subset.getLabel()));
                axioms.add(AnnotationAxiom.subAnnotationPropertyOf(subset,
                        OBOINOWL.SUBSET_PROPERTY));
            }
        }
        if (!ontology.getSynonymTypeDefs().isEmpty()) {
            axioms.add(Declaration.create(OBOINOWL.HAS_SCOPE, EntityType.ANNOTATION_PROPERTY));
            for (final SynonymTypeDef type : ontology.getSynonymTypeDefs()) {
                axioms.add(Declaration.create(type, EntityType.ANNOTATION_PROPERTY));
                axioms.add(Macro.label(type, type.getName()));
                axioms.add(AnnotationAxiom.subAnnotationPropertyOf(type,
                        OBOINOWL.SYNONYM_TYPE_PROPERTY));
                if (type.getSpecificity() != null) {
                    axioms.add(AnnotationAxiom.annotationAssertion(OBOINOWL.HAS_SCOPE, type,
                            type.getSpecificity().getProperty()));
                }
            }
        }
        for (final TypeDef typedef : ontology.getTypeDefs()) {
            axioms.addAll(getTypeDefAxioms(typedef));
        }
        for (final Term term : ontology.getTerms()) {
            axioms.addAll(getTermAxioms(term));
        }
        return axioms;
    }

    /**
     * Returns the axioms of a term or instance stanza.
     *
     * @param term
     *            the stanza
     * @return the axioms, in OBO tag order
     */
    public List<Axiom> getTermAxioms(final Term term) {
        final Reference s = term.getReference();
        final List<Axiom> axioms = Lists.newArrayList();
        if (!term.isInstance()) {
            axioms.add(Declaration.create(s, EntityType.CLASS));
            for (final Reference parent : term.getParents()) {
                axioms.add(ClassAxiom.subClassOf(s, parent));
            }
        } else {
            axioms.add(Declaration.create(s, EntityType.NAMED_INDIVIDUAL));
            for (final Reference parent : term.getParents()) {
                axioms.add(Assertion.classAssertion(parent, s));
            }
        }
        if (term.isAnonymous() != null) {
            axioms.add(Macro.isAnonymous(s, term.isAnonymous()));
        }
        if (term.getName() != null) {
            axioms.add(Macro.label(s, term.getName()));
        }
        if (term.getNamespace() != null) {
            axioms.add(Macro.oboNamespace(s, term.getNamespace()));
        }
        for (final Reference alt : term.getAltIds()) {
            axioms.add(Macro.replacedBy(alt, s));
        }
        addDefinition(axioms, term, s);
        for (final Reference subset : term.getSubsets()) {
            axioms.add(Macro.inSubset(s, subset));
        }
        addSynonyms(axioms, term, s);
        addXrefs(axioms, term, s);
        if (term.isBuiltin() != null) {
            axioms.add(Macro.isBuiltin(s, term.isBuiltin()));
        }
        addProperties(axioms, term, s);
        if (!term.getIntersectionOf().isEmpty()) {
            axioms.add(Macro.classIntersection(s, term.getIntersectionOf()));
        }
        if (!term.getUnionOf().isEmpty()) {
            axioms.add(Macro.classUnion(s, term.getUnionOf()));
        }
        if (!term.getEquivalentTo().isEmpty()) {
            axioms.add(ClassAxiom.equivalentClasses(ImmutableList.builder().add(s)
                    .addAll(term.getEquivalentTo()).build()));
        }
        if (!term.getDisjointFrom().isEmpty()) {
            axioms.add(ClassAxiom.disjointClasses(ImmutableList.builder().add(s)
                    .addAll(term.getDisjointFrom()).build()));
        }
        for (final Map.Entry<Reference, Reference> entry : term.getRelationships().entries()) {
            final Reference p = entry.getKey();
            final Reference o = entry.getValue();
            final List<Annotation> annotations = convert(term.getAnnotations(p, o));
            if (!term.isInstance()) {
                axioms.add(Macro.relationship(s, p, o, annotations));
            } else {
                axioms.add(Assertion.objectPropertyAssertion(p, s, o).withAnnotations(
                        annotations));
            }
        }
        if (term.isObsolete() != null) {
            axioms.add(Macro.isObsolete(s, term.isObsolete()));
        }
        LOGGER.debug("Converted term {} to {} axioms", s, axioms.size());
        return axioms;
    }

    /**
     * Returns the axioms of a typedef stanza. Metadata tags are converted to annotation
     * properties, other typedefs to object properties.
     *
     * @param typedef
     *            the stanza
     * @return the axioms, in OBO tag order
     */
    public List<Axiom> getTypeDefAxioms(final TypeDef typedef) {
        final Reference r = typedef.getReference();
        final boolean metadata = typedef.isMetadataTag();
        final List<Axiom> axioms = Lists.newArrayList();
        axioms.add(Declaration.create(r, metadata ? EntityType.ANNOTATION_PROPERTY
                : EntityType.OBJECT_PROPERTY));
        if (typedef.isAnonymous() != null) {
            axioms.add(Macro.isAnonymous(r, typedef.isAnonymous()));
        }
        if (typedef.getName() != null) {
            axioms.add(Macro.label(r, typedef.getName()));
        }
        if (typedef.getNamespace() != null) {
            axioms.add(Macro.oboNamespace(r, typedef.getNamespace()));
        }
        for (final Reference alt : typedef.getAltIds()) {
            axioms.add(Macro.replacedBy(alt, r));
        }
        addDefinition(axioms, typedef, r);
        if (typedef.getComment() != null) {
            axioms.add(Macro.comment(r, typedef.getComment()));
        }
        for (final Reference subset : typedef.getSubsets()) {
            axioms.add(Macro.inSubset(r, subset));
        }
        addSynonyms(axioms, typedef, r);
        addXrefs(axioms, typedef, r);
        addProperties(axioms, typedef, r);
        if (typedef.getDomain() != null) {
            axioms.add(metadata ? AnnotationAxiom.annotationPropertyDomain(r,
                    typedef.getDomain()) : ObjectPropertyAxiom.objectPropertyDomain(r,
                    typedef.getDomain()));
        }
        if (typedef.getRange() != null) {
            axioms.add(metadata ? AnnotationAxiom.annotationPropertyRange(r, typedef.getRange())
                    : ObjectPropertyAxiom.objectPropertyRange(r, typedef.getRange()));
        }
        if (typedef.isBuiltin() != null) {
            axioms.add(Macro.isBuiltin(r, typedef.isBuiltin()));
        }
        for (final List<Reference> chain : typedef.getHoldsOverChains()) {
            axioms.add(Macro.holdsOverChain(r, chain));
        }
        if (typedef.isAntiSymmetric()) {
            axioms.add(ObjectPropertyAxiom.asymmetric(r));
        }
        if (typedef.isCyclic() != null) {
            axioms.add(Macro.isCyclic(r, typedef.isCyclic()));
        }
        if (typedef.isReflexive()) {
            axioms.add(ObjectPropertyAxiom.reflexive(r));
        }
        if (typedef.isSymmetric()) {
            axioms.add(ObjectPropertyAxiom.symmetric(r));
        }
        if (typedef.isTransitive()) {
            axioms.add(ObjectPropertyAxiom.transitive(r));
        }
        if (typedef.isFunctional()) {
            axioms.add(ObjectPropertyAxiom.functional(r));
        }
        if (typedef.isInverseFunctional()) {
            axioms.add(ObjectPropertyAxiom.inverseFunctional(r));
        }
        for (final Reference parent : typedef.getParents()) {
            axioms.add(metadata ? AnnotationAxiom.subAnnotationPropertyOf(r, parent)
                    : ObjectPropertyAxiom.subObjectPropertyOf(r, parent));
        }
        if (!typedef.getEquivalentTo().isEmpty()) {
            axioms.add(ObjectPropertyAxiom.equivalentObjectProperties(ImmutableList.builder()
                    .add(r).addAll(typedef.getEquivalentTo()).build()));
        }
        for (final Reference disjoint : typedef.getDisjointFrom()) {
            axioms.add(ObjectPropertyAxiom.disjointObjectProperties(disjoint, r));
        }
        if (typedef.getInverse() != null) {
            axioms.add(ObjectPropertyAxiom.inverseObjectProperties(r, typedef.getInverse()));
        }
        for (final Reference over : typedef.getTransitiveOver()) {
            axioms.add(Macro.transitiveOver(r, over));
        }
        for (final List<Reference> chain : typedef.getEquivalentToChains()) {
            axioms.add(ObjectPropertyAxiom.subObjectPropertyOf(ObjectPropertyChain.create(chain),
                    r));
        }
        if (typedef.isObsolete() != null) {
            axioms.add(Macro.isObsolete(r, typedef.isObsolete()));
        }
        for (final Reference replacement : typedef.getReplacedBy()) {
            axioms.add(Macro.replacedBy(replacement, r));
        }
        for (final Reference reference : typedef.getSeeAlso()) {
            axioms.add(Macro.consider(r, reference));
        }
        if (typedef.isClassLevel() != null) {
            axioms.add(Macro.isClassLevel(r, typedef.isClassLevel()));
        }
        LOGGER.debug("Converted typedef {} to {} axioms", r, axioms.size());
        return axioms;
    }

    private static void addDefinition(final List<Axiom> axioms, final Stanza stanza,
            final Reference subject) {
        final String definition = stanza.getDefinition();
        if (definition != null) {
            axioms.add(Macro.description(subject, definition).withAnnotations(
                    convert(stanza.getAnnotations(DESCRIPTION, definition))));
        }
    }

    private static void addSynonyms(final List<Axiom> axioms, final Stanza stanza,
            final Reference subject) {
        for (final Synonym synonym : stanza.getSynonyms()) {
            axioms.add(Macro.synonym(subject, synonym.getName(), synonym.getScope(),
                    synonym.getLanguage(), synonym.getType(), synonym.getProvenance(),
                    convert(synonym.getAnnotations())));
        }
    }

    private static void addXrefs(final List<Axiom> axioms, final Stanza stanza,
            final Reference subject) {
        for (final Reference xref : stanza.getXrefs()) {
            axioms.add(Macro.xref(subject, xref, null,
                    convert(stanza.getAnnotations(OBOINOWL.HAS_DB_XREF, xref))));
        }
    }

    private static void addProperties(final List<Axiom> axioms, final Stanza stanza,
            final Reference subject) {
        for (final Map.Entry<Reference, Object> entry : stanza.getProperties().entries()) {
            final Reference property = entry.getKey();
            final Object value = entry.getValue();
            final List<Annotation> annotations = convert(stanza.getAnnotations(property, value));
            if (value instanceof OboLiteral) {
                axioms.add(AnnotationAxiom.annotationAssertion(property, subject,
                        ((OboLiteral) value).toLiteralBox()).withAnnotations(annotations));
            } else if (value instanceof Reference) {
                // alternative terms are emitted as term-replaced-by on the alternative id
                if (!property.equals(IAO.ALTERNATIVE_TERM)) {
                    axioms.add(AnnotationAxiom.annotationAssertion(property, subject, value)
                            .withAnnotations(annotations));
                }
            } else {
                throw new IllegalArgumentException("Unsupported value for property "
                        + property + " of " + subject + ": " + value);
            }
        }
    }

    private static List<Annotation> convert(final List<OboAnnotation> annotations) {
        final List<Annotation> result = Lists.newArrayListWithCapacity(annotations.size());
        for (final OboAnnotation annotation : annotations) {
            result.add(annotation.toAnnotation());
        }
        return result;
    }

}
