package eu.fbk.funowl.vocabulary;

import org.openrdf.model.Namespace;
import org.openrdf.model.URI;
import org.openrdf.model.impl.NamespaceImpl;
import org.openrdf.model.impl.ValueFactoryImpl;

/**
 * Constants for the OWL 2 vocabulary, as used by the RDF mapping of OWL 2 ontologies.
 *
 * @see <a href="https://www.w3.org/TR/owl2-mapping-to-rdf/">OWL 2 mapping to RDF graphs</a>
 */
public final class OWL2 {

    /** Recommended prefix for the vocabulary namespace: "owl". */
    public static final String PREFIX = "owl";

    /** Vocabulary namespace: "http://www.w3.org/2002/07/owl#". */
    public static final String NAMESPACE = "http://www.w3.org/2002/07/owl#";

    /** Immutable {@link Namespace} constant for the vocabulary namespace. */
    public static final Namespace NS = new NamespaceImpl(PREFIX, NAMESPACE);

    // CLASSES

    /** Class owl:Class. */
    public static final URI CLASS = createURI("Class");

    /** Class owl:Thing. */
    public static final URI THING = createURI("Thing");

    /** Class owl:Nothing. */
    public static final URI NOTHING = createURI("Nothing");

    /** Class owl:ObjectProperty. */
    public static final URI OBJECT_PROPERTY = createURI("ObjectProperty");

    /** Class owl:DatatypeProperty. */
    public static final URI DATATYPE_PROPERTY = createURI("DatatypeProperty");

    /** Class owl:AnnotationProperty. */
    public static final URI ANNOTATION_PROPERTY = createURI("AnnotationProperty");

    /** Class owl:NamedIndividual. */
    public static final URI NAMED_INDIVIDUAL = createURI("NamedIndividual");

    /** Class owl:Restriction. */
    public static final URI RESTRICTION = createURI("Restriction");

    /** Class owl:Axiom. */
    public static final URI AXIOM = createURI("Axiom");

    /** Class owl:Annotation. */
    public static final URI ANNOTATION = createURI("Annotation");

    /** Class owl:AllDisjointClasses. */
    public static final URI ALL_DISJOINT_CLASSES = createURI("AllDisjointClasses");

    /** Class owl:AllDisjointProperties. */
    public static final URI ALL_DISJOINT_PROPERTIES = createURI("AllDisjointProperties");

    /** Class owl:AllDifferent. */
    public static final URI ALL_DIFFERENT = createURI("AllDifferent");

    /** Class owl:NegativePropertyAssertion. */
    public static final URI NEGATIVE_PROPERTY_ASSERTION = createURI("NegativePropertyAssertion");

    /** Class owl:Ontology. */
    public static final URI ONTOLOGY = createURI("Ontology");

    /** Class owl:FunctionalProperty. */
    public static final URI FUNCTIONAL_PROPERTY = createURI("FunctionalProperty");

    /** Class owl:InverseFunctionalProperty. */
    public static final URI INVERSE_FUNCTIONAL_PROPERTY = createURI("InverseFunctionalProperty");

    /** Class owl:ReflexiveProperty. */
    public static final URI REFLEXIVE_PROPERTY = createURI("ReflexiveProperty");

    /** Class owl:IrreflexiveProperty. */
    public static final URI IRREFLEXIVE_PROPERTY = createURI("IrreflexiveProperty");

    /** Class owl:SymmetricProperty. */
    public static final URI SYMMETRIC_PROPERTY = createURI("SymmetricProperty");

    /** Class owl:AsymmetricProperty. */
    public static final URI ASYMMETRIC_PROPERTY = createURI("AsymmetricProperty");

    /** Class owl:TransitiveProperty. */
    public static final URI TRANSITIVE_PROPERTY = createURI("TransitiveProperty");

    // PROPERTIES

    /** Property owl:intersectionOf. */
    public static final URI INTERSECTION_OF = createURI("intersectionOf");

    /** Property owl:unionOf. */
    public static final URI UNION_OF = createURI("unionOf");

    /** Property owl:complementOf. */
    public static final URI COMPLEMENT_OF = createURI("complementOf");

    /** Property owl:oneOf. */
    public static final URI ONE_OF = createURI("oneOf");

    /** Property owl:datatypeComplementOf. */
    public static final URI DATATYPE_COMPLEMENT_OF = createURI("datatypeComplementOf");

    /** Property owl:onDatatype. */
    public static final URI ON_DATATYPE = createURI("onDatatype");

    /** Property owl:withRestrictions. */
    public static final URI WITH_RESTRICTIONS = createURI("withRestrictions");

    /** Property owl:onProperty. */
    public static final URI ON_PROPERTY = createURI("onProperty");

    /** Property owl:onProperties. */
    public static final URI ON_PROPERTIES = createURI("onProperties");

    /** Property owl:someValuesFrom. */
    public static final URI SOME_VALUES_FROM = createURI("someValuesFrom");

    /** Property owl:allValuesFrom. */
    public static final URI ALL_VALUES_FROM = createURI("allValuesFrom");

    /** Property owl:hasValue. */
    public static final URI HAS_VALUE = createURI("hasValue");

    /** Property owl:hasSelf. */
    public static final URI HAS_SELF = createURI("hasSelf");

    /** Property owl:minCardinality. */
    public static final URI MIN_CARDINALITY = createURI("minCardinality");

    /** Property owl:maxCardinality. */
    public static final URI MAX_CARDINALITY = createURI("maxCardinality");

    /** Property owl:cardinality. */
    public static final URI CARDINALITY = createURI("cardinality");

    /** Property owl:minQualifiedCardinality. */
    public static final URI MIN_QUALIFIED_CARDINALITY = createURI("minQualifiedCardinality");

    /** Property owl:maxQualifiedCardinality. */
    public static final URI MAX_QUALIFIED_CARDINALITY = createURI("maxQualifiedCardinality");

    /** Property owl:qualifiedCardinality. */
    public static final URI QUALIFIED_CARDINALITY = createURI("qualifiedCardinality");

    /** Property owl:onClass. */
    public static final URI ON_CLASS = createURI("onClass");

    /** Property owl:onDataRange. */
    public static final URI ON_DATA_RANGE = createURI("onDataRange");

    /** Property owl:equivalentClass. */
    public static final URI EQUIVALENT_CLASS = createURI("equivalentClass");

    /** Property owl:disjointWith. */
    public static final URI DISJOINT_WITH = createURI("disjointWith");

    /** Property owl:members. */
    public static final URI MEMBERS = createURI("members");

    /** Property owl:disjointUnionOf. */
    public static final URI DISJOINT_UNION_OF = createURI("disjointUnionOf");

    /** Property owl:propertyChainAxiom. */
    public static final URI PROPERTY_CHAIN_AXIOM = createURI("propertyChainAxiom");

    /** Property owl:equivalentProperty. */
    public static final URI EQUIVALENT_PROPERTY = createURI("equivalentProperty");

    /** Property owl:propertyDisjointWith. */
    public static final URI PROPERTY_DISJOINT_WITH = createURI("propertyDisjointWith");

    /** Property owl:inverseOf. */
    public static final URI INVERSE_OF = createURI("inverseOf");

    /** Property owl:hasKey. */
    public static final URI HAS_KEY = createURI("hasKey");

    /** Property owl:sameAs. */
    public static final URI SAME_AS = createURI("sameAs");

    /** Property owl:differentFrom. */
    public static final URI DIFFERENT_FROM = createURI("differentFrom");

    /** Property owl:distinctMembers. */
    public static final URI DISTINCT_MEMBERS = createURI("distinctMembers");

    /** Property owl:sourceIndividual. */
    public static final URI SOURCE_INDIVIDUAL = createURI("sourceIndividual");

    /** Property owl:assertionProperty. */
    public static final URI ASSERTION_PROPERTY = createURI("assertionProperty");

    /** Property owl:targetIndividual. */
    public static final URI TARGET_INDIVIDUAL = createURI("targetIndividual");

    /** Property owl:targetValue. */
    public static final URI TARGET_VALUE = createURI("targetValue");

    /** Property owl:annotatedSource. */
    public static final URI ANNOTATED_SOURCE = createURI("annotatedSource");

    /** Property owl:annotatedProperty. */
    public static final URI ANNOTATED_PROPERTY = createURI("annotatedProperty");

    /** Property owl:annotatedTarget. */
    public static final URI ANNOTATED_TARGET = createURI("annotatedTarget");

    /** Property owl:imports. */
    public static final URI IMPORTS = createURI("imports");

    /** Property owl:versionIRI. */
    public static final URI VERSION_IRI = createURI("versionIRI");

    /** Property owl:deprecated. */
    public static final URI DEPRECATED = createURI("deprecated");

    /** Property owl:versionInfo. */
    public static final URI VERSION_INFO = createURI("versionInfo");

    /** Property owl:priorVersion. */
    public static final URI PRIOR_VERSION = createURI("priorVersion");

    /** Property owl:backwardCompatibleWith. */
    public static final URI BACKWARD_COMPATIBLE_WITH = createURI("backwardCompatibleWith");

    /** Property owl:incompatibleWith. */
    public static final URI INCOMPATIBLE_WITH = createURI("incompatibleWith");

    // BUILT-IN ENTITIES

    /** Property owl:topObjectProperty. */
    public static final URI TOP_OBJECT_PROPERTY = createURI("topObjectProperty");

    /** Property owl:bottomObjectProperty. */
    public static final URI BOTTOM_OBJECT_PROPERTY = createURI("bottomObjectProperty");

    /** Property owl:topDataProperty. */
    public static final URI TOP_DATA_PROPERTY = createURI("topDataProperty");

    /** Property owl:bottomDataProperty. */
    public static final URI BOTTOM_DATA_PROPERTY = createURI("bottomDataProperty");

    /** Datatype owl:real. */
    public static final URI REAL = createURI("real");

    /** Datatype owl:rational. */
    public static final URI RATIONAL = createURI("rational");

    // HELPER METHODS

    private static URI createURI(final String localName) {
        return ValueFactoryImpl.getInstance().createURI(NAMESPACE, localName);
    }

    private OWL2() {
    }

}
