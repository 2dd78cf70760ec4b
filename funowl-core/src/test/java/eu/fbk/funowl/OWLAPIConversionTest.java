package eu.fbk.funowl;

import java.io.StringReader;
import java.io.StringWriter;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

import org.junit.Test;
import org.openrdf.model.Model;
import org.openrdf.model.Resource;
import org.openrdf.model.Statement;
import org.openrdf.model.URI;
import org.openrdf.model.Value;
import org.openrdf.model.impl.LinkedHashModel;
import org.openrdf.model.impl.URIImpl;
import org.openrdf.model.vocabulary.OWL;
import org.openrdf.model.vocabulary.RDF;
import org.openrdf.model.vocabulary.RDFS;
import org.openrdf.model.vocabulary.XMLSchema;
import org.openrdf.rio.RDFFormat;
import org.openrdf.rio.Rio;
import org.semanticweb.owlapi.apibinding.OWLManager;
import org.semanticweb.owlapi.formats.TurtleDocumentFormat;
import org.semanticweb.owlapi.io.StringDocumentSource;
import org.semanticweb.owlapi.io.StringDocumentTarget;
import org.semanticweb.owlapi.model.OWLOntology;
import org.semanticweb.owlapi.model.OWLOntologyManager;

import eu.fbk.funowl.data.Annotation;
import eu.fbk.funowl.data.AnnotationAxiom;
import eu.fbk.funowl.data.Assertion;
import eu.fbk.funowl.data.Axiom;
import eu.fbk.funowl.data.ClassAxiom;
import eu.fbk.funowl.data.ClassExpression;
import eu.fbk.funowl.data.DataPropertyAxiom;
import eu.fbk.funowl.data.DataRange;
import eu.fbk.funowl.data.DatatypeDefinition;
import eu.fbk.funowl.data.Declaration;
import eu.fbk.funowl.data.EntityType;
import eu.fbk.funowl.data.HasKey;
import eu.fbk.funowl.data.LiteralBox;
import eu.fbk.funowl.data.ObjectPropertyAxiom;
import eu.fbk.funowl.data.ObjectPropertyChain;
import eu.fbk.funowl.data.ObjectPropertyExpression;
import eu.fbk.funowl.data.RDFAssert;
import eu.fbk.funowl.data.RDFContext;
import eu.fbk.funowl.macro.Macro;
import eu.fbk.funowl.macro.MappingScope;
import eu.fbk.funowl.macro.SynonymScope;
import eu.fbk.funowl.vocabulary.OWL2;

/**
 * Checks that the RDF written for a document is isomorphic to the RDF the OWL API produces when
 * loading the functional syntax written for the same document.
 * <p>
 * Before comparison both graphs are normalized for the serialization choices on which the two
 * writers legitimately differ: the {@code rdf:List} typing of collection nodes, the order of
 * members in collections denoting sets (all collections except property chains), the shape of
 * equivalence and sameness links among named entities (all pairs or a chain), and the
 * declaration of built-in datatypes.
 * </p>
 */
public class OWLAPIConversionTest {

    private static final String IRI = "http://example.org/test.ofn";

    private static final URI MEMBER = new URIImpl("http://example.org/test#member");

    private static final Set<URI> EQUIVALENCES = ImmutableSet.of(OWL.EQUIVALENTCLASS,
            OWL.EQUIVALENTPROPERTY, OWL.SAMEAS);

    private static final Set<String> BUILTIN_NAMESPACES = ImmutableSet.of(RDF.NAMESPACE,
            RDFS.NAMESPACE, OWL.NAMESPACE, XMLSchema.NAMESPACE);

    private static final Annotation COMMENT = Annotation.create("rdfs:comment",
            LiteralBox.of("note"));

    @Test
    public void testDeclarations() throws Exception {
        assertConversion(Declaration.create("ex:A", EntityType.CLASS),
                Declaration.create("ex:p", EntityType.OBJECT_PROPERTY),
                Declaration.create("ex:d", EntityType.DATA_PROPERTY),
                Declaration.create("ex:ap", EntityType.ANNOTATION_PROPERTY),
                Declaration.create("ex:dt", EntityType.DATATYPE),
                Declaration.create("ex:a", EntityType.NAMED_INDIVIDUAL));
    }

    @Test
    public void testOntologyHeader() throws Exception {
        assertConversion(Ontology.builder().iri(IRI).versionIRI("http://example.org/1.0/test.ofn")
                .annotation(Annotation.create("dcterms:title", LiteralBox.of("Test")))
                .annotation(Annotation.create("rdfs:comment", LiteralBox.of("Commento", "it")))
                .axiom(ClassAxiom.subClassOf("ex:A", "ex:B")).build());
    }

    @Test
    public void testClassAxioms() throws Exception {
        assertConversion(ClassAxiom.subClassOf("ex:A", "ex:B").withAnnotations(COMMENT),
                ClassAxiom.disjointClasses("ex:A", "ex:C"),
                ClassAxiom.disjointClasses("ex:E", "ex:C", "ex:D").withAnnotations(COMMENT),
                ClassAxiom.disjointUnion("ex:F", "ex:H", "ex:G"));
    }

    @Test
    public void testEquivalentClasses() throws Exception {
        assertConversion(ClassAxiom.equivalentClasses("ex:A", "ex:B"),
                ClassAxiom.equivalentClasses("ex:C", "ex:D", "ex:E", "ex:F"),
                ClassAxiom.equivalentClasses("ex:G", ClassExpression.someValuesFrom("ex:p",
                        "ex:H")));
    }

    @Test
    public void testSameIndividual() throws Exception {
        assertConversion(Assertion.sameIndividual("ex:a", "ex:b"),
                Assertion.sameIndividual("ex:c", "ex:d", "ex:e"));
    }

    @Test
    public void testBooleanClassExpressions() throws Exception {
        assertConversion(
                ClassAxiom.subClassOf("ex:A", ClassExpression.intersectionOf("ex:C", "ex:B",
                        ClassExpression.complementOf("ex:D"))),
                ClassAxiom.subClassOf("ex:E", ClassExpression.unionOf("ex:G", "ex:F")),
                ClassAxiom.subClassOf("ex:H", ClassExpression.oneOf("ex:c", "ex:a", "ex:b")));
    }

    @Test
    public void testObjectRestrictions() throws Exception {
        assertConversion(
                ClassAxiom.subClassOf("ex:A", ClassExpression.someValuesFrom("ex:p", "ex:B")),
                ClassAxiom.subClassOf("ex:A", ClassExpression.allValuesFrom(
                        ObjectPropertyExpression.inverseOf("ex:q"), "ex:C")),
                ClassAxiom.subClassOf("ex:A", ClassExpression.hasValue("ex:p", "ex:a")),
                ClassAxiom.subClassOf("ex:A", ClassExpression.hasSelf("ex:r")),
                ClassAxiom.subClassOf("ex:A", ClassExpression.minCardinality(2, "ex:p")),
                ClassAxiom.subClassOf("ex:A", ClassExpression.maxCardinality(3, "ex:p",
                        "ex:B")),
                ClassAxiom.subClassOf("ex:A", ClassExpression.exactCardinality(1,
                        ObjectPropertyExpression.inverseOf("ex:q"), "ex:C")));
    }

    @Test
    public void testDataRestrictions() throws Exception {
        assertConversion(
                ClassAxiom.subClassOf("ex:A", ClassExpression.dataSomeValuesFrom("ex:d",
                        "xsd:string")),
                ClassAxiom.subClassOf("ex:A", ClassExpression.dataAllValuesFrom("ex:d",
                        DataRange.restriction("xsd:integer", DataRange.facet(
                                "xsd:minInclusive", 5), DataRange.facet("xsd:maxExclusive",
                                10)))),
                ClassAxiom.subClassOf("ex:A", ClassExpression.dataHasValue("ex:e", 42)),
                ClassAxiom.subClassOf("ex:A", ClassExpression.dataMinCardinality(1, "ex:d")),
                ClassAxiom.subClassOf("ex:A", ClassExpression.dataExactCardinality(2, "ex:e",
                        "xsd:integer")));
    }

    @Test
    public void testDataRanges() throws Exception {
        assertConversion(
                DataPropertyAxiom.dataPropertyRange("ex:d", DataRange.oneOf("c", "a", "b")),
                DataPropertyAxiom.dataPropertyRange("ex:e", DataRange.unionOf("xsd:string",
                        DataRange.intersectionOf("xsd:integer", DataRange.complementOf(
                                "xsd:boolean")))),
                DatatypeDefinition.create("ex:dt", DataRange.restriction("xsd:integer",
                        DataRange.facet("xsd:minInclusive", 0))));
    }

    @Test
    public void testObjectPropertyAxioms() throws Exception {
        assertConversion(ObjectPropertyAxiom.subObjectPropertyOf("ex:p", "ex:q"),
                ObjectPropertyAxiom.subObjectPropertyOf(ObjectPropertyChain.create(
                        ObjectPropertyExpression.inverseOf("ex:s"), "ex:q"), "ex:r"),
                ObjectPropertyAxiom.inverseObjectProperties("ex:p", "ex:t"),
                ObjectPropertyAxiom.disjointObjectProperties("ex:u", "ex:w", "ex:v"),
                ObjectPropertyAxiom.objectPropertyDomain(
                        ObjectPropertyExpression.inverseOf("ex:p"), "ex:A"),
                ObjectPropertyAxiom.objectPropertyRange("ex:p", "ex:B"),
                ObjectPropertyAxiom.transitive("ex:q"),
                ObjectPropertyAxiom.functional("ex:t").withAnnotations(COMMENT),
                ObjectPropertyAxiom.asymmetric(ObjectPropertyExpression.inverseOf("ex:u")));
    }

    @Test
    public void testDataPropertyAxioms() throws Exception {
        assertConversion(DataPropertyAxiom.subDataPropertyOf("ex:d", "ex:e"),
                DataPropertyAxiom.equivalentDataProperties("ex:f", "ex:g"),
                DataPropertyAxiom.disjointDataProperties("ex:h", "ex:f", "ex:d"),
                DataPropertyAxiom.dataPropertyDomain("ex:d", "ex:A"),
                DataPropertyAxiom.dataPropertyRange("ex:e", "xsd:integer"),
                DataPropertyAxiom.functionalDataProperty("ex:e"));
    }

    @Test
    public void testHasKey() throws Exception {
        assertConversion(HasKey.create("ex:A", ImmutableList.of(
                ObjectPropertyExpression.inverseOf("ex:p"), "ex:q"), ImmutableList.of("ex:d")));
    }

    @Test
    public void testAssertions() throws Exception {
        assertConversion(Assertion.classAssertion("ex:A", "ex:a"),
                Assertion.classAssertion(ClassExpression.someValuesFrom("ex:p", "ex:B"),
                        "ex:b"),
                Assertion.differentIndividuals("ex:c", "ex:a", "ex:b"),
                Assertion.objectPropertyAssertion("ex:p", "ex:a", "ex:b"),
                Assertion.objectPropertyAssertion(ObjectPropertyExpression.inverseOf("ex:q"),
                        "ex:a", "ex:c"),
                Assertion.dataPropertyAssertion("ex:d", "ex:a", 42),
                Assertion.dataPropertyAssertion("ex:e", "ex:b", LiteralBox.of("x", "en")));
    }

    @Test
    public void testNegativeAssertions() throws Exception {
        assertConversion(Assertion.negativeObjectPropertyAssertion("ex:p", "ex:a", "ex:b"),
                Assertion.negativeObjectPropertyAssertion(
                        ObjectPropertyExpression.inverseOf("ex:q"), "ex:a", "ex:c"),
                Assertion.negativeDataPropertyAssertion("ex:d", "ex:a", "x").withAnnotations(
                        COMMENT));
    }

    @Test
    public void testAnnotationAxioms() throws Exception {
        assertConversion(AnnotationAxiom.annotationAssertion("rdfs:label", "ex:A",
                LiteralBox.of("A", "en")), AnnotationAxiom.annotationAssertion("ex:ap", "ex:A",
                "ex:B").withAnnotations(COMMENT), AnnotationAxiom.subAnnotationPropertyOf(
                "ex:ap", "ex:aq"), AnnotationAxiom.annotationPropertyDomain("ex:aq", "ex:A"),
                AnnotationAxiom.annotationPropertyRange("ex:aq", "xsd:string"));
    }

    @Test
    public void testNestedAnnotations() throws Exception {
        assertConversion(ClassAxiom.subClassOf("ex:A", "ex:B").withAnnotations(
                Annotation.create("rdfs:comment", LiteralBox.of("outer"), Annotation.create(
                        "rdfs:seeAlso", "ex:source", Annotation.create("rdfs:comment",
                                LiteralBox.of("inner"))))));
    }

    @Test
    public void testMacros() throws Exception {
        assertConversion(Macro.label("ex:A", "A"), Macro.description("ex:A", "An A"),
                Macro.synonym("ex:A", "alpha", SynonymScope.BROAD, "en", "OMO:0003000",
                        ImmutableList.of("orcid:0000-0001"),
                        Collections.<Annotation>emptyList()),
                Macro.xref("ex:A", "ex:X"), Macro.mapping("ex:A", MappingScope.EXACT, "ex:Y",
                        "semapv:ManualMappingCuration", Collections.<Annotation>emptyList()),
                Macro.isObsolete("ex:B", true), Macro.replacedBy("ex:B", "ex:A"),
                Macro.relationship("ex:A", "ex:p", "ex:C"),
                Macro.transitiveOver("ex:p", "ex:q"),
                Macro.classIntersection("ex:D", ImmutableList.of("ex:A",
                        Maps.immutableEntry("ex:p", "ex:C"))));
    }

    private static void assertConversion(final Axiom... axioms) throws Exception {
        assertConversion(Ontology.builder().iri(IRI).axioms(Arrays.asList(axioms)).build());
    }

    private static void assertConversion(final Ontology ontology) throws Exception {
        final Document document = new Document(RDFAssert.CONVERTER.getPrefixes(), ontology);
        final StringWriter functional = new StringWriter();
        document.writeFunctional(functional);
        final StringWriter rdf = new StringWriter();
        document.writeRDF(rdf, RDFFormat.TURTLE);
        final Model expected = normalize(convert(functional.toString()));
        final Model actual = normalize(parse(rdf.toString()));
        RDFAssert.assertModel(expected, actual);
    }

    private static Model convert(final String functional) throws Exception {
        final OWLOntologyManager manager = OWLManager.createOWLOntologyManager();
        final OWLOntology ontology = manager.loadOntologyFromOntologyDocument(
                new StringDocumentSource(functional));
        final StringDocumentTarget target = new StringDocumentTarget();
        manager.saveOntology(ontology, new TurtleDocumentFormat(), target);
        return parse(target.toString());
    }

    private static Model parse(final String turtle) throws Exception {
        return Rio.parse(new StringReader(turtle), IRI, RDFFormat.TURTLE);
    }

    private static Model normalize(final Model model) {
        final Set<Value> tails = Sets.newHashSet(model.filter(null, RDF.REST, null).objects());
        final Set<Resource> ordered = Sets.newHashSet();
        for (final Value head : model.filter(null, OWL2.PROPERTY_CHAIN_AXIOM, null).objects()) {
            for (Resource cell = (Resource) head; cell != null && !RDF.NIL.equals(cell); cell = next(
                    model, cell)) {
                ordered.add(cell);
            }
        }

        final Model result = new LinkedHashModel();
        for (final Statement statement : model) {
            final Resource subject = statement.getSubject();
            final URI predicate = statement.getPredicate();
            final Value object = statement.getObject();
            if (predicate.equals(RDF.TYPE)
                    && (object.equals(RDF.LIST) || object.equals(RDFS.DATATYPE)
                            && subject instanceof URI
                            && BUILTIN_NAMESPACES.contains(((URI) subject).getNamespace()))) {
                continue;
            }
            if ((predicate.equals(RDF.FIRST) || predicate.equals(RDF.REST))
                    && !ordered.contains(subject)) {
                continue;
            }
            if (EQUIVALENCES.contains(predicate) && subject instanceof URI
                    && object instanceof URI) {
                continue;
            }
            result.add(subject, predicate, object);
        }

        // set-valued collections become unordered member links from the head node
        for (final Resource head : model.filter(null, RDF.FIRST, null).subjects()) {
            if (!tails.contains(head) && !ordered.contains(head)) {
                for (Resource cell = head; cell != null && !RDF.NIL.equals(cell); cell = next(
                        model, cell)) {
                    for (final Value member : model.filter(cell, RDF.FIRST, null).objects()) {
                        result.add(head, MEMBER, member);
                    }
                }
            }
        }

        // equivalent named entities are linked to the smallest member of their group
        for (final URI predicate : EQUIVALENCES) {
            for (final Set<Value> group : group(model, predicate)) {
                final Value first = RDFContext.NODE_ORDERING.min(group);
                for (final Value member : group) {
                    if (!member.equals(first)) {
                        result.add((Resource) first, predicate, member);
                    }
                }
            }
        }
        return result;
    }

    private static Resource next(final Model model, final Resource cell) {
        final Value rest = model.filter(cell, RDF.REST, null).objectValue();
        return rest instanceof Resource ? (Resource) rest : null;
    }

    private static List<Set<Value>> group(final Model model, final URI predicate) {
        final List<Set<Value>> groups = Lists.newArrayList();
        for (final Statement statement : model.filter(null, predicate, null)) {
            if (statement.getSubject() instanceof URI && statement.getObject() instanceof URI) {
                final Set<Value> merged = Sets.<Value>newHashSet(statement.getSubject(),
                        statement.getObject());
                for (final Iterator<Set<Value>> i = groups.iterator(); i.hasNext();) {
                    final Set<Value> group = i.next();
                    if (!Collections.disjoint(group, merged)) {
                        merged.addAll(group);
                        i.remove();
                    }
                }
                groups.add(merged);
            }
        }
        return groups;
    }

}
