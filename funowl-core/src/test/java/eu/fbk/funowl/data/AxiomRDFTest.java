package eu.fbk.funowl.data;

import java.util.Collections;

import com.google.common.collect.ImmutableList;

import org.junit.Test;

public class AxiomRDFTest {

    private static final Annotation COMMENT = Annotation.create("rdfs:comment",
            LiteralBox.of("note"));

    @Test
    public void testDeclaration() {
        RDFAssert.assertRDF("ex:A a owl:Class .", Declaration.create("ex:A", EntityType.CLASS));
        RDFAssert.assertRDF("ex:d a owl:DatatypeProperty .", Declaration.create("ex:d",
                EntityType.DATA_PROPERTY));
    }

    @Test
    public void testSubClassOf() {
        RDFAssert.assertRDF("ex:A a owl:Class; rdfs:subClassOf ex:B . ex:B a owl:Class .",
                ClassAxiom.subClassOf("ex:A", "ex:B"));
    }

    @Test
    public void testAnnotatedSubClassOf() {
        RDFAssert.assertRDF("ex:A a owl:Class; rdfs:subClassOf ex:B . ex:B a owl:Class . "
                + "[] a owl:Axiom; owl:annotatedSource ex:A; "
                + "owl:annotatedProperty rdfs:subClassOf; owl:annotatedTarget ex:B; "
                + "rdfs:comment \"note\" .", ClassAxiom.subClassOf("ex:A", "ex:B")
                .withAnnotations(COMMENT));
    }

    @Test
    public void testEquivalentClasses() {
        RDFAssert.assertRDF("ex:A a owl:Class; owl:equivalentClass ex:B, ex:C . "
                + "ex:B a owl:Class; owl:equivalentClass ex:C . ex:C a owl:Class .",
                ClassAxiom.equivalentClasses("ex:A", "ex:B", "ex:C"));
    }

    @Test
    public void testDisjointClasses() {
        RDFAssert.assertRDF("ex:A a owl:Class; owl:disjointWith ex:B . ex:B a owl:Class .",
                ClassAxiom.disjointClasses("ex:A", "ex:B"));
        RDFAssert.assertRDF("ex:A a owl:Class . ex:B a owl:Class . ex:C a owl:Class . "
                + "[] a owl:AllDisjointClasses; owl:members (ex:A ex:B ex:C); "
                + "rdfs:comment \"note\" .", ClassAxiom.disjointClasses("ex:C", "ex:A", "ex:B")
                .withAnnotations(COMMENT));
    }

    @Test
    public void testDisjointUnion() {
        RDFAssert.assertRDF("ex:A a owl:Class; owl:disjointUnionOf (ex:C ex:B) . "
                + "ex:B a owl:Class . ex:C a owl:Class .",
                ClassAxiom.disjointUnion("ex:A", "ex:C", "ex:B"));
    }

    @Test
    public void testPropertyChain() {
        RDFAssert.assertRDF("ex:r a owl:ObjectProperty; owl:propertyChainAxiom "
                + "([ owl:inverseOf ex:p ] ex:q) . ex:p a owl:ObjectProperty . "
                + "ex:q a owl:ObjectProperty .", ObjectPropertyAxiom.subObjectPropertyOf(
                ObjectPropertyChain.create(ObjectPropertyExpression.inverseOf("ex:p"), "ex:q"),
                "ex:r"));
    }

    @Test
    public void testObjectPropertyAxioms() {
        RDFAssert.assertRDF("ex:p a owl:ObjectProperty; rdfs:subPropertyOf ex:q . "
                + "ex:q a owl:ObjectProperty .",
                ObjectPropertyAxiom.subObjectPropertyOf("ex:p", "ex:q"));
        RDFAssert.assertRDF("ex:p a owl:ObjectProperty; owl:inverseOf ex:q . "
                + "ex:q a owl:ObjectProperty .",
                ObjectPropertyAxiom.inverseObjectProperties("ex:p", "ex:q"));
        RDFAssert.assertRDF("ex:p a owl:ObjectProperty, owl:TransitiveProperty .",
                ObjectPropertyAxiom.transitive("ex:p"));
        RDFAssert.assertRDF("ex:p a owl:ObjectProperty . ex:A a owl:Class . "
                + "[ owl:inverseOf ex:p ] rdfs:domain ex:A .",
                ObjectPropertyAxiom.objectPropertyDomain(
                        ObjectPropertyExpression.inverseOf("ex:p"), "ex:A"));
    }

    @Test
    public void testDisjointProperties() {
        RDFAssert.assertRDF("ex:p a owl:ObjectProperty; owl:propertyDisjointWith ex:q . "
                + "ex:q a owl:ObjectProperty .",
                ObjectPropertyAxiom.disjointObjectProperties("ex:p", "ex:q"));
        RDFAssert.assertRDF("ex:d a owl:DatatypeProperty . ex:e a owl:DatatypeProperty . "
                + "ex:f a owl:DatatypeProperty . "
                + "[] a owl:AllDisjointProperties; owl:members (ex:d ex:e ex:f) .",
                DataPropertyAxiom.disjointDataProperties("ex:f", "ex:d", "ex:e"));
    }

    @Test
    public void testDataPropertyAxioms() {
        RDFAssert.assertRDF("ex:d a owl:DatatypeProperty; rdfs:range xsd:integer .",
                DataPropertyAxiom.dataPropertyRange("ex:d", "xsd:integer"));
        RDFAssert.assertRDF("ex:d a owl:DatatypeProperty, owl:FunctionalProperty .",
                DataPropertyAxiom.functionalDataProperty("ex:d"));
        RDFAssert.assertRDF("ex:d a owl:DatatypeProperty; owl:equivalentProperty ex:e . "
                + "ex:e a owl:DatatypeProperty .",
                DataPropertyAxiom.equivalentDataProperties("ex:d", "ex:e"));
    }

    @Test
    public void testDatatypeDefinition() {
        RDFAssert.assertRDF("ex:dt a rdfs:Datatype; owl:equivalentClass "
                + "[ a rdfs:Datatype; owl:datatypeComplementOf xsd:string ] .",
                DatatypeDefinition.create("ex:dt", DataRange.complementOf("xsd:string")));
    }

    @Test
    public void testHasKey() {
        RDFAssert.assertRDF("ex:A a owl:Class; owl:hasKey ([ owl:inverseOf ex:p ] ex:d) . "
                + "ex:p a owl:ObjectProperty . ex:d a owl:DatatypeProperty .",
                HasKey.create("ex:A", ImmutableList.of(ObjectPropertyExpression.inverseOf(
                        "ex:p")), ImmutableList.of("ex:d")));
    }

    @Test
    public void testIndividualAssertions() {
        RDFAssert.assertRDF("ex:a a owl:NamedIndividual, ex:A . ex:A a owl:Class .",
                Assertion.classAssertion("ex:A", "ex:a"));
        RDFAssert.assertRDF("ex:a a owl:NamedIndividual; owl:sameAs ex:b . "
                + "ex:b a owl:NamedIndividual .", Assertion.sameIndividual("ex:a", "ex:b"));
        RDFAssert.assertRDF("ex:a a owl:NamedIndividual . ex:b a owl:NamedIndividual . "
                + "ex:c a owl:NamedIndividual . "
                + "[] a owl:AllDifferent; owl:distinctMembers (ex:c ex:a ex:b) .",
                Assertion.differentIndividuals("ex:c", "ex:a", "ex:b"));
    }

    @Test
    public void testObjectPropertyAssertion() {
        RDFAssert.assertRDF("ex:a a owl:NamedIndividual; ex:p ex:b . "
                + "ex:b a owl:NamedIndividual . ex:p a owl:ObjectProperty .",
                Assertion.objectPropertyAssertion("ex:p", "ex:a", "ex:b"));
        RDFAssert.assertRDF("ex:a a owl:NamedIndividual . ex:b a owl:NamedIndividual; ex:p ex:a . "
                + "ex:p a owl:ObjectProperty .", Assertion.objectPropertyAssertion(
                ObjectPropertyExpression.inverseOf("ex:p"), "ex:a", "ex:b"));
    }

    @Test
    public void testNegativeAssertions() {
        RDFAssert.assertRDF("ex:a a owl:NamedIndividual . ex:b a owl:NamedIndividual . "
                + "ex:p a owl:ObjectProperty . [] a owl:NegativePropertyAssertion; "
                + "owl:sourceIndividual ex:a; owl:assertionProperty [ owl:inverseOf ex:p ]; "
                + "owl:targetIndividual ex:b .", Assertion.negativeObjectPropertyAssertion(
                ObjectPropertyExpression.inverseOf("ex:p"), "ex:a", "ex:b"));
        RDFAssert.assertRDF("ex:a a owl:NamedIndividual . ex:d a owl:DatatypeProperty . "
                + "[] a owl:NegativePropertyAssertion; owl:sourceIndividual ex:a; "
                + "owl:assertionProperty ex:d; owl:targetValue \"x\"; rdfs:comment \"note\" .",
                Assertion.negativeDataPropertyAssertion("ex:d", "ex:a", "x").withAnnotations(
                        COMMENT));
    }

    @Test
    public void testDataPropertyAssertion() {
        RDFAssert.assertRDF("ex:a a owl:NamedIndividual; ex:d 42 . "
                + "ex:d a owl:DatatypeProperty .",
                Assertion.dataPropertyAssertion("ex:d", "ex:a", 42));
    }

    @Test
    public void testAnnotationAxioms() {
        RDFAssert.assertRDF("ex:A rdfs:label \"A\"@en .", AnnotationAxiom.annotationAssertion(
                "rdfs:label", "ex:A", LiteralBox.of("A", "en")));
        RDFAssert.assertRDF("ex:ap a owl:AnnotationProperty; rdfs:subPropertyOf ex:aq . "
                + "ex:aq a owl:AnnotationProperty .",
                AnnotationAxiom.subAnnotationPropertyOf("ex:ap", "ex:aq"));
        RDFAssert.assertRDF("ex:ap a owl:AnnotationProperty; rdfs:range xsd:string .",
                AnnotationAxiom.annotationPropertyRange("ex:ap", "xsd:string"));
    }

    @Test
    public void testAnnotationPropertiesDeclared() {
        RDFAssert.assertRDF("ex:A a owl:Class . ex:ap a owl:AnnotationProperty . "
                + "ex:A ex:ap ex:B . [] a owl:Axiom; owl:annotatedSource ex:A; "
                + "owl:annotatedProperty ex:ap; owl:annotatedTarget ex:B; "
                + "rdfs:comment \"note\" .", Declaration.create("ex:A", EntityType.CLASS),
                AnnotationAxiom.annotationAssertion("ex:ap", "ex:A", "ex:B").withAnnotations(
                        Collections.singletonList(COMMENT)));
    }

}
