package eu.fbk.funowl.data;

import java.util.Collections;

import com.google.common.collect.ImmutableList;

import org.junit.Assert;
import org.junit.Test;
import org.openrdf.model.Resource;
import org.openrdf.model.URI;
import org.openrdf.model.Value;
import org.openrdf.model.impl.URIImpl;
import org.openrdf.model.vocabulary.RDF;
import org.openrdf.model.vocabulary.RDFS;
import org.openrdf.model.vocabulary.XMLSchema;

import eu.fbk.funowl.data.RDFContext.Reification;

public class RDFContextTest {

    private static final URI A = new URIImpl("http://example.org/a");

    private static final URI B = new URIImpl("http://example.org/b");

    private static final URI P = new URIImpl("http://example.org/p");

    @Test
    public void testDeclare() {
        final RDFContext context = new RDFContext(RDFAssert.CONVERTER);
        Assert.assertEquals(A, context.declare(IdentifierBox.of("ex:a"), EntityType.CLASS));
        context.declare(IdentifierBox.of("owl:Thing"), EntityType.CLASS);
        context.declare(IdentifierBox.of("rdfs:label"), EntityType.ANNOTATION_PROPERTY);
        context.declare(IdentifierBox.of("xsd:string"), EntityType.DATATYPE);
        RDFAssert.assertModel(RDFAssert.parse("ex:a a owl:Class ."), context.getModel());
    }

    @Test
    public void testBuiltin() {
        Assert.assertTrue(RDFContext.isBuiltin(XMLSchema.INTEGER, EntityType.DATATYPE));
        Assert.assertTrue(RDFContext.isBuiltin(RDFS.LITERAL, EntityType.DATATYPE));
        Assert.assertTrue(RDFContext.isBuiltin(RDFS.COMMENT, EntityType.ANNOTATION_PROPERTY));
        Assert.assertFalse(RDFContext.isBuiltin(RDFS.COMMENT, EntityType.CLASS));
        Assert.assertFalse(RDFContext.isBuiltin(A, EntityType.NAMED_INDIVIDUAL));
    }

    @Test
    public void testSequence() {
        final RDFContext context = new RDFContext(RDFAssert.CONVERTER);
        Assert.assertEquals(RDF.NIL, context.sequence(Collections.<Value>emptyList(), false));
        final Resource head = context.sequence(ImmutableList.of(A, B), true);
        context.add(P, RDFS.RANGE, head);
        RDFAssert.assertModel(RDFAssert.parse("ex:p rdfs:range [ a rdf:List; rdf:first ex:a; "
                + "rdf:rest [ a rdf:List; rdf:first ex:b; rdf:rest rdf:nil ] ] ."),
                context.getModel());
    }

    @Test
    public void testReify() {
        final RDFContext context = new RDFContext(RDFAssert.CONVERTER);
        Assert.assertNull(context.reify(A, P, B, Collections.<Annotation>emptyList(),
                Reification.AXIOM));
        Assert.assertNotNull(context.reify(A, P, B, Collections.<Annotation>emptyList(),
                Reification.NEGATIVE_PROPERTY_ASSERTION));
        RDFAssert.assertModel(RDFAssert.parse("[] a owl:NegativePropertyAssertion; "
                + "owl:sourceIndividual ex:a; owl:assertionProperty ex:p; "
                + "owl:targetIndividual ex:b ."), context.getModel());
    }

    @Test
    public void testAddTriple() {
        final RDFContext context = new RDFContext(RDFAssert.CONVERTER);
        Assert.assertEquals(A, context.addTriple(A, P, B, Collections.<Annotation>emptyList()));
        final Resource node = context.addTriple(B, P, A, ImmutableList.of(Annotation.create(
                "rdfs:comment", LiteralBox.of("note"), Annotation.create("ex:q", "ex:a"))));
        Assert.assertNotEquals(B, node);
        RDFAssert.assertModel(RDFAssert.parse("ex:a ex:p ex:b . ex:b ex:p ex:a . "
                + "ex:q a owl:AnnotationProperty . "
                + "_:x a owl:Axiom; owl:annotatedSource ex:b; owl:annotatedProperty ex:p; "
                + "owl:annotatedTarget ex:a; rdfs:comment \"note\" . "
                + "_:y a owl:Annotation; owl:annotatedSource _:x; "
                + "owl:annotatedProperty rdfs:comment; owl:annotatedTarget \"note\"; "
                + "ex:q ex:a ."), context.getModel());
    }

    @Test
    public void testNodeOrdering() {
        Assert.assertEquals(ImmutableList.of(A, B), RDFContext.NODE_ORDERING.sortedCopy(
                ImmutableList.of(B, A)));
    }

}
