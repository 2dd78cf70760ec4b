package eu.fbk.funowl.data;

import org.junit.Assert;
import org.junit.Test;
import org.openrdf.model.Model;
import org.openrdf.model.impl.URIImpl;
import org.openrdf.model.vocabulary.RDF;
import org.openrdf.model.vocabulary.RDFS;

public class DataRangeTest {

    @Test
    public void testFunctional() {
        Assert.assertEquals("xsd:string", DataRange.of("xsd:string").toFunctional());
        Assert.assertEquals("DataIntersectionOf(xsd:integer ex:dt)", DataRange
                .intersectionOf("xsd:integer", "ex:dt").toFunctional());
        Assert.assertEquals("DataUnionOf(xsd:string xsd:boolean)", DataRange.unionOf(
                "xsd:string", "xsd:boolean").toFunctional());
        Assert.assertEquals("DataComplementOf(xsd:string)", DataRange.complementOf(
                "xsd:string").toFunctional());
        Assert.assertEquals("DataOneOf(\"a\" \"1\"^^xsd:integer)", DataRange.oneOf("a", 1)
                .toFunctional());
        Assert.assertEquals("DatatypeRestriction(xsd:integer xsd:minInclusive "
                + "\"5\"^^xsd:integer xsd:maxExclusive \"10\"^^xsd:integer)", DataRange
                .restriction("xsd:integer", DataRange.facet("xsd:minInclusive", 5),
                        DataRange.facet("xsd:maxExclusive", 10)).toFunctional());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnionArity() {
        DataRange.unionOf("xsd:string");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEmptyOneOf() {
        DataRange.oneOf();
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRestrictionWithoutFacets() {
        DataRange.restriction("xsd:integer");
    }

    @Test
    public void testNamedRDF() {
        RDFAssert.assertRDF("", DataRange.of("xsd:integer"));
        RDFAssert.assertRDF("", DataRange.of("rdfs:Literal"));
        RDFAssert.assertRDF("ex:dt a rdfs:Datatype .", DataRange.of("ex:dt"));
    }

    @Test
    public void testConnectiveRDF() {
        RDFAssert.assertRDF("ex:dt a rdfs:Datatype . "
                + "[] a rdfs:Datatype; owl:unionOf (xsd:string ex:dt) .",
                DataRange.unionOf("xsd:string", "ex:dt"));
        RDFAssert.assertRDF("[] a rdfs:Datatype; owl:datatypeComplementOf xsd:string .",
                DataRange.complementOf("xsd:string"));
    }

    @Test
    public void testOneOfRDF() {
        RDFAssert.assertRDF("[] a rdfs:Datatype; owl:oneOf [ a rdf:List; rdf:first \"a\"; "
                + "rdf:rest [ a rdf:List; rdf:first \"b\"; rdf:rest rdf:nil ] ] .",
                DataRange.oneOf("a", "b"));
    }

    @Test
    public void testOneOfListType() {
        final Model model = RDFAssert.emit(DataRange.oneOf("a", "b", "c"));
        Assert.assertEquals(3, model.filter(null, RDF.TYPE, RDF.LIST).size());
        Assert.assertTrue(model.filter(null, RDF.TYPE, new URIImpl(RDFS.NAMESPACE + "List"))
                .isEmpty());
    }

    @Test
    public void testRestrictionRDF() {
        RDFAssert.assertRDF("[] a rdfs:Datatype; owl:onDatatype xsd:integer; "
                + "owl:withRestrictions ([ xsd:minInclusive 5 ] [ xsd:maxInclusive 9 ]) .",
                DataRange.restriction("xsd:integer", DataRange.facet("xsd:minInclusive", 5),
                        DataRange.facet("xsd:maxInclusive", 9)));
    }

}
