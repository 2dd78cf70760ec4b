package eu.fbk.funowl.obo;

import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import org.junit.Assert;
import org.junit.Test;
import org.openrdf.model.Model;
import org.openrdf.model.URI;
import org.openrdf.model.impl.URIImpl;
import org.openrdf.model.vocabulary.OWL;
import org.openrdf.model.vocabulary.RDF;
import org.openrdf.model.vocabulary.RDFS;

import eu.fbk.funowl.Document;
import eu.fbk.funowl.Ontology;
import eu.fbk.funowl.data.Annotation;
import eu.fbk.funowl.data.Axiom;
import eu.fbk.funowl.data.Box;
import eu.fbk.funowl.data.Reference;
import eu.fbk.funowl.macro.SynonymScope;
import eu.fbk.funowl.vocabulary.IAO;
import eu.fbk.funowl.vocabulary.OBOINOWL;

public class OboConverterTest {

    private static final Reference TERM = Reference.create("GO", "0000001",
            "mitochondrion inheritance");

    private static final Reference PART_OF = Reference.create("BFO", "0000050", "part of");

    private static final Reference HAS_PART = Reference.create("BFO", "0000051", "has part");

    private static final Reference SLIM = Reference.create("go", "goslim_generic");

    private static final Reference CREATED_BY = Reference.create("oboInOwl", "created_by");

    private static final Reference GOC = Reference.create("GOC", "mcc");

    private static final Map<String, String> ID_SPACES = ImmutableMap.of( //
            "GO", "http://purl.obolibrary.org/obo/GO_", //
            "go", "http://purl.obolibrary.org/obo/go#", //
            "GOC", "http://purl.obolibrary.org/obo/go/references/", //
            "Wikipedia", "https://en.wikipedia.org/wiki/", //
            "owl", "http://example.org/not-owl#");

    private static List<String> render(final List<? extends Box> boxes) {
        final List<String> result = Lists.newArrayList();
        for (final Box box : boxes) {
            result.add(box.toFunctional());
        }
        return result;
    }

    private static Term newTerm() {
        return new Term() {

            @Override
            public Reference getReference() {
                return TERM;
            }

            @Override
            public String getName() {
                return "mitochondrion inheritance";
            }

            @Override
            public String getNamespace() {
                return "biological_process";
            }

            @Override
            public List<Reference> getAltIds() {
                return ImmutableList.of(Reference.create("GO", "0000003"));
            }

            @Override
            public String getDefinition() {
                return "The distribution of mitochondria.";
            }

            @Override
            public List<Reference> getSubsets() {
                return ImmutableList.of(SLIM);
            }

            @Override
            public List<Synonym> getSynonyms() {
                return ImmutableList.of(new Synonym("mitochondrial inheritance",
                        SynonymScope.EXACT), new Synonym("mt inheritance", null));
            }

            @Override
            public List<Reference> getXrefs() {
                return ImmutableList.of(Reference.create("Wikipedia", "Mitochondrion"));
            }

            @Override
            public ListMultimap<Reference, Object> getProperties() {
                return ImmutableListMultimap.<Reference, Object>of(CREATED_BY,
                        OboLiteral.string("jl"), IAO.ALTERNATIVE_TERM, TERM);
            }

            @Override
            public List<Reference> getParents() {
                return ImmutableList.of(Reference.create("GO", "0048308"));
            }

            @Override
            public ListMultimap<Reference, Reference> getRelationships() {
                return ImmutableListMultimap.of(PART_OF, Reference.create("GO", "0000002"));
            }

            @Override
            public List<OboAnnotation> getAnnotations(final Reference predicate,
                    final Object value) {
                if (predicate.equals(Reference.create("dcterms", "description"))) {
                    return ImmutableList.of(OboAnnotation.create(OBOINOWL.HAS_DB_XREF, GOC));
                }
                return ImmutableList.of();
            }

        };
    }

    private static TypeDef newTypeDef() {
        return new TypeDef() {

            @Override
            public Reference getReference() {
                return PART_OF;
            }

            @Override
            public String getName() {
                return "part of";
            }

            @Override
            public List<Reference> getXrefs() {
                return ImmutableList.of(Reference.create("RO", "0000050"));
            }

            @Override
            public Reference getDomain() {
                return Reference.create("BFO", "0000001");
            }

            @Override
            public List<List<Reference>> getHoldsOverChains() {
                return ImmutableList.<List<Reference>>of(ImmutableList.of(PART_OF, PART_OF));
            }

            @Override
            public boolean isTransitive() {
                return true;
            }

            @Override
            public List<Reference> getParents() {
                return ImmutableList.of(Reference.create("RO", "0002131"));
            }

            @Override
            public Reference getInverse() {
                return HAS_PART;
            }

            @Override
            public List<Reference> getTransitiveOver() {
                return ImmutableList.of(Reference.create("RO", "0002131"));
            }

            @Override
            public Boolean isObsolete() {
                return false;
            }

        };
    }

    private static OboOntology newOntology() {
        return new OboOntology() {

            @Override
            public String getPrefix() {
                return "go";
            }

            @Override
            public String getName() {
                return "Gene Ontology";
            }

            @Override
            public String getDataVersion() {
                return "2024-01-17";
            }

            @Override
            public Map<String, String> getIdSpaces() {
                return ID_SPACES;
            }

            @Override
            public List<Reference> getRootTerms() {
                return ImmutableList.of(Reference.create("GO", "0008150"));
            }

            @Override
            public List<SubsetDef> getSubsetDefs() {
                return ImmutableList.of(new SubsetDef(SLIM, "Generic GO slim"));
            }

            @Override
            public List<SynonymTypeDef> getSynonymTypeDefs() {
                return ImmutableList.of(new SynonymTypeDef(Reference.create("OMO", "0003000"),
                        "abbreviation", SynonymScope.EXACT));
            }

            @Override
            public List<OboAnnotation> getPropertyValues() {
                return ImmutableList.of(OboAnnotation.create(Reference.create("oboInOwl",
                        "hasOBOFormatVersion"), OboLiteral.string("1.4")));
            }

            @Override
            public List<TypeDef> getTypeDefs() {
                return ImmutableList.of(newTypeDef());
            }

            @Override
            public List<Term> getTerms() {
                return ImmutableList.of(newTerm());
            }

        };
    }

    @Test
    public void testTermAxioms() {
        final List<Axiom> axioms = new OboConverter().getTermAxioms(newTerm());
        Assert.assertEquals(ImmutableList.of( //
                "Declaration(Class(GO:0000001))", //
                "SubClassOf(GO:0000001 GO:0048308)", //
                "AnnotationAssertion(rdfs:label GO:0000001 \"mitochondrion inheritance\")", //
                "AnnotationAssertion(oboInOwl:hasOBONamespace GO:0000001 "
                        + "\"biological_process\")", //
                "AnnotationAssertion(IAO:0100001 GO:0000003 GO:0000001)", //
                "AnnotationAssertion(Annotation(oboInOwl:hasDbXref GOC:mcc) "
                        + "dcterms:description GO:0000001 \"The distribution of mitochondria.\")",
                "AnnotationAssertion(oboInOwl:inSubset GO:0000001 go:goslim_generic)", //
                "AnnotationAssertion(oboInOwl:hasExactSynonym GO:0000001 "
                        + "\"mitochondrial inheritance\")", //
                "AnnotationAssertion(oboInOwl:hasRelatedSynonym GO:0000001 "
                        + "\"mt inheritance\")", //
                "AnnotationAssertion(oboInOwl:hasDbXref GO:0000001 Wikipedia:Mitochondrion)", //
                "AnnotationAssertion(oboInOwl:created_by GO:0000001 \"jl\")", //
                "SubClassOf(GO:0000001 ObjectSomeValuesFrom(BFO:0000050 GO:0000002))"),
                render(axioms));
    }

    @Test
    public void testMinimalTerm() {
        final Term term = new Term() {

            @Override
            public Reference getReference() {
                return TERM;
            }

            @Override
            public List<Object> getIntersectionOf() {
                return ImmutableList.<Object>of(Reference.create("GO", "0000002"),
                        Maps.immutableEntry(PART_OF, Reference.create("GO", "0000003")));
            }

            @Override
            public List<Reference> getDisjointFrom() {
                return ImmutableList.of(Reference.create("GO", "0000004"));
            }

            @Override
            public Boolean isObsolete() {
                return true;
            }

        };
        Assert.assertEquals(ImmutableList.of( //
                "Declaration(Class(GO:0000001))", //
                "EquivalentClasses(GO:0000001 ObjectIntersectionOf(GO:0000002 "
                        + "ObjectSomeValuesFrom(BFO:0000050 GO:0000003)))", //
                "DisjointClasses(GO:0000001 GO:0000004)", //
                "AnnotationAssertion(owl:deprecated GO:0000001 \"true\"^^xsd:boolean)"),
                render(new OboConverter().getTermAxioms(term)));
    }

    @Test
    public void testInstanceAxioms() {
        final Term instance = new Term() {

            @Override
            public Reference getReference() {
                return Reference.create("ex", "a");
            }

            @Override
            public boolean isInstance() {
                return true;
            }

            @Override
            public List<Reference> getParents() {
                return ImmutableList.of(Reference.create("ex", "A"));
            }

            @Override
            public ListMultimap<Reference, Reference> getRelationships() {
                return ImmutableListMultimap.of(Reference.create("ex", "p"), Reference.create(
                        "ex", "b"));
            }

            @Override
            public List<OboAnnotation> getAnnotations(final Reference predicate,
                    final Object value) {
                return ImmutableList.of(OboAnnotation.create(OBOINOWL.HAS_DB_XREF, GOC));
            }

        };
        Assert.assertEquals(ImmutableList.of( //
                "Declaration(NamedIndividual(ex:a))", //
                "ClassAssertion(ex:A ex:a)", //
                "ObjectPropertyAssertion(Annotation(oboInOwl:hasDbXref GOC:mcc) ex:p ex:a ex:b)"),
                render(new OboConverter().getTermAxioms(instance)));
    }

    @Test
    public void testTypeDefAxioms() {
        Assert.assertEquals(ImmutableList.of( //
                "Declaration(ObjectProperty(BFO:0000050))", //
                "AnnotationAssertion(rdfs:label BFO:0000050 \"part of\")", //
                "AnnotationAssertion(oboInOwl:hasDbXref BFO:0000050 RO:0000050)", //
                "ObjectPropertyDomain(BFO:0000050 BFO:0000001)", //
                "SubObjectPropertyOf(ObjectPropertyChain(BFO:0000050 BFO:0000050) BFO:0000050)",
                "TransitiveObjectProperty(BFO:0000050)", //
                "SubObjectPropertyOf(BFO:0000050 RO:0002131)", //
                "InverseObjectProperties(BFO:0000050 BFO:0000051)", //
                "SubObjectPropertyOf(ObjectPropertyChain(BFO:0000050 RO:0002131) BFO:0000050)",
                "AnnotationAssertion(owl:deprecated BFO:0000050 \"false\"^^xsd:boolean)"),
                render(new OboConverter().getTypeDefAxioms(newTypeDef())));
    }

    @Test
    public void testMetadataTag() {
        final TypeDef typedef = new TypeDef() {

            @Override
            public Reference getReference() {
                return Reference.create("ex", "tag");
            }

            @Override
            public boolean isMetadataTag() {
                return true;
            }

            @Override
            public String getComment() {
                return "a tag";
            }

            @Override
            public Reference getRange() {
                return Reference.create("xsd", "string");
            }

            @Override
            public List<Reference> getParents() {
                return ImmutableList.of(Reference.create("ex", "parentTag"));
            }

            @Override
            public List<Reference> getSeeAlso() {
                return ImmutableList.of(Reference.create("ex", "other"));
            }

            @Override
            public Boolean isClassLevel() {
                return true;
            }

        };
        Assert.assertEquals(ImmutableList.of( //
                "Declaration(AnnotationProperty(ex:tag))", //
                "AnnotationAssertion(rdfs:comment ex:tag \"a tag\")", //
                "AnnotationPropertyRange(ex:tag xsd:string)", //
                "SubAnnotationPropertyOf(ex:tag ex:parentTag)", //
                "AnnotationAssertion(oboInOwl:consider ex:tag ex:other)", //
                "AnnotationAssertion(oboInOwl:is_class_level ex:tag \"true\"^^xsd:boolean)"),
                render(new OboConverter().getTypeDefAxioms(typedef)));
    }

    @Test
    public void testOntologyAnnotations() {
        final List<Annotation> annotations = new OboConverter()
                .getOntologyAnnotations(newOntology());
        Assert.assertEquals(ImmutableList.of( //
                "Annotation(dcterms:title \"Gene Ontology\")", //
                "Annotation(IAO:0700000 GO:0008150)", //
                "Annotation(oboInOwl:hasOBOFormatVersion \"1.4\")"), render(annotations));
    }

    @Test
    public void testOntologyAxioms() {
        final List<String> axioms = render(new OboConverter().getOntologyAxioms(newOntology()));
        Assert.assertEquals(ImmutableList.of( //
                "Declaration(AnnotationProperty(IAO:0700000))", //
                "AnnotationAssertion(rdfs:label IAO:0700000 \"has ontology root term\")", //
                "Declaration(AnnotationProperty(oboInOwl:SubsetProperty))", //
                "Declaration(AnnotationProperty(go:goslim_generic))", //
                "AnnotationAssertion(rdfs:label go:goslim_generic \"Generic GO slim\")", //
                "SubAnnotationPropertyOf(go:goslim_generic oboInOwl:SubsetProperty)", //
                "Declaration(AnnotationProperty(oboInOwl:hasScope))", //
                "Declaration(AnnotationProperty(OMO:0003000))", //
                "AnnotationAssertion(rdfs:label OMO:0003000 \"abbreviation\")", //
                "SubAnnotationPropertyOf(OMO:0003000 oboInOwl:SynonymTypeProperty)", //
                "AnnotationAssertion(oboInOwl:hasScope OMO:0003000 oboInOwl:hasExactSynonym)"),
                axioms.subList(0, 11));
        Assert.assertEquals("Declaration(ObjectProperty(BFO:0000050))", axioms.get(11));
        Assert.assertEquals("Declaration(Class(GO:0000001))", axioms.get(21));
        Assert.assertEquals(33, axioms.size());
    }

    @Test
    public void testConvert() {
        final Document document = new OboConverter().convert(newOntology());
        final Ontology ontology = document.getOntologies().get(0);
        Assert.assertEquals("https://w3id.org/biopragmatics/resources/go/go.ofn",
                ontology.getIRI());
        Assert.assertEquals("https://w3id.org/biopragmatics/resources/go/2024-01-17/go.ofn",
                ontology.getVersionIRI());
        final Map<String, String> prefixes = document.getPrefixMap();
        Assert.assertEquals("http://purl.obolibrary.org/obo/GO_", prefixes.get("GO"));
        Assert.assertEquals("http://www.w3.org/2002/07/owl#", prefixes.get("owl"));
        Assert.assertTrue(document.toFunctional().contains(
                "\nOntology(<https://w3id.org/biopragmatics/resources/go/go.ofn> "
                        + "<https://w3id.org/biopragmatics/resources/go/2024-01-17/go.ofn>\n"
                        + "Annotation(dcterms:title \"Gene Ontology\")\n"));
    }

    @Test
    public void testConvertToRDF() {
        final Model model = new OboConverter().convert(newOntology()).toRDF();
        final URI term = new URIImpl("http://purl.obolibrary.org/obo/GO_0000001");
        final URI partOf = new URIImpl("http://purl.obolibrary.org/obo/BFO_0000050");
        Assert.assertTrue(model.contains(term, RDF.TYPE, OWL.CLASS));
        Assert.assertTrue(model.contains(partOf, RDF.TYPE, OWL.TRANSITIVEPROPERTY));
        Assert.assertTrue(model.contains(term, RDFS.SUBCLASSOF, new URIImpl(
                "http://purl.obolibrary.org/obo/GO_0048308")));
        Assert.assertTrue(model.contains(new URIImpl(
                "https://w3id.org/biopragmatics/resources/go/go.ofn"), RDF.TYPE, OWL.ONTOLOGY));
    }

    @Test
    public void testCustomBase() {
        final OboConverter converter = new OboConverter("http://example.org/");
        Assert.assertEquals("http://example.org/go/go.ofn", converter.getOntologyIRI(
                newOntology()));
        Assert.assertNull(converter.getVersionIRI(new OboOntology() {

            @Override
            public String getPrefix() {
                return "x";
            }

            @Override
            public List<Term> getTerms() {
                return ImmutableList.of();
            }

        }));
    }

    @Test(expected = UnsupportedOperationException.class)
    public void testUnsupportedLiteralDatatype() {
        OboLiteral.create("x", Reference.create("ex", "dt")).toLiteralBox();
    }

}
