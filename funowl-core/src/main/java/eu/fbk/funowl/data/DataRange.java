package eu.fbk.funowl.data;

import java.util.Arrays;
import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import org.openrdf.model.BNode;
import org.openrdf.model.URI;
import org.openrdf.model.Value;
import org.openrdf.model.vocabulary.RDF;
import org.openrdf.model.vocabulary.RDFS;

import eu.fbk.funowl.vocabulary.OWL2;

/**
 * An OWL 2 data range.
 * <p>
 * A data range is either a {@link Named} datatype or one of the compound data ranges created by
 * the static factory methods of this class. Compound data ranges are emitted in RDF as blank
 * nodes typed {@code rdfs:Datatype}.
 * </p>
 */
public abstract class DataRange extends Box {

    DataRange() {
    }

    /**
     * Coerces an object to a data range. Data ranges are returned unchanged; any other object is
     * interpreted as the identifier of a named datatype.
     *
     * @param object
     *            the object to coerce
     * @return the resulting data range
     */
    public static DataRange of(final Object object) {
        if (object instanceof DataRange) {
            return (DataRange) object;
        }
        return new Named(IdentifierBox.of(object));
    }

    public static DataRange intersectionOf(final Object... dataRanges) {
        return intersectionOf(Arrays.asList(dataRanges));
    }

    public static DataRange intersectionOf(final Iterable<?> dataRanges) {
        return new DataIntersectionOf(listOf(dataRanges));
    }

    public static DataRange unionOf(final Object... dataRanges) {
        return unionOf(Arrays.asList(dataRanges));
    }

    public static DataRange unionOf(final Iterable<?> dataRanges) {
        return new DataUnionOf(listOf(dataRanges));
    }

    public static DataRange complementOf(final Object dataRange) {
        return new DataComplementOf(of(dataRange));
    }

    /**
     * Returns the enumeration of the literals specified.
     *
     * @param literals
     *            the literals, each accepted by {@link LiteralBox#of(Object)}
     * @return the resulting data range
     */
    public static DataRange oneOf(final Object... literals) {
        return oneOf(Arrays.asList(literals));
    }

    public static DataRange oneOf(final Iterable<?> literals) {
        final ImmutableList.Builder<LiteralBox> builder = ImmutableList.builder();
        for (final Object literal : literals) {
            builder.add(LiteralBox.of(literal));
        }
        return new DataOneOf(builder.build());
    }

    /**
     * Returns the restriction of a datatype with the facets specified.
     *
     * @param datatype
     *            the restricted datatype
     * @param facets
     *            the facets, at least one
     * @return the resulting data range
     */
    public static DataRange restriction(final Object datatype, final Facet... facets) {
        return restriction(datatype, Arrays.asList(facets));
    }

    public static DataRange restriction(final Object datatype, final Iterable<Facet> facets) {
        return new DatatypeRestriction(new Named(IdentifierBox.of(datatype)),
                ImmutableList.copyOf(facets));
    }

    /**
     * Creates a facet restriction, such as {@code xsd:minInclusive "5"^^xsd:integer}.
     *
     * @param facet
     *            the facet identifier
     * @param value
     *            the facet value, accepted by {@link LiteralBox#of(Object)}
     * @return the created facet
     */
    public static Facet facet(final Object facet, final Object value) {
        return new Facet(IdentifierBox.of(facet), LiteralBox.of(value));
    }

    static List<DataRange> listOf(final Iterable<?> objects) {
        final ImmutableList.Builder<DataRange> builder = ImmutableList.builder();
        for (final Object object : objects) {
            builder.add(of(object));
        }
        return builder.build();
    }

    /**
     * A named datatype, typed {@code rdfs:Datatype} unless it belongs to the OWL 2 datatype map.
     */
    public static final class Named extends DataRange {

        private final IdentifierBox identifier;

        Named(final IdentifierBox identifier) {
            this.identifier = identifier;
        }

        public IdentifierBox getIdentifier() {
            return this.identifier;
        }

        @Override
        public URI toRDF(final RDFContext context) {
            return context.declare(this.identifier, EntityType.DATATYPE);
        }

        @Override
        public void toFunctional(final StringBuilder out) {
            this.identifier.toFunctional(out);
        }

    }

    private abstract static class Connective extends DataRange {

        private final List<DataRange> dataRanges;

        Connective(final List<DataRange> dataRanges) {
            Preconditions.checkArgument(dataRanges.size() >= 2,
                    "%s requires at least two data ranges, got %s", getTag(), dataRanges);
            this.dataRanges = dataRanges;
        }

        public final List<DataRange> getDataRanges() {
            return this.dataRanges;
        }

        abstract URI getPredicate();

        @Override
        public final Value toRDF(final RDFContext context) {
            final BNode node = context.newBNode();
            context.add(node, RDF.TYPE, RDFS.DATATYPE);
            context.add(node, getPredicate(), context.sequence(this.dataRanges));
            return node;
        }

        @Override
        protected final void appendArguments(final StringBuilder out) {
            appendList(out, this.dataRanges);
        }

    }

    /**
     * The intersection of two or more data ranges.
     */
    public static final class DataIntersectionOf extends Connective {

        DataIntersectionOf(final List<DataRange> dataRanges) {
            super(dataRanges);
        }

        @Override
        URI getPredicate() {
            return OWL2.INTERSECTION_OF;
        }

    }

    /**
     * The union of two or more data ranges.
     */
    public static final class DataUnionOf extends Connective {

        DataUnionOf(final List<DataRange> dataRanges) {
            super(dataRanges);
        }

        @Override
        URI getPredicate() {
            return OWL2.UNION_OF;
        }

    }

    /**
     * The complement of a data range.
     */
    public static final class DataComplementOf extends DataRange {

        private final DataRange dataRange;

        DataComplementOf(final DataRange dataRange) {
            this.dataRange = dataRange;
        }

        public DataRange getDataRange() {
            return this.dataRange;
        }

        @Override
        public Value toRDF(final RDFContext context) {
            final BNode node = context.newBNode();
            context.add(node, RDF.TYPE, RDFS.DATATYPE);
            context.add(node, OWL2.DATATYPE_COMPLEMENT_OF, this.dataRange.toRDF(context));
            return node;
        }

        @Override
        protected void appendArguments(final StringBuilder out) {
            this.dataRange.toFunctional(out);
        }

    }

    /**
     * An enumeration of one or more literals. The nodes of the RDF collection of literals are
     * typed {@code rdf:List}, not {@code rdfs:List}: this is the term the OWL API writes and the
     * one that exists in the RDF vocabulary.
     */
    public static final class DataOneOf extends DataRange {

        private final List<LiteralBox> literals;

        DataOneOf(final List<LiteralBox> literals) {
            Preconditions.checkArgument(!literals.isEmpty(),
                    "DataOneOf requires at least one literal");
            this.literals = literals;
        }

        public List<LiteralBox> getLiterals() {
            return this.literals;
        }

        @Override
        public Value toRDF(final RDFContext context) {
            final BNode node = context.newBNode();
            context.add(node, RDF.TYPE, RDFS.DATATYPE);
            context.add(node, OWL2.ONE_OF, context.sequence(context.nodes(this.literals), true));
            return node;
        }

        @Override
        protected void appendArguments(final StringBuilder out) {
            appendList(out, this.literals);
        }

    }

    /**
     * A datatype restricted by one or more facets.
     */
    public static final class DatatypeRestriction extends DataRange {

        private final Named datatype;

        private final List<Facet> facets;

        DatatypeRestriction(final Named datatype, final List<Facet> facets) {
            Preconditions.checkArgument(!facets.isEmpty(),
                    "DatatypeRestriction requires at least one facet");
            this.datatype = datatype;
            this.facets = facets;
        }

        public Named getDatatype() {
            return this.datatype;
        }

        public List<Facet> getFacets() {
            return this.facets;
        }

        @Override
        public Value toRDF(final RDFContext context) {
            final BNode node = context.newBNode();
            context.add(node, RDF.TYPE, RDFS.DATATYPE);
            context.add(node, OWL2.ON_DATATYPE, this.datatype.toRDF(context));
            final List<Value> facetNodes = Lists.newArrayList();
            for (final Facet facet : this.facets) {
                final BNode facetNode = context.newBNode();
                context.add(facetNode, facet.getFacet().toRDF(context),
                        facet.getValue().toRDF(context));
                facetNodes.add(facetNode);
            }
            context.add(node, OWL2.WITH_RESTRICTIONS, context.sequence(facetNodes, false));
            return node;
        }

        @Override
        protected void appendArguments(final StringBuilder out) {
            this.datatype.toFunctional(out);
            for (final Facet facet : this.facets) {
                out.append(' ');
                facet.getFacet().toFunctional(out);
                out.append(' ');
                facet.getValue().toFunctional(out);
            }
        }

    }

    /**
     * A constraining facet and its value, used in {@link DatatypeRestriction}s.
     */
    public static final class Facet {

        private final IdentifierBox facet;

        private final LiteralBox value;

        Facet(final IdentifierBox facet, final LiteralBox value) {
            this.facet = facet;
            this.value = value;
        }

        public IdentifierBox getFacet() {
            return this.facet;
        }

        public LiteralBox getValue() {
            return this.value;
        }

        @Override
        public String toString() {
            return this.facet + " " + this.value;
        }

    }

}
