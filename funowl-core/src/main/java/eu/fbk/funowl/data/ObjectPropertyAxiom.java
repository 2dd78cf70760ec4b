package eu.fbk.funowl.data;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.openrdf.model.Resource;
import org.openrdf.model.URI;
import org.openrdf.model.Value;
import org.openrdf.model.vocabulary.RDF;
import org.openrdf.model.vocabulary.RDFS;

import eu.fbk.funowl.vocabulary.OWL2;

/**
 * Object property axioms of OWL 2 section 9.2.
 * <p>
 * When an operand is an {@link ObjectPropertyExpression.ObjectInverseOf inverse} expression,
 * these axioms also declare the wrapped named property.
 * </p>
 */
public abstract class ObjectPropertyAxiom extends Axiom {

    ObjectPropertyAxiom(final List<Annotation> annotations) {
        super(annotations);
    }

    private static List<Annotation> none() {
        return Collections.emptyList();
    }

    /**
     * Creates a {@code SubObjectPropertyOf} axiom.
     *
     * @param child
     *            the sub-property, either an {@link ObjectPropertyChain} or any object accepted
     *            by {@link ObjectPropertyExpression#of(Object)}
     * @param parent
     *            the super-property
     * @return the created axiom
     */
    public static SubObjectPropertyOf subObjectPropertyOf(final Object child,
            final Object parent) {
        final Box childBox = child instanceof ObjectPropertyChain ? (Box) child
                : ObjectPropertyExpression.of(child);
        return new SubObjectPropertyOf(none(), childBox, ObjectPropertyExpression.of(parent));
    }

    public static EquivalentObjectProperties equivalentObjectProperties(
            final Object... properties) {
        return equivalentObjectProperties(Arrays.asList(properties));
    }

    public static EquivalentObjectProperties equivalentObjectProperties(
            final Iterable<?> properties) {
        return new EquivalentObjectProperties(none(),
                ObjectPropertyExpression.listOf(properties));
    }

    public static DisjointObjectProperties disjointObjectProperties(final Object... properties) {
        return disjointObjectProperties(Arrays.asList(properties));
    }

    public static DisjointObjectProperties disjointObjectProperties(
            final Iterable<?> properties) {
        return new DisjointObjectProperties(none(), ObjectPropertyExpression.listOf(properties));
    }

    public static InverseObjectProperties inverseObjectProperties(final Object first,
            final Object second) {
        return new InverseObjectProperties(none(), ObjectPropertyExpression.of(first),
                ObjectPropertyExpression.of(second));
    }

    public static ObjectPropertyDomain objectPropertyDomain(final Object property,
            final Object domain) {
        return new ObjectPropertyDomain(none(), ObjectPropertyExpression.of(property),
                ClassExpression.of(domain));
    }

    public static ObjectPropertyRange objectPropertyRange(final Object property,
            final Object range) {
        return new ObjectPropertyRange(none(), ObjectPropertyExpression.of(property),
                ClassExpression.of(range));
    }

    public static ObjectPropertyCharacteristic functional(final Object property) {
        return characteristic(Characteristic.FUNCTIONAL, property);
    }

    public static ObjectPropertyCharacteristic inverseFunctional(final Object property) {
        return characteristic(Characteristic.INVERSE_FUNCTIONAL, property);
    }

    public static ObjectPropertyCharacteristic reflexive(final Object property) {
        return characteristic(Characteristic.REFLEXIVE, property);
    }

    public static ObjectPropertyCharacteristic irreflexive(final Object property) {
        return characteristic(Characteristic.IRREFLEXIVE, property);
    }

    public static ObjectPropertyCharacteristic symmetric(final Object property) {
        return characteristic(Characteristic.SYMMETRIC, property);
    }

    public static ObjectPropertyCharacteristic asymmetric(final Object property) {
        return characteristic(Characteristic.ASYMMETRIC, property);
    }

    public static ObjectPropertyCharacteristic transitive(final Object property) {
        return characteristic(Characteristic.TRANSITIVE, property);
    }

    public static ObjectPropertyCharacteristic characteristic(
            final Characteristic characteristic, final Object property) {
        return new ObjectPropertyCharacteristic(none(), characteristic,
                ObjectPropertyExpression.of(property));
    }

    static Resource emit(final RDFContext context, final ObjectPropertyExpression property) {
        property.declareWrapped(context);
        return (Resource) property.toRDF(context);
    }

    static List<Value> emitAll(final RDFContext context,
            final List<ObjectPropertyExpression> properties) {
        for (final ObjectPropertyExpression property : properties) {
            property.declareWrapped(context);
        }
        return context.nodes(properties);
    }

    /**
     * The seven characteristics an object property can be given by a unary axiom, with the
     * functional-syntax tag and RDF class of each.
     */
    public enum Characteristic {

        FUNCTIONAL("FunctionalObjectProperty", OWL2.FUNCTIONAL_PROPERTY),

        INVERSE_FUNCTIONAL("InverseFunctionalObjectProperty", OWL2.INVERSE_FUNCTIONAL_PROPERTY),

        REFLEXIVE("ReflexiveObjectProperty", OWL2.REFLEXIVE_PROPERTY),

        IRREFLEXIVE("IrreflexiveObjectProperty", OWL2.IRREFLEXIVE_PROPERTY),

        SYMMETRIC("SymmetricObjectProperty", OWL2.SYMMETRIC_PROPERTY),

        ASYMMETRIC("AsymmetricObjectProperty", OWL2.ASYMMETRIC_PROPERTY),

        TRANSITIVE("TransitiveObjectProperty", OWL2.TRANSITIVE_PROPERTY);

        private final String tag;

        private final URI type;

        private Characteristic(final String tag, final URI type) {
            this.tag = tag;
            this.type = type;
        }

        public String getTag() {
            return this.tag;
        }

        public URI getType() {
            return this.type;
        }

    }

    /**
     * Sub-property axiom. When the sub-property is a chain the RDF form is
     * {@code parent owl:propertyChainAxiom (p1 ... pn)}, with the operands in reverse order
     * with respect to functional syntax.
     */
    public static final class SubObjectPropertyOf extends ObjectPropertyAxiom {

        private final Box child;

        private final ObjectPropertyExpression parent;

        SubObjectPropertyOf(final List<Annotation> annotations, final Box child,
                final ObjectPropertyExpression parent) {
            super(annotations);
            this.child = child;
            this.parent = parent;
        }

        /**
         * Returns the sub-property.
         *
         * @return either an {@link ObjectPropertyExpression} or an {@link ObjectPropertyChain}
         */
        public Box getChild() {
            return this.child;
        }

        public ObjectPropertyExpression getParent() {
            return this.parent;
        }

        @Override
        protected Axiom doWithAnnotations(final List<Annotation> annotations) {
            return new SubObjectPropertyOf(annotations, this.child, this.parent);
        }

        @Override
        public Resource toRDF(final RDFContext context) {
            if (this.child instanceof ObjectPropertyChain) {
                final Resource parent = emit(context, this.parent);
                final List<Value> chain = emitAll(context,
                        ((ObjectPropertyChain) this.child).getProperties());
                return context.addTriple(parent, OWL2.PROPERTY_CHAIN_AXIOM,
                        context.sequence(chain, false), getAnnotations());
            }
            final Resource child = emit(context, (ObjectPropertyExpression) this.child);
            return context.addTriple(child, RDFS.SUBPROPERTYOF, emit(context, this.parent),
                    getAnnotations());
        }

        @Override
        protected void appendOperands(final StringBuilder out) {
            this.child.toFunctional(out);
            out.append(' ');
            this.parent.toFunctional(out);
        }

    }

    public static final class EquivalentObjectProperties extends ObjectPropertyAxiom {

        private final List<ObjectPropertyExpression> properties;

        EquivalentObjectProperties(final List<Annotation> annotations,
                final List<ObjectPropertyExpression> properties) {
            super(annotations);
            ClassAxiom.checkArity(properties, 2, "EquivalentObjectProperties");
            this.properties = properties;
        }

        public List<ObjectPropertyExpression> getProperties() {
            return this.properties;
        }

        @Override
        protected Axiom doWithAnnotations(final List<Annotation> annotations) {
            return new EquivalentObjectProperties(annotations, this.properties);
        }

        @Override
        public Resource toRDF(final RDFContext context) {
            return ClassAxiom.addPairwise(context, emitAll(context, this.properties),
                    OWL2.EQUIVALENT_PROPERTY, getAnnotations());
        }

        @Override
        protected void appendOperands(final StringBuilder out) {
            appendList(out, this.properties);
        }

    }

    public static final class DisjointObjectProperties extends ObjectPropertyAxiom {

        private final List<ObjectPropertyExpression> properties;

        DisjointObjectProperties(final List<Annotation> annotations,
                final List<ObjectPropertyExpression> properties) {
            super(annotations);
            ClassAxiom.checkArity(properties, 2, "DisjointObjectProperties");
            this.properties = properties;
        }

        public List<ObjectPropertyExpression> getProperties() {
            return this.properties;
        }

        @Override
        protected Axiom doWithAnnotations(final List<Annotation> annotations) {
            return new DisjointObjectProperties(annotations, this.properties);
        }

        @Override
        public Resource toRDF(final RDFContext context) {
            final List<Value> nodes = emitAll(context, this.properties);
            if (nodes.size() == 2) {
                return context.addTriple((Resource) nodes.get(0), OWL2.PROPERTY_DISJOINT_WITH,
                        nodes.get(1), getAnnotations());
            }
            return ClassAxiom.addAllDisjoint(context, OWL2.ALL_DISJOINT_PROPERTIES, nodes,
                    getAnnotations());
        }

        @Override
        protected void appendOperands(final StringBuilder out) {
            appendList(out, this.properties);
        }

    }

    public static final class InverseObjectProperties extends ObjectPropertyAxiom {

        private final ObjectPropertyExpression first;

        private final ObjectPropertyExpression second;

        InverseObjectProperties(final List<Annotation> annotations,
                final ObjectPropertyExpression first, final ObjectPropertyExpression second) {
            super(annotations);
            this.first = first;
            this.second = second;
        }

        public ObjectPropertyExpression getFirst() {
            return this.first;
        }

        public ObjectPropertyExpression getSecond() {
            return this.second;
        }

        @Override
        protected Axiom doWithAnnotations(final List<Annotation> annotations) {
            return new InverseObjectProperties(annotations, this.first, this.second);
        }

        @Override
        public Resource toRDF(final RDFContext context) {
            final Resource first = emit(context, this.first);
            return context.addTriple(first, OWL2.INVERSE_OF, emit(context, this.second),
                    getAnnotations());
        }

        @Override
        protected void appendOperands(final StringBuilder out) {
            this.first.toFunctional(out);
            out.append(' ');
            this.second.toFunctional(out);
        }

    }

    private abstract static class PropertyClassAxiom extends ObjectPropertyAxiom {

        private final ObjectPropertyExpression property;

        private final ClassExpression classExpression;

        PropertyClassAxiom(final List<Annotation> annotations,
                final ObjectPropertyExpression property, final ClassExpression classExpression) {
            super(annotations);
            this.property = property;
            this.classExpression = classExpression;
        }

        public final ObjectPropertyExpression getProperty() {
            return this.property;
        }

        public final ClassExpression getClassExpression() {
            return this.classExpression;
        }

        abstract URI getPredicate();

        @Override
        public final Resource toRDF(final RDFContext context) {
            final Resource property = emit(context, this.property);
            return context.addTriple(property, getPredicate(),
                    this.classExpression.toRDF(context), getAnnotations());
        }

        @Override
        protected final void appendOperands(final StringBuilder out) {
            this.property.toFunctional(out);
            out.append(' ');
            this.classExpression.toFunctional(out);
        }

    }

    public static final class ObjectPropertyDomain extends PropertyClassAxiom {

        ObjectPropertyDomain(final List<Annotation> annotations,
                final ObjectPropertyExpression property, final ClassExpression domain) {
            super(annotations, property, domain);
        }

        @Override
        URI getPredicate() {
            return RDFS.DOMAIN;
        }

        @Override
        protected Axiom doWithAnnotations(final List<Annotation> annotations) {
            return new ObjectPropertyDomain(annotations, getProperty(), getClassExpression());
        }

    }

    public static final class ObjectPropertyRange extends PropertyClassAxiom {

        ObjectPropertyRange(final List<Annotation> annotations,
                final ObjectPropertyExpression property, final ClassExpression range) {
            super(annotations, property, range);
        }

        @Override
        URI getPredicate() {
            return RDFS.RANGE;
        }

        @Override
        protected Axiom doWithAnnotations(final List<Annotation> annotations) {
            return new ObjectPropertyRange(annotations, getProperty(), getClassExpression());
        }

    }

    /**
     * A unary characteristic axiom, such as {@code TransitiveObjectProperty(a:p)}, emitted as
     * {@code a:p rdf:type owl:TransitiveProperty}.
     */
    public static final class ObjectPropertyCharacteristic extends ObjectPropertyAxiom {

        private final Characteristic characteristic;

        private final ObjectPropertyExpression property;

        ObjectPropertyCharacteristic(final List<Annotation> annotations,
                final Characteristic characteristic, final ObjectPropertyExpression property) {
            super(annotations);
            this.characteristic = characteristic;
            this.property = property;
        }

        public Characteristic getCharacteristic() {
            return this.characteristic;
        }

        public ObjectPropertyExpression getProperty() {
            return this.property;
        }

        @Override
        protected String getTag() {
            return this.characteristic.getTag();
        }

        @Override
        protected Axiom doWithAnnotations(final List<Annotation> annotations) {
            return new ObjectPropertyCharacteristic(annotations, this.characteristic,
                    this.property);
        }

        @Override
        public Resource toRDF(final RDFContext context) {
            return context.addTriple(emit(context, this.property), RDF.TYPE,
                    this.characteristic.getType(), getAnnotations());
        }

        @Override
        protected void appendOperands(final StringBuilder out) {
            this.property.toFunctional(out);
        }

    }

}
