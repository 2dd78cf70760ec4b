package eu.fbk.funowl.data;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.openrdf.model.Resource;
import org.openrdf.model.Value;
import org.openrdf.model.vocabulary.RDF;
import org.openrdf.model.vocabulary.RDFS;

import eu.fbk.funowl.vocabulary.OWL2;

/**
 * Data property axioms of OWL 2 section 9.3.
 */
public abstract class DataPropertyAxiom extends Axiom {

    DataPropertyAxiom(final List<Annotation> annotations) {
        super(annotations);
    }

    private static List<Annotation> none() {
        return Collections.emptyList();
    }

    public static SubDataPropertyOf subDataPropertyOf(final Object child, final Object parent) {
        return new SubDataPropertyOf(none(), DataPropertyExpression.of(child),
                DataPropertyExpression.of(parent));
    }

    public static EquivalentDataProperties equivalentDataProperties(final Object... properties) {
        return equivalentDataProperties(Arrays.asList(properties));
    }

    public static EquivalentDataProperties equivalentDataProperties(
            final Iterable<?> properties) {
        return new EquivalentDataProperties(none(), DataPropertyExpression.listOf(properties));
    }

    public static DisjointDataProperties disjointDataProperties(final Object... properties) {
        return disjointDataProperties(Arrays.asList(properties));
    }

    public static DisjointDataProperties disjointDataProperties(final Iterable<?> properties) {
        return new DisjointDataProperties(none(), DataPropertyExpression.listOf(properties));
    }

    public static DataPropertyDomain dataPropertyDomain(final Object property,
            final Object domain) {
        return new DataPropertyDomain(none(), DataPropertyExpression.of(property),
                ClassExpression.of(domain));
    }

    public static DataPropertyRange dataPropertyRange(final Object property,
            final Object range) {
        return new DataPropertyRange(none(), DataPropertyExpression.of(property),
                DataRange.of(range));
    }

    public static FunctionalDataProperty functionalDataProperty(final Object property) {
        return new FunctionalDataProperty(none(), DataPropertyExpression.of(property));
    }

    public static final class SubDataPropertyOf extends DataPropertyAxiom {

        private final DataPropertyExpression child;

        private final DataPropertyExpression parent;

        SubDataPropertyOf(final List<Annotation> annotations, final DataPropertyExpression child,
                final DataPropertyExpression parent) {
            super(annotations);
            this.child = child;
            this.parent = parent;
        }

        public DataPropertyExpression getChild() {
            return this.child;
        }

        public DataPropertyExpression getParent() {
            return this.parent;
        }

        @Override
        protected Axiom doWithAnnotations(final List<Annotation> annotations) {
            return new SubDataPropertyOf(annotations, this.child, this.parent);
        }

        @Override
        public Resource toRDF(final RDFContext context) {
            final Resource child = (Resource) this.child.toRDF(context);
            return context.addTriple(child, RDFS.SUBPROPERTYOF, this.parent.toRDF(context),
                    getAnnotations());
        }

        @Override
        protected void appendOperands(final StringBuilder out) {
            this.child.toFunctional(out);
            out.append(' ');
            this.parent.toFunctional(out);
        }

    }

    public static final class EquivalentDataProperties extends DataPropertyAxiom {

        private final List<DataPropertyExpression> properties;

        EquivalentDataProperties(final List<Annotation> annotations,
                final List<DataPropertyExpression> properties) {
            super(annotations);
            ClassAxiom.checkArity(properties, 2, "EquivalentDataProperties");
            this.properties = properties;
        }

        public List<DataPropertyExpression> getProperties() {
            return this.properties;
        }

        @Override
        protected Axiom doWithAnnotations(final List<Annotation> annotations) {
            return new EquivalentDataProperties(annotations, this.properties);
        }

        @Override
        public Resource toRDF(final RDFContext context) {
            return ClassAxiom.addPairwise(context, context.nodes(this.properties),
                    OWL2.EQUIVALENT_PROPERTY, getAnnotations());
        }

        @Override
        protected void appendOperands(final StringBuilder out) {
            appendList(out, this.properties);
        }

    }

    public static final class DisjointDataProperties extends DataPropertyAxiom {

        private final List<DataPropertyExpression> properties;

        DisjointDataProperties(final List<Annotation> annotations,
                final List<DataPropertyExpression> properties) {
            super(annotations);
            ClassAxiom.checkArity(properties, 2, "DisjointDataProperties");
            this.properties = properties;
        }

        public List<DataPropertyExpression> getProperties() {
            return this.properties;
        }

        @Override
        protected Axiom doWithAnnotations(final List<Annotation> annotations) {
            return new DisjointDataProperties(annotations, this.properties);
        }

        @Override
        public Resource toRDF(final RDFContext context) {
            final List<Value> nodes = context.nodes(this.properties);
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

    public static final class DataPropertyDomain extends DataPropertyAxiom {

        private final DataPropertyExpression property;

        private final ClassExpression domain;

        DataPropertyDomain(final List<Annotation> annotations,
                final DataPropertyExpression property, final ClassExpression domain) {
            super(annotations);
            this.property = property;
            this.domain = domain;
        }

        public DataPropertyExpression getProperty() {
            return this.property;
        }

        public ClassExpression getDomain() {
            return this.domain;
        }

        @Override
        protected Axiom doWithAnnotations(final List<Annotation> annotations) {
            return new DataPropertyDomain(annotations, this.property, this.domain);
        }

        @Override
        public Resource toRDF(final RDFContext context) {
            final Resource property = (Resource) this.property.toRDF(context);
            return context.addTriple(property, RDFS.DOMAIN, this.domain.toRDF(context),
                    getAnnotations());
        }

        @Override
        protected void appendOperands(final StringBuilder out) {
            this.property.toFunctional(out);
            out.append(' ');
            this.domain.toFunctional(out);
        }

    }

    public static final class DataPropertyRange extends DataPropertyAxiom {

        private final DataPropertyExpression property;

        private final DataRange range;

        DataPropertyRange(final List<Annotation> annotations,
                final DataPropertyExpression property, final DataRange range) {
            super(annotations);
            this.property = property;
            this.range = range;
        }

        public DataPropertyExpression getProperty() {
            return this.property;
        }

        public DataRange getRange() {
            return this.range;
        }

        @Override
        protected Axiom doWithAnnotations(final List<Annotation> annotations) {
            return new DataPropertyRange(annotations, this.property, this.range);
        }

        @Override
        public Resource toRDF(final RDFContext context) {
            final Resource property = (Resource) this.property.toRDF(context);
            return context.addTriple(property, RDFS.RANGE, this.range.toRDF(context),
                    getAnnotations());
        }

        @Override
        protected void appendOperands(final StringBuilder out) {
            this.property.toFunctional(out);
            out.append(' ');
            this.range.toFunctional(out);
        }

    }

    public static final class FunctionalDataProperty extends DataPropertyAxiom {

        private final DataPropertyExpression property;

        FunctionalDataProperty(final List<Annotation> annotations,
                final DataPropertyExpression property) {
            super(annotations);
            this.property = property;
        }

        public DataPropertyExpression getProperty() {
            return this.property;
        }

        @Override
        protected Axiom doWithAnnotations(final List<Annotation> annotations) {
            return new FunctionalDataProperty(annotations, this.property);
        }

        @Override
        public Resource toRDF(final RDFContext context) {
            return context.addTriple((Resource) this.property.toRDF(context), RDF.TYPE,
                    OWL2.FUNCTIONAL_PROPERTY, getAnnotations());
        }

        @Override
        protected void appendOperands(final StringBuilder out) {
            this.property.toFunctional(out);
        }

    }

}
