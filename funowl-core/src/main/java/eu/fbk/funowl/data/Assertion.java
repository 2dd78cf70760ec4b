package eu.fbk.funowl.data;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import org.openrdf.model.BNode;
import org.openrdf.model.Resource;
import org.openrdf.model.URI;
import org.openrdf.model.Value;
import org.openrdf.model.vocabulary.RDF;

import eu.fbk.funowl.data.RDFContext.Reification;
import eu.fbk.funowl.vocabulary.OWL2;

/**
 * Assertions about individuals (OWL 2 section 9.6). Named individuals are typed
 * {@code owl:NamedIndividual} when emitted in RDF.
 */
public abstract class Assertion extends Axiom {

    Assertion(final List<Annotation> annotations) {
        super(annotations);
    }

    private static List<Annotation> none() {
        return Collections.emptyList();
    }

    private static List<IdentifierBox> individuals(final Iterable<?> objects) {
        final ImmutableList.Builder<IdentifierBox> builder = ImmutableList.builder();
        for (final Object object : objects) {
            builder.add(IdentifierBox.of(object));
        }
        return builder.build();
    }

    private static List<Value> declareAll(final RDFContext context,
            final List<IdentifierBox> individuals) {
        final List<Value> nodes = Lists.newArrayList();
        for (final IdentifierBox individual : individuals) {
            nodes.add(declare(context, individual));
        }
        return nodes;
    }

    private static URI declare(final RDFContext context, final IdentifierBox individual) {
        return context.declare(individual, EntityType.NAMED_INDIVIDUAL);
    }

    public static SameIndividual sameIndividual(final Object... individuals) {
        return sameIndividual(Arrays.asList(individuals));
    }

    public static SameIndividual sameIndividual(final Iterable<?> individuals) {
        return new SameIndividual(none(), individuals(individuals));
    }

    public static DifferentIndividuals differentIndividuals(final Object... individuals) {
        return differentIndividuals(Arrays.asList(individuals));
    }

    public static DifferentIndividuals differentIndividuals(final Iterable<?> individuals) {
        return new DifferentIndividuals(none(), individuals(individuals));
    }

    public static ClassAssertion classAssertion(final Object classExpression,
            final Object individual) {
        return new ClassAssertion(none(), ClassExpression.of(classExpression),
                IdentifierBox.of(individual));
    }

    public static ObjectPropertyAssertion objectPropertyAssertion(final Object property,
            final Object source, final Object target) {
        return new ObjectPropertyAssertion(none(), ObjectPropertyExpression.of(property),
                IdentifierBox.of(source), IdentifierBox.of(target));
    }

    public static NegativeObjectPropertyAssertion negativeObjectPropertyAssertion(
            final Object property, final Object source, final Object target) {
        return new NegativeObjectPropertyAssertion(none(),
                ObjectPropertyExpression.of(property), IdentifierBox.of(source),
                IdentifierBox.of(target));
    }

    /**
     * Creates a {@code DataPropertyAssertion} axiom.
     *
     * @param property
     *            the data property expression
     * @param source
     *            the source individual
     * @param target
     *            the target value, coerced with {@link LiteralBox#of(Object)} so that a Java
     *            string becomes a string literal
     * @return the created axiom
     */
    public static DataPropertyAssertion dataPropertyAssertion(final Object property,
            final Object source, final Object target) {
        return new DataPropertyAssertion(none(), DataPropertyExpression.of(property),
                IdentifierBox.of(source), LiteralBox.of(target));
    }

    public static NegativeDataPropertyAssertion negativeDataPropertyAssertion(
            final Object property, final Object source, final Object target) {
        return new NegativeDataPropertyAssertion(none(), DataPropertyExpression.of(property),
                IdentifierBox.of(source), LiteralBox.of(target));
    }

    public static final class SameIndividual extends Assertion {

        private final List<IdentifierBox> individuals;

        SameIndividual(final List<Annotation> annotations, final List<IdentifierBox> individuals) {
            super(annotations);
            ClassAxiom.checkArity(individuals, 2, "SameIndividual");
            this.individuals = individuals;
        }

        public List<IdentifierBox> getIndividuals() {
            return this.individuals;
        }

        @Override
        protected Axiom doWithAnnotations(final List<Annotation> annotations) {
            return new SameIndividual(annotations, this.individuals);
        }

        @Override
        public Resource toRDF(final RDFContext context) {
            return ClassAxiom.addPairwise(context, declareAll(context, this.individuals),
                    OWL2.SAME_AS, getAnnotations());
        }

        @Override
        protected void appendOperands(final StringBuilder out) {
            appendList(out, this.individuals);
        }

    }

    /**
     * Pairwise difference of two or more individuals: a single {@code owl:differentFrom}
     * triple for two individuals, an {@code owl:AllDifferent} node listing them in order
     * otherwise.
     */
    public static final class DifferentIndividuals extends Assertion {

        private final List<IdentifierBox> individuals;

        DifferentIndividuals(final List<Annotation> annotations,
                final List<IdentifierBox> individuals) {
            super(annotations);
            ClassAxiom.checkArity(individuals, 2, "DifferentIndividuals");
            this.individuals = individuals;
        }

        public List<IdentifierBox> getIndividuals() {
            return this.individuals;
        }

        @Override
        protected Axiom doWithAnnotations(final List<Annotation> annotations) {
            return new DifferentIndividuals(annotations, this.individuals);
        }

        @Override
        public Resource toRDF(final RDFContext context) {
            final List<Value> nodes = declareAll(context, this.individuals);
            if (nodes.size() == 2) {
                return context.addTriple((Resource) nodes.get(0), OWL2.DIFFERENT_FROM,
                        nodes.get(1), getAnnotations());
            }
            final BNode node = context.newBNode();
            context.add(node, RDF.TYPE, OWL2.ALL_DIFFERENT);
            context.add(node, OWL2.DISTINCT_MEMBERS, context.sequence(nodes, false));
            context.annotate(node, getAnnotations());
            return node;
        }

        @Override
        protected void appendOperands(final StringBuilder out) {
            appendList(out, this.individuals);
        }

    }

    public static final class ClassAssertion extends Assertion {

        private final ClassExpression classExpression;

        private final IdentifierBox individual;

        ClassAssertion(final List<Annotation> annotations, final ClassExpression classExpression,
                final IdentifierBox individual) {
            super(annotations);
            this.classExpression = classExpression;
            this.individual = individual;
        }

        public ClassExpression getClassExpression() {
            return this.classExpression;
        }

        public IdentifierBox getIndividual() {
            return this.individual;
        }

        @Override
        protected Axiom doWithAnnotations(final List<Annotation> annotations) {
            return new ClassAssertion(annotations, this.classExpression, this.individual);
        }

        @Override
        public Resource toRDF(final RDFContext context) {
            final URI individual = declare(context, this.individual);
            return context.addTriple(individual, RDF.TYPE, this.classExpression.toRDF(context),
                    getAnnotations());
        }

        @Override
        protected void appendOperands(final StringBuilder out) {
            this.classExpression.toFunctional(out);
            out.append(' ');
            this.individual.toFunctional(out);
        }

    }

    private abstract static class PropertyAssertion<P extends Box, T extends Box> extends
            Assertion {

        private final P property;

        private final IdentifierBox source;

        private final T target;

        PropertyAssertion(final List<Annotation> annotations, final P property,
                final IdentifierBox source, final T target) {
            super(annotations);
            this.property = property;
            this.source = source;
            this.target = target;
        }

        public final P getProperty() {
            return this.property;
        }

        public final IdentifierBox getSource() {
            return this.source;
        }

        public final T getTarget() {
            return this.target;
        }

        @Override
        protected final void appendOperands(final StringBuilder out) {
            this.property.toFunctional(out);
            out.append(' ');
            this.source.toFunctional(out);
            out.append(' ');
            this.target.toFunctional(out);
        }

    }

    /**
     * Object property assertion. An assertion over an inverse property is emitted as the
     * triple of the wrapped property with source and target swapped.
     */
    public static final class ObjectPropertyAssertion extends
            PropertyAssertion<ObjectPropertyExpression, IdentifierBox> {

        ObjectPropertyAssertion(final List<Annotation> annotations,
                final ObjectPropertyExpression property, final IdentifierBox source,
                final IdentifierBox target) {
            super(annotations, property, source, target);
        }

        @Override
        protected Axiom doWithAnnotations(final List<Annotation> annotations) {
            return new ObjectPropertyAssertion(annotations, getProperty(), getSource(),
                    getTarget());
        }

        @Override
        public Resource toRDF(final RDFContext context) {
            URI source = declare(context, getSource());
            URI target = declare(context, getTarget());
            if (getProperty() instanceof ObjectPropertyExpression.ObjectInverseOf) {
                final URI swap = source;
                source = target;
                target = swap;
            }
            final URI property = getProperty().getNamedProperty().toRDF(context);
            return context.addTriple(source, property, target, getAnnotations());
        }

    }

    /**
     * Negative object property assertion, always emitted as an
     * {@code owl:NegativePropertyAssertion} node. Unlike {@link ObjectPropertyAssertion}, an
     * inverse property is kept as the asserted property and its wrapped property is declared.
     */
    public static final class NegativeObjectPropertyAssertion extends
            PropertyAssertion<ObjectPropertyExpression, IdentifierBox> {

        NegativeObjectPropertyAssertion(final List<Annotation> annotations,
                final ObjectPropertyExpression property, final IdentifierBox source,
                final IdentifierBox target) {
            super(annotations, property, source, target);
        }

        @Override
        protected Axiom doWithAnnotations(final List<Annotation> annotations) {
            return new NegativeObjectPropertyAssertion(annotations, getProperty(), getSource(),
                    getTarget());
        }

        @Override
        public Resource toRDF(final RDFContext context) {
            final URI source = declare(context, getSource());
            final URI target = declare(context, getTarget());
            getProperty().declareWrapped(context);
            final Resource property = (Resource) getProperty().toRDF(context);
            return context.reify(source, property, target, getAnnotations(),
                    Reification.NEGATIVE_PROPERTY_ASSERTION);
        }

    }

    public static final class DataPropertyAssertion extends
            PropertyAssertion<DataPropertyExpression, LiteralBox> {

        DataPropertyAssertion(final List<Annotation> annotations,
                final DataPropertyExpression property, final IdentifierBox source,
                final LiteralBox target) {
            super(annotations, property, source, target);
        }

        @Override
        protected Axiom doWithAnnotations(final List<Annotation> annotations) {
            return new DataPropertyAssertion(annotations, getProperty(), getSource(),
                    getTarget());
        }

        @Override
        public Resource toRDF(final RDFContext context) {
            final URI source = declare(context, getSource());
            return context.addTriple(source, (URI) getProperty().toRDF(context),
                    getTarget().toRDF(context), getAnnotations());
        }

    }

    public static final class NegativeDataPropertyAssertion extends
            PropertyAssertion<DataPropertyExpression, LiteralBox> {

        NegativeDataPropertyAssertion(final List<Annotation> annotations,
                final DataPropertyExpression property, final IdentifierBox source,
                final LiteralBox target) {
            super(annotations, property, source, target);
        }

        @Override
        protected Axiom doWithAnnotations(final List<Annotation> annotations) {
            return new NegativeDataPropertyAssertion(annotations, getProperty(), getSource(),
                    getTarget());
        }

        @Override
        public Resource toRDF(final RDFContext context) {
            final URI source = declare(context, getSource());
            return context.reify(source, (URI) getProperty().toRDF(context),
                    getTarget().toRDF(context), getAnnotations(),
                    Reification.NEGATIVE_PROPERTY_ASSERTION);
        }

    }

}
