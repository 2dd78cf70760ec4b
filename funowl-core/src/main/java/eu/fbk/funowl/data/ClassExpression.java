package eu.fbk.funowl.data;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import org.openrdf.model.BNode;
import org.openrdf.model.URI;
import org.openrdf.model.Value;
import org.openrdf.model.ValueFactory;
import org.openrdf.model.vocabulary.RDF;
import org.openrdf.model.vocabulary.XMLSchema;

import eu.fbk.funowl.vocabulary.OWL2;

/**
 * An OWL 2 class expression.
 * <p>
 * A class expression is either a {@link Named} class or one of the anonymous class expressions
 * of OWL 2 section 8, created through the static factory methods of this class. Anonymous class
 * expressions are emitted in RDF as blank nodes, typed {@code owl:Class} for boolean connectives
 * and enumerations and {@code owl:Restriction} for property restrictions.
 * </p>
 * <p>
 * Factory methods accept loosely typed arguments: any object accepted by
 * {@link IdentifierBox#of(Object)} is coerced to the corresponding named entity, while boxes of
 * the expected kind are used as they are.
 * </p>
 */
public abstract class ClassExpression extends Box {

    ClassExpression() {
    }

    public static ClassExpression of(final Object object) {
        if (object instanceof ClassExpression) {
            return (ClassExpression) object;
        }
        return new Named(IdentifierBox.of(object));
    }

    static List<ClassExpression> listOf(final Iterable<?> objects) {
        final ImmutableList.Builder<ClassExpression> builder = ImmutableList.builder();
        for (final Object object : objects) {
            builder.add(of(object));
        }
        return builder.build();
    }

    public static ClassExpression intersectionOf(final Object... classExpressions) {
        return intersectionOf(Arrays.asList(classExpressions));
    }

    public static ClassExpression intersectionOf(final Iterable<?> classExpressions) {
        return new ObjectIntersectionOf(listOf(classExpressions));
    }

    public static ClassExpression unionOf(final Object... classExpressions) {
        return unionOf(Arrays.asList(classExpressions));
    }

    public static ClassExpression unionOf(final Iterable<?> classExpressions) {
        return new ObjectUnionOf(listOf(classExpressions));
    }

    public static ClassExpression complementOf(final Object classExpression) {
        return new ObjectComplementOf(of(classExpression));
    }

    public static ClassExpression oneOf(final Object... individuals) {
        return oneOf(Arrays.asList(individuals));
    }

    public static ClassExpression oneOf(final Iterable<?> individuals) {
        final ImmutableList.Builder<IdentifierBox> builder = ImmutableList.builder();
        for (final Object individual : individuals) {
            builder.add(IdentifierBox.of(individual));
        }
        return new ObjectOneOf(builder.build());
    }

    public static ClassExpression someValuesFrom(final Object property,
            final Object classExpression) {
        return new ObjectSomeValuesFrom(ObjectPropertyExpression.of(property),
                of(classExpression));
    }

    public static ClassExpression allValuesFrom(final Object property,
            final Object classExpression) {
        return new ObjectAllValuesFrom(ObjectPropertyExpression.of(property),
                of(classExpression));
    }

    public static ClassExpression hasValue(final Object property, final Object individual) {
        return new ObjectHasValue(ObjectPropertyExpression.of(property),
                IdentifierBox.of(individual));
    }

    public static ClassExpression hasSelf(final Object property) {
        return new ObjectHasSelf(ObjectPropertyExpression.of(property));
    }

    public static ClassExpression minCardinality(final int n, final Object property) {
        return minCardinality(n, property, null);
    }

    /**
     * Returns an {@code ObjectMinCardinality} restriction, qualified if a class expression is
     * supplied.
     *
     * @param n
     *            the cardinality, not negative
     * @param property
     *            the object property expression
     * @param classExpression
     *            the qualifying class expression, null for an unqualified restriction
     * @return the created restriction
     */
    public static ClassExpression minCardinality(final int n, final Object property,
            @Nullable final Object classExpression) {
        return new ObjectMinCardinality(n, ObjectPropertyExpression.of(property),
                classExpression == null ? null : of(classExpression));
    }

    public static ClassExpression maxCardinality(final int n, final Object property) {
        return maxCardinality(n, property, null);
    }

    public static ClassExpression maxCardinality(final int n, final Object property,
            @Nullable final Object classExpression) {
        return new ObjectMaxCardinality(n, ObjectPropertyExpression.of(property),
                classExpression == null ? null : of(classExpression));
    }

    public static ClassExpression exactCardinality(final int n, final Object property) {
        return exactCardinality(n, property, null);
    }

    public static ClassExpression exactCardinality(final int n, final Object property,
            @Nullable final Object classExpression) {
        return new ObjectExactCardinality(n, ObjectPropertyExpression.of(property),
                classExpression == null ? null : of(classExpression));
    }

    public static ClassExpression dataSomeValuesFrom(final Object property,
            final Object dataRange) {
        return dataSomeValuesFrom(Collections.singletonList(property), dataRange);
    }

    /**
     * Returns a {@code DataSomeValuesFrom} restriction over one or more data properties. Only
     * restrictions over a single data property can be emitted in RDF.
     *
     * @param properties
     *            the data property expressions, at least one
     * @param dataRange
     *            the data range
     * @return the created restriction
     */
    public static ClassExpression dataSomeValuesFrom(final Iterable<?> properties,
            final Object dataRange) {
        return new DataSomeValuesFrom(DataPropertyExpression.listOf(properties),
                DataRange.of(dataRange));
    }

    public static ClassExpression dataAllValuesFrom(final Object property,
            final Object dataRange) {
        return dataAllValuesFrom(Collections.singletonList(property), dataRange);
    }

    public static ClassExpression dataAllValuesFrom(final Iterable<?> properties,
            final Object dataRange) {
        return new DataAllValuesFrom(DataPropertyExpression.listOf(properties),
                DataRange.of(dataRange));
    }

    public static ClassExpression dataHasValue(final Object property, final Object literal) {
        return new DataHasValue(DataPropertyExpression.of(property), LiteralBox.of(literal));
    }

    public static ClassExpression dataMinCardinality(final int n, final Object property) {
        return dataMinCardinality(n, property, null);
    }

    public static ClassExpression dataMinCardinality(final int n, final Object property,
            @Nullable final Object dataRange) {
        return new DataMinCardinality(n, DataPropertyExpression.of(property),
                dataRange == null ? null : DataRange.of(dataRange));
    }

    public static ClassExpression dataMaxCardinality(final int n, final Object property) {
        return dataMaxCardinality(n, property, null);
    }

    public static ClassExpression dataMaxCardinality(final int n, final Object property,
            @Nullable final Object dataRange) {
        return new DataMaxCardinality(n, DataPropertyExpression.of(property),
                dataRange == null ? null : DataRange.of(dataRange));
    }

    public static ClassExpression dataExactCardinality(final int n, final Object property) {
        return dataExactCardinality(n, property, null);
    }

    public static ClassExpression dataExactCardinality(final int n, final Object property,
            @Nullable final Object dataRange) {
        return new DataExactCardinality(n, DataPropertyExpression.of(property),
                dataRange == null ? null : DataRange.of(dataRange));
    }

    static BNode newRestriction(final RDFContext context, final Value property) {
        final BNode node = context.newBNode();
        context.add(node, RDF.TYPE, OWL2.RESTRICTION);
        context.add(node, OWL2.ON_PROPERTY, property);
        return node;
    }

    /**
     * A named class, typed {@code owl:Class} unless it is {@code owl:Thing} or
     * {@code owl:Nothing}.
     */
    public static final class Named extends ClassExpression {

        private final IdentifierBox identifier;

        Named(final IdentifierBox identifier) {
            this.identifier = identifier;
        }

        public IdentifierBox getIdentifier() {
            return this.identifier;
        }

        @Override
        public URI toRDF(final RDFContext context) {
            return context.declare(this.identifier, EntityType.CLASS);
        }

        @Override
        public void toFunctional(final StringBuilder out) {
            this.identifier.toFunctional(out);
        }

    }

    private abstract static class Connective extends ClassExpression {

        private final List<ClassExpression> classExpressions;

        Connective(final List<ClassExpression> classExpressions) {
            Preconditions.checkArgument(classExpressions.size() >= 2,
                    "%s requires at least two class expressions, got %s", getTag(),
                    classExpressions);
            this.classExpressions = classExpressions;
        }

        public final List<ClassExpression> getClassExpressions() {
            return this.classExpressions;
        }

        abstract URI getPredicate();

        @Override
        public final Value toRDF(final RDFContext context) {
            final BNode node = context.newBNode();
            context.add(node, RDF.TYPE, OWL2.CLASS);
            context.add(node, getPredicate(), context.sequence(this.classExpressions));
            return node;
        }

        @Override
        protected final void appendArguments(final StringBuilder out) {
            appendList(out, this.classExpressions);
        }

    }

    public static final class ObjectIntersectionOf extends Connective {

        ObjectIntersectionOf(final List<ClassExpression> classExpressions) {
            super(classExpressions);
        }

        @Override
        URI getPredicate() {
            return OWL2.INTERSECTION_OF;
        }

    }

    public static final class ObjectUnionOf extends Connective {

        ObjectUnionOf(final List<ClassExpression> classExpressions) {
            super(classExpressions);
        }

        @Override
        URI getPredicate() {
            return OWL2.UNION_OF;
        }

    }

    public static final class ObjectComplementOf extends ClassExpression {

        private final ClassExpression classExpression;

        ObjectComplementOf(final ClassExpression classExpression) {
            this.classExpression = classExpression;
        }

        public ClassExpression getClassExpression() {
            return this.classExpression;
        }

        @Override
        public Value toRDF(final RDFContext context) {
            final BNode node = context.newBNode();
            context.add(node, RDF.TYPE, OWL2.CLASS);
            context.add(node, OWL2.COMPLEMENT_OF, this.classExpression.toRDF(context));
            return node;
        }

        @Override
        protected void appendArguments(final StringBuilder out) {
            this.classExpression.toFunctional(out);
        }

    }

    /**
     * An enumeration of two or more individuals. In RDF, each individual is typed
     * {@code owl:NamedIndividual} and the collection lists them sorted by IRI.
     */
    public static final class ObjectOneOf extends ClassExpression {

        private final List<IdentifierBox> individuals;

        ObjectOneOf(final List<IdentifierBox> individuals) {
            Preconditions.checkArgument(individuals.size() >= 2,
                    "ObjectOneOf requires at least two individuals, got %s", individuals);
            this.individuals = individuals;
        }

        public List<IdentifierBox> getIndividuals() {
            return this.individuals;
        }

        @Override
        public Value toRDF(final RDFContext context) {
            final List<URI> members = RDFContext.NODE_ORDERING.sortedCopy(declareAll(context));
            final BNode node = context.newBNode();
            context.add(node, RDF.TYPE, OWL2.CLASS);
            context.add(node, OWL2.ONE_OF, context.sequence(members, false));
            return node;
        }

        private List<URI> declareAll(final RDFContext context) {
            final ImmutableList.Builder<URI> builder = ImmutableList.builder();
            for (final IdentifierBox individual : this.individuals) {
                builder.add(context.declare(individual, EntityType.NAMED_INDIVIDUAL));
            }
            return builder.build();
        }

        @Override
        protected void appendArguments(final StringBuilder out) {
            appendList(out, this.individuals);
        }

    }

    private abstract static class ObjectValuesFrom extends ClassExpression {

        private final ObjectPropertyExpression property;

        private final ClassExpression classExpression;

        ObjectValuesFrom(final ObjectPropertyExpression property,
                final ClassExpression classExpression) {
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
        public final Value toRDF(final RDFContext context) {
            final BNode node = newRestriction(context, this.property.toRDF(context));
            context.add(node, getPredicate(), this.classExpression.toRDF(context));
            return node;
        }

        @Override
        protected final void appendArguments(final StringBuilder out) {
            this.property.toFunctional(out);
            out.append(' ');
            this.classExpression.toFunctional(out);
        }

    }

    public static final class ObjectSomeValuesFrom extends ObjectValuesFrom {

        ObjectSomeValuesFrom(final ObjectPropertyExpression property,
                final ClassExpression classExpression) {
            super(property, classExpression);
        }

        @Override
        URI getPredicate() {
            return OWL2.SOME_VALUES_FROM;
        }

    }

    public static final class ObjectAllValuesFrom extends ObjectValuesFrom {

        ObjectAllValuesFrom(final ObjectPropertyExpression property,
                final ClassExpression classExpression) {
            super(property, classExpression);
        }

        @Override
        URI getPredicate() {
            return OWL2.ALL_VALUES_FROM;
        }

    }

    public static final class ObjectHasValue extends ClassExpression {

        private final ObjectPropertyExpression property;

        private final IdentifierBox individual;

        ObjectHasValue(final ObjectPropertyExpression property, final IdentifierBox individual) {
            this.property = property;
            this.individual = individual;
        }

        public ObjectPropertyExpression getProperty() {
            return this.property;
        }

        public IdentifierBox getIndividual() {
            return this.individual;
        }

        @Override
        public Value toRDF(final RDFContext context) {
            final BNode node = newRestriction(context, this.property.toRDF(context));
            context.add(node, OWL2.HAS_VALUE,
                    context.declare(this.individual, EntityType.NAMED_INDIVIDUAL));
            return node;
        }

        @Override
        protected void appendArguments(final StringBuilder out) {
            this.property.toFunctional(out);
            out.append(' ');
            this.individual.toFunctional(out);
        }

    }

    public static final class ObjectHasSelf extends ClassExpression {

        private final ObjectPropertyExpression property;

        ObjectHasSelf(final ObjectPropertyExpression property) {
            this.property = property;
        }

        public ObjectPropertyExpression getProperty() {
            return this.property;
        }

        @Override
        public Value toRDF(final RDFContext context) {
            final BNode node = newRestriction(context, this.property.toRDF(context));
            final ValueFactory factory = context.getValueFactory();
            context.add(node, OWL2.HAS_SELF, factory.createLiteral("true", XMLSchema.BOOLEAN));
            return node;
        }

        @Override
        protected void appendArguments(final StringBuilder out) {
            this.property.toFunctional(out);
        }

    }

    /**
     * Base class of the six cardinality restrictions. Subclasses select the predicates used
     * for the qualified and unqualified forms.
     */
    private abstract static class Cardinality<P extends Box, T extends Box> extends
            ClassExpression {

        private final int cardinality;

        private final P property;

        @Nullable
        private final T target;

        Cardinality(final int cardinality, final P property, @Nullable final T target) {
            Preconditions.checkArgument(cardinality >= 0, "Negative cardinality %s",
                    cardinality);
            this.cardinality = cardinality;
            this.property = property;
            this.target = target;
        }

        public final int getCardinality() {
            return this.cardinality;
        }

        public final P getProperty() {
            return this.property;
        }

        @Nullable
        public final T getTarget() {
            return this.target;
        }

        abstract URI getQualifiedPredicate();

        abstract URI getUnqualifiedPredicate();

        abstract URI getTargetPredicate();

        Value propertyToRDF(final RDFContext context) {
            return this.property.toRDF(context);
        }

        @Override
        public final Value toRDF(final RDFContext context) {
            final BNode node = newRestriction(context, propertyToRDF(context));
            final Value literal = context.getValueFactory().createLiteral(
                    Integer.toString(this.cardinality), XMLSchema.NON_NEGATIVE_INTEGER);
            if (this.target != null) {
                context.add(node, getQualifiedPredicate(), literal);
                context.add(node, getTargetPredicate(), this.target.toRDF(context));
            } else {
                context.add(node, getUnqualifiedPredicate(), literal);
            }
            return node;
        }

        @Override
        protected final void appendArguments(final StringBuilder out) {
            out.append(this.cardinality).append(' ');
            this.property.toFunctional(out);
            if (this.target != null) {
                out.append(' ');
                this.target.toFunctional(out);
            }
        }

    }

    private abstract static class ObjectCardinality extends
            Cardinality<ObjectPropertyExpression, ClassExpression> {

        ObjectCardinality(final int cardinality, final ObjectPropertyExpression property,
                @Nullable final ClassExpression target) {
            super(cardinality, property, target);
        }

        @Override
        final Value propertyToRDF(final RDFContext context) {
            getProperty().declareWrapped(context);
            return getProperty().toRDF(context);
        }

        @Override
        final URI getTargetPredicate() {
            return OWL2.ON_CLASS;
        }

    }

    public static final class ObjectMinCardinality extends ObjectCardinality {

        ObjectMinCardinality(final int cardinality, final ObjectPropertyExpression property,
                @Nullable final ClassExpression target) {
            super(cardinality, property, target);
        }

        @Override
        URI getQualifiedPredicate() {
            return OWL2.MIN_QUALIFIED_CARDINALITY;
        }

        @Override
        URI getUnqualifiedPredicate() {
            return OWL2.MIN_CARDINALITY;
        }

    }

    public static final class ObjectMaxCardinality extends ObjectCardinality {

        ObjectMaxCardinality(final int cardinality, final ObjectPropertyExpression property,
                @Nullable final ClassExpression target) {
            super(cardinality, property, target);
        }

        @Override
        URI getQualifiedPredicate() {
            return OWL2.MAX_QUALIFIED_CARDINALITY;
        }

        @Override
        URI getUnqualifiedPredicate() {
            return OWL2.MAX_CARDINALITY;
        }

    }

    public static final class ObjectExactCardinality extends ObjectCardinality {

        ObjectExactCardinality(final int cardinality, final ObjectPropertyExpression property,
                @Nullable final ClassExpression target) {
            super(cardinality, property, target);
        }

        @Override
        URI getQualifiedPredicate() {
            return OWL2.QUALIFIED_CARDINALITY;
        }

        @Override
        URI getUnqualifiedPredicate() {
            return OWL2.CARDINALITY;
        }

    }

    private abstract static class DataCardinality extends
            Cardinality<DataPropertyExpression, DataRange> {

        DataCardinality(final int cardinality, final DataPropertyExpression property,
                @Nullable final DataRange target) {
            super(cardinality, property, target);
        }

        @Override
        final URI getTargetPredicate() {
            return OWL2.ON_DATA_RANGE;
        }

    }

    public static final class DataMinCardinality extends DataCardinality {

        DataMinCardinality(final int cardinality, final DataPropertyExpression property,
                @Nullable final DataRange target) {
            super(cardinality, property, target);
        }

        @Override
        URI getQualifiedPredicate() {
            return OWL2.MIN_QUALIFIED_CARDINALITY;
        }

        @Override
        URI getUnqualifiedPredicate() {
            return OWL2.MIN_CARDINALITY;
        }

    }

    public static final class DataMaxCardinality extends DataCardinality {

        DataMaxCardinality(final int cardinality, final DataPropertyExpression property,
                @Nullable final DataRange target) {
            super(cardinality, property, target);
        }

        @Override
        URI getQualifiedPredicate() {
            return OWL2.MAX_QUALIFIED_CARDINALITY;
        }

        @Override
        URI getUnqualifiedPredicate() {
            return OWL2.MAX_CARDINALITY;
        }

    }

    public static final class DataExactCardinality extends DataCardinality {

        DataExactCardinality(final int cardinality, final DataPropertyExpression property,
                @Nullable final DataRange target) {
            super(cardinality, property, target);
        }

        @Override
        URI getQualifiedPredicate() {
            return OWL2.QUALIFIED_CARDINALITY;
        }

        @Override
        URI getUnqualifiedPredicate() {
            return OWL2.CARDINALITY;
        }

    }

    private abstract static class DataValuesFrom extends ClassExpression {

        private final List<DataPropertyExpression> properties;

        private final DataRange dataRange;

        DataValuesFrom(final List<DataPropertyExpression> properties, final DataRange dataRange) {
            Preconditions.checkArgument(!properties.isEmpty(),
                    "%s requires at least one data property", getTag());
            this.properties = properties;
            this.dataRange = dataRange;
        }

        public final List<DataPropertyExpression> getProperties() {
            return this.properties;
        }

        public final DataRange getDataRange() {
            return this.dataRange;
        }

        abstract URI getPredicate();

        @Override
        public final Value toRDF(final RDFContext context) {
            if (this.properties.size() > 1) {
                throw new UnsupportedOperationException(getTag()
                        + " over multiple data properties cannot be emitted in RDF");
            }
            final BNode node = newRestriction(context, this.properties.get(0).toRDF(context));
            context.add(node, getPredicate(), this.dataRange.toRDF(context));
            return node;
        }

        @Override
        protected final void appendArguments(final StringBuilder out) {
            appendList(out, this.properties);
            out.append(' ');
            this.dataRange.toFunctional(out);
        }

    }

    public static final class DataSomeValuesFrom extends DataValuesFrom {

        DataSomeValuesFrom(final List<DataPropertyExpression> properties,
                final DataRange dataRange) {
            super(properties, dataRange);
        }

        @Override
        URI getPredicate() {
            return OWL2.SOME_VALUES_FROM;
        }

    }

    public static final class DataAllValuesFrom extends DataValuesFrom {

        DataAllValuesFrom(final List<DataPropertyExpression> properties,
                final DataRange dataRange) {
            super(properties, dataRange);
        }

        @Override
        URI getPredicate() {
            return OWL2.ALL_VALUES_FROM;
        }

    }

    public static final class DataHasValue extends ClassExpression {

        private final DataPropertyExpression property;

        private final LiteralBox literal;

        DataHasValue(final DataPropertyExpression property, final LiteralBox literal) {
            this.property = property;
            this.literal = literal;
        }

        public DataPropertyExpression getProperty() {
            return this.property;
        }

        public LiteralBox getLiteral() {
            return this.literal;
        }

        @Override
        public Value toRDF(final RDFContext context) {
            final BNode node = newRestriction(context, this.property.toRDF(context));
            context.add(node, OWL2.HAS_VALUE, this.literal.toRDF(context));
            return node;
        }

        @Override
        protected void appendArguments(final StringBuilder out) {
            this.property.toFunctional(out);
            out.append(' ');
            this.literal.toFunctional(out);
        }

    }

}
