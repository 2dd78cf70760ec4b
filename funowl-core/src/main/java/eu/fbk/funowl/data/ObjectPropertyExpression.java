package eu.fbk.funowl.data;

import java.util.List;

import com.google.common.collect.ImmutableList;

import org.openrdf.model.BNode;
import org.openrdf.model.URI;
import org.openrdf.model.Value;

import eu.fbk.funowl.vocabulary.OWL2;

/**
 * An OWL 2 object property expression: either a {@link Named} object property or the
 * {@link ObjectInverseOf inverse} of a named object property.
 */
public abstract class ObjectPropertyExpression extends Box {

    ObjectPropertyExpression() {
    }

    /**
     * Coerces an object to an object property expression. Expressions are returned unchanged;
     * any other object is interpreted as the identifier of a named object property.
     *
     * @param object
     *            the object to coerce
     * @return the resulting expression
     */
    public static ObjectPropertyExpression of(final Object object) {
        if (object instanceof ObjectPropertyExpression) {
            return (ObjectPropertyExpression) object;
        }
        return new Named(IdentifierBox.of(object));
    }

    /**
     * Returns the inverse of a named object property.
     *
     * @param property
     *            the property, either a {@link Named} expression or an identifier
     * @return the inverse property expression
     * @throws IllegalArgumentException
     *             if the property is itself an inverse
     */
    public static ObjectInverseOf inverseOf(final Object property) {
        final ObjectPropertyExpression expression = of(property);
        if (!(expression instanceof Named)) {
            throw new IllegalArgumentException("Only named object properties can be inverted: "
                    + expression);
        }
        return new ObjectInverseOf((Named) expression);
    }

    static List<ObjectPropertyExpression> listOf(final Iterable<?> objects) {
        final ImmutableList.Builder<ObjectPropertyExpression> builder = ImmutableList.builder();
        for (final Object object : objects) {
            builder.add(of(object));
        }
        return builder.build();
    }

    /**
     * Returns the named object property this expression is based on.
     *
     * @return the named property (this expression, if named)
     */
    public abstract Named getNamedProperty();

    /**
     * Types as {@code owl:ObjectProperty} the named property wrapped by an inverse expression;
     * does nothing for named properties, which are typed when emitted.
     *
     * @param context
     *            the emission context
     */
    public abstract void declareWrapped(RDFContext context);

    /**
     * A named object property. Its RDF node is the property IRI, typed
     * {@code owl:ObjectProperty} unless it is {@code owl:topObjectProperty} or
     * {@code owl:bottomObjectProperty}.
     */
    public static final class Named extends ObjectPropertyExpression {

        private final IdentifierBox identifier;

        Named(final IdentifierBox identifier) {
            this.identifier = identifier;
        }

        public IdentifierBox getIdentifier() {
            return this.identifier;
        }

        @Override
        public Named getNamedProperty() {
            return this;
        }

        @Override
        public void declareWrapped(final RDFContext context) {
            // typed by toRDF()
        }

        @Override
        public URI toRDF(final RDFContext context) {
            return context.declare(this.identifier, EntityType.OBJECT_PROPERTY);
        }

        @Override
        public void toFunctional(final StringBuilder out) {
            this.identifier.toFunctional(out);
        }

    }

    /**
     * The inverse of a named object property. Its RDF node is a fresh blank node linked with
     * {@code owl:inverseOf} to the IRI of the wrapped property, which is not typed; axioms that
     * require the typing call {@link #declareWrapped(RDFContext)}.
     */
    public static final class ObjectInverseOf extends ObjectPropertyExpression {

        private final Named property;

        ObjectInverseOf(final Named property) {
            this.property = property;
        }

        @Override
        public Named getNamedProperty() {
            return this.property;
        }

        @Override
        public void declareWrapped(final RDFContext context) {
            this.property.toRDF(context);
        }

        @Override
        public Value toRDF(final RDFContext context) {
            final BNode node = context.newBNode();
            context.add(node, OWL2.INVERSE_OF, this.property.getIdentifier().toRDF(context));
            return node;
        }

        @Override
        protected void appendArguments(final StringBuilder out) {
            this.property.toFunctional(out);
        }

    }

}
