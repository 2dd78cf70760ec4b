package eu.fbk.funowl.data;

import java.util.List;

import com.google.common.collect.ImmutableList;

import org.openrdf.model.URI;

/**
 * An OWL 2 data property expression. OWL 2 only has named data properties, represented by
 * {@link Named}.
 */
public abstract class DataPropertyExpression extends Box {

    DataPropertyExpression() {
    }

    /**
     * Coerces an object to a data property expression. Expressions are returned unchanged; any
     * other object is interpreted as the identifier of a named data property.
     *
     * @param object
     *            the object to coerce
     * @return the resulting expression
     */
    public static DataPropertyExpression of(final Object object) {
        if (object instanceof DataPropertyExpression) {
            return (DataPropertyExpression) object;
        }
        return new Named(IdentifierBox.of(object));
    }

    static List<DataPropertyExpression> listOf(final Iterable<?> objects) {
        final ImmutableList.Builder<DataPropertyExpression> builder = ImmutableList.builder();
        for (final Object object : objects) {
            builder.add(of(object));
        }
        return builder.build();
    }

    /**
     * A named data property. Its RDF node is the property IRI, typed
     * {@code owl:DatatypeProperty} unless it is {@code owl:topDataProperty} or
     * {@code owl:bottomDataProperty}.
     */
    public static final class Named extends DataPropertyExpression {

        private final IdentifierBox identifier;

        Named(final IdentifierBox identifier) {
            this.identifier = identifier;
        }

        public IdentifierBox getIdentifier() {
            return this.identifier;
        }

        @Override
        public URI toRDF(final RDFContext context) {
            return context.declare(this.identifier, EntityType.DATA_PROPERTY);
        }

        @Override
        public void toFunctional(final StringBuilder out) {
            this.identifier.toFunctional(out);
        }

    }

}
