package eu.fbk.funowl.data;

import java.util.Arrays;
import java.util.List;

import com.google.common.base.Preconditions;

import org.openrdf.model.Value;

/**
 * A chain of object property expressions, usable only as the sub-property of a
 * {@link ObjectPropertyAxiom#subObjectPropertyOf(Object, Object) SubObjectPropertyOf} axiom.
 * <p>
 * A chain has no RDF node of its own: the enclosing axiom emits it as the collection object of
 * an {@code owl:propertyChainAxiom} triple.
 * </p>
 */
public final class ObjectPropertyChain extends Box {

    private final List<ObjectPropertyExpression> properties;

    private ObjectPropertyChain(final List<ObjectPropertyExpression> properties) {
        Preconditions.checkArgument(properties.size() >= 2,
                "A property chain requires at least two properties, got %s", properties);
        this.properties = properties;
    }

    public static ObjectPropertyChain create(final Object... properties) {
        return create(Arrays.asList(properties));
    }

    public static ObjectPropertyChain create(final Iterable<?> properties) {
        return new ObjectPropertyChain(ObjectPropertyExpression.listOf(properties));
    }

    public List<ObjectPropertyExpression> getProperties() {
        return this.properties;
    }

    @Override
    public Value toRDF(final RDFContext context) {
        throw new UnsupportedOperationException(
                "Property chains can only be emitted within SubObjectPropertyOf axioms");
    }

    @Override
    protected void appendArguments(final StringBuilder out) {
        appendList(out, this.properties);
    }

}
