package eu.fbk.funowl.data;

import java.util.Arrays;
import java.util.List;

import com.google.common.collect.ImmutableList;

import org.openrdf.model.Value;

/**
 * An annotation, i.e., an annotation property and value pair that can be attached to axioms,
 * ontologies and other annotations.
 * <p>
 * Annotations are recursive: each annotation may carry nested annotations to any depth. In RDF an
 * annotation exists only attached to the node it annotates (see
 * {@link RDFContext#annotate(org.openrdf.model.Resource, List)}), so {@link #toRDF(RDFContext)}
 * is not supported.
 * </p>
 */
public final class Annotation extends Box {

    private final IdentifierBox property;

    private final Box value;

    private final List<Annotation> annotations;

    private Annotation(final IdentifierBox property, final Box value,
            final List<Annotation> annotations) {
        this.property = property;
        this.value = value;
        this.annotations = annotations;
    }

    /**
     * Creates an annotation.
     *
     * @param property
     *            the annotation property, any object accepted by {@link IdentifierBox#of(Object)}
     * @param value
     *            the value, any object accepted by {@link Box#primitive(Object)}
     * @param annotations
     *            nested annotations
     * @return the created annotation
     */
    public static Annotation create(final Object property, final Object value,
            final Annotation... annotations) {
        return create(property, value, Arrays.asList(annotations));
    }

    /**
     * Creates an annotation with nested annotations taken from an iterable.
     *
     * @param property
     *            the annotation property, any object accepted by {@link IdentifierBox#of(Object)}
     * @param value
     *            the value, any object accepted by {@link Box#primitive(Object)}
     * @param annotations
     *            nested annotations, in order
     * @return the created annotation
     */
    public static Annotation create(final Object property, final Object value,
            final Iterable<Annotation> annotations) {
        return new Annotation(IdentifierBox.of(property), primitive(value),
                ImmutableList.copyOf(annotations));
    }

    public IdentifierBox getProperty() {
        return this.property;
    }

    /**
     * Returns the annotation value, either an {@link IdentifierBox} or a {@link LiteralBox}.
     *
     * @return the value
     */
    public Box getValue() {
        return this.value;
    }

    public List<Annotation> getAnnotations() {
        return this.annotations;
    }

    @Override
    public Value toRDF(final RDFContext context) {
        throw new UnsupportedOperationException(
                "Annotations can only be emitted attached to the node they annotate");
    }

    @Override
    protected void appendArguments(final StringBuilder out) {
        for (final Annotation annotation : this.annotations) {
            annotation.toFunctional(out);
            out.append(' ');
        }
        this.property.toFunctional(out);
        out.append(' ');
        this.value.toFunctional(out);
    }

}
