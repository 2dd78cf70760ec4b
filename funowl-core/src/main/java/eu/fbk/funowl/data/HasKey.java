package eu.fbk.funowl.data;

import java.util.Collections;
import java.util.List;

import com.google.common.base.Preconditions;

import org.openrdf.model.Resource;
import org.openrdf.model.Value;

import eu.fbk.funowl.vocabulary.OWL2;

/**
 * A key axiom (OWL 2 section 9.5).
 * <p>
 * Rendered as {@code HasKey(C (p1 ... pn) (d1 ... dm))}; in RDF the key is the single
 * collection of the object properties followed by the data properties.
 * </p>
 */
public final class HasKey extends Axiom {

    private final ClassExpression classExpression;

    private final List<ObjectPropertyExpression> objectProperties;

    private final List<DataPropertyExpression> dataProperties;

    private HasKey(final List<Annotation> annotations, final ClassExpression classExpression,
            final List<ObjectPropertyExpression> objectProperties,
            final List<DataPropertyExpression> dataProperties) {
        super(annotations);
        Preconditions.checkArgument(!objectProperties.isEmpty() || !dataProperties.isEmpty(),
                "HasKey requires at least one property");
        this.classExpression = classExpression;
        this.objectProperties = objectProperties;
        this.dataProperties = dataProperties;
    }

    /**
     * Creates a key axiom.
     *
     * @param classExpression
     *            the keyed class expression
     * @param objectProperties
     *            the object property expressions of the key, possibly empty
     * @param dataProperties
     *            the data property expressions of the key, possibly empty
     * @return the created axiom
     * @throws IllegalArgumentException
     *             if both property lists are empty
     */
    public static HasKey create(final Object classExpression, final Iterable<?> objectProperties,
            final Iterable<?> dataProperties) {
        return new HasKey(Collections.<Annotation>emptyList(),
                ClassExpression.of(classExpression),
                ObjectPropertyExpression.listOf(objectProperties),
                DataPropertyExpression.listOf(dataProperties));
    }

    public ClassExpression getClassExpression() {
        return this.classExpression;
    }

    public List<ObjectPropertyExpression> getObjectProperties() {
        return this.objectProperties;
    }

    public List<DataPropertyExpression> getDataProperties() {
        return this.dataProperties;
    }

    @Override
    protected Axiom doWithAnnotations(final List<Annotation> annotations) {
        return new HasKey(annotations, this.classExpression, this.objectProperties,
                this.dataProperties);
    }

    @Override
    public Resource toRDF(final RDFContext context) {
        final Resource subject = (Resource) this.classExpression.toRDF(context);
        final List<Value> key = ObjectPropertyAxiom.emitAll(context, this.objectProperties);
        key.addAll(context.nodes(this.dataProperties));
        return context.addTriple(subject, OWL2.HAS_KEY, context.sequence(key, false),
                getAnnotations());
    }

    @Override
    protected void appendOperands(final StringBuilder out) {
        this.classExpression.toFunctional(out);
        out.append(" (");
        appendList(out, this.objectProperties);
        out.append(") (");
        appendList(out, this.dataProperties);
        out.append(')');
    }

}
