package eu.fbk.funowl.data;

import java.util.Arrays;
import java.util.List;

import com.google.common.collect.ImmutableList;

import org.openrdf.model.Resource;

/**
 * Base class of OWL 2 axioms.
 * <p>
 * An axiom carries an ordered list of {@link Annotation}s, rendered before the operands in
 * functional syntax and reified in RDF. Axioms are immutable: {@link #withAnnotations(Iterable)}
 * returns an annotated copy. Concrete axioms are created with the static factory methods of
 * {@link ClassAxiom}, {@link ObjectPropertyAxiom}, {@link DataPropertyAxiom}, {@link Assertion}
 * and {@link AnnotationAxiom}, or directly for {@link Declaration}, {@link DatatypeDefinition}
 * and {@link HasKey}.
 * </p>
 */
public abstract class Axiom extends Box {

    private final List<Annotation> annotations;

    protected Axiom(final Iterable<Annotation> annotations) {
        this.annotations = ImmutableList.copyOf(annotations);
    }

    public final List<Annotation> getAnnotations() {
        return this.annotations;
    }

    /**
     * Returns a copy of this axiom carrying the annotations specified in place of the current
     * ones.
     *
     * @param annotations
     *            the new annotations, in order
     * @return the annotated axiom
     */
    public final Axiom withAnnotations(final Iterable<Annotation> annotations) {
        return doWithAnnotations(ImmutableList.copyOf(annotations));
    }

    public final Axiom withAnnotations(final Annotation... annotations) {
        return withAnnotations(Arrays.asList(annotations));
    }

    protected abstract Axiom doWithAnnotations(List<Annotation> annotations);

    /**
     * {@inheritDoc} The returned node is the reification node of the axiom, if annotated, or
     * the node of its main operand otherwise.
     */
    @Override
    public abstract Resource toRDF(RDFContext context);

    @Override
    protected final void appendArguments(final StringBuilder out) {
        for (final Annotation annotation : this.annotations) {
            annotation.toFunctional(out);
            out.append(' ');
        }
        appendOperands(out);
    }

    /**
     * Appends the space-separated operands of the axiom, which follow its annotations.
     *
     * @param out
     *            the builder where to append
     */
    protected void appendOperands(final StringBuilder out) {
        throw new UnsupportedOperationException("No functional operands for "
                + getClass().getSimpleName());
    }

}
