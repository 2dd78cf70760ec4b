package eu.fbk.funowl.data;

import java.util.Collections;
import java.util.List;

import org.openrdf.model.Resource;
import org.openrdf.model.URI;
import org.openrdf.model.vocabulary.RDFS;

/**
 * Annotation axioms of OWL 2 section 10.2. Annotation properties are typed
 * {@code owl:AnnotationProperty} in RDF unless they are built in.
 */
public abstract class AnnotationAxiom extends Axiom {

    AnnotationAxiom(final List<Annotation> annotations) {
        super(annotations);
    }

    private static List<Annotation> none() {
        return Collections.emptyList();
    }

    static URI declare(final RDFContext context, final IdentifierBox property) {
        return context.declare(property, EntityType.ANNOTATION_PROPERTY);
    }

    /**
     * Creates an {@code AnnotationAssertion} axiom.
     *
     * @param property
     *            the annotation property
     * @param subject
     *            the annotated IRI
     * @param value
     *            the annotation value, coerced with {@link Box#primitive(Object)}: a Java string
     *            is read as a CURIE, while a {@link LiteralBox} or a Sesame literal is used as a
     *            literal
     * @return the created axiom
     */
    public static AnnotationAssertion annotationAssertion(final Object property,
            final Object subject, final Object value) {
        return new AnnotationAssertion(none(), IdentifierBox.of(property),
                IdentifierBox.of(subject), Box.primitive(value));
    }

    public static SubAnnotationPropertyOf subAnnotationPropertyOf(final Object child,
            final Object parent) {
        return new SubAnnotationPropertyOf(none(), IdentifierBox.of(child),
                IdentifierBox.of(parent));
    }

    public static AnnotationPropertyDomain annotationPropertyDomain(final Object property,
            final Object domain) {
        return new AnnotationPropertyDomain(none(), IdentifierBox.of(property),
                IdentifierBox.of(domain));
    }

    public static AnnotationPropertyRange annotationPropertyRange(final Object property,
            final Object range) {
        return new AnnotationPropertyRange(none(), IdentifierBox.of(property),
                IdentifierBox.of(range));
    }

    public static final class AnnotationAssertion extends AnnotationAxiom {

        private final IdentifierBox property;

        private final IdentifierBox subject;

        private final Box value;

        AnnotationAssertion(final List<Annotation> annotations, final IdentifierBox property,
                final IdentifierBox subject, final Box value) {
            super(annotations);
            this.property = property;
            this.subject = subject;
            this.value = value;
        }

        public IdentifierBox getProperty() {
            return this.property;
        }

        public IdentifierBox getSubject() {
            return this.subject;
        }

        public Box getValue() {
            return this.value;
        }

        @Override
        protected Axiom doWithAnnotations(final List<Annotation> annotations) {
            return new AnnotationAssertion(annotations, this.property, this.subject, this.value);
        }

        @Override
        public Resource toRDF(final RDFContext context) {
            final URI property = declare(context, this.property);
            return context.addTriple(this.subject.toRDF(context), property,
                    this.value.toRDF(context), getAnnotations());
        }

        @Override
        protected void appendOperands(final StringBuilder out) {
            this.property.toFunctional(out);
            out.append(' ');
            this.subject.toFunctional(out);
            out.append(' ');
            this.value.toFunctional(out);
        }

    }

    public static final class SubAnnotationPropertyOf extends AnnotationAxiom {

        private final IdentifierBox child;

        private final IdentifierBox parent;

        SubAnnotationPropertyOf(final List<Annotation> annotations, final IdentifierBox child,
                final IdentifierBox parent) {
            super(annotations);
            this.child = child;
            this.parent = parent;
        }

        public IdentifierBox getChild() {
            return this.child;
        }

        public IdentifierBox getParent() {
            return this.parent;
        }

        @Override
        protected Axiom doWithAnnotations(final List<Annotation> annotations) {
            return new SubAnnotationPropertyOf(annotations, this.child, this.parent);
        }

        @Override
        public Resource toRDF(final RDFContext context) {
            final URI child = declare(context, this.child);
            return context.addTriple(child, RDFS.SUBPROPERTYOF, declare(context, this.parent),
                    getAnnotations());
        }

        @Override
        protected void appendOperands(final StringBuilder out) {
            this.child.toFunctional(out);
            out.append(' ');
            this.parent.toFunctional(out);
        }

    }

    private abstract static class PropertyTyping extends AnnotationAxiom {

        private final IdentifierBox property;

        private final IdentifierBox value;

        PropertyTyping(final List<Annotation> annotations, final IdentifierBox property,
                final IdentifierBox value) {
            super(annotations);
            this.property = property;
            this.value = value;
        }

        public final IdentifierBox getProperty() {
            return this.property;
        }

        public final IdentifierBox getValue() {
            return this.value;
        }

        abstract URI getPredicate();

        @Override
        public final Resource toRDF(final RDFContext context) {
            final URI property = declare(context, this.property);
            return context.addTriple(property, getPredicate(), this.value.toRDF(context),
                    getAnnotations());
        }

        @Override
        protected final void appendOperands(final StringBuilder out) {
            this.property.toFunctional(out);
            out.append(' ');
            this.value.toFunctional(out);
        }

    }

    public static final class AnnotationPropertyDomain extends PropertyTyping {

        AnnotationPropertyDomain(final List<Annotation> annotations,
                final IdentifierBox property, final IdentifierBox domain) {
            super(annotations, property, domain);
        }

        @Override
        URI getPredicate() {
            return RDFS.DOMAIN;
        }

        @Override
        protected Axiom doWithAnnotations(final List<Annotation> annotations) {
            return new AnnotationPropertyDomain(annotations, getProperty(), getValue());
        }

    }

    public static final class AnnotationPropertyRange extends PropertyTyping {

        AnnotationPropertyRange(final List<Annotation> annotations,
                final IdentifierBox property, final IdentifierBox range) {
            super(annotations, property, range);
        }

        @Override
        URI getPredicate() {
            return RDFS.RANGE;
        }

        @Override
        protected Axiom doWithAnnotations(final List<Annotation> annotations) {
            return new AnnotationPropertyRange(annotations, getProperty(), getValue());
        }

    }

}
