package eu.fbk.funowl.data;

import java.util.Collections;
import java.util.List;

import com.google.common.base.Preconditions;

import org.openrdf.model.Resource;
import org.openrdf.model.URI;
import org.openrdf.model.vocabulary.RDF;

/**
 * A declaration axiom, stating that an IRI denotes an entity of a certain {@link EntityType}.
 * <p>
 * Rendered as {@code Declaration(Class(a:x))}; in RDF it produces the single triple
 * {@code a:x rdf:type owl:Class}, which is emitted even for built-in vocabulary.
 * </p>
 */
public final class Declaration extends Axiom {

    private final IdentifierBox entity;

    private final EntityType type;

    private Declaration(final List<Annotation> annotations, final IdentifierBox entity,
            final EntityType type) {
        super(annotations);
        this.entity = entity;
        this.type = Preconditions.checkNotNull(type);
    }

    /**
     * Creates a declaration axiom.
     *
     * @param entity
     *            the declared entity, any object accepted by {@link IdentifierBox#of(Object)}
     * @param type
     *            the entity type
     * @return the created axiom
     */
    public static Declaration create(final Object entity, final EntityType type) {
        return new Declaration(Collections.<Annotation>emptyList(), IdentifierBox.of(entity), type);
    }

    public IdentifierBox getEntity() {
        return this.entity;
    }

    public EntityType getType() {
        return this.type;
    }

    @Override
    protected Axiom doWithAnnotations(final List<Annotation> annotations) {
        return new Declaration(annotations, this.entity, this.type);
    }

    @Override
    public Resource toRDF(final RDFContext context) {
        final URI uri = this.entity.toRDF(context);
        return context.addTriple(uri, RDF.TYPE, this.type.getType(), getAnnotations());
    }

    @Override
    protected void appendOperands(final StringBuilder out) {
        out.append(this.type.getTag()).append('(');
        this.entity.toFunctional(out);
        out.append(')');
    }

}
