package eu.fbk.funowl.obo;

import java.util.Objects;

import com.google.common.base.Preconditions;

import eu.fbk.funowl.data.Annotation;
import eu.fbk.funowl.data.Reference;

/**
 * A predicate and value pair qualifying an OBO value, such as the provenance of a definition or
 * of a cross-reference. The value is either a {@link Reference} or an {@link OboLiteral}.
 */
public final class OboAnnotation {

    private final Reference predicate;

    private final Object value;

    private OboAnnotation(final Reference predicate, final Object value) {
        Preconditions.checkArgument(value instanceof Reference || value instanceof OboLiteral,
                "Unsupported OBO annotation value: %s", value);
        this.predicate = Preconditions.checkNotNull(predicate);
        this.value = value;
    }

    public static OboAnnotation create(final Reference predicate, final Reference value) {
        return new OboAnnotation(predicate, value);
    }

    public static OboAnnotation create(final Reference predicate, final OboLiteral value) {
        return new OboAnnotation(predicate, value);
    }

    public Reference getPredicate() {
        return this.predicate;
    }

    public Object getValue() {
        return this.value;
    }

    /**
     * Converts this OBO annotation into an OWL annotation.
     *
     * @return the OWL annotation, whose value is an IRI or a typed literal
     */
    public Annotation toAnnotation() {
        if (this.value instanceof OboLiteral) {
            return Annotation.create(this.predicate, ((OboLiteral) this.value).toLiteralBox());
        }
        return Annotation.create(this.predicate, this.value);
    }

    @Override
    public boolean equals(final Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof OboAnnotation)) {
            return false;
        }
        final OboAnnotation other = (OboAnnotation) object;
        return this.predicate.equals(other.predicate) && this.value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.predicate, this.value);
    }

    @Override
    public String toString() {
        return this.predicate + " " + this.value;
    }

}
