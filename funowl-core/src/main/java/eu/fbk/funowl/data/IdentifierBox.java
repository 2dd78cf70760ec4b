package eu.fbk.funowl.data;

import java.util.Objects;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;

import org.openrdf.model.URI;

/**
 * A box wrapping either an absolute IRI or a namespaced {@link Reference}.
 * <p>
 * The functional-syntax rendering is the CURIE {@code prefix:identifier} for a reference and
 * {@code <iri>} for an absolute IRI. In RDF, a reference is expanded through the
 * {@link Converter} of the context, while an IRI is emitted as is. Two identifier boxes are equal
 * if they wrap the same IRI or the same reference (display names are ignored).
 * </p>
 */
public final class IdentifierBox extends Box {

    @Nullable
    private final URI uri;

    @Nullable
    private final Reference reference;

    private IdentifierBox(@Nullable final URI uri, @Nullable final Reference reference) {
        this.uri = uri;
        this.reference = reference;
    }

    /**
     * Returns an identifier box for the object specified. Accepted inputs are identifier boxes
     * (returned unchanged), Sesame {@link URI}s, {@link Reference}s and other
     * {@link Referenced} objects (whose display name is dropped), and CURIE strings.
     *
     * @param object
     *            the object to wrap
     * @return the resulting identifier box
     * @throws IllegalArgumentException
     *             if the object has an unsupported type or is a malformed CURIE
     */
    public static IdentifierBox of(final Object object) {
        if (object instanceof IdentifierBox) {
            return (IdentifierBox) object;
        } else if (object instanceof URI) {
            return new IdentifierBox((URI) object, null);
        } else if (object instanceof Referenced) {
            return new IdentifierBox(null, ((Referenced) object).getReference().withName(null));
        } else if (object instanceof String) {
            return new IdentifierBox(null, Reference.parse((String) object));
        }
        throw new IllegalArgumentException("Unsupported identifier: " + object + " ("
                + (object == null ? null : object.getClass().getName()) + ")");
    }

    public boolean isReference() {
        return this.reference != null;
    }

    @Nullable
    public Reference getReference() {
        return this.reference;
    }

    @Nullable
    public URI getURI() {
        return this.uri;
    }

    @Override
    public URI toRDF(final RDFContext context) {
        return this.uri != null ? this.uri : context.expand(this.reference);
    }

    @Override
    public void toFunctional(final StringBuilder out) {
        if (this.uri != null) {
            out.append('<').append(this.uri.stringValue()).append('>');
        } else {
            final String curie = this.reference.getCurie();
            Preconditions.checkArgument(curie.indexOf('(') < 0 && curie.indexOf(')') < 0,
                    "CURIE %s cannot be written in functional syntax", curie);
            out.append(curie);
        }
    }

    @Override
    public boolean equals(final Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof IdentifierBox)) {
            return false;
        }
        final IdentifierBox other = (IdentifierBox) object;
        return Objects.equals(this.uri, other.uri)
                && Objects.equals(this.reference, other.reference);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.uri, this.reference);
    }

}
