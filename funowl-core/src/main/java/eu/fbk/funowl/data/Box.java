package eu.fbk.funowl.data;

import java.time.temporal.Temporal;

import javax.xml.datatype.XMLGregorianCalendar;

import org.openrdf.model.Literal;
import org.openrdf.model.URI;
import org.openrdf.model.Value;

/**
 * Base class of all the OWL 2 constructs of the model.
 * <p>
 * A {@code Box} has two independent renderings: an RDF node obtained with
 * {@link #toRDF(RDFContext)}, which also adds to the context graph all the triples needed to
 * describe the node, and an OWL 2 Functional-Style Syntax string obtained with
 * {@link #toFunctional()}. The default functional rendering is {@code Tag(args)}, where the tag
 * is the simple name of the box class and the arguments are produced by
 * {@link #appendArguments(StringBuilder)}. Boxes are immutable and never keep a reference to the
 * context they are emitted into.
 * </p>
 */
public abstract class Box {

    protected Box() {
    }

    /**
     * Returns the RDF node for this box, adding the triples describing it to the supplied
     * context.
     *
     * @param context
     *            the emission context holding the target graph and the CURIE converter
     * @return the RDF node representing the box
     * @throws UnsupportedOperationException
     *             if the box has no RDF node representation
     */
    public abstract Value toRDF(RDFContext context);

    /**
     * Appends the functional-syntax rendering of this box to the supplied builder.
     *
     * @param out
     *            the builder where to append
     */
    public void toFunctional(final StringBuilder out) {
        out.append(getTag()).append('(');
        appendArguments(out);
        out.append(')');
    }

    public final String toFunctional() {
        final StringBuilder builder = new StringBuilder();
        toFunctional(builder);
        return builder.toString();
    }

    /**
     * Returns the functional-syntax tag of this box, which defaults to the class simple name.
     *
     * @return the tag
     */
    protected String getTag() {
        return getClass().getSimpleName();
    }

    /**
     * Appends the space-separated arguments of the functional-syntax rendering of the box.
     *
     * @param out
     *            the builder where to append
     */
    protected void appendArguments(final StringBuilder out) {
        throw new UnsupportedOperationException("No functional arguments for "
                + getClass().getSimpleName());
    }

    @Override
    public String toString() {
        return toFunctional();
    }

    /**
     * Converts a primitive value to an {@link IdentifierBox} or a {@link LiteralBox}. Strings,
     * {@link URI}s and {@link Referenced} objects become identifiers (a string being parsed as a
     * CURIE); {@link Literal}s, booleans, numbers and dates become literals. Use
     * {@link LiteralBox#of(Object)} to obtain a string literal.
     *
     * @param value
     *            the value to convert
     * @return the resulting primitive box
     * @throws IllegalArgumentException
     *             if the value has an unsupported type
     */
    public static Box primitive(final Object value) {
        if (value instanceof IdentifierBox || value instanceof LiteralBox) {
            return (Box) value;
        } else if (value instanceof Literal || value instanceof Boolean
                || value instanceof Number || value instanceof java.time.temporal.Temporal
                || value instanceof XMLGregorianCalendar) {
            return LiteralBox.of(value);
        } else if (value instanceof String || value instanceof URI
                || value instanceof Referenced) {
            return IdentifierBox.of(value);
        }
        throw new IllegalArgumentException("Unsupported primitive value: " + value + " ("
                + (value == null ? null : value.getClass().getName()) + ")");
    }

    static void appendList(final StringBuilder out, final Iterable<? extends Box> boxes) {
        String separator = "";
        for (final Box box : boxes) {
            out.append(separator);
            box.toFunctional(out);
            separator = " ";
        }
    }

}
