package eu.fbk.funowl.data;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;

import javax.annotation.Nullable;
import javax.xml.datatype.XMLGregorianCalendar;

import com.google.common.base.Preconditions;

import org.openrdf.model.Literal;
import org.openrdf.model.URI;
import org.openrdf.model.ValueFactory;
import org.openrdf.model.impl.ValueFactoryImpl;
import org.openrdf.model.vocabulary.RDF;
import org.openrdf.model.vocabulary.RDFS;
import org.openrdf.model.vocabulary.XMLSchema;

import eu.fbk.funowl.vocabulary.OWL2;

/**
 * A box wrapping an RDF literal.
 * <p>
 * Literals are rendered in functional syntax as {@code "label"} for plain strings,
 * {@code "label"@lang} for language-tagged strings and {@code "label"^^datatype} otherwise, where
 * the datatype is written as a CURIE for the predeclared {@code xsd}, {@code rdf}, {@code rdfs}
 * and {@code owl} namespaces and as {@code <iri>} for any other namespace.
 * </p>
 */
public final class LiteralBox extends Box {

    private static final ValueFactory FACTORY = ValueFactoryImpl.getInstance();

    private final Literal literal;

    private LiteralBox(final Literal literal) {
        this.literal = literal;
    }

    /**
     * Returns a literal box for the object specified. Supported inputs are: literal boxes
     * (returned unchanged) and Sesame {@link Literal}s; booleans ({@code xsd:boolean}); integral
     * numbers ({@code xsd:integer}); floating point numbers and {@link BigDecimal}s (
     * {@code xsd:decimal}); strings (plain literals); {@link LocalDate}s ({@code xsd:date}); and
     * {@link LocalDateTime}s, {@link OffsetDateTime}s, {@link ZonedDateTime}s and
     * {@link XMLGregorianCalendar}s ({@code xsd:dateTime}).
     *
     * @param object
     *            the object to wrap
     * @return the resulting literal box
     * @throws IllegalArgumentException
     *             if the object has an unsupported type or is a non-finite number
     */
    public static LiteralBox of(final Object object) {
        if (object instanceof LiteralBox) {
            return (LiteralBox) object;
        } else if (object instanceof Literal) {
            return new LiteralBox((Literal) object);
        } else if (object instanceof String) {
            return new LiteralBox(FACTORY.createLiteral((String) object));
        } else if (object instanceof Boolean) {
            return of(object.toString(), XMLSchema.BOOLEAN);
        } else if (object instanceof Integer || object instanceof Long
                || object instanceof Short || object instanceof Byte
                || object instanceof BigInteger) {
            return of(object.toString(), XMLSchema.INTEGER);
        } else if (object instanceof Double || object instanceof Float) {
            final double value = ((Number) object).doubleValue();
            Preconditions.checkArgument(!Double.isNaN(value) && !Double.isInfinite(value),
                    "Cannot represent %s as xsd:decimal", object);
            final BigDecimal decimal = object instanceof Float ? new BigDecimal(object.toString())
                    : BigDecimal.valueOf(value);
            return of(decimal.toPlainString(), XMLSchema.DECIMAL);
        } else if (object instanceof BigDecimal) {
            return of(((BigDecimal) object).toPlainString(), XMLSchema.DECIMAL);
        } else if (object instanceof LocalDate) {
            return of(DateTimeFormatter.ISO_LOCAL_DATE.format((LocalDate) object),
                    XMLSchema.DATE);
        } else if (object instanceof LocalDateTime) {
            return of(DateTimeFormatter.ISO_LOCAL_DATE_TIME.format((LocalDateTime) object),
                    XMLSchema.DATETIME);
        } else if (object instanceof OffsetDateTime) {
            return of(DateTimeFormatter.ISO_OFFSET_DATE_TIME.format((OffsetDateTime) object),
                    XMLSchema.DATETIME);
        } else if (object instanceof ZonedDateTime) {
            return of(DateTimeFormatter.ISO_OFFSET_DATE_TIME.format((ZonedDateTime) object),
                    XMLSchema.DATETIME);
        } else if (object instanceof XMLGregorianCalendar) {
            return new LiteralBox(FACTORY.createLiteral((XMLGregorianCalendar) object));
        }
        throw new IllegalArgumentException("Unsupported literal: " + object + " ("
                + (object == null ? null : object.getClass().getName()) + ")");
    }

    /**
     * Returns a string literal box with an optional language tag.
     *
     * @param label
     *            the string value
     * @param language
     *            the language tag, or null for a plain string
     * @return the resulting literal box
     */
    public static LiteralBox of(final String label, @Nullable final String language) {
        return new LiteralBox(language == null ? FACTORY.createLiteral(label) : FACTORY
                .createLiteral(label, language));
    }

    /**
     * Returns a typed literal box.
     *
     * @param label
     *            the lexical form
     * @param datatype
     *            the datatype IRI
     * @return the resulting literal box
     */
    public static LiteralBox of(final String label, final URI datatype) {
        return new LiteralBox(FACTORY.createLiteral(label, datatype));
    }

    public Literal getLiteral() {
        return this.literal;
    }

    @Override
    public Literal toRDF(final RDFContext context) {
        return this.literal;
    }

    @Override
    public void toFunctional(final StringBuilder out) {
        out.append('"');
        final String label = this.literal.getLabel();
        for (int i = 0; i < label.length(); ++i) {
            final char c = label.charAt(i);
            if (c == '"' || c == '\\') {
                out.append('\\');
            }
            out.append(c);
        }
        out.append('"');
        final String language = this.literal.getLanguage();
        final URI datatype = this.literal.getDatatype();
        if (language != null) {
            out.append('@').append(language);
        } else if (datatype != null && !datatype.equals(XMLSchema.STRING)) {
            out.append("^^");
            final String namespace = datatype.getNamespace();
            if (namespace.equals(XMLSchema.NAMESPACE)) {
                out.append("xsd:").append(datatype.getLocalName());
            } else if (namespace.equals(RDF.NAMESPACE)) {
                out.append("rdf:").append(datatype.getLocalName());
            } else if (namespace.equals(RDFS.NAMESPACE)) {
                out.append("rdfs:").append(datatype.getLocalName());
            } else if (namespace.equals(OWL2.NAMESPACE)) {
                out.append("owl:").append(datatype.getLocalName());
            } else {
                out.append('<').append(datatype.stringValue()).append('>');
            }
        }
    }

    @Override
    public boolean equals(final Object object) {
        return object == this || object instanceof LiteralBox
                && this.literal.equals(((LiteralBox) object).literal);
    }

    @Override
    public int hashCode() {
        return this.literal.hashCode();
    }

}
