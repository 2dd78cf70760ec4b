package eu.fbk.funowl.obo;

import java.util.Objects;

import com.google.common.base.Preconditions;

import org.openrdf.model.ValueFactory;
import org.openrdf.model.impl.ValueFactoryImpl;
import org.openrdf.model.vocabulary.XMLSchema;

import eu.fbk.funowl.data.LiteralBox;
import eu.fbk.funowl.data.Reference;

/**
 * A literal property value of an OBO stanza, given as a lexical form and a datatype reference.
 */
public final class OboLiteral {

    private static final ValueFactory FACTORY = ValueFactoryImpl.getInstance();

    private final String value;

    private final Reference datatype;

    private OboLiteral(final String value, final Reference datatype) {
        this.value = Preconditions.checkNotNull(value);
        this.datatype = Preconditions.checkNotNull(datatype);
    }

    public static OboLiteral create(final String value, final Reference datatype) {
        return new OboLiteral(value, datatype);
    }

    public static OboLiteral string(final String value) {
        return new OboLiteral(value, Reference.create(XMLSchema.PREFIX, "string"));
    }

    public String getValue() {
        return this.value;
    }

    public Reference getDatatype() {
        return this.datatype;
    }

    /**
     * Converts this OBO literal to a literal box.
     *
     * @return the literal box
     * @throws UnsupportedOperationException
     *             if the datatype is not in the {@code xsd} namespace
     */
    public LiteralBox toLiteralBox() {
        if (!XMLSchema.PREFIX.equals(this.datatype.getPrefix())) {
            throw new UnsupportedOperationException(
                    "Literal conversion is not supported for datatype prefix "
                            + this.datatype.getPrefix());
        }
        return LiteralBox.of(this.value,
                FACTORY.createURI(XMLSchema.NAMESPACE, this.datatype.getIdentifier()));
    }

    @Override
    public boolean equals(final Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof OboLiteral)) {
            return false;
        }
        final OboLiteral other = (OboLiteral) object;
        return this.value.equals(other.value) && this.datatype.equals(other.datatype);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.value, this.datatype);
    }

    @Override
    public String toString() {
        return "\"" + this.value + "\"^^" + this.datatype;
    }

}
