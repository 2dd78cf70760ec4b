package eu.fbk.funowl.data;

import java.util.Collections;
import java.util.List;

import org.openrdf.model.Resource;

import eu.fbk.funowl.vocabulary.OWL2;

/**
 * A datatype definition axiom (OWL 2 section 9.4), emitted as
 * {@code datatype owl:equivalentClass dataRange}.
 */
public final class DatatypeDefinition extends Axiom {

    private final DataRange.Named datatype;

    private final DataRange dataRange;

    private DatatypeDefinition(final List<Annotation> annotations,
            final DataRange.Named datatype, final DataRange dataRange) {
        super(annotations);
        this.datatype = datatype;
        this.dataRange = dataRange;
    }

    public static DatatypeDefinition create(final Object datatype, final Object dataRange) {
        return new DatatypeDefinition(Collections.<Annotation>emptyList(),
                new DataRange.Named(IdentifierBox.of(datatype)), DataRange.of(dataRange));
    }

    public DataRange.Named getDatatype() {
        return this.datatype;
    }

    public DataRange getDataRange() {
        return this.dataRange;
    }

    @Override
    protected Axiom doWithAnnotations(final List<Annotation> annotations) {
        return new DatatypeDefinition(annotations, this.datatype, this.dataRange);
    }

    @Override
    public Resource toRDF(final RDFContext context) {
        return context.addTriple(this.datatype.toRDF(context), OWL2.EQUIVALENT_CLASS,
                this.dataRange.toRDF(context), getAnnotations());
    }

    @Override
    protected void appendOperands(final StringBuilder out) {
        this.datatype.toFunctional(out);
        out.append(' ');
        this.dataRange.toFunctional(out);
    }

}
