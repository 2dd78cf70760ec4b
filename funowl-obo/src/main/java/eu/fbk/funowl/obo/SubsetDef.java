package eu.fbk.funowl.obo;

import com.google.common.base.Preconditions;

import eu.fbk.funowl.data.Reference;
import eu.fbk.funowl.data.Referenced;

/**
 * A subset definition of an OBO ontology header.
 */
public final class SubsetDef implements Referenced {

    private final Reference reference;

    private final String label;

    public SubsetDef(final Reference reference, final String label) {
        this.reference = Preconditions.checkNotNull(reference);
        this.label = Preconditions.checkNotNull(label);
    }

    @Override
    public Reference getReference() {
        return this.reference;
    }

    public String getLabel() {
        return this.label;
    }

    @Override
    public String toString() {
        return this.reference + " \"" + this.label + "\"";
    }

}
