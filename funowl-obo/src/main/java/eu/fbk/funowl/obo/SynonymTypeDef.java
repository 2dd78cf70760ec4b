package eu.fbk.funowl.obo;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;

import eu.fbk.funowl.data.Reference;
import eu.fbk.funowl.data.Referenced;
import eu.fbk.funowl.macro.SynonymScope;

/**
 * A synonym type definition of an OBO ontology header.
 */
public final class SynonymTypeDef implements Referenced {

    private final Reference reference;

    private final String name;

    @Nullable
    private final SynonymScope specificity;

    public SynonymTypeDef(final Reference reference, final String name,
            @Nullable final SynonymScope specificity) {
        this.reference = Preconditions.checkNotNull(reference);
        this.name = Preconditions.checkNotNull(name);
        this.specificity = specificity;
    }

    @Override
    public Reference getReference() {
        return this.reference;
    }

    public String getName() {
        return this.name;
    }

    @Nullable
    public SynonymScope getSpecificity() {
        return this.specificity;
    }

    @Override
    public String toString() {
        return this.reference + " \"" + this.name + "\""
                + (this.specificity == null ? "" : " " + this.specificity);
    }

}
