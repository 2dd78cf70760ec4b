package eu.fbk.funowl.obo;

import java.util.Collections;
import java.util.List;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import eu.fbk.funowl.data.Reference;
import eu.fbk.funowl.macro.SynonymScope;

/**
 * An OBO synonym: a text with optional scope, synonym type, language, provenance and
 * annotations.
 */
public final class Synonym {

    private final String name;

    @Nullable
    private final SynonymScope scope;

    @Nullable
    private final Reference type;

    @Nullable
    private final String language;

    private final List<Reference> provenance;

    private final List<OboAnnotation> annotations;

    public Synonym(final String name, @Nullable final SynonymScope scope,
            @Nullable final Reference type, @Nullable final String language,
            final Iterable<Reference> provenance, final Iterable<OboAnnotation> annotations) {
        this.name = Preconditions.checkNotNull(name);
        this.scope = scope;
        this.type = type;
        this.language = language;
        this.provenance = ImmutableList.copyOf(provenance);
        this.annotations = ImmutableList.copyOf(annotations);
    }

    public Synonym(final String name, @Nullable final SynonymScope scope) {
        this(name, scope, null, null, Collections.<Reference>emptyList(),
                Collections.<OboAnnotation>emptyList());
    }

    public String getName() {
        return this.name;
    }

    @Nullable
    public SynonymScope getScope() {
        return this.scope;
    }

    @Nullable
    public Reference getType() {
        return this.type;
    }

    @Nullable
    public String getLanguage() {
        return this.language;
    }

    public List<Reference> getProvenance() {
        return this.provenance;
    }

    public List<OboAnnotation> getAnnotations() {
        return this.annotations;
    }

    @Override
    public String toString() {
        return "\"" + this.name + "\" " + (this.scope == null ? "" : this.scope + " ")
                + (this.type == null ? "" : this.type + " ") + this.provenance;
    }

}
