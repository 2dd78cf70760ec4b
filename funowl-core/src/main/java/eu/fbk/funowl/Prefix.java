package eu.fbk.funowl;

import com.google.common.base.Preconditions;

import org.openrdf.model.Value;

import eu.fbk.funowl.data.Box;
import eu.fbk.funowl.data.RDFContext;

/**
 * A prefix declaration of a functional-syntax document, rendered as
 * {@code Prefix(p:=<namespace>)}.
 */
public final class Prefix extends Box {

    private final String prefix;

    private final String namespace;

    public Prefix(final String prefix, final String namespace) {
        this.prefix = Preconditions.checkNotNull(prefix);
        this.namespace = Preconditions.checkNotNull(namespace);
    }

    public String getPrefix() {
        return this.prefix;
    }

    public String getNamespace() {
        return this.namespace;
    }

    @Override
    public Value toRDF(final RDFContext context) {
        throw new UnsupportedOperationException("Prefix declarations have no RDF node");
    }

    @Override
    protected void appendArguments(final StringBuilder out) {
        out.append(this.prefix).append(":=<").append(this.namespace).append('>');
    }

}
