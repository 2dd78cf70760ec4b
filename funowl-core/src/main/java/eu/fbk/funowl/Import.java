package eu.fbk.funowl;

import com.google.common.base.Preconditions;

import org.openrdf.model.Value;

import eu.fbk.funowl.data.Box;
import eu.fbk.funowl.data.RDFContext;

/**
 * An import of another ontology document, rendered as {@code Import(<iri>)}. In RDF imports
 * are emitted by the importing {@link Ontology} as {@code owl:imports} triples.
 */
public final class Import extends Box {

    private final String iri;

    public Import(final String iri) {
        this.iri = Preconditions.checkNotNull(iri);
    }

    public String getIRI() {
        return this.iri;
    }

    @Override
    public Value toRDF(final RDFContext context) {
        throw new UnsupportedOperationException("Imports have no RDF node of their own");
    }

    @Override
    protected void appendArguments(final StringBuilder out) {
        out.append('<').append(this.iri).append('>');
    }

}
