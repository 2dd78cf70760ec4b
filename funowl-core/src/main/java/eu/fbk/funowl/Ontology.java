package eu.fbk.funowl;

import java.util.List;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import org.openrdf.model.Resource;
import org.openrdf.model.ValueFactory;
import org.openrdf.model.vocabulary.RDF;

import eu.fbk.funowl.data.Annotation;
import eu.fbk.funowl.data.Axiom;
import eu.fbk.funowl.data.Box;
import eu.fbk.funowl.data.RDFContext;
import eu.fbk.funowl.vocabulary.OWL2;

/**
 * An OWL 2 ontology: an optional IRI and version IRI, imports, ontology annotations and axioms.
 * <p>
 * Ontologies are immutable and are created with a {@link Builder}:
 * </p>
 *
 * <pre>
 * Ontology ontology = Ontology.builder().iri(&quot;https://example.org/example.ofn&quot;)
 *         .annotation(Annotation.create(&quot;rdfs:comment&quot;, LiteralBox.of(&quot;test&quot;)))
 *         .axiom(ClassAxiom.subClassOf(&quot;a:Child&quot;, &quot;a:Person&quot;)).build();
 * </pre>
 */
public final class Ontology extends Box {

    @Nullable
    private final String iri;

    @Nullable
    private final String versionIRI;

    private final List<Import> imports;

    private final List<Annotation> annotations;

    private final List<Axiom> axioms;

    private Ontology(final Builder builder) {
        Preconditions.checkArgument(builder.versionIRI == null || builder.iri != null,
                "A version IRI requires an ontology IRI");
        this.iri = builder.iri;
        this.versionIRI = builder.versionIRI;
        this.imports = ImmutableList.copyOf(builder.imports);
        this.annotations = ImmutableList.copyOf(builder.annotations);
        this.axioms = ImmutableList.copyOf(builder.axioms);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Nullable
    public String getIRI() {
        return this.iri;
    }

    @Nullable
    public String getVersionIRI() {
        return this.versionIRI;
    }

    public List<Import> getImports() {
        return this.imports;
    }

    public List<Annotation> getAnnotations() {
        return this.annotations;
    }

    public List<Axiom> getAxioms() {
        return this.axioms;
    }

    /**
     * {@inheritDoc} The ontology node, typed {@code owl:Ontology}, is the ontology IRI or a
     * fresh blank node for an anonymous ontology; it is the subject of version IRI, imports and
     * ontology annotations. All axioms are then emitted in order.
     */
    @Override
    public Resource toRDF(final RDFContext context) {
        final ValueFactory factory = context.getValueFactory();
        final Resource node = this.iri != null ? factory.createURI(this.iri) : context
                .newBNode();
        context.add(node, RDF.TYPE, OWL2.ONTOLOGY);
        if (this.versionIRI != null) {
            context.add(node, OWL2.VERSION_IRI, factory.createURI(this.versionIRI));
        }
        for (final Import imported : this.imports) {
            context.add(node, OWL2.IMPORTS, factory.createURI(imported.getIRI()));
        }
        context.annotate(node, this.annotations);
        for (final Axiom axiom : this.axioms) {
            axiom.toRDF(context);
        }
        return node;
    }

    @Override
    public void toFunctional(final StringBuilder out) {
        out.append("Ontology(");
        if (this.iri != null) {
            out.append('<').append(this.iri).append('>');
            if (this.versionIRI != null) {
                out.append(" <").append(this.versionIRI).append('>');
            }
        }
        out.append('\n');
        final List<List<? extends Box>> parts = Lists.newArrayList();
        for (final List<? extends Box> part : ImmutableList.<List<? extends Box>>of(
                this.imports, this.annotations, this.axioms)) {
            if (!part.isEmpty()) {
                parts.add(part);
            }
        }
        String partSeparator = "";
        for (final List<? extends Box> part : parts) {
            out.append(partSeparator);
            String separator = "";
            for (final Box box : part) {
                out.append(separator);
                box.toFunctional(out);
                separator = "\n";
            }
            partSeparator = "\n\n";
        }
        out.append("\n)");
    }

    public static final class Builder {

        @Nullable
        private String iri;

        @Nullable
        private String versionIRI;

        private final List<Import> imports = Lists.newArrayList();

        private final List<Annotation> annotations = Lists.newArrayList();

        private final List<Axiom> axioms = Lists.newArrayList();

        Builder() {
        }

        public Builder iri(@Nullable final String iri) {
            this.iri = iri;
            return this;
        }

        public Builder versionIRI(@Nullable final String versionIRI) {
            this.versionIRI = versionIRI;
            return this;
        }

        public Builder imports(final String... iris) {
            for (final String iri : iris) {
                this.imports.add(new Import(iri));
            }
            return this;
        }

        public Builder annotation(final Annotation annotation) {
            this.annotations.add(Preconditions.checkNotNull(annotation));
            return this;
        }

        public Builder annotations(final Iterable<Annotation> annotations) {
            for (final Annotation annotation : annotations) {
                annotation(annotation);
            }
            return this;
        }

        public Builder axiom(final Axiom axiom) {
            this.axioms.add(Preconditions.checkNotNull(axiom));
            return this;
        }

        public Builder axioms(final Iterable<? extends Axiom> axioms) {
            for (final Axiom axiom : axioms) {
                axiom(axiom);
            }
            return this;
        }

        public Ontology build() {
            return new Ontology(this);
        }

    }

}
