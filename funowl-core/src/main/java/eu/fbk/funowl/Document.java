package eu.fbk.funowl;

import java.io.File;
import java.io.IOException;
import java.io.Writer;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

import com.google.common.base.Charsets;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.io.Files;

import org.openrdf.model.Model;
import org.openrdf.model.Namespace;
import org.openrdf.model.Statement;
import org.openrdf.rio.RDFFormat;
import org.openrdf.rio.RDFHandlerException;
import org.openrdf.rio.RDFWriter;
import org.openrdf.rio.Rio;
import org.openrdf.rio.WriterConfig;
import org.openrdf.rio.helpers.BasicWriterSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.fbk.funowl.data.Converter;
import eu.fbk.funowl.data.RDFContext;

/**
 * An OWL 2 functional-syntax document: a list of prefix declarations followed by one or more
 * ontologies.
 * <p>
 * Prefix declarations are sorted by prefix, ignoring case. The same prefixes are used to expand
 * CURIEs when the document is converted to RDF, which is possible only for documents with a
 * single ontology.
 * </p>
 */
public final class Document {

    private static final Logger LOGGER = LoggerFactory.getLogger(Document.class);

    private static final Comparator<Prefix> PREFIX_ORDER = new Comparator<Prefix>() {

        @Override
        public int compare(final Prefix first, final Prefix second) {
            return String.CASE_INSENSITIVE_ORDER.compare(first.getPrefix(), second.getPrefix());
        }

    };

    private final List<Prefix> prefixes;

    private final List<Ontology> ontologies;

    /**
     * Creates a document for the ontologies and prefix map specified.
     *
     * @param prefixes
     *            the prefix to namespace map to declare
     * @param ontologies
     *            the ontologies of the document, at least one
     */
    public Document(final Map<String, String> prefixes, final Iterable<Ontology> ontologies) {
        final List<Prefix> list = Lists.newArrayList();
        for (final Map.Entry<String, String> entry : prefixes.entrySet()) {
            list.add(new Prefix(entry.getKey(), entry.getValue()));
        }
        Collections.sort(list, PREFIX_ORDER);
        this.prefixes = ImmutableList.copyOf(list);
        this.ontologies = ImmutableList.copyOf(ontologies);
        Preconditions.checkArgument(!this.ontologies.isEmpty(),
                "A document requires at least one ontology");
    }

    public Document(final Map<String, String> prefixes, final Ontology... ontologies) {
        this(prefixes, ImmutableList.copyOf(ontologies));
    }

    public List<Prefix> getPrefixes() {
        return this.prefixes;
    }

    public List<Ontology> getOntologies() {
        return this.ontologies;
    }

    /**
     * Returns the prefix to namespace map declared by this document.
     *
     * @return an immutable map, in declaration order
     */
    public Map<String, String> getPrefixMap() {
        final Map<String, String> map = Maps.newLinkedHashMap();
        for (final Prefix prefix : this.prefixes) {
            map.put(prefix.getPrefix(), prefix.getNamespace());
        }
        return Collections.unmodifiableMap(map);
    }

    public String toFunctional() {
        final StringBuilder out = new StringBuilder();
        String separator = "";
        for (final Prefix prefix : this.prefixes) {
            out.append(separator);
            prefix.toFunctional(out);
            separator = "\n";
        }
        out.append("\n\n");
        separator = "";
        for (final Ontology ontology : this.ontologies) {
            out.append(separator);
            ontology.toFunctional(out);
            separator = "\n\n";
        }
        return out.toString();
    }

    /**
     * Converts the document to an RDF graph, according to the OWL 2 RDF mapping.
     *
     * @return the resulting graph, with the document prefixes bound as namespaces
     * @throws IllegalArgumentException
     *             if the document contains more than one ontology
     */
    public Model toRDF() {
        Preconditions.checkArgument(this.ontologies.size() == 1,
                "Only documents with exactly one ontology can be converted to RDF, got %s",
                this.ontologies.size());
        final Converter converter = Converter.create(getPrefixMap());
        final RDFContext context = new RDFContext(converter);
        for (final Map.Entry<String, String> entry : converter.getPrefixes().entrySet()) {
            context.getModel().setNamespace(entry.getKey(), entry.getValue());
        }
        this.ontologies.get(0).toRDF(context);
        LOGGER.debug("Converted document to {} triples", context.getModel().size());
        return context.getModel();
    }

    public void writeFunctional(final Writer writer) throws IOException {
        writer.write(toFunctional());
        writer.flush();
    }

    public void writeFunctional(final File file) throws IOException {
        Files.write(toFunctional(), file, Charsets.UTF_8);
        LOGGER.debug("Written functional syntax to {}", file);
    }

    public void writeRDF(final Writer writer) throws IOException, RDFHandlerException {
        writeRDF(writer, RDFFormat.TURTLE);
    }

    /**
     * Writes the RDF form of the document.
     *
     * @param writer
     *            the writer to write to, not closed
     * @param format
     *            the RDF format to use
     * @throws IOException
     *             on failure
     * @throws RDFHandlerException
     *             if serialization fails
     */
    public void writeRDF(final Writer writer, final RDFFormat format) throws IOException,
            RDFHandlerException {
        final Model model = toRDF();
        final RDFWriter rdfWriter = Rio.createWriter(format, writer);
        final WriterConfig config = rdfWriter.getWriterConfig();
        config.set(BasicWriterSettings.PRETTY_PRINT, true);
        config.set(BasicWriterSettings.XSD_STRING_TO_PLAIN_LITERAL, true);
        rdfWriter.startRDF();
        for (final Namespace namespace : model.getNamespaces()) {
            rdfWriter.handleNamespace(namespace.getPrefix(), namespace.getName());
        }
        for (final Statement statement : model) {
            rdfWriter.handleStatement(statement);
        }
        rdfWriter.endRDF();
        writer.flush();
    }

    public void writeRDF(final File file) throws IOException, RDFHandlerException {
        final RDFFormat format = Rio.getWriterFormatForFileName(file.getName());
        final Writer writer = Files.newWriter(file, Charsets.UTF_8);
        try {
            writeRDF(writer, format != null ? format : RDFFormat.TURTLE);
        } finally {
            writer.close();
        }
        LOGGER.debug("Written RDF to {}", file);
    }

    @Override
    public String toString() {
        return toFunctional();
    }

}
