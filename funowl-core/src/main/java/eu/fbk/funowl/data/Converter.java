package eu.fbk.funowl.data;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

import javax.annotation.Nullable;

import com.google.common.base.Charsets;
import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableMap;
import com.google.common.io.Resources;

import org.openrdf.model.vocabulary.RDF;
import org.openrdf.model.vocabulary.RDFS;
import org.openrdf.model.vocabulary.XMLSchema;

import eu.fbk.funowl.vocabulary.OWL2;

/**
 * A bidirectional mapping between CURIEs and IRIs, based on a prefix map.
 * <p>
 * A {@code Converter} expands CURIEs into absolute IRIs during RDF emission and compresses IRIs
 * back to {@link Reference}s. Expansion is strict: an unknown prefix causes an
 * {@link IllegalArgumentException}. The {@code rdf}, {@code rdfs}, {@code owl} and {@code xsd}
 * prefixes, which the functional syntax predeclares, are always available. A converter returned
 * by {@link #getDefault()} is backed by the prefix table in resource
 * {@code eu/fbk/funowl/data/prefixes}. {@code Converter} objects are immutable and can be shared
 * by all the boxes of an emission.
 * </p>
 */
public final class Converter {

    private static final Map<String, String> BUILTIN_PREFIXES = ImmutableMap.of( //
            "rdf", RDF.NAMESPACE, //
            "rdfs", RDFS.NAMESPACE, //
            "xsd", XMLSchema.NAMESPACE, //
            "owl", OWL2.NAMESPACE);

    private static final Converter DEFAULT;

    static {
        try {
            final Map<String, String> prefixes = new LinkedHashMap<>();
            for (final String line : Resources.readLines(Converter.class.getResource("prefixes"),
                    Charsets.UTF_8)) {
                if (!line.isEmpty() && line.charAt(0) != '#') {
                    final Iterator<String> i = Splitter.on(' ').trimResults().omitEmptyStrings()
                            .split(line).iterator();
                    final String namespace = i.next();
                    while (i.hasNext()) {
                        prefixes.put(i.next(), namespace);
                    }
                }
            }
            DEFAULT = create(prefixes);
        } catch (final Throwable ex) {
            throw new Error("Unexpected exception (!): " + ex.getMessage(), ex);
        }
    }

    private final Map<String, String> prefixes;

    private Converter(final Map<String, String> prefixes) {
        this.prefixes = prefixes;
    }

    /**
     * Returns the converter for the default prefix table.
     *
     * @return the default converter
     */
    public static Converter getDefault() {
        return DEFAULT;
    }

    /**
     * Creates a converter for the prefix map specified. Entries are kept in iteration order; the
     * built-in {@code rdf}, {@code rdfs}, {@code owl} and {@code xsd} prefixes are added after
     * them if not explicitly mapped.
     *
     * @param prefixes
     *            a prefix to namespace map
     * @return the created converter
     */
    public static Converter create(final Map<String, String> prefixes) {
        final Map<String, String> map = new LinkedHashMap<>();
        for (final Map.Entry<String, String> entry : prefixes.entrySet()) {
            final String prefix = entry.getKey();
            final String namespace = entry.getValue();
            Preconditions.checkArgument(!prefix.isEmpty() && prefix.indexOf(':') < 0,
                    "Invalid prefix '%s'", prefix);
            Preconditions.checkArgument(!namespace.isEmpty(), "Empty namespace for prefix %s",
                    prefix);
            map.put(prefix, namespace);
        }
        for (final Map.Entry<String, String> entry : BUILTIN_PREFIXES.entrySet()) {
            if (!map.containsKey(entry.getKey())) {
                map.put(entry.getKey(), entry.getValue());
            }
        }
        return new Converter(ImmutableMap.copyOf(map));
    }

    /**
     * Returns a converter containing the mappings of this converter plus the ones specified.
     * Mappings of this converter take precedence in case of conflicts.
     *
     * @param prefixes
     *            additional prefix to namespace mappings
     * @return the resulting converter
     */
    public Converter withPrefixes(final Map<String, String> prefixes) {
        final Map<String, String> map = new LinkedHashMap<>(this.prefixes);
        for (final Map.Entry<String, String> entry : prefixes.entrySet()) {
            if (!map.containsKey(entry.getKey())) {
                map.put(entry.getKey(), entry.getValue());
            }
        }
        return create(map);
    }

    /**
     * Returns the prefix to namespace map of this converter, in insertion order.
     *
     * @return an immutable map
     */
    public Map<String, String> getPrefixes() {
        return this.prefixes;
    }

    @Nullable
    public String getNamespace(final String prefix) {
        return this.prefixes.get(prefix);
    }

    /**
     * Expands a reference into an absolute IRI.
     *
     * @param reference
     *            the reference to expand
     * @return the expanded IRI
     * @throws IllegalArgumentException
     *             if the prefix of the reference is not known
     */
    public String expand(final Reference reference) {
        final String namespace = this.prefixes.get(reference.getPrefix());
        Preconditions.checkArgument(namespace != null, "Unknown prefix '%s' in %s",
                reference.getPrefix(), reference);
        return namespace + reference.getIdentifier();
    }

    /**
     * Expands a CURIE into an absolute IRI.
     *
     * @param curie
     *            the CURIE to expand
     * @return the expanded IRI
     * @throws IllegalArgumentException
     *             if the CURIE is malformed or its prefix is not known
     */
    public String expand(final String curie) {
        return expand(Reference.parse(curie));
    }

    /**
     * Compresses an IRI into a reference, using the longest matching namespace.
     *
     * @param iri
     *            the IRI to compress
     * @return the reference, or null if no namespace matches or the local part would be empty
     */
    @Nullable
    public Reference compress(final String iri) {
        String bestPrefix = null;
        String bestNamespace = null;
        for (final Map.Entry<String, String> entry : this.prefixes.entrySet()) {
            final String namespace = entry.getValue();
            if (iri.startsWith(namespace) && iri.length() > namespace.length()
                    && (bestNamespace == null || namespace.length() > bestNamespace.length())) {
                bestPrefix = entry.getKey();
                bestNamespace = namespace;
            }
        }
        return bestPrefix == null ? null : Reference.create(bestPrefix,
                iri.substring(bestNamespace.length()));
    }

    @Override
    public boolean equals(final Object object) {
        return object == this || object instanceof Converter
                && this.prefixes.equals(((Converter) object).prefixes);
    }

    @Override
    public int hashCode() {
        return this.prefixes.hashCode();
    }

    @Override
    public String toString() {
        return "Converter" + this.prefixes;
    }

}
