package eu.fbk.funowl.data;

import java.util.List;
import java.util.Set;

import javax.annotation.Nullable;

import com.google.common.base.Function;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import com.google.common.collect.Ordering;

import org.openrdf.model.BNode;
import org.openrdf.model.Literal;
import org.openrdf.model.Model;
import org.openrdf.model.Resource;
import org.openrdf.model.URI;
import org.openrdf.model.Value;
import org.openrdf.model.ValueFactory;
import org.openrdf.model.impl.LinkedHashModel;
import org.openrdf.model.impl.ValueFactoryImpl;
import org.openrdf.model.vocabulary.RDF;
import org.openrdf.model.vocabulary.RDFS;
import org.openrdf.model.vocabulary.XMLSchema;

import eu.fbk.funowl.vocabulary.OWL2;

/**
 * The target of an RDF emission: a mutable graph plus the {@link Converter} used to expand
 * CURIEs.
 * <p>
 * Besides giving access to the graph, the context implements the shared pieces of the OWL 2 RDF
 * mapping: typing of entities with skip-listing of built-in vocabulary ({@link #declare}), RDF
 * collections ({@link #sequence}) and reification of annotated triples ({@link #addTriple},
 * {@link #reify}, {@link #annotate}). A context is not thread safe.
 * </p>
 */
public final class RDFContext {

    /**
     * Orders RDF nodes by their string form, the order used for the members of enumerations and
     * n-ary disjointness axioms.
     */
    public static final Ordering<Value> NODE_ORDERING = Ordering.<String>natural().onResultOf(
            new Function<Value, String>() {

                @Override
                public String apply(final Value value) {
                    return value.stringValue();
                }

            });

    private static final Set<URI> BUILTIN_CLASSES = ImmutableSet.of(OWL2.THING, OWL2.NOTHING);

    private static final Set<URI> BUILTIN_OBJECT_PROPERTIES = ImmutableSet.of(
            OWL2.TOP_OBJECT_PROPERTY, OWL2.BOTTOM_OBJECT_PROPERTY);

    private static final Set<URI> BUILTIN_DATA_PROPERTIES = ImmutableSet.of(
            OWL2.TOP_DATA_PROPERTY, OWL2.BOTTOM_DATA_PROPERTY);

    private static final Set<URI> BUILTIN_ANNOTATION_PROPERTIES = ImmutableSet.of(RDFS.LABEL,
            RDFS.COMMENT, RDFS.SEEALSO, RDFS.ISDEFINEDBY, OWL2.DEPRECATED, OWL2.VERSION_INFO,
            OWL2.PRIOR_VERSION, OWL2.BACKWARD_COMPATIBLE_WITH, OWL2.INCOMPATIBLE_WITH);

    private static final Set<URI> BUILTIN_DATATYPES = ImmutableSet.of(RDFS.LITERAL,
            ValueFactoryImpl.getInstance().createURI(RDF.NAMESPACE, "PlainLiteral"),
            ValueFactoryImpl.getInstance().createURI(RDF.NAMESPACE, "langString"),
            RDF.XMLLITERAL, OWL2.REAL, OWL2.RATIONAL);

    private final Model model;

    private final Converter converter;

    private final ValueFactory factory;

    /**
     * Creates a context emitting into a new, empty graph.
     *
     * @param converter
     *            the converter for CURIE expansion
     */
    public RDFContext(final Converter converter) {
        this(new LinkedHashModel(), converter);
    }

    /**
     * Creates a context emitting into the graph specified.
     *
     * @param model
     *            the target graph
     * @param converter
     *            the converter for CURIE expansion
     */
    public RDFContext(final Model model, final Converter converter) {
        this.model = Preconditions.checkNotNull(model);
        this.converter = Preconditions.checkNotNull(converter);
        this.factory = ValueFactoryImpl.getInstance();
    }

    public Model getModel() {
        return this.model;
    }

    public Converter getConverter() {
        return this.converter;
    }

    public ValueFactory getValueFactory() {
        return this.factory;
    }

    /**
     * Expands a reference to an IRI using the converter of this context.
     *
     * @param reference
     *            the reference to expand
     * @return the expanded IRI
     * @throws IllegalArgumentException
     *             if the prefix of the reference is unknown
     */
    public URI expand(final Reference reference) {
        return this.factory.createURI(this.converter.expand(reference));
    }

    public BNode newBNode() {
        return this.factory.createBNode();
    }

    public void add(final Resource subject, final URI predicate, final Value object) {
        this.model.add(subject, predicate, object);
    }

    /**
     * Returns the IRI of an entity, typing it with the RDF class of the entity type unless it is
     * part of the built-in vocabulary for that type (e.g., {@code owl:Thing} for classes or
     * {@code rdfs:label} for annotation properties).
     *
     * @param identifier
     *            the entity identifier
     * @param type
     *            the entity type
     * @return the entity IRI
     */
    public URI declare(final IdentifierBox identifier, final EntityType type) {
        final URI uri = identifier.toRDF(this);
        if (!isBuiltin(uri, type)) {
            add(uri, RDF.TYPE, type.getType());
        }
        return uri;
    }

    /**
     * Checks whether an IRI belongs to the built-in vocabulary for a certain entity type, whose
     * elements are never typed in the graph.
     *
     * @param uri
     *            the IRI to check
     * @param type
     *            the entity type
     * @return true if built-in
     */
    public static boolean isBuiltin(final URI uri, final EntityType type) {
        switch (type) {
        case CLASS:
            return BUILTIN_CLASSES.contains(uri);
        case OBJECT_PROPERTY:
            return BUILTIN_OBJECT_PROPERTIES.contains(uri);
        case DATA_PROPERTY:
            return BUILTIN_DATA_PROPERTIES.contains(uri);
        case ANNOTATION_PROPERTY:
            return BUILTIN_ANNOTATION_PROPERTIES.contains(uri);
        case DATATYPE:
            return BUILTIN_DATATYPES.contains(uri)
                    || uri.getNamespace().equals(XMLSchema.NAMESPACE);
        default:
            return false;
        }
    }

    /**
     * Emits an RDF collection for the nodes specified.
     *
     * @param nodes
     *            the members of the collection
     * @param typed
     *            whether each collection node has to be typed {@code rdf:List}
     * @return the head of the collection, {@code rdf:nil} if empty
     */
    public Resource sequence(final List<? extends Value> nodes, final boolean typed) {
        if (nodes.isEmpty()) {
            return RDF.NIL;
        }
        final BNode head = newBNode();
        Resource current = head;
        for (int i = 0; i < nodes.size(); ++i) {
            if (typed) {
                add(current, RDF.TYPE, RDF.LIST);
            }
            add(current, RDF.FIRST, nodes.get(i));
            final Resource next = i == nodes.size() - 1 ? RDF.NIL : newBNode();
            add(current, RDF.REST, next);
            current = next;
        }
        return head;
    }

    /**
     * Emits an untyped RDF collection for the RDF nodes of the boxes specified.
     *
     * @param boxes
     *            the boxes whose nodes form the collection
     * @return the head of the collection, {@code rdf:nil} if empty
     */
    public Resource sequence(final Iterable<? extends Box> boxes) {
        return sequence(nodes(boxes), false);
    }

    /**
     * Emits the boxes specified, returning their nodes in iteration order.
     *
     * @param boxes
     *            the boxes to emit
     * @return a mutable list with the RDF nodes of the boxes
     */
    public List<Value> nodes(final Iterable<? extends Box> boxes) {
        final List<Value> nodes = Lists.newArrayList();
        for (final Box box : boxes) {
            nodes.add(box.toRDF(this));
        }
        return nodes;
    }

    /**
     * Adds a triple and reifies it as an {@code owl:Axiom} if annotations are supplied.
     *
     * @param subject
     *            the triple subject
     * @param predicate
     *            the triple predicate
     * @param object
     *            the triple object
     * @param annotations
     *            the annotations of the triple, possibly empty
     * @return the reification node, if annotated, otherwise the subject
     */
    public Resource addTriple(final Resource subject, final URI predicate, final Value object,
            final List<Annotation> annotations) {
        add(subject, predicate, object);
        final BNode node = reify(subject, predicate, object, annotations, Reification.AXIOM);
        return node != null ? node : subject;
    }

    /**
     * Reifies a triple without adding it to the graph. A blank node typed and linked to the
     * triple as dictated by the reification kind is created if annotations are supplied or the
     * kind is forced; annotations are then attached to it.
     *
     * @param subject
     *            the triple subject
     * @param predicate
     *            the triple predicate, a blank node only for negative assertions over an
     *            inverse property
     * @param object
     *            the triple object
     * @param annotations
     *            the annotations to attach to the reification node
     * @param kind
     *            the reification kind, which determines type and vocabulary of the node
     * @return the reification node, or null if no reification was needed
     */
    @Nullable
    public BNode reify(final Resource subject, final Resource predicate, final Value object,
            final List<Annotation> annotations, final Reification kind) {
        if (annotations.isEmpty() && !kind.isForced()) {
            return null;
        }
        final BNode node = newBNode();
        add(node, RDF.TYPE, kind.getType());
        add(node, kind.getSourcePredicate(), subject);
        add(node, kind.getPropertyPredicate(), predicate);
        add(node, kind.getTargetPredicate(object), object);
        annotate(node, annotations);
        return node;
    }

    /**
     * Attaches annotations directly to a node. Each annotation property is declared, and an
     * annotation carrying nested annotations is reified as an {@code owl:Annotation}.
     *
     * @param node
     *            the annotated node
     * @param annotations
     *            the annotations to attach
     */
    public void annotate(final Resource node, final List<Annotation> annotations) {
        for (final Annotation annotation : annotations) {
            final URI property = declare(annotation.getProperty(), EntityType.ANNOTATION_PROPERTY);
            final Value value = annotation.getValue().toRDF(this);
            add(node, property, value);
            reify(node, property, value, annotation.getAnnotations(), Reification.ANNOTATION);
        }
    }

    /**
     * The kinds of triple reification of the OWL 2 RDF mapping.
     */
    public enum Reification {

        /** Annotated axioms. */
        AXIOM(OWL2.AXIOM, false, OWL2.ANNOTATED_SOURCE, OWL2.ANNOTATED_PROPERTY,
                OWL2.ANNOTATED_TARGET, OWL2.ANNOTATED_TARGET),

        /** Annotated annotations. */
        ANNOTATION(OWL2.ANNOTATION, false, OWL2.ANNOTATED_SOURCE, OWL2.ANNOTATED_PROPERTY,
                OWL2.ANNOTATED_TARGET, OWL2.ANNOTATED_TARGET),

        /** Negative property assertions, which are always reified. */
        NEGATIVE_PROPERTY_ASSERTION(OWL2.NEGATIVE_PROPERTY_ASSERTION, true,
                OWL2.SOURCE_INDIVIDUAL, OWL2.ASSERTION_PROPERTY, OWL2.TARGET_INDIVIDUAL,
                OWL2.TARGET_VALUE);

        private final URI type;

        private final boolean forced;

        private final URI sourcePredicate;

        private final URI propertyPredicate;

        private final URI targetPredicate;

        private final URI literalTargetPredicate;

        private Reification(final URI type, final boolean forced, final URI sourcePredicate,
                final URI propertyPredicate, final URI targetPredicate,
                final URI literalTargetPredicate) {
            this.type = type;
            this.forced = forced;
            this.sourcePredicate = sourcePredicate;
            this.propertyPredicate = propertyPredicate;
            this.targetPredicate = targetPredicate;
            this.literalTargetPredicate = literalTargetPredicate;
        }

        public URI getType() {
            return this.type;
        }

        public boolean isForced() {
            return this.forced;
        }

        public URI getSourcePredicate() {
            return this.sourcePredicate;
        }

        public URI getPropertyPredicate() {
            return this.propertyPredicate;
        }

        public URI getTargetPredicate(final Value target) {
            return target instanceof Literal ? this.literalTargetPredicate : this.targetPredicate;
        }

    }

}
