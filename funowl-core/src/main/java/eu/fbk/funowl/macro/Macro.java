package eu.fbk.funowl.macro;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import org.openrdf.model.Resource;

import eu.fbk.funowl.data.Annotation;
import eu.fbk.funowl.data.AnnotationAxiom;
import eu.fbk.funowl.data.Axiom;
import eu.fbk.funowl.data.ClassAxiom;
import eu.fbk.funowl.data.ClassExpression;
import eu.fbk.funowl.data.LiteralBox;
import eu.fbk.funowl.data.ObjectPropertyAxiom;
import eu.fbk.funowl.data.ObjectPropertyChain;
import eu.fbk.funowl.data.RDFContext;
import eu.fbk.funowl.data.Reference;
import eu.fbk.funowl.vocabulary.IAO;
import eu.fbk.funowl.vocabulary.OBOINOWL;
import eu.fbk.funowl.vocabulary.SSSOM;

/**
 * A convenience axiom expanding into exactly one underlying OWL axiom.
 * <p>
 * Macros capture recurring OBO idioms, such as labels, synonyms, mappings and existential
 * relationships. A macro renders and emits exactly as the axiom it wraps, which can be obtained
 * with {@link #getAxiom()}; its {@link Type} records the idiom it was created from. Macros are
 * created with the static factory methods of this class.
 * </p>
 */
public final class Macro extends Axiom {

    private static final Reference LABEL = Reference.create("rdfs", "label");

    private static final Reference COMMENT = Reference.create("rdfs", "comment");

    private static final Reference DESCRIPTION = Reference.create("dcterms", "description");

    private static final Reference DEPRECATED = Reference.create("owl", "deprecated");

    private static final Reference THING = Reference.create("owl", "Thing");

    private final Type type;

    private final Axiom axiom;

    private Macro(final Type type, final Axiom axiom) {
        super(axiom.getAnnotations());
        this.type = Preconditions.checkNotNull(type);
        this.axiom = axiom;
    }

    public Type getType() {
        return this.type;
    }

    public Axiom getAxiom() {
        return this.axiom;
    }

    @Override
    protected Axiom doWithAnnotations(final List<Annotation> annotations) {
        return new Macro(this.type, this.axiom.withAnnotations(annotations));
    }

    @Override
    public Resource toRDF(final RDFContext context) {
        return this.axiom.toRDF(context);
    }

    @Override
    public void toFunctional(final StringBuilder out) {
        this.axiom.toFunctional(out);
    }

    // RELATIONSHIPS

    /**
     * Asserts an OBO relationship as {@code SubClassOf(s ObjectSomeValuesFrom(p o))}.
     *
     * @param subject
     *            the subject class
     * @param predicate
     *            the object property
     * @param object
     *            the object class
     * @param annotations
     *            annotations of the resulting axiom
     * @return the created macro
     */
    public static Macro relationship(final Object subject, final Object predicate,
            final Object object, final Annotation... annotations) {
        return relationship(subject, predicate, object, Arrays.asList(annotations));
    }

    public static Macro relationship(final Object subject, final Object predicate,
            final Object object, final Iterable<Annotation> annotations) {
        return new Macro(Type.RELATIONSHIP, ClassAxiom.subClassOf(subject,
                ClassExpression.someValuesFrom(predicate, object)).withAnnotations(annotations));
    }

    /**
     * Asserts that a property holds over a chain of properties, as
     * {@code SubObjectPropertyOf(ObjectPropertyChain(p1 ... pn) p)}.
     *
     * @param predicate
     *            the object property
     * @param chain
     *            the chain, at least two properties
     * @return the created macro
     */
    public static Macro holdsOverChain(final Object predicate, final Iterable<?> chain) {
        return new Macro(Type.HOLDS_OVER_CHAIN, ObjectPropertyAxiom.subObjectPropertyOf(
                ObjectPropertyChain.create(chain), predicate));
    }

    /**
     * Asserts that a property is transitive over another one, i.e., that it holds over the chain
     * formed by itself followed by the other property.
     *
     * @param predicate
     *            the object property
     * @param over
     *            the property it is transitive over
     * @return the created macro
     */
    public static Macro transitiveOver(final Object predicate, final Object over) {
        return new Macro(Type.TRANSITIVE_OVER, ObjectPropertyAxiom.subObjectPropertyOf(
                ObjectPropertyChain.create(predicate, over), predicate));
    }

    public static Macro dataPropertyMaxCardinality(final int cardinality, final Object property) {
        return new Macro(Type.DATA_PROPERTY_MAX_CARDINALITY, ClassAxiom.subClassOf(THING,
                ClassExpression.dataMaxCardinality(cardinality, property)));
    }

    /**
     * Defines a class as equivalent to the intersection of the elements specified. An element
     * that is a {@link Map.Entry} stands for the existential restriction
     * {@code ObjectSomeValuesFrom(key value)}; any other element is a class expression.
     *
     * @param term
     *            the defined class
     * @param elements
     *            the elements of the intersection, at least two
     * @return the created macro
     */
    public static Macro classIntersection(final Object term, final Iterable<?> elements) {
        return new Macro(Type.CLASS_INTERSECTION, ClassAxiom.equivalentClasses(term,
                ClassExpression.intersectionOf(expressions(elements))));
    }

    public static Macro classUnion(final Object term, final Iterable<?> elements) {
        return new Macro(Type.CLASS_UNION, ClassAxiom.equivalentClasses(term,
                ClassExpression.unionOf(expressions(elements))));
    }

    private static List<Object> expressions(final Iterable<?> elements) {
        final List<Object> expressions = Lists.newArrayList();
        for (final Object element : elements) {
            if (element instanceof Map.Entry<?, ?>) {
                final Map.Entry<?, ?> entry = (Map.Entry<?, ?>) element;
                expressions.add(ClassExpression.someValuesFrom(entry.getKey(), entry.getValue()));
            } else {
                expressions.add(element);
            }
        }
        return expressions;
    }

    // STRING ANNOTATIONS

    public static Macro label(final Object subject, final String label) {
        return label(subject, label, null);
    }

    public static Macro label(final Object subject, final String label,
            @Nullable final String language) {
        return string(Type.LABEL, LABEL, subject, label, language);
    }

    public static Macro description(final Object subject, final String description) {
        return description(subject, description, null);
    }

    public static Macro description(final Object subject, final String description,
            @Nullable final String language) {
        return string(Type.DESCRIPTION, DESCRIPTION, subject, description, language);
    }

    public static Macro comment(final Object subject, final String comment) {
        return comment(subject, comment, null);
    }

    public static Macro comment(final Object subject, final String comment,
            @Nullable final String language) {
        return string(Type.COMMENT, COMMENT, subject, comment, language);
    }

    public static Macro oboNamespace(final Object subject, final String namespace) {
        return string(Type.OBO_NAMESPACE, OBOINOWL.HAS_OBO_NAMESPACE, subject, namespace, null);
    }

    private static Macro string(final Type type, final Reference property,
            final Object subject, final String value, @Nullable final String language) {
        return new Macro(type, AnnotationAxiom.annotationAssertion(property, subject,
                LiteralBox.of(value, language)));
    }

    // OBJECT ANNOTATIONS

    public static Macro alt(final Object subject, final Object alternative) {
        return object(Type.ALT, IAO.ALTERNATIVE_TERM, subject, alternative);
    }

    public static Macro replacedBy(final Object subject, final Object replacement) {
        return object(Type.REPLACED_BY, IAO.TERM_REPLACED_BY, subject, replacement);
    }

    public static Macro consider(final Object subject, final Object candidate) {
        return object(Type.CONSIDER, OBOINOWL.CONSIDER, subject, candidate);
    }

    public static Macro inSubset(final Object subject, final Object subset) {
        return object(Type.IN_SUBSET, OBOINOWL.IN_SUBSET, subject, subset);
    }

    private static Macro object(final Type type, final Reference property,
            final Object subject, final Object target) {
        return new Macro(type, AnnotationAxiom.annotationAssertion(property, subject, target));
    }

    // BOOLEAN ANNOTATIONS

    public static Macro isAnonymous(final Object subject, final boolean value) {
        return flag(Type.IS_ANONYMOUS, OBOINOWL.IS_ANONYMOUS, subject, value);
    }

    public static Macro isBuiltin(final Object subject, final boolean value) {
        return flag(Type.IS_BUILTIN, OBOINOWL.BUILTIN, subject, value);
    }

    public static Macro isClassLevel(final Object subject, final boolean value) {
        return flag(Type.IS_CLASS_LEVEL, OBOINOWL.IS_CLASS_LEVEL, subject, value);
    }

    public static Macro isObsolete(final Object subject, final boolean value) {
        return flag(Type.IS_OBSOLETE, DEPRECATED, subject, value);
    }

    public static Macro isCyclic(final Object subject, final boolean value) {
        return flag(Type.IS_CYCLIC, OBOINOWL.IS_CYCLIC, subject, value);
    }

    private static Macro flag(final Type type, final Reference property, final Object subject,
            final boolean value) {
        return new Macro(type, AnnotationAxiom.annotationAssertion(property, subject,
                LiteralBox.of(value)));
    }

    // SYNONYMS AND MAPPINGS

    public static Macro synonym(final Object subject, final String value) {
        return synonym(subject, value, null);
    }

    public static Macro synonym(final Object subject, final String value,
            @Nullable final Object scope) {
        return synonym(subject, value, scope, null, null, Collections.emptyList(),
                Collections.<Annotation>emptyList());
    }

    /**
     * Asserts a synonym. The annotations of the resulting axiom are the annotations given,
     * followed by one {@code oboInOwl:hasDbXref} annotation per provenance entry and by the
     * {@code oboInOwl:hasSynonymType} annotation, if a synonym type is given.
     *
     * @param subject
     *            the term the synonym belongs to
     * @param value
     *            the synonym text
     * @param scope
     *            either a {@link SynonymScope}, the case-insensitive name of one, or the
     *            annotation property to use; {@link SynonymScope#RELATED} if null
     * @param language
     *            the language of the synonym text, if known
     * @param synonymType
     *            the synonym type, if any
     * @param provenance
     *            the provenance references, possibly empty
     * @param annotations
     *            further annotations, possibly empty
     * @return the created macro
     */
    public static Macro synonym(final Object subject, final String value,
            @Nullable final Object scope, @Nullable final String language,
            @Nullable final Object synonymType, final Iterable<?> provenance,
            final Iterable<Annotation> annotations) {
        final List<Annotation> all = Lists.newArrayList(annotations);
        for (final Object reference : provenance) {
            all.add(Annotation.create(OBOINOWL.HAS_DB_XREF, reference));
        }
        if (synonymType != null) {
            all.add(Annotation.create(OBOINOWL.HAS_SYNONYM_TYPE, synonymType));
        }
        final Object property;
        if (scope == null) {
            property = SynonymScope.RELATED.getProperty();
        } else if (scope instanceof SynonymScope) {
            property = ((SynonymScope) scope).getProperty();
        } else if (scope instanceof String && isScopeName(SynonymScope.class, (String) scope)) {
            property = SynonymScope.forName((String) scope).getProperty();
        } else {
            property = scope;
        }
        return new Macro(Type.SYNONYM, AnnotationAxiom.annotationAssertion(property, subject,
                LiteralBox.of(value, language)).withAnnotations(all));
    }

    public static Macro mapping(final Object subject, final Object predicate,
            final Object target) {
        return mapping(subject, predicate, target, null, Collections.<Annotation>emptyList());
    }

    /**
     * Asserts a semantic mapping between two terms. A mapping justification, if given, is
     * appended to the annotations as {@code sssom:has_mapping_justification}.
     *
     * @param subject
     *            the mapped term
     * @param predicate
     *            either a {@link MappingScope}, the case-insensitive name of one, or the mapping
     *            property to use
     * @param target
     *            the term mapped to
     * @param justification
     *            the mapping justification, e.g., {@code semapv:ManualMappingCuration}, if known
     * @param annotations
     *            further annotations, possibly empty
     * @return the created macro
     */
    public static Macro mapping(final Object subject, final Object predicate,
            final Object target, @Nullable final Object justification,
            final Iterable<Annotation> annotations) {
        final Object property;
        if (predicate instanceof MappingScope) {
            property = ((MappingScope) predicate).getProperty();
        } else if (predicate instanceof String
                && isScopeName(MappingScope.class, (String) predicate)) {
            property = MappingScope.forName((String) predicate).getProperty();
        } else {
            property = predicate;
        }
        return newMapping(Type.MAPPING, property, subject, target, justification, annotations);
    }

    public static Macro xref(final Object subject, final Object target) {
        return xref(subject, target, null, Collections.<Annotation>emptyList());
    }

    public static Macro xref(final Object subject, final Object target,
            @Nullable final Object justification, final Iterable<Annotation> annotations) {
        return newMapping(Type.XREF, OBOINOWL.HAS_DB_XREF, subject, target, justification,
                annotations);
    }

    private static Macro newMapping(final Type type, final Object property,
            final Object subject, final Object target, @Nullable final Object justification,
            final Iterable<Annotation> annotations) {
        final ImmutableList.Builder<Annotation> all = ImmutableList.builder();
        all.addAll(annotations);
        if (justification != null) {
            all.add(Annotation.create(SSSOM.HAS_MAPPING_JUSTIFICATION, justification));
        }
        return new Macro(type, AnnotationAxiom.annotationAssertion(property, subject, target)
                .withAnnotations(all.build()));
    }

    private static <E extends Enum<E>> boolean isScopeName(final Class<E> scopeClass,
            final String name) {
        for (final E scope : scopeClass.getEnumConstants()) {
            if (scope.name().equalsIgnoreCase(name.trim())) {
                return true;
            }
        }
        return false;
    }

    /**
     * The idioms a macro can be created from.
     */
    public enum Type {

        RELATIONSHIP,

        LABEL,

        DESCRIPTION,

        COMMENT,

        OBO_NAMESPACE,

        ALT,

        REPLACED_BY,

        CONSIDER,

        IN_SUBSET,

        IS_ANONYMOUS,

        IS_BUILTIN,

        IS_CLASS_LEVEL,

        IS_OBSOLETE,

        IS_CYCLIC,

        SYNONYM,

        MAPPING,

        XREF,

        HOLDS_OVER_CHAIN,

        TRANSITIVE_OVER,

        DATA_PROPERTY_MAX_CARDINALITY,

        CLASS_INTERSECTION,

        CLASS_UNION

    }

}
