package eu.fbk.funowl.data;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import org.openrdf.model.BNode;
import org.openrdf.model.Resource;
import org.openrdf.model.URI;
import org.openrdf.model.Value;
import org.openrdf.model.vocabulary.RDF;
import org.openrdf.model.vocabulary.RDFS;

import eu.fbk.funowl.vocabulary.OWL2;

/**
 * Class axioms of OWL 2 section 9.1.
 */
public abstract class ClassAxiom extends Axiom {

    ClassAxiom(final List<Annotation> annotations) {
        super(annotations);
    }

    private static List<Annotation> none() {
        return Collections.emptyList();
    }

    public static SubClassOf subClassOf(final Object child, final Object parent) {
        return new SubClassOf(none(), ClassExpression.of(child), ClassExpression.of(parent));
    }

    public static EquivalentClasses equivalentClasses(final Object... classExpressions) {
        return equivalentClasses(Arrays.asList(classExpressions));
    }

    public static EquivalentClasses equivalentClasses(final Iterable<?> classExpressions) {
        return new EquivalentClasses(none(), ClassExpression.listOf(classExpressions));
    }

    public static DisjointClasses disjointClasses(final Object... classExpressions) {
        return disjointClasses(Arrays.asList(classExpressions));
    }

    public static DisjointClasses disjointClasses(final Iterable<?> classExpressions) {
        return new DisjointClasses(none(), ClassExpression.listOf(classExpressions));
    }

    public static DisjointUnion disjointUnion(final Object parent, final Object... children) {
        return disjointUnion(parent, Arrays.asList(children));
    }

    public static DisjointUnion disjointUnion(final Object parent, final Iterable<?> children) {
        return new DisjointUnion(none(), new ClassExpression.Named(IdentifierBox.of(parent)),
                ClassExpression.listOf(children));
    }

    static void checkArity(final List<?> operands, final int min, final String tag) {
        Preconditions.checkArgument(operands.size() >= min,
                "%s requires at least %s operands, got %s", tag, min, operands);
    }

    /**
     * Adds one triple per unordered pair of nodes, in list order.
     *
     * @return the node returned for the first pair
     */
    static Resource addPairwise(final RDFContext context, final List<Value> nodes,
            final URI predicate, final List<Annotation> annotations) {
        Resource result = null;
        for (int i = 0; i < nodes.size(); ++i) {
            for (int j = i + 1; j < nodes.size(); ++j) {
                final Resource node = context.addTriple((Resource) nodes.get(i), predicate,
                        nodes.get(j), annotations);
                result = result == null ? node : result;
            }
        }
        return result;
    }

    /**
     * Emits an n-ary disjointness as a blank node of the type specified whose members are
     * sorted by their string form; annotations are attached to that node.
     */
    static BNode addAllDisjoint(final RDFContext context, final URI type,
            final List<Value> nodes, final List<Annotation> annotations) {
        final BNode node = context.newBNode();
        context.add(node, RDF.TYPE, type);
        context.add(node, OWL2.MEMBERS,
                context.sequence(RDFContext.NODE_ORDERING.sortedCopy(nodes), false));
        context.annotate(node, annotations);
        return node;
    }

    public static final class SubClassOf extends ClassAxiom {

        private final ClassExpression child;

        private final ClassExpression parent;

        SubClassOf(final List<Annotation> annotations, final ClassExpression child,
                final ClassExpression parent) {
            super(annotations);
            this.child = child;
            this.parent = parent;
        }

        public ClassExpression getChild() {
            return this.child;
        }

        public ClassExpression getParent() {
            return this.parent;
        }

        @Override
        protected Axiom doWithAnnotations(final List<Annotation> annotations) {
            return new SubClassOf(annotations, this.child, this.parent);
        }

        @Override
        public Resource toRDF(final RDFContext context) {
            final Resource child = (Resource) this.child.toRDF(context);
            return context.addTriple(child, RDFS.SUBCLASSOF, this.parent.toRDF(context),
                    getAnnotations());
        }

        @Override
        protected void appendOperands(final StringBuilder out) {
            this.child.toFunctional(out);
            out.append(' ');
            this.parent.toFunctional(out);
        }

    }

    public static final class EquivalentClasses extends ClassAxiom {

        private final List<ClassExpression> classExpressions;

        EquivalentClasses(final List<Annotation> annotations,
                final List<ClassExpression> classExpressions) {
            super(annotations);
            checkArity(classExpressions, 2, "EquivalentClasses");
            this.classExpressions = classExpressions;
        }

        public List<ClassExpression> getClassExpressions() {
            return this.classExpressions;
        }

        @Override
        protected Axiom doWithAnnotations(final List<Annotation> annotations) {
            return new EquivalentClasses(annotations, this.classExpressions);
        }

        @Override
        public Resource toRDF(final RDFContext context) {
            return addPairwise(context, context.nodes(this.classExpressions),
                    OWL2.EQUIVALENT_CLASS, getAnnotations());
        }

        @Override
        protected void appendOperands(final StringBuilder out) {
            appendList(out, this.classExpressions);
        }

    }

    /**
     * Pairwise disjointness of two or more class expressions: a single
     * {@code owl:disjointWith} triple for two operands, an {@code owl:AllDisjointClasses}
     * node otherwise.
     */
    public static final class DisjointClasses extends ClassAxiom {

        private final List<ClassExpression> classExpressions;

        DisjointClasses(final List<Annotation> annotations,
                final List<ClassExpression> classExpressions) {
            super(annotations);
            checkArity(classExpressions, 2, "DisjointClasses");
            this.classExpressions = classExpressions;
        }

        public List<ClassExpression> getClassExpressions() {
            return this.classExpressions;
        }

        @Override
        protected Axiom doWithAnnotations(final List<Annotation> annotations) {
            return new DisjointClasses(annotations, this.classExpressions);
        }

        @Override
        public Resource toRDF(final RDFContext context) {
            final List<Value> nodes = context.nodes(this.classExpressions);
            if (nodes.size() == 2) {
                return context.addTriple((Resource) nodes.get(0), OWL2.DISJOINT_WITH,
                        nodes.get(1), getAnnotations());
            }
            return addAllDisjoint(context, OWL2.ALL_DISJOINT_CLASSES, nodes, getAnnotations());
        }

        @Override
        protected void appendOperands(final StringBuilder out) {
            appendList(out, this.classExpressions);
        }

    }

    public static final class DisjointUnion extends ClassAxiom {

        private final ClassExpression.Named parent;

        private final List<ClassExpression> children;

        DisjointUnion(final List<Annotation> annotations, final ClassExpression.Named parent,
                final List<ClassExpression> children) {
            super(annotations);
            checkArity(children, 2, "DisjointUnion");
            this.parent = parent;
            this.children = ImmutableList.copyOf(children);
        }

        public ClassExpression.Named getParent() {
            return this.parent;
        }

        public List<ClassExpression> getChildren() {
            return this.children;
        }

        @Override
        protected Axiom doWithAnnotations(final List<Annotation> annotations) {
            return new DisjointUnion(annotations, this.parent, this.children);
        }

        @Override
        public Resource toRDF(final RDFContext context) {
            return context.addTriple(this.parent.toRDF(context), OWL2.DISJOINT_UNION_OF,
                    context.sequence(this.children), getAnnotations());
        }

        @Override
        protected void appendOperands(final StringBuilder out) {
            this.parent.toFunctional(out);
            out.append(' ');
            appendList(out, this.children);
        }

    }

}
