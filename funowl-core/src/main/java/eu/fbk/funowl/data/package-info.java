/**
 * Object model of the OWL 2 structural specification, with emission to OWL Functional-Style
 * Syntax ({@link eu.fbk.funowl.data.Box#toFunctional()}) and to RDF according to the OWL 2 RDF
 * mapping ({@link eu.fbk.funowl.data.Box#toRDF(RDFContext)}).
 * <p>
 * Every element is a {@link eu.fbk.funowl.data.Box}. Entities are referenced through
 * {@link eu.fbk.funowl.data.IdentifierBox}es, either full IRIs or CURIEs expanded by a
 * {@link eu.fbk.funowl.data.Converter}; literals are wrapped in
 * {@link eu.fbk.funowl.data.LiteralBox}es. Class expressions, data ranges and property
 * expressions are created with the static factory methods of
 * {@link eu.fbk.funowl.data.ClassExpression}, {@link eu.fbk.funowl.data.DataRange},
 * {@link eu.fbk.funowl.data.ObjectPropertyExpression} and
 * {@link eu.fbk.funowl.data.DataPropertyExpression}; axioms with those of the
 * {@link eu.fbk.funowl.data.Axiom} subclasses. All the objects of this package are immutable
 * and thread safe, with the exception of {@link eu.fbk.funowl.data.RDFContext}.
 * </p>
 */
@javax.annotation.ParametersAreNonnullByDefault
package eu.fbk.funowl.data;
