/**
 * OWL 2 ontologies and functional-syntax documents built from the axioms of
 * {@link eu.fbk.funowl.data}, with output to OWL Functional-Style Syntax and to RDF.
 */
@javax.annotation.ParametersAreNonnullByDefault
package eu.fbk.funowl;
