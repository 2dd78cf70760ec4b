/**
 * Conversion of OBO ontologies into OWL 2 axioms and functional-syntax documents.
 * <p>
 * The OBO object model is described by the {@link eu.fbk.funowl.obo.OboOntology},
 * {@link eu.fbk.funowl.obo.Term} and {@link eu.fbk.funowl.obo.TypeDef} interfaces, to be
 * implemented by the OBO parser in use; {@link eu.fbk.funowl.obo.OboConverter} turns them into
 * axioms following the OBO tag order.
 * </p>
 */
@javax.annotation.ParametersAreNonnullByDefault
package eu.fbk.funowl.obo;
