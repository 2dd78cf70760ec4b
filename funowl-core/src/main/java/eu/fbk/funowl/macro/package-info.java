/**
 * Macros expanding common OBO idioms into OWL axioms.
 */
@javax.annotation.ParametersAreNonnullByDefault
package eu.fbk.funowl.macro;
