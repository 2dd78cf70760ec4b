/**
 * Vocabulary constants for OWL 2 and the curation vocabularies used by macros.
 */
@javax.annotation.ParametersAreNonnullByDefault
package eu.fbk.funowl.vocabulary;
