/* @LICENSE@
 */

/**
 * Lightweight, language aware scanners which supply the semantic context
 * (function declarations, typed identifiers) used by semantic predicates.
 * No parsing: each scanner is a small character level state machine.
 */
package org.semrep.lang;
