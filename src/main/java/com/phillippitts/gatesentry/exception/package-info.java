/**
 * Exception hierarchy. All exceptions are unchecked and extend
 * {@link com.phillippitts.gatesentry.exception.GateSentryException}.
 *
 * <p>Inside a turn, collaborator failures ({@link com.phillippitts.gatesentry.exception.CapabilityException})
 * never escape: each step catches them and degrades. Only session lookup and turn serialization errors
 * reach the REST boundary.
 */
package com.phillippitts.gatesentry.exception;
