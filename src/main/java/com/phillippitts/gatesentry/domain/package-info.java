/**
 * Domain model of a gate screening session.
 *
 * <p>Key concepts:
 * <ul>
 *   <li>{@link com.phillippitts.gatesentry.domain.SessionState} - message log, visitor profile, decision
 *       and latest vision verdict of one session</li>
 *   <li>{@link com.phillippitts.gatesentry.domain.VisitorProfile} - tracked intake fields, each a
 *       three-valued {@link com.phillippitts.gatesentry.domain.FieldValue}</li>
 *   <li>{@link com.phillippitts.gatesentry.domain.VisionSchema} - normalized verdict for a camera frame</li>
 * </ul>
 *
 * <p>Records are immutable. {@code SessionState} and {@code VisitorProfile} are mutable and confined to
 * the session store or to the turn that copied them.
 */
package com.phillippitts.gatesentry.domain;
