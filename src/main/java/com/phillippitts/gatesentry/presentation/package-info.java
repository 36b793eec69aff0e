/**
 * Presentation layer: REST controllers, request/response records and exception translation.
 *
 * <p>Presentation depends on service, never the reverse. Controllers are thin adapters; domain
 * exceptions are mapped to HTTP status codes in
 * {@link com.phillippitts.gatesentry.presentation.exception.GlobalExceptionHandler}.
 */
package com.phillippitts.gatesentry.presentation;
