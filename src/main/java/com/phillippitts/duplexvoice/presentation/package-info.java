/**
 * Presentation layer (REST controllers and exception handling).
 *
 * <p>Presentation depends on service, never the reverse. Controllers are thin adapters over
 * {@link com.phillippitts.duplexvoice.service.duplex.DuplexController}; domain exceptions are
 * translated to HTTP status codes by
 * {@link com.phillippitts.duplexvoice.presentation.exception.GlobalExceptionHandler}.
 */
package com.phillippitts.duplexvoice.presentation;
