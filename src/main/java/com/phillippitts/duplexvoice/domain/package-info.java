/**
 * Immutable domain model shared by the duplex controller, its loops and its observers.
 *
 * <p>{@link com.phillippitts.duplexvoice.domain.DuplexConfig} is the only configuration type the
 * controller consumes; the remaining types are values passed between loops
 * ({@link com.phillippitts.duplexvoice.domain.Transcription},
 * {@link com.phillippitts.duplexvoice.domain.Intent}) or published to subscribers
 * ({@link com.phillippitts.duplexvoice.domain.DuplexEvent}).
 */
package com.phillippitts.duplexvoice.domain;
