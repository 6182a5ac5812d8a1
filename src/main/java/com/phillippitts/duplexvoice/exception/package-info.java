/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.duplexvoice.exception.DuplexVoiceException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.duplexvoice.exception.ControllerConfigurationException} - Thrown
 *       synchronously for invalid configuration or lifecycle misuse (fatal to the call)</li>
 *   <li>{@link com.phillippitts.duplexvoice.exception.RecognitionException} - Transient
 *       recognizer failure for one chunk; the listen loop skips it</li>
 *   <li>{@link com.phillippitts.duplexvoice.exception.SynthesisException} - Transient
 *       synthesizer failure; the speak loop falls back to listening</li>
 * </ul>
 *
 * <p>Cancellation is never signalled with these types; loops observe the session running flag
 * and thread interruption instead. All exceptions map to HTTP responses via
 * {@code GlobalExceptionHandler}.
 *
 * @see com.phillippitts.duplexvoice.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.duplexvoice.exception;
