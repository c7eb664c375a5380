/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.platemate.exception.PlateMateException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.platemate.exception.ConversationException} - Chat API failures,
 *       tagged with the session token valid at call time. Split into
 *       {@link com.phillippitts.platemate.exception.TransientApiException} and
 *       {@link com.phillippitts.platemate.exception.EmptyOrUnsafeResponseException}</li>
 *   <li>{@link com.phillippitts.platemate.exception.ConversationBusyException} - A second request
 *       was issued while one is in flight</li>
 *   <li>{@link com.phillippitts.platemate.exception.PermissionDeniedException} - Microphone or
 *       location access denied</li>
 *   <li>{@link com.phillippitts.platemate.exception.AudioCaptureException} - Microphone or
 *       recognizer could not be opened</li>
 *   <li>{@link com.phillippitts.platemate.exception.GeocodeException} - Reverse-geocode lookup failed</li>
 * </ul>
 *
 * <p>None of these are fatal to the process: every failure degrades to a visible, recoverable
 * state change (a fallback chat message, a user-facing event, or an unchanged place name).
 *
 * @see com.phillippitts.platemate.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.platemate.exception;
