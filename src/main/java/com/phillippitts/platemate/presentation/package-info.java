/**
 * Presentation layer (REST API controllers and exception handling).
 *
 * <p>The HTTP boundary stands in for the chat screen: controllers are thin adapters over
 * {@link com.phillippitts.platemate.service.session.SessionController} and the speech and
 * location services. Presentation depends on service but not vice versa.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code presentation.controller} - REST controllers</li>
 *   <li>{@code presentation.exception} - exception to HTTP status mapping</li>
 * </ul>
 */
package com.phillippitts.platemate.presentation;
