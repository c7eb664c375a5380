/**
 * REST API controllers.
 *
 * <ul>
 *   <li>{@link com.phillippitts.platemate.presentation.controller.AssistantController}
 *       - session, messages, voice, location, restaurants and favorites under {@code /api}</li>
 *   <li>{@link com.phillippitts.platemate.presentation.controller.PingController}
 *       - {@code GET /ping} for verifying the server and the MDC log pattern</li>
 * </ul>
 */
package com.phillippitts.platemate.presentation.controller;
