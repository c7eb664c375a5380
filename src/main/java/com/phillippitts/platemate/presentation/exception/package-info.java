/**
 * Global exception handling for REST API responses.
 *
 * <p>Exception Mapping:
 * <ul>
 *   <li>{@link com.phillippitts.platemate.exception.ConversationBusyException} → 409 Conflict</li>
 *   <li>{@link com.phillippitts.platemate.exception.PermissionDeniedException} → 403 Forbidden</li>
 *   <li>{@link com.phillippitts.platemate.exception.AudioCaptureException} → 503 Service Unavailable</li>
 *   <li>{@link com.phillippitts.platemate.exception.ConversationException} → 503 Service Unavailable (retry)</li>
 *   <li>{@code IllegalArgumentException} → 400 Bad Request</li>
 *   <li>{@code Exception} (catch-all) → 500 Internal Server Error</li>
 * </ul>
 *
 * <p>Response Format:
 * <pre>
 * {
 *   "errorCode": "ConversationBusyException",
 *   "message": "Assistant is busy",
 *   "details": "Wait for the current reply before sending another message",
 *   "timestamp": "2026-03-02T15:42:32.529Z"
 * }
 * </pre>
 */
package com.phillippitts.platemate.presentation.exception;
