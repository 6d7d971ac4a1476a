/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.captionhub.exception.CaptionHubException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.captionhub.exception.InvalidStateTransitionException} - Session
 *       lifecycle operation invoked out of order (HTTP 409)</li>
 *   <li>{@link com.phillippitts.captionhub.exception.SessionNotFoundException} - Unknown
 *       session id (HTTP 404)</li>
 *   <li>{@link com.phillippitts.captionhub.exception.SessionStartException} - A channel could
 *       not be opened while starting a session (HTTP 503)</li>
 *   <li>{@link com.phillippitts.captionhub.exception.InvalidSegmentException} and
 *       {@link com.phillippitts.captionhub.exception.UnsupportedLanguageException} - Rejected
 *       input, never retried (HTTP 400)</li>
 *   <li>{@link com.phillippitts.captionhub.exception.TranslationException} - One translation
 *       request failed; carries a transient/non-transient classification</li>
 *   <li>{@link com.phillippitts.captionhub.exception.PersistenceException} - Storage write
 *       failed; transient failures are retried by the durable logger, permanent ones reject the
 *       offending record</li>
 * </ul>
 *
 * @see com.phillippitts.captionhub.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.captionhub.exception;
