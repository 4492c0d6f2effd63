/**
 * Domain model for streaming recognition results and session state.
 *
 * <p>These types are independent of the Google client library so the session controller
 * can be exercised against a fake gateway.
 *
 * @since 1.0
 */
package com.phillippitts.speechrelay.domain;
