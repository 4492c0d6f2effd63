/**
 * Recognition gateway abstraction.
 *
 * <p>The session controller only sees {@link com.phillippitts.speechrelay.service.stt.RecognitionGateway},
 * {@link com.phillippitts.speechrelay.service.stt.RecognitionStream} and
 * {@link com.phillippitts.speechrelay.service.stt.RecognitionListener}; the Google client
 * library is confined to the {@code google} sub-package.
 *
 * @since 1.0
 */
package com.phillippitts.speechrelay.service.stt;
