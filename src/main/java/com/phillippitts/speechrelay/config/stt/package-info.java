/**
 * Speech-to-Text client wiring: credential parsing and creation of the shared gateway bean.
 */
package com.phillippitts.speechrelay.config.stt;
