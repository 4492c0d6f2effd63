/**
 * Service layer: streaming sessions, the recognition gateway, health and metrics.
 */
package com.phillippitts.speechrelay.service;
