/**
 * Spring configuration: thread pools, engine wiring, metrics, and typed properties under
 * {@code config.properties}.
 */
package com.phillippitts.uptimemonitor.config;
