/**
 * Maps application exceptions to HTTP responses.
 */
package com.phillippitts.uptimemonitor.presentation.exception;
