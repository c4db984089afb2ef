/**
 * REST controllers: monitor CRUD and the push heartbeat endpoint.
 */
package com.phillippitts.uptimemonitor.presentation.controller;
