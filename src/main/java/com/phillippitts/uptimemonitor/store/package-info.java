/**
 * Collaborator interfaces for monitor configuration and status history.
 *
 * <p>The scheduling engine depends only on these interfaces. The default implementation lives in
 * {@code store.memory}; a database-backed implementation can replace it by declaring its own beans.
 */
package com.phillippitts.uptimemonitor.store;
