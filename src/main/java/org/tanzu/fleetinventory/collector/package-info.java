/**
 * Bounded fan-out of blocking per-device calls.
 *
 * <p>{@link org.tanzu.fleetinventory.collector.BoundedCollector} runs at most N tasks at once, each under
 * its own deadline, and reports every submission as a {@link org.tanzu.fleetinventory.collector.TaskOutcome}.
 * A host that never answers costs one deadline of scheduling time and nothing more.
 */
package org.tanzu.fleetinventory.collector;
