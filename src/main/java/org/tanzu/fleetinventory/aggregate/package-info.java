/**
 * Run output: {@link org.tanzu.fleetinventory.aggregate.ResultAggregate} with its
 * {@link org.tanzu.fleetinventory.aggregate.RunManifest}, and the
 * {@link org.tanzu.fleetinventory.aggregate.OutputSink} contract for renderers.
 */
package org.tanzu.fleetinventory.aggregate;
