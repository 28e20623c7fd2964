/**
 * Contracts of the inventory sources the engine reads from.
 *
 * <p>Provisioning is the primary source. Broker, directory, virtualization and telemetry
 * adapters are secondary. Vendor implementations plug in as Spring beans; the vCenter
 * implementation lives in {@code org.tanzu.fleetinventory.vcenter}.
 */
package org.tanzu.fleetinventory.source;
