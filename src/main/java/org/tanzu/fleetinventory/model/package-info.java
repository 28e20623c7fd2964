/**
 * Typed device data: one optional group per contributing plane, the per-source
 * {@link org.tanzu.fleetinventory.model.PartialRecord} and the reconciled
 * {@link org.tanzu.fleetinventory.model.DeviceRecord}.
 */
package org.tanzu.fleetinventory.model;
