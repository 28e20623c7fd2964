/**
 * vCenter virtualization source: a read-only vAPI client and the
 * {@link org.tanzu.fleetinventory.source.VirtualizationAdapter} built on it.
 */
package org.tanzu.fleetinventory.vcenter;
