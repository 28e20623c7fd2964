/**
 * Device identity correlation.
 *
 * <p>{@link org.tanzu.fleetinventory.identity.DeviceIdentityNormalizer} turns the name formats of the
 * provisioning, broker, directory and hypervisor planes into a single
 * {@link org.tanzu.fleetinventory.identity.DeviceIdentity} key.
 */
package org.tanzu.fleetinventory.identity;
