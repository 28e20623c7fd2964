/**
 * Spring configuration: bound properties for the inventory run and the vCenter connection,
 * Cloud Foundry service binding processing, and the WebClient used for vAPI calls.
 */
package org.tanzu.fleetinventory.config;
