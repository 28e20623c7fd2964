/**
 * Inventory run orchestration and the MCP tools that expose it.
 */
package org.tanzu.fleetinventory.inventory;
