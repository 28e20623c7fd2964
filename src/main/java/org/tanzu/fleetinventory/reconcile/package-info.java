/**
 * Cross-source reconciliation.
 *
 * <p>{@link org.tanzu.fleetinventory.reconcile.CrossSourceReconciler} merges
 * {@link org.tanzu.fleetinventory.reconcile.SourceSnapshot}s by device identity under a fixed source
 * precedence and reports orphans chosen by an {@link org.tanzu.fleetinventory.reconcile.OrphanInclusionPolicy}.
 */
package org.tanzu.fleetinventory.reconcile;
