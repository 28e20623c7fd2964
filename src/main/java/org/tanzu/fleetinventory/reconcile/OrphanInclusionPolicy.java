package org.tanzu.fleetinventory.reconcile;

import org.tanzu.fleetinventory.model.PartialRecord;

import java.util.Collection;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * Decides whether a device found only in a secondary source is reported as an orphan.
 *
 * Either every candidate is included, or only candidates whose catalog provisioning type is
 * one of the configured types. A candidate without catalog information is included, since
 * there is nothing to exclude it on.
 */
public final class OrphanInclusionPolicy {

    private final boolean includeAll;
    private final Set<String> provisioningTypes;

    private OrphanInclusionPolicy(boolean includeAll, Set<String> provisioningTypes) {
        this.includeAll = includeAll;
        this.provisioningTypes = provisioningTypes;
    }

    /**
     * Includes every secondary-only device, whatever its provisioning type.
     *
     * @return The policy
     */
    public static OrphanInclusionPolicy includeAll() {
        return new OrphanInclusionPolicy(true, Set.of());
    }

    /**
     * Includes candidates whose provisioning type matches one of the given types, ignoring case.
     *
     * @param types Provisioning types such as {@code PVS}, {@code MCS} or {@code Manual}
     * @return The policy
     */
    public static OrphanInclusionPolicy matchingProvisioningTypes(Collection<String> types) {
        Set<String> normalized = new TreeSet<>();
        for (String type : types) {
            if (type != null && !type.trim().isEmpty()) {
                normalized.add(type.trim().toUpperCase(Locale.ROOT));
            }
        }
        return new OrphanInclusionPolicy(false, Set.copyOf(normalized));
    }

    /**
     * Tests an orphan candidate.
     *
     * @param candidate Record of a device unknown to the primary source
     * @return true if the device should be reported as an orphan
     */
    public boolean includes(PartialRecord candidate) {
        if (includeAll) {
            return true;
        }
        String classifier = candidate.getClassifier();
        if (classifier == null || classifier.trim().isEmpty()) {
            return true;
        }
        return provisioningTypes.contains(classifier.trim().toUpperCase(Locale.ROOT));
    }

    public boolean isIncludeAll() { return includeAll; }
    /** Upper-cased provisioning types; empty for an include-all policy */
    public Set<String> getProvisioningTypes() { return provisioningTypes; }

    @Override
    public String toString() {
        return includeAll ? "OrphanInclusionPolicy{all}" : "OrphanInclusionPolicy{types=" + new TreeSet<>(provisioningTypes) + "}";
    }
}
