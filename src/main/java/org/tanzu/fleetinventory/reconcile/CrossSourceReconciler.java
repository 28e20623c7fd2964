package org.tanzu.fleetinventory.reconcile;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.tanzu.fleetinventory.identity.DeviceIdentity;
import org.tanzu.fleetinventory.model.CollectionIssue;
import org.tanzu.fleetinventory.model.DeviceRecord;
import org.tanzu.fleetinventory.model.DirectoryGroup;
import org.tanzu.fleetinventory.model.InventoryWarning;
import org.tanzu.fleetinventory.model.OrchestrationGroup;
import org.tanzu.fleetinventory.model.PartialRecord;
import org.tanzu.fleetinventory.model.ProvisioningGroup;
import org.tanzu.fleetinventory.model.SourceKind;
import org.tanzu.fleetinventory.model.TelemetryGroup;
import org.tanzu.fleetinventory.model.VirtualizationGroup;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges the records of every source into one record per device and finds orphans.
 *
 * Merge rules:
 * - The primary source seeds one record per device it lists.
 * - Secondary sources are applied in precedence order: by {@link SourceKind} rank, then by the
 *   order they were passed in. A field already set by a stronger source is never overwritten;
 *   weaker sources only fill gaps. The result therefore depends on precedence alone and not on
 *   the order in which remote fetches happened to finish.
 * - A secondary device whose short name matches a known device under a different domain is a
 *   merge conflict: the contribution is dropped and a warning recorded. Orphans introduced by
 *   the same source are not known devices for this check, so one broker listing
 *   {@code CORP\VDA01} and {@code LAB\VDA01} yields two orphans.
 * - A secondary device unknown to the primary becomes an orphan record when its source is
 *   orphan-capable and the {@link OrphanInclusionPolicy} includes it. Sources applied later
 *   enrich orphans like any other record.
 * - A device listed twice by the same source keeps its first entry; the second is a warning.
 *
 * The reconciler holds no state between calls. Reconciling the same snapshots twice gives
 * equal results.
 */
@Component
public class CrossSourceReconciler {

    private static final Logger logger = LoggerFactory.getLogger(CrossSourceReconciler.class);

    private static final Comparator<IndexedSource> PRECEDENCE =
            Comparator.comparingInt((IndexedSource s) -> s.snapshot.getKind().rank())
                    .thenComparingInt(s -> s.index);

    /**
     * Reconciles the primary source with the secondary sources.
     *
     * @param primary Snapshot of the authoritative source
     * @param secondaries Snapshots of the other sources, in configured order
     * @param policy Decides which secondary-only devices are reported as orphans
     * @return Merged records, orphan counts and warnings
     */
    public ReconciliationResult reconcile(SourceSnapshot primary, List<SourceSnapshot> secondaries,
                                          OrphanInclusionPolicy policy) {
        logger.info("Reconciling primary '{}' ({} records) with {} secondary sources, {}",
                primary.getName(), primary.getRecords().size(), secondaries.size(), policy);

        List<InventoryWarning> warnings = new ArrayList<>();
        Map<String, List<Accumulator>> byShortName = new HashMap<>();
        List<Accumulator> accumulators = new ArrayList<>();

        for (PartialRecord record : distinct(primary, warnings)) {
            Accumulator accumulator = new Accumulator(record.getIdentity(), primary.getName());
            accumulator.absorb(record, primary.getName());
            accumulators.add(accumulator);
            byShortName.computeIfAbsent(record.getIdentity().getShortName(), k -> new ArrayList<>()).add(accumulator);
        }

        List<IndexedSource> ordered = new ArrayList<>();
        for (int i = 0; i < secondaries.size(); i++) {
            ordered.add(new IndexedSource(secondaries.get(i), i));
        }
        ordered.sort(PRECEDENCE);

        Map<String, Integer> orphanCounts = new LinkedHashMap<>();
        for (SourceSnapshot secondary : secondaries) {
            if (secondary.isOrphanCapable()) {
                orphanCounts.putIfAbsent(secondary.getName(), 0);
            }
        }

        for (IndexedSource indexed : ordered) {
            SourceSnapshot source = indexed.snapshot;
            int merged = 0;
            int ignored = 0;
            for (PartialRecord record : distinct(source, warnings)) {
                DeviceIdentity identity = record.getIdentity();
                List<Accumulator> candidates = byShortName.get(identity.getShortName());
                Accumulator match = findMatch(candidates, identity);
                Accumulator conflict = match == null ? conflicting(candidates, source) : null;

                if (match != null) {
                    match.absorb(record, source.getName());
                    merged++;
                } else if (conflict != null) {
                    DeviceIdentity existing = conflict.effectiveIdentity();
                    String message = String.format("'%s' reports %s but %s is already known; contribution dropped",
                            source.getName(), identity.qualifiedName(), existing.qualifiedName());
                    logger.warn("Merge conflict: {}", message);
                    warnings.add(new InventoryWarning(InventoryWarning.Type.MERGE_CONFLICT, source.getName(),
                            identity.qualifiedName(), message));
                } else if (source.isOrphanCapable() && policy.includes(record)) {
                    Accumulator orphan = new Accumulator(identity, source.getName());
                    orphan.orphanOf(source.getName());
                    orphan.absorb(record, source.getName());
                    accumulators.add(orphan);
                    byShortName.computeIfAbsent(identity.getShortName(), k -> new ArrayList<>()).add(orphan);
                    orphanCounts.merge(source.getName(), 1, Integer::sum);
                    logger.debug("Orphan {} from '{}' (classifier={})", identity.qualifiedName(), source.getName(),
                            record.getClassifier());
                } else {
                    ignored++;
                }
            }
            logger.info("Source '{}' ({}): merged {}, ignored {}", source.getName(), source.getKind(), merged, ignored);
        }

        accumulators.sort(Comparator.comparing((Accumulator a) -> a.identity));
        Map<DeviceIdentity, DeviceRecord> records = new LinkedHashMap<>();
        for (Accumulator accumulator : accumulators) {
            DeviceRecord record = accumulator.toRecord();
            records.put(record.getIdentity(), record);
        }

        logger.info("Reconciled {} devices, orphans per source {}, {} warnings", records.size(), orphanCounts,
                warnings.size());
        return new ReconciliationResult(records, orphanCounts, warnings);
    }

    private static Accumulator findMatch(List<Accumulator> candidates, DeviceIdentity identity) {
        if (candidates == null) {
            return null;
        }
        for (Accumulator candidate : candidates) {
            if (candidate.effectiveIdentity().equals(identity)) {
                return candidate;
            }
        }
        return null;
    }

    /**
     * Finds a known device that the given source contradicts on the domain. Devices the same
     * source introduced as orphans do not count: two domains there are two distinct devices.
     */
    private static Accumulator conflicting(List<Accumulator> candidates, SourceSnapshot source) {
        if (candidates == null) {
            return null;
        }
        for (Accumulator candidate : candidates) {
            if (!candidate.seededBy.equals(source.getName())) {
                return candidate;
            }
        }
        return null;
    }

    private static List<PartialRecord> distinct(SourceSnapshot source, List<InventoryWarning> warnings) {
        Map<String, List<DeviceIdentity>> seen = new HashMap<>();
        List<PartialRecord> result = new ArrayList<>(source.getRecords().size());
        for (PartialRecord record : source.getRecords()) {
            DeviceIdentity identity = record.getIdentity();
            List<DeviceIdentity> sameName = seen.computeIfAbsent(identity.getShortName(), k -> new ArrayList<>());
            if (sameName.contains(identity)) {
                String message = String.format("'%s' lists %s more than once; first entry kept",
                        source.getName(), identity.qualifiedName());
                logger.warn("Duplicate identity: {}", message);
                warnings.add(new InventoryWarning(InventoryWarning.Type.DUPLICATE_IDENTITY, source.getName(),
                        identity.qualifiedName(), message));
                continue;
            }
            sameName.add(identity);
            result.add(record);
        }
        return result;
    }

    private static final class IndexedSource {
        private final SourceSnapshot snapshot;
        private final int index;

        private IndexedSource(SourceSnapshot snapshot, int index) {
            this.snapshot = snapshot;
            this.index = index;
        }
    }

    /**
     * Mutable working state of one device. Lives only inside a single reconcile call.
     */
    private static final class Accumulator {
        private final DeviceIdentity identity;
        private final String seededBy;
        private String displayName;
        private String domain;
        private ProvisioningGroup provisioning;
        private OrchestrationGroup orchestration;
        private DirectoryGroup directory;
        private VirtualizationGroup virtualization;
        private TelemetryGroup telemetry;
        private String orphanProvenance;
        private final List<String> sources = new ArrayList<>();
        private final List<CollectionIssue> issues = new ArrayList<>();

        private Accumulator(DeviceIdentity identity, String seededBy) {
            this.identity = identity;
            this.seededBy = seededBy;
        }

        private DeviceIdentity effectiveIdentity() {
            return identity.withDomainIfAbsent(domain);
        }

        private void orphanOf(String sourceName) {
            this.orphanProvenance = sourceName;
        }

        private void absorb(PartialRecord record, String sourceName) {
            if (displayName == null && !record.getIdentity().getRawName().isEmpty()) {
                displayName = record.getIdentity().getRawName();
            }
            if (domain == null) {
                domain = record.getIdentity().getDomain();
            }
            provisioning = provisioning == null ? record.getProvisioning() : provisioning.mergedWith(record.getProvisioning());
            orchestration = orchestration == null ? record.getOrchestration() : orchestration.mergedWith(record.getOrchestration());
            directory = directory == null ? record.getDirectory() : directory.mergedWith(record.getDirectory());
            virtualization = virtualization == null ? record.getVirtualization() : virtualization.mergedWith(record.getVirtualization());
            telemetry = telemetry == null ? record.getTelemetry() : telemetry.mergedWith(record.getTelemetry());
            if (!sources.contains(sourceName)) {
                sources.add(sourceName);
            }
            issues.addAll(record.getIssues());
        }

        private DeviceRecord toRecord() {
            DeviceRecord.Builder builder = DeviceRecord.builder(effectiveIdentity())
                    .displayName(displayName == null ? identity.qualifiedName() : displayName)
                    .domain(domain)
                    .provisioning(provisioning)
                    .orchestration(orchestration)
                    .directory(directory)
                    .virtualization(virtualization)
                    .telemetry(telemetry)
                    .contributingSources(sources)
                    .collectionIssues(issues);
            if (orphanProvenance != null) {
                builder.orphan(orphanProvenance);
            }
            return builder.build();
        }
    }
}
