package org.tanzu.fleetinventory.inventory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.tanzu.fleetinventory.aggregate.OutputSink;
import org.tanzu.fleetinventory.aggregate.ResultAggregate;
import org.tanzu.fleetinventory.aggregate.RunManifest;
import org.tanzu.fleetinventory.collector.BoundedCollector;
import org.tanzu.fleetinventory.collector.CollectorStats;
import org.tanzu.fleetinventory.collector.CollectorWork;
import org.tanzu.fleetinventory.collector.TaskOutcome;
import org.tanzu.fleetinventory.config.InventoryConfig;
import org.tanzu.fleetinventory.identity.DeviceIdentity;
import org.tanzu.fleetinventory.identity.DeviceIdentityNormalizer;
import org.tanzu.fleetinventory.model.CollectionIssue;
import org.tanzu.fleetinventory.model.DirectoryGroup;
import org.tanzu.fleetinventory.model.InventoryWarning;
import org.tanzu.fleetinventory.model.OrchestrationGroup;
import org.tanzu.fleetinventory.model.PartialRecord;
import org.tanzu.fleetinventory.model.ProvisioningGroup;
import org.tanzu.fleetinventory.model.SourceKind;
import org.tanzu.fleetinventory.model.TelemetryGroup;
import org.tanzu.fleetinventory.model.VirtualizationGroup;
import org.tanzu.fleetinventory.reconcile.CrossSourceReconciler;
import org.tanzu.fleetinventory.reconcile.OrphanInclusionPolicy;
import org.tanzu.fleetinventory.reconcile.ReconciliationResult;
import org.tanzu.fleetinventory.reconcile.SourceSnapshot;
import org.tanzu.fleetinventory.source.BrokerMachine;
import org.tanzu.fleetinventory.source.CatalogInfo;
import org.tanzu.fleetinventory.source.DeviceFilter;
import org.tanzu.fleetinventory.source.DeviceNotFoundException;
import org.tanzu.fleetinventory.source.DirectoryAdapter;
import org.tanzu.fleetinventory.source.OrchestrationAdapter;
import org.tanzu.fleetinventory.source.ProvisioningAdapter;
import org.tanzu.fleetinventory.source.SourceUnavailableException;
import org.tanzu.fleetinventory.source.TelemetryAdapter;
import org.tanzu.fleetinventory.source.VirtualizationAdapter;
import org.tanzu.fleetinventory.source.VmListing;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Runs one inventory pass across every configured source.
 *
 * A run proceeds in phases:
 * 1. List the primary (provisioning) source. This is the only fatal step.
 * 2. Build the provisioning reference data (disk versions, store paths) on the run thread.
 * 3. Fan out per-device provisioning detail through a {@link BoundedCollector}.
 * 4. List every configured broker and the hypervisor VMs.
 * 5. Reconcile once to learn the full device set, orphans included.
 * 6. Fan out hypervisor detail, directory lookups and telemetry probes for that set.
 * 7. Reconcile everything, build the manifest, hand the aggregate to the output sinks.
 *
 * Sources other than the primary are optional: a source with no adapter bean is skipped, a
 * source that cannot be reached is listed as unavailable in the manifest. Runs are
 * serialized; the latest aggregate stays available for the read-only MCP tools.
 */
@Service
public class FleetInventoryService {

    private static final Logger logger = LoggerFactory.getLogger(FleetInventoryService.class);

    /** Source name of the combined broker snapshot */
    public static final String BROKER_SOURCE = "broker";

    private final ProvisioningAdapter provisioningAdapter;
    private final OrchestrationAdapter orchestrationAdapter;
    private final VirtualizationAdapter virtualizationAdapter;
    private final DirectoryAdapter directoryAdapter;
    private final TelemetryAdapter telemetryAdapter;
    private final CrossSourceReconciler reconciler;
    private final InventoryConfig config;
    private final List<OutputSink> outputSinks;

    private volatile ResultAggregate latest;

    @Autowired
    public FleetInventoryService(ObjectProvider<ProvisioningAdapter> provisioningAdapter,
                                 ObjectProvider<OrchestrationAdapter> orchestrationAdapter,
                                 ObjectProvider<VirtualizationAdapter> virtualizationAdapter,
                                 ObjectProvider<DirectoryAdapter> directoryAdapter,
                                 ObjectProvider<TelemetryAdapter> telemetryAdapter,
                                 CrossSourceReconciler reconciler,
                                 InventoryConfig config,
                                 List<OutputSink> outputSinks) {
        this(provisioningAdapter.getIfAvailable(), orchestrationAdapter.getIfAvailable(),
                virtualizationAdapter.getIfAvailable(), directoryAdapter.getIfAvailable(),
                telemetryAdapter.getIfAvailable(), reconciler, config, outputSinks);
    }

    /**
     * @param provisioningAdapter Primary source; runs fail while it is null
     * @param orchestrationAdapter Broker source, or null
     * @param virtualizationAdapter Hypervisor source, or null
     * @param directoryAdapter Directory source, or null
     * @param telemetryAdapter Live telemetry source, or null
     * @param reconciler Merges the source snapshots
     * @param config Run settings
     * @param outputSinks Receivers of every completed run
     */
    public FleetInventoryService(ProvisioningAdapter provisioningAdapter,
                                 OrchestrationAdapter orchestrationAdapter,
                                 VirtualizationAdapter virtualizationAdapter,
                                 DirectoryAdapter directoryAdapter,
                                 TelemetryAdapter telemetryAdapter,
                                 CrossSourceReconciler reconciler,
                                 InventoryConfig config,
                                 List<OutputSink> outputSinks) {
        this.provisioningAdapter = provisioningAdapter;
        this.orchestrationAdapter = orchestrationAdapter;
        this.virtualizationAdapter = virtualizationAdapter;
        this.directoryAdapter = directoryAdapter;
        this.telemetryAdapter = telemetryAdapter;
        this.reconciler = reconciler;
        this.config = config;
        this.outputSinks = outputSinks == null ? List.of() : List.copyOf(outputSinks);
        logger.info("FleetInventoryService initialized (provisioning={}, orchestration={}, virtualization={}, directory={}, telemetry={})",
                provisioningAdapter != null, orchestrationAdapter != null, virtualizationAdapter != null,
                directoryAdapter != null, telemetryAdapter != null);
    }

    /**
     * Result of the most recent successful run.
     * @return The aggregate, or null if no run has completed yet
     */
    public ResultAggregate getLatest() {
        return latest;
    }

    /**
     * Runs an inventory pass with the orphan policy from configuration.
     */
    public ResultAggregate run() {
        return run(configuredPolicy());
    }

    /**
     * Builds the orphan policy from the {@code inventory.*} settings.
     */
    public OrphanInclusionPolicy configuredPolicy() {
        return config.isIncludeAllOrphans()
                ? OrphanInclusionPolicy.includeAll()
                : OrphanInclusionPolicy.matchingProvisioningTypes(config.getOrphanProvisioningTypes());
    }

    /**
     * Runs an inventory pass.
     *
     * @param policy Decides which secondary-only devices are reported as orphans
     * @return The reconciled records and the run manifest
     * @throws InventoryRunException if there is no primary source or it cannot be listed
     */
    public synchronized ResultAggregate run(OrphanInclusionPolicy policy) {
        String runId = UUID.randomUUID().toString();
        Instant startedAt = Instant.now();
        RunContext run = new RunContext();
        logger.info("Inventory run {} started ({}, maxConcurrency={}, perTaskTimeout={})",
                runId, policy, config.getMaxConcurrency(), config.getPerTaskTimeout());

        if (provisioningAdapter == null) {
            throw new InventoryRunException("No provisioning source is configured");
        }
        String primaryName = provisioningAdapter.getName();
        List<DeviceIdentity> devices;
        try {
            devices = provisioningAdapter.listDevices(deviceFilter());
        } catch (RuntimeException e) {
            logger.error("Inventory run {} aborted: primary source '{}' could not be listed", runId, primaryName, e);
            throw new InventoryRunException("Failed to list primary source '" + primaryName + "': " + e.getMessage(), e);
        }
        logger.info("Primary source '{}' listed {} devices", primaryName, devices.size());

        ProvisioningReferenceData reference = loadReferenceData(primaryName, run);
        SourceSnapshot primary = collectPrimary(primaryName, devices, reference, run);

        List<SourceSnapshot> listed = new ArrayList<>();
        SourceSnapshot brokers = collectBrokers(run);
        if (brokers != null) {
            listed.add(brokers);
        }
        List<VmListing> vms = listVms(run);

        // Enrichment fan-outs cover orphans as well, so the device set comes from a first reconcile.
        Set<DeviceIdentity> known = reconciler.reconcile(primary, listed, policy).getRecords().keySet();
        logger.info("Run {}: {} devices to enrich", runId, known.size());

        List<SourceSnapshot> secondaries = new ArrayList<>(listed);
        if (vms != null) {
            secondaries.add(describeVms(vms, known, run));
        }
        if (directoryAdapter != null) {
            secondaries.add(collectDirectory(known, run));
        }
        if (telemetryAdapter != null) {
            secondaries.add(collectTelemetry(known, run));
        }

        ReconciliationResult result = reconciler.reconcile(primary, secondaries, policy);
        run.warnings.addAll(result.getWarnings());

        RunManifest manifest = new RunManifest(runId, startedAt, Instant.now(), result.getRecords().size(),
                result.getOrphanCounts(), run.timedOut, run.failed, run.unavailable, run.warnings,
                policy.toString(), run.stats);
        ResultAggregate aggregate = new ResultAggregate(result.getRecords(), manifest);
        latest = aggregate;
        logger.info("Inventory run {} completed: {}", runId, manifest);

        publish(aggregate);
        return aggregate;
    }

    private DeviceFilter deviceFilter() {
        if (config.getDeviceSite() == null && config.getDeviceCollection() == null) {
            return DeviceFilter.none();
        }
        return new DeviceFilter(config.getDeviceSite(), config.getDeviceCollection());
    }

    private ProvisioningReferenceData loadReferenceData(String primaryName, RunContext run) {
        try {
            ProvisioningReferenceData reference = ProvisioningReferenceData.from(
                    provisioningAdapter.listDiskVersions(), provisioningAdapter.listStores());
            logger.info("Loaded reference data from '{}': {} disks, {} stores", primaryName,
                    reference.diskCount(), reference.storeCount());
            return reference;
        } catch (RuntimeException e) {
            String message = "Disk versions and stores unavailable: " + e.getMessage();
            logger.warn("'{}': {}", primaryName, message);
            run.warnings.add(new InventoryWarning(InventoryWarning.Type.SOURCE_UNAVAILABLE, primaryName, null, message));
            return ProvisioningReferenceData.empty();
        }
    }

    private SourceSnapshot collectPrimary(String primaryName, List<DeviceIdentity> devices,
                                          ProvisioningReferenceData reference, RunContext run) {
        Map<DeviceIdentity, TaskOutcome<ProvisioningGroup>> details =
                fanOut(primaryName, devices, provisioningAdapter::getDeviceDetail, run);
        reportSourceDown(primaryName, details.values(), run);

        List<PartialRecord> records = new ArrayList<>(devices.size());
        for (DeviceIdentity identity : devices) {
            PartialRecord.Builder record = PartialRecord.builder(identity);
            TaskOutcome<ProvisioningGroup> outcome = details.get(identity);
            if (outcome != null && outcome.isCompleted()) {
                record.provisioning(reference.complete(outcome.getValue()));
            } else if (outcome != null) {
                recordIncomplete(primaryName, identity, outcome, record, run);
            }
            records.add(record.build());
        }
        return SourceSnapshot.of(primaryName, SourceKind.PROVISIONING, records);
    }

    /**
     * Lists every configured broker into one orphan-capable snapshot. Brokers are read in
     * configured order, so a machine listed by two brokers keeps the first broker's entry.
     */
    private SourceSnapshot collectBrokers(RunContext run) {
        List<String> addresses = config.getBrokerAdminAddresses();
        if (orchestrationAdapter == null || addresses == null || addresses.isEmpty()) {
            logger.info("No broker configured, orchestration source skipped");
            return null;
        }
        List<PartialRecord> records = new ArrayList<>();
        for (String address : addresses) {
            String sourceLabel = BROKER_SOURCE + "@" + address;
            try {
                Map<String, String> catalogTypes = catalogTypes(orchestrationAdapter.listCatalogs(address));
                List<BrokerMachine> machines = orchestrationAdapter.listMachines(address);
                for (BrokerMachine machine : machines) {
                    records.add(brokerRecord(machine, catalogTypes, address));
                }
                logger.info("Broker {} listed {} machines in {} catalogs", address, machines.size(), catalogTypes.size());
            } catch (RuntimeException e) {
                sourceUnavailable(sourceLabel, e, run);
            }
        }
        return SourceSnapshot.orphanCapable(BROKER_SOURCE, SourceKind.ORCHESTRATION, records);
    }

    private static Map<String, String> catalogTypes(List<CatalogInfo> catalogs) {
        Map<String, String> types = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        for (CatalogInfo catalog : catalogs) {
            if (catalog.getCatalogRef() != null) {
                types.putIfAbsent(catalog.getCatalogRef(), catalog.getProvisioningType());
            }
        }
        return Collections.unmodifiableMap(types);
    }

    private static PartialRecord brokerRecord(BrokerMachine machine, Map<String, String> catalogTypes, String address) {
        OrchestrationGroup group = machine.getGroup() == null ? OrchestrationGroup.builder().build() : machine.getGroup();
        OrchestrationGroup.Builder builder = group.toBuilder();
        if (group.getProvisioningType() == null && machine.getCatalogRef() != null) {
            builder.provisioningType(catalogTypes.get(machine.getCatalogRef()));
        }
        if (group.getBrokerAddress() == null) {
            builder.brokerAddress(address);
        }
        return PartialRecord.builder(machine.getIdentity()).orchestration(builder.build()).build();
    }

    private List<VmListing> listVms(RunContext run) {
        if (virtualizationAdapter == null) {
            return null;
        }
        try {
            return virtualizationAdapter.listVms(config.getVmNamePattern());
        } catch (RuntimeException e) {
            sourceUnavailable(virtualizationAdapter.getName(), e, run);
            return null;
        }
    }

    private SourceSnapshot describeVms(List<VmListing> vms, Set<DeviceIdentity> known, RunContext run) {
        String sourceName = virtualizationAdapter.getName();
        Character splitChar = config.splitCharacter();

        List<DeviceIdentity> identities = new ArrayList<>();
        List<VmListing> listings = new ArrayList<>();
        for (VmListing listing : vms) {
            DeviceIdentity identity = DeviceIdentityNormalizer.normalize(listing.getName(), null, splitChar);
            if (known.contains(identity)) {
                identities.add(identity);
                listings.add(listing);
            }
        }
        logger.info("'{}': {} of {} VMs belong to known devices", sourceName, listings.size(), vms.size());

        Map<DeviceIdentity, VmListing> byIdentity = new LinkedHashMap<>();
        for (int i = 0; i < identities.size(); i++) {
            byIdentity.putIfAbsent(identities.get(i), listings.get(i));
        }
        Map<DeviceIdentity, TaskOutcome<VirtualizationGroup>> details =
                fanOut(sourceName, identities, identity -> virtualizationAdapter.describeVm(byIdentity.get(identity)), run);
        reportSourceDown(sourceName, details.values(), run);

        List<PartialRecord> records = new ArrayList<>(identities.size());
        for (int i = 0; i < identities.size(); i++) {
            DeviceIdentity identity = identities.get(i);
            PartialRecord.Builder record = PartialRecord.builder(identity);
            TaskOutcome<VirtualizationGroup> outcome = details.get(identity);
            if (outcome != null && outcome.isCompleted()) {
                record.virtualization(outcome.getValue());
            } else {
                record.virtualization(listings.get(i).getGroup());
                if (outcome != null) {
                    recordIncomplete(sourceName, identity, outcome, record, run);
                }
            }
            records.add(record.build());
        }
        return SourceSnapshot.of(sourceName, SourceKind.VIRTUALIZATION, records);
    }

    private SourceSnapshot collectDirectory(Set<DeviceIdentity> known, RunContext run) {
        String sourceName = directoryAdapter.getName();
        Map<DeviceIdentity, TaskOutcome<DirectoryGroup>> outcomes =
                fanOut(sourceName, known, identity -> directoryAdapter.lookup(identity.getShortName()), run);
        reportSourceDown(sourceName, outcomes.values(), run);

        List<PartialRecord> records = new ArrayList<>(outcomes.size());
        for (Map.Entry<DeviceIdentity, TaskOutcome<DirectoryGroup>> entry : outcomes.entrySet()) {
            PartialRecord.Builder record = PartialRecord.builder(entry.getKey());
            TaskOutcome<DirectoryGroup> outcome = entry.getValue();
            if (isSourceDown(outcome)) {
                continue;
            }
            if (outcome.isCompleted()) {
                record.directory(outcome.getValue());
            } else {
                recordIncomplete(sourceName, entry.getKey(), outcome, record, run);
            }
            records.add(record.build());
        }
        return SourceSnapshot.of(sourceName, SourceKind.DIRECTORY, records);
    }

    private SourceSnapshot collectTelemetry(Set<DeviceIdentity> known, RunContext run) {
        String sourceName = telemetryAdapter.getName();
        Map<DeviceIdentity, TaskOutcome<TelemetryGroup>> outcomes = fanOut(sourceName, known,
                identity -> telemetryAdapter.getTelemetry(identity.getShortName(), config.getTelemetryTimeout()), run);
        reportSourceDown(sourceName, outcomes.values(), run);

        List<PartialRecord> records = new ArrayList<>(outcomes.size());
        for (Map.Entry<DeviceIdentity, TaskOutcome<TelemetryGroup>> entry : outcomes.entrySet()) {
            DeviceIdentity identity = entry.getKey();
            TaskOutcome<TelemetryGroup> outcome = entry.getValue();
            if (isSourceDown(outcome)) {
                continue;
            }
            PartialRecord.Builder record = PartialRecord.builder(identity);
            if (outcome.isCompleted() && outcome.getValue() == null) {
                record.telemetry(TelemetryGroup.unreachable("no telemetry returned"));
                unreachable(sourceName, identity, "no telemetry returned", record, run);
            } else if (outcome.isCompleted()) {
                TelemetryGroup telemetry = outcome.getValue();
                record.telemetry(telemetry);
                if (telemetry.getStatus() == TelemetryGroup.Status.TIMED_OUT) {
                    timedOut(sourceName, identity, "probe reported a timeout", record, run);
                } else if (telemetry.getStatus() == TelemetryGroup.Status.UNREACHABLE) {
                    unreachable(sourceName, identity, telemetry.getDetail(), record, run);
                }
            } else if (outcome.isTimedOut()) {
                record.telemetry(TelemetryGroup.timedOut());
                recordIncomplete(sourceName, identity, outcome, record, run);
            } else if (outcome.isFailed()) {
                record.telemetry(TelemetryGroup.unreachable(outcome.getError().getMessage()));
                recordIncomplete(sourceName, identity, outcome, record, run);
            }
            records.add(record.build());
        }
        return SourceSnapshot.of(sourceName, SourceKind.TELEMETRY, records);
    }

    private <T> Map<DeviceIdentity, TaskOutcome<T>> fanOut(String name, Collection<DeviceIdentity> identities,
                                                            CollectorWork<T> work, RunContext run) {
        try (BoundedCollector<T> collector =
                     new BoundedCollector<>(name, config.getMaxConcurrency(), config.getPerTaskTimeout())) {
            for (DeviceIdentity identity : identities) {
                collector.submit(identity, work);
            }
            Map<DeviceIdentity, TaskOutcome<T>> outcomes = collector.drain();
            run.stats.put(name, collector.getStats());
            return outcomes;
        }
    }

    private void recordIncomplete(String sourceName, DeviceIdentity identity, TaskOutcome<?> outcome,
                                  PartialRecord.Builder record, RunContext run) {
        if (outcome.isTimedOut()) {
            timedOut(sourceName, identity, "no answer within " + outcome.getElapsed().toMillis() + " ms", record, run);
        } else if (outcome.isFailed()) {
            Throwable error = outcome.getError();
            if (error instanceof SourceUnavailableException) {
                return;
            }
            if (error instanceof DeviceNotFoundException) {
                record.issue(new CollectionIssue(sourceName, CollectionIssue.Kind.NOT_FOUND, error.getMessage()));
                logger.debug("'{}' has no entry for {}", sourceName, identity.qualifiedName());
            } else {
                unreachable(sourceName, identity, error.getMessage(), record, run);
            }
        }
    }

    /**
     * Lists a source as unavailable when any of its per-device calls reported the whole source
     * down. The source is listed once, and the affected devices carry no per-device failure.
     */
    private void reportSourceDown(String sourceName, Collection<? extends TaskOutcome<?>> outcomes, RunContext run) {
        for (TaskOutcome<?> outcome : outcomes) {
            if (isSourceDown(outcome)) {
                sourceUnavailable(sourceName, (SourceUnavailableException) outcome.getError(), run);
                return;
            }
        }
    }

    private static boolean isSourceDown(TaskOutcome<?> outcome) {
        return outcome.isFailed() && outcome.getError() instanceof SourceUnavailableException;
    }

    private void timedOut(String sourceName, DeviceIdentity identity, String message,
                          PartialRecord.Builder record, RunContext run) {
        run.timedOut++;
        record.issue(new CollectionIssue(sourceName, CollectionIssue.Kind.TIMED_OUT, message));
        run.warnings.add(new InventoryWarning(InventoryWarning.Type.TIMED_OUT, sourceName, identity.qualifiedName(), message));
    }

    private void unreachable(String sourceName, DeviceIdentity identity, String message,
                             PartialRecord.Builder record, RunContext run) {
        run.failed++;
        record.issue(new CollectionIssue(sourceName, CollectionIssue.Kind.UNREACHABLE, message));
        run.warnings.add(new InventoryWarning(InventoryWarning.Type.DEVICE_UNREACHABLE, sourceName,
                identity.qualifiedName(), message));
    }

    private void sourceUnavailable(String sourceName, RuntimeException e, RunContext run) {
        logger.warn("Source '{}' unavailable, continuing without it: {}", sourceName, e.getMessage());
        run.unavailable.add(sourceName);
        run.warnings.add(new InventoryWarning(InventoryWarning.Type.SOURCE_UNAVAILABLE, sourceName, null, e.getMessage()));
    }

    private void publish(ResultAggregate aggregate) {
        for (OutputSink sink : outputSinks) {
            try {
                sink.accept(aggregate);
            } catch (RuntimeException e) {
                logger.error("Output sink {} failed for run {}", sink.getClass().getSimpleName(),
                        aggregate.getManifest().getRunId(), e);
            }
        }
    }

    /**
     * Mutable bookkeeping of one run, touched only on the run thread.
     */
    private static final class RunContext {
        private final List<InventoryWarning> warnings = new ArrayList<>();
        private final List<String> unavailable = new ArrayList<>();
        private final Map<String, CollectorStats> stats = new LinkedHashMap<>();
        private int timedOut;
        private int failed;
    }
}
