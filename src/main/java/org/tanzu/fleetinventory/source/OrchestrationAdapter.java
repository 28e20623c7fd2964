package org.tanzu.fleetinventory.source;

import java.util.List;

/**
 * Contract of the broker/orchestration plane. One adapter serves every configured controller;
 * the admin address selects the site.
 */
public interface OrchestrationAdapter {

    /**
     * Lists the machines of a site.
     *
     * @param adminAddress Address of the site's controller
     * @return Machines in broker order
     * @throws SourceUnavailableException if the controller cannot be reached
     */
    List<BrokerMachine> listMachines(String adminAddress);

    /**
     * Lists the catalogs of a site with their provisioning type.
     *
     * @param adminAddress Address of the site's controller
     * @return Catalogs of the site
     * @throws SourceUnavailableException if the controller cannot be reached
     */
    List<CatalogInfo> listCatalogs(String adminAddress);
}
