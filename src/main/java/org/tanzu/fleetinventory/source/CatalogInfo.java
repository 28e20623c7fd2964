package org.tanzu.fleetinventory.source;

/**
 * A broker machine catalog and how its machines are provisioned (PVS, MCS, Manual).
 */
public class CatalogInfo {

    private final String catalogRef;
    private final String provisioningType;

    public CatalogInfo(String catalogRef, String provisioningType) {
        this.catalogRef = catalogRef;
        this.provisioningType = provisioningType;
    }

    public String getCatalogRef() { return catalogRef; }
    public String getProvisioningType() { return provisioningType; }
}
