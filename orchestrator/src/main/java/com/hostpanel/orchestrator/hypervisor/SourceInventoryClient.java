package com.hostpanel.orchestrator.hypervisor;

import com.fasterxml.jackson.databind.JsonNode;
import com.hostpanel.orchestrator.model.SourceHost;

import java.util.List;

/**
 * Read access to the VM inventory of a source (ESXi) host.
 *
 * One call authenticates and returns every VM as the raw property document
 * the host reports (name, config, runtime, guest, summary). Normalization
 * happens in the discovery layer.
 */
public interface SourceInventoryClient {

    /**
     * @throws HypervisorException if the host cannot be reached or rejects the credentials
     */
    List<JsonNode> retrieveVirtualMachines(SourceHost host);
}
