package com.hostpanel.orchestrator.api;

import com.hostpanel.orchestrator.api.dto.DiscoveredVmResponse;
import com.hostpanel.orchestrator.discovery.InventoryDiscoveryService;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Inventory of source hosts.
 *
 * POST /source-hosts/{id}/discovery  refresh the stored snapshot from the host
 * GET  /source-hosts/{id}/vms        read the stored snapshot
 */
@RestController
@RequestMapping("/source-hosts/{id}")
public class DiscoveryController {

    private final InventoryDiscoveryService discovery;

    public DiscoveryController(InventoryDiscoveryService discovery) {
        this.discovery = discovery;
    }

    @PostMapping("/discovery")
    public List<DiscoveredVmResponse> discover(@PathVariable Long id) {
        return discovery.discover(id).stream()
                .map(DiscoveredVmResponse::from)
                .toList();
    }

    @GetMapping("/vms")
    public List<DiscoveredVmResponse> snapshot(@PathVariable Long id) {
        return discovery.getSnapshot(id).stream()
                .map(DiscoveredVmResponse::from)
                .toList();
    }
}
