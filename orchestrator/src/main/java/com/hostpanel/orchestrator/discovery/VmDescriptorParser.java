package com.hostpanel.orchestrator.discovery;

import com.fasterxml.jackson.databind.JsonNode;
import com.hostpanel.orchestrator.model.DiscoveredVm;
import com.hostpanel.orchestrator.model.DiskInfo;
import com.hostpanel.orchestrator.model.NetworkAdapter;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Normalizes one VM property document from the source inventory into a
 * {@link DiscoveredVm}.
 *
 * Expected shape (property names as the source reports them):
 * <pre>
 *   name
 *   config.hardware.{numCPU, memoryMB, device[]}
 *   config.{guestFullName, guestId, files.vmPathName, uuid, instanceUuid, version, annotation}
 *   runtime.powerState
 *   guest.{net[], toolsStatus, toolsVersion, toolsRunningStatus}
 * </pre>
 * Devices are told apart by their "_type" discriminator.
 */
@Component
public class VmDescriptorParser {

    static final String UNKNOWN = "Unknown";

    /**
     * @throws IllegalArgumentException if the document has no VM name
     */
    public DiscoveredVm parse(JsonNode vm) {
        String name = text(vm.path("name"), null);
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("VM document has no name");
        }
        JsonNode config   = vm.path("config");
        JsonNode hardware = config.path("hardware");
        JsonNode guest    = vm.path("guest");

        List<DiskInfo>       disks    = new ArrayList<>();
        List<NetworkAdapter> adapters = new ArrayList<>();
        for (JsonNode device : hardware.path("device")) {
            String type = device.path("_type").asText("");
            if ("VirtualDisk".equals(type)) {
                disks.add(parseDisk(device));
            } else if (type.contains("VirtualEthernet")) {
                adapters.add(parseAdapter(device));
            }
        }
        adapters = enrichWithGuestIps(adapters, guest.path("net"));

        String guestOS = text(config.path("guestFullName"), text(config.path("guestId"), UNKNOWN));

        return new DiscoveredVm(
                name,
                text(config.path("files").path("vmPathName"), null),
                text(vm.path("runtime").path("powerState"), "unknown"),
                hardware.path("numCPU").asInt(0),
                hardware.path("memoryMB").asLong(0),
                guestOS,
                disks,
                adapters,
                rawMetadata(config, guest));
    }

    // ------------------------------------------------------------------
    // Devices
    // ------------------------------------------------------------------

    private static DiskInfo parseDisk(JsonNode device) {
        JsonNode backing = device.path("backing");
        double sizeGB = Math.round(device.path("capacityInKB").asDouble(0) / 1024 / 1024 * 100) / 100.0;
        return new DiskInfo(
                text(device.path("deviceInfo").path("label"), UNKNOWN),
                sizeGB,
                text(backing.path("fileName"), null),
                text(backing.path("_type"), null));
    }

    private static NetworkAdapter parseAdapter(JsonNode device) {
        JsonNode backing = device.path("backing");
        String network = text(backing.path("deviceName"),
                              text(backing.path("network").path("name"), UNKNOWN));
        return new NetworkAdapter(
                text(device.path("deviceInfo").path("label"), UNKNOWN),
                text(device.path("macAddress"), null),
                null,
                network);
    }

    /** Guest tooling reports addresses per MAC; prefer the first IPv4 one. */
    private static List<NetworkAdapter> enrichWithGuestIps(List<NetworkAdapter> adapters, JsonNode guestNets) {
        List<NetworkAdapter> result = new ArrayList<>(adapters);
        for (JsonNode net : guestNets) {
            String mac = net.path("macAddress").asText("");
            JsonNode addresses = net.path("ipAddress");
            if (mac.isEmpty() || !addresses.isArray() || addresses.isEmpty()) {
                continue;
            }
            String ip = null;
            for (JsonNode address : addresses) {
                if (!address.asText().contains(":")) {
                    ip = address.asText();
                    break;
                }
            }
            if (ip == null) {
                ip = addresses.get(0).asText();
            }
            for (int i = 0; i < result.size(); i++) {
                if (mac.equalsIgnoreCase(result.get(i).macAddress())) {
                    result.set(i, result.get(i).withIpAddress(ip));
                }
            }
        }
        return result;
    }

    private static Map<String, Object> rawMetadata(JsonNode config, JsonNode guest) {
        Map<String, Object> tools = new LinkedHashMap<>();
        tools.put("status",  text(guest.path("toolsStatus"), null));
        tools.put("version", text(guest.path("toolsVersion"), null));
        tools.put("running", text(guest.path("toolsRunningStatus"), null));

        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("uuid",         text(config.path("uuid"), null));
        raw.put("instanceUuid", text(config.path("instanceUuid"), null));
        raw.put("version",      text(config.path("version"), null));
        raw.put("annotation",   text(config.path("annotation"), null));
        raw.put("tools",        tools);
        return raw;
    }

    private static String text(JsonNode node, String fallback) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return fallback;
        }
        String value = node.asText();
        return value.isEmpty() ? fallback : value;
    }
}
