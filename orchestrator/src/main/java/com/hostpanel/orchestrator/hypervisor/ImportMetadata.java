package com.hostpanel.orchestrator.hypervisor;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What a Proxmox node reports about one VM on an attached ESXi import storage.
 *
 * @param volume     volume path of the .vmx file, without the storage prefix
 * @param createArgs suggested VM creation arguments (name, ostype, cores, memory…)
 * @param disks      disk key (scsi0, sata1, efidisk0…) → { volid, size }
 * @param net        net key (net0…) → { model, macaddr }
 */
public record ImportMetadata(String volume, JsonNode createArgs, JsonNode disks, JsonNode net) {

    public static final String EFI_DISK = "efidisk0";

    /** Name from the creation arguments, falling back to the .vmx basename. */
    public String vmName() {
        String name = createArgs.path("name").asText("");
        if (!name.isEmpty()) {
            return name;
        }
        String file = volume.substring(volume.lastIndexOf('/') + 1);
        return file.endsWith(".vmx") ? file.substring(0, file.length() - 4) : file;
    }

    /** Data disks in reported order, key → source volid. The EFI vars disk is excluded. */
    public Map<String, String> dataDisks() {
        Map<String, String> result = new LinkedHashMap<>();
        disks.fields().forEachRemaining(e -> {
            if (!EFI_DISK.equals(e.getKey()) && e.getValue().hasNonNull("volid")) {
                result.put(e.getKey(), e.getValue().get("volid").asText());
            }
        });
        return result;
    }

    /** Volid of the EFI vars disk, or null for BIOS guests. */
    public String efiDiskVolid() {
        JsonNode efi = disks.path(EFI_DISK);
        return efi.hasNonNull("volid") ? efi.get("volid").asText() : null;
    }

    public double dataDiskSizeGB() {
        long bytes = 0;
        for (var it = disks.fields(); it.hasNext(); ) {
            var e = it.next();
            if (!EFI_DISK.equals(e.getKey())) {
                bytes += e.getValue().path("size").asLong(0);
            }
        }
        return Math.round(bytes / (1024.0 * 1024 * 1024) * 100) / 100.0;
    }
}
