package com.hostpanel.orchestrator.hypervisor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ImportMetadataTest {

    final ObjectMapper mapper = new ObjectMapper();

    @Test
    void uefiGuest_efiDiskSeparatedFromDataDisks() throws Exception {
        ImportMetadata meta = metadata("ha-datacenter/datastore1/web01/web01.vmx", """
                {"name":"web01"}
                """, """
                {"scsi0":{"volid":"esxi-import-1:ha-datacenter/datastore1/web01/web01.vmdk","size":21474836480},
                 "scsi1":{"volid":"esxi-import-1:ha-datacenter/datastore1/web01/web01_1.vmdk","size":10737418240},
                 "efidisk0":{"volid":"esxi-import-1:ha-datacenter/datastore1/web01/web01.nvram","size":540672}}
                """);

        assertThat(meta.vmName()).isEqualTo("web01");
        assertThat(meta.dataDisks()).containsOnlyKeys("scsi0", "scsi1");
        assertThat(meta.efiDiskVolid()).endsWith("web01.nvram");
        assertThat(meta.dataDiskSizeGB()).isEqualTo(30.0);
    }

    @Test
    void noNameInCreateArgs_fallsBackToVmxBasename() throws Exception {
        ImportMetadata meta = metadata("ha-datacenter/datastore1/db01/db01.vmx", "{}", """
                {"sata0":{"volid":"esxi-import-1:ha-datacenter/datastore1/db01/db01.vmdk","size":1073741824}}
                """);

        assertThat(meta.vmName()).isEqualTo("db01");
        assertThat(meta.efiDiskVolid()).isNull();
        assertThat(meta.dataDisks()).containsEntry("sata0", "esxi-import-1:ha-datacenter/datastore1/db01/db01.vmdk");
    }

    @Test
    void versionComparison() {
        assertThat(ProxmoxClient.isAtLeast("8.2.4", 8, 2)).isTrue();
        assertThat(ProxmoxClient.isAtLeast("9.0", 8, 2)).isTrue();
        assertThat(ProxmoxClient.isAtLeast("8.1-2", 8, 2)).isFalse();
        assertThat(ProxmoxClient.isAtLeast("7.4", 8, 2)).isFalse();
        assertThat(ProxmoxClient.isAtLeast("unknown", 8, 2)).isFalse();
    }

    private ImportMetadata metadata(String volume, String createArgs, String disks) throws Exception {
        JsonNode net = mapper.readTree("{}");
        return new ImportMetadata(volume, mapper.readTree(createArgs), mapper.readTree(disks), net);
    }
}
