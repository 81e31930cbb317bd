package com.hostpanel.orchestrator.migration;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hostpanel.orchestrator.hypervisor.CredentialCipher;
import com.hostpanel.orchestrator.hypervisor.HypervisorException;
import com.hostpanel.orchestrator.hypervisor.ImportMetadata;
import com.hostpanel.orchestrator.hypervisor.ProxmoxClient;
import com.hostpanel.orchestrator.model.*;
import com.hostpanel.orchestrator.repository.ImportedVmRepository;
import com.hostpanel.orchestrator.repository.SourceHostRepository;
import com.hostpanel.orchestrator.repository.TargetClusterRepository;
import com.hostpanel.orchestrator.service.JobException;
import com.hostpanel.orchestrator.service.PipelineRun;
import com.hostpanel.orchestrator.service.TargetContext;
import com.hostpanel.orchestrator.service.TargetOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.hostpanel.orchestrator.TestEntities.withId;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Native import against a mocked Proxmox API.
 */
@ExtendWith(MockitoExtension.class)
class NativeImportStrategyTest {

    @Mock ProxmoxClient           proxmox;
    @Mock VmidAllocator           vmids;
    @Mock CredentialCipher        cipher;
    @Mock SourceHostRepository    sourceHosts;
    @Mock TargetClusterRepository clusters;
    @Mock ImportedVmRepository    importedVms;

    final ObjectMapper  json    = new ObjectMapper();
    final SourceHost    source  = withId(new SourceHost("esxi01", "10.0.0.10", "root", "enc-src"), 1L);
    final TargetCluster cluster = withId(new TargetCluster("pve-a", "10.0.1.10", "root", "enc-dst"), 2L);
    final MigrationParameters params = new MigrationParameters(1L, 2L, "pve1", "local-lvm", "vmbr0",
            ImportStrategy.NATIVE_IMPORT, true);

    final List<String> stages = new ArrayList<>();

    Job                  job;
    NativeImportStrategy strategy;

    @BeforeEach
    void setUp() {
        lenient().when(sourceHosts.findById(1L)).thenReturn(Optional.of(source));
        lenient().when(clusters.findById(2L)).thenReturn(Optional.of(cluster));
        lenient().when(cipher.decrypt("enc-src")).thenReturn("esxi-pass");
        job = Job.pending(JobKind.MIGRATION, List.of("web01"), params.toMap());
        strategy = new NativeImportStrategy(proxmox, vmids, cipher, sourceHosts, clusters, importedVms, 60);
    }

    // ------------------------------------------------------------------
    // Capability check
    // ------------------------------------------------------------------

    @Test
    void open_clusterWithoutNativeImport_everyTargetFailsWithoutFallback() throws Exception {
        when(proxmox.supportsNativeEsxiImport(cluster)).thenReturn(false);

        PipelineRun run = strategy.open(job, params);

        assertThatThrownBy(() -> run.processTarget(target("web01")))
                .isInstanceOf(JobException.class)
                .hasMessageContaining("does not support native ESXi import")
                .extracting("kind").isEqualTo(JobException.Kind.TARGET_FAILURE);
        verify(proxmox, never()).addEsxiStorage(any(), any(), any(), any(), any());
        verify(proxmox, never()).createVm(any(), any(), any());
    }

    // ------------------------------------------------------------------
    // Import
    // ------------------------------------------------------------------

    @Test
    void processTarget_buildsImportFromConfigAndRecordsVm() throws Exception {
        String storage = "esxi-import-" + job.id().substring(0, 8);
        stubCatalogue(storage);
        when(vmids.allocate(cluster)).thenReturn(105);
        when(proxmox.createVm(eq(cluster), eq("pve1"), any())).thenReturn("UPID:pve1:0001");

        PipelineRun run = strategy.open(job, params);
        TargetOutcome outcome = run.processTarget(target("web01"));

        verify(proxmox).addEsxiStorage(cluster, storage, "10.0.0.10", "root", "esxi-pass");
        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, String>> config = ArgumentCaptor.forClass(Map.class);
        verify(proxmox).createVm(eq(cluster), eq("pve1"), config.capture());
        assertThat(config.getValue())
                .containsEntry("vmid", "105")
                .containsEntry("name", "web01")
                .containsEntry("ostype", "l26")
                .containsEntry("cores", "2")
                .containsEntry("sockets", "2")
                .containsEntry("memory", "4096")
                .containsEntry("bios", "ovmf")
                .containsEntry("scsi0", "local-lvm:0,import-from=" + storage + ":ha-datacenter/ds1/web01/web01.vmdk")
                .containsEntry("scsi1", "local-lvm:0,import-from=" + storage + ":ha-datacenter/ds1/web01/web01_1.vmdk")
                .containsEntry("efidisk0", "local-lvm:0,efitype=4m,pre-enrolled-keys=1,import-from="
                        + storage + ":ha-datacenter/ds1/web01/web01.nvram")
                .containsEntry("net0", "vmxnet3,bridge=vmbr0,macaddr=00:50:56:aa:bb:cc");
        verify(proxmox).waitForTask(eq(cluster), eq("pve1"), eq("UPID:pve1:0001"), any());
        verify(proxmox).startVm(cluster, "pve1", 105);

        ArgumentCaptor<ImportedVm> saved = ArgumentCaptor.forClass(ImportedVm.class);
        verify(importedVms).save(saved.capture());
        assertThat(saved.getValue().getVmid()).isEqualTo(105);
        assertThat(saved.getValue().getCpuCores()).isEqualTo(4);
        assertThat(saved.getValue().getStorageGB()).isEqualTo(30.0);

        assertThat(outcome.producedResourceId()).isEqualTo("105");
        assertThat(stages).containsExactly("DISCOVERING", "CREATING", "COMPLETED");
    }

    @Test
    void processTarget_vmNotOnImportStorage_targetFailure() throws Exception {
        stubCatalogue("esxi-import-" + job.id().substring(0, 8));

        PipelineRun run = strategy.open(job, params);

        assertThatThrownBy(() -> run.processTarget(target("ghost")))
                .isInstanceOf(JobException.class)
                .extracting("kind").isEqualTo(JobException.Kind.TARGET_FAILURE);
        verifyNoInteractions(vmids);
    }

    @Test
    void processTarget_importTaskFails_errorPropagatesAndNothingRecorded() throws Exception {
        stubCatalogue("esxi-import-" + job.id().substring(0, 8));
        when(vmids.allocate(cluster)).thenReturn(105);
        when(proxmox.createVm(any(), any(), any())).thenReturn("UPID:x");
        when(proxmox.waitForTask(any(), any(), any(), any())).thenThrow(new HypervisorException("Task UPID:x failed: disk full"));

        PipelineRun run = strategy.open(job, params);

        assertThatThrownBy(() -> run.processTarget(target("web01"))).hasMessageContaining("disk full");
        verify(importedVms, never()).save(any());
    }

    // ------------------------------------------------------------------
    // Storage lifecycle
    // ------------------------------------------------------------------

    @Test
    void close_removesTransientStorage_andToleratesFailure() throws Exception {
        String storage = "esxi-import-" + job.id().substring(0, 8);
        stubCatalogue(storage);
        doThrow(new HypervisorException("HTTP 500")).when(proxmox).removeStorage(cluster, storage);

        PipelineRun run = strategy.open(job, params);
        run.close();

        verify(proxmox).removeStorage(cluster, storage);
    }

    @Test
    void open_catalogueUnreadable_storageRemovedAndSetupFails() {
        String storage = "esxi-import-" + job.id().substring(0, 8);
        when(proxmox.supportsNativeEsxiImport(cluster)).thenReturn(true);
        when(proxmox.listVmxVolumes(cluster, "pve1", storage)).thenThrow(new HypervisorException("HTTP 500"));

        assertThatThrownBy(() -> strategy.open(job, params)).isInstanceOf(HypervisorException.class);
        verify(proxmox).removeStorage(cluster, storage);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private TargetContext target(String name) {
        return new TargetContext(job.id(), 0, name, (stage, message) -> stages.add(stage));
    }

    private void stubCatalogue(String storage) throws Exception {
        when(proxmox.supportsNativeEsxiImport(cluster)).thenReturn(true);
        String volume = "ha-datacenter/ds1/web01/web01.vmx";
        when(proxmox.listVmxVolumes(cluster, "pve1", storage)).thenReturn(List.of(storage + ":" + volume));
        String prefix = storage + ":ha-datacenter/ds1/web01/";
        ImportMetadata metadata = new ImportMetadata(volume,
                json.readTree("""
                        {"name":"web01","ostype":"l26","cores":2,"sockets":2,"memory":4096,"bios":"ovmf"}
                        """),
                json.readTree("""
                        {"scsi0":{"volid":"%sweb01.vmdk","size":21474836480},
                         "scsi1":{"volid":"%sweb01_1.vmdk","size":10737418240},
                         "efidisk0":{"volid":"%sweb01.nvram","size":131072}}
                        """.formatted(prefix, prefix, prefix)),
                json.readTree("""
                        {"net0":{"model":"vmxnet3","macaddr":"00:50:56:aa:bb:cc"}}
                        """));
        lenient().when(proxmox.importMetadata(cluster, "pve1", storage, volume)).thenReturn(metadata);
    }
}
