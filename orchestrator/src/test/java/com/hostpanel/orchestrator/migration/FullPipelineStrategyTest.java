package com.hostpanel.orchestrator.migration;

import com.hostpanel.orchestrator.discovery.InventoryDiscoveryService;
import com.hostpanel.orchestrator.hypervisor.ProxmoxClient;
import com.hostpanel.orchestrator.model.*;
import com.hostpanel.orchestrator.repository.ImportedVmRepository;
import com.hostpanel.orchestrator.repository.SourceHostRepository;
import com.hostpanel.orchestrator.repository.TargetClusterRepository;
import com.hostpanel.orchestrator.service.JobException;
import com.hostpanel.orchestrator.service.PipelineRun;
import com.hostpanel.orchestrator.service.TargetContext;
import com.hostpanel.orchestrator.service.TargetOutcome;
import com.hostpanel.orchestrator.transfer.DiskConversionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
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
 * Full pipeline with discovery, transfer and the Proxmox API mocked.
 */
@ExtendWith(MockitoExtension.class)
class FullPipelineStrategyTest {

    @Mock InventoryDiscoveryService discovery;
    @Mock DiskConversionService     transfer;
    @Mock ProxmoxClient             proxmox;
    @Mock VmidAllocator             vmids;
    @Mock SourceHostRepository      sourceHosts;
    @Mock TargetClusterRepository   clusters;
    @Mock ImportedVmRepository      importedVms;

    @TempDir Path scratch;

    final SourceHost    source  = withId(new SourceHost("esxi01", "10.0.0.10", "root", "enc"), 1L);
    final TargetCluster cluster = withId(new TargetCluster("pve-a", "10.0.1.10", "root", "enc"), 2L);
    final MigrationParameters params = new MigrationParameters(1L, 2L, "pve1", "local", "vmbr0",
            ImportStrategy.FULL_PIPELINE, false);

    final DiscoveredVm web01 = new DiscoveredVm("web01", "[ds1] web01/web01.vmx", "poweredOff", 2, 4096,
            "Microsoft Windows Server 2019 (64-bit)",
            List.of(new DiskInfo("Hard disk 1", 40, "[ds1] web01/web01.vmdk", "flat"),
                    new DiskInfo("Hard disk 2", 10, "[ds1] web01/web01_1.vmdk", "flat")),
            List.of(new NetworkAdapter("Network adapter 1", "00:50:56:aa:bb:cc", "10.0.0.5", "VM Network")),
            Map.of());

    final List<String> stages = new ArrayList<>();

    Job                  job;
    FullPipelineStrategy strategy;

    @BeforeEach
    void setUp() {
        lenient().when(sourceHosts.findById(1L)).thenReturn(Optional.of(source));
        lenient().when(clusters.findById(2L)).thenReturn(Optional.of(cluster));
        job = Job.pending(JobKind.MIGRATION, List.of("web01"), params.toMap());
        strategy = new FullPipelineStrategy(discovery, transfer, proxmox, vmids, sourceHosts, clusters,
                importedVms, scratch.toString(), "/var/lib/vz/images", 60);
    }

    // ------------------------------------------------------------------
    // open()
    // ------------------------------------------------------------------

    @Test
    void open_noStoredSnapshot_runsDiscoveryFirst() {
        when(discovery.getSnapshot(1L)).thenReturn(List.of());
        when(discovery.discover(1L)).thenReturn(List.of(web01));

        strategy.open(job, params);

        verify(discovery).discover(1L);
    }

    @Test
    void open_sourceUnreachable_setupFails() {
        when(discovery.getSnapshot(1L)).thenReturn(List.of());
        when(discovery.discover(1L)).thenThrow(
                new JobException(JobException.Kind.SOURCE_UNREACHABLE, "Cannot retrieve inventory"));

        assertThatThrownBy(() -> strategy.open(job, params))
                .isInstanceOf(JobException.class)
                .extracting("kind").isEqualTo(JobException.Kind.SOURCE_UNREACHABLE);
    }

    // ------------------------------------------------------------------
    // processTarget()
    // ------------------------------------------------------------------

    @Test
    void processTarget_convertsUploadsCreatesAndRecords() throws Exception {
        when(discovery.getSnapshot(1L)).thenReturn(List.of(web01));
        when(vmids.allocate(cluster)).thenReturn(101);
        Path workDir = scratch.resolve(job.id());
        Path disk0 = workDir.resolve("vm-101-disk-0.qcow2");
        Path disk1 = workDir.resolve("vm-101-disk-1.qcow2");
        when(transfer.convert(eq(source), eq("[ds1] web01/web01.vmdk"), eq(workDir), eq("vm-101-disk-0"), any()))
                .thenReturn(disk0);
        when(transfer.convert(eq(source), eq("[ds1] web01/web01_1.vmdk"), eq(workDir), eq("vm-101-disk-1"), any()))
                .thenReturn(disk1);
        when(proxmox.createVm(eq(cluster), eq("pve1"), any())).thenReturn("UPID:pve1:42");

        PipelineRun run = strategy.open(job, params);
        TargetOutcome outcome = run.processTarget(target("web01"));

        verify(transfer).upload(disk0, cluster, "/var/lib/vz/images/101");
        verify(transfer).upload(disk1, cluster, "/var/lib/vz/images/101");

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, String>> config = ArgumentCaptor.forClass(Map.class);
        verify(proxmox).createVm(eq(cluster), eq("pve1"), config.capture());
        assertThat(config.getValue())
                .containsEntry("vmid", "101")
                .containsEntry("cores", "2")
                .containsEntry("memory", "4096")
                .containsEntry("ostype", "win10")
                .containsEntry("scsi0", "local:101/vm-101-disk-0.qcow2")
                .containsEntry("scsi1", "local:101/vm-101-disk-1.qcow2")
                .containsEntry("net0", "virtio,bridge=vmbr0,macaddr=00:50:56:aa:bb:cc");
        verify(proxmox).waitForTask(eq(cluster), eq("pve1"), eq("UPID:pve1:42"), any());
        verify(proxmox, never()).startVm(any(), any(), anyInt());
        verify(importedVms).save(any(ImportedVm.class));
        verify(transfer).discard(disk0);
        verify(transfer).discard(disk1);

        assertThat(outcome.producedResourceId()).isEqualTo("101");
        assertThat(stages).containsExactly("DISCOVERING", "DOWNLOADING", "DOWNLOADING",
                "UPLOADING", "UPLOADING", "CREATING", "COMPLETED");
    }

    @Test
    void processTarget_vmNotInInventory_failsBeforeAllocatingVmid() {
        when(discovery.getSnapshot(1L)).thenReturn(List.of(web01));

        PipelineRun run = strategy.open(job, params);

        assertThatThrownBy(() -> run.processTarget(target("db01")))
                .isInstanceOf(JobException.class)
                .hasMessageContaining("not found");
        verifyNoInteractions(vmids, transfer);
    }

    @Test
    void processTarget_uploadFails_noVmCreatedAndImagesKept() {
        when(discovery.getSnapshot(1L)).thenReturn(List.of(web01));
        when(vmids.allocate(cluster)).thenReturn(101);
        when(transfer.convert(any(), anyString(), any(), anyString(), any())).thenReturn(scratch.resolve("img.qcow2"));
        when(transfer.upload(any(), eq(cluster), anyString()))
                .thenThrow(new JobException(JobException.Kind.TARGET_FAILURE, "Upload failed"));

        PipelineRun run = strategy.open(job, params);

        assertThatThrownBy(() -> run.processTarget(target("web01"))).hasMessageContaining("Upload failed");
        verify(proxmox, never()).createVm(any(), any(), any());
        verify(transfer, never()).discard(any());
        verify(importedVms, never()).save(any());
        verify(vmids).release(cluster, 101);
    }

    private TargetContext target(String name) {
        return new TargetContext(job.id(), 0, name, (stage, message) -> stages.add(stage));
    }
}
