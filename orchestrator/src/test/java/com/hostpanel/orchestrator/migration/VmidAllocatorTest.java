package com.hostpanel.orchestrator.migration;

import com.hostpanel.orchestrator.hypervisor.ProxmoxClient;
import com.hostpanel.orchestrator.model.TargetCluster;
import com.hostpanel.orchestrator.repository.ImportedVmRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static com.hostpanel.orchestrator.TestEntities.withId;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class VmidAllocatorTest {

    @Mock ProxmoxClient        proxmox;
    @Mock ImportedVmRepository importedVms;

    final TargetCluster cluster = withId(new TargetCluster("pve-a", "10.0.1.10", "root", "enc"), 7L);

    @Test
    void allocate_skipsIdsAlreadyInRegistry() {
        when(proxmox.nextVmid(cluster)).thenReturn(100);
        when(importedVms.existsByClusterIdAndVmid(eq(7L), anyInt()))
                .thenAnswer(inv -> inv.<Integer>getArgument(1) < 102);

        assertThat(new VmidAllocator(proxmox, importedVms).allocate(cluster)).isEqualTo(102);
    }

    @Test
    void allocate_sameSuggestionTwice_neverHandsOutTheSameId() {
        when(proxmox.nextVmid(cluster)).thenReturn(100);
        when(importedVms.existsByClusterIdAndVmid(eq(7L), anyInt())).thenReturn(false);
        VmidAllocator allocator = new VmidAllocator(proxmox, importedVms);

        int first  = allocator.allocate(cluster);
        int second = allocator.allocate(cluster);

        assertThat(first).isEqualTo(100);
        assertThat(second).isEqualTo(101);
    }

    @Test
    void release_idCanBeHandedOutAgainAndReservationsDoNotAccumulate() {
        when(proxmox.nextVmid(cluster)).thenReturn(100);
        when(importedVms.existsByClusterIdAndVmid(eq(7L), anyInt())).thenReturn(false);
        VmidAllocator allocator = new VmidAllocator(proxmox, importedVms);

        int first = allocator.allocate(cluster);
        allocator.release(cluster, first);
        int second = allocator.allocate(cluster);
        allocator.release(cluster, second);

        assertThat(second).isEqualTo(first);
        assertThat(allocator.reservedCount(cluster)).isZero();
    }

    @Test
    void allocate_remoteSuggestionFetchedOutsideTheReservationLock() throws Exception {
        CountDownLatch slowCallStarted = new CountDownLatch(1);
        CountDownLatch releaseSlowCall = new CountDownLatch(1);
        TargetCluster other = withId(new TargetCluster("pve-b", "10.0.2.10", "root", "enc"), 8L);
        when(proxmox.nextVmid(other)).thenAnswer(inv -> {
            slowCallStarted.countDown();
            releaseSlowCall.await(30, TimeUnit.SECONDS);
            return 200;
        });
        when(proxmox.nextVmid(cluster)).thenReturn(100);
        when(importedVms.existsByClusterIdAndVmid(anyLong(), anyInt())).thenReturn(false);
        VmidAllocator allocator = new VmidAllocator(proxmox, importedVms);

        CompletableFuture<Integer> slow = CompletableFuture.supplyAsync(() -> allocator.allocate(other));
        assertThat(slowCallStarted.await(5, TimeUnit.SECONDS)).isTrue();

        CompletableFuture<Integer> fast = CompletableFuture.supplyAsync(() -> allocator.allocate(cluster));
        assertThat(fast.get(2, TimeUnit.SECONDS)).isEqualTo(100);

        releaseSlowCall.countDown();
        assertThat(slow.get(5, TimeUnit.SECONDS)).isEqualTo(200);
    }
}
