package com.hostpanel.orchestrator.transfer;

import com.hostpanel.orchestrator.service.JobException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ImageConverter against small shell scripts standing in for qemu-img.
 * The scripts receive the same arguments qemu-img would; the output path is $7.
 */
@DisabledOnOs(OS.WINDOWS)
class ImageConverterTest {

    @TempDir Path dir;

    @Test
    void vmdkToQcow2_toolSucceeds_outputKeptAndLogRemoved() throws Exception {
        ImageConverter converter = new ImageConverter(script("""
                printf qcow2 > "$7"
                """).toString(), 30);
        Path output = dir.resolve("vm-101-disk-0.qcow2");

        converter.vmdkToQcow2(input(), output);

        assertThat(output).hasContent("qcow2");
        assertThat(dir.resolve("vm-101-disk-0.qcow2.log")).doesNotExist();
    }

    @Test
    void vmdkToQcow2_nonZeroExit_toolOutputQuotedAndPartialOutputDeleted() throws Exception {
        ImageConverter converter = new ImageConverter(script("""
                printf partial > "$7"
                echo "qemu-img: Could not open 'in.vmdk': invalid VMDK image descriptor"
                exit 1
                """).toString(), 30);
        Path output = dir.resolve("vm-101-disk-0.qcow2");

        assertThatThrownBy(() -> converter.vmdkToQcow2(input(), output))
                .isInstanceOf(JobException.class)
                .hasMessageContaining("exited with 1")
                .hasMessageContaining("invalid VMDK image descriptor")
                .extracting("kind").isEqualTo(JobException.Kind.CONVERSION_TOOL_FAILURE);

        assertThat(output).doesNotExist();
    }

    @Test
    void vmdkToQcow2_timeout_toolKilledAndPartialOutputDeleted() throws Exception {
        Path pidFile = dir.resolve("pid");
        ImageConverter converter = new ImageConverter(script("""
                echo $$ > "%s"
                printf partial > "$7"
                exec sleep 30
                """.formatted(pidFile)).toString(), 1);
        Path output = dir.resolve("vm-101-disk-0.qcow2");

        assertThatThrownBy(() -> converter.vmdkToQcow2(input(), output))
                .isInstanceOf(JobException.class)
                .hasMessageContaining("did not finish within 1 s");

        assertThat(isAlive(pidFile)).isFalse();
        assertThat(output).doesNotExist();
    }

    @Test
    void vmdkToQcow2_workerInterrupted_toolKilledAndInterruptKept() throws Exception {
        Path pidFile = dir.resolve("pid");
        ImageConverter converter = new ImageConverter(script("""
                echo $$ > "%s"
                printf partial > "$7"
                exec sleep 30
                """.formatted(pidFile)).toString(), 60);
        Path output = dir.resolve("vm-101-disk-0.qcow2");
        Path input = input();
        AtomicReference<Throwable> failure = new AtomicReference<>();
        AtomicReference<Boolean>   interruptKept = new AtomicReference<>();

        Thread worker = new Thread(() -> {
            try {
                converter.vmdkToQcow2(input, output);
            } catch (RuntimeException e) {
                failure.set(e);
            }
            interruptKept.set(Thread.currentThread().isInterrupted());
        });
        worker.start();
        waitForContent(pidFile);
        worker.interrupt();
        worker.join(15_000);

        assertThat(worker.isAlive()).isFalse();
        assertThat(failure.get())
                .isInstanceOf(JobException.class)
                .hasMessageContaining("Interrupted while converting");
        assertThat(interruptKept.get()).isTrue();
        assertThat(isAlive(pidFile)).isFalse();
        assertThat(output).doesNotExist();
    }

    @Test
    void vmdkToQcow2_toolMissing_conversionToolFailure() throws Exception {
        ImageConverter converter = new ImageConverter(dir.resolve("no-such-tool").toString(), 30);

        assertThatThrownBy(() -> converter.vmdkToQcow2(input(), dir.resolve("out.qcow2")))
                .isInstanceOf(JobException.class)
                .hasMessageContaining("Cannot run")
                .extracting("kind").isEqualTo(JobException.Kind.CONVERSION_TOOL_FAILURE);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Path script(String body) throws IOException {
        Path script = dir.resolve("fake-qemu-img");
        Files.writeString(script, "#!/bin/sh\n" + body, StandardCharsets.UTF_8);
        Files.setPosixFilePermissions(script, PosixFilePermissions.fromString("rwxr-xr-x"));
        return script;
    }

    private Path input() throws IOException {
        Path input = dir.resolve("in.vmdk");
        if (!Files.exists(input)) {
            Files.writeString(input, "vmdk");
        }
        return input;
    }

    private static void waitForContent(Path file) throws Exception {
        long deadline = System.currentTimeMillis() + 10_000;
        while (System.currentTimeMillis() < deadline) {
            if (Files.exists(file) && !Files.readString(file).isBlank()) {
                return;
            }
            Thread.sleep(20);
        }
        throw new AssertionError(file + " was never written");
    }

    private static boolean isAlive(Path pidFile) throws IOException {
        long pid = Long.parseLong(Files.readString(pidFile).trim());
        return ProcessHandle.of(pid).map(ProcessHandle::isAlive).orElse(false);
    }
}
