package com.hostpanel.orchestrator.transfer;

import com.hostpanel.orchestrator.service.JobException;
import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs {@code qemu-img convert -f vmdk -O qcow2} as an external process.
 *
 * Tool output goes to a side file next to the output image so a long
 * conversion never blocks on a full pipe; its tail is quoted in the error
 * when the tool fails.
 */
@Component
public class ImageConverter {

    private static final Logger log = LoggerFactory.getLogger(ImageConverter.class);

    private static final int  ERROR_TAIL_CHARS   = 500;
    private static final long KILL_GRACE_SECONDS = 10;

    private final String qemuImg;
    private final long   timeoutSeconds;

    public ImageConverter(@Value("${hostpanel.transfer.qemu-img:qemu-img}") String qemuImg,
                          @Value("${hostpanel.transfer.convert-timeout-seconds:7200}") long timeoutSeconds) {
        this.qemuImg        = qemuImg;
        this.timeoutSeconds = timeoutSeconds;
    }

    /**
     * Convert a VMDK image into a new qcow2 file.
     *
     * On any failure the tool is no longer running and the partial output
     * has been deleted when this method returns.
     *
     * @throws JobException CONVERSION_TOOL_FAILURE on a non-zero exit, a timeout,
     *                      an interrupt or when the tool cannot be started
     */
    public void vmdkToQcow2(Path input, Path output) {
        List<String> command = List.of(qemuImg, "convert", "-f", "vmdk", "-O", "qcow2",
                input.toString(), output.toString());
        Path toolLog = output.resolveSibling(output.getFileName() + ".log");
        log.info("Converting {} -> {}", input.getFileName(), output.getFileName());
        long started = System.currentTimeMillis();
        Process process = null;
        boolean converted = false;
        try {
            process = new ProcessBuilder(command)
                    .redirectErrorStream(true)
                    .redirectOutput(toolLog.toFile())
                    .start();
            if (!process.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
                kill(process);
                throw new JobException(JobException.Kind.CONVERSION_TOOL_FAILURE,
                        "qemu-img did not finish within " + timeoutSeconds + " s for " + input.getFileName());
            }
            int exit = process.exitValue();
            if (exit != 0) {
                throw new JobException(JobException.Kind.CONVERSION_TOOL_FAILURE,
                        "qemu-img exited with " + exit + ": " + tail(toolLog));
            }
            converted = true;
            log.info("Converted {} in {} s", input.getFileName(), (System.currentTimeMillis() - started) / 1000);
        } catch (IOException e) {
            throw new JobException(JobException.Kind.CONVERSION_TOOL_FAILURE,
                    "Cannot run " + qemuImg + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            kill(process);
            Thread.currentThread().interrupt();
            throw new JobException(JobException.Kind.CONVERSION_TOOL_FAILURE,
                    "Interrupted while converting " + input.getFileName(), e);
        } finally {
            if (!converted) {
                deleteQuietly(output);
            }
            deleteQuietly(toolLog);
        }
    }

    /** Kill the tool and wait for it to exit; the caller's interrupt status is left as it was. */
    private static void kill(Process process) {
        if (process == null) {
            return;
        }
        process.destroyForcibly();
        boolean interrupted = Thread.interrupted();
        try {
            if (!process.waitFor(KILL_GRACE_SECONDS, TimeUnit.SECONDS)) {
                log.warn("qemu-img (pid {}) did not exit after being killed", process.pid());
            }
        } catch (InterruptedException e) {
            interrupted = true;
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Could not delete {}: {}", file, e.getMessage());
        }
    }

    private static String tail(Path file) {
        try {
            String text = FileUtils.readFileToString(file.toFile(), StandardCharsets.UTF_8).trim();
            return text.length() <= ERROR_TAIL_CHARS ? text : text.substring(text.length() - ERROR_TAIL_CHARS);
        } catch (IOException e) {
            return "(no output)";
        }
    }
}
