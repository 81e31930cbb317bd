package com.hostpanel.orchestrator.transfer;

import com.hostpanel.orchestrator.hypervisor.CredentialCipher;
import com.hostpanel.orchestrator.model.SourceHost;
import com.hostpanel.orchestrator.model.TargetCluster;
import com.hostpanel.orchestrator.service.JobException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;

/**
 * Moves disk images between hypervisors through this machine.
 *
 * Steps of {@link #convert}:
 *   1. SFTP-download the source disk into {@code <destinationDir>/temp/<basename>-<uuid8>}
 *   2. Convert it to {@code <destinationDir>/<outputName>.qcow2} with qemu-img
 *   3. Delete the staged download and, if it is now empty, the temp directory
 *
 * A failed step deletes any partial output before raising. Cleanup of the
 * staged download is best-effort and never turns a good conversion into a failure.
 *
 * {@link #upload} leaves the local artifact in place, so a failed upload can be
 * retried without converting again. Callers {@link #discard} it once it is no
 * longer needed.
 */
@Service
public class DiskConversionService {

    private static final Logger log = LoggerFactory.getLogger(DiskConversionService.class);

    static final String STAGING_DIR = "temp";

    private final RemoteFileTransport transport;
    private final ImageConverter      converter;
    private final CredentialCipher    cipher;

    public DiskConversionService(RemoteFileTransport transport,
                                 ImageConverter converter,
                                 CredentialCipher cipher) {
        this.transport = transport;
        this.converter = converter;
        this.cipher    = cipher;
    }

    // ------------------------------------------------------------------
    // Source side
    // ------------------------------------------------------------------

    /**
     * Fetch one disk from a source host and convert it to qcow2.
     *
     * @param diskSourcePath datastore path ("[datastore1] web01/web01.vmdk") or absolute path
     * @return path of the converted image
     * @throws JobException TARGET_FAILURE if the download fails,
     *                      CONVERSION_TOOL_FAILURE if the converter fails or times out
     */
    public Path convert(SourceHost source, String diskSourcePath, Path destinationDir, String outputName) {
        return convert(source, diskSourcePath, destinationDir, outputName, () -> {});
    }

    /**
     * As {@link #convert(SourceHost, String, Path, String)}, calling
     * {@code onDownloaded} between the download and the conversion.
     */
    public Path convert(SourceHost source, String diskSourcePath, Path destinationDir, String outputName,
                        Runnable onDownloaded) {
        String remotePath = toRemotePath(diskSourcePath);
        Path stagingDir = destinationDir.resolve(STAGING_DIR);
        Path staged = stagingDir.resolve(basename(remotePath) + "-" + UUID.randomUUID().toString().substring(0, 8));
        Path output = destinationDir.resolve(outputName + ".qcow2");

        try {
            transport.download(sourceEndpoint(source), remotePath, staged);
        } catch (IOException | RuntimeException e) {
            deleteQuietly(staged);
            removeIfEmpty(stagingDir);
            throw new JobException(JobException.Kind.TARGET_FAILURE,
                    "Download of " + remotePath + " from " + source.getHost() + " failed: " + e.getMessage(), e);
        }

        try {
            onDownloaded.run();
            converter.vmdkToQcow2(staged, output);
            return output;
        } catch (RuntimeException e) {
            deleteQuietly(output);
            throw e;
        } finally {
            deleteQuietly(staged);
            removeIfEmpty(stagingDir);
        }
    }

    // ------------------------------------------------------------------
    // Target side
    // ------------------------------------------------------------------

    /**
     * Copy a local file into a directory on a target cluster node.
     * The local file is kept whatever the outcome.
     *
     * @return remote path of the uploaded file
     * @throws JobException TARGET_FAILURE if the upload fails
     */
    public String upload(Path localPath, TargetCluster cluster, String targetStorageDir) {
        try {
            return transport.upload(targetEndpoint(cluster), localPath, targetStorageDir);
        } catch (IOException | RuntimeException e) {
            throw new JobException(JobException.Kind.TARGET_FAILURE,
                    "Upload of " + localPath.getFileName() + " to " + cluster.getName() + " failed: " + e.getMessage(), e);
        }
    }

    /**
     * Copy a file from a target cluster node into {@code localDir}.
     *
     * @return local path of the downloaded file
     * @throws JobException TARGET_FAILURE if the download fails
     */
    public Path download(TargetCluster cluster, String remotePath, Path localDir) {
        Path local = localDir.resolve(basename(remotePath));
        try {
            transport.download(targetEndpoint(cluster), remotePath, local);
            return local;
        } catch (IOException | RuntimeException e) {
            deleteQuietly(local);
            throw new JobException(JobException.Kind.TARGET_FAILURE,
                    "Download of " + remotePath + " from " + cluster.getName() + " failed: " + e.getMessage(), e);
        }
    }

    /** Delete a local artifact that is no longer needed. */
    public void discard(Path localPath) {
        deleteQuietly(localPath);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /** "[datastore1] dir/disk.vmdk" → "/vmfs/volumes/datastore1/dir/disk.vmdk". */
    static String toRemotePath(String diskSourcePath) {
        String path = diskSourcePath.trim();
        if (path.startsWith("[")) {
            int close = path.indexOf(']');
            if (close > 0) {
                String datastore = path.substring(1, close);
                String rest = path.substring(close + 1).trim();
                return "/vmfs/volumes/" + datastore + "/" + rest;
            }
        }
        return path;
    }

    private static String basename(String path) {
        return path.substring(path.lastIndexOf('/') + 1);
    }

    private SshEndpoint sourceEndpoint(SourceHost host) {
        return new SshEndpoint(host.getHost(), host.getSshPort(), host.getUsername(),
                cipher.decrypt(host.getPasswordEncrypted()));
    }

    private SshEndpoint targetEndpoint(TargetCluster cluster) {
        return new SshEndpoint(cluster.getHost(), cluster.getSshPort(), cluster.sshUsername(),
                cipher.decrypt(cluster.getPasswordEncrypted()));
    }

    private static void deleteQuietly(Path file) {
        try {
            if (Files.deleteIfExists(file)) {
                log.debug("Deleted {}", file);
            }
        } catch (IOException e) {
            log.warn("Could not delete {}: {}", file, e.getMessage());
        }
    }

    private static void removeIfEmpty(Path dir) {
        try {
            Files.deleteIfExists(dir);
        } catch (DirectoryNotEmptyException e) {
            log.debug("Staging directory {} still in use", dir);
        } catch (IOException e) {
            log.warn("Could not remove staging directory {}: {}", dir, e.getMessage());
        }
    }
}
