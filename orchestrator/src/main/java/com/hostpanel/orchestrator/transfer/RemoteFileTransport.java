package com.hostpanel.orchestrator.transfer;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Moves whole files between this machine and a remote host.
 */
public interface RemoteFileTransport {

    /** Copy {@code remotePath} to {@code localFile}, replacing it if present. */
    void download(SshEndpoint endpoint, String remotePath, Path localFile) throws IOException;

    /**
     * Copy {@code localFile} into {@code remoteDir}, creating missing directories.
     *
     * @return the remote path of the uploaded file
     */
    String upload(SshEndpoint endpoint, Path localFile, String remoteDir) throws IOException;
}
