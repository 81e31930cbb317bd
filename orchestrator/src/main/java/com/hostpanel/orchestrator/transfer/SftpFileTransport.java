package com.hostpanel.orchestrator.transfer;

import org.apache.commons.io.IOUtils;
import org.apache.sshd.client.ClientBuilder;
import org.apache.sshd.client.SshClient;
import org.apache.sshd.client.config.hosts.HostConfigEntryResolver;
import org.apache.sshd.client.keyverifier.AcceptAllServerKeyVerifier;
import org.apache.sshd.client.session.ClientSession;
import org.apache.sshd.sftp.client.SftpClient;
import org.apache.sshd.sftp.client.SftpClientFactory;
import org.apache.sshd.sftp.common.SftpConstants;
import org.apache.sshd.sftp.common.SftpException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.TimeUnit;

/**
 * {@link RemoteFileTransport} over SFTP (Apache MINA SSHD), password auth.
 *
 * One SSH client and session per transfer; both are closed when the
 * transfer ends, successful or not. Hypervisor hosts are addressed by IP and
 * commonly use self-generated host keys, so any server key is accepted.
 */
@Component
public class SftpFileTransport implements RemoteFileTransport {

    private static final Logger log = LoggerFactory.getLogger(SftpFileTransport.class);

    private final long timeoutSeconds;

    public SftpFileTransport(@Value("${hostpanel.transfer.ssh-timeout-seconds:30}") long timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }

    @Override
    public void download(SshEndpoint endpoint, String remotePath, Path localFile) throws IOException {
        log.info("Downloading {}:{} to {}", endpoint.host(), remotePath, localFile);
        Files.createDirectories(localFile.toAbsolutePath().getParent());
        withSftp(endpoint, sftp -> {
            try (InputStream in = sftp.read(remotePath);
                 OutputStream out = Files.newOutputStream(localFile)) {
                long bytes = IOUtils.copyLarge(in, out);
                log.info("Downloaded {} bytes from {}", bytes, endpoint.host());
            }
            return null;
        });
    }

    @Override
    public String upload(SshEndpoint endpoint, Path localFile, String remoteDir) throws IOException {
        String dir = remoteDir.endsWith("/") ? remoteDir.substring(0, remoteDir.length() - 1) : remoteDir;
        String remotePath = dir + "/" + localFile.getFileName();
        log.info("Uploading {} to {}:{}", localFile, endpoint.host(), remotePath);
        return withSftp(endpoint, sftp -> {
            mkdirs(sftp, dir);
            try (InputStream in = Files.newInputStream(localFile);
                 OutputStream out = sftp.write(remotePath)) {
                long bytes = IOUtils.copyLarge(in, out);
                log.info("Uploaded {} bytes to {}", bytes, endpoint.host());
            }
            return remotePath;
        });
    }

    // ------------------------------------------------------------------
    // Session handling
    // ------------------------------------------------------------------

    @FunctionalInterface
    private interface SftpAction<T> {
        T run(SftpClient sftp) throws IOException;
    }

    private <T> T withSftp(SshEndpoint endpoint, SftpAction<T> action) throws IOException {
        SshClient client = ClientBuilder.builder()
                .hostConfigEntryResolver(HostConfigEntryResolver.EMPTY)
                .serverKeyVerifier(AcceptAllServerKeyVerifier.INSTANCE)
                .build();
        client.start();
        try (ClientSession session = client.connect(endpoint.username(), endpoint.host(), endpoint.port())
                .verify(timeoutSeconds, TimeUnit.SECONDS)
                .getSession()) {
            session.addPasswordIdentity(endpoint.password());
            session.auth().verify(timeoutSeconds, TimeUnit.SECONDS);
            log.debug("SFTP session authenticated to {}", endpoint);
            try (SftpClient sftp = SftpClientFactory.instance().createSftpClient(session)) {
                return action.run(sftp);
            }
        } finally {
            client.stop();
        }
    }

    private static void mkdirs(SftpClient sftp, String dir) throws IOException {
        StringBuilder path = new StringBuilder();
        for (String segment : dir.split("/")) {
            if (segment.isEmpty()) {
                continue;
            }
            path.append('/').append(segment);
            try {
                sftp.stat(path.toString());
            } catch (SftpException e) {
                if (e.getStatus() != SftpConstants.SSH_FX_NO_SUCH_FILE) {
                    throw e;
                }
                sftp.mkdir(path.toString());
            }
        }
    }
}
