package com.hostpanel.orchestrator.model;

import jakarta.persistence.*;

/**
 * A source hypervisor host (ESXi) that VMs are discovered on and migrated from.
 *
 * Managed by the panel's host administration screens; this service only reads it.
 * The password is stored encrypted and decrypted through CredentialCipher on use.
 *
 * DB table: source_hosts
 */
@Entity
@Table(name = "source_hosts")
public class SourceHost {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false)
    private String host;

    // HTTPS port of the inventory API.
    @Column(nullable = false)
    private int port = 443;

    @Column(name = "ssh_port", nullable = false)
    private int sshPort = 22;

    @Column(nullable = false)
    private String username;

    @Column(name = "password_encrypted", nullable = false)
    private String passwordEncrypted;

    protected SourceHost() {}   // required by JPA

    public SourceHost(String name, String host, String username, String passwordEncrypted) {
        this.name              = name;
        this.host              = host;
        this.username          = username;
        this.passwordEncrypted = passwordEncrypted;
    }

    public Long   getId()                { return id; }
    public String getName()              { return name; }
    public String getHost()              { return host; }
    public int    getPort()              { return port; }
    public int    getSshPort()           { return sshPort; }
    public String getUsername()          { return username; }
    public String getPasswordEncrypted() { return passwordEncrypted; }
}
