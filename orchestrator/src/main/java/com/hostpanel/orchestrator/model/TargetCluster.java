package com.hostpanel.orchestrator.model;

import jakarta.persistence.*;

/**
 * A Proxmox cluster VMs and images are moved to.
 *
 * The API user is "username@realm"; SSH transfers log in as the bare username.
 *
 * DB table: target_clusters
 */
@Entity
@Table(name = "target_clusters")
public class TargetCluster {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false)
    private String host;

    @Column(name = "api_port", nullable = false)
    private int apiPort = 8006;

    @Column(name = "ssh_port", nullable = false)
    private int sshPort = 22;

    @Column(nullable = false)
    private String username;

    @Column(nullable = false)
    private String realm = "pam";

    @Column(name = "password_encrypted", nullable = false)
    private String passwordEncrypted;

    protected TargetCluster() {}   // required by JPA

    public TargetCluster(String name, String host, String username, String passwordEncrypted) {
        this.name              = name;
        this.host              = host;
        this.username          = username;
        this.passwordEncrypted = passwordEncrypted;
    }

    public Long   getId()                { return id; }
    public String getName()              { return name; }
    public String getHost()              { return host; }
    public int    getApiPort()           { return apiPort; }
    public int    getSshPort()           { return sshPort; }
    public String getUsername()          { return username; }
    public String getRealm()             { return realm; }
    public String getPasswordEncrypted() { return passwordEncrypted; }

    /** "root@pam" style principal for the REST API. */
    public String apiPrincipal() {
        return username.contains("@") ? username : username + "@" + realm;
    }

    /** Login name for SSH, without any realm suffix. */
    public String sshUsername() {
        int at = username.indexOf('@');
        return at < 0 ? username : username.substring(0, at);
    }
}
