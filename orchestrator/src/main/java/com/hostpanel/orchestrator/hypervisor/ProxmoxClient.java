package com.hostpanel.orchestrator.hypervisor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hostpanel.orchestrator.model.TargetCluster;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * HTTP client for the Proxmox VE REST API (/api2/json).
 *
 * Authentication uses tickets: POST /access/ticket returns a ticket (sent as
 * the PVEAuthCookie cookie) and a CSRF token (sent on every write). Tickets
 * are valid for two hours; they are cached per cluster and renewed a little
 * before expiry.
 *
 * Every Proxmox response wraps its payload in {"data": ...}; the methods
 * here return the unwrapped payload.
 */
@Component
public class ProxmoxClient {

    private static final Logger log = LoggerFactory.getLogger(ProxmoxClient.class);

    private static final Duration TICKET_LIFETIME = Duration.ofMinutes(110);
    private static final Duration TASK_POLL       = Duration.ofSeconds(3);

    private final HttpClient       http;
    private final ObjectMapper     json;
    private final CredentialCipher cipher;

    private final Map<Long, Ticket> tickets = new ConcurrentHashMap<>();

    private record Ticket(String ticket, String csrfToken, Instant expiresAt) {
        boolean isValid() {
            return Instant.now().isBefore(expiresAt);
        }
    }

    @Autowired
    public ProxmoxClient(ObjectMapper objectMapper, CredentialCipher cipher) {
        this(objectMapper, cipher, HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(15))
                .build());
    }

    ProxmoxClient(ObjectMapper objectMapper, CredentialCipher cipher, HttpClient http) {
        this.json   = objectMapper;
        this.cipher = cipher;
        this.http   = http;
    }

    // ------------------------------------------------------------------
    // Cluster information
    // ------------------------------------------------------------------

    /** Release string, e.g. "8.2.4". */
    public String version(TargetCluster cluster) {
        return get(cluster, "/version").path("version").asText();
    }

    /** Native ESXi import storage ("esxi" type) exists from Proxmox VE 8.2 on. */
    public boolean supportsNativeEsxiImport(TargetCluster cluster) {
        return isAtLeast(version(cluster), 8, 2);
    }

    /** The cluster's suggestion for the next free VMID. */
    public int nextVmid(TargetCluster cluster) {
        JsonNode data = get(cluster, "/cluster/nextid");
        return data.isNumber() ? data.asInt() : Integer.parseInt(data.asText());
    }

    // ------------------------------------------------------------------
    // VM lifecycle
    // ------------------------------------------------------------------

    /**
     * Create a QEMU VM. Disk imports requested in {@code config} run inside
     * the returned task.
     *
     * @return UPID of the creation task
     */
    public String createVm(TargetCluster cluster, String node, Map<String, String> config) {
        log.info("Creating VM {} on {}/{}", config.get("vmid"), cluster.getName(), node);
        return post(cluster, "/nodes/" + node + "/qemu", config).asText();
    }

    /** @return UPID of the start task */
    public String startVm(TargetCluster cluster, String node, int vmid) {
        log.info("Starting VM {} on {}/{}", vmid, cluster.getName(), node);
        return post(cluster, "/nodes/" + node + "/qemu/" + vmid + "/status/start", Map.of()).asText();
    }

    public ProxmoxTaskStatus taskStatus(TargetCluster cluster, String node, String upid) {
        JsonNode data = get(cluster, "/nodes/" + node + "/tasks/" + encode(upid) + "/status");
        String exit = data.hasNonNull("exitstatus") ? data.get("exitstatus").asText() : null;
        return new ProxmoxTaskStatus(upid, data.path("status").asText(), exit);
    }

    /**
     * Poll a task until it stops.
     *
     * @throws HypervisorException if the task ends with anything but "OK" or outlives {@code timeout}
     */
    public ProxmoxTaskStatus waitForTask(TargetCluster cluster, String node, String upid, Duration timeout) {
        Instant deadline = Instant.now().plus(timeout);
        while (true) {
            ProxmoxTaskStatus status = taskStatus(cluster, node, upid);
            if (!status.isRunning()) {
                if (!status.isSuccessful()) {
                    throw new HypervisorException("Task " + upid + " failed: " + status.exitStatus());
                }
                return status;
            }
            if (Instant.now().isAfter(deadline)) {
                throw new HypervisorException("Task " + upid + " still running after " + timeout.toMinutes() + " min");
            }
            try {
                Thread.sleep(TASK_POLL.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new HypervisorException("Interrupted while waiting for task " + upid, e);
            }
        }
    }

    // ------------------------------------------------------------------
    // ESXi import storage
    // ------------------------------------------------------------------

    /** Register an ESXi host as cluster-wide import storage. */
    public void addEsxiStorage(TargetCluster cluster, String storageName,
                               String server, String username, String password) {
        log.info("Adding ESXi import storage '{}' ({}) on {}", storageName, server, cluster.getName());
        Map<String, String> form = new LinkedHashMap<>();
        form.put("storage",  storageName);
        form.put("type",     "esxi");
        form.put("server",   server);
        form.put("username", username);
        form.put("password", password);
        form.put("content",  "import");
        form.put("skip-cert-verification", "1");
        post(cluster, "/storage", form);
    }

    public void removeStorage(TargetCluster cluster, String storageName) {
        log.info("Removing storage '{}' from {}", storageName, cluster.getName());
        send(cluster, "DELETE", "/storage/" + encode(storageName), null);
    }

    /** Volids of the .vmx files visible through an import storage. */
    public List<String> listVmxVolumes(TargetCluster cluster, String node, String storageName) {
        List<String> volids = new ArrayList<>();
        get(cluster, "/nodes/" + node + "/storage/" + encode(storageName) + "/content").forEach(item -> {
            if ("vmx".equals(item.path("format").asText())) {
                volids.add(item.path("volid").asText());
            }
        });
        return volids;
    }

    /** @param volume volume path without the "storage:" prefix */
    public ImportMetadata importMetadata(TargetCluster cluster, String node, String storageName, String volume) {
        JsonNode data = get(cluster, "/nodes/" + node + "/storage/" + encode(storageName)
                + "/import-metadata?volume=" + encode(volume));
        return new ImportMetadata(volume, data.path("create-args"), data.path("disks"), data.path("net"));
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    static boolean isAtLeast(String version, int major, int minor) {
        String[] parts = version.split("[.-]");
        try {
            int maj = Integer.parseInt(parts[0]);
            int min = parts.length > 1 ? Integer.parseInt(parts[1]) : 0;
            return maj > major || (maj == major && min >= minor);
        } catch (NumberFormatException e) {
            log.warn("Unrecognised Proxmox version '{}'", version);
            return false;
        }
    }

    private JsonNode get(TargetCluster cluster, String path) {
        return send(cluster, "GET", path, null);
    }

    private JsonNode post(TargetCluster cluster, String path, Map<String, String> form) {
        return send(cluster, "POST", path, form);
    }

    /**
     * A 401 on a cached ticket drops it and repeats the request once with a
     * fresh ticket. Proxmox rejects such requests before acting on them.
     */
    private JsonNode send(TargetCluster cluster, String method, String path, Map<String, String> form) {
        String what = method + " " + path + " on " + cluster.getName();
        Ticket ticket = ticketFor(cluster);
        HttpResponse<String> resp = execute(request(cluster, method, path, form, ticket), what);
        if (resp.statusCode() == 401) {
            forget(cluster, ticket);
            log.debug("Ticket for cluster {} rejected, authenticating again", cluster.getName());
            resp = execute(request(cluster, method, path, form, ticketFor(cluster)), what);
            if (resp.statusCode() == 401) {
                forget(cluster, null);
            }
        }
        if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
            throw new HypervisorException(what + " failed — HTTP " + resp.statusCode() + ": " + resp.body());
        }
        return parse(resp.body()).path("data");
    }

    private static HttpRequest request(TargetCluster cluster, String method, String path,
                                       Map<String, String> form, Ticket ticket) {
        HttpRequest.Builder req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl(cluster) + path))
                .timeout(Duration.ofSeconds(60))
                .header("Accept", "application/json")
                .header("Cookie", "PVEAuthCookie=" + ticket.ticket());
        if (!"GET".equals(method)) {
            req.header("CSRFPreventionToken", ticket.csrfToken());
        }
        if (form != null) {
            req.header("Content-Type", "application/x-www-form-urlencoded")
               .method(method, HttpRequest.BodyPublishers.ofString(formEncode(form)));
        } else {
            req.method(method, HttpRequest.BodyPublishers.noBody());
        }
        return req.build();
    }

    private Ticket ticketFor(TargetCluster cluster) {
        Ticket cached = cluster.getId() == null ? null : tickets.get(cluster.getId());
        if (cached != null && cached.isValid()) {
            return cached;
        }
        log.debug("Requesting API ticket for cluster {}", cluster.getName());
        Map<String, String> form = Map.of(
                "username", cluster.apiPrincipal(),
                "password", cipher.decrypt(cluster.getPasswordEncrypted()));
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl(cluster) + "/access/ticket"))
                .timeout(Duration.ofSeconds(30))
                .header("Content-Type", "application/x-www-form-urlencoded")
                .POST(HttpRequest.BodyPublishers.ofString(formEncode(form)))
                .build();
        HttpResponse<String> resp = execute(req, "authentication on " + cluster.getName());
        if (resp.statusCode() != 200) {
            throw new HypervisorException("Authentication on " + cluster.getName()
                    + " failed — HTTP " + resp.statusCode());
        }
        JsonNode data = parse(resp.body()).path("data");
        Ticket fresh = new Ticket(data.path("ticket").asText(),
                                  data.path("CSRFPreventionToken").asText(),
                                  Instant.now().plus(TICKET_LIFETIME));
        if (cluster.getId() != null) {
            tickets.put(cluster.getId(), fresh);
        }
        return fresh;
    }

    /** Drop the cached ticket; with {@code expected} set, only if it is still that one. */
    private void forget(TargetCluster cluster, Ticket expected) {
        if (cluster.getId() == null) {
            return;
        }
        if (expected == null) {
            tickets.remove(cluster.getId());
        } else {
            tickets.remove(cluster.getId(), expected);
        }
    }

    private HttpResponse<String> execute(HttpRequest req, String what) {
        try {
            return http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new HypervisorException("Interrupted during " + what, e);
        } catch (Exception e) {
            throw new HypervisorException(what + " failed: " + e.getMessage(), e);
        }
    }

    private JsonNode parse(String body) {
        try {
            return json.readTree(body);
        } catch (Exception e) {
            throw new HypervisorException("Unparseable Proxmox response: " + body, e);
        }
    }

    private static String baseUrl(TargetCluster cluster) {
        return "https://" + cluster.getHost() + ":" + cluster.getApiPort() + "/api2/json";
    }

    private static String formEncode(Map<String, String> form) {
        return form.entrySet().stream()
                .map(e -> encode(e.getKey()) + "=" + encode(e.getValue()))
                .collect(Collectors.joining("&"));
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
