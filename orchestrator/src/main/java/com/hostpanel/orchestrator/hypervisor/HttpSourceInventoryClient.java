package com.hostpanel.orchestrator.hypervisor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hostpanel.orchestrator.model.SourceHost;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * HTTP client for the ESXi inventory endpoint.
 *
 * Session flow (vSphere REST style):
 *   POST /api/session              basic auth → session token
 *   GET  {inventory path}          header vmware-api-session-id
 *   DELETE /api/session            best effort
 *
 * The inventory path returns a JSON array of VM property documents, or an
 * object wrapping that array in "value".
 */
@Component
public class HttpSourceInventoryClient implements SourceInventoryClient {

    private static final Logger log = LoggerFactory.getLogger(HttpSourceInventoryClient.class);

    private static final String SESSION_PATH   = "/api/session";
    private static final String SESSION_HEADER = "vmware-api-session-id";

    private final HttpClient       http;
    private final ObjectMapper     json;
    private final CredentialCipher cipher;
    private final String           inventoryPath;

    public HttpSourceInventoryClient(ObjectMapper objectMapper,
                                     CredentialCipher cipher,
                                     @Value("${hostpanel.inventory.path:/api/inventory/vms?properties=name,config,runtime,guest,summary}")
                                     String inventoryPath) {
        this.json          = objectMapper;
        this.cipher        = cipher;
        this.inventoryPath = inventoryPath;
        this.http          = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(15))
                .build();
    }

    @Override
    public List<JsonNode> retrieveVirtualMachines(SourceHost host) {
        String baseUrl = "https://" + host.getHost() + ":" + host.getPort();
        String session = authenticate(baseUrl, host);
        try {
            log.info("Retrieving VM inventory from {}", host.getHost());
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + inventoryPath))
                    .timeout(Duration.ofMinutes(2))
                    .header("Accept", "application/json")
                    .header(SESSION_HEADER, session)
                    .GET()
                    .build();
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                throw new HypervisorException("Inventory request to " + host.getHost()
                        + " failed — HTTP " + resp.statusCode() + ": " + resp.body());
            }
            return vmItems(json.readTree(resp.body()), host.getHost());
        } catch (HypervisorException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new HypervisorException("Interrupted while reading inventory from " + host.getHost(), e);
        } catch (Exception e) {
            throw new HypervisorException("Inventory request to " + host.getHost() + " failed", e);
        } finally {
            logout(baseUrl, session);
        }
    }

    /**
     * Extracts the VM documents from an inventory response. A body that carries
     * no VM array is rejected so it cannot be mistaken for an empty inventory.
     */
    static List<JsonNode> vmItems(JsonNode root, String host) {
        JsonNode items = root == null || root.isArray() ? root : root.get("value");
        if (items == null || !items.isArray()) {
            throw new HypervisorException("Unexpected inventory response from " + host + ": no VM list");
        }
        List<JsonNode> vms = new ArrayList<>();
        items.forEach(vms::add);
        return vms;
    }

    // ------------------------------------------------------------------
    // Session handling
    // ------------------------------------------------------------------

    private String authenticate(String baseUrl, SourceHost host) {
        String credentials = host.getUsername() + ":" + cipher.decrypt(host.getPasswordEncrypted());
        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + SESSION_PATH))
                    .timeout(Duration.ofSeconds(30))
                    .header("Authorization", "Basic " + Base64.getEncoder()
                            .encodeToString(credentials.getBytes(StandardCharsets.UTF_8)))
                    .POST(HttpRequest.BodyPublishers.noBody())
                    .build();
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                throw new HypervisorException("Authentication to " + host.getHost()
                        + " failed — HTTP " + resp.statusCode());
            }
            // The token comes back as a JSON string literal.
            return json.readValue(resp.body(), String.class);
        } catch (HypervisorException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new HypervisorException("Interrupted while authenticating to " + host.getHost(), e);
        } catch (Exception e) {
            throw new HypervisorException("Cannot reach source host " + host.getHost(), e);
        }
    }

    private void logout(String baseUrl, String session) {
        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + SESSION_PATH))
                    .timeout(Duration.ofSeconds(10))
                    .header(SESSION_HEADER, session)
                    .DELETE()
                    .build();
            http.send(req, HttpResponse.BodyHandlers.discarding());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            log.debug("Session logout at {} failed: {}", baseUrl, e.getMessage());
        }
    }
}
