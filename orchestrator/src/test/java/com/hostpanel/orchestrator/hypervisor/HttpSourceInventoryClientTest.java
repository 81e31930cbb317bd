package com.hostpanel.orchestrator.hypervisor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpSourceInventoryClientTest {

    final ObjectMapper mapper = new ObjectMapper();

    @Test
    void bareArray_everyDocumentReturned() throws Exception {
        List<JsonNode> vms = HttpSourceInventoryClient.vmItems(
                mapper.readTree("[{\"name\":\"web01\"},{\"name\":\"db01\"}]"), "esxi01");

        assertThat(vms).extracting(n -> n.get("name").asText()).containsExactly("web01", "db01");
    }

    @Test
    void wrappedInValue_documentsUnwrapped() throws Exception {
        List<JsonNode> vms = HttpSourceInventoryClient.vmItems(
                mapper.readTree("{\"value\":[{\"name\":\"web01\"}]}"), "esxi01");

        assertThat(vms).hasSize(1);
    }

    @Test
    void emptyArray_isAnEmptyInventory() throws Exception {
        assertThat(HttpSourceInventoryClient.vmItems(mapper.readTree("{\"value\":[]}"), "esxi01")).isEmpty();
    }

    @Test
    void noValueField_rejectedInsteadOfEmptyInventory() throws Exception {
        assertThatThrownBy(() -> HttpSourceInventoryClient.vmItems(mapper.readTree("{}"), "esxi01"))
                .isInstanceOf(HypervisorException.class)
                .hasMessageContaining("esxi01")
                .hasMessageContaining("no VM list");
    }

    @Test
    void valueNotAnArray_rejected() throws Exception {
        assertThatThrownBy(() -> HttpSourceInventoryClient.vmItems(
                mapper.readTree("{\"value\":{\"error\":\"not authorized\"}}"), "esxi01"))
                .isInstanceOf(HypervisorException.class);
    }

    @Test
    void nullDocument_rejected() {
        assertThatThrownBy(() -> HttpSourceInventoryClient.vmItems(null, "esxi01"))
                .isInstanceOf(HypervisorException.class);
    }
}
