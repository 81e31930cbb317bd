package com.hostpanel.orchestrator.model.json;

import com.hostpanel.orchestrator.migration.ImportStrategy;
import com.hostpanel.orchestrator.migration.MigrationParameters;
import com.hostpanel.orchestrator.model.TargetResult;
import com.hostpanel.orchestrator.model.TargetStatus;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * The JSON columns of the jobs table, read back the way a cache miss
 * rebuilds a job from its durable record.
 */
class JsonAttributeConverterTest {

    final TargetResultListConverter targets = new TargetResultListConverter();
    final JsonMapConverter          params  = new JsonMapConverter();

    @Test
    void targetResults_pendingFailedAndSucceededSurviveTheColumn() {
        TargetResult pending   = TargetResult.pending("web01");
        TargetResult failed    = TargetResult.pending("db01").atStage("CONVERTING", "Converting disk 1 of 2")
                .failed("qemu-img exited with 1: invalid VMDK image descriptor");
        TargetResult succeeded = TargetResult.pending("mail01").atStage("CREATING", "Creating VM 105")
                .succeeded("105", "Imported as VM 105");
        List<TargetResult> original = List.of(pending, failed, succeeded);

        List<TargetResult> read = targets.convertToEntityAttribute(targets.convertToDatabaseColumn(original));

        assertThat(read).containsExactlyElementsOf(original);
        assertThat(read.get(0).stage()).isNull();
        assertThat(read.get(0).status()).isEqualTo(TargetStatus.PENDING);
        assertThat(read.get(1).stage()).isEqualTo("CONVERTING");
        assertThat(read.get(2).producedResourceId()).isEqualTo("105");
    }

    @Test
    void targetResults_nullOrBlankColumn_emptyList() {
        assertThat(targets.convertToEntityAttribute(null)).isEmpty();
        assertThat(targets.convertToEntityAttribute("  ")).isEmpty();
        assertThat(targets.convertToDatabaseColumn(null)).isNull();
    }

    @Test
    void targetResults_unknownPropertiesIgnored() {
        List<TargetResult> read = targets.convertToEntityAttribute("""
                [{"targetId":"web01","status":"SKIPPED","message":"already there","legacyField":1}]
                """);

        assertThat(read).singleElement()
                .extracting(TargetResult::status).isEqualTo(TargetStatus.SKIPPED);
    }

    @Test
    void targetResults_corruptColumn_illegalState() {
        assertThatThrownBy(() -> targets.convertToEntityAttribute("[{\"status\":\"SLEEPING\"}]"))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void parameters_migrationParametersParseTheSameAfterTheColumn() {
        Map<String, Object> original = new LinkedHashMap<>(new MigrationParameters(
                1L, 2L, "pve1", "local-lvm", "vmbr0", ImportStrategy.NATIVE_IMPORT, true).toMap());
        original.put("note", null);

        Map<String, Object> read = params.convertToEntityAttribute(params.convertToDatabaseColumn(original));

        assertThat(read).containsKeys("sourceHostId", "clusterId", "strategy", "note");
        assertThat(MigrationParameters.from(read)).isEqualTo(MigrationParameters.from(original));
    }
}
