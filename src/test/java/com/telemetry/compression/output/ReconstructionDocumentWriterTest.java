package com.telemetry.compression.output;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.telemetry.compression.model.DecompressionResult;
import com.telemetry.compression.model.RecordType;
import com.telemetry.compression.model.Sample;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class ReconstructionDocumentWriterTest {

    @TempDir
    Path tempDir;

    private static DecompressionResult result() {
        DecompressionResult result = new DecompressionResult("site/7:pump");
        result.addSample(new Sample("site/7:pump", 1000L, 1.5, 2.0));
        result.addSample(new Sample("site/7:pump", 2000L, 1.5, 2.0));
        result.recordApplied(RecordType.NEW_EXEMPLAR);
        result.recordApplied(RecordType.REFERENCE);
        result.segmentCompleted();
        return result;
    }

    @Test
    void testWritesDocumentPerDevice() throws Exception {
        ReconstructionDocumentWriter writer = new ReconstructionDocumentWriter(tempDir.resolve("out").toString());

        File file = writer.write(result());

        assertThat(file).exists().hasName("site_7_pump_reconstructed.json");
        JsonNode root = new ObjectMapper().readTree(file);
        assertThat(root.get("deviceId").asText()).isEqualTo("site/7:pump");
        assertThat(root.get("segmentCount").asInt()).isEqualTo(1);
        assertThat(root.get("recordCount").asLong()).isEqualTo(2);
        assertThat(root.get("referenceCount").asLong()).isEqualTo(1);
        assertThat(root.get("sampleCount").asInt()).isEqualTo(2);
        assertThat(root.get("samples")).hasSize(2);
        assertThat(root.get("samples").get(1).get("timestamp").asLong()).isEqualTo(2000L);
        assertThat(root.get("samples").get(1).get("values").get(0).asDouble()).isEqualTo(1.5);
    }

    @Test
    void testJsonMatchesWrittenDocument() throws Exception {
        ReconstructionDocumentWriter writer = new ReconstructionDocumentWriter(tempDir.toString());
        ObjectMapper mapper = new ObjectMapper();

        JsonNode fromString = mapper.readTree(writer.toJson(result()));
        JsonNode fromFile = mapper.readTree(writer.write(result()));

        assertThat(fromString).isEqualTo(fromFile);
    }
}
