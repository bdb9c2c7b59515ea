package com.telemetry.compression.output;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.telemetry.compression.model.DecompressionResult;
import com.telemetry.compression.model.Sample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;

/**
 * 将单设备的解压结果写成 JSON 文档：
 * <pre>
 * {"deviceId":..., "segmentCount":..., "recordCount":..., "referenceCount":..., "sampleCount":...,
 *  "samples":[{"timestamp":..., "values":[...]}, ...]}
 * </pre>
 */
public class ReconstructionDocumentWriter {

    private static final Logger log = LoggerFactory.getLogger(ReconstructionDocumentWriter.class);

    private final File outputDir;
    private final ObjectMapper objectMapper;

    public ReconstructionDocumentWriter(String outputDir) {
        this.outputDir = new File(outputDir);
        this.objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * 写出文档。
     *
     * @return 文档文件
     * @throws IllegalStateException 目录无法创建或写入失败
     */
    public File write(DecompressionResult result) {
        if (!outputDir.exists() && !outputDir.mkdirs()) {
            throw new IllegalStateException("Failed to create output directory: " + outputDir);
        }
        File file = new File(outputDir, fileNameFor(result.getDeviceId()));
        try {
            objectMapper.writeValue(file, toDocument(result));
        } catch (IOException e) {
            log.error("Failed to write reconstruction of device '{}' to {}: {}",
                    result.getDeviceId(), file, e.getMessage(), e);
            throw new IllegalStateException("Failed to write reconstruction document", e);
        }
        log.info("Reconstruction of device '{}' saved to {} ({} KB).",
                result.getDeviceId(), file, String.format("%.2f", file.length() / 1024.0));
        return file;
    }

    public String toJson(DecompressionResult result) {
        try {
            return objectMapper.writeValueAsString(toDocument(result));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize reconstruction document", e);
        }
    }

    ObjectNode toDocument(DecompressionResult result) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("deviceId", result.getDeviceId());
        root.put("segmentCount", result.getSegmentCount());
        root.put("recordCount", result.getRecordCount());
        root.put("referenceCount", result.getReferenceCount());
        root.put("sampleCount", result.getSampleCount());

        ArrayNode samples = root.putArray("samples");
        for (Sample sample : result.getSamples()) {
            ObjectNode row = samples.addObject();
            row.put("timestamp", sample.getTimestamp());
            ArrayNode values = row.putArray("values");
            for (double value : sample.getValues()) {
                values.add(value);
            }
        }
        return root;
    }

    /** 设备标识转为合法文件名 */
    static String fileNameFor(String deviceId) {
        return deviceId.replaceAll("[^a-zA-Z0-9_.-]", "_") + "_reconstructed.json";
    }
}
