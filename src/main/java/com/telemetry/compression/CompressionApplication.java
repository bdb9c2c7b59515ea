package com.telemetry.compression;

import com.telemetry.compression.collector.KafkaSampleCollector;
import com.telemetry.compression.core.impl.DefaultCompressionExecutor;
import com.telemetry.compression.core.impl.DefaultSessionManager;
import com.telemetry.compression.model.CompressionConfig;
import com.telemetry.compression.model.DecompressionResult;
import com.telemetry.compression.model.ReplaySelection;
import com.telemetry.compression.model.SessionStatistics;
import com.telemetry.compression.output.ReconstructionDocumentWriter;
import com.telemetry.compression.storage.SQLiteTelemetryStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

/**
 * 系统启动引导类。
 * 一条命令完成全部初始化：打开存储、创建会话管理器与执行器，按运行方式执行。
 *
 * 运行方式：
 * - backlog：压缩 original_samples 中的积压采样，写入 compressed_data_optimized
 * - decompress：重放压缩记录（可按 app.segments、app.from/app.to 选择），为每个设备输出重建 JSON 文档
 * - stream：从 Kafka 实时消费采样并流式压缩
 *
 * 用法：java -jar telemetry-compression.jar [配置文件路径]
 */
public class CompressionApplication {

    private static final Logger log = LoggerFactory.getLogger(CompressionApplication.class);

    private static final long SHUTDOWN_TIMEOUT_MS = 30_000;

    private SQLiteTelemetryStorage storage;
    private DefaultCompressionExecutor executor;
    private KafkaSampleCollector collector;

    /**
     * 初始化组件
     */
    public void init(AppConfig config) {
        log.info("=== IoT Telemetry Window Compression Engine ===");
        log.info("Starting with config: {}", config);

        CompressionConfig engineConfig = config.toCompressionConfig();
        engineConfig.validate().getWarnings()
                .forEach(warning -> log.warn("Engine config: {}", warning));

        // 1. 初始化存储层
        storage = new SQLiteTelemetryStorage(config.getStoragePath());

        // 2. 初始化会话管理器（同设备单写入者）
        DefaultSessionManager sessionManager = new DefaultSessionManager(engineConfig, storage);

        // 3. 初始化执行器
        executor = new DefaultCompressionExecutor(sessionManager, storage, storage,
                config.getWorkerParallelism());

        // 4. 流式接入
        if (config.getMode() == AppConfig.Mode.STREAM) {
            collector = new KafkaSampleCollector(config.getKafkaBootstrapServers(),
                    config.getKafkaInputTopic(), config.getKafkaGroupId(), sessionManager, storage);
        }
    }

    /**
     * 压缩积压数据
     *
     * @return 成功压缩的设备统计，按设备顺序排列
     */
    public Map<String, SessionStatistics> compressBacklog(List<String> devices) {
        Map<String, SessionStatistics> completed = new LinkedHashMap<>();
        Map<String, Future<SessionStatistics>> futures = executor.submitAll(devices);
        for (Map.Entry<String, Future<SessionStatistics>> entry : futures.entrySet()) {
            awaitResult(entry.getKey(), entry.getValue())
                    .ifPresent(statistics -> completed.put(entry.getKey(), statistics));
        }
        log.info("Backlog compression finished: {}/{} devices succeeded.", completed.size(), devices.size());
        return completed;
    }

    /**
     * 解压并写出重建文档
     *
     * @return 成功解压的设备结果
     */
    public Map<String, DecompressionResult> decompress(List<String> devices, ReconstructionDocumentWriter writer) {
        return decompress(devices, ReplaySelection.all(), writer);
    }

    /**
     * 按分段或时间范围解压并写出重建文档
     */
    public Map<String, DecompressionResult> decompress(List<String> devices, ReplaySelection selection,
                                                      ReconstructionDocumentWriter writer) {
        Map<String, Future<DecompressionResult>> futures = new LinkedHashMap<>();
        for (String deviceId : devices) {
            futures.put(deviceId, executor.submitDecompression(deviceId, selection));
        }
        Map<String, DecompressionResult> completed = new LinkedHashMap<>();
        for (Map.Entry<String, Future<DecompressionResult>> entry : futures.entrySet()) {
            awaitResult(entry.getKey(), entry.getValue()).ifPresent(result -> {
                writer.write(result);
                completed.put(entry.getKey(), result);
            });
        }
        log.info("Decompression finished: {}/{} devices succeeded.", completed.size(), devices.size());
        return completed;
    }

    private <T> Optional<T> awaitResult(String deviceId, Future<T> future) {
        try {
            return Optional.of(future.get());
        } catch (ExecutionException e) {
            // 失败只影响该设备，原因已由执行器记录
            log.warn("Device '{}' skipped: {}", deviceId, e.getCause().getMessage());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for device '" + deviceId + "'", e);
        }
    }

    public void run(AppConfig config) {
        List<String> devices = config.getDevices().isEmpty() ? storage.listDevices() : config.getDevices();
        switch (config.getMode()) {
            case BACKLOG:
                compressBacklog(devices);
                shutdown();
                break;
            case DECOMPRESS:
                decompress(devices, config.getReplaySelection(),
                        new ReconstructionDocumentWriter(config.getOutputDir()));
                shutdown();
                break;
            case STREAM:
                Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                    log.info("Shutdown hook triggered, performing graceful shutdown...");
                    shutdown();
                }, "shutdown-hook"));
                collector.start();
                log.info("=== Streaming compression started ===");
                break;
            default:
                throw new IllegalArgumentException("Unsupported mode: " + config.getMode());
        }
    }

    public synchronized void shutdown() {
        if (collector != null) {
            collector.stop();
            collector = null;
        }
        if (executor != null) {
            executor.shutdown(SHUTDOWN_TIMEOUT_MS);
            executor = null;
        }
        if (storage != null) {
            storage.shutdown();
            storage = null;
        }
        log.info("=== Compression engine shut down ===");
    }

    /**
     * 应用入口
     */
    public static void main(String[] args) {
        String configPath = (args.length > 0) ? args[0] : "config/compression.properties";

        AppConfig config = AppConfig.load(configPath);
        CompressionApplication app = new CompressionApplication();
        app.init(config);
        app.run(config);
    }
}
