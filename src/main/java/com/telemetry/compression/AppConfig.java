package com.telemetry.compression;

import com.telemetry.compression.model.CompressionConfig;
import com.telemetry.compression.model.ReplaySelection;
import com.telemetry.compression.model.TrailingWindowMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Properties;

/**
 * 应用配置类。
 * 对应配置文件中的系统级参数与压缩引擎参数。
 */
public class AppConfig {

    private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

    /** 配置文件不存在时回退读取的类路径资源 */
    static final String CLASSPATH_RESOURCE = "compression.properties";

    public enum Mode { BACKLOG, DECOMPRESS, STREAM }

    // ---- 运行方式 ----
    private Mode mode = Mode.BACKLOG;
    private List<String> devices = Collections.emptyList();
    private int workerParallelism = Runtime.getRuntime().availableProcessors();

    // ---- 解压范围 ----
    private ReplaySelection replaySelection = ReplaySelection.all();

    // ---- 存储与输出 ----
    private String storagePath = "data/storage";
    private String outputDir = "data/reconstructed";

    // ---- Kafka ----
    private String kafkaBootstrapServers = "localhost:9092";
    private String kafkaInputTopic = "telemetry-samples";
    private String kafkaGroupId = "compression-engine";

    // ---- 压缩引擎 ----
    private CompressionConfig compressionConfig = new CompressionConfig();

    /**
     * 从文件加载配置；文件不可读时回退到类路径资源，仍不可用则全部取默认值
     */
    public static AppConfig load(String configPath) {
        Properties props = new Properties();
        try (InputStream in = new FileInputStream(configPath)) {
            props.load(in);
            log.info("Loaded config from {}", configPath);
        } catch (IOException e) {
            log.warn("Failed to load config from {}, trying classpath resource '{}'. Error: {}",
                    configPath, CLASSPATH_RESOURCE, e.getMessage());
            loadClasspathResource(props);
        }
        return fromProperties(props);
    }

    /**
     * 从属性集合构建配置。单个键取值非法时记录告警并保留该键的默认值。
     */
    public static AppConfig fromProperties(Properties props) {
        AppConfig config = new AppConfig();
        CompressionConfig engine = config.compressionConfig;

        config.mode = parse(props, "app.mode", config.mode,
                v -> Mode.valueOf(v.toUpperCase(Locale.ROOT)));
        config.devices = parse(props, "app.devices", config.devices, AppConfig::parseList);
        config.workerParallelism = parse(props, "worker.parallelism", config.workerParallelism,
                Integer::parseInt);
        config.replaySelection = parseReplaySelection(props);
        config.storagePath = props.getProperty("storage.path", config.storagePath);
        config.outputDir = props.getProperty("output.dir", config.outputDir);
        config.kafkaBootstrapServers = props.getProperty("kafka.bootstrap.servers", config.kafkaBootstrapServers);
        config.kafkaInputTopic = props.getProperty("kafka.input.topic", config.kafkaInputTopic);
        config.kafkaGroupId = props.getProperty("kafka.group.id", config.kafkaGroupId);

        engine.setWindowSize(parse(props, "engine.window.size", engine.getWindowSize(), Integer::parseInt));
        engine.setPoolCapacity(parse(props, "engine.pool.capacity", engine.getPoolCapacity(), Integer::parseInt));
        engine.setInitialThreshold(parse(props, "engine.threshold.initial",
                engine.getInitialThreshold(), Double::parseDouble));
        engine.setMinThreshold(parse(props, "engine.threshold.min", engine.getMinThreshold(), Double::parseDouble));
        engine.setMaxThreshold(parse(props, "engine.threshold.max", engine.getMaxThreshold(), Double::parseDouble));
        engine.setThresholdStep(parse(props, "engine.threshold.step", engine.getThresholdStep(), Double::parseDouble));
        engine.setAdaptiveThreshold(parse(props, "engine.threshold.adaptive",
                engine.isAdaptiveThreshold(), Boolean::parseBoolean));
        engine.setTargetRatio(parse(props, "engine.target.ratio", engine.getTargetRatio(), Double::parseDouble));
        engine.setRatioTolerance(parse(props, "engine.ratio.tolerance",
                engine.getRatioTolerance(), Double::parseDouble));
        engine.setErrorBudget(parse(props, "engine.error.budget", engine.getErrorBudget(), Double::parseDouble));
        engine.setControllerHistory(parse(props, "engine.controller.history",
                engine.getControllerHistory(), Integer::parseInt));
        engine.setWarmupWindows(parse(props, "engine.controller.warmup",
                engine.getWarmupWindows(), Integer::parseInt));
        engine.setTrailingMode(parse(props, "engine.trailing.mode", engine.getTrailingMode(),
                v -> TrailingWindowMode.valueOf(v.toUpperCase(Locale.ROOT))));
        engine.setSimilarityMeasure(parse(props, "engine.similarity.measure", engine.getSimilarityMeasure(),
                v -> v.toUpperCase(Locale.ROOT)));
        engine.setDimensionWeights(parse(props, "engine.dimension.weights", engine.getDimensionWeights(),
                AppConfig::parseWeights));
        engine.setCostW1(parse(props, "engine.cost.w1", engine.getCostW1(), Double::parseDouble));
        engine.setCostW2(parse(props, "engine.cost.w2", engine.getCostW2(), Double::parseDouble));
        engine.setMaxAcceptableCer(parse(props, "engine.cost.max.cer",
                engine.getMaxAcceptableCer(), Double::parseDouble));

        return config;
    }

    private static void loadClasspathResource(Properties props) {
        try (InputStream in = AppConfig.class.getClassLoader().getResourceAsStream(CLASSPATH_RESOURCE)) {
            if (in == null) {
                log.warn("Classpath resource '{}' not found, using defaults.", CLASSPATH_RESOURCE);
                return;
            }
            props.load(in);
        } catch (IOException e) {
            log.warn("Failed to read classpath resource '{}', using defaults. Error: {}",
                    CLASSPATH_RESOURCE, e.getMessage());
        }
    }

    private interface Parser<T> {
        T parse(String raw);
    }

    private static <T> T parse(Properties props, String key, T defaultValue, Parser<T> parser) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return parser.parse(raw.trim());
        } catch (IllegalArgumentException e) {
            log.warn("Invalid value '{}' for '{}', using default {}.", raw, key, defaultValue);
            return defaultValue;
        }
    }

    private static ReplaySelection parseReplaySelection(Properties props) {
        List<Long> segments = parse(props, "app.segments", Collections.<Long>emptyList(), raw -> {
            List<Long> ids = new ArrayList<>();
            for (String item : parseList(raw)) {
                ids.add(Long.parseLong(item));
            }
            return ids;
        });
        long from = parse(props, "app.from", Long.MIN_VALUE, Long::parseLong);
        long to = parse(props, "app.to", Long.MAX_VALUE, Long::parseLong);
        if (from >= to) {
            log.warn("Invalid replay range [{}, {}), replaying the whole time range.", from, to);
            return ReplaySelection.ofSegments(segments);
        }
        return new ReplaySelection(segments, from, to);
    }

    private static List<String> parseList(String raw) {
        List<String> items = new ArrayList<>();
        for (String item : raw.split(",")) {
            if (!item.isBlank()) {
                items.add(item.trim());
            }
        }
        return Collections.unmodifiableList(items);
    }

    private static double[] parseWeights(String raw) {
        return parseList(raw).stream().mapToDouble(Double::parseDouble).toArray();
    }

    /**
     * 压缩引擎配置
     */
    public CompressionConfig toCompressionConfig() { return compressionConfig; }

    // ---- Getters ----
    public Mode getMode() { return mode; }
    public List<String> getDevices() { return devices; }
    public int getWorkerParallelism() { return workerParallelism; }
    public ReplaySelection getReplaySelection() { return replaySelection; }
    public String getStoragePath() { return storagePath; }
    public String getOutputDir() { return outputDir; }
    public String getKafkaBootstrapServers() { return kafkaBootstrapServers; }
    public String getKafkaInputTopic() { return kafkaInputTopic; }
    public String getKafkaGroupId() { return kafkaGroupId; }

    @Override
    public String toString() {
        return "AppConfig{mode=" + mode
                + ", devices=" + devices
                + ", parallelism=" + workerParallelism
                + ", replay=" + replaySelection
                + ", storagePath='" + storagePath + "'"
                + ", outputDir='" + outputDir + "'"
                + ", kafka='" + kafkaBootstrapServers + "'"
                + ", engine=" + compressionConfig
                + ", weights=" + Arrays.toString(compressionConfig.getDimensionWeights()) + "}";
    }
}
