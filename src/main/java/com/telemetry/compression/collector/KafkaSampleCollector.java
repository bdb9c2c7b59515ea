package com.telemetry.compression.collector;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.telemetry.compression.core.CompressionSession;
import com.telemetry.compression.core.SessionManager;
import com.telemetry.compression.exception.SessionConflictException;
import com.telemetry.compression.model.Sample;
import com.telemetry.compression.storage.SQLiteTelemetryStorage;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Kafka采样采集消费者。
 * 从Kafka Topic实时消费设备上报的采样，按设备送入各自的流式压缩会话，
 * 可选地同时写入本地SQLite的 original_samples 表作为原始数据备份。
 *
 * 消息格式约定（JSON）：
 * {"deviceId":"DEV001","timestamp":1708128000000,"values":[12.5,3.1]}
 */
public class KafkaSampleCollector implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(KafkaSampleCollector.class);

    private final String bootstrapServers;
    private final String topic;
    private final String groupId;
    private final SessionManager sessionManager;
    private final SQLiteTelemetryStorage archive;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final AtomicBoolean running = new AtomicBoolean(false);

    /** 各设备的流式压缩会话 */
    private final ConcurrentHashMap<String, CompressionSession> sessions = new ConcurrentHashMap<>();

    /** 会话因输入非法而失败的设备，直到 resetDevice 之前不再接收其采样 */
    private final Set<String> faultedDevices = ConcurrentHashMap.newKeySet();

    private KafkaConsumer<String, String> consumer;
    private Thread collectorThread;

    /**
     * @param archive 原始采样备份存储，为null时不备份
     */
    public KafkaSampleCollector(String bootstrapServers, String topic, String groupId,
                                SessionManager sessionManager, SQLiteTelemetryStorage archive) {
        this.bootstrapServers = bootstrapServers;
        this.topic = topic;
        this.groupId = groupId;
        this.sessionManager = sessionManager;
        this.archive = archive;
    }

    public void start() {
        if (!running.compareAndSet(false, true)) {
            log.warn("KafkaSampleCollector is already running.");
            return;
        }

        Properties props = new Properties();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ConsumerConfig.GROUP_ID_CONFIG, groupId);
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "latest");
        props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "true");
        props.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, "10000");

        consumer = new KafkaConsumer<>(props);
        consumer.subscribe(Collections.singletonList(topic));

        collectorThread = new Thread(this, "kafka-sample-collector");
        collectorThread.setDaemon(true);
        collectorThread.start();

        log.info("KafkaSampleCollector started. Topic: {}, Group: {}", topic, groupId);
    }

    @Override
    public void run() {
        try {
            while (running.get()) {
                ConsumerRecords<String, String> records = consumer.poll(Duration.ofMillis(100));
                for (ConsumerRecord<String, String> record : records) {
                    try {
                        if (!handleMessage(record.value())) {
                            log.debug("Kafka record at offset {} was not compressed.", record.offset());
                        }
                    } catch (RuntimeException e) {
                        log.error("Failed to process Kafka record at offset {}: {}",
                                record.offset(), e.getMessage());
                    }
                }
            }
        } catch (RuntimeException e) {
            log.error("KafkaSampleCollector encountered fatal error", e);
        } finally {
            if (consumer != null) {
                consumer.close();
            }
            finishAndReportTails();
            log.info("KafkaSampleCollector stopped.");
        }
    }

    /**
     * 消费线程退出时收尾：结束所有会话，并以 WARN 记录未凑满窗口的尾部采样。
     */
    Map<String, List<Sample>> finishAndReportTails() {
        Map<String, List<Sample>> tails = finishAll();
        tails.forEach((deviceId, tail) ->
                log.warn("Device '{}' stream ends with {} buffered samples short of a full window; "
                        + "they are not compressed.", deviceId, tail.size()));
        return tails;
    }

    /**
     * 处理一条消息：解析、备份、送入设备会话。
     * 非法消息和失败设备只影响自身，不会中断消费循环。
     *
     * @return 采样是否已送入压缩会话
     */
    boolean handleMessage(String json) {
        Sample sample;
        try {
            sample = parseSample(json);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Skipping malformed sample message: {}", e.getMessage());
            return false;
        }

        if (archive != null) {
            try {
                archive.writeSample(sample);
            } catch (RuntimeException e) {
                log.error("Failed to archive sample of device '{}' at {}: {}",
                        sample.getDeviceId(), sample.getTimestamp(), e.getMessage());
            }
        }

        String deviceId = sample.getDeviceId();
        if (faultedDevices.contains(deviceId)) {
            log.debug("Device '{}' is faulted, sample at {} ignored.", deviceId, sample.getTimestamp());
            return false;
        }

        CompressionSession session = sessions.get(deviceId);
        if (session == null) {
            try {
                session = sessionManager.openCompression(deviceId);
            } catch (SessionConflictException e) {
                log.warn("Device '{}' is being compressed elsewhere, sample at {} not streamed.",
                        deviceId, sample.getTimestamp());
                return false;
            } catch (RuntimeException e) {
                log.error("Failed to open streaming session for device '{}': {}", deviceId, e.getMessage());
                return false;
            }
            sessions.put(deviceId, session);
        }

        try {
            session.offer(sample);
            return true;
        } catch (RuntimeException e) {
            // offer 失败时会话已中止并释放
            sessions.remove(deviceId);
            faultedDevices.add(deviceId);
            log.error("Streaming compression of device '{}' stopped: {}", deviceId, e.getMessage());
            return false;
        }
    }

    Sample parseSample(String json) throws JsonProcessingException {
        if (json == null) {
            throw new IllegalArgumentException("Empty message");
        }
        JsonNode node = objectMapper.readTree(json);
        JsonNode deviceId = node.get("deviceId");
        JsonNode timestamp = node.get("timestamp");
        JsonNode values = node.get("values");
        if (deviceId == null || !deviceId.isTextual()) {
            throw new IllegalArgumentException("Missing deviceId");
        }
        if (timestamp == null || !timestamp.canConvertToLong()) {
            throw new IllegalArgumentException("Missing or invalid timestamp");
        }
        if (values == null || !values.isArray() || values.size() == 0) {
            throw new IllegalArgumentException("Missing values");
        }
        double[] parsed = new double[values.size()];
        for (int i = 0; i < parsed.length; i++) {
            JsonNode value = values.get(i);
            if (!value.isNumber()) {
                throw new IllegalArgumentException("Non-numeric value at dimension " + i);
            }
            parsed[i] = value.asDouble();
        }
        return new Sample(deviceId.asText(), timestamp.asLong(), parsed);
    }

    /**
     * 清除设备的失败标记，之后的采样会开启新会话
     */
    public void resetDevice(String deviceId) {
        if (faultedDevices.remove(deviceId)) {
            log.info("Device '{}' reset, streaming resumes with a new segment.", deviceId);
        }
    }

    /**
     * 结束全部流式会话
     *
     * @return 各设备 BUFFER 模式下未编码的尾部采样
     */
    public Map<String, List<Sample>> finishAll() {
        Map<String, List<Sample>> pending = new ConcurrentHashMap<>();
        for (String deviceId : new ArrayList<>(sessions.keySet())) {
            CompressionSession session = sessions.remove(deviceId);
            if (session == null) {
                continue;
            }
            try {
                List<Sample> tail = session.finish();
                if (!tail.isEmpty()) {
                    pending.put(deviceId, tail);
                }
            } catch (RuntimeException e) {
                log.error("Failed to finish streaming session of device '{}': {}", deviceId, e.getMessage());
            }
        }
        return pending;
    }

    public void stop() {
        running.set(false);
        if (collectorThread != null) {
            try {
                collectorThread.join(5000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    public List<String> getStreamingDevices() {
        List<String> devices = new ArrayList<>(sessions.keySet());
        Collections.sort(devices);
        return devices;
    }

    public Set<String> getFaultedDevices() {
        return Collections.unmodifiableSet(faultedDevices);
    }
}
