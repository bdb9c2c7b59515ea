package com.telemetry.compression.storage;

import com.telemetry.compression.core.RecordSink;
import com.telemetry.compression.core.RecordSource;
import com.telemetry.compression.core.SampleSource;
import com.telemetry.compression.engine.RecordCodec;
import com.telemetry.compression.exception.RecordStreamCorruptedException;
import com.telemetry.compression.model.CompressedRecord;
import com.telemetry.compression.model.Sample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 基于SQLite的遥测数据存储实现。
 *
 * 核心设计：
 * - original_samples 保存原始采样，数值以大端 double 数组存为 BLOB
 * - compressed_data_optimized 按 (设备, 分段, 序号) 只追加保存压缩记录
 * - compression_segments 登记每次压缩会话开启的分段
 * - 读取按页进行，积压数据再多也不会一次性装入内存
 */
public class SQLiteTelemetryStorage implements SampleSource, RecordSink, RecordSource {

    private static final Logger log = LoggerFactory.getLogger(SQLiteTelemetryStorage.class);

    private static final String DB_FILE = "telemetry.db";

    /** 分页读取的行数 */
    private final int pageSize;

    private final String storageRoot;
    private final Connection connection;

    /** 分段内下一条记录的序号：deviceId#segmentId -> seq */
    private final ConcurrentHashMap<String, AtomicLong> nextSequence = new ConcurrentHashMap<>();

    public SQLiteTelemetryStorage(String storageRoot) {
        this(storageRoot, 1000);
    }

    public SQLiteTelemetryStorage(String storageRoot, int pageSize) {
        if (pageSize <= 0) {
            throw new IllegalArgumentException("Page size must be positive: " + pageSize);
        }
        this.storageRoot = storageRoot;
        this.pageSize = pageSize;

        // 确保存储目录存在
        File dir = new File(storageRoot);
        if (!dir.exists() && !dir.mkdirs()) {
            throw new IllegalStateException("Failed to create storage directory: " + storageRoot);
        }

        this.connection = openDatabase();
        log.info("SQLiteTelemetryStorage initialized. Root: {}, PageSize: {}", storageRoot, pageSize);
    }

    // ==================== 原始采样 ====================

    /**
     * 写入单个原始采样，同一设备同一时间戳重复写入时覆盖
     */
    public synchronized void writeSample(Sample sample) {
        try (PreparedStatement stmt = connection.prepareStatement(
                "INSERT OR REPLACE INTO original_samples (device_id, timestamp, sample_values) VALUES (?, ?, ?)")) {
            bindSample(stmt, sample);
            stmt.executeUpdate();
        } catch (SQLException e) {
            log.error("Failed to write sample of device '{}': {}", sample.getDeviceId(), e.getMessage(), e);
            throw new IllegalStateException("Failed to write sample", e);
        }
    }

    /**
     * 在单个事务中批量写入原始采样
     */
    public synchronized void writeSamples(List<Sample> samples) {
        try {
            connection.setAutoCommit(false);
            try (PreparedStatement stmt = connection.prepareStatement(
                    "INSERT OR REPLACE INTO original_samples (device_id, timestamp, sample_values) VALUES (?, ?, ?)")) {
                for (Sample sample : samples) {
                    bindSample(stmt, sample);
                    stmt.addBatch();
                }
                stmt.executeBatch();
            }
            connection.commit();
        } catch (SQLException e) {
            rollbackQuietly();
            log.error("Failed to write {} samples: {}", samples.size(), e.getMessage(), e);
            throw new IllegalStateException("Failed to write samples", e);
        } finally {
            restoreAutoCommit();
        }
        log.debug("Wrote {} samples.", samples.size());
    }

    @Override
    public synchronized List<String> listDevices() {
        List<String> devices = new ArrayList<>();
        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery(
                     "SELECT DISTINCT device_id FROM original_samples ORDER BY device_id ASC")) {
            while (rs.next()) {
                devices.add(rs.getString(1));
            }
        } catch (SQLException e) {
            log.error("Failed to list devices: {}", e.getMessage(), e);
            throw new IllegalStateException("Failed to list devices", e);
        }
        return devices;
    }

    @Override
    public Iterator<Sample> openSamples(String deviceId, long fromInclusive, long toExclusive) {
        return new SamplePageIterator(deviceId, fromInclusive, toExclusive);
    }

    // ==================== 压缩记录 ====================

    @Override
    public synchronized long openSegment(String deviceId) {
        try {
            long segmentId;
            try (PreparedStatement stmt = connection.prepareStatement(
                    "SELECT COALESCE(MAX(segment_id), 0) + 1 FROM compression_segments WHERE device_id = ?")) {
                stmt.setString(1, deviceId);
                try (ResultSet rs = stmt.executeQuery()) {
                    rs.next();
                    segmentId = rs.getLong(1);
                }
            }
            try (PreparedStatement stmt = connection.prepareStatement(
                    "INSERT INTO compression_segments (device_id, segment_id, created_at) VALUES (?, ?, ?)")) {
                stmt.setString(1, deviceId);
                stmt.setLong(2, segmentId);
                stmt.setLong(3, System.currentTimeMillis());
                stmt.executeUpdate();
            }
            nextSequence.put(sequenceKey(deviceId, segmentId), new AtomicLong(0));
            log.debug("Segment {} opened for device '{}'.", segmentId, deviceId);
            return segmentId;
        } catch (SQLException e) {
            log.error("Failed to open segment for device '{}': {}", deviceId, e.getMessage(), e);
            throw new IllegalStateException("Failed to open segment", e);
        }
    }

    @Override
    public synchronized void append(String deviceId, long segmentId, CompressedRecord record) {
        AtomicLong sequence = nextSequence.get(sequenceKey(deviceId, segmentId));
        if (sequence == null) {
            throw new IllegalStateException("Segment " + segmentId + " of device '" + deviceId + "' is not open");
        }
        try (PreparedStatement stmt = connection.prepareStatement(
                "INSERT INTO compressed_data_optimized (device_id, segment_id, seq, record_type, slot_index, "
                        + "window_start, window_end, payload) VALUES (?, ?, ?, ?, ?, ?, ?, ?)")) {
            stmt.setString(1, deviceId);
            stmt.setLong(2, segmentId);
            stmt.setLong(3, sequence.get());
            stmt.setInt(4, record.getType().getCode());
            stmt.setInt(5, record.getSlotIndex());
            stmt.setLong(6, record.getWindowStartTimestamp());
            stmt.setLong(7, record.getWindowEndTimestamp());
            stmt.setBytes(8, RecordCodec.encode(record));
            stmt.executeUpdate();
            sequence.incrementAndGet();
        } catch (SQLException e) {
            log.error("Failed to append record {} of device '{}' segment {}: {}",
                    sequence.get(), deviceId, segmentId, e.getMessage(), e);
            throw new IllegalStateException("Failed to append compressed record", e);
        }
    }

    @Override
    public synchronized List<Long> listSegments(String deviceId) {
        List<Long> segments = new ArrayList<>();
        try (PreparedStatement stmt = connection.prepareStatement(
                "SELECT segment_id FROM compression_segments WHERE device_id = ? ORDER BY segment_id ASC")) {
            stmt.setString(1, deviceId);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    segments.add(rs.getLong(1));
                }
            }
        } catch (SQLException e) {
            log.error("Failed to list segments of device '{}': {}", deviceId, e.getMessage(), e);
            throw new IllegalStateException("Failed to list segments", e);
        }
        return segments;
    }

    @Override
    public synchronized OptionalLong lastWindowEnd(String deviceId) {
        try (PreparedStatement stmt = connection.prepareStatement(
                "SELECT MAX(window_end) FROM compressed_data_optimized WHERE device_id = ?")) {
            stmt.setString(1, deviceId);
            try (ResultSet rs = stmt.executeQuery()) {
                rs.next();
                long end = rs.getLong(1);
                return rs.wasNull() ? OptionalLong.empty() : OptionalLong.of(end);
            }
        } catch (SQLException e) {
            log.error("Failed to read last window end of device '{}': {}", deviceId, e.getMessage(), e);
            throw new IllegalStateException("Failed to read last window end", e);
        }
    }

    @Override
    public synchronized List<Long> findSegments(String deviceId, long fromInclusive, long toExclusive) {
        List<Long> segments = new ArrayList<>();
        try (PreparedStatement stmt = connection.prepareStatement(
                "SELECT DISTINCT segment_id FROM compressed_data_optimized "
                        + "WHERE device_id = ? AND window_start < ? AND window_end >= ? ORDER BY segment_id ASC")) {
            stmt.setString(1, deviceId);
            stmt.setLong(2, toExclusive);
            stmt.setLong(3, fromInclusive);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    segments.add(rs.getLong(1));
                }
            }
        } catch (SQLException e) {
            log.error("Failed to find segments of device '{}' in [{}, {}): {}",
                    deviceId, fromInclusive, toExclusive, e.getMessage(), e);
            throw new IllegalStateException("Failed to find segments", e);
        }
        return segments;
    }

    @Override
    public Iterable<CompressedRecord> readRecords(String deviceId, long segmentId) {
        return () -> new RecordPageIterator(deviceId, segmentId);
    }

    /**
     * 统计设备已保存的压缩记录数
     */
    public synchronized long countRecords(String deviceId) {
        try (PreparedStatement stmt = connection.prepareStatement(
                "SELECT COUNT(*) FROM compressed_data_optimized WHERE device_id = ?")) {
            stmt.setString(1, deviceId);
            try (ResultSet rs = stmt.executeQuery()) {
                rs.next();
                return rs.getLong(1);
            }
        } catch (SQLException e) {
            log.error("Failed to count records of device '{}': {}", deviceId, e.getMessage(), e);
            throw new IllegalStateException("Failed to count records", e);
        }
    }

    // ==================== 分页读取 ====================

    private synchronized List<Sample> loadSamplePage(String deviceId, long fromInclusive, long toExclusive) {
        List<Sample> page = new ArrayList<>(pageSize);
        try (PreparedStatement stmt = connection.prepareStatement(
                "SELECT timestamp, sample_values FROM original_samples "
                        + "WHERE device_id = ? AND timestamp >= ? AND timestamp < ? "
                        + "ORDER BY timestamp ASC LIMIT ?")) {
            stmt.setString(1, deviceId);
            stmt.setLong(2, fromInclusive);
            stmt.setLong(3, toExclusive);
            stmt.setInt(4, pageSize);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    page.add(new Sample(deviceId, rs.getLong(1), RecordCodec.decodeValues(rs.getBytes(2))));
                }
            }
        } catch (SQLException e) {
            log.error("Failed to read samples of device '{}': {}", deviceId, e.getMessage(), e);
            throw new IllegalStateException("Failed to read samples", e);
        }
        return page;
    }

    private synchronized List<CompressedRecord> loadRecordPage(String deviceId, long segmentId, long fromSeq) {
        List<CompressedRecord> page = new ArrayList<>(pageSize);
        try (PreparedStatement stmt = connection.prepareStatement(
                "SELECT seq, payload FROM compressed_data_optimized "
                        + "WHERE device_id = ? AND segment_id = ? AND seq >= ? ORDER BY seq ASC LIMIT ?")) {
            stmt.setString(1, deviceId);
            stmt.setLong(2, segmentId);
            stmt.setLong(3, fromSeq);
            stmt.setInt(4, pageSize);
            try (ResultSet rs = stmt.executeQuery()) {
                long expected = fromSeq;
                while (rs.next()) {
                    long seq = rs.getLong(1);
                    if (seq != expected) {
                        throw new RecordStreamCorruptedException(deviceId, expected,
                                "Missing record in segment " + segmentId + ", next stored sequence is " + seq);
                    }
                    page.add(decodeRecord(deviceId, seq, rs.getBytes(2)));
                    expected++;
                }
            }
        } catch (SQLException e) {
            log.error("Failed to read records of device '{}' segment {}: {}",
                    deviceId, segmentId, e.getMessage(), e);
            throw new IllegalStateException("Failed to read compressed records", e);
        }
        return page;
    }

    private static CompressedRecord decodeRecord(String deviceId, long seq, byte[] payload) {
        try {
            return RecordCodec.decode(payload);
        } catch (IllegalArgumentException e) {
            throw new RecordStreamCorruptedException(deviceId, seq, "Undecodable record payload", e);
        }
    }

    /**
     * 按时间戳分页迭代原始采样
     */
    private class SamplePageIterator implements Iterator<Sample> {
        private final String deviceId;
        private final long toExclusive;
        private long nextFrom;
        private List<Sample> page = List.of();
        private int position;
        private boolean exhausted;

        SamplePageIterator(String deviceId, long fromInclusive, long toExclusive) {
            this.deviceId = deviceId;
            this.nextFrom = fromInclusive;
            this.toExclusive = toExclusive;
        }

        @Override
        public boolean hasNext() {
            if (position < page.size()) {
                return true;
            }
            if (exhausted) {
                return false;
            }
            page = loadSamplePage(deviceId, nextFrom, toExclusive);
            position = 0;
            if (page.size() < pageSize) {
                exhausted = true;
            }
            if (!page.isEmpty()) {
                long last = page.get(page.size() - 1).getTimestamp();
                if (last == Long.MAX_VALUE) {
                    exhausted = true;
                } else {
                    nextFrom = last + 1;
                }
            }
            return !page.isEmpty();
        }

        @Override
        public Sample next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return page.get(position++);
        }
    }

    /**
     * 按序号分页迭代一个分段的压缩记录
     */
    private class RecordPageIterator implements Iterator<CompressedRecord> {
        private final String deviceId;
        private final long segmentId;
        private long nextSeq;
        private List<CompressedRecord> page = List.of();
        private int position;
        private boolean exhausted;

        RecordPageIterator(String deviceId, long segmentId) {
            this.deviceId = deviceId;
            this.segmentId = segmentId;
        }

        @Override
        public boolean hasNext() {
            if (position < page.size()) {
                return true;
            }
            if (exhausted) {
                return false;
            }
            page = loadRecordPage(deviceId, segmentId, nextSeq);
            position = 0;
            nextSeq += page.size();
            if (page.size() < pageSize) {
                exhausted = true;
            }
            return !page.isEmpty();
        }

        @Override
        public CompressedRecord next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return page.get(position++);
        }
    }

    // ==================== 内部工具方法 ====================

    private Connection openDatabase() {
        String dbPath = storageRoot + File.separator + DB_FILE;
        try {
            Connection conn = DriverManager.getConnection("jdbc:sqlite:" + dbPath);
            conn.setAutoCommit(true);

            // 启用WAL模式
            try (Statement stmt = conn.createStatement()) {
                stmt.execute("PRAGMA journal_mode=WAL");
                stmt.execute("PRAGMA synchronous=NORMAL");
                stmt.execute("PRAGMA cache_size=10000");
            }

            try (Statement stmt = conn.createStatement()) {
                stmt.execute("CREATE TABLE IF NOT EXISTS original_samples ("
                        + "device_id TEXT NOT NULL, "
                        + "timestamp INTEGER NOT NULL, "
                        + "sample_values BLOB NOT NULL, "
                        + "PRIMARY KEY (device_id, timestamp))");
                stmt.execute("CREATE TABLE IF NOT EXISTS compression_segments ("
                        + "device_id TEXT NOT NULL, "
                        + "segment_id INTEGER NOT NULL, "
                        + "created_at INTEGER NOT NULL, "
                        + "PRIMARY KEY (device_id, segment_id))");
                stmt.execute("CREATE TABLE IF NOT EXISTS compressed_data_optimized ("
                        + "device_id TEXT NOT NULL, "
                        + "segment_id INTEGER NOT NULL, "
                        + "seq INTEGER NOT NULL, "
                        + "record_type INTEGER NOT NULL, "
                        + "slot_index INTEGER NOT NULL, "
                        + "window_start INTEGER NOT NULL, "
                        + "window_end INTEGER NOT NULL, "
                        + "payload BLOB NOT NULL, "
                        + "PRIMARY KEY (device_id, segment_id, seq))");
                stmt.execute("CREATE INDEX IF NOT EXISTS idx_compressed_data_optimized_window "
                        + "ON compressed_data_optimized (device_id, window_start)");
            }

            log.info("Telemetry database initialized at: {}", dbPath);
            return conn;
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to initialize telemetry database at " + dbPath, e);
        }
    }

    private static void bindSample(PreparedStatement stmt, Sample sample) throws SQLException {
        stmt.setString(1, sample.getDeviceId());
        stmt.setLong(2, sample.getTimestamp());
        stmt.setBytes(3, RecordCodec.encodeValues(sample.getValues()));
    }

    private void rollbackQuietly() {
        try {
            connection.rollback();
        } catch (SQLException e) {
            log.warn("Rollback failed: {}", e.getMessage());
        }
    }

    private void restoreAutoCommit() {
        try {
            connection.setAutoCommit(true);
        } catch (SQLException e) {
            log.warn("Failed to restore auto-commit: {}", e.getMessage());
        }
    }

    private static String sequenceKey(String deviceId, long segmentId) {
        return deviceId + "#" + segmentId;
    }

    /** 关闭连接 */
    public synchronized void shutdown() {
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("Failed to close telemetry database: {}", e.getMessage());
        }
        nextSequence.clear();
        log.info("SQLiteTelemetryStorage shut down.");
    }
}
