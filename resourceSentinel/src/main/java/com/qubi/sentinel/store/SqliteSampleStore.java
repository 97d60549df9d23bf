package com.qubi.sentinel.store;

import com.qubi.sentinel.config.AppConfig;
import com.qubi.sentinel.core.errors.OrderingException;
import com.qubi.sentinel.core.errors.StoreException;
import com.qubi.sentinel.core.errors.ValidationException;
import com.qubi.sentinel.core.model.MetricSample;
import com.qubi.sentinel.core.spi.SampleStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Serie temporal sobre una tabla SQLite en modo WAL.
 *
 * <p>Una sola conexión de escritura, serializada por {@link #writeLock}. Cada lectura abre su
 * propia conexión: en WAL cada lector ve un snapshot commiteado, nunca una fila a medias.
 * Timestamps en epoch millis UTC.
 */
public class SqliteSampleStore implements SampleStore {
    private static final Logger log = LoggerFactory.getLogger(SqliteSampleStore.class);

    private final String url;
    private final String table;
    private final Connection writer;
    private final ReentrantLock writeLock = new ReentrantLock();

    // watermark de orden, restaurado de la tabla al abrir
    private volatile Instant lastTimestamp;
    private volatile boolean closed;

    private final String insertSql;
    private final String rangeSql;
    private final String latestSql;
    private final String countSql;

    private SqliteSampleStore(Path file, String table) {
        this.url = "jdbc:sqlite:" + file.toAbsolutePath();
        this.table = table;
        this.insertSql = "INSERT INTO " + table
                + " (timestamp, cpu_percent, mem_percent, disk_percent) VALUES (?, ?, ?, ?)";
        this.rangeSql = "SELECT timestamp, cpu_percent, mem_percent, disk_percent FROM " + table
                + " WHERE timestamp >= ? AND timestamp <= ? ORDER BY timestamp, id";
        this.latestSql = "SELECT timestamp, cpu_percent, mem_percent, disk_percent FROM " + table
                + " ORDER BY timestamp DESC, id DESC LIMIT ?";
        this.countSql = "SELECT COUNT(*) FROM " + table;
        try {
            this.writer = DriverManager.getConnection(url);
        } catch (SQLException e) {
            throw new StoreException("cannot open store at " + file, e);
        }
    }

    public static SqliteSampleStore open(AppConfig.StoreConfig cfg) {
        return open(Path.of(cfg.path), cfg.table);
    }

    /**
     * Abre (o crea) el store. Corre {@code PRAGMA quick_check}: cualquier resultado distinto
     * de {@code ok} es corrupción y se lanza {@link StoreException}.
     */
    public static SqliteSampleStore open(Path file, String table) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
        } catch (IOException e) {
            throw new StoreException("cannot create store directory for " + file, e);
        }
        SqliteSampleStore store = new SqliteSampleStore(file, table);
        try {
            store.initialize();
        } catch (RuntimeException e) {
            store.close();
            throw e;
        }
        log.info("[open] store {} table={} samples={} last={}", file, table, store.count(), store.lastTimestamp);
        return store;
    }

    private void initialize() {
        try (Statement st = writer.createStatement()) {
            try (ResultSet rs = st.executeQuery("PRAGMA quick_check")) {
                String result = rs.next() ? rs.getString(1) : null;
                if (!"ok".equalsIgnoreCase(result))
                    throw new StoreException("store integrity check failed: " + result);
            }
            st.execute("PRAGMA journal_mode=WAL");
            // FULL: en WAL, NORMAL puede perder los últimos commits ante un crash del SO
            st.execute("PRAGMA synchronous=FULL");
            st.execute("CREATE TABLE IF NOT EXISTS " + table + " ("
                    + "id INTEGER PRIMARY KEY AUTOINCREMENT, "
                    + "timestamp INTEGER NOT NULL, "
                    + "cpu_percent REAL NOT NULL, "
                    + "mem_percent REAL NOT NULL, "
                    + "disk_percent REAL NOT NULL)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_" + table + "_timestamp ON " + table + " (timestamp)");
            try (ResultSet rs = st.executeQuery("SELECT MAX(timestamp) FROM " + table)) {
                if (rs.next()) {
                    long max = rs.getLong(1);
                    if (!rs.wasNull()) lastTimestamp = Instant.ofEpochMilli(max);
                }
            }
        } catch (SQLException e) {
            throw new StoreException("cannot initialize store " + url, e);
        }
    }

    // --- Escritura

    @Override
    public void append(MetricSample sample) throws ValidationException, OrderingException {
        validate(sample);
        writeLock.lock();
        try {
            ensureOpen();
            Instant last = lastTimestamp;
            if (last != null && sample.timestamp().isBefore(last))
                throw new OrderingException(sample.timestamp(), last);

            try (PreparedStatement ps = writer.prepareStatement(insertSql)) {
                ps.setLong(1, sample.timestamp().toEpochMilli());
                ps.setDouble(2, sample.cpuPercent());
                ps.setDouble(3, sample.memPercent());
                ps.setDouble(4, sample.diskPercent());
                ps.executeUpdate(); // autocommit: la fila es atómica para los lectores
            } catch (SQLException e) {
                throw new StoreException("append failed at " + sample.timestamp(), e);
            }
            lastTimestamp = sample.timestamp();
        } finally {
            writeLock.unlock();
        }
    }

    static void validate(MetricSample s) throws ValidationException {
        check(MetricSample.CPU, s.cpuPercent());
        check(MetricSample.MEM, s.memPercent());
        check(MetricSample.DISK, s.diskPercent());
    }

    private static void check(String field, double v) throws ValidationException {
        if (!Double.isFinite(v) || v < 0.0 || v > 100.0) throw new ValidationException(field, v);
    }

    // --- Lectura

    @Override
    public List<MetricSample> query(Instant start, Instant end) {
        if (start.isAfter(end)) return List.of();
        return read(rangeSql, ps -> {
            ps.setLong(1, start.toEpochMilli());
            ps.setLong(2, end.toEpochMilli());
        });
    }

    @Override
    public List<MetricSample> latest(int limit) {
        if (limit <= 0) return List.of();
        List<MetricSample> out = new ArrayList<>(read(latestSql, ps -> ps.setInt(1, limit)));
        Collections.reverse(out);
        return out;
    }

    @Override
    public long count() {
        ensureOpen();
        try (Connection c = DriverManager.getConnection(url);
             Statement st = c.createStatement();
             ResultSet rs = st.executeQuery(countSql)) {
            return rs.next() ? rs.getLong(1) : 0L;
        } catch (SQLException e) {
            throw new StoreException("count failed", e);
        }
    }

    @Override
    public Optional<Instant> lastTimestamp() {
        return Optional.ofNullable(lastTimestamp);
    }

    private interface Binder { void bind(PreparedStatement ps) throws SQLException; }

    private List<MetricSample> read(String sql, Binder binder) {
        ensureOpen();
        try (Connection c = DriverManager.getConnection(url);
             PreparedStatement ps = c.prepareStatement(sql)) {
            binder.bind(ps);
            List<MetricSample> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new MetricSample(
                            Instant.ofEpochMilli(rs.getLong(1)),
                            rs.getDouble(2),
                            rs.getDouble(3),
                            rs.getDouble(4)));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new StoreException("read failed on " + table, e);
        }
    }

    /** Nivel de {@code PRAGMA synchronous} de la conexión writer (2 = FULL). */
    int synchronousLevel() {
        writeLock.lock();
        try {
            ensureOpen();
            try (Statement st = writer.createStatement();
                 ResultSet rs = st.executeQuery("PRAGMA synchronous")) {
                return rs.next() ? rs.getInt(1) : -1;
            }
        } catch (SQLException e) {
            throw new StoreException("cannot read synchronous mode", e);
        } finally {
            writeLock.unlock();
        }
    }

    private void ensureOpen() {
        if (closed) throw new StoreException("store is closed");
    }

    @Override
    public void close() {
        writeLock.lock();
        try {
            if (closed) return;
            closed = true;
            writer.close();
            log.info("[close] store {}", url);
        } catch (SQLException e) {
            log.warn("[close] error closing store {}: {}", url, e.toString());
        } finally {
            writeLock.unlock();
        }
    }
}
