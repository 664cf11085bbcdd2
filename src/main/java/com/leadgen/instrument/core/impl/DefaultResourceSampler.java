package com.leadgen.instrument.core.impl;

import com.leadgen.instrument.core.ResourceSampler;
import com.leadgen.instrument.core.SamplingException;
import com.leadgen.instrument.model.CpuSnapshot;
import com.leadgen.instrument.model.MemorySnapshot;
import com.sun.management.OperatingSystemMXBean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 资源采样器默认实现。
 *
 * Linux 上优先读取 /proc（VmRSS、VmSize、/proc/stat、/proc/loadavg、/proc/meminfo），
 * 其他平台退回到 {@link OperatingSystemMXBean} 与 {@link MemoryMXBean}。
 */
public class DefaultResourceSampler implements ResourceSampler {

    private static final Logger log = LoggerFactory.getLogger(DefaultResourceSampler.class);

    private static final double BYTES_PER_MB = 1024.0 * 1024.0;
    private static final double KB_PER_MB = 1024.0;

    private final Path procRoot;
    /** 非 HotSpot 兼容 JVM 上可能为null */
    private final OperatingSystemMXBean osBean;
    private final MemoryMXBean memoryBean;

    public DefaultResourceSampler() {
        this(Path.of("/proc"), platformOsBean());
    }

    public DefaultResourceSampler(Path procRoot, OperatingSystemMXBean osBean) {
        this.procRoot = procRoot;
        this.osBean = osBean;
        this.memoryBean = ManagementFactory.getMemoryMXBean();
        log.debug("ResourceSampler initialized. procfs: {}, osBean: {}",
                Files.isReadable(procRoot.resolve("self/status")), osBean != null);
    }

    // ==================== 内存 ====================

    @Override
    public MemorySnapshot memorySnapshot() throws SamplingException {
        Path status = procRoot.resolve("self/status");
        double residentMB;
        double virtualMB;
        if (Files.isReadable(status)) {
            List<String> lines = readLines(status);
            residentMB = kbField(lines, "VmRSS:", status) / KB_PER_MB;
            virtualMB = kbField(lines, "VmSize:", status) / KB_PER_MB;
        } else if (osBean != null) {
            // 无procfs时以JVM已提交内存近似常驻内存
            residentMB = (memoryBean.getHeapMemoryUsage().getCommitted()
                    + memoryBean.getNonHeapMemoryUsage().getCommitted()) / BYTES_PER_MB;
            virtualMB = osBean.getCommittedVirtualMemorySize() / BYTES_PER_MB;
        } else {
            throw new SamplingException("No process memory counters available on this platform");
        }

        double totalMB;
        double availableMB;
        Path meminfo = procRoot.resolve("meminfo");
        if (Files.isReadable(meminfo)) {
            List<String> lines = readLines(meminfo);
            totalMB = kbField(lines, "MemTotal:", meminfo) / KB_PER_MB;
            availableMB = kbField(lines, "MemAvailable:", meminfo) / KB_PER_MB;
        } else if (osBean != null) {
            totalMB = osBean.getTotalMemorySize() / BYTES_PER_MB;
            availableMB = osBean.getFreeMemorySize() / BYTES_PER_MB;
        } else {
            throw new SamplingException("No system memory counters available on this platform");
        }

        double percent = totalMB > 0 ? residentMB / totalMB * 100.0 : 0.0;
        return new MemorySnapshot(residentMB, virtualMB, percent, availableMB);
    }

    // ==================== CPU ====================

    @Override
    public CpuSnapshot cpuSnapshot(Duration interval) throws SamplingException {
        if (interval == null || interval.isNegative()) {
            throw new IllegalArgumentException("CPU sample interval must be non-negative, got: " + interval);
        }
        Path stat = procRoot.resolve("stat");
        if (Files.isReadable(stat)) {
            List<long[]> before = readCpuTimes(stat);
            sleep(interval);
            List<long[]> after = readCpuTimes(stat);
            if (before.size() != after.size()) {
                throw new SamplingException("CPU count changed while sampling " + stat);
            }
            double total = busyPercent(before.get(0), after.get(0));
            double[] perCore = new double[before.size() - 1];
            for (int i = 1; i < before.size(); i++) {
                perCore[i - 1] = busyPercent(before.get(i), after.get(i));
            }
            return new CpuSnapshot(total, perCore, loadAverage());
        }

        if (osBean == null) {
            throw new SamplingException("No CPU counters available on this platform");
        }
        sleep(interval);
        double load = osBean.getCpuLoad();
        if (load < 0) {
            throw new SamplingException("System CPU load is not available");
        }
        double[] perCore = new double[osBean.getAvailableProcessors()];
        // MXBean 不提供分核数据，各核以整体使用率填充
        Arrays.fill(perCore, load * 100.0);
        return new CpuSnapshot(load * 100.0, perCore, loadAverage());
    }

    @Override
    public double processCpuPercent() throws SamplingException {
        if (osBean == null) {
            throw new SamplingException("Process CPU load is not available on this JVM");
        }
        double load = osBean.getProcessCpuLoad();
        if (load < 0) {
            throw new SamplingException("Process CPU load is not available yet");
        }
        return load * 100.0;
    }

    // ==================== 内部方法 ====================

    private double[] loadAverage() throws SamplingException {
        Path loadavg = procRoot.resolve("loadavg");
        if (Files.isReadable(loadavg)) {
            List<String> lines = readLines(loadavg);
            String[] parts = lines.isEmpty() ? new String[0] : lines.get(0).trim().split("\\s+");
            if (parts.length < 3) {
                throw new SamplingException("Malformed " + loadavg);
            }
            try {
                return new double[]{
                        Double.parseDouble(parts[0]),
                        Double.parseDouble(parts[1]),
                        Double.parseDouble(parts[2])
                };
            } catch (NumberFormatException e) {
                throw new SamplingException("Malformed " + loadavg, e);
            }
        }
        double oneMinute = osBean != null ? osBean.getSystemLoadAverage() : -1;
        // MXBean只提供1分钟负载，5/15分钟补0；平台不支持负载均值时全部为0
        return oneMinute < 0 ? new double[3] : new double[]{oneMinute, 0.0, 0.0};
    }

    /**
     * 读取 /proc/stat 中的 cpu 行，第一个元素为汇总行，其余为各核。
     * 每个数组为 {busy, total} 两个jiffies计数。
     */
    private List<long[]> readCpuTimes(Path stat) throws SamplingException {
        List<long[]> result = new ArrayList<>();
        for (String line : readLines(stat)) {
            if (!line.startsWith("cpu")) {
                continue;
            }
            String[] parts = line.trim().split("\\s+");
            if (parts.length < 5) {
                throw new SamplingException("Malformed cpu line in " + stat + ": " + line);
            }
            long total = 0;
            long idle = 0;
            try {
                for (int i = 1; i < parts.length; i++) {
                    long value = Long.parseLong(parts[i]);
                    total += value;
                    // idle + iowait
                    if (i == 4 || i == 5) {
                        idle += value;
                    }
                }
            } catch (NumberFormatException e) {
                throw new SamplingException("Malformed cpu line in " + stat + ": " + line, e);
            }
            result.add(new long[]{total - idle, total});
        }
        if (result.isEmpty()) {
            throw new SamplingException("No cpu lines found in " + stat);
        }
        return result;
    }

    private static double busyPercent(long[] before, long[] after) {
        long totalDelta = after[1] - before[1];
        if (totalDelta <= 0) {
            return 0.0;
        }
        long busyDelta = after[0] - before[0];
        return Math.max(0.0, Math.min(100.0, busyDelta * 100.0 / totalDelta));
    }

    private static double kbField(List<String> lines, String prefix, Path source) throws SamplingException {
        for (String line : lines) {
            if (line.startsWith(prefix)) {
                String[] parts = line.substring(prefix.length()).trim().split("\\s+");
                try {
                    return Double.parseDouble(parts[0]);
                } catch (NumberFormatException e) {
                    throw new SamplingException("Malformed field '" + prefix + "' in " + source, e);
                }
            }
        }
        throw new SamplingException("Field '" + prefix + "' not found in " + source);
    }

    private static List<String> readLines(Path path) throws SamplingException {
        try {
            return Files.readAllLines(path);
        } catch (IOException e) {
            throw new SamplingException("Failed to read " + path + ": " + e.getMessage(), e);
        }
    }

    private static void sleep(Duration interval) throws SamplingException {
        try {
            Thread.sleep(interval.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SamplingException("Interrupted while sampling CPU usage", e);
        }
    }

    private static OperatingSystemMXBean platformOsBean() {
        java.lang.management.OperatingSystemMXBean bean = ManagementFactory.getOperatingSystemMXBean();
        return bean instanceof OperatingSystemMXBean ? (OperatingSystemMXBean) bean : null;
    }
}
