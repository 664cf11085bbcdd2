package com.leadgen.instrument.core.impl;

import com.leadgen.instrument.core.MemoryReclaimer;
import com.leadgen.instrument.core.ResourceSampler;
import com.leadgen.instrument.core.SamplingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 通过 {@link System#gc()} 发出回收提示，并用常驻内存差值估算释放量。
 */
public class GcMemoryReclaimer implements MemoryReclaimer {

    private static final Logger log = LoggerFactory.getLogger(GcMemoryReclaimer.class);

    private final ResourceSampler sampler;

    public GcMemoryReclaimer(ResourceSampler sampler) {
        this.sampler = sampler;
    }

    @Override
    public double reclaim() {
        double before;
        try {
            before = sampler.memorySnapshot().residentMB();
        } catch (SamplingException e) {
            log.warn("Failed to measure memory before reclamation hint: {}", e.getMessage());
            System.gc();
            return 0.0;
        }

        System.gc();

        try {
            double after = sampler.memorySnapshot().residentMB();
            log.debug("Reclamation hint issued, RSS {}MB -> {}MB",
                    String.format("%.1f", before), String.format("%.1f", after));
            return before - after;
        } catch (SamplingException e) {
            log.warn("Failed to measure memory after reclamation hint: {}", e.getMessage());
            return 0.0;
        }
    }
}
