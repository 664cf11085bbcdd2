package com.leadgen.instrument.model;

/**
 * 进程内存快照。
 *
 * @param residentMB        常驻内存（RSS）
 * @param virtualMB         虚拟内存
 * @param percentOfSystem   RSS占系统物理内存的百分比
 * @param systemAvailableMB 系统可用内存
 */
public record MemorySnapshot(
        double residentMB,
        double virtualMB,
        double percentOfSystem,
        double systemAvailableMB
) {
}
