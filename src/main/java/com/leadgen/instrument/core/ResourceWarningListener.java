package com.leadgen.instrument.core;

import com.leadgen.instrument.model.ResourceWarning;

/**
 * 资源告警观察者。
 */
@FunctionalInterface
public interface ResourceWarningListener {

    void onWarning(ResourceWarning warning);
}
