package com.qubi.sentinel.core.spi;

import com.qubi.sentinel.core.model.MetricSample;

@FunctionalInterface
public interface SampleListener {
    void onSample(MetricSample sample);
}
