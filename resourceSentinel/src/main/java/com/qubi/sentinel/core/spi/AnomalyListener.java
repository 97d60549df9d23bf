package com.qubi.sentinel.core.spi;

import com.qubi.sentinel.core.model.AnomalyScore;
import com.qubi.sentinel.core.model.MetricSample;

@FunctionalInterface
public interface AnomalyListener {
    void onAnomaly(MetricSample sample, AnomalyScore score);
}
