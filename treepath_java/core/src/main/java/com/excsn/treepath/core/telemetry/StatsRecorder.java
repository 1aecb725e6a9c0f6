package com.excsn.treepath.core.telemetry;

import java.time.Duration;
import java.util.Map;

public interface StatsRecorder {

  StatsRecorder NOOP = new StatsRecorder() {
    @Override
    public void recordCounterIncrement(Map<String, Object> tags, String name) {
    }

    @Override
    public void recordTimer(Map<String, Object> tags, String name, Duration value) {
    }

    @Override
    public void recordGauge(Map<String, Object> tags, String name, Number value) {
    }
  };

  Map<String, Object> GROUP_TAGS = Map.of("group", "treepath");

  void recordCounterIncrement(Map<String, Object> tags, String name);
  void recordTimer(Map<String, Object> tags, String name, Duration value);
  void recordGauge(Map<String, Object> tags, String name, Number value);
}
