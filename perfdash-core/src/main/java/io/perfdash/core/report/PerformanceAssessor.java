package io.perfdash.core.report;

import io.perfdash.api.report.Assessment;
import io.perfdash.api.report.AssessmentLevel;
import io.perfdash.api.stats.SummaryStatistics;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turns mean readings into verdicts using the collector's long-standing thresholds.
 * An area whose metric has no data gets no verdict.
 */
public class PerformanceAssessor {

    private static final double KB_PER_MB = 1024.0;

    public List<Assessment> assess(Map<String, SummaryStatistics> byMetric) {
        List<Assessment> assessments = new ArrayList<>();

        SummaryStatistics memory = byMetric.get("memory_total");
        if (memory != null) {
            double mb = memory.mean() / KB_PER_MB;
            assessments.add(grade("memory", "memory_total", mb, "MB", 500, 200,
                    "Memory usage is high, consider reducing the app's footprint",
                    "Memory usage is normal",
                    "Memory usage is good"));
        }

        SummaryStatistics cpu = byMetric.get("cpu_percentage");
        if (cpu != null) {
            assessments.add(grade("cpu", "cpu_percentage", cpu.mean(), "%", 30, 15,
                    "CPU usage is high, look for CPU-heavy work",
                    "CPU usage is normal",
                    "CPU usage is good"));
        }

        SummaryStatistics janky = byMetric.get("janky_percent");
        if (janky != null) {
            assessments.add(grade("smoothness", "janky_percent", janky.mean(), "%", 20, 10,
                    "Severe jank, rendering performance needs work",
                    "Slight jank, rendering could be optimised",
                    "Rendering is smooth"));
        }

        SummaryStatistics temperature = byMetric.get("battery_temperature");
        if (temperature != null) {
            assessments.add(grade("temperature", "battery_temperature", temperature.mean(), "°C", 40, 35,
                    "Device runs hot, the app may be causing heavy heating",
                    "Device runs warm but within an acceptable range",
                    "Device temperature is normal"));
        }

        return assessments;
    }

    private static Assessment grade(String area, String metricId, double value, String unit,
                                    double highAbove, double normalAbove,
                                    String high, String normal, String good) {
        if (value > highAbove) {
            return new Assessment(area, metricId, value, unit, AssessmentLevel.HIGH, high);
        }
        if (value > normalAbove) {
            return new Assessment(area, metricId, value, unit, AssessmentLevel.NORMAL, normal);
        }
        return new Assessment(area, metricId, value, unit, AssessmentLevel.GOOD, good);
    }
}
