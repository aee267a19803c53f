package io.shiftwatch.core;

/**
 * A sensor value with its display title and unit of measure.
 */
public record TitledValue(String title, double value, String metricUnit) {
}
