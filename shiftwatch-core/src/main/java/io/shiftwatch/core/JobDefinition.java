package io.shiftwatch.core;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Request to create a monitoring job, as received from the configuration surface.
 *
 * <p>Sensors are kept in input order with duplicates removed.
 */
public record JobDefinition(
        String name,
        String description,
        Trigger trigger,
        List<SensorRef> sensors,
        String chat,
        boolean diffField,
        boolean tgSend,
        boolean summation,
        boolean speedInfo,
        boolean shiftReport
) {

    public JobDefinition {
        sensors = sensors == null ? List.of() : List.copyOf(new LinkedHashSet<>(sensors));
    }

    public boolean multipleSensors() {
        return sensors.size() > 1;
    }

    public FunctionKind kind() {
        return diffField ? FunctionKind.CUMULATIVE : FunctionKind.SIMPLE;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static final class Builder {
        private final String name;
        private String description;
        private Trigger trigger;
        private final List<SensorRef> sensors = new ArrayList<>();
        private String chat;
        private boolean diffField;
        private boolean tgSend = true;
        private boolean summation;
        private boolean speedInfo;
        private boolean shiftReport;

        private Builder(String name) {
            this.name = name;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder trigger(Trigger trigger) {
            this.trigger = trigger;
            return this;
        }

        public Builder sensor(SensorType type, String id) {
            this.sensors.add(new SensorRef(id, type));
            return this;
        }

        public Builder chat(String chat) {
            this.chat = chat;
            return this;
        }

        public Builder diffField(boolean diffField) {
            this.diffField = diffField;
            return this;
        }

        public Builder tgSend(boolean tgSend) {
            this.tgSend = tgSend;
            return this;
        }

        public Builder summation(boolean summation) {
            this.summation = summation;
            return this;
        }

        public Builder speedInfo(boolean speedInfo) {
            this.speedInfo = speedInfo;
            return this;
        }

        public Builder shiftReport(boolean shiftReport) {
            this.shiftReport = shiftReport;
            return this;
        }

        public JobDefinition build() {
            return new JobDefinition(name, description, trigger, sensors, chat,
                    diffField, tgSend, summation, speedInfo, shiftReport);
        }
    }
}
