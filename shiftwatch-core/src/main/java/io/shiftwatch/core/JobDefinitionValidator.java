package io.shiftwatch.core;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Checks a {@link JobDefinition} before anything is scheduled or stored.
 */
public final class JobDefinitionValidator {

    static final Pattern NAME_PATTERN = Pattern.compile("^[a-zA-Z0-9_]+_[a-zA-Z0-9_]+_[a-zA-Z0-9_]+$");
    static final int NAME_MIN = 3;
    static final int NAME_MAX = 30;
    static final int DESCRIPTION_MIN = 3;
    static final int DESCRIPTION_MAX = 100;

    private JobDefinitionValidator() {
    }

    /**
     * @param supportedTypes sensor types that have a registered reader
     * @throws InvalidJobException listing every violation found
     */
    public static void validate(JobDefinition def, Predicate<SensorType> supportedTypes) {
        List<String> problems = violations(def, supportedTypes);
        if (!problems.isEmpty()) {
            throw new InvalidJobException(problems);
        }
    }

    public static List<String> violations(JobDefinition def, Predicate<SensorType> supportedTypes) {
        List<String> problems = new ArrayList<>();
        if (def == null) {
            problems.add("job definition must not be null");
            return problems;
        }

        String name = def.name();
        if (name == null || name.length() < NAME_MIN || name.length() > NAME_MAX) {
            problems.add("name must be " + NAME_MIN + ".." + NAME_MAX + " characters");
        } else if (!NAME_PATTERN.matcher(name).matches()) {
            problems.add("name must look like part_part_part (letters, digits, underscores): " + name);
        }

        String description = def.description();
        if (description == null || description.length() < DESCRIPTION_MIN || description.length() > DESCRIPTION_MAX) {
            problems.add("description must be " + DESCRIPTION_MIN + ".." + DESCRIPTION_MAX + " characters");
        }

        if (def.trigger() == null) {
            problems.add("trigger must be set");
        } else {
            problems.addAll(def.trigger().violations());
        }

        if (def.sensors().isEmpty()) {
            problems.add("at least one sensor must be set");
        }
        for (SensorRef sensor : def.sensors()) {
            if (!supportedTypes.test(sensor.type())) {
                problems.add("no reader available for sensor type " + sensor.type() + ": " + sensor.id());
            }
        }

        if (def.diffField() && def.multipleSensors() && !def.summation()) {
            problems.add("if diff_field is true, summation must be true when there are multiple sensors");
        }
        if (def.shiftReport() && !def.tgSend()) {
            problems.add("notifications must be enabled for shift reports");
        }
        return problems;
    }
}
