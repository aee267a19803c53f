package io.shiftwatch.report;

import io.shiftwatch.core.SampleRecord;
import io.shiftwatch.core.SnapshotSample;
import io.shiftwatch.core.TitledValue;
import io.shiftwatch.idle.IdleAlert;
import io.shiftwatch.shift.Shift;
import io.shiftwatch.shift.ShiftWindow;

import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders chat messages (Telegram HTML subset). Tables go inside {@code <pre>} blocks.
 */
public class MessageFormatter {

    private static final DateTimeFormatter WINDOW_FORMAT = DateTimeFormatter.ofPattern("dd.MM.yyyy HH:mm");

    public String productionMessage(double speed,
                                    double shiftSpeed,
                                    double produced,
                                    String metricUnit,
                                    String shiftLabel,
                                    String description,
                                    boolean speedInfo) {
        String symbol = symbol(metricUnit);
        List<String[]> rows = new ArrayList<>(3);
        if (speedInfo) {
            rows.add(row("Rate", round(speed) + symbol + "/h"));
        }
        if (shiftSpeed > 0) {
            rows.add(row("Shift rate", round(shiftSpeed) + symbol + "/h"));
        }
        rows.add(row("Produced", round(produced) + symbol));

        return "<b>" + escape(description) + " 📈</b>\n"
                + "<pre>" + table(shiftLabel, "Value", rows) + "</pre>";
    }

    /**
     * Shift report of a cumulative job. The day total is only shown on Night reports.
     */
    public String reportMessage(ShiftWindow window,
                                double counterValue,
                                double produced,
                                double dayProduced,
                                String metricUnit,
                                String description) {
        String symbol = symbol(metricUnit);
        List<String[]> rows = new ArrayList<>(3);
        rows.add(row("Produced", round(produced) + symbol));
        if (window.shift() == Shift.NIGHT) {
            rows.add(row("Day total", round(dayProduced) + symbol));
        }
        rows.add(row("Counter", round(counterValue) + symbol));

        return "<b>" + escape(description) + " 📊</b>\n"
                + "<u>Shift report</u>\n"
                + windowLines(window)
                + "<pre>" + table("Shift", window.label(), rows) + "</pre>";
    }

    public String snapshotMessage(List<TitledValue> values, String shiftLabel, String description) {
        List<String[]> rows = new ArrayList<>(values.size());
        for (TitledValue v : values) {
            rows.add(row(v.title(), round(v.value()) + symbol(v.metricUnit())));
        }
        return "<b>" + escape(description) + " ⚡</b>\n"
                + "<pre>" + table(shiftLabel, "Value", rows) + "</pre>";
    }

    /**
     * Per-title last/min/max over the samples of a shift, in first-seen title order.
     */
    public String snapshotReportMessage(ShiftWindow window, String description, List<SampleRecord> samples) {
        Map<String, double[]> stats = new LinkedHashMap<>();
        Map<String, String> units = new LinkedHashMap<>();
        for (SampleRecord record : samples) {
            if (!(record instanceof SnapshotSample snapshot)) {
                continue;
            }
            for (TitledValue v : snapshot.values()) {
                units.putIfAbsent(v.title(), v.metricUnit());
                double[] s = stats.get(v.title());
                if (s == null) {
                    stats.put(v.title(), new double[]{v.value(), v.value(), v.value()});
                } else {
                    s[0] = v.value();
                    s[1] = Math.min(s[1], v.value());
                    s[2] = Math.max(s[2], v.value());
                }
            }
        }

        List<String[]> rows = new ArrayList<>(stats.size());
        for (Map.Entry<String, double[]> e : stats.entrySet()) {
            String symbol = symbol(units.get(e.getKey()));
            double[] s = e.getValue();
            rows.add(row(e.getKey(), round(s[0]) + symbol + " (" + round(s[1]) + ".." + round(s[2]) + ")"));
        }

        return "<b>" + escape(description) + " 📊</b>\n"
                + "<u>Shift report</u>\n"
                + windowLines(window)
                + "<pre>" + table(window.label(), "Last (min..max)", rows) + "</pre>";
    }

    public String idleMessage(String description, IdleAlert alert) {
        if (alert.fault()) {
            return "⚠️ WARNING: <b>" + escape(description) + "</b> is in a fault state!";
        }
        return "ℹ️ <b>" + escape(description) + "</b> is idle 💤.";
    }

    String table(String header1, String header2, List<String[]> rows) {
        String h1 = escape(header1);
        String h2 = escape(header2);
        int w1 = h1.length();
        int w2 = h2.length();
        List<String[]> cells = new ArrayList<>(rows.size());
        for (String[] r : rows) {
            String[] escaped = {escape(r[0]), escape(r[1])};
            w1 = Math.max(w1, escaped[0].length());
            w2 = Math.max(w2, escaped[1].length());
            cells.add(escaped);
        }

        String border = "+" + "-".repeat(w1 + 2) + "+" + "-".repeat(w2 + 2) + "+\n";
        StringBuilder sb = new StringBuilder();
        sb.append(border);
        sb.append(line(h1, h2, w1, w2));
        sb.append(border);
        for (String[] c : cells) {
            sb.append(line(c[0], c[1], w1, w2));
        }
        sb.append(border);
        return sb.toString();
    }

    private static String line(String a, String b, int w1, int w2) {
        return "| " + pad(a, w1) + " | " + pad(b, w2) + " |\n";
    }

    private static String pad(String s, int width) {
        return s + " ".repeat(Math.max(0, width - s.length()));
    }

    private static String windowLines(ShiftWindow window) {
        return "🗓<i>" + window.start().format(WINDOW_FORMAT) + "</i>\n"
                + "🗓<i>" + window.end().format(WINDOW_FORMAT) + "</i>\n";
    }

    private static String[] row(String name, String value) {
        return new String[]{name, value};
    }

    static String round(double value) {
        return String.format(Locale.ROOT, "%.1f", value);
    }

    private static String symbol(String metricUnit) {
        return (metricUnit == null || metricUnit.isEmpty()) ? "" : metricUnit.substring(0, 1);
    }

    private static String escape(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
    }
}
