package io.shiftwatch.report;

import io.shiftwatch.core.SampleRecord;
import io.shiftwatch.core.SnapshotSample;
import io.shiftwatch.core.TitledValue;
import io.shiftwatch.idle.IdleAlert;
import io.shiftwatch.shift.Shift;
import io.shiftwatch.shift.ShiftWindow;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MessageFormatterTest {

    private final MessageFormatter formatter = new MessageFormatter();

    @Test
    void tableShouldPadColumnsToWidestCell() {
        String table = formatter.table("Shift", "Day ☀", List.<String[]>of(new String[]{"Produced", "60.0p"}));

        assertThat(table).isEqualTo(
                "+----------+-------+\n"
                        + "| Shift    | Day ☀ |\n"
                        + "+----------+-------+\n"
                        + "| Produced | 60.0p |\n"
                        + "+----------+-------+\n");
    }

    @Test
    void productionMessageShouldShowRatesOnlyWhenAvailable() {
        String withSpeed = formatter.productionMessage(200, 150, 60, "pcs", "Day ☀", "Line A", true);
        String plain = formatter.productionMessage(200, 0, 60, "pcs", "Day ☀", "Line A", false);

        assertThat(withSpeed).contains("Rate", "200.0p/h", "Shift rate", "150.0p/h", "60.0p");
        assertThat(plain).contains("Produced", "60.0p").doesNotContain("Rate");
    }

    @Test
    void dayTotalShouldOnlyAppearOnNightReports() {
        ShiftWindow day = window("2026-03-10T08:00:00Z", "2026-03-10T20:00:00Z", Shift.DAY);
        ShiftWindow night = window("2026-03-10T20:00:00Z", "2026-03-11T08:00:00Z", Shift.NIGHT);

        String dayReport = formatter.reportMessage(day, 1500, 500, 800, "pcs", "Line A");
        String nightReport = formatter.reportMessage(night, 1500, 500, 800, "pcs", "Line A");

        assertThat(dayReport).contains("Shift report", "10.03.2026 08:00", "10.03.2026 20:00", "500.0p")
                .doesNotContain("Day total");
        assertThat(nightReport).contains("Day total", "800.0p", "Night ☾");
    }

    @Test
    void snapshotReportShouldSummariseLastMinMaxPerTitle() {
        ShiftWindow day = window("2026-03-10T08:00:00Z", "2026-03-10T20:00:00Z", Shift.DAY);
        List<SampleRecord> samples = List.of(
                snapshot("2026-03-10T09:00:00Z", 3),
                snapshot("2026-03-10T10:00:00Z", 5),
                snapshot("2026-03-10T11:00:00Z", 1)
        );

        String report = formatter.snapshotReportMessage(day, "Oven", samples);

        assertThat(report).contains("Temperature", "1.0° (1.0..5.0)");
    }

    @Test
    void descriptionShouldBeHtmlEscaped() {
        String text = formatter.snapshotMessage(List.of(new TitledValue("A<B", 1, "pcs")), "Day ☀", "Tom & Jerry");

        assertThat(text).contains("Tom &amp; Jerry", "A&lt;B").doesNotContain("A<B");
    }

    @Test
    void idleMessageShouldDistinguishFault() {
        assertThat(formatter.idleMessage("Line A", new IdleAlert("line_a_counter", 3, true))).contains("fault state");
        assertThat(formatter.idleMessage("Line A", new IdleAlert("line_a_counter", 3, false))).contains("is idle");
    }

    private static SnapshotSample snapshot(String at, double value) {
        return new SnapshotSample(Instant.parse(at), List.of(new TitledValue("Temperature", value, "°C")));
    }

    private static ShiftWindow window(String start, String end, Shift shift) {
        return new ShiftWindow(zdt(start), zdt(end), shift);
    }

    private static ZonedDateTime zdt(String instant) {
        return Instant.parse(instant).atZone(ZoneOffset.UTC);
    }
}
