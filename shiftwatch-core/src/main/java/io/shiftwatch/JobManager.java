package io.shiftwatch;

import io.shiftwatch.core.CronTrigger;
import io.shiftwatch.core.CumulativeParameters;
import io.shiftwatch.core.DeliveryException;
import io.shiftwatch.core.DuplicateJobException;
import io.shiftwatch.core.FunctionKind;
import io.shiftwatch.core.InvalidJobException;
import io.shiftwatch.core.JobDefinition;
import io.shiftwatch.core.JobDefinitionValidator;
import io.shiftwatch.core.JobNotFoundException;
import io.shiftwatch.core.JobParameters;
import io.shiftwatch.core.MonitorJob;
import io.shiftwatch.core.ReportNotConfiguredException;
import io.shiftwatch.core.ShiftReportNames;
import io.shiftwatch.core.SimpleParameters;
import io.shiftwatch.idle.IdleFaultDetector;
import io.shiftwatch.report.ShiftReportService;
import io.shiftwatch.sensor.SensorAggregator;
import io.shiftwatch.shift.ShiftClock;
import io.shiftwatch.store.TimeSeriesStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Job operations offered to the configuration surface.
 *
 * <p>Typical usage:
 * <pre>{@code
 * jobManager.createJob(JobDefinition.builder("line_a_counter")
 *         .description("Line A output")
 *         .trigger(IntervalTrigger.every(15, IntervalUnit.MINUTES))
 *         .sensor(SensorType.OPC, "65f1c0...")
 *         .diffField(true)
 *         .shiftReport(true)
 *         .build());
 *
 * jobManager.deleteJob("line_a_counter", DeleteOptions.all());
 * }</pre>
 */
public class JobManager {
    private static final Logger log = LoggerFactory.getLogger(JobManager.class);

    static final int REPORT_SECOND = 30;

    private final JobScheduler scheduler;
    private final TimeSeriesStore seriesStore;
    private final SensorAggregator aggregator;
    private final IdleFaultDetector idleDetector;
    private final ShiftReportService reportService;
    private final ShiftClock shiftClock;

    public JobManager(JobScheduler scheduler,
                      TimeSeriesStore seriesStore,
                      SensorAggregator aggregator,
                      IdleFaultDetector idleDetector,
                      ShiftReportService reportService,
                      ShiftClock shiftClock) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.seriesStore = Objects.requireNonNull(seriesStore, "seriesStore must not be null");
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator must not be null");
        this.idleDetector = Objects.requireNonNull(idleDetector, "idleDetector must not be null");
        this.reportService = Objects.requireNonNull(reportService, "reportService must not be null");
        this.shiftClock = Objects.requireNonNull(shiftClock, "shiftClock must not be null");
    }

    /**
     * Validate, create the series and schedule the job, plus its two shift-report children when
     * requested.
     *
     * @return the base job followed by any report children
     * @throws InvalidJobException   if the definition is invalid
     * @throws DuplicateJobException if the name is taken
     */
    public List<MonitorJob> createJob(JobDefinition def) {
        JobDefinitionValidator.validate(def, aggregator::supports);
        if (scheduler.jobExists(def.name())) {
            throw new DuplicateJobException(def.name());
        }

        seriesStore.createSeries(def.name());
        MonitorJob base = MonitorJob.active(def.name(), def.trigger(), def.kind(),
                parameters(def, def.name(), false));

        List<MonitorJob> created = new ArrayList<>(3);
        created.add(scheduler.addJob(base));

        if (def.shiftReport()) {
            try {
                addReportJobs(def, created);
            } catch (RuntimeException e) {
                log.warn("shiftwatch report jobs failed, rolling back name={} msg={}", def.name(), e.getMessage());
                for (MonitorJob job : created) {
                    scheduler.removeJob(job.name());
                }
                throw e;
            }
        }

        log.info("shiftwatch job created name={} kind={} jobs={}", def.name(), def.kind(), created.size());
        return created;
    }

    /**
     * Remove a job. A shift-report child name removes only that child.
     *
     * @throws JobNotFoundException if no such job exists
     */
    public void deleteJob(String name, DeleteOptions options) {
        MonitorJob job = getJob(name);
        DeleteOptions opts = options != null ? options : DeleteOptions.defaults();

        remove(job.name());
        if (job.isShiftReportChild()) {
            return;
        }

        if (opts.removeSeries()) {
            seriesStore.dropSeries(job.name());
        }

        if (opts.deleteShiftChildren()) {
            boolean hadChildren = false;
            for (String child : ShiftReportNames.children(job.name())) {
                if (scheduler.jobExists(child)) {
                    hadChildren = true;
                    remove(child);
                }
            }
            if (hadChildren) {
                seriesStore.dropSeries(ShiftReportNames.reportSeries(job.name()));
            }
        }
    }

    public MonitorJob pause(String name) {
        return scheduler.pauseJob(name);
    }

    public MonitorJob resume(String name) {
        return scheduler.resumeJob(name);
    }

    public List<MonitorJob> listJobs() {
        return scheduler.listJobs();
    }

    /**
     * @throws JobNotFoundException if no such job exists
     */
    public MonitorJob getJob(String name) {
        return scheduler.getJob(name).orElseThrow(() -> new JobNotFoundException(name));
    }

    /**
     * Send the report of the previous shift right away. Accepts a report child or its base job.
     *
     * @throws JobNotFoundException         if no such job exists
     * @throws ReportNotConfiguredException if the job has no shift report
     * @throws DeliveryException            if there was nothing to report or delivery failed
     */
    public void triggerReportNow(String name) {
        MonitorJob job = getJob(name);
        MonitorJob reportJob = job.parameters().shiftReport() ? job : findReportChild(job.name());

        boolean sent = reportService.sendPreviousShiftReport(
                reportJob.name(),
                reportJob.parameters().description(),
                reportJob.kind()
        );
        if (!sent) {
            throw new DeliveryException("Failed to send shift report: " + name);
        }
    }

    private MonitorJob findReportChild(String baseName) {
        for (String child : ShiftReportNames.children(baseName)) {
            var found = scheduler.getJob(child);
            if (found.isPresent()) {
                return found.get();
            }
        }
        throw new ReportNotConfiguredException(baseName);
    }

    private void addReportJobs(JobDefinition def, List<MonitorJob> created) {
        String reportSeries = ShiftReportNames.reportSeries(def.name());
        if (def.kind() == FunctionKind.CUMULATIVE) {
            seriesStore.createSeries(reportSeries);
        }

        List<String> names = ShiftReportNames.children(def.name());
        LocalTime[] starts = {shiftClock.firstShiftStart(), shiftClock.secondShiftStart()};
        for (int i = 0; i < names.size(); i++) {
            CronTrigger trigger = CronTrigger.daily(starts[i].getHour(), starts[i].getMinute(), REPORT_SECOND);
            MonitorJob child = MonitorJob.active(names.get(i), trigger, def.kind(),
                    parameters(def, reportSeries, true));
            created.add(scheduler.addJob(child));
        }
    }

    private void remove(String name) {
        scheduler.removeJob(name);
        idleDetector.evict(name);
    }

    private static JobParameters parameters(JobDefinition def, String seriesKey, boolean shiftReport) {
        if (def.kind() == FunctionKind.CUMULATIVE) {
            return new CumulativeParameters(seriesKey, def.description(), def.sensors(),
                    def.tgSend(), shiftReport, def.speedInfo(), def.chat());
        }
        return new SimpleParameters(seriesKey, def.description(), def.sensors(),
                def.tgSend(), shiftReport, def.summation(), def.chat());
    }
}
