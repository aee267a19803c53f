package io.shiftwatch.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.shiftwatch.JobHandler;
import io.shiftwatch.JobManager;
import io.shiftwatch.JobScheduler;
import io.shiftwatch.core.JobHandlerRegistry;
import io.shiftwatch.idle.IdleFaultDetector;
import io.shiftwatch.internal.CumulativeJobHandler;
import io.shiftwatch.internal.PooledJobScheduler;
import io.shiftwatch.internal.SimpleJobHandler;
import io.shiftwatch.internal.mongo.MongoJobStore;
import io.shiftwatch.internal.mongo.MongoTimeSeriesStore;
import io.shiftwatch.notify.LoggingNotifier;
import io.shiftwatch.notify.Notifier;
import io.shiftwatch.production.ProductionRecorder;
import io.shiftwatch.report.MessageFormatter;
import io.shiftwatch.report.ReportChartProvider;
import io.shiftwatch.report.ShiftReportService;
import io.shiftwatch.sensor.SensorAggregator;
import io.shiftwatch.sensor.SensorReader;
import io.shiftwatch.shift.ShiftClock;
import io.shiftwatch.store.JobStore;
import io.shiftwatch.store.TimeSeriesStore;
import io.shiftwatch.telegram.TelegramNotifier;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.util.List;

/**
 * Spring Boot auto-configuration entrypoint for the monitoring engine.
 *
 * <p>Applications contribute {@link SensorReader} beans for the sensor types they support and,
 * optionally, a {@link ReportChartProvider}. Any bean declared here can be replaced by declaring
 * one of the same type.
 */
@AutoConfiguration
@ConditionalOnClass({JobScheduler.class, MongoTemplate.class})
@EnableConfigurationProperties({ShiftWatchProperties.class, TelegramProperties.class})
@ConditionalOnProperty(prefix = "shiftwatch", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ShiftWatchAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock shiftWatchClock(ShiftWatchProperties props) {
        return Clock.system(props.zoneId());
    }

    @Bean
    @ConditionalOnMissingBean
    public ShiftClock shiftClock(ShiftWatchProperties props, Clock clock) {
        return new ShiftClock(props.firstShiftStart(), props.secondShiftStart(), clock);
    }

    @Bean
    @ConditionalOnMissingBean(TimeSeriesStore.class)
    protected MongoTimeSeriesStore mongoTimeSeriesStore(MongoTemplate mongoTemplate) {
        return new MongoTimeSeriesStore(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean(JobStore.class)
    protected MongoJobStore mongoJobStore(MongoTemplate mongoTemplate, ObjectMapper objectMapper, ShiftWatchProperties props) {
        return new MongoJobStore(mongoTemplate, objectMapper, props.getJobsCollection());
    }

    @Bean
    @ConditionalOnMissingBean
    protected ShiftWatchMongoIndexConfig shiftWatchMongoIndexConfig(MongoTemplate mongoTemplate, ShiftWatchProperties props) {
        return new ShiftWatchMongoIndexConfig(mongoTemplate, props.getJobsCollection());
    }

    @Bean
    @ConditionalOnMissingBean
    public SensorAggregator sensorAggregator(ObjectProvider<SensorReader> readers) {
        return new SensorAggregator(readers.orderedStream().toList());
    }

    @Bean
    @ConditionalOnMissingBean
    public IdleFaultDetector idleFaultDetector() {
        return new IdleFaultDetector();
    }

    @Bean
    @ConditionalOnMissingBean
    public ProductionRecorder productionRecorder(TimeSeriesStore store, Clock clock) {
        return new ProductionRecorder(store, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public MessageFormatter messageFormatter() {
        return new MessageFormatter();
    }

    @Bean
    @ConditionalOnMissingBean(Notifier.class)
    @ConditionalOnProperty(prefix = "shiftwatch.telegram", name = "enabled", havingValue = "true")
    public TelegramNotifier telegramNotifier(TelegramProperties telegram, ObjectMapper objectMapper) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) telegram.getConnectTimeout().toMillis());
        requestFactory.setReadTimeout((int) telegram.getReadTimeout().toMillis());
        return new TelegramNotifier(telegram, new RestTemplate(requestFactory), objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public Notifier loggingNotifier() {
        return new LoggingNotifier();
    }

    @Bean
    @ConditionalOnMissingBean
    public ShiftReportService shiftReportService(TimeSeriesStore store,
                                                 ProductionRecorder recorder,
                                                 ShiftClock shiftClock,
                                                 MessageFormatter formatter,
                                                 Notifier notifier,
                                                 ObjectProvider<ReportChartProvider> chartProvider,
                                                 ShiftWatchProperties props) {
        return new ShiftReportService(store, recorder, shiftClock, formatter, notifier,
                chartProvider.getIfAvailable(), props.getReportLookback());
    }

    @Bean
    @ConditionalOnMissingBean
    public CumulativeJobHandler cumulativeJobHandler(SensorAggregator aggregator,
                                                     ProductionRecorder recorder,
                                                     IdleFaultDetector idleDetector,
                                                     ShiftClock shiftClock,
                                                     ShiftReportService reportService,
                                                     MessageFormatter formatter,
                                                     Notifier notifier) {
        return new CumulativeJobHandler(aggregator, recorder, idleDetector, shiftClock, reportService, formatter, notifier);
    }

    @Bean
    @ConditionalOnMissingBean
    public SimpleJobHandler simpleJobHandler(SensorAggregator aggregator,
                                             ProductionRecorder recorder,
                                             IdleFaultDetector idleDetector,
                                             ShiftClock shiftClock,
                                             ShiftReportService reportService,
                                             MessageFormatter formatter,
                                             Notifier notifier,
                                             ShiftWatchProperties props) {
        return new SimpleJobHandler(aggregator, recorder, idleDetector, shiftClock, reportService, formatter, notifier,
                props.isSkipEqualityCheck());
    }

    @Bean
    @ConditionalOnMissingBean
    public JobHandlerRegistry jobHandlerRegistry(ObjectProvider<List<JobHandler>> handlersProvider) {
        List<JobHandler> handlers = handlersProvider.getIfAvailable(List::of);
        return new JobHandlerRegistry(handlers);
    }

    @Bean
    @ConditionalOnMissingBean
    public JobScheduler jobScheduler(ShiftWatchProperties props, JobStore jobStore, JobHandlerRegistry registry, Clock clock) {
        return new PooledJobScheduler(props, jobStore, registry, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public JobManager jobManager(JobScheduler scheduler,
                                 TimeSeriesStore seriesStore,
                                 SensorAggregator aggregator,
                                 IdleFaultDetector idleDetector,
                                 ShiftReportService reportService,
                                 ShiftClock shiftClock) {
        return new JobManager(scheduler, seriesStore, aggregator, idleDetector, reportService, shiftClock);
    }

    @Bean
    @ConditionalOnMissingBean
    public ShiftWatchLifecycle shiftWatchLifecycle(JobScheduler scheduler) {
        return new ShiftWatchLifecycle(scheduler);
    }

    @Bean
    @ConditionalOnProperty(prefix = "shiftwatch", name = "ensure-indexes-on-startup", havingValue = "true")
    public SmartInitializingSingleton shiftWatchIndexesInitializer(ShiftWatchMongoIndexConfig indexConfig) {
        return indexConfig::ensureIndexes;
    }
}
