package ru.mirror.relay.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.typesafe.config.Config;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.jooq.SQLDialect;
import ru.mirror.relay.ConfigReader;
import ru.mirror.relay.Service;
import ru.mirror.relay.impl.settings.ConsumerSettings;
import ru.mirror.relay.impl.settings.DBSettings;
import ru.mirror.relay.impl.settings.LinkSettings;
import ru.mirror.relay.impl.settings.ProducerSettings;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

@Slf4j
public class ServiceRelay implements Service {
    private final AtomicBoolean isExit = new AtomicBoolean(false);
    private final CountDownLatch stopped = new CountDownLatch(1);
    private final CountDownLatch finished = new CountDownLatch(1);

    @Override
    public void start(Config config) {
        ConfigReader configReader = new ConfigurationReader(config);
        ConsumerSettings consumerSettings = Settings.makeConsumerSettings(config);
        ProducerSettings producerSettings = Settings.makeProducerSettings(config);
        DBSettings dbSettings = Settings.makeDBSettings(config);
        LinkSettings linkSettings = Settings.makeLinkSettings(config);
        ObjectMapper objectMapper = new ObjectMapper();

        HikariDataSource dataSource = DbStateStore.createDataSource(dbSettings);
        DbStateStore stateStore = new DbStateStore(dataSource, dbSettings.getDialect(), Clock.systemUTC());
        stateStore.init();

        StatsRecorder statsRecorder = new StatsRecorder(Path.of(config.getString("relay.statsFile")), objectMapper);
        statsRecorder.markRunning();
        log.info("Service started");

        HttpLinkResolver linkResolver = new HttpLinkResolver(linkSettings);
        WriterToKafka writerToKafka = WriterToKafka.builder()
                .producerSettings(producerSettings)
                .objectMapper(objectMapper)
                .build();
        ForwardingPipeline pipeline = new ForwardingPipeline(
                stateStore,
                new ProcessorOfFilters(stateStore, linkResolver),
                new CodeDeduplicator(configReader, stateStore),
                writerToKafka,
                statsRecorder,
                producerSettings.getDestination());
        ReaderFromKafka readerFromKafka = ReaderFromKafka.builder()
                .consumerSettings(consumerSettings)
                .pipeline(pipeline)
                .objectMapper(objectMapper)
                .configReader(configReader)
                .isExit(isExit)
                .build();
        RetentionScheduler retentionScheduler = new RetentionScheduler(configReader, stateStore, isExit);

        ExecutorService executorService = Executors.newFixedThreadPool(2);
        executorService.submit(readerFromKafka::processing);
        Future<?> retentionTask = executorService.submit(retentionScheduler);

        Thread shutdownHook = new Thread(this::stop, "relay-shutdown");
        Runtime.getRuntime().addShutdownHook(shutdownHook);
        try {
            stopped.await();
        } catch (InterruptedException e) {
            log.warn("MAIN_THREAD_INTERRUPTED");
            Thread.currentThread().interrupt();
            isExit.set(true);
        }

        // текущее сообщение дорабатывает, планировщик прерывается во время ожидания
        retentionTask.cancel(true);
        executorService.shutdown();
        try {
            if (!executorService.awaitTermination(10, TimeUnit.SECONDS)) {
                executorService.shutdownNow();
            }
        } catch (InterruptedException e) {
            executorService.shutdownNow();
            Thread.currentThread().interrupt();
        }
        writerToKafka.close();
        try {
            linkResolver.close();
        } catch (IOException e) {
            log.warn("HTTP_CLIENT_CLOSE_FAILED {}", e.getMessage());
        }
        statsRecorder.markStopped();
        log.info("Service stopped");
        dataSource.close();
        finished.countDown();
    }

    public void stop() {
        isExit.set(true);
        stopped.countDown();
        try {
            if (!finished.await(20, TimeUnit.SECONDS)) {
                log.warn("SERVICE_STOP_TIMEOUT");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private record Settings() {
        private static ConsumerSettings makeConsumerSettings(Config config) {
            Config kafkaConfigConsumer = config.getConfig("kafka").getConfig("consumer");
            ConsumerSettings consumerSettings = ConsumerSettings.builder()
                    .groupId(kafkaConfigConsumer.getString("group.id"))
                    .bootstrapServers(kafkaConfigConsumer.getString("bootstrap.servers"))
                    .autoOffsetReset(kafkaConfigConsumer.getString("auto.offset.reset"))
                    .topicIn(kafkaConfigConsumer.getString("topicIn"))
                    .pollIntervalMs(kafkaConfigConsumer.getInt("pollIntervalMs"))
                    .sources(ConsumerSettings.parseSources(config.getString("relay.sources")))
                    .build();
            log.debug("CONSUMER_SETTINGS_WAS_READ: {}", consumerSettings);
            return consumerSettings;
        }

        private static ProducerSettings makeProducerSettings(Config config) {
            Config kafkaConfigProducer = config.getConfig("kafka").getConfig("producer");
            ProducerSettings producerSettings = ProducerSettings.builder()
                    .bootstrapServers(kafkaConfigProducer.getString("bootstrap.servers"))
                    .topicOut(kafkaConfigProducer.getString("topicOut"))
                    .sendTimeoutSec(kafkaConfigProducer.getInt("sendTimeoutSec"))
                    .destination(config.getString("relay.destination"))
                    .build();
            log.debug("PRODUCER_SETTINGS_WAS_READ: {}", producerSettings);
            return producerSettings;
        }

        private static DBSettings makeDBSettings(Config config) {
            Config dbConfig = config.getConfig("db");
            DBSettings dbSettings = DBSettings.builder().jdbcUrl(dbConfig.getString("jdbcUrl"))
                    .driver(dbConfig.getString("driver"))
                    .user(dbConfig.getString("user"))
                    .password(dbConfig.getString("password"))
                    .dialect(SQLDialect.valueOf(dbConfig.getString("dialect")))
                    .maximumPoolSize(dbConfig.getInt("maximumPoolSize"))
                    .build();
            log.debug("DB_SETTINGS_WAS_READ: {}", dbSettings);
            return dbSettings;
        }

        private static LinkSettings makeLinkSettings(Config config) {
            Config linksConfig = config.getConfig("relay.links");
            return LinkSettings.builder()
                    .timeoutSec(linksConfig.getInt("timeoutSec"))
                    .userAgent(linksConfig.getString("userAgent"))
                    .productMarkers(linksConfig.getStringList("productMarkers"))
                    .build();
        }
    }
}
