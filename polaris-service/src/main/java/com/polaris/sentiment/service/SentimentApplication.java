/*
 * Copyright (c) 2025 Polaris Sentiment
 * Licensed under the Apache License, Version 2.0
 */
package com.polaris.sentiment.service;

import com.polaris.sentiment.cache.CacheFactory;
import com.polaris.sentiment.cache.ResultCache;
import com.polaris.sentiment.codec.JsonResultCodec;
import com.polaris.sentiment.config.ConfigSource;
import com.polaris.sentiment.runtime.ResultShaper;
import com.polaris.sentiment.runtime.SentimentPipeline;
import com.polaris.sentiment.service.config.ServiceConfig;
import com.polaris.sentiment.service.provider.GoogleLanguageProvider;
import com.polaris.sentiment.service.server.SentimentHttpServer;
import com.polaris.sentiment.service.telemetry.TracingService;

import java.io.IOException;
import java.io.InputStream;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

public class SentimentApplication {
    private static final Logger logger = Logger.getLogger(SentimentApplication.class.getName());

    private SentimentHttpServer httpServer;
    private GoogleLanguageProvider provider;
    private TracingService tracingService;
    private ServiceConfig config;

    public static void main(String[] args) {
        try {
            ConfigSource source = ConfigSource.system();
            ServiceConfig config = ServiceConfig.from(source);
            configureLogging(config.getLogLevel());

            SentimentApplication app = new SentimentApplication();
            app.start(config, source);
            Runtime.getRuntime().addShutdownHook(new Thread(app::shutdown, "sentiment-shutdown"));
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            logger.log(Level.SEVERE, "Application failed to start: " + e.getMessage(), e);
            System.exit(1);
        }
    }

    void start(ServiceConfig config, ConfigSource source) throws IOException {
        this.config = config;
        logger.info("Starting sentiment service: " + config);

        tracingService = TracingService.create(source);
        provider = GoogleLanguageProvider.create(config.getProviderEndpoint(),
                config.getProviderApiKey().orElse(null));

        ResultCache cache = CacheFactory.create(config.getCacheConfig());
        SentimentPipeline pipeline = new SentimentPipeline(provider, cache, new JsonResultCodec(),
                new ResultShaper(), config.getRequestTimeout(), tracingService.getTracer());

        httpServer = new SentimentHttpServer(config.getPort(), pipeline, cache,
                config.getHttpTimeout(), tracingService.getTracer());
        httpServer.start();
        logger.info("Sentiment service is ready to serve requests on port " + httpServer.getPort());
    }

    void shutdown() {
        if (httpServer != null) httpServer.stop(config.getShutdownGrace());
        if (provider != null) provider.close();
        if (tracingService != null) tracingService.shutdown();
        logger.info("Sentiment service shutdown complete");
    }

    /**
     * Loads {@code logging.properties} from the classpath, then applies the
     * configured level to the root logger and its handlers.
     */
    static void configureLogging(Level level) {
        try (InputStream is = SentimentApplication.class.getResourceAsStream("/logging.properties")) {
            if (is != null) {
                LogManager.getLogManager().readConfiguration(is);
            }
        } catch (IOException e) {
            logger.log(Level.WARNING, "Could not load logging.properties, using JVM defaults", e);
        }

        Logger root = Logger.getLogger("");
        root.setLevel(level);
        for (Handler handler : root.getHandlers()) {
            handler.setLevel(level);
        }
    }
}
