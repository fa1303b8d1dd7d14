package com.p14n.kafkatopology.lifecycle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes one debug record per producer lifecycle event.
 */
public class LoggingLifecycleListener implements ProducerLifecycleListener {

    private static final Logger logger = LoggerFactory.getLogger(LoggingLifecycleListener.class);

    @Override
    public void onLifecycleEvent(ProducerLifecycleNotification notification) {
        if (notification.producer() == null) {
            logger.atDebug()
                    .addKeyValue("event", notification.event())
                    .log("Producers loaded");
            return;
        }
        logger.atDebug()
                .addKeyValue("event", notification.event())
                .addKeyValue("producer", notification.producer().id())
                .addKeyValue("cluster", notification.producer().clusterId())
                .addArgument(notification.producer().id())
                .addArgument(notification.event())
                .log("Producer {} {}");
    }
}
