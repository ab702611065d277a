package com.ospicorp.capacityforecast.alert;

import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LoggingAlertSink implements AlertSink {
  private static final Logger log = LoggerFactory.getLogger(LoggingAlertSink.class);

  @Override
  public void publish(List<AlertEvent> events) {
    if (events.isEmpty()) {
      log.info("No capacity alerts triggered");
      return;
    }
    log.warn("Capacity alerts triggered: {}", events.size());
    for (AlertEvent event : events) {
      log.warn("Series {} at {}: {}", event.seriesId(), event.timestamp(), event.message());
    }
  }
}
