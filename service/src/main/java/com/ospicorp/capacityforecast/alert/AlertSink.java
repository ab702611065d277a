package com.ospicorp.capacityforecast.alert;

import java.util.List;

/** Notification collaborator that receives evaluated alerts. */
public interface AlertSink {

  void publish(List<AlertEvent> events);
}
