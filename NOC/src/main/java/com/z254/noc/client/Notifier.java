package com.z254.noc.client;

import com.z254.noc.domain.model.IncidentRecord;
import com.z254.noc.domain.model.NotificationChannel;
import com.z254.noc.domain.model.NotificationReport;
import com.z254.noc.domain.model.Severity;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Sends incident notifications over a set of channels.
 */
public interface Notifier {

    Mono<NotificationReport> send(IncidentRecord incident, List<NotificationChannel> channels, Severity severity);
}
