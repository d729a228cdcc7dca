package com.aiprofessor.simulation.domain.port;

import com.aiprofessor.simulation.domain.audit.ActivityLogEntry;

/** Destination of audit entries. */
public interface ActivityLogSink {

    void record(ActivityLogEntry entry);
}
