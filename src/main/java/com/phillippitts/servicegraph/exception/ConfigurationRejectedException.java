package com.phillippitts.servicegraph.exception;

import com.phillippitts.servicegraph.domain.ResolutionReport;

/**
 * Thrown at startup when the configured service set has fatal issues. Activation is aborted
 * before any service is started.
 */
public class ConfigurationRejectedException extends ServiceGraphException {

    private final transient ResolutionReport report;

    public ConfigurationRejectedException(String message, ResolutionReport report) {
        super(message);
        this.report = report;
    }

    public ResolutionReport getReport() {
        return report;
    }

    public int getFatalCount() {
        return report.fatal().size();
    }
}
