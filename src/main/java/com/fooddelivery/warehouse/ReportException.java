package com.fooddelivery.warehouse;

/**
 * A single report could not be produced, for instance because no snapshot has been built yet.
 */
public class ReportException extends RuntimeException {

    private final ReportName report;

    public ReportException(ReportName report, String message) {
        super(message);
        this.report = report;
    }

    public ReportException(ReportName report, String message, Throwable cause) {
        super(message, cause);
        this.report = report;
    }

    public ReportName getReport() {
        return report;
    }
}
