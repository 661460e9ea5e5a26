package me.golemcore.host.domain.exception;

import me.golemcore.host.domain.model.ErrorKind;
import me.golemcore.host.domain.model.ShutdownReport;

/**
 * Shutdown drain timed out with sessions still live. Carries the report so the
 * response can list the stragglers.
 */
public class ShutdownIncompleteException extends HostException {

    private static final long serialVersionUID = 1L;

    private final transient ShutdownReport report;

    public ShutdownIncompleteException(ShutdownReport report) {
        super(ErrorKind.SHUTDOWN_INCOMPLETE, "Shutdown drain timed out with " + report.getStragglers().size()
                + " sessions still live: " + report.getStragglers());
        this.report = report;
    }

    public ShutdownReport getReport() {
        return report;
    }
}
