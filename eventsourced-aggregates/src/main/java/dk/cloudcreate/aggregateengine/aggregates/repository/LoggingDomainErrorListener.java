package dk.cloudcreate.aggregateengine.aggregates.repository;

import dk.cloudcreate.aggregateengine.aggregates.*;
import org.slf4j.*;

/**
 * {@link DomainErrorListener} that logs every rejection at INFO level together with the correlation id of the command
 */
public final class LoggingDomainErrorListener<ID, COMMAND_TYPE, ERROR_TYPE extends DomainError> implements DomainErrorListener<ID, COMMAND_TYPE, ERROR_TYPE> {
    private static final Logger log = LoggerFactory.getLogger(LoggingDomainErrorListener.class);

    @Override
    public void onCommandRejected(AggregateType aggregateType, ID aggregateId, COMMAND_TYPE command, ERROR_TYPE error) {
        log.info("[{}:{}] Rejected '{}' with correlation id '{}': {}",
                 aggregateType,
                 aggregateId,
                 command.getClass().getSimpleName(),
                 error.correlationId().map(Object::toString).orElse("n/a"),
                 error.description());
    }

    @Override
    public String toString() {
        return "LoggingDomainErrorListener";
    }
}
