package dk.cloudcreate.aggregateengine.examples.bank;

import dk.cloudcreate.aggregateengine.aggregates.AggregateType;
import dk.cloudcreate.aggregateengine.aggregates.repository.*;
import dk.cloudcreate.aggregateengine.eventlog.EventLog;
import dk.cloudcreate.aggregateengine.eventlog.serializer.json.JacksonEventCodec;
import dk.cloudcreate.aggregateengine.eventlog.types.EventStreamName;

/**
 * Wiring of the {@link BankAccount} aggregate: the events of account <code>12345</code> are stored in the stream <code>account-12345</code>
 * under the event type names <code>funds-deposited</code> and <code>funds-withdrawn</code>
 */
public final class BankAccounts {
    public static final AggregateType AGGREGATE_TYPE = AggregateType.of("Accounts");
    public static final String        STREAM_PREFIX  = "account";

    private BankAccounts() {
    }

    public static JacksonEventCodec<BankEvent> codec() {
        return JacksonEventCodec.builder(BankEvent.class)
                                .register("funds-deposited", BankEvent.FundsDeposited.class)
                                .register("funds-withdrawn", BankEvent.FundsWithdrawn.class)
                                .build();
    }

    public static EventStreamName streamName(AccountId accountId) {
        return EventStreamName.of(STREAM_PREFIX, accountId);
    }

    public static AggregateTypeConfiguration<AccountId, BankEvent, BankCommand, AccountError, BankAccount> configuration() {
        return AggregateTypeConfiguration.of(AGGREGATE_TYPE,
                                             BankAccounts::streamName,
                                             BankAccount::seed,
                                             codec());
    }

    public static EventSourcedAggregateRepository<AccountId, BankEvent, BankCommand, AccountError, BankAccount> repository(EventLog eventLog) {
        return EventSourcedAggregateRepository.from(eventLog, configuration());
    }
}
