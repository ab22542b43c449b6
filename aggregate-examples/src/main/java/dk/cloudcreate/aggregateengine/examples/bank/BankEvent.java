package dk.cloudcreate.aggregateengine.examples.bank;

import dk.cloudcreate.aggregateengine.common.types.CorrelationId;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Facts about a bank account. Every event carries the correlation id of the command that resulted in it
 */
public sealed interface BankEvent {
    AccountId accountId();

    long amount();

    CorrelationId correlation();

    record FundsDeposited(AccountId accountId, long amount, CorrelationId correlation) implements BankEvent {
        public FundsDeposited {
            requireNonNull(accountId, "No accountId provided");
            requireNonNull(correlation, "No correlation provided");
        }
    }

    record FundsWithdrawn(AccountId accountId, long amount, CorrelationId correlation) implements BankEvent {
        public FundsWithdrawn {
            requireNonNull(accountId, "No accountId provided");
            requireNonNull(correlation, "No correlation provided");
        }
    }
}
