package dk.cloudcreate.aggregateengine.examples.bank;

import dk.cloudcreate.aggregateengine.aggregates.DomainError;
import dk.cloudcreate.aggregateengine.common.types.CorrelationId;

import java.util.Optional;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Reasons a {@link BankAccount} rejects a {@link BankCommand}
 */
public sealed interface AccountError extends DomainError {
    AccountId accountId();

    CorrelationId correlation();

    @Override
    default Optional<CorrelationId> correlationId() {
        return Optional.of(correlation());
    }

    /**
     * The withdrawal would bring the balance below zero
     */
    record InsufficientFunds(AccountId accountId, long balance, long requestedAmount, CorrelationId correlation) implements AccountError {
        @Override
        public String description() {
            return msg("Account '{}' has insufficient funds: balance {} is less than the requested amount {}", accountId, balance, requestedAmount);
        }
    }

    record InvalidAmount(AccountId accountId, long amount, CorrelationId correlation) implements AccountError {
        @Override
        public String description() {
            return msg("Amount {} for account '{}' is negative", amount, accountId);
        }
    }

    /**
     * The deposit would make the balance exceed {@link Long#MAX_VALUE}
     */
    record BalanceOverflow(AccountId accountId, long balance, long amount, CorrelationId correlation) implements AccountError {
        @Override
        public String description() {
            return msg("Depositing {} to account '{}' with balance {} would overflow the balance", amount, accountId, balance);
        }
    }

    /**
     * The command was addressed to another account than the one it was executed against
     */
    record AccountMismatch(AccountId accountId, AccountId commandAccountId, CorrelationId correlation) implements AccountError {
        @Override
        public String description() {
            return msg("Command for account '{}' was executed against account '{}'", commandAccountId, accountId);
        }
    }
}
