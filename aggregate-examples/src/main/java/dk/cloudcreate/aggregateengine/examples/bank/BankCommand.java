package dk.cloudcreate.aggregateengine.examples.bank;

import dk.cloudcreate.aggregateengine.common.types.CorrelationId;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Commands that can be executed against a {@link BankAccount}.<br>
 * The amounts aren't validated when the command is created - a negative amount is rejected by the account
 * with {@link AccountError.InvalidAmount}
 */
public sealed interface BankCommand {
    AccountId accountId();

    long amount();

    CorrelationId correlation();

    record DepositFunds(AccountId accountId, long amount, CorrelationId correlation) implements BankCommand {
        public DepositFunds {
            requireNonNull(accountId, "No accountId provided");
            requireNonNull(correlation, "No correlation provided");
        }

        public static DepositFunds of(AccountId accountId, long amount) {
            return new DepositFunds(accountId, amount, CorrelationId.random());
        }
    }

    record WithdrawFunds(AccountId accountId, long amount, CorrelationId correlation) implements BankCommand {
        public WithdrawFunds {
            requireNonNull(accountId, "No accountId provided");
            requireNonNull(correlation, "No correlation provided");
        }

        public static WithdrawFunds of(AccountId accountId, long amount) {
            return new WithdrawFunds(accountId, amount, CorrelationId.random());
        }
    }
}
