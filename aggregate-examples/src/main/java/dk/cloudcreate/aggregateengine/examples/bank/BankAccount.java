package dk.cloudcreate.aggregateengine.examples.bank;

import dk.cloudcreate.aggregateengine.aggregates.*;

import java.math.BigInteger;
import java.util.Objects;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * The projected state of a bank account: its balance
 */
public final class BankAccount extends ImmutableAggregateState<AccountId, BankEvent, BankCommand, AccountError, BankAccount> {
    private static final BigInteger MAX_BALANCE = BigInteger.valueOf(Long.MAX_VALUE);

    public final long balance;

    private BankAccount(AccountId accountId, long balance, Generation generation) {
        super(accountId, generation);
        this.balance = balance;
    }

    /**
     * @param accountId the account id
     * @return an account without history: balance 0 and generation 0
     */
    public static BankAccount seed(AccountId accountId) {
        return new BankAccount(accountId, 0, Generation.INITIAL);
    }

    @Override
    protected BankAccount whenApplied(BankEvent event, Generation nextGeneration) {
        try {
            if (event instanceof BankEvent.FundsDeposited) {
                return new BankAccount(aggregateId(), Math.addExact(balance, event.amount()), nextGeneration);
            }
            if (event instanceof BankEvent.FundsWithdrawn) {
                return new BankAccount(aggregateId(), Math.subtractExact(balance, event.amount()), nextGeneration);
            }
        } catch (ArithmeticException e) {
            throw new AggregateException(msg("Applying '{}' to balance {} of account '{}' overflows the balance",
                                             event, balance, aggregateId()), e);
        }
        throw unhandled(event);
    }

    @Override
    protected CommandResult<BankEvent, AccountError> decide(BankCommand command) {
        if (!aggregateId().equals(command.accountId())) {
            return CommandResult.rejected(new AccountError.AccountMismatch(aggregateId(), command.accountId(), command.correlation()));
        }
        if (command.amount() < 0) {
            return CommandResult.rejected(new AccountError.InvalidAmount(aggregateId(), command.amount(), command.correlation()));
        }

        if (command instanceof BankCommand.DepositFunds) {
            if (BigInteger.valueOf(balance).add(BigInteger.valueOf(command.amount())).compareTo(MAX_BALANCE) > 0) {
                return CommandResult.rejected(new AccountError.BalanceOverflow(aggregateId(), balance, command.amount(), command.correlation()));
            }
            return CommandResult.accepted(new BankEvent.FundsDeposited(aggregateId(), command.amount(), command.correlation()));
        }
        if (command instanceof BankCommand.WithdrawFunds) {
            // balance - amount can't underflow when evaluated as a BigInteger
            if (BigInteger.valueOf(balance).subtract(BigInteger.valueOf(command.amount())).signum() < 0) {
                return CommandResult.rejected(new AccountError.InsufficientFunds(aggregateId(), balance, command.amount(), command.correlation()));
            }
            return CommandResult.accepted(new BankEvent.FundsWithdrawn(aggregateId(), command.amount(), command.correlation()));
        }
        throw unhandledCommand(command);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BankAccount)) return false;
        BankAccount that = (BankAccount) o;
        return baseEquals(that) && balance == that.balance;
    }

    @Override
    public int hashCode() {
        return Objects.hash(aggregateId(), generation(), balance);
    }

    @Override
    public String toString() {
        return "BankAccount{" +
                "accountId=" + aggregateId() +
                ", balance=" + balance +
                ", generation=" + generation() +
                '}';
    }
}
