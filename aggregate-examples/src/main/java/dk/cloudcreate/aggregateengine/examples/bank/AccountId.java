package dk.cloudcreate.aggregateengine.examples.bank;

import dk.cloudcreate.essentials.types.*;

import java.util.UUID;

public class AccountId extends CharSequenceType<AccountId> implements Identifier {
    public AccountId(CharSequence value) {
        super(value);
    }

    public static AccountId of(CharSequence value) {
        return new AccountId(value);
    }

    public static AccountId random() {
        return new AccountId(UUID.randomUUID().toString());
    }
}
