package com.ryuqq.kindstore.testkit.model;

import com.ryuqq.kindstore.core.model.Model;
import com.ryuqq.kindstore.core.model.ModelSchema;
import com.ryuqq.kindstore.core.property.IntegerProperty;

/**
 * 트랜잭션 테스트용 계좌 모델.
 *
 * @author Kindstore Team
 * @since 1.0.0
 */
public class BankAccount extends Model {

    public static final IntegerProperty BALANCE = IntegerProperty.builder("balance").defaultValue(0L).build();

    public static final ModelSchema<BankAccount> SCHEMA = ModelSchema.builder(BankAccount.class, BankAccount::new)
        .property(BALANCE)
        .register();

    public static BankAccount withBalance(long balance) {
        BankAccount account = new BankAccount();
        account.set(BALANCE, balance);
        return account;
    }

    public long getBalance() {
        return get(BALANCE);
    }

    public BankAccount deposit(long amount) {
        set(BALANCE, getBalance() + amount);
        return this;
    }
}
