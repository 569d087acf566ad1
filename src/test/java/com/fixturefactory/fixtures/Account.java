package com.fixturefactory.fixtures;

import lombok.Getter;

/**
 * Immutable model built through its constructor only.
 */
@Getter
public class Account {
    private final String owner;
    private final long balance;

    public Account(String owner, long balance) {
        this.owner = owner;
        this.balance = balance;
    }
}
