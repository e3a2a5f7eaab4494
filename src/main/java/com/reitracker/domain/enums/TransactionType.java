package com.reitracker.domain.enums;

/** Direction of a ledger entry. Amounts are always stored positive. */
public enum TransactionType {
    INCOME,
    EXPENSE
}
