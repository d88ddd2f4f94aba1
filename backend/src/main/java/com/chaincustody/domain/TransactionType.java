package com.chaincustody.domain;

public enum TransactionType {
    DEPOSIT,
    WITHDRAW
}
