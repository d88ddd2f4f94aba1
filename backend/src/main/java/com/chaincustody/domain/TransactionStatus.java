package com.chaincustody.domain;

public enum TransactionStatus {
    PENDING,
    CONFIRMED,
    FAILED
}
