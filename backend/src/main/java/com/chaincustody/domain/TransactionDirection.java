package com.chaincustody.domain;

public enum TransactionDirection {
    INCOMING,
    OUTGOING
}
