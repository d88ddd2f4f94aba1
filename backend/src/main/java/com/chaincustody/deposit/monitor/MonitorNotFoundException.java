package com.chaincustody.deposit.monitor;

public class MonitorNotFoundException extends RuntimeException {

    public MonitorNotFoundException(String chain, String address) {
        super("No monitor for " + chain + ":" + address);
    }
}
