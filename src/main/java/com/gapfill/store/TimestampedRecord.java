package com.gapfill.store;

public interface TimestampedRecord {

    String getSymbol();

    long getEpochMs();
}
