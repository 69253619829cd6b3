package com.sluice.model;

public enum ProxyClassification {
    UNTESTED,
    WORKING,
    FAILED
}
