package com.frauddetection.hypersearch.domain;

public enum ParameterType {
    INT,
    FLOAT,
    BOOLEAN,
    CATEGORICAL
}
