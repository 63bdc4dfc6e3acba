package com.realdiscount.pipeline.model;

public enum RunStatus {
    SUCCESS,
    FAILED
}
