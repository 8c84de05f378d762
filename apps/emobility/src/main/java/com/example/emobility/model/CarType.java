package com.example.emobility.model;

public enum CarType {
    PRIVATE,
    COMPANY,
    POOL_CAR
}
