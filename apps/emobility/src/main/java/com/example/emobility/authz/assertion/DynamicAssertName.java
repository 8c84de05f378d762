package com.example.emobility.authz.assertion;

public enum DynamicAssertName {
    POOL_CAR,
    OWN_USER
}
