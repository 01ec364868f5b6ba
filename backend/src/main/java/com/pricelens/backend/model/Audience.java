package com.pricelens.backend.model;

public enum Audience {
    CUSTOMER,
    REGULATOR
}
