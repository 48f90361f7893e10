package com.fieldservice.shared.enums;

public enum TradeType {
    FLOORING,
    HVAC,
    PLUMBING,
    ELECTRICAL,
    OTHER
}
