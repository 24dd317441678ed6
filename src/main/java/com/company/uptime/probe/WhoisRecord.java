package com.company.uptime.probe;

import lombok.Value;

import java.time.Instant;

@Value
public class WhoisRecord {
    Instant expiryDate;
    String registrar;
}
