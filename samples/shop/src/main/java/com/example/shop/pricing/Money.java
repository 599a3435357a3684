package com.example.shop.pricing;

import info.isaksson.erland.recordnames.model.annotations.RecordName;
import info.isaksson.erland.recordnames.model.annotations.RecordNamespace;

@RecordName("Amount")
@RecordNamespace("com.example.finance")
public class Money {
    long cents;
    String currency;
}
