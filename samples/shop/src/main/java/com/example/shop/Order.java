package com.example.shop;

import com.example.shop.pricing.Money;

import java.util.List;
import java.util.Map;

public class Order {

    public static class Line {
        String sku;
        int quantity;
    }

    List<Line> lines;
    Map<String, Money> totalsByCurrency;
    Result<Money, String> settled;

    public Money total() {
        record Subtotal(String currency, long cents) { }
        return new Money();
    }
}
