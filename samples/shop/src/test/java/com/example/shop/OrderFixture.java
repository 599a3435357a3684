package com.example.shop;

public class OrderFixture { }
