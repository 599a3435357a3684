package com.example.shop.pricing;
