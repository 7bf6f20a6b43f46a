package com.adharvest.listings.model;

public enum AdType {
    OFFER, DEMAND
}
