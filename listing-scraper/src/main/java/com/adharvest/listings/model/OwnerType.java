package com.adharvest.listings.model;

public enum OwnerType {
    ALL, PRIVATE, PRO
}
