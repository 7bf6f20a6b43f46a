package com.adharvest.listings.model;

/**
 * Transport settings handed through to the page fetcher untouched.
 */
public record ProxySettings(String host, Integer port, String username, String password) {

    public static ProxySettings none() {
        return new ProxySettings(null, null, null, null);
    }

    public boolean isConfigured() {
        return host != null && !host.isBlank();
    }

    @Override
    public String toString() {
        return isConfigured() ? "ProxySettings[" + host + ":" + port + "]" : "ProxySettings[none]";
    }
}
