package com.last9.mcpserver.session;

/**
 * Tenant metrics datasource selected at session setup.
 */
public record Datasource(String name, String readUrl, String region, String username, String password) {

    @Override
    public String toString() {
        return "Datasource{name=" + name + ", readUrl=" + readUrl + ", region=" + region + "}";
    }
}
