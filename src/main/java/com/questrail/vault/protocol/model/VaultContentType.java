package com.questrail.vault.protocol.model;

/**
 * Values carried in the {@code Content-Type} header of requests.
 */
public enum VaultContentType
{
    JSON("json"),
    ASCII("ascii"),
    BYTES("bytes");

    private final String wireName;

    VaultContentType(String wireName)
    {
        this.wireName = wireName;
    }

    public String wireName()
    {
        return wireName;
    }
}
