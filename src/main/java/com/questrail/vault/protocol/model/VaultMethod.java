package com.questrail.vault.protocol.model;

/**
 * The fixed set of methods understood by the vault server.
 */
public enum VaultMethod
{
    CREATE_USER("create_user"),
    LOGIN_REQUEST("login_request"),
    LOGIN_TEST("login_test"),
    GET_SOURCES("get_sources"),
    GET_PASSWORD("get_password"),
    SET_PASSWORD("set_password"),
    DELETE_PASSWORD("delete_password"),
    DELETE_USER("delete_user");

    private final String wireName;

    VaultMethod(String wireName)
    {
        this.wireName = wireName;
    }

    /**
     * Value carried in the {@code Method} header.
     */
    public String wireName()
    {
        return wireName;
    }
}
