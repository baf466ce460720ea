package com.questrail.vault.protocol.model;

/**
 * Header names and reserved session tokens used by the vault protocol.
 */
public final class VaultHeaders
{
    public static final String METHOD = "Method";
    public static final String SESSION = "Session";
    public static final String CONTENT_TYPE = "Content-Type";
    public static final String CONTENT_LENGTH = "Content-Length";

    /** Session value meaning "no session" (create_user). */
    public static final String NO_SESSION = "-";

    /** Session value asking the server to open a new session (login_request). */
    public static final String NEW_SESSION = "*";

    private VaultHeaders() {}
}
