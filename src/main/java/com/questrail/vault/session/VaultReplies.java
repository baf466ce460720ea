package com.questrail.vault.session;

import com.questrail.vault.protocol.model.VaultMessage;

import java.util.List;

/**
 * Helpers for callers interpreting server responses.
 *
 * <p>A response whose body is anything other than {@value #SUCCESS} is a
 * business-level failure. It is returned, not raised; its body is the
 * server's explanation.</p>
 */
public final class VaultReplies
{
    public static final String SUCCESS = "Success";

    private VaultReplies() {}

    public static boolean isSuccess(VaultMessage response)
    {
        return SUCCESS.equals(response.bodyAsAscii());
    }

    /**
     * Parse a {@code get_sources} response. An empty body (not logged in,
     * server error) yields an empty list.
     *
     * @throws IllegalArgumentException if a non-empty body is not a JSON array of strings
     */
    public static List<String> sources(VaultMessage response)
    {
        return VaultBodies.sources(response.body());
    }
}
