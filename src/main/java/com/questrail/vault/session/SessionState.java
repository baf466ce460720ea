package com.questrail.vault.session;

/**
 * Authentication state of a {@link VaultSession}.
 *
 * <pre>
 *   ANONYMOUS --login_request (challenge received)--> AWAITING_CHALLENGE
 *   AWAITING_CHALLENGE --login_test "Success"--> AUTHENTICATED
 *   AWAITING_CHALLENGE --anything else--> ANONYMOUS
 *   AUTHENTICATED --delete_user "Success" / logout--> ANONYMOUS
 * </pre>
 */
public enum SessionState
{
    ANONYMOUS,
    AWAITING_CHALLENGE,
    AUTHENTICATED
}
