package com.questrail.vault.session;

import com.questrail.vault.api.VaultClientException;
import com.questrail.vault.api.VaultCryptoException;
import com.questrail.vault.crypto.RsaKeyManager;
import com.questrail.vault.protocol.client.VaultProtocolClient;
import com.questrail.vault.protocol.config.VaultClientConfig;
import com.questrail.vault.protocol.model.VaultContentType;
import com.questrail.vault.protocol.model.VaultHeaders;
import com.questrail.vault.protocol.model.VaultMessage;
import com.questrail.vault.protocol.model.VaultMethod;
import com.questrail.vault.protocol.observability.Slf4jVaultObservabilitySink;
import com.questrail.vault.protocol.observability.VaultObservabilitySink;
import com.questrail.vault.protocol.observability.VaultSessionTransitionEvent;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Base64;
import java.util.Objects;
import java.util.Optional;

/**
 * VaultSession
 * =============================================================================
 * One user's conversation with the vault server.
 *
 * <h2>Responsibilities</h2>
 * <ul>
 *   <li>Build the body, content type and session header of each operation</li>
 *   <li>Track the authentication state ({@link SessionState})</li>
 *   <li>Answer the login challenge with the user's private key</li>
 * </ul>
 *
 * <h2>Results</h2>
 * Every operation returns the server's response. A body other than
 * {@code "Success"} is a business failure and is returned, not raised; see
 * {@link VaultReplies}. Transport, framing and crypto failures are raised as
 * {@link VaultClientException}s.
 *
 * <h2>Names</h2>
 * User and source names must be ASCII; anything else is refused with
 * {@link IllegalArgumentException} before a request is sent. Passwords may
 * be any text; they are encrypted as UTF-8.
 *
 * <h2>Threading</h2>
 * Operations are serialized on this instance so that state and token stay
 * consistent. Use one session per user.
 */
public final class VaultSession implements AutoCloseable
{
    private final VaultProtocolClient client;
    private final RsaKeyManager keys;
    private final VaultObservabilitySink sink;

    private SessionState state = SessionState.ANONYMOUS;
    private String userName;
    private String pendingToken;
    private String activeToken;

    public VaultSession(VaultProtocolClient client, RsaKeyManager keys, VaultObservabilitySink sink)
    {
        this.client = Objects.requireNonNull(client, "client");
        this.keys = Objects.requireNonNull(keys, "keys");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    /**
     * Composition root: Netty transport, keys under
     * {@link VaultClientConfig#keysDirectory()}, logging through SLF4J.
     */
    public static VaultSession create(VaultClientConfig config)
    {
        VaultObservabilitySink sink = new Slf4jVaultObservabilitySink();
        return new VaultSession(VaultProtocolClient.create(config), new RsaKeyManager(config.keysDirectory()), sink);
    }

    public RsaKeyManager keys()
    {
        return keys;
    }

    public synchronized SessionState state()
    {
        return state;
    }

    /**
     * The token in use after a successful login.
     */
    public synchronized Optional<String> sessionToken()
    {
        return Optional.ofNullable(activeToken);
    }

    /**
     * The token issued by the last {@code login_request}, awaiting the challenge answer.
     */
    public synchronized Optional<String> pendingSessionToken()
    {
        return Optional.ofNullable(pendingToken);
    }

    public synchronized Optional<String> userName()
    {
        return Optional.ofNullable(userName);
    }

    // ---------------------------------------------------------------------
    // Anonymous operations
    // ---------------------------------------------------------------------

    /**
     * Register {@code userName} with the current public key.
     */
    public synchronized VaultMessage createUser(String userName)
    {
        requireAsciiName("userName", userName);
        byte[] body = VaultBodies.createUser(userName, keys.exportPublicKeyBase64());
        return client.exchange(VaultMethod.CREATE_USER, body, VaultHeaders.NO_SESSION, VaultContentType.JSON);
    }

    /**
     * Ask for a login challenge. A non-empty body is the challenge (the
     * server's random number encrypted with our public key) and the
     * {@code Session} header carries the token to answer with.
     */
    public synchronized VaultMessage loginRequest(String userName)
    {
        requireAsciiName("userName", userName);
        this.userName = userName;
        this.activeToken = null;
        this.pendingToken = null;

        VaultMessage response;
        try {
            response = client.exchange(VaultMethod.LOGIN_REQUEST, ascii(userName),
                    VaultHeaders.NEW_SESSION, VaultContentType.ASCII);
        }
        catch (VaultClientException e) {
            transition(SessionState.ANONYMOUS);
            throw e;
        }

        Optional<String> token = response.header(VaultHeaders.SESSION);
        if (response.hasBody() && token.isPresent()) {
            pendingToken = token.get();
            transition(SessionState.AWAITING_CHALLENGE);
        }
        else {
            transition(SessionState.ANONYMOUS);
        }
        return response;
    }

    /**
     * Answer a challenge: decrypt it with the private key and send the
     * plaintext back under {@code session}.
     *
     * @throws IllegalStateException if no challenge is outstanding
     * @throws VaultCryptoException  if the challenge cannot be decrypted; the
     *                               session returns to {@link SessionState#ANONYMOUS}
     */
    public synchronized VaultMessage loginTest(byte[] challenge, String session)
    {
        Objects.requireNonNull(challenge, "challenge");
        Objects.requireNonNull(session, "session");
        if (state != SessionState.AWAITING_CHALLENGE) {
            throw new IllegalStateException("No login challenge outstanding (state " + state + ")");
        }

        VaultMessage response;
        try {
            byte[] answer = keys.decrypt(challenge);
            response = client.exchange(VaultMethod.LOGIN_TEST, answer, session, VaultContentType.BYTES);
        }
        catch (VaultClientException e) {
            pendingToken = null;
            transition(SessionState.ANONYMOUS);
            throw e;
        }

        pendingToken = null;
        if (VaultReplies.isSuccess(response)) {
            activeToken = session;
            transition(SessionState.AUTHENTICATED);
        }
        else {
            transition(SessionState.ANONYMOUS);
        }
        return response;
    }

    /**
     * Both login steps.
     *
     * @return {@code true} if the session is now authenticated
     */
    public synchronized boolean login(String userName)
    {
        VaultMessage challenge = loginRequest(userName);
        if (state != SessionState.AWAITING_CHALLENGE) {
            return false;
        }
        loginTest(challenge.body(), pendingToken);
        return state == SessionState.AUTHENTICATED;
    }

    /**
     * Forget the token locally. The server is not told.
     */
    public synchronized void logout()
    {
        activeToken = null;
        pendingToken = null;
        transition(SessionState.ANONYMOUS);
    }

    // ---------------------------------------------------------------------
    // Authenticated operations
    // ---------------------------------------------------------------------

    /**
     * @return JSON array of source names on success, see {@link VaultReplies#sources}
     */
    public synchronized VaultMessage getSources()
    {
        return client.exchange(VaultMethod.GET_SOURCES, new byte[0], requireToken());
    }

    /**
     * @return the stored ciphertext on success, see {@link #decryptPassword}
     */
    public synchronized VaultMessage getPassword(String source)
    {
        requireAsciiName("source", source);
        return client.exchange(VaultMethod.GET_PASSWORD, ascii(source), requireToken(), VaultContentType.ASCII);
    }

    /**
     * Store {@code password} for {@code source}, encrypted with our public key.
     * The server only ever sees ciphertext.
     */
    public synchronized VaultMessage setPassword(String source, String password)
    {
        requireAsciiName("source", source);
        Objects.requireNonNull(password, "password");
        String token = requireToken();

        byte[] ciphertext = keys.encrypt(password.getBytes(StandardCharsets.UTF_8));
        byte[] body = VaultBodies.setPassword(source, Base64.getEncoder().encodeToString(ciphertext));
        return client.exchange(VaultMethod.SET_PASSWORD, body, token, VaultContentType.JSON);
    }

    public synchronized VaultMessage deletePassword(String source)
    {
        requireAsciiName("source", source);
        return client.exchange(VaultMethod.DELETE_PASSWORD, ascii(source), requireToken(), VaultContentType.ASCII);
    }

    /**
     * Delete the logged-in user. On success the session becomes anonymous.
     */
    public synchronized VaultMessage deleteUser()
    {
        VaultMessage response = client.exchange(VaultMethod.DELETE_USER, new byte[0], requireToken());
        if (VaultReplies.isSuccess(response)) {
            activeToken = null;
            transition(SessionState.ANONYMOUS);
        }
        return response;
    }

    /**
     * Decrypt a {@code get_password} body with the private key.
     */
    public String decryptPassword(byte[] ciphertext)
    {
        Objects.requireNonNull(ciphertext, "ciphertext");
        return new String(keys.decrypt(ciphertext), StandardCharsets.UTF_8);
    }

    @Override
    public void close()
    {
        client.close();
    }

    private String requireToken()
    {
        if (state != SessionState.AUTHENTICATED || activeToken == null) {
            throw new IllegalStateException("Not logged in (state " + state + ")");
        }
        return activeToken;
    }

    private void transition(SessionState next)
    {
        SessionState previous = state;
        state = next;
        if (previous != next) {
            sink.onSessionTransition(new VaultSessionTransitionEvent(Instant.now(), userName, previous, next));
        }
    }

    private static byte[] ascii(String text)
    {
        return text.getBytes(StandardCharsets.US_ASCII);
    }

    /**
     * User and source names travel as raw ASCII bodies in some requests and
     * inside JSON in others; both forms only agree for ASCII text.
     */
    private static void requireAsciiName(String what, String text)
    {
        Objects.requireNonNull(text, what);
        if (!StandardCharsets.US_ASCII.newEncoder().canEncode(text)) {
            throw new IllegalArgumentException(what + " must be ASCII: " + text);
        }
    }
}
