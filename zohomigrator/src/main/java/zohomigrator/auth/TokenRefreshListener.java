package zohomigrator.auth;

/**
 * Callback invoked after a token pair has been refreshed.
 *
 * <p>The token manager keeps tokens in memory only; persisting them is the
 * listener's job.
 */
@FunctionalInterface
public interface TokenRefreshListener {

    void tokensRefreshed(Backend backend, TokenPair tokens);
}
