package zohomigrator.config;

/**
 * OAuth client registration and the initial token pair for one backend.
 *
 * @param clientId OAuth client id
 * @param clientSecret OAuth client secret
 * @param accessToken last known access token, may be empty
 * @param refreshToken long-lived refresh token
 */
public record OAuthCredentials(String clientId, String clientSecret, String accessToken, String refreshToken) {

    public OAuthCredentials {
        accessToken = accessToken != null ? accessToken : "";
    }

    @Override
    public String toString() {
        return "OAuthCredentials{clientId=" + clientId + ", clientSecret=***, accessToken=***, refreshToken=***}";
    }
}
