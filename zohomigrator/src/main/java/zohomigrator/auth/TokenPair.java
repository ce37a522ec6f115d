package zohomigrator.auth;

import java.util.Objects;

/**
 * Access and refresh token for one backend.
 */
public record TokenPair(String accessToken, String refreshToken) {

    public TokenPair {
        Objects.requireNonNull(accessToken, "accessToken");
        Objects.requireNonNull(refreshToken, "refreshToken");
    }

    @Override
    public String toString() {
        return "TokenPair{***}";
    }
}
