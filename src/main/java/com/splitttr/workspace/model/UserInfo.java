package com.splitttr.workspace.model;

/** Display metadata for a user, as returned by the identity lookup. */
public record UserInfo(
    String firstName,
    String lastName,
    String email,
    String profileImageUrl
) {
    public static UserInfo empty() {
        return new UserInfo(null, null, null, null);
    }
}
