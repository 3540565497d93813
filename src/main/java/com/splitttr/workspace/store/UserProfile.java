package com.splitttr.workspace.store;

import com.splitttr.workspace.model.UserInfo;

public record UserProfile(
    String id,
    String firstName,
    String lastName,
    String email,
    String profileImageUrl
) {
    public UserInfo toUserInfo() {
        return new UserInfo(firstName, lastName, email, profileImageUrl);
    }
}
