package com.social.automation.integration;

public record PostResult(boolean success, String externalId) {

    public static PostResult failed() {
        return new PostResult(false, null);
    }
}
