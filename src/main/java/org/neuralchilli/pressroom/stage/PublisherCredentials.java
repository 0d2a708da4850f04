package org.neuralchilli.pressroom.stage;

import javax.annotation.Nonnull;

/**
 * Platform credentials handed to the publisher. Both values may be null
 * when none are configured.
 */
public record PublisherCredentials(String appId, String appSecret) {

    public static PublisherCredentials none() {
        return new PublisherCredentials(null, null);
    }

    public boolean configured() {
        return appId != null && !appId.isBlank() && appSecret != null && !appSecret.isBlank();
    }

    @Nonnull
    @Override
    public String toString() {
        return "PublisherCredentials[appId=" + appId + ", appSecret=" + (appSecret != null ? "****" : null) + "]";
    }
}
