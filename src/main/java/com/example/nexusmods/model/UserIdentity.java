package com.example.nexusmods.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response of {@code GET users/validate.json}.
 * <p>
 * The API reports premium and supporter status twice, once under a
 * question-mark key and once under a plain key. Both values are kept as sent.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record UserIdentity(
        @JsonProperty("user_id") long userId,
        @JsonProperty("key") String key,
        @JsonProperty("name") String name,
        @JsonProperty("is_premium?") @JsonAlias("is_premium_q") boolean premiumQ,
        @JsonProperty("is_supporter?") @JsonAlias("is_supporter_q") boolean supporterQ,
        @JsonProperty("email") String email,
        @JsonProperty("profile_url") String profileUrl,
        @JsonProperty("is_premium") boolean premiumFlag,
        @JsonProperty("is_supporter") boolean supporterFlag) {

    /**
     * True only when both premium flags are set.
     */
    @JsonIgnore
    public boolean isPremium() {
        return premiumQ && premiumFlag;
    }

    /**
     * True only when both supporter flags are set.
     */
    @JsonIgnore
    public boolean isSupporter() {
        return supporterQ && supporterFlag;
    }

    @Override
    public String toString() {
        // the echoed API key never ends up in logs
        return "UserIdentity[userId=" + userId + ", name=" + name + ", email=" + email
                + ", profileUrl=" + profileUrl + ", premium=" + isPremium() + ", supporter=" + isSupporter() + "]";
    }
}
