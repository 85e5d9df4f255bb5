package com.ridwan.slackexport.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SlackUser {

    @JsonProperty("id")
    private String id;

    @JsonProperty("name")
    private String name;

    @JsonProperty("real_name")
    private String realName;

    @JsonProperty("deleted")
    private boolean deleted;

    @JsonProperty("profile")
    private Profile profile;

    /** Display name as shown in the Slack client: display name, then real name, then handle. */
    public String displayName() {
        if (profile != null) {
            if (profile.getDisplayName() != null && !profile.getDisplayName().isBlank()) {
                return profile.getDisplayName();
            }
            if (profile.getRealName() != null && !profile.getRealName().isBlank()) {
                return profile.getRealName();
            }
        }
        if (realName != null && !realName.isBlank()) {
            return realName;
        }
        return name;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Profile {

        @JsonProperty("display_name")
        private String displayName;

        @JsonProperty("real_name")
        private String realName;
    }
}
