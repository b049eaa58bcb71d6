package com.codeheadsystems.lockr.model.vault;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The secret part of a vault entry. This whole object is serialized to JSON and sealed; none of
 * it is stored in the clear.
 *
 * @param title    display title
 * @param username login name
 * @param email    email address
 * @param password the password
 * @param website  site URL
 * @param notes    free text
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record VaultEntryPayload(@JsonProperty("title") String title,
                                @JsonProperty("username") String username,
                                @JsonProperty("email") String email,
                                @JsonProperty("password") String password,
                                @JsonProperty("website") String website,
                                @JsonProperty("notes") String notes) {

  @Override
  public String toString() {
    return "VaultEntryPayload[title=" + title + ", password=<redacted>]";
  }
}
