package com.codeheadsystems.lockr.model.vault;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A freshly generated password. Nothing about it is stored.
 *
 * @param password the password
 * @param options  the options it was generated with, defaults filled in
 */
public record GeneratePasswordResponse(@JsonProperty("password") String password,
                                       @JsonProperty("options") GeneratePasswordRequest options) {

  @Override
  public String toString() {
    return "GeneratePasswordResponse[password=<redacted>, options=" + options + "]";
  }
}
