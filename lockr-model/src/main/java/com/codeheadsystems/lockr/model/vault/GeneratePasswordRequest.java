package com.codeheadsystems.lockr.model.vault;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Options for a server-generated password. Absent fields take their defaults: length 16,
 * upper case, lower case and digits on, symbols and both exclusions off.
 * <p>
 * Used by: {@code POST /vault/generate-password}, and echoed back with defaults applied
 *
 * @param length           password length, 8 to 128
 * @param includeUppercase include {@code A-Z}
 * @param includeLowercase include {@code a-z}
 * @param includeNumbers   include {@code 0-9}
 * @param includeSymbols   include punctuation
 * @param excludeSimilar   leave out characters that are easy to misread, such as {@code l}, {@code 1} and {@code O}
 * @param excludeAmbiguous leave out brackets, quotes and other punctuation that is awkward to type
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GeneratePasswordRequest(@JsonProperty("length") Integer length,
                                      @JsonProperty("includeUppercase") Boolean includeUppercase,
                                      @JsonProperty("includeLowercase") Boolean includeLowercase,
                                      @JsonProperty("includeNumbers") Boolean includeNumbers,
                                      @JsonProperty("includeSymbols") Boolean includeSymbols,
                                      @JsonProperty("excludeSimilar") Boolean excludeSimilar,
                                      @JsonProperty("excludeAmbiguous") Boolean excludeAmbiguous) {
}
