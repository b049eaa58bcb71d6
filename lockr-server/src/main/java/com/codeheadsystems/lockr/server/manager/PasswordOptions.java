package com.codeheadsystems.lockr.server.manager;

/**
 * Resolved password generation options.
 *
 * @param length           password length
 * @param uppercase        include upper case letters
 * @param lowercase        include lower case letters
 * @param digits           include digits
 * @param symbols          include punctuation
 * @param excludeSimilar   drop look-alike characters
 * @param excludeAmbiguous drop brackets, quotes and similar punctuation
 */
public record PasswordOptions(int length,
                              boolean uppercase,
                              boolean lowercase,
                              boolean digits,
                              boolean symbols,
                              boolean excludeSimilar,
                              boolean excludeAmbiguous) {

  public static final int DEFAULT_LENGTH = 16;

  /**
   * Fills absent options with their defaults.
   *
   * @return resolved options
   */
  public static PasswordOptions withDefaults(Integer length,
                                             Boolean uppercase,
                                             Boolean lowercase,
                                             Boolean digits,
                                             Boolean symbols,
                                             Boolean excludeSimilar,
                                             Boolean excludeAmbiguous) {
    return new PasswordOptions(
        length == null ? DEFAULT_LENGTH : length,
        !Boolean.FALSE.equals(uppercase),
        !Boolean.FALSE.equals(lowercase),
        !Boolean.FALSE.equals(digits),
        Boolean.TRUE.equals(symbols),
        Boolean.TRUE.equals(excludeSimilar),
        Boolean.TRUE.equals(excludeAmbiguous));
  }

  public static PasswordOptions defaults() {
    return withDefaults(null, null, null, null, null, null, null);
  }
}
