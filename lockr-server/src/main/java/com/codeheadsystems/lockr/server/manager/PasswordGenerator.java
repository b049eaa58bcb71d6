package com.codeheadsystems.lockr.server.manager;

import com.codeheadsystems.lockr.server.error.VaultException;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Generates random passwords from {@link SecureRandom}.
 * <p>
 * Every selected character class appears at least once; the remaining positions draw from the
 * union of the selected classes and the result is shuffled. Nothing is stored or logged.
 */
public class PasswordGenerator {

  private static final Logger log = LoggerFactory.getLogger(PasswordGenerator.class);

  public static final int MIN_LENGTH = 8;
  public static final int MAX_LENGTH = 128;

  static final String UPPERCASE = "ABCDEFGHIJKLMNOPQRSTUVWXYZ";
  static final String LOWERCASE = "abcdefghijklmnopqrstuvwxyz";
  static final String DIGITS = "0123456789";
  static final String SYMBOLS = "!@#$%^&*()_+-=[]{};':\"\\|,.<>/?~";
  static final String SIMILAR = "il1Lo0O";
  static final String AMBIGUOUS = "{}[]()/\\'\"~,;.<>";

  private final SecureRandom random;

  public PasswordGenerator() {
    this(new SecureRandom());
  }

  public PasswordGenerator(SecureRandom random) {
    this.random = random;
  }

  /**
   * Generates one password.
   *
   * @param options resolved options
   * @return the password
   * @throws VaultException VALIDATION_ERROR if the length is out of range or no class is selected
   */
  public String generate(PasswordOptions options) {
    if (options.length() < MIN_LENGTH || options.length() > MAX_LENGTH) {
      throw VaultException.validation("Length must be between " + MIN_LENGTH + " and " + MAX_LENGTH);
    }
    List<String> pools = pools(options);
    if (pools.isEmpty()) {
      throw VaultException.validation("At least one character type must be selected");
    }
    log.debug("generate(length={}, classes={})", options.length(), pools.size());

    StringBuilder union = new StringBuilder();
    char[] password = new char[options.length()];
    for (int i = 0; i < pools.size(); i++) {
      String pool = pools.get(i);
      union.append(pool);
      password[i] = pick(pool);
    }
    String all = union.toString();
    for (int i = pools.size(); i < password.length; i++) {
      password[i] = pick(all);
    }
    for (int i = password.length - 1; i > 0; i--) {
      int j = random.nextInt(i + 1);
      char swap = password[i];
      password[i] = password[j];
      password[j] = swap;
    }
    return new String(password);
  }

  private List<String> pools(PasswordOptions options) {
    List<String> pools = new ArrayList<>(4);
    if (options.uppercase()) {
      pools.add(filter(UPPERCASE, options));
    }
    if (options.lowercase()) {
      pools.add(filter(LOWERCASE, options));
    }
    if (options.digits()) {
      pools.add(filter(DIGITS, options));
    }
    if (options.symbols()) {
      pools.add(filter(SYMBOLS, options));
    }
    return pools;
  }

  private static String filter(String pool, PasswordOptions options) {
    StringBuilder kept = new StringBuilder(pool.length());
    for (char c : pool.toCharArray()) {
      if (options.excludeSimilar() && SIMILAR.indexOf(c) >= 0) {
        continue;
      }
      if (options.excludeAmbiguous() && AMBIGUOUS.indexOf(c) >= 0) {
        continue;
      }
      kept.append(c);
    }
    return kept.toString();
  }

  private char pick(String pool) {
    return pool.charAt(random.nextInt(pool.length()));
  }
}
