package com.codeheadsystems.lockr.server.error;

/**
 * Failure of a vault operation. The message is safe to return to the caller; it never contains
 * key material or plaintext.
 */
public class VaultException extends RuntimeException {

  private final VaultErrorCode code;

  /**
   * Instantiates a new vault exception.
   *
   * @param code    the code
   * @param message the message
   */
  public VaultException(VaultErrorCode code, String message) {
    super(message);
    this.code = code;
  }

  /**
   * Instantiates a new vault exception.
   *
   * @param code    the code
   * @param message the message
   * @param cause   the cause
   */
  public VaultException(VaultErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = code;
  }

  public static VaultException validation(String message) {
    return new VaultException(VaultErrorCode.VALIDATION_ERROR, message);
  }

  public static VaultException sessionRequired() {
    return new VaultException(VaultErrorCode.SESSION_REQUIRED, "Vault is locked; unlock it first");
  }

  public static VaultException notFound(String message) {
    return new VaultException(VaultErrorCode.NOT_FOUND, message);
  }

  public static VaultException busy() {
    return new VaultException(VaultErrorCode.VAULT_BUSY,
        "Another operation on this vault is in progress; try again shortly");
  }

  public static VaultException fatal(String message, Throwable cause) {
    return new VaultException(VaultErrorCode.FATAL, message, cause);
  }

  public VaultErrorCode code() {
    return code;
  }
}
