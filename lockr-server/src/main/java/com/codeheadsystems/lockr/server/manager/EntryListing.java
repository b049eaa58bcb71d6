package com.codeheadsystems.lockr.server.manager;

import java.util.List;

/**
 * Readable entries plus a count of the ones that were not.
 *
 * @param entries    decrypted entries, oldest first
 * @param unreadable entries that failed authentication under the session key
 */
public record EntryListing(List<DecryptedEntry> entries, int unreadable) {
}
