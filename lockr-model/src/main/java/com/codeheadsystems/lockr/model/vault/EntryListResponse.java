package com.codeheadsystems.lockr.model.vault;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Every readable entry in the caller's vault.
 *
 * @param entries    decrypted entries, oldest first
 * @param unreadable count of entries that did not decrypt under the session key
 */
public record EntryListResponse(@JsonProperty("entries") List<EntryResponse> entries,
                                @JsonProperty("unreadable") int unreadable) {
}
