package com.dbbaskette.envsync.service.conflict;

import java.util.List;
import java.util.Map;

/**
 * A name whose recorded hashes disagree.
 *
 * @param valueHashes scope label to the first 8 hex chars of the recorded hash
 */
public record ConflictEntry(String secretName, List<String> scopes, Map<String, String> valueHashes) {}
