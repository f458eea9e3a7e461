package com.dbbaskette.envsync.service.github;

/**
 * A scope's public sealing key as published by GitHub.
 *
 * @param keyId identifier that must accompany every value sealed with this key
 * @param key   base64 encoded 32-byte Curve25519 public key
 */
public record ScopePublicKey(String keyId, String key) {}
