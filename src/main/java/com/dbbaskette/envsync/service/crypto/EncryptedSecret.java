package com.dbbaskette.envsync.service.crypto;

/**
 * A base64 sealed value together with the id of the key it was sealed for.
 */
public record EncryptedSecret(String encryptedValue, String keyId) {}
