package com.baykanat.socialsync.client;

import com.baykanat.socialsync.domain.model.AccountCredentials;

import java.util.Optional;

/** Hesap token çözümleyici. Şifreleme ve OAuth akışları adaptörde kalır. */
public interface CredentialStore {

    Optional<AccountCredentials> resolveAccountCredentials(String accountId);

    /** Önbellekteki credential'ı düşürür (auth hatasından sonra). */
    void invalidate(String accountId);
}
