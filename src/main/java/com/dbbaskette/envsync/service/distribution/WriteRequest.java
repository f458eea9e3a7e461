package com.dbbaskette.envsync.service.distribution;

import com.dbbaskette.envsync.model.SecretScope;
import com.dbbaskette.envsync.service.github.RepoRef;

/**
 * One secret destined for one scope.
 *
 * @param remoteName  name written to the scope (environment suffix stripped)
 * @param mappingName name the mapping is tracked under (as supplied)
 */
public record WriteRequest(RepoRef repo, SecretScope scope, String remoteName, String mappingName,
                           String value, boolean excluded, boolean force, boolean dryRun) {

    @Override
    public String toString() {
        return "WriteRequest[" + repo.fullName() + " " + scope + " " + remoteName + "]";
    }
}
