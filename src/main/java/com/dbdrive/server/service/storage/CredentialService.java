package com.dbdrive.server.service.storage;

import com.dbdrive.server.exception.BusinessException;

public interface CredentialService {

    /**
     * @return an access token valid for at least a few more minutes
     */
    String validCredential() throws BusinessException;
}
