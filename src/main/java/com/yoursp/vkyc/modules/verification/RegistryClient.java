package com.yoursp.vkyc.modules.verification;

import com.yoursp.vkyc.model.enums.DocumentType;
import com.yoursp.vkyc.model.enums.RegistryStatus;

import java.util.Map;

/**
 * External document-registry verification capability.
 */
public interface RegistryClient {

    /**
     * @return the registry's answer for the extracted fields
     * @throws com.yoursp.vkyc.modules.verification.exception.RegistryTransientException
     *         on timeouts and other failures worth retrying
     */
    RegistryStatus verify(Map<String, String> fields, DocumentType documentType);
}
